package io.hhplus.circulation.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * 분산락 어노테이션
 *
 * 소장본 단위로 상태 전이를 직렬화한다. (같은 소장본 전이는 선형화, 다른 소장본은 병렬)
 * 대출은 회원 단위 락을 먼저 잡고 소장본 락을 잡는다. (항상 회원 → 소장본 순서)
 *
 * 사용 예시:
 * <pre>
 * {@code
 * @DistributedLock(key = "'copy:' + #command.copyId()")
 * @Transactional
 * public TransitionOutcome<LoanResponse> checkout(CheckoutCommand command, IdempotencyTicket ticket, Deadline deadline) { ... }
 * }
 * </pre>
 *
 * 주의사항:
 * - 락 → 트랜잭션 → 커밋 → 락 해제 순서를 위해 Aspect가 트랜잭션보다 먼저 적용된다.
 * - 메서드 인자에 Deadline이 있으면 대기 시간은 min(waitTime, 남은 시간)으로 줄어든다.
 * - 락 획득 실패 시 BusinessException(LOCK_WAIT_TIMEOUT)이 발생한다.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * 락 키 (SpEL). circulation.lock.key-prefix가 앞에 붙는다.
     * 예: "'copy:' + #command.copyId()" → "circulation:copy:C7"
     */
    String key();

    /**
     * 락 대기 시간. 음수면 circulation.lock.wait-time 사용
     */
    long waitTime() default -1L;

    /**
     * 락 임대 시간. 음수면 circulation.lock.lease-time 사용
     *
     * 트랜잭션 실행 시간보다 충분히 길어야 한다.
     */
    long leaseTime() default -1L;

    TimeUnit timeUnit() default TimeUnit.MILLISECONDS;
}
