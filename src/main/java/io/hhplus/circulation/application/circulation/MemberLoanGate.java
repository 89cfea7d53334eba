package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.infrastructure.lock.DistributedLock;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 회원 단위 대출 직렬화
 * <p>
 * 대출 한도 확인과 대출 생성을 같은 회원 락 안에서 수행해
 * 한 회원이 서로 다른 소장본을 동시에 대출해도 한도를 넘지 않게 한다.
 * 소장본 락(AllocationEngine)은 이 락 안쪽에서 잡힌다.
 */
@Component
public class MemberLoanGate {

    @DistributedLock(key = "'member:' + #userId")
    public <T> T withMemberLock(String userId, Deadline deadline, Supplier<T> action) {
        return action.get();
    }
}
