package io.hhplus.circulation.infrastructure.lock;

import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.config.CirculationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.time.Duration;

/**
 * 분산락 AOP
 *
 * 동작 흐름:
 * 1. SpEL 표현식으로 락 키 생성 (prefix + 평가 결과)
 * 2. 대기 시간 결정: min(설정값, 인자로 받은 Deadline의 남은 시간)
 * 3. LockManager로 락 획득 시도, 실패 시 LOCK_WAIT_TIMEOUT (같은 멱등성 키로 재시도 가능)
 * 4. 비즈니스 로직 실행 (트랜잭션은 이 안쪽에서 시작/커밋)
 * 5. 락 해제
 *
 * HIGHEST_PRECEDENCE + 1: @Transactional보다 바깥에서 감싸 커밋 이후에 락이 풀리도록 한다.
 * (HIGHEST_PRECEDENCE는 ExposeInvocationInterceptor 자리)
 */
@Slf4j
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
@RequiredArgsConstructor
public class DistributedLockAspect {

    private final LockManager lockManager;
    private final CirculationProperties properties;
    private final ExpressionParser parser = new SpelExpressionParser();

    @Around("@annotation(io.hhplus.circulation.infrastructure.lock.DistributedLock)")
    public Object lock(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        DistributedLock distributedLock = method.getAnnotation(DistributedLock.class);
        Object[] args = joinPoint.getArgs();

        String lockKey = properties.getLock().getKeyPrefix()
            + parseLockKey(distributedLock.key(), signature, args);
        Duration waitTime = resolveWaitTime(distributedLock, args);
        Duration leaseTime = distributedLock.leaseTime() < 0
            ? properties.getLock().getLeaseTime()
            : Duration.ofMillis(distributedLock.timeUnit().toMillis(distributedLock.leaseTime()));

        LockManager.AcquiredLock acquired = acquire(lockKey, waitTime, leaseTime);
        if (acquired == null) {
            log.warn("락 획득 실패: key={}, waitTime={}ms", lockKey, waitTime.toMillis());
            throw new BusinessException(
                ErrorCode.LOCK_WAIT_TIMEOUT,
                "같은 소장본 또는 회원에 대한 다른 요청이 처리 중입니다. 같은 멱등성 키로 다시 시도해주세요. (lockKey: " + lockKey + ")"
            );
        }

        log.debug("락 획득: key={}, leaseTime={}ms", lockKey, leaseTime.toMillis());
        try (acquired) {
            return joinPoint.proceed();
        } finally {
            log.debug("락 해제: key={}", lockKey);
        }
    }

    private LockManager.AcquiredLock acquire(String lockKey, Duration waitTime, Duration leaseTime) {
        try {
            return lockManager.tryAcquire(lockKey, waitTime, leaseTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.LOCK_WAIT_TIMEOUT, "락 대기 중 인터럽트 발생: " + lockKey);
        }
    }

    private Duration resolveWaitTime(DistributedLock distributedLock, Object[] args) {
        Duration configured = distributedLock.waitTime() < 0
            ? properties.getLock().getWaitTime()
            : Duration.ofMillis(distributedLock.timeUnit().toMillis(distributedLock.waitTime()));

        for (Object arg : args) {
            if (arg instanceof Deadline deadline) {
                return deadline.cap(configured);
            }
        }
        return configured;
    }

    private String parseLockKey(String keyExpression, MethodSignature signature, Object[] args) {
        StandardEvaluationContext context = new StandardEvaluationContext();

        String[] parameterNames = signature.getParameterNames();
        for (int i = 0; i < parameterNames.length; i++) {
            context.setVariable(parameterNames[i], args[i]);
        }

        return parser.parseExpression(keyExpression).getValue(context, String.class);
    }
}
