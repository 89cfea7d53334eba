package io.hhplus.circulation.infrastructure.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Redisson RLock 기반 락
 *
 * - tryLock() 대기 중에는 Redis Pub/Sub으로 해제 알림을 받는다. (Spin Lock보다 효율적)
 * - leaseTime이 지나면 Redis가 락을 자동 해제한다. (프로세스 장애 시 데드락 방지)
 */
@Slf4j
@Component
@Profile("!test")
@RequiredArgsConstructor
public class RedissonLockManager implements LockManager {

    private final RedissonClient redissonClient;

    @Override
    public AcquiredLock tryAcquire(String key, Duration waitTime, Duration leaseTime) throws InterruptedException {
        RLock lock = redissonClient.getLock(key);
        boolean locked = lock.tryLock(waitTime.toMillis(), leaseTime.toMillis(), TimeUnit.MILLISECONDS);
        if (!locked) {
            return null;
        }
        return new AcquiredLock() {
            @Override
            public String key() {
                return key;
            }

            @Override
            public void close() {
                // leaseTime 만료로 이미 풀렸다면 다른 요청이 보유 중일 수 있다
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                } else {
                    log.warn("락이 이미 해제됨 (leaseTime 초과 가능성): key={}", key);
                }
            }
        };
    }
}
