package io.hhplus.circulation.infrastructure.lock;

import java.time.Duration;

/**
 * 키 단위 상호 배제
 * <p>
 * - RedissonLockManager: Redis 분산 락 (기본 프로필, 다중 인스턴스)
 * - LocalLockManager: JVM 내부 공정 락 (test 프로필)
 */
public interface LockManager {

    /**
     * @return 획득한 락. waitTime 안에 획득하지 못하면 null
     */
    AcquiredLock tryAcquire(String key, Duration waitTime, Duration leaseTime) throws InterruptedException;

    interface AcquiredLock extends AutoCloseable {

        String key();

        @Override
        void close();
    }
}
