package io.hhplus.circulation.infrastructure.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 키별 로컬 락 매니저 (단일 JVM)
 *
 * 공정(fair) ReentrantLock으로 같은 소장본에 대한 전이를 도착 순서대로 직렬화한다.
 * leaseTime은 지원하지 않는다. (스레드가 살아있는 한 finally에서 반드시 해제)
 *
 * 락을 보유하거나 기다리는 스레드 수를 세어, 0이 되면 맵에서 제거한다.
 * 카운트 증감은 compute 안에서만 하므로 제거된 락 객체를 새 요청이 잡는 일은 없다.
 */
@Slf4j
@Component
@Profile("test")
public class LocalLockManager implements LockManager {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    @Override
    public AcquiredLock tryAcquire(String key, Duration waitTime, Duration leaseTime) throws InterruptedException {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry target = existing == null ? new LockEntry() : existing;
            target.users++;
            return target;
        });

        boolean locked = false;
        try {
            locked = entry.lock.tryLock(waitTime.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            if (!locked) {
                leave(key, entry);
            }
        }
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
                entry.lock.unlock();
                leave(key, entry);
            }
        };
    }

    private void leave(String key, LockEntry entry) {
        locks.computeIfPresent(key, (k, current) -> {
            if (current != entry) {
                return current;
            }
            current.users--;
            return current.users == 0 ? null : current;
        });
    }

    int size() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
