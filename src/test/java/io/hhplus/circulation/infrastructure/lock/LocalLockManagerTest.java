package io.hhplus.circulation.infrastructure.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LocalLockManagerTest {

    private final LocalLockManager lockManager = new LocalLockManager();

    @Test
    @DisplayName("같은 키 - 보유 중이면 다른 스레드는 대기 시간 후 실패")
    void 같은키_상호배제() throws Exception {
        // Given
        LockManager.AcquiredLock held = lockManager.tryAcquire("copy:C7", Duration.ofMillis(100), Duration.ofSeconds(1));
        assertThat(held).isNotNull();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            // When
            Future<LockManager.AcquiredLock> other = executor.submit(() ->
                lockManager.tryAcquire("copy:C7", Duration.ofMillis(100), Duration.ofSeconds(1)));

            // Then
            assertThat(other.get(2, TimeUnit.SECONDS)).isNull();
        } finally {
            held.close();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("해제 후 대기 중인 스레드가 락 획득")
    void 해제후_획득() throws Exception {
        // Given
        LockManager.AcquiredLock held = lockManager.tryAcquire("copy:C7", Duration.ofMillis(100), Duration.ofSeconds(1));
        CountDownLatch waiting = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<String> other = executor.submit(() -> {
                waiting.countDown();
                LockManager.AcquiredLock acquired = lockManager.tryAcquire("copy:C7", Duration.ofSeconds(2), Duration.ofSeconds(1));
                try {
                    return acquired == null ? null : acquired.key();
                } finally {
                    if (acquired != null) {
                        acquired.close();
                    }
                }
            });

            // When
            waiting.await();
            Thread.sleep(50);
            held.close();

            // Then
            assertThat(other.get(3, TimeUnit.SECONDS)).isEqualTo("copy:C7");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("다른 키 - 서로 막지 않음")
    void 다른키_독립() throws Exception {
        LockManager.AcquiredLock c7 = lockManager.tryAcquire("copy:C7", Duration.ofMillis(100), Duration.ofSeconds(1));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> c8 = executor.submit(() -> {
                LockManager.AcquiredLock acquired = lockManager.tryAcquire("copy:C8", Duration.ofMillis(100), Duration.ofSeconds(1));
                if (acquired == null) {
                    return false;
                }
                acquired.close();
                return true;
            });

            assertThat(c8.get(2, TimeUnit.SECONDS)).isTrue();
            assertThat(lockManager.size()).isEqualTo(1);
        } finally {
            c7.close();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("보유/대기 스레드가 모두 빠지면 키가 맵에서 제거된다")
    void 유휴락_제거() throws Exception {
        // Given
        LockManager.AcquiredLock held = lockManager.tryAcquire("copy:C9", Duration.ofMillis(100), Duration.ofSeconds(1));
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            // When: 대기하다 실패한 스레드는 카운트만 되돌린다
            Future<LockManager.AcquiredLock> timedOut = executor.submit(() ->
                lockManager.tryAcquire("copy:C9", Duration.ofMillis(50), Duration.ofSeconds(1)));
            assertThat(timedOut.get(2, TimeUnit.SECONDS)).isNull();
            assertThat(lockManager.size()).isEqualTo(1);

            held.close();

            // Then
            assertThat(lockManager.size()).isZero();

            LockManager.AcquiredLock again = lockManager.tryAcquire("copy:C9", Duration.ofMillis(100), Duration.ofSeconds(1));
            assertThat(again).isNotNull();
            again.close();
            assertThat(lockManager.size()).isZero();
        } finally {
            executor.shutdown();
        }
    }
}
