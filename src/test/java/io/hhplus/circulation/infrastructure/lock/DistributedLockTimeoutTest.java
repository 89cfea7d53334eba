package io.hhplus.circulation.infrastructure.lock;

import io.hhplus.circulation.application.common.Actor;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.application.loan.dto.CheckoutRequest;
import io.hhplus.circulation.application.loan.dto.LoanResponse;
import io.hhplus.circulation.application.usecase.loan.CheckoutUseCase;
import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.common.exception.ErrorType;
import io.hhplus.circulation.config.CirculationProperties;
import io.hhplus.circulation.domain.copy.Copy;
import io.hhplus.circulation.domain.copy.CopyRepository;
import io.hhplus.circulation.domain.copy.CopyStatus;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecordRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * 락 대기 시간 초과 테스트
 * <p>
 * 다른 스레드가 소장본 락을 쥐고 있는 동안 짧은 마감 시각으로 대출하면
 * Conflict가 아니라 LOCK_WAIT_TIMEOUT(TIMEOUT)으로 끝나고, 같은 키로 다시 시도할 수 있어야 한다.
 */
@SpringBootTest
@ActiveProfiles("test")
class DistributedLockTimeoutTest {

    @Autowired
    private CheckoutUseCase checkoutUseCase;

    @Autowired
    private LockManager lockManager;

    @Autowired
    private CirculationProperties properties;

    @Autowired
    private CopyRepository copyRepository;

    @Autowired
    private IdempotencyRecordRepository idempotencyRecordRepository;

    private final ExecutorService holder = Executors.newSingleThreadExecutor();
    private final CountDownLatch held = new CountDownLatch(1);
    private final CountDownLatch releaseSignal = new CountDownLatch(1);

    private String copyId;
    private String userId;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        copyId = "LT-" + suffix;
        userId = "LTU-" + suffix;
        copyRepository.save(Copy.register(copyId, "B-300"));
    }

    @AfterEach
    void tearDown() {
        releaseSignal.countDown();
        holder.shutdown();
    }

    /**
     * 락 해제는 획득한 스레드에서 해야 하므로 별도 스레드가 쥐고 있다가 신호를 받으면 놓는다.
     */
    private Future<?> holdCopyLock() throws InterruptedException {
        String lockKey = properties.getLock().getKeyPrefix() + "copy:" + copyId;
        Future<?> task = holder.submit(() -> {
            LockManager.AcquiredLock lock = lockManager.tryAcquire(lockKey, Duration.ofSeconds(1), Duration.ofSeconds(30));
            try {
                held.countDown();
                releaseSignal.await(30, TimeUnit.SECONDS);
            } finally {
                if (lock != null) {
                    lock.close();
                }
            }
            return null;
        });
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();
        return task;
    }

    @Test
    @DisplayName("락 보유 중 짧은 마감 시각 - LOCK_WAIT_TIMEOUT, 설정 대기 시간보다 일찍 반환")
    void 락대기_마감시각_초과() throws Exception {
        // Given
        Future<?> holding = holdCopyLock();
        String idempotencyKey = "K-" + copyId;
        CallContext shortDeadline = new CallContext(Actor.member(userId), null, Deadline.after(Duration.ofMillis(300)));

        // When
        long startNanos = System.nanoTime();
        Throwable thrown = catchThrowable(() ->
            checkoutUseCase.execute(new CheckoutRequest(copyId, userId, idempotencyKey), shortDeadline));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        // Then
        assertThat(thrown).isInstanceOf(BusinessException.class);
        BusinessException timeout = (BusinessException) thrown;
        assertThat(timeout.getErrorCode()).isEqualTo(ErrorCode.LOCK_WAIT_TIMEOUT);
        assertThat(timeout.getErrorCode().getType()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(elapsed).isLessThan(properties.getLock().getWaitTime());

        assertThat(copyRepository.findByIdOrThrow(copyId).getStatus()).isEqualTo(CopyStatus.AVAILABLE);
        assertThat(idempotencyRecordRepository.findByIdempotencyKey(idempotencyKey)).isEmpty();

        // 락이 풀리면 같은 키로 재시도 가능
        releaseSignal.countDown();
        holding.get(5, TimeUnit.SECONDS);

        LoanResponse loan = checkoutUseCase.execute(
            new CheckoutRequest(copyId, userId, idempotencyKey),
            new CallContext(Actor.member(userId), null, Deadline.after(Duration.ofSeconds(5))));
        assertThat(loan.copyId()).isEqualTo(copyId);
        assertThat(copyRepository.findByIdOrThrow(copyId).getStatus()).isEqualTo(CopyStatus.LOANED);
    }
}
