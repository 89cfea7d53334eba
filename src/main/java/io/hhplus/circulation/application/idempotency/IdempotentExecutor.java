package io.hhplus.circulation.application.idempotency;

import io.hhplus.circulation.application.audit.AuditEmitter;
import io.hhplus.circulation.application.circulation.TransitionOutcome;
import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.config.CirculationProperties;
import io.hhplus.circulation.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

/**
 * 멱등성 키로 보호되는 쓰기 요청 실행기
 * <p>
 * 흐름: begin → (NEW) 엔진 전이(트랜잭션, 결과 첨부) → 감사 기록 → complete
 * <pre>
 * NEW                  : 전이 실행. 실패 시 release 후 예외 전파 (결과는 캐싱하지 않음)
 * DUPLICATE_IN_FLIGHT  : 마감 시각까지 poll-interval 간격으로 재확인, 초과 시 Timeout
 * DUPLICATE_COMPLETED  : 저장된 결과 반환 (비즈니스 로직 재실행 없음)
 * KEY_REUSE_MISMATCH   : Conflict
 * </pre>
 * 전이 커밋 이후 단계(감사 기록, complete)가 실패해도 응답은 성공으로 반환한다.
 * 남은 단계는 IdempotencyRecoveryScheduler가 이어서 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotentExecutor {

    private final IdempotencyCoordinator coordinator;
    private final AuditEmitter auditEmitter;
    private final MetricsCollector metricsCollector;
    private final CirculationProperties properties;

    public <T> T execute(IdempotentRequest request,
                         Class<T> resultType,
                         Function<IdempotencyTicket, TransitionOutcome<T>> transition) {
        String operation = request.operationType().name().toLowerCase(Locale.ROOT);
        long startNanos = System.nanoTime();
        try {
            T result = resolve(request, resultType, transition);
            metricsCollector.recordTransition(operation, "success");
            return result;
        } catch (BusinessException e) {
            metricsCollector.recordTransition(operation, e.getType().name().toLowerCase(Locale.ROOT));
            throw e;
        } catch (RuntimeException e) {
            metricsCollector.recordTransition(operation, "internal");
            throw e;
        } finally {
            metricsCollector.recordTransitionDuration(operation, startNanos);
        }
    }

    private <T> T resolve(IdempotentRequest request,
                          Class<T> resultType,
                          Function<IdempotencyTicket, TransitionOutcome<T>> transition) {
        IdempotencyDecision decision = coordinator.begin(request);
        boolean waited = false;

        while (decision.is(IdempotencyDecision.Outcome.DUPLICATE_IN_FLIGHT)) {
            waited = true;
            awaitNextPoll(request);
            decision = coordinator.poll(request);
        }

        switch (decision.outcome()) {
            case KEY_REUSE_MISMATCH -> {
                metricsCollector.recordIdempotency("mismatch");
                log.warn("멱등성 키 재사용 감지: key={}, operation={}", request.idempotencyKey(), request.operationType());
                throw new BusinessException(
                    ErrorCode.IDEMPOTENCY_KEY_MISMATCH,
                    "다른 요청에 이미 사용된 멱등성 키입니다: " + request.idempotencyKey()
                );
            }
            case DUPLICATE_COMPLETED -> {
                metricsCollector.recordIdempotency(waited ? "waited" : "replayed");
                log.info("저장된 결과 반환: key={}, operation={}", request.idempotencyKey(), request.operationType());
                return coordinator.readResult(decision.payload(), resultType);
            }
            default -> {
                metricsCollector.recordIdempotency("new");
                return runTransition(request, decision.recordId(), transition);
            }
        }
    }

    private <T> T runTransition(IdempotentRequest request,
                                Long recordId,
                                Function<IdempotencyTicket, TransitionOutcome<T>> transition) {
        IdempotencyTicket ticket = new IdempotencyTicket(recordId, request.idempotencyKey(), request.correlationId());

        TransitionOutcome<T> outcome;
        try {
            outcome = transition.apply(ticket);
        } catch (RuntimeException e) {
            releaseQuietly(recordId, e);
            throw e;
        }

        // 이 시점에서 전이는 커밋됨
        auditEmitter.emit(outcome.auditEntries(), request.correlationId());

        try {
            coordinator.complete(recordId);
        } catch (RuntimeException e) {
            log.error("멱등성 레코드 완료 처리 실패 (복구 스윕이 완료 예정): key={}, recordId={}",
                request.idempotencyKey(), recordId, e);
        }
        return outcome.result();
    }

    private void awaitNextPoll(IdempotentRequest request) {
        Deadline deadline = request.deadline();
        if (deadline.isExpired()) {
            metricsCollector.recordIdempotency("timeout");
            log.warn("처리 중인 동일 요청 대기 시간 초과: key={}", request.idempotencyKey());
            throw new BusinessException(ErrorCode.IDEMPOTENCY_WAIT_TIMEOUT);
        }
        Duration sleep = deadline.cap(properties.getIdempotency().getPollInterval());
        try {
            Thread.sleep(Math.max(1L, sleep.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.IDEMPOTENCY_WAIT_TIMEOUT, "대기 중 인터럽트 발생: " + request.idempotencyKey());
        }
    }

    private void releaseQuietly(Long recordId, RuntimeException cause) {
        try {
            coordinator.release(recordId);
        } catch (RuntimeException releaseError) {
            // 해제 실패 시 IN_FLIGHT가 남지만 stale-after 이후 복구 스윕이 삭제한다
            log.error("멱등성 레코드 해제 실패: recordId={}", recordId, releaseError);
            cause.addSuppressed(releaseError);
        }
    }
}
