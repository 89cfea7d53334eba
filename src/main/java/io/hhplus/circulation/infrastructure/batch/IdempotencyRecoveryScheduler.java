package io.hhplus.circulation.infrastructure.batch;

import io.hhplus.circulation.application.audit.AuditEmitter;
import io.hhplus.circulation.application.audit.AuditPayloadCodec;
import io.hhplus.circulation.application.idempotency.IdempotencyCoordinator;
import io.hhplus.circulation.config.CirculationProperties;
import io.hhplus.circulation.domain.audit.AuditEntry;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecord;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 멱등성 레코드 복구 스윕
 * <p>
 * stale-after 이상 IN_FLIGHT로 남은 레코드를 정리한다.
 * - 결과가 첨부됨: 전이는 커밋되었으나 이후 단계가 중단된 경우 → 남은 감사 항목 기록 후 COMPLETED
 * - 결과 없음: 전이가 커밋되지 않은 경우 → 삭제 (같은 키로 재실행 가능)
 * 보존 기간이 지난 레코드도 함께 삭제한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyRecoveryScheduler {

    private final IdempotencyRecordRepository recordRepository;
    private final IdempotencyCoordinator idempotencyCoordinator;
    private final AuditEmitter auditEmitter;
    private final AuditPayloadCodec auditPayloadCodec;
    private final CirculationProperties properties;

    @Scheduled(fixedRateString = "${circulation.idempotency.sweep-rate:60000}")
    public void sweep() {
        try {
            SweepResult result = sweep(LocalDateTime.now());
            if (result.total() > 0) {
                log.info("멱등성 레코드 스윕 완료: {}", result);
            }
        } catch (Exception e) {
            log.error("멱등성 레코드 스윕 실패", e);
        }
    }

    public SweepResult sweep(LocalDateTime now) {
        LocalDateTime cutoff = now.minus(properties.getIdempotency().getStaleAfter());
        List<IdempotencyRecord> stale = recordRepository.findStaleInFlight(
            cutoff,
            properties.getIdempotency().getSweepBatchSize()
        );

        int completed = 0;
        int released = 0;
        for (IdempotencyRecord record : stale) {
            try {
                if (record.hasOutcome()) {
                    if (finish(record)) {
                        completed++;
                    }
                } else if (recordRepository.deleteStaleWithoutOutcome(record.getId(), cutoff) > 0) {
                    log.warn("미완료 요청 해제: key={}, createdAt={}", record.getIdempotencyKey(), record.getCreatedAt());
                    released++;
                }
            } catch (Exception e) {
                log.error("멱등성 레코드 복구 실패: key={}, recordId={}", record.getIdempotencyKey(), record.getId(), e);
            }
        }

        int purged = recordRepository.deleteExpired(now);
        return new SweepResult(completed, released, purged);
    }

    private boolean finish(IdempotencyRecord record) {
        List<AuditEntry> pending = auditPayloadCodec.read(record.getPendingAudit());
        String correlationId = pending.isEmpty() ? record.getIdempotencyKey() : pending.get(0).correlationId();

        // eventId가 미리 정해져 있으므로 이미 기록된 항목은 중복 기록되지 않는다
        auditEmitter.emit(pending, correlationId);
        boolean done = idempotencyCoordinator.complete(record.getId());
        if (done) {
            log.info("중단된 요청 완료 처리: key={}, operation={}, auditEntries={}",
                record.getIdempotencyKey(), record.getOperationType(), pending.size());
        }
        return done;
    }

    public record SweepResult(int completed, int released, int purged) {
        public int total() {
            return completed + released + purged;
        }
    }
}
