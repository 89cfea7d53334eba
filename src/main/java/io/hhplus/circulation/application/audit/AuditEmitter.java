package io.hhplus.circulation.application.audit;

import io.hhplus.circulation.domain.audit.AuditEntry;
import io.hhplus.circulation.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 감사 로그 기록기 (Audit Emitter)
 * <p>
 * 커밋된 전이의 감사 항목을 기록한다. 실패해도 예외를 던지지 않는다. (best effort)
 * - DB 일시 장애: @Retryable로 max-attempts까지 재시도
 * - 최종 실패: @Recover에서 AuditGap으로 남기고 메트릭 증가 (전이는 그대로 유효)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditEmitter {

    private final AuditEventWriter auditEventWriter;
    private final AuditGapRecorder auditGapRecorder;
    private final MetricsCollector metricsCollector;

    @Retryable(
        retryFor = DataAccessException.class,
        maxAttemptsExpression = "${circulation.audit.max-attempts:3}",
        backoff = @Backoff(delay = 100, multiplier = 2)
    )
    public void emit(List<AuditEntry> entries, String correlationId) {
        if (entries.isEmpty()) {
            return;
        }
        int appended = auditEventWriter.appendAll(entries);
        log.debug("감사 이벤트 기록: correlationId={}, appended={}/{}", correlationId, appended, entries.size());
    }

    @Recover
    public void recover(RuntimeException e, List<AuditEntry> entries, String correlationId) {
        log.error("감사 이벤트 기록 최종 실패, 누락으로 기록: correlationId={}, entries={}",
            correlationId, entries.size(), e);
        metricsCollector.recordAuditGap();
        try {
            auditGapRecorder.record(correlationId, entries, e);
        } catch (RuntimeException gapError) {
            // 누락 기록조차 실패: 로그가 유일한 흔적
            log.error("감사 누락 기록 실패 (수동 확인 필요): correlationId={}, entries={}",
                correlationId, entries, gapError);
        }
    }
}
