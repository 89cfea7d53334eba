package io.hhplus.circulation.infrastructure.batch;

import io.hhplus.circulation.application.audit.AuditEventWriter;
import io.hhplus.circulation.application.audit.AuditPayloadCodec;
import io.hhplus.circulation.config.CirculationProperties;
import io.hhplus.circulation.domain.audit.AuditGap;
import io.hhplus.circulation.domain.audit.AuditGapRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 감사 누락 재처리
 * <p>
 * 기록에 실패해 audit_gaps에 남은 항목을 다시 기록한다.
 * 재시도 간격은 AuditGap이 관리한다. (1, 2, 4, 8분 후 FAILED)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditReconciliationScheduler {

    private final AuditGapRepository auditGapRepository;
    private final AuditEventWriter auditEventWriter;
    private final AuditPayloadCodec auditPayloadCodec;
    private final CirculationProperties properties;

    @Scheduled(fixedRateString = "${circulation.audit.reconcile-rate:60000}")
    public void scheduledReconcile() {
        try {
            reconcile();
        } catch (Exception e) {
            log.error("감사 누락 재처리 실패", e);
        }
    }

    /**
     * @return 해결된 누락 건수
     */
    public int reconcile() {
        List<AuditGap> gaps = auditGapRepository.findRetryableGaps(properties.getAudit().getReconcileBatchSize());
        if (gaps.isEmpty()) {
            return 0;
        }

        int resolved = 0;
        for (AuditGap gap : gaps) {
            gap.startRetry();
            auditGapRepository.save(gap);
            try {
                int appended = auditEventWriter.appendAll(auditPayloadCodec.read(gap.getPayload()));
                gap.markResolved();
                resolved++;
                log.info("감사 누락 해결: gapId={}, correlationId={}, appended={}",
                    gap.getId(), gap.getCorrelationId(), appended);
            } catch (Exception e) {
                gap.markRetryFailed(e.getMessage());
                log.error("감사 누락 재기록 실패: gapId={}, retryCount={}, status={}",
                    gap.getId(), gap.getRetryCount(), gap.getStatus(), e);
            }
            auditGapRepository.save(gap);
        }

        log.info("감사 누락 재처리: 대상 {}건, 해결 {}건", gaps.size(), resolved);
        return resolved;
    }
}
