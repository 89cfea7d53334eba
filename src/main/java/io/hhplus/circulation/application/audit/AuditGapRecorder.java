package io.hhplus.circulation.application.audit;

import io.hhplus.circulation.domain.audit.AuditEntry;
import io.hhplus.circulation.domain.audit.AuditGap;
import io.hhplus.circulation.domain.audit.AuditGapRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 감사 로그 누락 기록 (AuditReconciliationScheduler가 재처리)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditGapRecorder {

    private final AuditGapRepository auditGapRepository;
    private final AuditPayloadCodec payloadCodec;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditGap record(String correlationId, List<AuditEntry> entries, Throwable cause) {
        AuditGap gap = AuditGap.create(correlationId, payloadCodec.write(entries), describe(cause));
        AuditGap saved = auditGapRepository.save(gap);
        log.warn("감사 누락 기록: gapId={}, correlationId={}, entries={}", saved.getId(), correlationId, entries.size());
        return saved;
    }

    private String describe(Throwable cause) {
        if (cause == null) {
            return null;
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
