package io.hhplus.circulation.domain.audit;

import java.util.List;
import java.util.Optional;

/**
 * 감사 누락 저장소 인터페이스
 */
public interface AuditGapRepository {

    AuditGap save(AuditGap gap);

    Optional<AuditGap> findById(Long id);

    /**
     * 재기록 대상 조회
     * - status = PENDING
     * - nextRetryAt이 현재 시각 이전
     */
    List<AuditGap> findRetryableGaps(int limit);

    long countByStatus(AuditGap.AuditGapStatus status);
}
