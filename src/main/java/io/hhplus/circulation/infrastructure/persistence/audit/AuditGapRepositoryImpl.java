package io.hhplus.circulation.infrastructure.persistence.audit;

import io.hhplus.circulation.domain.audit.AuditGap;
import io.hhplus.circulation.domain.audit.AuditGap.AuditGapStatus;
import io.hhplus.circulation.domain.audit.AuditGapRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class AuditGapRepositoryImpl implements AuditGapRepository {

    private final AuditGapJpaRepository jpaRepository;

    @Override
    public AuditGap save(AuditGap gap) {
        return jpaRepository.save(gap);
    }

    @Override
    public Optional<AuditGap> findById(Long id) {
        return jpaRepository.findById(id);
    }

    @Override
    public List<AuditGap> findRetryableGaps(int limit) {
        return jpaRepository.findRetryable(
            AuditGapStatus.PENDING,
            LocalDateTime.now(),
            PageRequest.of(0, limit)
        );
    }

    @Override
    public long countByStatus(AuditGapStatus status) {
        return jpaRepository.countByStatus(status);
    }
}
