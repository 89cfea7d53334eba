package io.hhplus.circulation.infrastructure.persistence.audit;

import io.hhplus.circulation.domain.audit.AuditGap;
import io.hhplus.circulation.domain.audit.AuditGap.AuditGapStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface AuditGapJpaRepository extends JpaRepository<AuditGap, Long> {

    @Query("SELECT g FROM AuditGap g " +
           "WHERE g.status = :status " +
           "AND g.nextRetryAt <= :now " +
           "ORDER BY g.nextRetryAt ASC")
    List<AuditGap> findRetryable(@Param("status") AuditGapStatus status,
                                 @Param("now") LocalDateTime now,
                                 Pageable pageable);

    long countByStatus(AuditGapStatus status);
}
