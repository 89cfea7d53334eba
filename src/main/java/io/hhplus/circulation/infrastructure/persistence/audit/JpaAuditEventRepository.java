package io.hhplus.circulation.infrastructure.persistence.audit;

import io.hhplus.circulation.domain.audit.AuditEntityType;
import io.hhplus.circulation.domain.audit.AuditEvent;
import io.hhplus.circulation.domain.audit.AuditEventRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaAuditEventRepository extends JpaRepository<AuditEvent, Long>, AuditEventRepository {

    @Override
    @SuppressWarnings("unchecked")
    AuditEvent save(AuditEvent event);

    @Override
    boolean existsByEventId(String eventId);

    @Override
    List<AuditEvent> findByEntityTypeAndEntityIdOrderByIdAsc(AuditEntityType entityType, String entityId);

    @Override
    List<AuditEvent> findByCorrelationIdOrderByIdAsc(String correlationId);

    @Override
    long countByEntityTypeAndEntityId(AuditEntityType entityType, String entityId);
}
