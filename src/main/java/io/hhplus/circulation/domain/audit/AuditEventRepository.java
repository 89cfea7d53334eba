package io.hhplus.circulation.domain.audit;

import java.util.List;

public interface AuditEventRepository {

    AuditEvent save(AuditEvent event);

    boolean existsByEventId(String eventId);

    List<AuditEvent> findByEntityTypeAndEntityIdOrderByIdAsc(AuditEntityType entityType, String entityId);

    List<AuditEvent> findByCorrelationIdOrderByIdAsc(String correlationId);

    long countByEntityTypeAndEntityId(AuditEntityType entityType, String entityId);
}
