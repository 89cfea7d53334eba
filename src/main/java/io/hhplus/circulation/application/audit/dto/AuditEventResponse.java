package io.hhplus.circulation.application.audit.dto;

import io.hhplus.circulation.domain.audit.AuditEvent;

import java.time.LocalDateTime;

public record AuditEventResponse(
    String eventId,
    String entityType,
    String entityId,
    String action,
    String fromState,
    String toState,
    String actor,
    String correlationId,
    LocalDateTime occurredAt
) {
    public static AuditEventResponse from(AuditEvent event) {
        return new AuditEventResponse(
            event.getEventId(),
            event.getEntityType().name(),
            event.getEntityId(),
            event.getAction(),
            event.getFromState(),
            event.getToState(),
            event.getActor(),
            event.getCorrelationId(),
            event.getOccurredAt()
        );
    }
}
