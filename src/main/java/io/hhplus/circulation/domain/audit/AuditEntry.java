package io.hhplus.circulation.domain.audit;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 기록 예정인 감사 항목
 * <p>
 * eventId를 미리 발급해 두므로 같은 항목을 여러 번 기록하려 해도 감사 로그에는 한 번만 남는다.
 * 멱등성 레코드의 pendingAudit, 감사 누락(AuditGap)의 payload로 JSON 직렬화된다.
 */
public record AuditEntry(
    String eventId,
    AuditEntityType entityType,
    String entityId,
    String action,
    String fromState,
    String toState,
    String actor,
    String correlationId,
    LocalDateTime occurredAt
) {

    public static AuditEntry of(AuditEntityType entityType,
                                String entityId,
                                String action,
                                String fromState,
                                String toState,
                                String actor,
                                String correlationId,
                                LocalDateTime occurredAt) {
        return new AuditEntry(
            UUID.randomUUID().toString(),
            entityType,
            entityId,
            action,
            fromState,
            toState,
            actor,
            correlationId,
            occurredAt
        );
    }

    public AuditEvent toEvent() {
        return AuditEvent.of(this);
    }
}
