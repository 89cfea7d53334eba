package io.hhplus.circulation.domain.audit;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 감사 이벤트 (불변, append-only)
 * <p>
 * 커밋된 상태 전이 1건당 엔티티별로 1건 기록된다.
 * eventId UNIQUE 제약으로 재기록(복구 스윕, 누락 재처리)에도 중복이 생기지 않는다.
 */
@Entity
@Table(
    name = "audit_events",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_audit_events_event_id", columnNames = "event_id")
    },
    indexes = {
        @Index(name = "idx_audit_events_entity", columnList = "entity_type, entity_id"),
        @Index(name = "idx_audit_events_correlation_id", columnList = "correlation_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, updatable = false, length = 36)
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false, length = 20)
    private AuditEntityType entityType;

    @Column(name = "entity_id", nullable = false, updatable = false, length = 50)
    private String entityId;

    @Column(nullable = false, updatable = false, length = 30)
    private String action;

    @Column(name = "from_state", updatable = false, length = 20)
    private String fromState;

    @Column(name = "to_state", nullable = false, updatable = false, length = 20)
    private String toState;

    @Column(nullable = false, updatable = false, length = 50)
    private String actor;

    @Column(name = "correlation_id", updatable = false, length = 100)
    private String correlationId;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime occurredAt;

    static AuditEvent of(AuditEntry entry) {
        AuditEvent event = new AuditEvent();
        event.eventId = entry.eventId();
        event.entityType = entry.entityType();
        event.entityId = entry.entityId();
        event.action = entry.action();
        event.fromState = entry.fromState();
        event.toState = entry.toState();
        event.actor = entry.actor();
        event.correlationId = entry.correlationId();
        event.occurredAt = entry.occurredAt();
        return event;
    }
}
