package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.domain.audit.AuditEntry;

import java.util.List;

/**
 * 커밋된 전이의 결과와, 커밋 이후 기록할 감사 항목
 */
public record TransitionOutcome<T>(T result, List<AuditEntry> auditEntries) {

    public TransitionOutcome {
        auditEntries = List.copyOf(auditEntries);
    }

    public static <T> TransitionOutcome<T> of(T result, List<AuditEntry> auditEntries) {
        return new TransitionOutcome<>(result, auditEntries);
    }
}
