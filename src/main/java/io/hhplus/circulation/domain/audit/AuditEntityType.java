package io.hhplus.circulation.domain.audit;

public enum AuditEntityType {
    COPY,
    LOAN
}
