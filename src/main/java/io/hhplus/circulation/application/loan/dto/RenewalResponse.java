package io.hhplus.circulation.application.loan.dto;

import io.hhplus.circulation.domain.loan.Loan;

import java.time.LocalDateTime;

public record RenewalResponse(
    Long loanId,
    String copyId,
    LocalDateTime previousDueAt,
    LocalDateTime newDueAt,
    int renewalCount,
    int remainingRenewals
) {
    public static RenewalResponse of(LocalDateTime previousDueAt, Loan renewed, int maxRenewals) {
        return new RenewalResponse(
            renewed.getId(),
            renewed.getCopyId(),
            previousDueAt,
            renewed.getDueAt(),
            renewed.getRenewalCount(),
            Math.max(0, maxRenewals - renewed.getRenewalCount())
        );
    }
}
