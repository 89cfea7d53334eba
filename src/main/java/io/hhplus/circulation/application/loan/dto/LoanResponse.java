package io.hhplus.circulation.application.loan.dto;

import io.hhplus.circulation.domain.loan.Loan;

import java.time.LocalDateTime;

public record LoanResponse(
    Long loanId,
    String copyId,
    String userId,
    String status,
    LocalDateTime checkedOutAt,
    LocalDateTime dueAt,
    LocalDateTime returnedAt,
    int renewalCount
) {
    public static LoanResponse from(Loan loan) {
        return new LoanResponse(
            loan.getId(),
            loan.getCopyId(),
            loan.getUserId(),
            loan.getStatus().name(),
            loan.getCheckedOutAt(),
            loan.getDueAt(),
            loan.getReturnedAt(),
            loan.getRenewalCount()
        );
    }
}
