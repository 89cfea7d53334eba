package io.hhplus.circulation.application.loan.dto;

import java.util.List;

public record LoanListResponse(
    String userId,
    List<LoanResponse> loans,
    long activeCount
) {
    public static LoanListResponse of(String userId, List<LoanResponse> loans) {
        long active = loans.stream().filter(loan -> "ACTIVE".equals(loan.status())).count();
        return new LoanListResponse(userId, loans, active);
    }
}
