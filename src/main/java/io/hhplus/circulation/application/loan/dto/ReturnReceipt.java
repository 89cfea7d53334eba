package io.hhplus.circulation.application.loan.dto;

import io.hhplus.circulation.domain.loan.Loan;

import java.time.LocalDateTime;

/**
 * 반납 영수증
 *
 * @param overdue 반납 시각이 반납 예정일을 지났는지
 */
public record ReturnReceipt(
    Long loanId,
    String copyId,
    String userId,
    String status,
    LocalDateTime checkedOutAt,
    LocalDateTime dueAt,
    LocalDateTime returnedAt,
    boolean overdue
) {
    public static ReturnReceipt from(Loan returned) {
        return new ReturnReceipt(
            returned.getId(),
            returned.getCopyId(),
            returned.getUserId(),
            returned.getStatus().name(),
            returned.getCheckedOutAt(),
            returned.getDueAt(),
            returned.getReturnedAt(),
            returned.isOverdue(returned.getReturnedAt())
        );
    }
}
