package io.hhplus.circulation.application.loan.dto;

import io.hhplus.circulation.domain.loan.LoanHistory;

import java.time.LocalDateTime;
import java.util.List;

public record LoanHistoryResponse(
    Long loanId,
    List<Entry> entries
) {
    public static LoanHistoryResponse of(Long loanId, List<LoanHistory> history) {
        return new LoanHistoryResponse(loanId, history.stream().map(Entry::from).toList());
    }

    public record Entry(
        String eventType,
        String status,
        LocalDateTime dueAt,
        int renewalCount,
        LocalDateTime occurredAt
    ) {
        static Entry from(LoanHistory history) {
            return new Entry(
                history.getEventType().name(),
                history.getStatus().name(),
                history.getDueAt(),
                history.getRenewalCount(),
                history.getOccurredAt()
            );
        }
    }
}
