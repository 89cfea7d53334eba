package io.hhplus.circulation.application.copy.dto;

import java.time.LocalDateTime;

public record LostReportResponse(
    Long loanId,
    String copyId,
    String userId,
    String loanStatus,
    String copyStatus,
    LocalDateTime reportedAt
) {
}
