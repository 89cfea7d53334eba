package io.hhplus.circulation.application.copy.dto;

import io.hhplus.circulation.domain.copy.Copy;

/**
 * 소장본 가용성 조회 결과 (Redis 캐시 대상)
 *
 * @param state FREE / HELD / UNAVAILABLE
 */
public record CopyResponse(
    String copyId,
    String bookId,
    String status,
    String state,
    Long currentLoanId,
    boolean available
) {
    public static CopyResponse from(Copy copy) {
        return new CopyResponse(
            copy.getCopyId(),
            copy.getBookId(),
            copy.getStatus().name(),
            copy.getState().name(),
            copy.getCurrentLoanId(),
            copy.isAvailable()
        );
    }
}
