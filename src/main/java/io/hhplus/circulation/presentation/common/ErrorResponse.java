package io.hhplus.circulation.presentation.common;

import io.hhplus.circulation.common.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 에러 응답
 * <p>
 * type: NOT_FOUND / CONFLICT / FORBIDDEN / TIMEOUT / INTERNAL / INVALID_INPUT
 * retryable: 같은 멱등성 키로 그대로 재시도해도 되는지
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorResponse {

    private final String code;
    private final String message;
    private final String type;
    private final boolean retryable;
    private final Object details;

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return of(errorCode, message, null);
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, Object details) {
        return new ErrorResponse(
            errorCode.getCode(),
            message,
            errorCode.getType().name(),
            errorCode.getType().isRetryable(),
            details
        );
    }
}
