package io.hhplus.circulation.common.exception;

import lombok.Getter;

/**
 * 비즈니스 로직 예외
 * 원장/엔진/멱등성 계층에서 발생하는 규칙 위반을 ErrorCode로 표현한다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage) {
        super(customMessage);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public ErrorType getType() {
        return errorCode.getType();
    }

    public boolean isRetryable() {
        return errorCode.getType().isRetryable();
    }
}
