package io.hhplus.circulation.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 에러 분류
 * <p>
 * 호출자가 "재시도 / 포기"를 판단할 수 있도록 ErrorCode를 묶는다.
 * - NOT_FOUND: 입력을 바꾸지 않으면 재시도 불가
 * - CONFLICT: 상태를 다시 조회한 뒤에만 재시도
 * - FORBIDDEN: 재시도 불가
 * - TIMEOUT: 같은 멱등성 키로 안전하게 재시도 가능
 * - INTERNAL: 백오프 후 재시도 (멱등성 키로 안전)
 */
@Getter
@RequiredArgsConstructor
public enum ErrorType {
    NOT_FOUND(false),
    CONFLICT(false),
    FORBIDDEN(false),
    TIMEOUT(true),
    INTERNAL(true),
    INVALID_INPUT(false);

    private final boolean retryable;
}
