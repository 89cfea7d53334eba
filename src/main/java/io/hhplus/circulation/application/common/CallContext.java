package io.hhplus.circulation.application.common;

import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;

/**
 * 쓰기 요청 공통 정보
 *
 * @param actor         요청 주체
 * @param correlationId 감사 로그 추적 ID (없으면 멱등성 키 사용)
 * @param deadline      락 대기 + 멱등성 대기의 상한
 */
public record CallContext(Actor actor, String correlationId, Deadline deadline) {

    /**
     * audit_events.correlation_id / audit_gaps.correlation_id 컬럼 길이
     */
    public static final int MAX_CORRELATION_ID_LENGTH = 100;

    public CallContext {
        if (correlationId != null && correlationId.length() > MAX_CORRELATION_ID_LENGTH) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "추적 ID는 " + MAX_CORRELATION_ID_LENGTH + "자를 초과할 수 없습니다: length=" + correlationId.length()
            );
        }
    }

    public String correlationIdOr(String fallback) {
        return (correlationId == null || correlationId.isBlank()) ? fallback : correlationId;
    }
}
