package io.hhplus.circulation.presentation.common;

import io.hhplus.circulation.application.common.Actor;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.config.CirculationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 요청 헤더 → Actor / CallContext
 * <p>
 * X-User-Id, X-User-Role은 앞단의 인증 계층이 채운 값을 그대로 신뢰한다.
 */
@Component
@RequiredArgsConstructor
public class RequestContextResolver {

    public static final String USER_ID = "X-User-Id";
    public static final String USER_ROLE = "X-User-Role";
    public static final String CORRELATION_ID = "X-Correlation-Id";
    public static final String REQUEST_TIMEOUT_MS = "X-Request-Timeout-Ms";

    private final CirculationProperties properties;

    public Actor actor(String userId, String role) {
        return Actor.of(userId, role);
    }

    public CallContext context(String userId, String role, String correlationId, Long timeoutMs) {
        return new CallContext(actor(userId, role), correlationId, Deadline.after(timeout(timeoutMs)));
    }

    private Duration timeout(Long timeoutMs) {
        if (timeoutMs == null) {
            return properties.getIdempotency().getWaitTimeout();
        }
        if (timeoutMs <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, REQUEST_TIMEOUT_MS + "는 양수여야 합니다: " + timeoutMs);
        }
        return Duration.ofMillis(timeoutMs);
    }
}
