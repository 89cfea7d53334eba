package io.hhplus.circulation.application.idempotency;

import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.domain.idempotency.OperationType;

/**
 * 멱등성 키로 보호되는 쓰기 요청 한 건
 *
 * @param fingerprint OperationFingerprint.of(operationType, 핵심 파라미터...)
 */
public record IdempotentRequest(
    String idempotencyKey,
    OperationType operationType,
    String fingerprint,
    String correlationId,
    Deadline deadline
) {
    public static IdempotentRequest of(String idempotencyKey,
                                       OperationType operationType,
                                       String correlationId,
                                       Deadline deadline,
                                       Object... params) {
        return new IdempotentRequest(
            idempotencyKey,
            operationType,
            OperationFingerprint.of(operationType, params),
            correlationId,
            deadline
        );
    }
}
