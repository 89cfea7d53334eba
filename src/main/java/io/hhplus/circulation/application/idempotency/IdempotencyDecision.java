package io.hhplus.circulation.application.idempotency;

/**
 * begin() 판정 결과
 * <p>
 * - NEW: 이 요청이 IN_FLIGHT 레코드를 만들었다. 비즈니스 로직을 실행한다.
 * - DUPLICATE_IN_FLIGHT: 같은 키의 요청이 처리 중이다. 마감 시각까지 기다린다.
 * - DUPLICATE_COMPLETED: 이미 처리되었다. 저장된 결과를 그대로 반환한다.
 * - KEY_REUSE_MISMATCH: 같은 키가 다른 작업/파라미터로 사용되었다.
 */
public record IdempotencyDecision(Outcome outcome, Long recordId, String payload) {

    public enum Outcome {
        NEW,
        DUPLICATE_IN_FLIGHT,
        DUPLICATE_COMPLETED,
        KEY_REUSE_MISMATCH
    }

    public static IdempotencyDecision newRequest(Long recordId) {
        return new IdempotencyDecision(Outcome.NEW, recordId, null);
    }

    public static IdempotencyDecision inFlight() {
        return new IdempotencyDecision(Outcome.DUPLICATE_IN_FLIGHT, null, null);
    }

    public static IdempotencyDecision completed(String payload) {
        return new IdempotencyDecision(Outcome.DUPLICATE_COMPLETED, null, payload);
    }

    public static IdempotencyDecision mismatch() {
        return new IdempotencyDecision(Outcome.KEY_REUSE_MISMATCH, null, null);
    }

    public boolean is(Outcome expected) {
        return outcome == expected;
    }
}
