package io.hhplus.circulation.domain.idempotency;

/**
 * 멱등성 키로 보호되는 쓰기 작업 종류
 */
public enum OperationType {
    CHECKOUT,
    RETURN,
    RENEW,
    REPORT_LOST,
    RETIRE
}
