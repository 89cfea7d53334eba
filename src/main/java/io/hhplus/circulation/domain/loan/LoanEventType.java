package io.hhplus.circulation.domain.loan;

/**
 * 대출 원장 이벤트 타입
 */
public enum LoanEventType {
    CREATED,
    RENEWED,
    RETURNED,
    LOST
}
