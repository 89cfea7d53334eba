package io.hhplus.circulation.domain.loan;

/**
 * 대출 상태
 * <p>
 * ACTIVE: 대출 중 (소장본당 최대 1건)
 * RETURNED: 반납 완료 (이후 불변)
 * LOST: 분실 처리 (이후 불변)
 */
public enum LoanStatus {
    ACTIVE,
    RETURNED,
    LOST
}
