package io.hhplus.circulation.domain.copy;

/**
 * 소장본 상태
 * <p>
 * AVAILABLE: 대출 가능
 * LOANED: 대출 중 (currentLoanId가 ACTIVE 대출을 가리킴)
 * LOST: 분실
 * RETIRED: 폐기 (물리 삭제 대신 상태로 관리)
 */
public enum CopyStatus {
    AVAILABLE,
    LOANED,
    LOST,
    RETIRED
}
