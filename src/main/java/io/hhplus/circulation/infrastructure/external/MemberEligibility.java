package io.hhplus.circulation.infrastructure.external;

/**
 * 회원 대출 자격
 *
 * @param active         대출 정지 여부의 반대 (정지 회원이면 false)
 * @param underLoanLimit 현재 대출 권수가 한도 미만인지
 */
public record MemberEligibility(
    boolean active,
    boolean underLoanLimit,
    long activeLoanCount
) {
    public boolean isEligible() {
        return active && underLoanLimit;
    }
}
