package io.hhplus.circulation.domain.loan;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 대출 Repository (Loan Ledger 현재 상태 뷰)
 * <p>
 * 상태 전이 메서드는 "ACTIVE일 때만" 적용되는 조건부 UPDATE이며 변경된 행 수를 반환한다.
 */
public interface LoanRepository {

    Optional<Loan> findById(Long id);

    /**
     * INSERT 즉시 flush (uk_loans_active_copy 위반을 호출 지점에서 감지하기 위함)
     */
    Loan saveAndFlush(Loan loan);

    Optional<Loan> findByActiveCopyId(String copyId);

    List<Loan> findByUserIdOrderByCheckedOutAtDesc(String userId);

    long countByUserIdAndStatus(String userId, LoanStatus status);

    long countByCopyIdAndStatus(String copyId, LoanStatus status);

    /**
     * ACTIVE → RETURNED
     */
    int markReturned(Long loanId, LocalDateTime returnedAt);

    /**
     * ACTIVE → LOST
     */
    int markLost(Long loanId, LocalDateTime lostAt);

    /**
     * ACTIVE 유지, dueAt 갱신 + renewalCount + 1
     * expectedRenewalCount가 다르면 (동시 연장) 0 반환
     */
    int extendDue(Long loanId, int expectedRenewalCount, LocalDateTime newDueAt);

    default Loan findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.LOAN_NOT_FOUND,
                "대출 기록을 찾을 수 없습니다. loanId: " + id
            ));
    }
}
