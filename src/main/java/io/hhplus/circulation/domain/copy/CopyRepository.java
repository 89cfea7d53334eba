package io.hhplus.circulation.domain.copy;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;

import java.util.Optional;

/**
 * 소장본 Repository (Resource Ledger 저장소)
 * <p>
 * 상태 전이 메서드는 모두 "조건부 UPDATE" 한 번으로 수행되며 변경된 행 수를 반환한다.
 * 0이면 조건 불일치(Conflict)이고 아무 부수효과도 없다.
 */
public interface CopyRepository {

    Optional<Copy> findById(String copyId);

    boolean existsById(String copyId);

    Copy save(Copy copy);

    /**
     * AVAILABLE → LOANED (currentLoanId = loanId)
     */
    int allocate(String copyId, Long loanId);

    /**
     * LOANED(currentLoanId = expectedLoanId) → AVAILABLE
     */
    int release(String copyId, Long expectedLoanId);

    /**
     * LOANED(currentLoanId = expectedLoanId) → LOST
     */
    int markLost(String copyId, Long expectedLoanId);

    /**
     * fromStatus → RETIRED
     */
    int retire(String copyId, CopyStatus fromStatus);

    default Copy findByIdOrThrow(String copyId) {
        return findById(copyId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.COPY_NOT_FOUND,
                "소장본을 찾을 수 없습니다. copyId: " + copyId
            ));
    }
}
