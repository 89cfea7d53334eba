package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.copy.Copy;
import io.hhplus.circulation.domain.copy.CopyRepository;
import io.hhplus.circulation.domain.copy.CopyStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * 자원 원장 (Resource Ledger)
 * <p>
 * 소장본별 할당 상태와 현재 대출을 관리한다.
 * 모든 전이는 CopyRepository의 조건부 UPDATE 한 번이며, 0건이면 Conflict로 변환한다.
 * 호출자는 엔진 트랜잭션 안에 있어야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResourceLedger {

    private final CopyRepository copyRepository;

    public Copy getCopy(String copyId) {
        return copyRepository.findByIdOrThrow(copyId);
    }

    public void tryAllocate(String copyId, Long loanId) {
        if (copyRepository.allocate(copyId, loanId) == 0) {
            log.warn("소장본 할당 실패 (AVAILABLE 아님): copyId={}, loanId={}", copyId, loanId);
            throw new BusinessException(
                ErrorCode.COPY_NOT_AVAILABLE,
                "대출 가능한 소장본이 아닙니다. copyId: " + copyId
            );
        }
    }

    public void release(String copyId, Long expectedLoanId) {
        if (copyRepository.release(copyId, expectedLoanId) == 0) {
            log.warn("소장본 반환 실패 (대출 불일치): copyId={}, expectedLoanId={}", copyId, expectedLoanId);
            throw new BusinessException(
                ErrorCode.INVALID_COPY_STATUS,
                String.format("소장본이 해당 대출로 대출 중이 아닙니다. copyId: %s, loanId: %d", copyId, expectedLoanId)
            );
        }
    }

    public void markLost(String copyId, Long expectedLoanId) {
        if (copyRepository.markLost(copyId, expectedLoanId) == 0) {
            log.warn("소장본 분실 처리 실패 (대출 불일치): copyId={}, expectedLoanId={}", copyId, expectedLoanId);
            throw new BusinessException(
                ErrorCode.INVALID_COPY_STATUS,
                String.format("소장본이 해당 대출로 대출 중이 아닙니다. copyId: %s, loanId: %d", copyId, expectedLoanId)
            );
        }
    }

    public void retire(String copyId, CopyStatus fromStatus) {
        if (copyRepository.retire(copyId, fromStatus) == 0) {
            throw new BusinessException(
                ErrorCode.INVALID_COPY_STATUS,
                String.format("소장본 상태가 변경되어 폐기할 수 없습니다. copyId: %s, expected: %s", copyId, fromStatus)
            );
        }
    }

    public Copy register(String copyId, String bookId) {
        if (copyRepository.existsById(copyId)) {
            throw new BusinessException(
                ErrorCode.COPY_ALREADY_REGISTERED,
                "이미 등록된 소장본입니다. copyId: " + copyId
            );
        }
        try {
            return copyRepository.save(Copy.register(copyId, bookId));
        } catch (DataIntegrityViolationException e) {
            // 동시 등록: PK 중복
            throw new BusinessException(
                ErrorCode.COPY_ALREADY_REGISTERED,
                "이미 등록된 소장본입니다. copyId: " + copyId
            );
        }
    }
}
