package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ConstraintViolations;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.loan.Loan;
import io.hhplus.circulation.domain.loan.LoanEventType;
import io.hhplus.circulation.domain.loan.LoanHistory;
import io.hhplus.circulation.domain.loan.LoanHistoryRepository;
import io.hhplus.circulation.domain.loan.LoanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 대출 원장 (Loan Ledger)
 * <p>
 * loans(현재 상태) 갱신과 loan_history(원장 항목) 추가를 같은 트랜잭션에서 수행한다.
 * 상태 전이는 "ACTIVE일 때만" 적용되는 조건부 UPDATE이며, 0건이면 Conflict.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoanLedger {

    private final LoanRepository loanRepository;
    private final LoanHistoryRepository loanHistoryRepository;

    /**
     * ACTIVE 대출 생성
     * <p>
     * 같은 소장본에 ACTIVE 대출이 이미 있으면 uk_loans_active_copy 위반 → COPY_NOT_AVAILABLE.
     * 락이나 조건부 UPDATE가 뚫리더라도 이 제약이 이중 대출을 막는다.
     * 그 밖의 제약 위반(컬럼 길이 초과 등)은 그대로 전파한다.
     */
    public Loan createActiveLoan(String copyId, String userId, LocalDateTime checkedOutAt, LocalDateTime dueAt) {
        Loan saved;
        try {
            saved = loanRepository.saveAndFlush(Loan.createActive(copyId, userId, checkedOutAt, dueAt));
        } catch (DataIntegrityViolationException e) {
            if (!ConstraintViolations.isViolationOf(e, Loan.ACTIVE_COPY_CONSTRAINT)) {
                throw e;
            }
            log.warn("ACTIVE 대출 중복 (저장소 제약 위반): copyId={}, userId={}", copyId, userId);
            throw new BusinessException(
                ErrorCode.COPY_NOT_AVAILABLE,
                "이미 대출 중인 소장본입니다. copyId: " + copyId
            );
        }
        loanHistoryRepository.save(LoanHistory.of(saved, LoanEventType.CREATED, checkedOutAt));
        return saved;
    }

    public Loan completeReturn(Long loanId, LocalDateTime returnedAt) {
        if (loanRepository.markReturned(loanId, returnedAt) == 0) {
            throw notActive(loanId);
        }
        return appendHistory(loanId, LoanEventType.RETURNED, returnedAt);
    }

    public Loan renew(Long loanId, int expectedRenewalCount, LocalDateTime newDueAt, LocalDateTime renewedAt) {
        if (loanRepository.extendDue(loanId, expectedRenewalCount, newDueAt) == 0) {
            throw notActive(loanId);
        }
        return appendHistory(loanId, LoanEventType.RENEWED, renewedAt);
    }

    public Loan markLost(Long loanId, LocalDateTime lostAt) {
        if (loanRepository.markLost(loanId, lostAt) == 0) {
            throw notActive(loanId);
        }
        return appendHistory(loanId, LoanEventType.LOST, lostAt);
    }

    public Optional<Loan> findActiveByCopyId(String copyId) {
        return loanRepository.findByActiveCopyId(copyId);
    }

    public Loan getLoan(Long loanId) {
        return loanRepository.findByIdOrThrow(loanId);
    }

    public List<Loan> listByUser(String userId) {
        return loanRepository.findByUserIdOrderByCheckedOutAtDesc(userId);
    }

    public List<LoanHistory> history(Long loanId) {
        return loanHistoryRepository.findByLoanIdOrderByIdAsc(loanId);
    }

    private Loan appendHistory(Long loanId, LoanEventType eventType, LocalDateTime occurredAt) {
        // 조건부 UPDATE가 영속성 컨텍스트를 비웠으므로 갱신된 행을 다시 읽는다
        Loan updated = loanRepository.findByIdOrThrow(loanId);
        loanHistoryRepository.save(LoanHistory.of(updated, eventType, occurredAt));
        return updated;
    }

    private BusinessException notActive(Long loanId) {
        log.warn("대출 전이 실패 (ACTIVE 아님 또는 동시 변경): loanId={}", loanId);
        return new BusinessException(
            ErrorCode.LOAN_NOT_ACTIVE,
            "진행 중인 대출이 아니거나 이미 변경되었습니다. loanId: " + loanId
        );
    }
}
