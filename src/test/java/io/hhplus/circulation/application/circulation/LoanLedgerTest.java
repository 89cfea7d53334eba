package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.loan.Loan;
import io.hhplus.circulation.domain.loan.LoanRepository;
import io.hhplus.circulation.domain.loan.LoanStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * 대출 원장 테스트
 * <p>
 * 락과 조건부 UPDATE를 거치지 않고 원장을 직접 호출해 저장소 제약만으로 이중 대출이 막히는지 확인한다.
 */
@SpringBootTest
@ActiveProfiles("test")
class LoanLedgerTest {

    @Autowired
    private LoanLedger loanLedger;

    @Autowired
    private LoanRepository loanRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    @DisplayName("같은 소장본 ACTIVE 대출 2건 - 유니크 제약으로 COPY_NOT_AVAILABLE")
    void ACTIVE대출_중복_차단() {
        // Given
        String copyId = "LL-" + UUID.randomUUID().toString().substring(0, 8);
        LocalDateTime now = LocalDateTime.now();
        Loan first = transactionTemplate.execute(status ->
            loanLedger.createActiveLoan(copyId, "user-1", now, now.plusDays(14)));

        // When & Then
        assertThatThrownBy(() -> transactionTemplate.execute(status ->
            loanLedger.createActiveLoan(copyId, "user-2", now, now.plusDays(14))))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.COPY_NOT_AVAILABLE);

        assertThat(loanRepository.countByCopyIdAndStatus(copyId, LoanStatus.ACTIVE)).isEqualTo(1);
        assertThat(loanRepository.findByActiveCopyId(copyId)).get()
            .extracting(Loan::getId)
            .isEqualTo(first.getId());
    }

    @Test
    @DisplayName("반납 후 같은 소장본 새 대출 - 허용")
    void 반납후_재대출() {
        // Given
        String copyId = "LL-" + UUID.randomUUID().toString().substring(0, 8);
        LocalDateTime now = LocalDateTime.now();
        Loan first = transactionTemplate.execute(status ->
            loanLedger.createActiveLoan(copyId, "user-1", now, now.plusDays(14)));
        transactionTemplate.executeWithoutResult(status -> loanLedger.completeReturn(first.getId(), now.plusDays(1)));

        // When
        Loan second = transactionTemplate.execute(status ->
            loanLedger.createActiveLoan(copyId, "user-2", now.plusDays(1), now.plusDays(15)));

        // Then
        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(loanLedger.history(first.getId()))
            .extracting(history -> history.getEventType().name())
            .containsExactly("CREATED", "RETURNED");
    }

    @Test
    @DisplayName("반납된 대출 재반납 - LOAN_NOT_ACTIVE")
    void 재반납_차단() {
        // Given
        String copyId = "LL-" + UUID.randomUUID().toString().substring(0, 8);
        LocalDateTime now = LocalDateTime.now();
        Loan loan = transactionTemplate.execute(status ->
            loanLedger.createActiveLoan(copyId, "user-1", now, now.plusDays(14)));
        transactionTemplate.executeWithoutResult(status -> loanLedger.completeReturn(loan.getId(), now));

        // When & Then
        assertThatThrownBy(() -> transactionTemplate.executeWithoutResult(status -> loanLedger.completeReturn(loan.getId(), now)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.LOAN_NOT_ACTIVE);
    }

    @Test
    @DisplayName("유니크 제약 외의 저장소 오류(컬럼 길이 초과)는 COPY_NOT_AVAILABLE로 바꾸지 않는다")
    void 다른제약위반_그대로전파() {
        // Given
        String copyId = "LL-" + UUID.randomUUID().toString().substring(0, 8);
        LocalDateTime now = LocalDateTime.now();

        // When & Then
        assertThatThrownBy(() -> transactionTemplate.execute(status ->
            loanLedger.createActiveLoan(copyId, "U".repeat(60), now, now.plusDays(14))))
            .isInstanceOf(DataIntegrityViolationException.class)
            .isNotInstanceOf(BusinessException.class);

        assertThat(loanRepository.countByCopyIdAndStatus(copyId, LoanStatus.ACTIVE)).isZero();
    }
}
