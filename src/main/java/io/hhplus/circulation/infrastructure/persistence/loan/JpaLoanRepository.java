package io.hhplus.circulation.infrastructure.persistence.loan;

import io.hhplus.circulation.domain.loan.Loan;
import io.hhplus.circulation.domain.loan.LoanRepository;
import io.hhplus.circulation.domain.loan.LoanStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 대출 JPA Repository
 * <p>
 * uk_loans_active_copy: 동일 소장본에 ACTIVE 대출을 두 건 INSERT하면 DataIntegrityViolationException
 * <p>
 * 종료 전이(RETURNED, LOST)는 activeCopyId를 NULL로 돌려 다음 대출이 INSERT될 수 있게 한다.
 */
@Repository
public interface JpaLoanRepository extends JpaRepository<Loan, Long>, LoanRepository {

    @Override
    Optional<Loan> findById(Long id);

    @Override
    @SuppressWarnings("unchecked")
    Loan saveAndFlush(Loan loan);

    @Override
    Optional<Loan> findByActiveCopyId(String copyId);

    @Override
    List<Loan> findByUserIdOrderByCheckedOutAtDesc(String userId);

    @Override
    long countByUserIdAndStatus(String userId, LoanStatus status);

    @Override
    long countByCopyIdAndStatus(String copyId, LoanStatus status);

    @Override
    default int markReturned(Long loanId, LocalDateTime returnedAt) {
        return closeActive(loanId, LoanStatus.ACTIVE, LoanStatus.RETURNED, returnedAt, returnedAt);
    }

    @Override
    default int markLost(Long loanId, LocalDateTime lostAt) {
        return closeActive(loanId, LoanStatus.ACTIVE, LoanStatus.LOST, null, lostAt);
    }

    @Override
    default int extendDue(Long loanId, int expectedRenewalCount, LocalDateTime newDueAt) {
        return extendActive(loanId, LoanStatus.ACTIVE, expectedRenewalCount, newDueAt, LocalDateTime.now());
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Loan l SET l.status = :to, l.activeCopyId = NULL, l.returnedAt = :returnedAt, l.updatedAt = :now " +
           "WHERE l.id = :loanId AND l.status = :active")
    int closeActive(@Param("loanId") Long loanId,
                    @Param("active") LoanStatus active,
                    @Param("to") LoanStatus to,
                    @Param("returnedAt") LocalDateTime returnedAt,
                    @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Loan l SET l.dueAt = :newDueAt, l.renewalCount = l.renewalCount + 1, l.updatedAt = :now " +
           "WHERE l.id = :loanId AND l.status = :active AND l.renewalCount = :expectedRenewalCount")
    int extendActive(@Param("loanId") Long loanId,
                     @Param("active") LoanStatus active,
                     @Param("expectedRenewalCount") int expectedRenewalCount,
                     @Param("newDueAt") LocalDateTime newDueAt,
                     @Param("now") LocalDateTime now);
}
