package io.hhplus.circulation.infrastructure.persistence.loan;

import io.hhplus.circulation.domain.loan.LoanHistory;
import io.hhplus.circulation.domain.loan.LoanHistoryRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaLoanHistoryRepository extends JpaRepository<LoanHistory, Long>, LoanHistoryRepository {

    @Override
    @SuppressWarnings("unchecked")
    LoanHistory save(LoanHistory history);

    @Override
    List<LoanHistory> findByLoanIdOrderByIdAsc(Long loanId);
}
