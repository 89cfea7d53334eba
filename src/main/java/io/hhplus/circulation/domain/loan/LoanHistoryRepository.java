package io.hhplus.circulation.domain.loan;

import java.util.List;

public interface LoanHistoryRepository {

    LoanHistory save(LoanHistory history);

    List<LoanHistory> findByLoanIdOrderByIdAsc(Long loanId);
}
