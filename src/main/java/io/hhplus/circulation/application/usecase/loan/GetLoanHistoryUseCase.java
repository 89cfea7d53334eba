package io.hhplus.circulation.application.usecase.loan;

import io.hhplus.circulation.application.circulation.LoanLedger;
import io.hhplus.circulation.application.common.Actor;
import io.hhplus.circulation.application.loan.dto.LoanHistoryResponse;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.loan.Loan;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

@UseCase
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class GetLoanHistoryUseCase {

    private final LoanLedger loanLedger;

    public LoanHistoryResponse execute(Long loanId, Actor actor) {
        Loan loan = loanLedger.getLoan(loanId);
        if (!actor.canActFor(loan.getUserId())) {
            throw new BusinessException(ErrorCode.NOT_LOAN_OWNER, "본인의 대출 이력만 조회할 수 있습니다. loanId: " + loanId);
        }
        return LoanHistoryResponse.of(loanId, loanLedger.history(loanId));
    }
}
