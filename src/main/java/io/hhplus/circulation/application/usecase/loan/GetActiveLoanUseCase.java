package io.hhplus.circulation.application.usecase.loan;

import io.hhplus.circulation.application.circulation.LoanLedger;
import io.hhplus.circulation.application.circulation.ResourceLedger;
import io.hhplus.circulation.application.loan.dto.LoanResponse;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

@UseCase
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class GetActiveLoanUseCase {

    private final ResourceLedger resourceLedger;
    private final LoanLedger loanLedger;

    public LoanResponse execute(String copyId) {
        resourceLedger.getCopy(copyId);
        return loanLedger.findActiveByCopyId(copyId)
            .map(LoanResponse::from)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.LOAN_NOT_FOUND,
                "진행 중인 대출이 없습니다. copyId: " + copyId
            ));
    }
}
