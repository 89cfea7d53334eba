package io.hhplus.circulation.application.usecase.loan;

import io.hhplus.circulation.application.circulation.AllocationEngine;
import io.hhplus.circulation.application.circulation.LoanLedger;
import io.hhplus.circulation.application.circulation.RenewCommand;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.application.idempotency.IdempotentExecutor;
import io.hhplus.circulation.application.idempotency.IdempotentRequest;
import io.hhplus.circulation.application.loan.dto.RenewRequest;
import io.hhplus.circulation.application.loan.dto.RenewalResponse;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.domain.idempotency.OperationType;
import io.hhplus.circulation.domain.loan.Loan;
import lombok.RequiredArgsConstructor;

/**
 * 대출 연장 UseCase
 * <p>
 * 락은 소장본 단위이므로 대출의 소장본 ID를 먼저 읽어 락 키로 사용한다.
 * (copyId는 대출 생성 후 바뀌지 않으므로 락 밖에서 읽어도 안전)
 */
@UseCase
@RequiredArgsConstructor
public class RenewUseCase {

    private final AllocationEngine allocationEngine;
    private final LoanLedger loanLedger;
    private final IdempotentExecutor idempotentExecutor;

    public RenewalResponse execute(Long loanId, RenewRequest request, CallContext context) {
        IdempotentRequest idempotentRequest = IdempotentRequest.of(
            request.idempotencyKey(),
            OperationType.RENEW,
            context.correlationIdOr(request.idempotencyKey()),
            context.deadline(),
            loanId
        );

        return idempotentExecutor.execute(idempotentRequest, RenewalResponse.class, ticket -> {
            Loan loan = loanLedger.getLoan(loanId);
            return allocationEngine.renew(
                new RenewCommand(loanId, loan.getCopyId(), context.actor()),
                ticket,
                context.deadline()
            );
        });
    }
}
