package io.hhplus.circulation.application.usecase.loan;

import io.hhplus.circulation.application.circulation.AllocationEngine;
import io.hhplus.circulation.application.circulation.ReturnCommand;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.application.idempotency.IdempotentExecutor;
import io.hhplus.circulation.application.idempotency.IdempotentRequest;
import io.hhplus.circulation.application.loan.dto.ReturnReceipt;
import io.hhplus.circulation.application.loan.dto.ReturnRequest;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.domain.idempotency.OperationType;
import lombok.RequiredArgsConstructor;

@UseCase
@RequiredArgsConstructor
public class ReturnUseCase {

    private final AllocationEngine allocationEngine;
    private final IdempotentExecutor idempotentExecutor;

    public ReturnReceipt execute(ReturnRequest request, CallContext context) {
        context.actor().requireSelfOrAdmin(request.userId());

        IdempotentRequest idempotentRequest = IdempotentRequest.of(
            request.idempotencyKey(),
            OperationType.RETURN,
            context.correlationIdOr(request.idempotencyKey()),
            context.deadline(),
            request.copyId(),
            request.userId()
        );

        return idempotentExecutor.execute(idempotentRequest, ReturnReceipt.class, ticket ->
            allocationEngine.returnCopy(
                new ReturnCommand(request.copyId(), request.userId(), context.actor()),
                ticket,
                context.deadline()
            )
        );
    }
}
