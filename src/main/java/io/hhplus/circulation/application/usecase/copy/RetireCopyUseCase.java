package io.hhplus.circulation.application.usecase.copy;

import io.hhplus.circulation.application.circulation.AllocationEngine;
import io.hhplus.circulation.application.circulation.RetireCommand;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.application.copy.dto.CopyResponse;
import io.hhplus.circulation.application.copy.dto.RetireCopyRequest;
import io.hhplus.circulation.application.idempotency.IdempotentExecutor;
import io.hhplus.circulation.application.idempotency.IdempotentRequest;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.domain.idempotency.OperationType;
import lombok.RequiredArgsConstructor;

/**
 * 소장본 폐기 UseCase (관리자 전용)
 */
@UseCase
@RequiredArgsConstructor
public class RetireCopyUseCase {

    private final AllocationEngine allocationEngine;
    private final IdempotentExecutor idempotentExecutor;

    public CopyResponse execute(String copyId, RetireCopyRequest request, CallContext context) {
        context.actor().requireAdmin();

        IdempotentRequest idempotentRequest = IdempotentRequest.of(
            request.idempotencyKey(),
            OperationType.RETIRE,
            context.correlationIdOr(request.idempotencyKey()),
            context.deadline(),
            copyId
        );

        return idempotentExecutor.execute(idempotentRequest, CopyResponse.class, ticket ->
            allocationEngine.retire(new RetireCommand(copyId, context.actor()), ticket, context.deadline())
        );
    }
}
