package io.hhplus.circulation.application.usecase.copy;

import io.hhplus.circulation.application.circulation.AllocationEngine;
import io.hhplus.circulation.application.circulation.ReportLostCommand;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.application.copy.dto.LostReportResponse;
import io.hhplus.circulation.application.copy.dto.ReportLostRequest;
import io.hhplus.circulation.application.idempotency.IdempotentExecutor;
import io.hhplus.circulation.application.idempotency.IdempotentRequest;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.domain.idempotency.OperationType;
import lombok.RequiredArgsConstructor;

/**
 * 분실 신고 UseCase (대출자 본인 또는 관리자)
 */
@UseCase
@RequiredArgsConstructor
public class ReportLostUseCase {

    private final AllocationEngine allocationEngine;
    private final IdempotentExecutor idempotentExecutor;

    public LostReportResponse execute(String copyId, ReportLostRequest request, CallContext context) {
        IdempotentRequest idempotentRequest = IdempotentRequest.of(
            request.idempotencyKey(),
            OperationType.REPORT_LOST,
            context.correlationIdOr(request.idempotencyKey()),
            context.deadline(),
            copyId
        );

        return idempotentExecutor.execute(idempotentRequest, LostReportResponse.class, ticket ->
            allocationEngine.reportLost(new ReportLostCommand(copyId, context.actor()), ticket, context.deadline())
        );
    }
}
