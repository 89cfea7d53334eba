package io.hhplus.circulation.application.usecase.copy;

import io.hhplus.circulation.application.audit.AuditEmitter;
import io.hhplus.circulation.application.circulation.AllocationEngine;
import io.hhplus.circulation.application.circulation.RegisterCopyCommand;
import io.hhplus.circulation.application.circulation.TransitionOutcome;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.application.copy.dto.CopyResponse;
import io.hhplus.circulation.application.copy.dto.RegisterCopyRequest;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.infrastructure.external.CatalogClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * 소장본 등록 UseCase (관리자 전용)
 * <p>
 * 카탈로그에 존재하고 도서 ID가 일치하는 소장본만 AVAILABLE로 등록한다.
 * 재시도는 COPY_ALREADY_REGISTERED로 응답하므로 멱등성 키를 받지 않는다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class RegisterCopyUseCase {

    private final AllocationEngine allocationEngine;
    private final CatalogClient catalogClient;
    private final AuditEmitter auditEmitter;

    public CopyResponse execute(RegisterCopyRequest request, CallContext context) {
        context.actor().requireAdmin();

        if (!catalogClient.copyExists(request.copyId())) {
            throw new BusinessException(
                ErrorCode.COPY_NOT_FOUND,
                "카탈로그에 없는 소장본입니다. copyId: " + request.copyId()
            );
        }
        String catalogBookId = catalogClient.bookOf(request.copyId()).orElse(null);
        if (!request.bookId().equals(catalogBookId)) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("카탈로그의 도서 ID와 일치하지 않습니다. copyId: %s, bookId: %s, catalog: %s",
                    request.copyId(), request.bookId(), catalogBookId)
            );
        }

        String correlationId = context.correlationIdOr(UUID.randomUUID().toString());
        TransitionOutcome<CopyResponse> outcome = allocationEngine.register(
            new RegisterCopyCommand(request.copyId(), request.bookId(), context.actor()),
            correlationId,
            context.deadline()
        );
        auditEmitter.emit(outcome.auditEntries(), correlationId);
        return outcome.result();
    }
}
