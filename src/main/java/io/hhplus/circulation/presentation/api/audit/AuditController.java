package io.hhplus.circulation.presentation.api.audit;

import io.hhplus.circulation.application.audit.dto.AuditEventResponse;
import io.hhplus.circulation.application.usecase.audit.GetAuditEventsUseCase;
import io.hhplus.circulation.presentation.common.RequestContextResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static io.hhplus.circulation.presentation.common.RequestContextResolver.USER_ID;
import static io.hhplus.circulation.presentation.common.RequestContextResolver.USER_ROLE;

@RestController
@RequestMapping("/api/audit-events")
@RequiredArgsConstructor
public class AuditController {

    private final GetAuditEventsUseCase getAuditEventsUseCase;
    private final RequestContextResolver contextResolver;

    @GetMapping
    public ResponseEntity<List<AuditEventResponse>> getAuditEvents(
            @RequestHeader(USER_ID) String userId,
            @RequestHeader(value = USER_ROLE, required = false) String role,
            @RequestParam(required = false) String entityType,
            @RequestParam(required = false) String entityId,
            @RequestParam(required = false) String correlationId
    ) {
        List<AuditEventResponse> response = getAuditEventsUseCase.execute(
                entityType, entityId, correlationId, contextResolver.actor(userId, role));
        return ResponseEntity.ok(response);
    }
}
