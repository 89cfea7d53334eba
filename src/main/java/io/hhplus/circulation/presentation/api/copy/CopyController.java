package io.hhplus.circulation.presentation.api.copy;

import io.hhplus.circulation.application.copy.dto.*;
import io.hhplus.circulation.application.loan.dto.LoanResponse;
import io.hhplus.circulation.application.usecase.copy.GetCopyUseCase;
import io.hhplus.circulation.application.usecase.copy.RegisterCopyUseCase;
import io.hhplus.circulation.application.usecase.copy.ReportLostUseCase;
import io.hhplus.circulation.application.usecase.copy.RetireCopyUseCase;
import io.hhplus.circulation.application.usecase.loan.GetActiveLoanUseCase;
import io.hhplus.circulation.presentation.common.RequestContextResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import static io.hhplus.circulation.presentation.common.RequestContextResolver.*;

@Validated
@RestController
@RequestMapping("/api/copies")
@RequiredArgsConstructor
public class CopyController {

    // 조회 플로우: 엔진을 거치지 않음 (가용성은 캐시 적용)
    private final GetCopyUseCase getCopyUseCase;
    private final GetActiveLoanUseCase getActiveLoanUseCase;

    // 쓰기 플로우
    private final ReportLostUseCase reportLostUseCase;
    private final RetireCopyUseCase retireCopyUseCase;
    private final RegisterCopyUseCase registerCopyUseCase;

    private final RequestContextResolver contextResolver;

    @GetMapping("/{copyId}")
    public ResponseEntity<CopyResponse> getCopy(@PathVariable String copyId) {
        return ResponseEntity.ok(getCopyUseCase.execute(copyId));
    }

    @GetMapping("/{copyId}/active-loan")
    public ResponseEntity<LoanResponse> getActiveLoan(@PathVariable String copyId) {
        return ResponseEntity.ok(getActiveLoanUseCase.execute(copyId));
    }

    @PostMapping
    public ResponseEntity<CopyResponse> registerCopy(
            @RequestHeader(USER_ID) String userId,
            @RequestHeader(value = USER_ROLE, required = false) String role,
            @RequestHeader(value = CORRELATION_ID, required = false) String correlationId,
            @RequestHeader(value = REQUEST_TIMEOUT_MS, required = false) Long timeoutMs,
            @Valid @RequestBody RegisterCopyRequest request
    ) {
        CopyResponse response = registerCopyUseCase.execute(
                request, contextResolver.context(userId, role, correlationId, timeoutMs));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/{copyId}/lost")
    public ResponseEntity<LostReportResponse> reportLost(
            @RequestHeader(USER_ID) String userId,
            @RequestHeader(value = USER_ROLE, required = false) String role,
            @RequestHeader(value = CORRELATION_ID, required = false) String correlationId,
            @RequestHeader(value = REQUEST_TIMEOUT_MS, required = false) Long timeoutMs,
            @PathVariable String copyId,
            @Valid @RequestBody ReportLostRequest request
    ) {
        LostReportResponse response = reportLostUseCase.execute(
                copyId, request, contextResolver.context(userId, role, correlationId, timeoutMs));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{copyId}/retire")
    public ResponseEntity<CopyResponse> retireCopy(
            @RequestHeader(USER_ID) String userId,
            @RequestHeader(value = USER_ROLE, required = false) String role,
            @RequestHeader(value = CORRELATION_ID, required = false) String correlationId,
            @RequestHeader(value = REQUEST_TIMEOUT_MS, required = false) Long timeoutMs,
            @PathVariable String copyId,
            @Valid @RequestBody RetireCopyRequest request
    ) {
        CopyResponse response = retireCopyUseCase.execute(
                copyId, request, contextResolver.context(userId, role, correlationId, timeoutMs));
        return ResponseEntity.ok(response);
    }
}
