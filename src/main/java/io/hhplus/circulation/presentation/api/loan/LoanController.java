package io.hhplus.circulation.presentation.api.loan;

import io.hhplus.circulation.application.loan.dto.*;
import io.hhplus.circulation.application.usecase.loan.*;
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
@RequestMapping("/api/loans")
@RequiredArgsConstructor
public class LoanController {

    // 쓰기 플로우: 멱등성 키 + 소장본 단위 락
    private final CheckoutUseCase checkoutUseCase;
    private final ReturnUseCase returnUseCase;
    private final RenewUseCase renewUseCase;

    // 조회 플로우
    private final ListLoansUseCase listLoansUseCase;
    private final GetLoanHistoryUseCase getLoanHistoryUseCase;

    private final RequestContextResolver contextResolver;

    /**
     * 대출 API
     *
     * 같은 idempotencyKey로 재요청하면 최초 결과가 그대로 반환된다. (201 + 같은 본문)
     */
    @PostMapping("/checkout")
    public ResponseEntity<LoanResponse> checkout(
            @RequestHeader(USER_ID) String userId,
            @RequestHeader(value = USER_ROLE, required = false) String role,
            @RequestHeader(value = CORRELATION_ID, required = false) String correlationId,
            @RequestHeader(value = REQUEST_TIMEOUT_MS, required = false) Long timeoutMs,
            @Valid @RequestBody CheckoutRequest request
    ) {
        LoanResponse response = checkoutUseCase.execute(
                request, contextResolver.context(userId, role, correlationId, timeoutMs));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/return")
    public ResponseEntity<ReturnReceipt> returnCopy(
            @RequestHeader(USER_ID) String userId,
            @RequestHeader(value = USER_ROLE, required = false) String role,
            @RequestHeader(value = CORRELATION_ID, required = false) String correlationId,
            @RequestHeader(value = REQUEST_TIMEOUT_MS, required = false) Long timeoutMs,
            @Valid @RequestBody ReturnRequest request
    ) {
        ReturnReceipt response = returnUseCase.execute(
                request, contextResolver.context(userId, role, correlationId, timeoutMs));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{loanId}/renew")
    public ResponseEntity<RenewalResponse> renew(
            @RequestHeader(USER_ID) String userId,
            @RequestHeader(value = USER_ROLE, required = false) String role,
            @RequestHeader(value = CORRELATION_ID, required = false) String correlationId,
            @RequestHeader(value = REQUEST_TIMEOUT_MS, required = false) Long timeoutMs,
            @PathVariable Long loanId,
            @Valid @RequestBody RenewRequest request
    ) {
        RenewalResponse response = renewUseCase.execute(
                loanId, request, contextResolver.context(userId, role, correlationId, timeoutMs));
        return ResponseEntity.ok(response);
    }

    @GetMapping
    public ResponseEntity<LoanListResponse> listLoans(
            @RequestHeader(USER_ID) String requesterId,
            @RequestHeader(value = USER_ROLE, required = false) String role,
            @RequestParam String userId
    ) {
        LoanListResponse response = listLoansUseCase.execute(userId, contextResolver.actor(requesterId, role));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{loanId}/history")
    public ResponseEntity<LoanHistoryResponse> getHistory(
            @RequestHeader(USER_ID) String userId,
            @RequestHeader(value = USER_ROLE, required = false) String role,
            @PathVariable Long loanId
    ) {
        LoanHistoryResponse response = getLoanHistoryUseCase.execute(loanId, contextResolver.actor(userId, role));
        return ResponseEntity.ok(response);
    }
}
