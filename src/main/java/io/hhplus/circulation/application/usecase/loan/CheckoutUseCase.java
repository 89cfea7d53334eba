package io.hhplus.circulation.application.usecase.loan;

import io.hhplus.circulation.application.circulation.AllocationEngine;
import io.hhplus.circulation.application.circulation.CheckoutCommand;
import io.hhplus.circulation.application.circulation.MemberLoanGate;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.application.idempotency.IdempotentExecutor;
import io.hhplus.circulation.application.idempotency.IdempotentRequest;
import io.hhplus.circulation.application.loan.dto.CheckoutRequest;
import io.hhplus.circulation.application.loan.dto.LoanResponse;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.idempotency.OperationType;
import io.hhplus.circulation.infrastructure.external.MemberClient;
import io.hhplus.circulation.infrastructure.external.MemberEligibility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 대출 UseCase
 * <p>
 * 1. 요청자 확인 (회원은 본인 명의로만 대출)
 * 2. 멱등성 판정 (같은 키 재요청은 최초 결과 반환)
 * 3. NEW일 때만 회원 락 안에서 자격 확인 후 할당 엔진 호출
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class CheckoutUseCase {

    private final AllocationEngine allocationEngine;
    private final MemberLoanGate memberLoanGate;
    private final IdempotentExecutor idempotentExecutor;
    private final MemberClient memberClient;

    public LoanResponse execute(CheckoutRequest request, CallContext context) {
        context.actor().requireSelfOrAdmin(request.userId());

        IdempotentRequest idempotentRequest = IdempotentRequest.of(
            request.idempotencyKey(),
            OperationType.CHECKOUT,
            context.correlationIdOr(request.idempotencyKey()),
            context.deadline(),
            request.copyId(),
            request.userId()
        );

        return idempotentExecutor.execute(idempotentRequest, LoanResponse.class, ticket ->
            memberLoanGate.withMemberLock(request.userId(), context.deadline(), () -> {
                verifyEligibility(request.userId());
                return allocationEngine.checkout(
                    new CheckoutCommand(request.copyId(), request.userId(), context.actor()),
                    ticket,
                    context.deadline()
                );
            })
        );
    }

    private void verifyEligibility(String userId) {
        MemberEligibility eligibility = memberClient.isEligible(userId);
        if (!eligibility.active()) {
            log.warn("정지 회원 대출 시도: userId={}", userId);
            throw new BusinessException(ErrorCode.MEMBER_INACTIVE, "대출이 정지된 회원입니다. userId: " + userId);
        }
        if (!eligibility.underLoanLimit()) {
            log.warn("대출 한도 초과: userId={}, activeLoans={}", userId, eligibility.activeLoanCount());
            throw new BusinessException(
                ErrorCode.LOAN_LIMIT_EXCEEDED,
                String.format("대출 가능 권수를 초과했습니다. userId: %s, 현재 %d권", userId, eligibility.activeLoanCount())
            );
        }
    }
}
