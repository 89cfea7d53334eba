package io.hhplus.circulation.application.usecase.loan;

import io.hhplus.circulation.application.circulation.LoanLedger;
import io.hhplus.circulation.application.common.Actor;
import io.hhplus.circulation.application.loan.dto.LoanListResponse;
import io.hhplus.circulation.application.loan.dto.LoanResponse;
import io.hhplus.circulation.application.usecase.UseCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 회원별 대출 목록 (최근 대출 순)
 * <p>
 * 읽기 경로: 멱등성, 락 없음
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ListLoansUseCase {

    private final LoanLedger loanLedger;

    public LoanListResponse execute(String userId, Actor actor) {
        actor.requireSelfOrAdmin(userId);
        log.debug("대출 목록 조회: userId={}", userId);

        List<LoanResponse> loans = loanLedger.listByUser(userId).stream()
            .map(LoanResponse::from)
            .toList();
        return LoanListResponse.of(userId, loans);
    }
}
