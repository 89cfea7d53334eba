package io.hhplus.circulation.infrastructure.external;

import io.hhplus.circulation.config.CirculationProperties;
import io.hhplus.circulation.domain.loan.LoanRepository;
import io.hhplus.circulation.domain.loan.LoanStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

/**
 * Mock 회원 서비스
 * <p>
 * 시뮬레이션 규칙:
 * - circulation.member.suspended-users에 포함된 회원: 정지 (active = false)
 * - ACTIVE 대출 수 < circulation.member.max-active-loans: 한도 이내
 * <p>
 * 한도 검사는 호출자(CheckoutUseCase)가 회원 락 안에서 수행한다.
 */
@Slf4j
@Service
@Profile("!prod")
@RequiredArgsConstructor
public class MockMemberClient implements MemberClient {

    private final LoanRepository loanRepository;
    private final CirculationProperties properties;

    @Override
    public MemberEligibility isEligible(String userId) {
        boolean active = !properties.getMember().getSuspendedUsers().contains(userId);
        long activeLoans = loanRepository.countByUserIdAndStatus(userId, LoanStatus.ACTIVE);
        boolean underLimit = activeLoans < properties.getMember().getMaxActiveLoans();

        log.debug("Mock 회원 자격 조회: userId={}, active={}, activeLoans={}", userId, active, activeLoans);
        return new MemberEligibility(active, underLimit, activeLoans);
    }
}
