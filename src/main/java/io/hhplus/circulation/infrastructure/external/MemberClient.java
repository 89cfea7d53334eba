package io.hhplus.circulation.infrastructure.external;

/**
 * 회원 서비스 인터페이스
 * <p>
 * 대출 자격(정지 여부, 대출 한도)만 조회한다. 인증/비밀번호 검증은 하지 않는다.
 */
public interface MemberClient {

    MemberEligibility isEligible(String userId);
}
