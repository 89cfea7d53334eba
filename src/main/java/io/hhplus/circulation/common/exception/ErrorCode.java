package io.hhplus.circulation.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 소장본 관련 (CP)
    // ====================================
    COPY_NOT_FOUND("CP001", "소장본을 찾을 수 없습니다", ErrorType.NOT_FOUND),
    COPY_NOT_AVAILABLE("CP002", "대출 가능한 소장본이 아닙니다", ErrorType.CONFLICT),
    COPY_ALREADY_REGISTERED("CP003", "이미 등록된 소장본입니다", ErrorType.CONFLICT),
    INVALID_COPY_STATUS("CP004", "소장본 상태가 올바르지 않습니다", ErrorType.CONFLICT),

    // ====================================
    // 대출 관련 (L)
    // ====================================
    LOAN_NOT_FOUND("L001", "대출 기록을 찾을 수 없습니다", ErrorType.NOT_FOUND),
    NO_ACTIVE_LOAN("L002", "진행 중인 대출이 없습니다", ErrorType.CONFLICT),
    LOAN_NOT_ACTIVE("L003", "진행 중인 대출이 아닙니다", ErrorType.CONFLICT),
    RENEWAL_LIMIT_EXCEEDED("L004", "연장 가능 횟수를 초과했습니다", ErrorType.CONFLICT),
    NOT_LOAN_OWNER("L005", "본인의 대출만 처리할 수 있습니다", ErrorType.FORBIDDEN),

    // ====================================
    // 회원 관련 (M)
    // ====================================
    MEMBER_INACTIVE("M001", "대출이 정지된 회원입니다", ErrorType.FORBIDDEN),
    LOAN_LIMIT_EXCEEDED("M002", "대출 가능 권수를 초과했습니다", ErrorType.FORBIDDEN),
    ACTOR_MISMATCH("M003", "다른 회원을 대신해 요청할 수 없습니다", ErrorType.FORBIDDEN),
    ADMIN_ONLY("M004", "관리자만 요청할 수 있습니다", ErrorType.FORBIDDEN),

    // ====================================
    // 멱등성 / 동시성 관련 (I)
    // ====================================
    IDEMPOTENCY_KEY_MISMATCH("I001", "다른 요청에 이미 사용된 멱등성 키입니다", ErrorType.CONFLICT),
    IDEMPOTENCY_WAIT_TIMEOUT("I002", "동일한 요청이 아직 처리 중입니다. 같은 키로 다시 시도해주세요", ErrorType.TIMEOUT),
    LOCK_WAIT_TIMEOUT("I003", "다른 요청이 처리 중입니다. 잠시 후 다시 시도해주세요", ErrorType.TIMEOUT),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INTERNAL_SERVER_ERROR("COMMON001", "서버 내부 오류가 발생했습니다", ErrorType.INTERNAL),
    INVALID_INPUT("COMMON002", "입력값이 올바르지 않습니다", ErrorType.INVALID_INPUT);

    private final String code;
    private final String message;
    private final ErrorType type;
}
