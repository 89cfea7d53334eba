package io.hhplus.circulation.domain.idempotency;

/**
 * 멱등성 키 처리 상태
 * <p>
 * IN_FLIGHT: 처리 중 (결과 미확정)
 * COMPLETED: 처리 완료 (결과 캐싱, 이후 불변)
 * <p>
 * 실패한 요청은 별도 상태로 남기지 않고 레코드를 제거해 같은 키로 재시도할 수 있게 한다.
 */
public enum IdempotencyStatus {
    IN_FLIGHT,
    COMPLETED
}
