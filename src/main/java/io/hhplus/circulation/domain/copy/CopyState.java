package io.hhplus.circulation.domain.copy;

/**
 * 할당 엔진 관점의 소장본 상태
 * <p>
 * Copy.status와 현재 대출 상태로부터 파생된다.
 * - FREE: AVAILABLE, 진행 중 대출 없음
 * - HELD: LOANED, ACTIVE 대출 1건
 * - UNAVAILABLE: LOST / RETIRED
 */
public enum CopyState {
    FREE,
    HELD,
    UNAVAILABLE;

    public static CopyState of(CopyStatus status) {
        return switch (status) {
            case AVAILABLE -> FREE;
            case LOANED -> HELD;
            case LOST, RETIRED -> UNAVAILABLE;
        };
    }
}
