package io.hhplus.circulation.application.loan.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CheckoutRequest(
    @NotBlank(message = "소장본 ID는 필수입니다")
    @Size(max = 50, message = "소장본 ID는 50자를 초과할 수 없습니다")
    String copyId,

    @NotBlank(message = "회원 ID는 필수입니다")
    @Size(max = 50, message = "회원 ID는 50자를 초과할 수 없습니다")
    String userId,

    /**
     * 멱등성 키 (클라이언트가 UUID 등으로 생성)
     * - 같은 키 + 같은 요청: 최초 결과 그대로 반환
     * - 같은 키 + 다른 요청: 409 Conflict
     */
    @NotBlank(message = "멱등성 키는 필수입니다")
    @Size(max = 100, message = "멱등성 키는 100자를 초과할 수 없습니다")
    String idempotencyKey
) {
}
