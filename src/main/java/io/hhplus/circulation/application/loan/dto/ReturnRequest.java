package io.hhplus.circulation.application.loan.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ReturnRequest(
    @NotBlank(message = "소장본 ID는 필수입니다")
    @Size(max = 50, message = "소장본 ID는 50자를 초과할 수 없습니다")
    String copyId,

    @NotBlank(message = "회원 ID는 필수입니다")
    @Size(max = 50, message = "회원 ID는 50자를 초과할 수 없습니다")
    String userId,

    @NotBlank(message = "멱등성 키는 필수입니다")
    @Size(max = 100, message = "멱등성 키는 100자를 초과할 수 없습니다")
    String idempotencyKey
) {
}
