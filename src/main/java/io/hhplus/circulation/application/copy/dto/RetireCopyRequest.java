package io.hhplus.circulation.application.copy.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RetireCopyRequest(
    @NotBlank(message = "멱등성 키는 필수입니다")
    @Size(max = 100, message = "멱등성 키는 100자를 초과할 수 없습니다")
    String idempotencyKey
) {
}
