package io.hhplus.circulation.application.copy.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterCopyRequest(
    @NotBlank(message = "소장본 ID는 필수입니다")
    @Size(max = 50, message = "소장본 ID는 50자를 초과할 수 없습니다")
    String copyId,

    @NotBlank(message = "도서 ID는 필수입니다")
    @Size(max = 50, message = "도서 ID는 50자를 초과할 수 없습니다")
    String bookId
) {
}
