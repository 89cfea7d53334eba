package io.hhplus.circulation.domain.idempotency;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class IdempotencyRecordTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 10, 0);
    private static final Duration RETENTION = Duration.ofHours(24);

    @Test
    @DisplayName("IN_FLIGHT 생성 - 결과 없음, 보존 기간 후 만료")
    void inFlight_생성() {
        // When
        IdempotencyRecord record = IdempotencyRecord.inFlight("K1", OperationType.CHECKOUT, "fp", NOW, RETENTION);

        // Then
        assertThat(record.isInFlight()).isTrue();
        assertThat(record.hasOutcome()).isFalse();
        assertThat(record.getExpiresAt()).isEqualTo(NOW.plusHours(24));
        assertThat(record.isExpired(NOW.plusHours(23))).isFalse();
        assertThat(record.isExpired(NOW.plusHours(25))).isTrue();
    }

    @Test
    @DisplayName("IN_FLIGHT 생성 실패 - 키 100자 초과")
    void inFlight_키길이초과_예외발생() {
        assertThatThrownBy(() -> IdempotencyRecord.inFlight("K".repeat(101), OperationType.CHECKOUT, "fp", NOW, RETENTION))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("지문 비교 - 작업 유형과 지문이 모두 같아야 일치")
    void matches() {
        IdempotencyRecord record = IdempotencyRecord.inFlight("K1", OperationType.CHECKOUT, "fp", NOW, RETENTION);

        assertThat(record.matches(OperationType.CHECKOUT, "fp")).isTrue();
        assertThat(record.matches(OperationType.CHECKOUT, "other")).isFalse();
        assertThat(record.matches(OperationType.RETURN, "fp")).isFalse();
    }

    @Test
    @DisplayName("만료된 키 재사용 - 새 IN_FLIGHT로 초기화")
    void resetForReuse_만료키() {
        // Given
        IdempotencyRecord record = IdempotencyRecord.inFlight("K1", OperationType.CHECKOUT, "fp", NOW, RETENTION);
        ReflectionTestUtils.setField(record, "status", IdempotencyStatus.COMPLETED);
        ReflectionTestUtils.setField(record, "responsePayload", "{}");
        LocalDateTime later = NOW.plusDays(2);

        // When
        record.resetForReuse(OperationType.RETURN, "fp2", later, RETENTION);

        // Then
        assertThat(record.isInFlight()).isTrue();
        assertThat(record.hasOutcome()).isFalse();
        assertThat(record.matches(OperationType.RETURN, "fp2")).isTrue();
        assertThat(record.getExpiresAt()).isEqualTo(later.plusHours(24));
    }

    @Test
    @DisplayName("만료되지 않은 키는 재사용 불가")
    void resetForReuse_미만료_예외발생() {
        IdempotencyRecord record = IdempotencyRecord.inFlight("K1", OperationType.CHECKOUT, "fp", NOW, RETENTION);

        assertThatThrownBy(() -> record.resetForReuse(OperationType.CHECKOUT, "fp", NOW.plusHours(1), RETENTION))
            .isInstanceOf(BusinessException.class);
    }
}
