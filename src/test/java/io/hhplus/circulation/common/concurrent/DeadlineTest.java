package io.hhplus.circulation.common.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class DeadlineTest {

    @Test
    @DisplayName("남은 시간은 설정한 시간을 넘지 않음")
    void remaining() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(5));

        assertThat(deadline.remaining()).isLessThanOrEqualTo(Duration.ofSeconds(5));
        assertThat(deadline.isExpired()).isFalse();
    }

    @Test
    @DisplayName("0초 마감 - 즉시 만료, 남은 시간 0")
    void zero() {
        Deadline deadline = Deadline.after(Duration.ZERO);

        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("대기 시간 제한 - 설정값과 남은 시간 중 짧은 쪽")
    void cap() {
        Deadline deadline = Deadline.after(Duration.ofMillis(200));

        assertThat(deadline.cap(Duration.ofSeconds(3))).isLessThanOrEqualTo(Duration.ofMillis(200));
        assertThat(deadline.cap(Duration.ofMillis(10))).isEqualTo(Duration.ofMillis(10));
    }

    @Test
    @DisplayName("음수 시간으로 생성 불가")
    void negative() {
        assertThatThrownBy(() -> Deadline.after(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
