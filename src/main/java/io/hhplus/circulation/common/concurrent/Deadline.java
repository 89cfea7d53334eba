package io.hhplus.circulation.common.concurrent;

import java.time.Duration;

/**
 * 호출자가 지정한 처리 마감 시각
 * <p>
 * 락 대기와 멱등성 대기(IN_FLIGHT 폴링)는 모두 이 마감 시각을 넘지 않는다.
 * System.nanoTime 기반이므로 벽시계 변경에 영향받지 않는다.
 */
public final class Deadline {

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be zero or positive: " + timeout);
        }
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    public Duration remaining() {
        long remaining = deadlineNanos - System.nanoTime();
        return remaining > 0 ? Duration.ofNanos(remaining) : Duration.ZERO;
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * 설정된 대기 시간과 남은 시간 중 짧은 쪽
     */
    public Duration cap(Duration waitTime) {
        Duration remaining = remaining();
        return waitTime.compareTo(remaining) <= 0 ? waitTime : remaining;
    }

    @Override
    public String toString() {
        return "Deadline[remaining=" + remaining().toMillis() + "ms]";
    }
}
