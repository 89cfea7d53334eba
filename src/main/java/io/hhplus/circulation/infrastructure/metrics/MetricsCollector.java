package io.hhplus.circulation.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 대출 엔진 메트릭 수집
 *
 * 수집 메트릭:
 * - circulation_transition_total{operation, status}: 전이 결과 (success, not_found, conflict, forbidden, timeout, internal ...)
 * - circulation_transition_duration_seconds{operation}: 전이 처리 시간 (P50, P95, P99)
 * - circulation_idempotency_total{outcome}: 멱등성 판정 (new, replayed, waited, mismatch, timeout)
 * - circulation_audit_gap_total: 감사 로그 누락 발생
 */
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;
    private final Counter auditGapCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.auditGapCounter = Counter.builder("circulation_audit_gap_total")
                .description("Committed transitions whose audit events could not be written")
                .register(meterRegistry);
    }

    // ============================================================
    // 상태 전이
    // ============================================================

    public void recordTransition(String operation, String status) {
        Counter.builder("circulation_transition_total")
                .tag("operation", operation)
                .tag("status", status)
                .description("Circulation state transitions by outcome")
                .register(meterRegistry)
                .increment();
    }

    public void recordTransitionDuration(String operation, long startNanos) {
        Timer.builder("circulation_transition_duration_seconds")
                .tag("operation", operation)
                .description("Circulation transition processing duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    // ============================================================
    // 멱등성
    // ============================================================

    public void recordIdempotency(String outcome) {
        Counter.builder("circulation_idempotency_total")
                .tag("outcome", outcome)
                .description("Idempotency coordinator decisions")
                .register(meterRegistry)
                .increment();
    }

    // ============================================================
    // 감사 로그
    // ============================================================

    public void recordAuditGap() {
        auditGapCounter.increment();
    }
}
