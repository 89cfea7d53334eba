package io.hhplus.circulation.domain.audit;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 감사 로그 누락 기록
 * <p>
 * 상태 전이는 커밋되었지만 감사 이벤트 기록이 재시도 끝에 실패한 경우 저장한다.
 * AuditReconciliationScheduler가 주기적으로 재기록한다.
 * <p>
 * 상태:
 * - PENDING: 재기록 대기
 * - RETRYING: 재기록 중
 * - RESOLVED: 재기록 완료
 * - FAILED: 최종 실패 (수동 확인 필요)
 */
@Entity
@Table(name = "audit_gaps", indexes = {
    @Index(name = "idx_audit_gaps_status_next_retry", columnList = "status, next_retry_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditGap {

    private static final int MAX_RETRY_COUNT = 5;
    static final int MAX_CORRELATION_ID_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "correlation_id", length = MAX_CORRELATION_ID_LENGTH)
    private String correlationId;

    /**
     * 누락된 AuditEntry 목록 (JSON 배열)
     */
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuditGapStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    public static AuditGap create(String correlationId, String payload, String errorMessage) {
        LocalDateTime now = LocalDateTime.now();

        AuditGap gap = new AuditGap();
        gap.correlationId = fitCorrelationId(correlationId);
        gap.payload = payload;
        gap.errorMessage = errorMessage;
        gap.status = AuditGapStatus.PENDING;
        gap.retryCount = 0;
        gap.createdAt = now;
        gap.updatedAt = now;
        gap.nextRetryAt = now.plusMinutes(1);
        return gap;
    }

    /**
     * 누락 기록 자체가 컬럼 길이로 실패하면 안 되므로 잘라서 저장한다.
     */
    static String fitCorrelationId(String correlationId) {
        if (correlationId == null || correlationId.length() <= MAX_CORRELATION_ID_LENGTH) {
            return correlationId;
        }
        return correlationId.substring(0, MAX_CORRELATION_ID_LENGTH);
    }

    public void startRetry() {
        if (this.status != AuditGapStatus.PENDING) {
            throw new IllegalStateException("재기록 가능한 상태가 아닙니다: " + this.status);
        }
        this.status = AuditGapStatus.RETRYING;
        this.retryCount++;
        this.updatedAt = LocalDateTime.now();
    }

    public void markResolved() {
        this.status = AuditGapStatus.RESOLVED;
        this.updatedAt = LocalDateTime.now();
        this.nextRetryAt = null;
    }

    public void markRetryFailed(String errorMessage) {
        this.errorMessage = errorMessage;
        this.updatedAt = LocalDateTime.now();

        if (this.retryCount >= MAX_RETRY_COUNT) {
            this.status = AuditGapStatus.FAILED;
            this.nextRetryAt = null;
        } else {
            this.status = AuditGapStatus.PENDING;
            // 1, 2, 4, 8분
            long delayMinutes = (long) Math.pow(2, this.retryCount - 1);
            this.nextRetryAt = LocalDateTime.now().plusMinutes(delayMinutes);
        }
    }

    public boolean canRetry(LocalDateTime now) {
        return this.status == AuditGapStatus.PENDING
            && this.retryCount < MAX_RETRY_COUNT
            && this.nextRetryAt != null
            && !now.isBefore(this.nextRetryAt);
    }

    public enum AuditGapStatus {
        PENDING,
        RETRYING,
        RESOLVED,
        FAILED
    }
}
