package io.hhplus.circulation.domain.idempotency;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 멱등성 레코드 (2단계 마커: IN_FLIGHT → COMPLETED)
 * <p>
 * - 클라이언트 제공 idempotencyKey + 작업 지문(fingerprint)으로 재시도 요청을 식별
 * - UNIQUE 제약으로 동시 요청 중 하나만 IN_FLIGHT 레코드를 만들 수 있음
 * - 엔진 트랜잭션 안에서 결과(responsePayload)와 미기록 감사 항목(pendingAudit)을 붙여
 *   커밋 이후 단계(감사 기록, 완료 처리)의 intent 역할을 함께 수행
 * <p>
 * 상태 전이(결과 첨부/완료/해제)는 IdempotencyRecordRepository의 조건부 쿼리로만 수행한다.
 */
@Entity
@Table(
    name = "idempotency_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_idempotency_records_key", columnNames = "idempotency_key")
    },
    indexes = {
        @Index(name = "idx_idempotency_records_status_created", columnList = "status, created_at"),
        @Index(name = "idx_idempotency_records_expires_at", columnList = "expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IdempotencyRecord {

    private static final int MAX_KEY_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "idempotency_key", nullable = false, length = MAX_KEY_LENGTH)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false, length = 20)
    private OperationType operationType;

    /**
     * 작업 종류 + 핵심 파라미터의 SHA-256 (hex)
     */
    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IdempotencyStatus status;

    /**
     * 처리 결과 (JSON). 엔진 트랜잭션 커밋과 함께 기록된다.
     */
    @Column(name = "response_payload", columnDefinition = "TEXT")
    private String responsePayload;

    /**
     * 아직 감사 로그에 기록되지 않은 항목 (JSON 배열). COMPLETED 시 비워진다.
     */
    @Column(name = "pending_audit", columnDefinition = "TEXT")
    private String pendingAudit;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public static IdempotencyRecord inFlight(String idempotencyKey,
                                             OperationType operationType,
                                             String fingerprint,
                                             LocalDateTime now,
                                             Duration retention) {
        validateIdempotencyKey(idempotencyKey);

        IdempotencyRecord record = new IdempotencyRecord();
        record.idempotencyKey = idempotencyKey;
        record.operationType = operationType;
        record.fingerprint = fingerprint;
        record.status = IdempotencyStatus.IN_FLIGHT;
        record.createdAt = now;
        record.expiresAt = now.plus(retention);
        return record;
    }

    /**
     * 보존 기간이 지난 키를 새 요청의 IN_FLIGHT 마커로 재사용
     */
    public void resetForReuse(OperationType operationType, String fingerprint, LocalDateTime now, Duration retention) {
        if (!isExpired(now)) {
            throw new BusinessException(
                ErrorCode.INTERNAL_SERVER_ERROR,
                "만료되지 않은 멱등성 키는 재사용할 수 없습니다: " + idempotencyKey
            );
        }
        this.operationType = operationType;
        this.fingerprint = fingerprint;
        this.status = IdempotencyStatus.IN_FLIGHT;
        this.responsePayload = null;
        this.pendingAudit = null;
        this.completedAt = null;
        this.createdAt = now;
        this.expiresAt = now.plus(retention);
    }

    public boolean isExpired(LocalDateTime now) {
        return now.isAfter(expiresAt);
    }

    public boolean isInFlight() {
        return status == IdempotencyStatus.IN_FLIGHT;
    }

    public boolean isCompleted() {
        return status == IdempotencyStatus.COMPLETED;
    }

    /**
     * 엔진 트랜잭션이 커밋되어 결과가 확정되었는지 (IN_FLIGHT여도 결과가 있으면 확정)
     */
    public boolean hasOutcome() {
        return responsePayload != null;
    }

    public boolean matches(OperationType operationType, String fingerprint) {
        return this.operationType == operationType && this.fingerprint.equals(fingerprint);
    }

    private static void validateIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "멱등성 키는 필수입니다");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "멱등성 키는 100자를 초과할 수 없습니다");
        }
    }
}
