package io.hhplus.circulation.domain.loan;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 대출 (1회의 대출 에피소드)
 * <p>
 * loans 테이블은 대출의 "현재 상태" 뷰이고, 모든 상태 변화는 loan_history에 추가 기록된다.
 * <p>
 * 소장본당 ACTIVE 대출 1건 불변식은 DB 제약으로 강제한다.
 * - activeCopyId: ACTIVE일 때만 copyId, 종료되면 NULL
 * - UNIQUE(active_copy_id): NULL은 중복 허용이므로 "copy_id별 ACTIVE 1건" 부분 유니크 인덱스와 동일
 * - 애플리케이션 검사와 별개로 동작하는 마지막 방어선
 */
@Entity
@Table(
    name = "loans",
    uniqueConstraints = {
        @UniqueConstraint(name = Loan.ACTIVE_COPY_CONSTRAINT, columnNames = "active_copy_id")
    },
    indexes = {
        @Index(name = "idx_loans_copy_id", columnList = "copy_id"),
        @Index(name = "idx_loans_user_status", columnList = "user_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Loan extends BaseTimeEntity {

    public static final String ACTIVE_COPY_CONSTRAINT = "uk_loans_active_copy";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "copy_id", nullable = false, length = 50)
    private String copyId;

    @Column(name = "user_id", nullable = false, length = 50)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LoanStatus status;

    @Column(name = "active_copy_id", length = 50)
    private String activeCopyId;

    @Column(name = "checked_out_at", nullable = false)
    private LocalDateTime checkedOutAt;

    @Column(name = "due_at", nullable = false)
    private LocalDateTime dueAt;

    @Column(name = "returned_at")
    private LocalDateTime returnedAt;

    @Column(name = "renewal_count", nullable = false)
    private int renewalCount;

    public static Loan createActive(String copyId, String userId, LocalDateTime checkedOutAt, LocalDateTime dueAt) {
        if (copyId == null || copyId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "소장본 ID는 필수입니다");
        }
        if (userId == null || userId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "회원 ID는 필수입니다");
        }
        if (dueAt == null || !dueAt.isAfter(checkedOutAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "반납 예정일은 대출 시각 이후여야 합니다");
        }

        Loan loan = new Loan();
        loan.copyId = copyId;
        loan.userId = userId;
        loan.status = LoanStatus.ACTIVE;
        loan.activeCopyId = copyId;
        loan.checkedOutAt = checkedOutAt;
        loan.dueAt = dueAt;
        loan.renewalCount = 0;
        return loan;
    }

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }

    public boolean isOwnedBy(String userId) {
        return this.userId.equals(userId);
    }

    public boolean isOverdue(LocalDateTime at) {
        return at.isAfter(dueAt);
    }

    /**
     * 연장 후 반납 예정일 계산 (상태 변경 없음)
     * <p>
     * 실제 연장은 LoanRepository.extendDue()의 조건부 UPDATE로 반영된다.
     */
    public LocalDateTime nextDueAt(int maxRenewals, Duration renewalPeriod) {
        if (!isActive()) {
            throw new BusinessException(
                ErrorCode.LOAN_NOT_ACTIVE,
                "진행 중인 대출만 연장할 수 있습니다. 현재 상태: " + status
            );
        }
        if (renewalCount >= maxRenewals) {
            throw new BusinessException(
                ErrorCode.RENEWAL_LIMIT_EXCEEDED,
                String.format("연장 가능 횟수를 초과했습니다. (최대 %d회, 현재 %d회)", maxRenewals, renewalCount)
            );
        }
        return dueAt.plus(renewalPeriod);
    }
}
