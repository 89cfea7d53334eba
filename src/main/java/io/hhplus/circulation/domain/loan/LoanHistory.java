package io.hhplus.circulation.domain.loan;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 대출 원장 항목 (append-only)
 * <p>
 * 대출 생성/연장/반납/분실 시점의 스냅샷을 한 행씩 추가한다.
 * 수정/삭제하지 않으며, 대출별 최신 항목이 loans 테이블의 현재 상태와 일치한다.
 */
@Entity
@Table(
    name = "loan_history",
    indexes = {
        @Index(name = "idx_loan_history_loan_id", columnList = "loan_id"),
        @Index(name = "idx_loan_history_copy_id", columnList = "copy_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoanHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private Long loanId;

    @Column(name = "copy_id", nullable = false, updatable = false, length = 50)
    private String copyId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 50)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 20)
    private LoanEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private LoanStatus status;

    @Column(name = "due_at", nullable = false, updatable = false)
    private LocalDateTime dueAt;

    @Column(name = "renewal_count", nullable = false, updatable = false)
    private int renewalCount;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime occurredAt;

    public static LoanHistory of(Loan loan, LoanEventType eventType, LocalDateTime occurredAt) {
        LoanHistory history = new LoanHistory();
        history.loanId = loan.getId();
        history.copyId = loan.getCopyId();
        history.userId = loan.getUserId();
        history.eventType = eventType;
        history.status = loan.getStatus();
        history.dueAt = loan.getDueAt();
        history.renewalCount = loan.getRenewalCount();
        history.occurredAt = occurredAt;
        return history;
    }
}
