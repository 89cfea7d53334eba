package io.hhplus.circulation.infrastructure.batch;

import io.hhplus.circulation.application.circulation.AllocationEngine;
import io.hhplus.circulation.application.circulation.CheckoutCommand;
import io.hhplus.circulation.application.circulation.TransitionOutcome;
import io.hhplus.circulation.application.common.Actor;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.application.idempotency.IdempotencyCoordinator;
import io.hhplus.circulation.application.idempotency.IdempotencyDecision;
import io.hhplus.circulation.application.idempotency.IdempotencyTicket;
import io.hhplus.circulation.application.idempotency.IdempotentRequest;
import io.hhplus.circulation.application.loan.dto.CheckoutRequest;
import io.hhplus.circulation.application.loan.dto.LoanResponse;
import io.hhplus.circulation.application.usecase.loan.CheckoutUseCase;
import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.domain.audit.AuditEntityType;
import io.hhplus.circulation.domain.audit.AuditEventRepository;
import io.hhplus.circulation.domain.copy.Copy;
import io.hhplus.circulation.domain.copy.CopyRepository;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecord;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecordRepository;
import io.hhplus.circulation.domain.idempotency.IdempotencyStatus;
import io.hhplus.circulation.domain.idempotency.OperationType;
import io.hhplus.circulation.domain.loan.LoanRepository;
import io.hhplus.circulation.domain.loan.LoanStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 멱등성 레코드 복구 스윕 테스트
 * <p>
 * 프로세스가 중간에 멈춘 상황을 UseCase 대신 조정자와 엔진을 직접 호출해 재현한다.
 */
@SpringBootTest
@ActiveProfiles("test")
class IdempotencyRecoverySchedulerTest {

    @Autowired
    private IdempotencyRecoveryScheduler recoveryScheduler;

    @Autowired
    private IdempotencyCoordinator idempotencyCoordinator;

    @Autowired
    private AllocationEngine allocationEngine;

    @Autowired
    private CheckoutUseCase checkoutUseCase;

    @Autowired
    private IdempotencyRecordRepository recordRepository;

    @Autowired
    private AuditEventRepository auditEventRepository;

    @Autowired
    private CopyRepository copyRepository;

    @Autowired
    private LoanRepository loanRepository;

    private String copyId;
    private String userId;
    private String idempotencyKey;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        copyId = "S-" + suffix;
        userId = "SU-" + suffix;
        idempotencyKey = "sweep-" + suffix;
        copyRepository.save(Copy.register(copyId, "B-400"));
    }

    private IdempotentRequest checkoutRequest(Deadline deadline) {
        return IdempotentRequest.of(idempotencyKey, OperationType.CHECKOUT, idempotencyKey, deadline, copyId, userId);
    }

    private CallContext context() {
        return new CallContext(Actor.member(userId), null, Deadline.after(Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("결과가 첨부된 채 멈춘 요청 - 감사 기록 후 COMPLETED, 같은 키 재시도는 기존 대출 반환")
    void 전이커밋후_중단() {
        // Given: 전이는 커밋되었으나 감사 기록과 완료 처리 전에 중단
        Deadline deadline = Deadline.after(Duration.ofSeconds(5));
        IdempotencyDecision decision = idempotencyCoordinator.begin(checkoutRequest(deadline));
        assertThat(decision.is(IdempotencyDecision.Outcome.NEW)).isTrue();

        TransitionOutcome<LoanResponse> outcome = allocationEngine.checkout(
            new CheckoutCommand(copyId, userId, Actor.member(userId)),
            new IdempotencyTicket(decision.recordId(), idempotencyKey, idempotencyKey),
            deadline
        );
        Long loanId = outcome.result().loanId();
        assertThat(auditEventRepository.countByEntityTypeAndEntityId(AuditEntityType.LOAN, String.valueOf(loanId))).isZero();

        // When
        IdempotencyRecoveryScheduler.SweepResult result = recoveryScheduler.sweep(LocalDateTime.now().plusMinutes(5));

        // Then
        assertThat(result.completed()).isGreaterThanOrEqualTo(1);
        IdempotencyRecord record = recordRepository.findByIdempotencyKey(idempotencyKey).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(IdempotencyStatus.COMPLETED);
        assertThat(auditEventRepository.countByEntityTypeAndEntityId(AuditEntityType.LOAN, String.valueOf(loanId))).isEqualTo(1);
        assertThat(auditEventRepository.countByEntityTypeAndEntityId(AuditEntityType.COPY, copyId)).isEqualTo(1);

        LoanResponse replayed = checkoutUseCase.execute(new CheckoutRequest(copyId, userId, idempotencyKey), context());
        assertThat(replayed.loanId()).isEqualTo(loanId);
        assertThat(loanRepository.countByCopyIdAndStatus(copyId, LoanStatus.ACTIVE)).isEqualTo(1);
    }

    @Test
    @DisplayName("결과 없이 멈춘 요청 - 레코드 삭제, 같은 키로 새로 실행")
    void 전이전_중단() {
        // Given: IN_FLIGHT 레코드만 남기고 중단
        IdempotencyDecision decision = idempotencyCoordinator.begin(checkoutRequest(Deadline.after(Duration.ofSeconds(5))));
        assertThat(decision.is(IdempotencyDecision.Outcome.NEW)).isTrue();

        // When
        IdempotencyRecoveryScheduler.SweepResult result = recoveryScheduler.sweep(LocalDateTime.now().plusMinutes(5));

        // Then
        assertThat(result.released()).isGreaterThanOrEqualTo(1);
        assertThat(recordRepository.findByIdempotencyKey(idempotencyKey)).isEmpty();

        LoanResponse loan = checkoutUseCase.execute(new CheckoutRequest(copyId, userId, idempotencyKey), context());
        assertThat(loan.status()).isEqualTo("ACTIVE");
        assertThat(recordRepository.findByIdempotencyKey(idempotencyKey).orElseThrow().getStatus())
            .isEqualTo(IdempotencyStatus.COMPLETED);
    }

    @Test
    @DisplayName("stale-after 이전의 IN_FLIGHT 요청 - 건드리지 않음")
    void 진행중요청_유지() {
        // Given
        idempotencyCoordinator.begin(checkoutRequest(Deadline.after(Duration.ofSeconds(5))));

        // When
        recoveryScheduler.sweep(LocalDateTime.now());

        // Then
        assertThat(recordRepository.findByIdempotencyKey(idempotencyKey).orElseThrow().getStatus())
            .isEqualTo(IdempotencyStatus.IN_FLIGHT);
    }

    @Test
    @DisplayName("보존 기간이 지난 레코드 - 삭제")
    void 만료레코드_삭제() {
        // Given
        checkoutUseCase.execute(new CheckoutRequest(copyId, userId, idempotencyKey), context());

        // When
        IdempotencyRecoveryScheduler.SweepResult result = recoveryScheduler.sweep(LocalDateTime.now().plusDays(2));

        // Then
        assertThat(result.purged()).isGreaterThanOrEqualTo(1);
        assertThat(recordRepository.findByIdempotencyKey(idempotencyKey)).isEmpty();
    }
}
