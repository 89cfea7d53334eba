package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.application.common.Actor;
import io.hhplus.circulation.application.copy.dto.CopyResponse;
import io.hhplus.circulation.application.copy.dto.LostReportResponse;
import io.hhplus.circulation.application.idempotency.IdempotencyCoordinator;
import io.hhplus.circulation.application.idempotency.IdempotencyTicket;
import io.hhplus.circulation.application.loan.dto.LoanResponse;
import io.hhplus.circulation.application.loan.dto.RenewalResponse;
import io.hhplus.circulation.application.loan.dto.ReturnReceipt;
import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.config.CacheConfig;
import io.hhplus.circulation.config.CirculationProperties;
import io.hhplus.circulation.domain.audit.AuditEntityType;
import io.hhplus.circulation.domain.audit.AuditEntry;
import io.hhplus.circulation.domain.copy.Copy;
import io.hhplus.circulation.domain.copy.CopyStatus;
import io.hhplus.circulation.domain.idempotency.OperationType;
import io.hhplus.circulation.domain.loan.Loan;
import io.hhplus.circulation.domain.loan.LoanStatus;
import io.hhplus.circulation.infrastructure.lock.DistributedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 할당 엔진 (Allocation Engine)
 * <p>
 * 소장본 상태 머신: FREE(AVAILABLE) → HELD(LOANED) → FREE / UNAVAILABLE(LOST, RETIRED)
 * <p>
 * 모든 전이의 실행 순서:
 * <pre>
 * 1. 소장본 단위 분산락 획득 (@DistributedLock, 대기는 Deadline 이내)
 * 2. 트랜잭션 시작
 * 3. 사전 조건 검사 (소장본 존재, 상태, 대출 소유자)
 * 4. 두 원장 변경 (조건부 UPDATE, 하나라도 0건이면 예외 → 전체 롤백)
 * 5. 멱등성 레코드에 결과와 감사 항목 첨부 (같은 트랜잭션)
 * 6. 커밋 → 캐시 무효화 → 락 해제
 * </pre>
 * 방어 계층:
 * - 1차: 분산락 (같은 소장본 전이를 직렬화)
 * - 2차: 조건부 UPDATE (AVAILABLE일 때만 LOANED로)
 * - 3차: uk_loans_active_copy (소장본당 ACTIVE 대출 1건)
 * <p>
 * 감사 항목은 여기서 만들기만 하고, 기록은 커밋 이후 IdempotentExecutor가 수행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AllocationEngine {

    private final ResourceLedger resourceLedger;
    private final LoanLedger loanLedger;
    private final IdempotencyCoordinator idempotencyCoordinator;
    private final CirculationProperties properties;

    /**
     * 대출: FREE → HELD
     * <p>
     * 동시에 같은 소장본을 대출하면 락을 먼저 잡은 요청만 성공하고 나머지는 COPY_NOT_AVAILABLE.
     */
    @DistributedLock(key = "'copy:' + #command.copyId()")
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.COPY_AVAILABILITY, key = "#command.copyId()")
    public TransitionOutcome<LoanResponse> checkout(CheckoutCommand command, IdempotencyTicket ticket, Deadline deadline) {
        LocalDateTime now = LocalDateTime.now();
        Copy copy = resourceLedger.getCopy(command.copyId());
        if (!copy.isAvailable()) {
            log.warn("대출 불가 상태: copyId={}, status={}", copy.getCopyId(), copy.getStatus());
            throw new BusinessException(
                ErrorCode.COPY_NOT_AVAILABLE,
                String.format("대출 가능한 소장본이 아닙니다. copyId: %s, status: %s", copy.getCopyId(), copy.getStatus())
            );
        }

        Loan loan = loanLedger.createActiveLoan(
            command.copyId(),
            command.userId(),
            now,
            now.plus(properties.getLoan().getLoanPeriod())
        );
        resourceLedger.tryAllocate(command.copyId(), loan.getId());

        LoanResponse response = LoanResponse.from(loan);
        List<AuditEntry> entries = List.of(
            loanEntry(loan.getId(), OperationType.CHECKOUT, null, LoanStatus.ACTIVE, command.actor(), ticket, now),
            copyEntry(command.copyId(), OperationType.CHECKOUT, CopyStatus.AVAILABLE, CopyStatus.LOANED, command.actor(), ticket, now)
        );
        idempotencyCoordinator.attachOutcome(ticket, response, entries);

        log.info("대출 완료: copyId={}, loanId={}, userId={}, key={}",
            command.copyId(), loan.getId(), command.userId(), ticket.idempotencyKey());
        return TransitionOutcome.of(response, entries);
    }

    /**
     * 반납: HELD → FREE
     */
    @DistributedLock(key = "'copy:' + #command.copyId()")
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.COPY_AVAILABILITY, key = "#command.copyId()")
    public TransitionOutcome<ReturnReceipt> returnCopy(ReturnCommand command, IdempotencyTicket ticket, Deadline deadline) {
        LocalDateTime now = LocalDateTime.now();
        resourceLedger.getCopy(command.copyId());

        Loan active = requireActiveLoan(command.copyId());
        if (!active.isOwnedBy(command.userId()) && !command.actor().isAdmin()) {
            throw notOwner(active, command.userId());
        }

        Loan returned = loanLedger.completeReturn(active.getId(), now);
        resourceLedger.release(command.copyId(), active.getId());

        ReturnReceipt receipt = ReturnReceipt.from(returned);
        List<AuditEntry> entries = List.of(
            loanEntry(active.getId(), OperationType.RETURN, LoanStatus.ACTIVE, LoanStatus.RETURNED, command.actor(), ticket, now),
            copyEntry(command.copyId(), OperationType.RETURN, CopyStatus.LOANED, CopyStatus.AVAILABLE, command.actor(), ticket, now)
        );
        idempotencyCoordinator.attachOutcome(ticket, receipt, entries);

        log.info("반납 완료: copyId={}, loanId={}, overdue={}, key={}",
            command.copyId(), active.getId(), receipt.overdue(), ticket.idempotencyKey());
        return TransitionOutcome.of(receipt, entries);
    }

    /**
     * 연장: HELD → HELD (반납 예정일 + renewal-period, 연장 횟수 + 1)
     * <p>
     * 연체 중인 대출도 연장할 수 있다. 새 반납 예정일은 기존 반납 예정일 기준이다.
     */
    @DistributedLock(key = "'copy:' + #command.copyId()")
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.COPY_AVAILABILITY, key = "#command.copyId()")
    public TransitionOutcome<RenewalResponse> renew(RenewCommand command, IdempotencyTicket ticket, Deadline deadline) {
        LocalDateTime now = LocalDateTime.now();
        Loan loan = loanLedger.getLoan(command.loanId());
        if (!loan.getCopyId().equals(command.copyId())) {
            // 락 키와 대출 대상이 어긋나면 직렬화가 보장되지 않는다
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                String.format("대출과 소장본이 일치하지 않습니다. loanId: %d, copyId: %s", loan.getId(), command.copyId()));
        }
        if (!command.actor().canActFor(loan.getUserId())) {
            throw notOwner(loan, command.actor().userId());
        }

        int maxRenewals = properties.getLoan().getMaxRenewals();
        LocalDateTime previousDueAt = loan.getDueAt();
        LocalDateTime newDueAt = loan.nextDueAt(maxRenewals, properties.getLoan().getRenewalPeriod());
        Loan renewed = loanLedger.renew(loan.getId(), loan.getRenewalCount(), newDueAt, now);

        RenewalResponse response = RenewalResponse.of(previousDueAt, renewed, maxRenewals);
        List<AuditEntry> entries = List.of(
            loanEntry(loan.getId(), OperationType.RENEW, LoanStatus.ACTIVE, LoanStatus.ACTIVE, command.actor(), ticket, now)
        );
        idempotencyCoordinator.attachOutcome(ticket, response, entries);

        log.info("연장 완료: loanId={}, dueAt {} → {}, renewalCount={}, key={}",
            loan.getId(), previousDueAt, newDueAt, renewed.getRenewalCount(), ticket.idempotencyKey());
        return TransitionOutcome.of(response, entries);
    }

    /**
     * 분실 신고: HELD → UNAVAILABLE (소장본과 대출 모두 LOST)
     */
    @DistributedLock(key = "'copy:' + #command.copyId()")
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.COPY_AVAILABILITY, key = "#command.copyId()")
    public TransitionOutcome<LostReportResponse> reportLost(ReportLostCommand command, IdempotencyTicket ticket, Deadline deadline) {
        LocalDateTime now = LocalDateTime.now();
        resourceLedger.getCopy(command.copyId());

        Loan active = requireActiveLoan(command.copyId());
        if (!command.actor().canActFor(active.getUserId())) {
            throw notOwner(active, command.actor().userId());
        }

        Loan lost = loanLedger.markLost(active.getId(), now);
        resourceLedger.markLost(command.copyId(), active.getId());

        LostReportResponse response = new LostReportResponse(
            lost.getId(),
            lost.getCopyId(),
            lost.getUserId(),
            lost.getStatus().name(),
            CopyStatus.LOST.name(),
            now
        );
        List<AuditEntry> entries = List.of(
            loanEntry(active.getId(), OperationType.REPORT_LOST, LoanStatus.ACTIVE, LoanStatus.LOST, command.actor(), ticket, now),
            copyEntry(command.copyId(), OperationType.REPORT_LOST, CopyStatus.LOANED, CopyStatus.LOST, command.actor(), ticket, now)
        );
        idempotencyCoordinator.attachOutcome(ticket, response, entries);

        log.info("분실 처리 완료: copyId={}, loanId={}, key={}", command.copyId(), active.getId(), ticket.idempotencyKey());
        return TransitionOutcome.of(response, entries);
    }

    /**
     * 폐기: AVAILABLE 또는 LOST → RETIRED
     * <p>
     * 대출 중인 소장본은 폐기할 수 없다. (먼저 반납 또는 분실 처리)
     */
    @DistributedLock(key = "'copy:' + #command.copyId()")
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.COPY_AVAILABILITY, key = "#command.copyId()")
    public TransitionOutcome<CopyResponse> retire(RetireCommand command, IdempotencyTicket ticket, Deadline deadline) {
        LocalDateTime now = LocalDateTime.now();
        Copy copy = resourceLedger.getCopy(command.copyId());
        CopyStatus from = copy.getStatus();
        if (from != CopyStatus.AVAILABLE && from != CopyStatus.LOST) {
            throw new BusinessException(
                ErrorCode.INVALID_COPY_STATUS,
                String.format("대출 가능 또는 분실 상태의 소장본만 폐기할 수 있습니다. copyId: %s, status: %s", command.copyId(), from)
            );
        }

        resourceLedger.retire(command.copyId(), from);

        CopyResponse response = CopyResponse.from(resourceLedger.getCopy(command.copyId()));
        List<AuditEntry> entries = List.of(
            copyEntry(command.copyId(), OperationType.RETIRE, from, CopyStatus.RETIRED, command.actor(), ticket, now)
        );
        idempotencyCoordinator.attachOutcome(ticket, response, entries);

        log.info("폐기 완료: copyId={}, from={}, key={}", command.copyId(), from, ticket.idempotencyKey());
        return TransitionOutcome.of(response, entries);
    }

    /**
     * 소장본 등록: (없음) → AVAILABLE
     * <p>
     * 멱등성 키가 없는 관리 작업이다. 중복 등록은 COPY_ALREADY_REGISTERED.
     */
    @DistributedLock(key = "'copy:' + #command.copyId()")
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.COPY_AVAILABILITY, key = "#command.copyId()")
    public TransitionOutcome<CopyResponse> register(RegisterCopyCommand command, String correlationId, Deadline deadline) {
        Copy copy = resourceLedger.register(command.copyId(), command.bookId());

        AuditEntry entry = AuditEntry.of(
            AuditEntityType.COPY,
            command.copyId(),
            "REGISTER",
            null,
            CopyStatus.AVAILABLE.name(),
            command.actor().userId(),
            correlationId,
            LocalDateTime.now()
        );

        log.info("소장본 등록 완료: copyId={}, bookId={}", command.copyId(), command.bookId());
        return TransitionOutcome.of(CopyResponse.from(copy), List.of(entry));
    }

    private Loan requireActiveLoan(String copyId) {
        return loanLedger.findActiveByCopyId(copyId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.NO_ACTIVE_LOAN,
                "진행 중인 대출이 없습니다. copyId: " + copyId
            ));
    }

    private BusinessException notOwner(Loan loan, String userId) {
        log.warn("대출 소유자 불일치: loanId={}, owner={}, requester={}", loan.getId(), loan.getUserId(), userId);
        return new BusinessException(
            ErrorCode.NOT_LOAN_OWNER,
            String.format("본인의 대출만 처리할 수 있습니다. loanId: %d", loan.getId())
        );
    }

    private AuditEntry loanEntry(Long loanId, OperationType operation, LoanStatus from, LoanStatus to,
                                 Actor actor, IdempotencyTicket ticket, LocalDateTime at) {
        return AuditEntry.of(
            AuditEntityType.LOAN,
            String.valueOf(loanId),
            operation.name(),
            from == null ? null : from.name(),
            to.name(),
            actor.userId(),
            ticket.correlationId(),
            at
        );
    }

    private AuditEntry copyEntry(String copyId, OperationType operation, CopyStatus from, CopyStatus to,
                                 Actor actor, IdempotencyTicket ticket, LocalDateTime at) {
        return AuditEntry.of(
            AuditEntityType.COPY,
            copyId,
            operation.name(),
            from.name(),
            to.name(),
            actor.userId(),
            ticket.correlationId(),
            at
        );
    }
}
