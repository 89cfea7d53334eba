package io.hhplus.circulation.application.usecase.loan;

import io.hhplus.circulation.application.common.Actor;
import io.hhplus.circulation.application.common.CallContext;
import io.hhplus.circulation.application.loan.dto.*;
import io.hhplus.circulation.common.concurrent.Deadline;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.audit.AuditEntityType;
import io.hhplus.circulation.domain.audit.AuditEvent;
import io.hhplus.circulation.domain.audit.AuditEventRepository;
import io.hhplus.circulation.domain.copy.Copy;
import io.hhplus.circulation.domain.copy.CopyRepository;
import io.hhplus.circulation.domain.copy.CopyStatus;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecordRepository;
import io.hhplus.circulation.domain.idempotency.IdempotencyStatus;
import io.hhplus.circulation.domain.loan.LoanRepository;
import io.hhplus.circulation.domain.loan.LoanStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * 대출/반납 시나리오 통합 테스트
 * <p>
 * B: 같은 키 재시도 → 최초 대출 반환, 대출 1건
 * C: 반납 → 대출 RETURNED, 소장본 AVAILABLE, 대출/소장본 감사 이벤트 각 1건
 * D: 반납 재요청(새 키) → Conflict(진행 중인 대출 없음)
 * E: 존재하지 않는 소장본 대출 → NotFound
 */
@SpringBootTest
@ActiveProfiles("test")
class CirculationScenarioTest {

    @Autowired
    private CheckoutUseCase checkoutUseCase;

    @Autowired
    private ReturnUseCase returnUseCase;

    @Autowired
    private GetActiveLoanUseCase getActiveLoanUseCase;

    @Autowired
    private ListLoansUseCase listLoansUseCase;

    @Autowired
    private CopyRepository copyRepository;

    @Autowired
    private LoanRepository loanRepository;

    @Autowired
    private AuditEventRepository auditEventRepository;

    @Autowired
    private IdempotencyRecordRepository idempotencyRecordRepository;

    private String copyId;
    private String userId;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        copyId = "C7-" + suffix;
        userId = "U1-" + suffix;
        copyRepository.save(Copy.register(copyId, "B-700"));
    }

    private CallContext memberContext(String userId) {
        return new CallContext(Actor.member(userId), null, Deadline.after(Duration.ofSeconds(5)));
    }

    private String key(String name) {
        return name + "-" + copyId;
    }

    @Test
    @DisplayName("시나리오 B - 같은 키로 재시도하면 최초 대출이 그대로 반환되고 대출은 1건")
    void 같은키_재시도() {
        // Given
        LoanResponse first = checkoutUseCase.execute(new CheckoutRequest(copyId, userId, key("K1")), memberContext(userId));

        // When
        LoanResponse retried = checkoutUseCase.execute(new CheckoutRequest(copyId, userId, key("K1")), memberContext(userId));

        // Then
        assertThat(retried).isEqualTo(first);
        assertThat(loanRepository.countByCopyIdAndStatus(copyId, LoanStatus.ACTIVE)).isEqualTo(1);
        assertThat(idempotencyRecordRepository.countByIdempotencyKey(key("K1"))).isEqualTo(1);
        assertThat(idempotencyRecordRepository.findByIdempotencyKey(key("K1")))
            .get()
            .extracting("status")
            .isEqualTo(IdempotencyStatus.COMPLETED);
    }

    @Test
    @DisplayName("시나리오 C - 반납하면 대출 RETURNED, 소장본 AVAILABLE, 감사 이벤트 대출/소장본 각 1건")
    void 반납() {
        // Given
        LoanResponse loan = checkoutUseCase.execute(new CheckoutRequest(copyId, userId, key("K1")), memberContext(userId));

        // When
        ReturnReceipt receipt = returnUseCase.execute(new ReturnRequest(copyId, userId, key("K3")), memberContext(userId));

        // Then
        assertThat(receipt.loanId()).isEqualTo(loan.loanId());
        assertThat(receipt.status()).isEqualTo("RETURNED");
        assertThat(receipt.returnedAt()).isNotNull();
        assertThat(receipt.overdue()).isFalse();

        Copy copy = copyRepository.findByIdOrThrow(copyId);
        assertThat(copy.getStatus()).isEqualTo(CopyStatus.AVAILABLE);
        assertThat(copy.getCurrentLoanId()).isNull();

        List<AuditEvent> events = auditEventRepository.findByCorrelationIdOrderByIdAsc(key("K3"));
        assertThat(events).hasSize(2);
        assertThat(events).extracting(AuditEvent::getEntityType)
            .containsExactlyInAnyOrder(AuditEntityType.LOAN, AuditEntityType.COPY);
        assertThat(events).allSatisfy(event -> assertThat(event.getActor()).isEqualTo(userId));
        assertThat(events).filteredOn(event -> event.getEntityType() == AuditEntityType.COPY)
            .singleElement()
            .satisfies(event -> {
                assertThat(event.getFromState()).isEqualTo("LOANED");
                assertThat(event.getToState()).isEqualTo("AVAILABLE");
            });
    }

    @Test
    @DisplayName("시나리오 D - 이미 반납된 소장본을 새 키로 반납하면 Conflict")
    void 반납_재요청() {
        // Given
        checkoutUseCase.execute(new CheckoutRequest(copyId, userId, key("K1")), memberContext(userId));
        returnUseCase.execute(new ReturnRequest(copyId, userId, key("K3")), memberContext(userId));

        // When & Then
        assertThatThrownBy(() -> returnUseCase.execute(new ReturnRequest(copyId, userId, key("K4")), memberContext(userId)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NO_ACTIVE_LOAN);
    }

    @Test
    @DisplayName("시나리오 E - 존재하지 않는 소장본 대출은 NotFound")
    void 없는소장본_대출() {
        assertThatThrownBy(() -> checkoutUseCase.execute(
            new CheckoutRequest("X99-" + copyId, userId, key("K5")), memberContext(userId)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.COPY_NOT_FOUND);
    }

    @Test
    @DisplayName("실패한 요청은 결과가 저장되지 않아 같은 키로 다시 실행된다")
    void 실패요청_재실행() {
        // Given: 등록 전 소장본 대출 → NotFound
        String lateCopyId = "LATE-" + copyId;
        assertThatThrownBy(() -> checkoutUseCase.execute(
            new CheckoutRequest(lateCopyId, userId, key("K6")), memberContext(userId)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.COPY_NOT_FOUND);
        assertThat(idempotencyRecordRepository.countByIdempotencyKey(key("K6"))).isZero();

        // When: 소장본 등록 후 같은 키로 재시도
        copyRepository.save(Copy.register(lateCopyId, "B-700"));
        LoanResponse loan = checkoutUseCase.execute(new CheckoutRequest(lateCopyId, userId, key("K6")), memberContext(userId));

        // Then
        assertThat(loan.status()).isEqualTo("ACTIVE");
        assertThat(loan.copyId()).isEqualTo(lateCopyId);
    }

    @Test
    @DisplayName("키 재사용 감지 - 같은 키로 다른 소장본을 대출하면 Conflict")
    void 키재사용_불일치() {
        // Given
        String otherCopyId = "C8-" + copyId;
        copyRepository.save(Copy.register(otherCopyId, "B-800"));
        checkoutUseCase.execute(new CheckoutRequest(copyId, userId, key("K1")), memberContext(userId));

        // When & Then
        assertThatThrownBy(() -> checkoutUseCase.execute(
            new CheckoutRequest(otherCopyId, userId, key("K1")), memberContext(userId)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.IDEMPOTENCY_KEY_MISMATCH);

        assertThat(copyRepository.findByIdOrThrow(otherCopyId).getStatus()).isEqualTo(CopyStatus.AVAILABLE);
    }

    @Test
    @DisplayName("왕복 - 대출 → 반납 → 다른 회원 대출 성공")
    void 대출_반납_재대출() {
        // Given
        String otherUser = "U2-" + copyId;
        LoanResponse first = checkoutUseCase.execute(new CheckoutRequest(copyId, userId, key("K1")), memberContext(userId));
        returnUseCase.execute(new ReturnRequest(copyId, userId, key("K2")), memberContext(userId));

        // When
        LoanResponse second = checkoutUseCase.execute(new CheckoutRequest(copyId, otherUser, key("K3")), memberContext(otherUser));

        // Then
        assertThat(second.loanId()).isNotEqualTo(first.loanId());
        assertThat(getActiveLoanUseCase.execute(copyId).loanId()).isEqualTo(second.loanId());
        assertThat(loanRepository.countByCopyIdAndStatus(copyId, LoanStatus.ACTIVE)).isEqualTo(1);
        assertThat(loanRepository.countByCopyIdAndStatus(copyId, LoanStatus.RETURNED)).isEqualTo(1);
    }

    @Test
    @DisplayName("다른 회원 명의로 대출 요청 - Forbidden")
    void 대리대출_거부() {
        assertThatThrownBy(() -> checkoutUseCase.execute(
            new CheckoutRequest(copyId, userId, key("K1")), memberContext("SOMEONE-ELSE")))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ACTOR_MISMATCH);
    }

    @Test
    @DisplayName("본인 대출이 아닌 소장본 반납 - Forbidden, 관리자는 대리 반납 가능")
    void 반납_소유자확인() {
        // Given
        String otherUser = "U2-" + copyId;
        checkoutUseCase.execute(new CheckoutRequest(copyId, userId, key("K1")), memberContext(userId));

        // When & Then: 다른 회원
        assertThatThrownBy(() -> returnUseCase.execute(
            new ReturnRequest(copyId, otherUser, key("K2")), memberContext(otherUser)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_LOAN_OWNER);

        // 관리자
        CallContext admin = new CallContext(Actor.admin("LIBRARIAN"), null, Deadline.after(Duration.ofSeconds(5)));
        ReturnReceipt receipt = returnUseCase.execute(new ReturnRequest(copyId, userId, key("K3")), admin);
        assertThat(receipt.status()).isEqualTo("RETURNED");
    }

    @Test
    @DisplayName("정지 회원 대출 - Forbidden")
    void 정지회원_대출() {
        assertThatThrownBy(() -> checkoutUseCase.execute(
            new CheckoutRequest(copyId, "SUSPENDED-USER", key("K1")), memberContext("SUSPENDED-USER")))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.MEMBER_INACTIVE);
    }

    @Test
    @DisplayName("대출 한도 초과 - Forbidden, 한도 내 대출은 목록에 최근 순으로 조회")
    void 대출한도_초과() {
        // Given: 한도 3권까지 대출
        for (int i = 0; i < 3; i++) {
            String id = "L" + i + "-" + copyId;
            copyRepository.save(Copy.register(id, "B-700"));
            checkoutUseCase.execute(new CheckoutRequest(id, userId, key("LIMIT-" + i)), memberContext(userId));
        }

        // When & Then
        assertThatThrownBy(() -> checkoutUseCase.execute(
            new CheckoutRequest(copyId, userId, key("LIMIT-3")), memberContext(userId)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.LOAN_LIMIT_EXCEEDED);

        LoanListResponse loans = listLoansUseCase.execute(userId, Actor.member(userId));
        assertThat(loans.loans()).hasSize(3);
        assertThat(loans.activeCount()).isEqualTo(3);
    }
}
