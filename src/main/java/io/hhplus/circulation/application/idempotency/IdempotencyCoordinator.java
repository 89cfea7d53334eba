package io.hhplus.circulation.application.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.circulation.application.audit.AuditPayloadCodec;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.audit.AuditEntry;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecord;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 멱등성 조정자 (Idempotency Coordinator)
 * <p>
 * 2단계 마커:
 * 1. begin(): IN_FLIGHT 레코드 INSERT → NEW / 기존 레코드 상태로 분기
 * 2. attachOutcome(): 엔진 트랜잭션 안에서 결과 첨부 (전이와 함께 커밋 또는 롤백)
 * 3. complete(): 감사 기록 이후 COMPLETED 전환
 * 실패 시 release()로 IN_FLIGHT 레코드를 지워 같은 키로 재시도할 수 있게 한다.
 * <p>
 * 같은 키의 동시 요청은 UNIQUE 제약 + SELECT FOR UPDATE로 선형화된다.
 * (동시 중복 요청은 NEW를 받지 못하고 IN_FLIGHT 또는 COMPLETED를 본다)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyCoordinator {

    private static final int MAX_BEGIN_ATTEMPTS = 3;

    private final IdempotencyRecordWriter recordWriter;
    private final IdempotencyRecordRepository recordRepository;
    private final AuditPayloadCodec auditPayloadCodec;
    private final ObjectMapper objectMapper;

    public IdempotencyDecision begin(IdempotentRequest request) {
        for (int attempt = 1; attempt <= MAX_BEGIN_ATTEMPTS; attempt++) {
            try {
                IdempotencyRecord created = recordWriter.insertInFlight(request);
                log.debug("멱등성 레코드 생성: key={}, recordId={}", request.idempotencyKey(), created.getId());
                return IdempotencyDecision.newRequest(created.getId());
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                // UNIQUE 위반 (또는 동시 INSERT 락 대기 실패): 이미 존재하는 키
                Optional<IdempotencyDecision> existing = recordWriter.inspectExisting(request);
                if (existing.isPresent()) {
                    return existing.get();
                }
                log.debug("멱등성 레코드가 조회 전에 해제됨, 재시도: key={}, attempt={}",
                    request.idempotencyKey(), attempt);
            }
        }
        // INSERT와 해제가 계속 엇갈리는 경우: 다른 요청이 처리 중인 것으로 보고 대기
        return IdempotencyDecision.inFlight();
    }

    /**
     * 대기 중 상태 재확인. 레코드가 사라졌거나 만료되었으면 begin()부터 다시 수행
     */
    public IdempotencyDecision poll(IdempotentRequest request) {
        return recordWriter.peek(request).orElseGet(() -> begin(request));
    }

    /**
     * 엔진 트랜잭션 안에서 결과와 미기록 감사 항목을 첨부
     * <p>
     * 레코드가 이미 없거나(복구 스윕이 삭제) 결과가 붙어 있으면 예외를 던져 전이 전체를 롤백한다.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void attachOutcome(IdempotencyTicket ticket, Object result, List<AuditEntry> auditEntries) {
        int updated = recordRepository.attachOutcome(
            ticket.recordId(),
            serialize(result),
            auditPayloadCodec.write(auditEntries)
        );
        if (updated == 0) {
            log.error("멱등성 레코드에 결과를 첨부할 수 없음 (전이 롤백): key={}, recordId={}",
                ticket.idempotencyKey(), ticket.recordId());
            throw new BusinessException(
                ErrorCode.INTERNAL_SERVER_ERROR,
                "요청 처리 상태를 확인할 수 없습니다. 같은 멱등성 키로 다시 시도해주세요."
            );
        }
    }

    @Transactional
    public boolean complete(Long recordId) {
        int updated = recordRepository.complete(recordId, LocalDateTime.now());
        if (updated == 0) {
            log.warn("멱등성 레코드 완료 처리 대상 없음 (이미 완료되었거나 스윕됨): recordId={}", recordId);
        }
        return updated > 0;
    }

    /**
     * 결과가 첨부되지 않은(=전이가 커밋되지 않은) IN_FLIGHT 레코드만 삭제
     */
    @Transactional
    public boolean release(Long recordId) {
        int deleted = recordRepository.release(recordId);
        log.debug("멱등성 레코드 해제: recordId={}, deleted={}", recordId, deleted);
        return deleted > 0;
    }

    public <T> T readResult(String payload, Class<T> resultType) {
        try {
            return objectMapper.readValue(payload, resultType);
        } catch (JsonProcessingException e) {
            log.error("저장된 응답 역직렬화 실패: type={}", resultType.getSimpleName(), e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "응답 역직렬화 중 오류가 발생했습니다.");
        }
    }

    private String serialize(Object result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("응답 직렬화 실패: type={}", result.getClass().getSimpleName(), e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "응답 직렬화 중 오류가 발생했습니다.");
        }
    }
}
