package io.hhplus.circulation.application.idempotency;

import io.hhplus.circulation.config.CirculationProperties;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecord;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 멱등성 레코드 저장 서비스
 *
 * IdempotencyCoordinator에서 분리하여 REQUIRES_NEW 트랜잭션이 프록시를 통해 적용되도록 함
 * (자기 자신의 메서드 호출에서는 프록시가 적용되지 않음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyRecordWriter {

    private final IdempotencyRecordRepository recordRepository;
    private final CirculationProperties properties;

    /**
     * IN_FLIGHT 레코드 INSERT (Insert-first)
     *
     * 없는 행에 대한 SELECT FOR UPDATE는 InnoDB 갭락으로 대기/데드락을 늘리므로
     * 먼저 INSERT하고, UNIQUE 위반(DataIntegrityViolationException)일 때만 기존 행을 잠가서 읽는다.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IdempotencyRecord insertInFlight(IdempotentRequest request) {
        IdempotencyRecord record = IdempotencyRecord.inFlight(
            request.idempotencyKey(),
            request.operationType(),
            request.fingerprint(),
            LocalDateTime.now(),
            properties.getIdempotency().getRetention()
        );
        return recordRepository.saveAndFlush(record);
    }

    /**
     * 기존 키 상태 분기 (SELECT FOR UPDATE)
     *
     * @return 레코드가 그 사이 삭제되었다면 empty (호출자가 INSERT부터 다시 시도)
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<IdempotencyDecision> inspectExisting(IdempotentRequest request) {
        return recordRepository.findByIdempotencyKeyWithLock(request.idempotencyKey())
            .map(existing -> decide(existing, request, true));
    }

    /**
     * 락 없이 현재 상태만 확인 (IN_FLIGHT 대기 중 폴링)
     *
     * @return 레코드가 없거나 만료되었다면 empty (호출자가 begin()부터 다시 시도)
     */
    @Transactional(readOnly = true, propagation = Propagation.REQUIRES_NEW)
    public Optional<IdempotencyDecision> peek(IdempotentRequest request) {
        return recordRepository.findByIdempotencyKey(request.idempotencyKey())
            .filter(existing -> !existing.isExpired(LocalDateTime.now()))
            .map(existing -> decide(existing, request, false));
    }

    private IdempotencyDecision decide(IdempotencyRecord existing, IdempotentRequest request, boolean locked) {
        LocalDateTime now = LocalDateTime.now();

        // 보존 기간이 지난 키는 새 요청으로 재사용 (잠근 상태에서만)
        if (locked && existing.isExpired(now) && (existing.isCompleted() || !existing.hasOutcome())) {
            existing.resetForReuse(
                request.operationType(),
                request.fingerprint(),
                now,
                properties.getIdempotency().getRetention()
            );
            log.info("만료된 멱등성 키 재사용: key={}", request.idempotencyKey());
            return IdempotencyDecision.newRequest(existing.getId());
        }

        if (!existing.matches(request.operationType(), request.fingerprint())) {
            return IdempotencyDecision.mismatch();
        }

        // 결과가 첨부되어 있으면 COMPLETED 전환 전이라도 전이는 커밋된 것
        if (existing.hasOutcome()) {
            return IdempotencyDecision.completed(existing.getResponsePayload());
        }

        return IdempotencyDecision.inFlight();
    }
}
