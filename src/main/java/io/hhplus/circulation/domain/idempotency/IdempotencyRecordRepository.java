package io.hhplus.circulation.domain.idempotency;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 멱등성 레코드 Repository
 * <p>
 * 상태 전이는 모두 조건부 쿼리이며 영향받은 행 수를 반환한다.
 */
public interface IdempotencyRecordRepository {

    Optional<IdempotencyRecord> findById(Long id);

    Optional<IdempotencyRecord> findByIdempotencyKey(String idempotencyKey);

    /**
     * SELECT FOR UPDATE (기존 키 상태 분기용)
     */
    Optional<IdempotencyRecord> findByIdempotencyKeyWithLock(String idempotencyKey);

    /**
     * INSERT 즉시 flush. UNIQUE 위반 시 DataIntegrityViolationException
     */
    IdempotencyRecord saveAndFlush(IdempotencyRecord record);

    /**
     * IN_FLIGHT이고 결과가 없는 레코드에만 결과/미기록 감사 항목 첨부
     */
    int attachOutcome(Long id, String responsePayload, String pendingAudit);

    /**
     * 결과가 첨부된 IN_FLIGHT → COMPLETED (pendingAudit 제거)
     */
    int complete(Long id, LocalDateTime completedAt);

    /**
     * 결과가 없는 IN_FLIGHT 레코드 삭제 (실패한 요청의 키 반환)
     */
    int release(Long id);

    /**
     * createdAt이 cutoff 이전인데 아직 IN_FLIGHT인 레코드
     */
    List<IdempotencyRecord> findStaleInFlight(LocalDateTime cutoff, int limit);

    /**
     * 결과 없이 cutoff 이전부터 IN_FLIGHT인 레코드 삭제 (커밋되지 않은 전이)
     */
    int deleteStaleWithoutOutcome(Long id, LocalDateTime cutoff);

    /**
     * 보존 기간이 지난 COMPLETED 레코드 삭제
     */
    int deleteExpired(LocalDateTime now);

    long countByIdempotencyKey(String idempotencyKey);
}
