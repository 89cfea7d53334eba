package io.hhplus.circulation.infrastructure.persistence.idempotency;

import io.hhplus.circulation.domain.idempotency.IdempotencyRecord;
import io.hhplus.circulation.domain.idempotency.IdempotencyRecordRepository;
import io.hhplus.circulation.domain.idempotency.IdempotencyStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 멱등성 레코드 JPA Repository
 * <p>
 * UNIQUE 제약(uk_idempotency_records_key)으로 동일 키의 동시 INSERT 중 하나만 성공한다.
 * <p>
 * 결과 첨부(attachOutcome)와 복구 스윕의 삭제(deleteStaleWithoutOutcome)는 같은 행에 대한
 * 조건부 쿼리이므로 둘 중 먼저 커밋된 쪽만 적용된다.
 * - 스윕이 먼저 삭제: 엔진의 attachOutcome이 0건 → 엔진 트랜잭션 롤백
 * - 엔진이 먼저 첨부: 스윕의 삭제 조건(responsePayload IS NULL) 불일치 → 삭제되지 않음
 */
@Repository
public interface JpaIdempotencyRecordRepository
    extends JpaRepository<IdempotencyRecord, Long>, IdempotencyRecordRepository {

    @Override
    Optional<IdempotencyRecord> findById(Long id);

    @Override
    Optional<IdempotencyRecord> findByIdempotencyKey(String idempotencyKey);

    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM IdempotencyRecord r WHERE r.idempotencyKey = :idempotencyKey")
    Optional<IdempotencyRecord> findByIdempotencyKeyWithLock(@Param("idempotencyKey") String idempotencyKey);

    @Override
    @SuppressWarnings("unchecked")
    IdempotencyRecord saveAndFlush(IdempotencyRecord record);

    @Override
    long countByIdempotencyKey(String idempotencyKey);

    @Override
    default int attachOutcome(Long id, String responsePayload, String pendingAudit) {
        return attachOutcomeIfInFlight(id, IdempotencyStatus.IN_FLIGHT, responsePayload, pendingAudit);
    }

    @Override
    default int complete(Long id, LocalDateTime completedAt) {
        return completeIfOutcomeAttached(id, IdempotencyStatus.IN_FLIGHT, IdempotencyStatus.COMPLETED, completedAt);
    }

    @Override
    default int release(Long id) {
        return deleteInFlightWithoutOutcome(id, IdempotencyStatus.IN_FLIGHT);
    }

    @Override
    default List<IdempotencyRecord> findStaleInFlight(LocalDateTime cutoff, int limit) {
        return findByStatusCreatedBefore(IdempotencyStatus.IN_FLIGHT, cutoff, PageRequest.of(0, limit));
    }

    @Override
    default int deleteStaleWithoutOutcome(Long id, LocalDateTime cutoff) {
        return deleteInFlightWithoutOutcomeCreatedBefore(id, IdempotencyStatus.IN_FLIGHT, cutoff);
    }

    @Override
    default int deleteExpired(LocalDateTime now) {
        return deleteByStatusExpiredBefore(IdempotencyStatus.COMPLETED, now);
    }

    @Modifying(flushAutomatically = true)
    @Query("UPDATE IdempotencyRecord r SET r.responsePayload = :payload, r.pendingAudit = :pendingAudit " +
           "WHERE r.id = :id AND r.status = :inFlight AND r.responsePayload IS NULL")
    int attachOutcomeIfInFlight(@Param("id") Long id,
                                @Param("inFlight") IdempotencyStatus inFlight,
                                @Param("payload") String payload,
                                @Param("pendingAudit") String pendingAudit);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IdempotencyRecord r SET r.status = :completed, r.pendingAudit = NULL, r.completedAt = :completedAt " +
           "WHERE r.id = :id AND r.status = :inFlight AND r.responsePayload IS NOT NULL")
    int completeIfOutcomeAttached(@Param("id") Long id,
                                  @Param("inFlight") IdempotencyStatus inFlight,
                                  @Param("completed") IdempotencyStatus completed,
                                  @Param("completedAt") LocalDateTime completedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM IdempotencyRecord r " +
           "WHERE r.id = :id AND r.status = :inFlight AND r.responsePayload IS NULL")
    int deleteInFlightWithoutOutcome(@Param("id") Long id,
                                     @Param("inFlight") IdempotencyStatus inFlight);

    // 복구 스윕은 트랜잭션 밖에서 호출하므로 건별로 커밋
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM IdempotencyRecord r " +
           "WHERE r.id = :id AND r.status = :inFlight AND r.responsePayload IS NULL AND r.createdAt < :cutoff")
    int deleteInFlightWithoutOutcomeCreatedBefore(@Param("id") Long id,
                                                  @Param("inFlight") IdempotencyStatus inFlight,
                                                  @Param("cutoff") LocalDateTime cutoff);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM IdempotencyRecord r WHERE r.status = :status AND r.expiresAt < :now")
    int deleteByStatusExpiredBefore(@Param("status") IdempotencyStatus status,
                                    @Param("now") LocalDateTime now);

    @Query("SELECT r FROM IdempotencyRecord r WHERE r.status = :status AND r.createdAt < :cutoff ORDER BY r.id ASC")
    List<IdempotencyRecord> findByStatusCreatedBefore(@Param("status") IdempotencyStatus status,
                                                      @Param("cutoff") LocalDateTime cutoff,
                                                      Pageable pageable);
}
