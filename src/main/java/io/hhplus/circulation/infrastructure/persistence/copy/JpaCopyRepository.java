package io.hhplus.circulation.infrastructure.persistence.copy;

import io.hhplus.circulation.domain.copy.Copy;
import io.hhplus.circulation.domain.copy.CopyRepository;
import io.hhplus.circulation.domain.copy.CopyStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 소장본 JPA Repository
 * <p>
 * 상태 전이는 "UPDATE ... WHERE copy_id = ? AND status = ? [AND current_loan_id = ?]" 형태의
 * 조건부 UPDATE 한 번으로 수행한다. (check-and-set이 DB 안에서 원자적으로 일어남)
 * <p>
 * clearAutomatically: 벌크 UPDATE 후 영속성 컨텍스트의 오래된 Copy를 비워 재조회 시 최신 상태를 읽도록 함
 * flushAutomatically: 같은 트랜잭션에서 먼저 INSERT된 Loan 등이 UPDATE 전에 반영되도록 함
 */
@Repository
public interface JpaCopyRepository extends JpaRepository<Copy, String>, CopyRepository {

    @Override
    Optional<Copy> findById(String copyId);

    @Override
    @SuppressWarnings("unchecked")
    Copy save(Copy copy);

    @Override
    default int allocate(String copyId, Long loanId) {
        return updateStatus(copyId, CopyStatus.AVAILABLE, CopyStatus.LOANED, loanId, LocalDateTime.now());
    }

    @Override
    default int release(String copyId, Long expectedLoanId) {
        return updateStatusOfLoan(copyId, expectedLoanId, CopyStatus.LOANED, CopyStatus.AVAILABLE, LocalDateTime.now());
    }

    @Override
    default int markLost(String copyId, Long expectedLoanId) {
        return updateStatusOfLoan(copyId, expectedLoanId, CopyStatus.LOANED, CopyStatus.LOST, LocalDateTime.now());
    }

    @Override
    default int retire(String copyId, CopyStatus fromStatus) {
        return updateStatus(copyId, fromStatus, CopyStatus.RETIRED, null, LocalDateTime.now());
    }

    /**
     * from → to, currentLoanId 설정 (AVAILABLE → LOANED, AVAILABLE/LOST → RETIRED)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Copy c SET c.status = :to, c.currentLoanId = :loanId, c.updatedAt = :now " +
           "WHERE c.copyId = :copyId AND c.status = :from")
    int updateStatus(@Param("copyId") String copyId,
                     @Param("from") CopyStatus from,
                     @Param("to") CopyStatus to,
                     @Param("loanId") Long loanId,
                     @Param("now") LocalDateTime now);

    /**
     * 특정 대출에 묶인 소장본만 전이 (LOANED → AVAILABLE/LOST). 대출 연결은 해제한다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Copy c SET c.status = :to, c.currentLoanId = NULL, c.updatedAt = :now " +
           "WHERE c.copyId = :copyId AND c.status = :from AND c.currentLoanId = :loanId")
    int updateStatusOfLoan(@Param("copyId") String copyId,
                           @Param("loanId") Long loanId,
                           @Param("from") CopyStatus from,
                           @Param("to") CopyStatus to,
                           @Param("now") LocalDateTime now);
}
