package io.hhplus.circulation.domain.copy;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

/**
 * 소장본 (물리적 도서 1권)
 * <p>
 * 불변식: status == LOANED ⇔ currentLoanId가 이 소장본의 ACTIVE 대출을 가리킨다.
 * <p>
 * 상태 변경은 할당 엔진이 CopyRepository의 조건부 UPDATE로만 수행한다.
 * (엔티티를 읽어서 수정 후 저장하는 방식은 동시 요청에서 Lost Update가 발생)
 */
@Entity
@Table(
    name = "copies",
    indexes = {
        @Index(name = "idx_copies_book_id", columnList = "book_id"),
        @Index(name = "idx_copies_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Copy extends BaseTimeEntity implements Persistable<String> {

    @Id
    @Column(name = "copy_id", length = 50)
    private String copyId;

    @Column(name = "book_id", nullable = false, length = 50)
    private String bookId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CopyStatus status;

    @Column(name = "current_loan_id")
    private Long currentLoanId;

    // copyId는 카탈로그가 부여하는 자연키이므로 merge 대신 persist가 되도록 신규 여부를 직접 관리
    @Transient
    private boolean newEntity;

    public static Copy register(String copyId, String bookId) {
        validateId(copyId, "소장본 ID");
        validateId(bookId, "도서 ID");

        Copy copy = new Copy();
        copy.copyId = copyId;
        copy.bookId = bookId;
        copy.status = CopyStatus.AVAILABLE;
        copy.newEntity = true;
        return copy;
    }

    @Override
    public String getId() {
        return copyId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostPersist
    @PostLoad
    protected void markNotNew() {
        this.newEntity = false;
    }

    public CopyState getState() {
        return CopyState.of(status);
    }

    public boolean isAvailable() {
        return status == CopyStatus.AVAILABLE;
    }

    public boolean isLoanedBy(Long loanId) {
        return status == CopyStatus.LOANED && loanId != null && loanId.equals(currentLoanId);
    }

    private static void validateId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, name + "는 필수입니다");
        }
        if (value.length() > 50) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, name + "는 50자를 초과할 수 없습니다");
        }
    }
}
