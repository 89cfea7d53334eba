package io.hhplus.circulation.common.exception;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

/**
 * 저장소 제약 위반이 특정 제약(UNIQUE 등) 때문인지 판별
 * <p>
 * 컬럼 길이 초과나 NOT NULL 위반도 같은 DataIntegrityViolationException으로 올라오므로,
 * 이름으로 구분해야 하는 경우에만 사용한다.
 * DB마다 보고하는 이름 형식이 달라(MySQL: "loans.uk_x", H2: "PUBLIC.UK_X_INDEX_2") 대소문자 무시 포함 여부로 비교한다.
 */
public final class ConstraintViolations {

    private ConstraintViolations() {
    }

    public static boolean isViolationOf(DataIntegrityViolationException e, String constraintName) {
        String expected = constraintName.toLowerCase(Locale.ROOT);
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                && violation.getConstraintName() != null
                && violation.getConstraintName().toLowerCase(Locale.ROOT).contains(expected)) {
                return true;
            }
        }
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(expected);
    }
}
