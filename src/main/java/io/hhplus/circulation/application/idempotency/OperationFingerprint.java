package io.hhplus.circulation.application.idempotency;

import io.hhplus.circulation.domain.idempotency.OperationType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 작업 지문: SHA-256(operationType | param1 | param2 ...)
 * <p>
 * 같은 멱등성 키가 다른 작업/다른 파라미터로 재사용되었는지 판별한다.
 * 파라미터 구분자가 값에 섞여 충돌하지 않도록 각 값 앞에 길이를 붙인다.
 */
public final class OperationFingerprint {

    private OperationFingerprint() {
    }

    public static String of(OperationType operationType, Object... params) {
        StringBuilder canonical = new StringBuilder(operationType.name());
        for (Object param : params) {
            String value = String.valueOf(param);
            canonical.append('|').append(value.length()).append(':').append(value);
        }
        return sha256(canonical.toString());
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
