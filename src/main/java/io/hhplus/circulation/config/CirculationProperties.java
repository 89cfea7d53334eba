package io.hhplus.circulation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 대출 엔진 설정 (application.yml의 circulation.*)
 */
@Configuration
@ConfigurationProperties(prefix = "circulation")
@Data
public class CirculationProperties {

    private LoanPolicy loan = new LoanPolicy();
    private MemberPolicy member = new MemberPolicy();
    private IdempotencyPolicy idempotency = new IdempotencyPolicy();
    private LockPolicy lock = new LockPolicy();
    private AuditPolicy audit = new AuditPolicy();
    private CatalogPolicy catalog = new CatalogPolicy();

    @Data
    public static class LoanPolicy {
        private Duration loanPeriod = Duration.ofDays(14);
        private Duration renewalPeriod = Duration.ofDays(14);
        private int maxRenewals = 2;
    }

    @Data
    public static class MemberPolicy {
        private int maxActiveLoans = 5;
        private List<String> suspendedUsers = new ArrayList<>();
    }

    @Data
    public static class IdempotencyPolicy {
        /**
         * COMPLETED 레코드 보존 기간
         */
        private Duration retention = Duration.ofHours(24);
        /**
         * 호출자가 마감 시각을 주지 않았을 때의 기본 대기 시간
         */
        private Duration waitTimeout = Duration.ofSeconds(5);
        private Duration pollInterval = Duration.ofMillis(50);
        /**
         * 이 시간 이상 IN_FLIGHT인 레코드는 복구 스윕 대상
         */
        private Duration staleAfter = Duration.ofMinutes(2);
        private int sweepBatchSize = 100;
    }

    @Data
    public static class LockPolicy {
        private String keyPrefix = "circulation:";
        private Duration waitTime = Duration.ofSeconds(3);
        private Duration leaseTime = Duration.ofSeconds(30);
    }

    @Data
    public static class AuditPolicy {
        private int maxAttempts = 3;
        private int reconcileBatchSize = 50;
    }

    @Data
    public static class CatalogPolicy {
        /**
         * Mock 카탈로그에 미리 등록할 소장본 (copyId → bookId)
         */
        private Map<String, String> seed = new LinkedHashMap<>();
    }
}
