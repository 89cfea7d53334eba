package io.hhplus.circulation.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Spring Retry 활성화 (감사 로그 기록 재시도)
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
