package io.hhplus.circulation.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정
 *
 * BaseTimeEntity의 @CreatedDate, @LastModifiedDate를 채운다.
 * (소장본/대출의 조건부 UPDATE는 쿼리에서 updatedAt을 직접 갱신)
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
