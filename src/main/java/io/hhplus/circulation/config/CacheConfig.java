package io.hhplus.circulation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hhplus.circulation.application.copy.dto.CopyResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.SimpleCacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.Map;

/**
 * Spring Cache 설정 (Redis 기반)
 *
 * 캐시 전략: Cache-Aside
 * - 조회: GetCopyUseCase (@Cacheable copyAvailability)
 * - 무효화: AllocationEngine의 상태 전이 (@CacheEvict copyAvailability)
 *
 * transactionAware: 전이 트랜잭션이 커밋된 뒤에 무효화되므로
 * 롤백된 전이가 캐시를 지우거나, 커밋 전 상태가 다시 캐싱되는 일을 줄인다.
 *
 * Note: 테스트 환경에서는 비활성화 (@Profile("!test"))
 */
@Slf4j
@Configuration
@EnableCaching
@Profile("!test")
public class CacheConfig {

    public static final String COPY_AVAILABILITY = "copyAvailability";

    private ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private RedisCacheConfiguration copyAvailabilityConfig() {
        return RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(Duration.ofMinutes(10))
                .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer())
                )
                .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new Jackson2JsonRedisSerializer<>(objectMapper(), CopyResponse.class)
                        )
                )
                .disableCachingNullValues();
    }

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(copyAvailabilityConfig())
                .withInitialCacheConfigurations(Map.of(COPY_AVAILABILITY, copyAvailabilityConfig()))
                .transactionAware()
                .build();
    }

    /**
     * 캐시 장애(Redis 연결 실패, 역직렬화 오류)가 조회/전이 자체를 실패시키지 않도록 로그만 남긴다.
     * 가용성 원본은 항상 DB(Resource Ledger)다.
     */
    @Bean
    public CacheErrorHandler cacheErrorHandler() {
        return new SimpleCacheErrorHandler() {
            @Override
            public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
                log.warn("캐시 조회 실패, DB 조회로 대체: cache={}, key={}, error={}",
                        cache.getName(), key, exception.getMessage());
                try {
                    cache.evict(key);
                } catch (RuntimeException evictError) {
                    log.warn("손상된 캐시 엔트리 제거 실패: cache={}, key={}", cache.getName(), key, evictError);
                }
            }

            @Override
            public void handleCachePutError(RuntimeException exception, Cache cache, Object key, Object value) {
                log.warn("캐시 저장 실패: cache={}, key={}, error={}", cache.getName(), key, exception.getMessage());
            }

            @Override
            public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
                log.error("캐시 무효화 실패 (TTL 만료까지 오래된 값이 보일 수 있음): cache={}, key={}",
                        cache.getName(), key, exception);
            }
        };
    }
}
