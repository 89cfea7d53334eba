package io.hhplus.circulation.infrastructure.external;

import io.hhplus.circulation.config.CirculationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mock 카탈로그
 * <p>
 * circulation.catalog.seed로 초기화되는 인메모리 (copyId → bookId) 목록.
 * 테스트는 register()로 항목을 추가한다.
 * <p>
 * 실제 연동 시: 카탈로그 API 클라이언트로 교체 (타임아웃 권장 1초, 조회 결과 캐싱)
 */
@Slf4j
@Service
@Profile("!prod")
public class MockCatalogClient implements CatalogClient {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    public MockCatalogClient(CirculationProperties properties) {
        entries.putAll(properties.getCatalog().getSeed());
        log.info("Mock 카탈로그 초기화: {}건", entries.size());
    }

    @Override
    public boolean copyExists(String copyId) {
        return entries.containsKey(copyId);
    }

    @Override
    public Optional<String> bookOf(String copyId) {
        return Optional.ofNullable(entries.get(copyId));
    }

    public void register(String copyId, String bookId) {
        entries.put(copyId, bookId);
    }
}
