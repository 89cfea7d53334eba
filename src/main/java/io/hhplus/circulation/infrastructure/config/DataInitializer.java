package io.hhplus.circulation.infrastructure.config;

import io.hhplus.circulation.config.CirculationProperties;
import io.hhplus.circulation.domain.copy.Copy;
import io.hhplus.circulation.domain.copy.CopyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * 로컬 실행용 소장본 초기 데이터
 * <p>
 * circulation.catalog.seed의 소장본 중 아직 등록되지 않은 것만 AVAILABLE로 등록한다.
 */
@Slf4j
@Component
@Profile("!test")  // 테스트 환경에서는 비활성화
@RequiredArgsConstructor
public class DataInitializer implements ApplicationRunner {

    private final CopyRepository copyRepository;
    private final CirculationProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        Map<String, String> seed = properties.getCatalog().getSeed();
        int created = 0;
        for (Map.Entry<String, String> entry : seed.entrySet()) {
            if (copyRepository.existsById(entry.getKey())) {
                continue;
            }
            copyRepository.save(Copy.register(entry.getKey(), entry.getValue()));
            created++;
        }
        log.info("소장본 초기 데이터: 카탈로그 {}건 중 {}건 등록", seed.size(), created);
    }
}
