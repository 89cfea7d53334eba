package io.hhplus.circulation.application.usecase.copy;

import io.hhplus.circulation.application.circulation.ResourceLedger;
import io.hhplus.circulation.application.copy.dto.CopyResponse;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.config.CacheConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@UseCase
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class GetCopyUseCase {

    private final ResourceLedger resourceLedger;

    /**
     * 소장본 가용성 조회 (캐시 적용)
     *
     * 캐시 키: "copyAvailability::{copyId}"
     * - 엔진 전이가 커밋되면 @CacheEvict로 무효화된다.
     *
     * 엔진을 거치지 않는 읽기 경로이므로 전이 직전 값이 잠시 보일 수 있다.
     * 대출 가능 여부의 최종 판단은 항상 엔진의 조건부 UPDATE가 한다.
     */
    @Cacheable(cacheNames = CacheConfig.COPY_AVAILABILITY, key = "#copyId", sync = true)
    public CopyResponse execute(String copyId) {
        log.debug("소장본 조회: copyId={}", copyId);
        return CopyResponse.from(resourceLedger.getCopy(copyId));
    }
}
