package io.hhplus.circulation.infrastructure.external;

import java.util.Optional;

/**
 * 카탈로그 서비스 인터페이스
 * <p>
 * 소장본의 존재 여부와 소속 도서를 알려주는 외부 협력자.
 * 검색/서지 정보는 이 서비스의 관심사가 아니다.
 * <p>
 * 현재 구현:
 * - MockCatalogClient: 인메모리 카탈로그
 */
public interface CatalogClient {

    boolean copyExists(String copyId);

    Optional<String> bookOf(String copyId);
}
