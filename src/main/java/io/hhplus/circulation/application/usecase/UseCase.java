package io.hhplus.circulation.application.usecase;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * 외부 요청 하나를 처리하는 진입점 (권한 확인 → 멱등성 → 엔진 호출 순서를 조립)
 * <p>
 * 쓰기 UseCase는 트랜잭션을 걸지 않는다. 쓰기 트랜잭션은 AllocationEngine 안쪽에서만 열린다.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface UseCase {
    String value() default "";
}
