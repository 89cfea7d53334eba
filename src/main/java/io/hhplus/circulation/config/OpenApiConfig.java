package io.hhplus.circulation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Library Circulation API")
                .description("도서 대출/반납/연장/분실 처리 API (X-User-Id, X-User-Role 헤더로 호출자 식별)")
                .version("1.0.0"));
    }
}
