package io.hhplus.bridge.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Commerce Bridge API")
                .description("고객 생애 가치 조회/재계산 및 Contact Us 설정 API 문서")
                .version("1.0.0"))
            .tags(List.of(
                new Tag().name("customer-lifetime").description("/api/customers/{customerId}/lifetime"),
                new Tag().name("settings").description("/api/settings/contact-us")
            ));
    }
}
