package io.hhplus.bridge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정
 *
 * BaseTimeEntity의 @CreatedDate, @LastModifiedDate 자동 처리
 * 메인 클래스와 분리해 @WebMvcTest 같은 슬라이스 테스트에 JPA 설정이 섞이지 않게 한다.
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
