package io.hhplus.bridge.infrastructure.persistence.lifetime;

import io.hhplus.bridge.application.customer.listener.CustomerLifetimeListener;
import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.lifetime.LifetimeEntityRegistry;
import io.hhplus.bridge.domain.lifetime.RelatedEntityKind;
import io.hhplus.bridge.domain.order.Order;
import io.hhplus.bridge.domain.payment.PaymentTransaction;
import org.hibernate.cfg.AvailableSettings;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * 생애 가치 추적용 Hibernate 설정
 *
 * - 엔티티 분류는 여기서 한 번 등록한다.
 * - Interceptor는 SessionFactory 전역 인스턴스이며, 트랜잭션별 상태는 리스너가 트랜잭션 리소스로 관리한다.
 */
@Configuration
public class LifetimeHibernateConfig {

    @Bean
    public LifetimeEntityRegistry lifetimeEntityRegistry() {
        return new LifetimeEntityRegistry(Map.of(
            Customer.class, RelatedEntityKind.OWNER,
            Order.class, RelatedEntityKind.PRIMARY,
            PaymentTransaction.class, RelatedEntityKind.SECONDARY
        ));
    }

    @Bean
    public LifetimeTrackingInterceptor lifetimeTrackingInterceptor(
            LifetimeEntityRegistry lifetimeEntityRegistry,
            ObjectProvider<CustomerLifetimeListener> listenerProvider
    ) {
        return new LifetimeTrackingInterceptor(lifetimeEntityRegistry, listenerProvider);
    }

    @Bean
    public HibernatePropertiesCustomizer lifetimeInterceptorCustomizer(LifetimeTrackingInterceptor interceptor) {
        return hibernateProperties -> hibernateProperties.put(AvailableSettings.INTERCEPTOR, interceptor);
    }
}
