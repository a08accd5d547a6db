package io.hhplus.bridge.config;

import io.hhplus.bridge.domain.order.Order;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 고객 생애 가치 재계산 설정 (lifetime.*)
 */
@ConfigurationProperties(prefix = "lifetime")
@NoArgsConstructor
@Getter
@Setter
public class LifetimeProperties {

    /** 트랜잭션 변경 추적 + 커밋 후 재계산 사용 여부. Default true. */
    private boolean enabled = true;

    /** 주문 UPDATE 시 재계산을 일으키는 필드. Default customer, subtotalValue. */
    private Set<String> valueAffectingFields =
            new LinkedHashSet<>(List.of(Order.CUSTOMER_FIELD, Order.SUBTOTAL_FIELD));
}
