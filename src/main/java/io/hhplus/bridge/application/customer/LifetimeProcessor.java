package io.hhplus.bridge.application.customer;

import io.hhplus.bridge.application.payment.PaymentStatusProvider;
import io.hhplus.bridge.common.exception.BusinessException;
import io.hhplus.bridge.common.exception.ErrorCode;
import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.order.Order;
import io.hhplus.bridge.domain.order.OrderRepository;
import io.hhplus.bridge.domain.payment.PaymentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 고객 생애 가치 계산
 *
 * 생애 가치 = 완납(FULL) 주문의 소계 합계
 * 커밋된 상태만 읽으며 엔티티를 수정하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class LifetimeProcessor {

    private final OrderRepository orderRepository;
    private final PaymentStatusProvider paymentStatusProvider;

    public Long calculateLifetimeValue(Customer customer) {
        if (customer.getId() == null) {
            throw new BusinessException(
                ErrorCode.CUSTOMER_NOT_FOUND,
                "저장되지 않은 고객의 생애 가치는 계산할 수 없습니다"
            );
        }

        return orderRepository.findByCustomerId(customer.getId()).stream()
            .filter(order -> paymentStatusProvider.getPaymentStatus(order) == PaymentStatus.FULL)
            .mapToLong(Order::getSubtotalValue)
            .sum();
    }
}
