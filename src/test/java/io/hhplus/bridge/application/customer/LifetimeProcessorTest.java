package io.hhplus.bridge.application.customer;

import io.hhplus.bridge.application.payment.PaymentStatusProvider;
import io.hhplus.bridge.common.exception.BusinessException;
import io.hhplus.bridge.common.exception.ErrorCode;
import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.order.Order;
import io.hhplus.bridge.domain.payment.PaymentAction;
import io.hhplus.bridge.domain.payment.PaymentTransaction;
import io.hhplus.bridge.infrastructure.persistence.customer.InMemoryCustomerRepository;
import io.hhplus.bridge.infrastructure.persistence.order.InMemoryOrderRepository;
import io.hhplus.bridge.infrastructure.persistence.payment.InMemoryPaymentTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LifetimeProcessorTest {

    private InMemoryCustomerRepository customerRepository;
    private InMemoryOrderRepository orderRepository;
    private InMemoryPaymentTransactionRepository paymentTransactionRepository;
    private LifetimeProcessor lifetimeProcessor;

    private Customer customer;

    @BeforeEach
    void setUp() {
        customerRepository = new InMemoryCustomerRepository();
        orderRepository = new InMemoryOrderRepository();
        paymentTransactionRepository = new InMemoryPaymentTransactionRepository();
        lifetimeProcessor = new LifetimeProcessor(
            orderRepository,
            new PaymentStatusProvider(paymentTransactionRepository)
        );

        customer = customerRepository.save(Customer.create("홍길동", "hong@test.com"));
    }

    @Test
    @DisplayName("완납된 주문의 소계만 합산한다")
    void 완납주문만_합산() {
        // Given
        Order paid1 = saveOrder("ORD-001", 10000L);
        Order paid2 = saveOrder("ORD-002", 25000L);
        Order partial = saveOrder("ORD-003", 50000L);
        saveOrder("ORD-004", 7000L);  // 결제 없음

        pay(paid1, 10000L);
        pay(paid2, 30000L);  // 초과 결제도 FULL
        pay(partial, 20000L);

        // When
        Long lifetime = lifetimeProcessor.calculateLifetimeValue(customer);

        // Then
        assertThat(lifetime).isEqualTo(35000L);
    }

    @Test
    @DisplayName("다른 고객의 주문은 포함하지 않는다")
    void 다른고객주문_제외() {
        // Given
        Customer other = customerRepository.save(Customer.create("김철수", "kim@test.com"));
        Order otherOrder = orderRepository.save(Order.create("ORD-100", other, 90000L));
        pay(otherOrder, 90000L);

        // When & Then
        assertThat(lifetimeProcessor.calculateLifetimeValue(customer)).isZero();
        assertThat(lifetimeProcessor.calculateLifetimeValue(other)).isEqualTo(90000L);
    }

    @Test
    @DisplayName("주문이 없으면 0")
    void 주문없음_0() {
        assertThat(lifetimeProcessor.calculateLifetimeValue(customer)).isZero();
    }

    @Test
    @DisplayName("저장되지 않은 고객은 계산할 수 없다")
    void 미저장고객_예외발생() {
        Customer transientCustomer = Customer.create("미저장", null);

        assertThatThrownBy(() -> lifetimeProcessor.calculateLifetimeValue(transientCustomer))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CUSTOMER_NOT_FOUND);
    }

    private Order saveOrder(String orderNumber, Long subtotal) {
        return orderRepository.save(Order.create(orderNumber, customer, subtotal));
    }

    private void pay(Order order, Long amount) {
        PaymentTransaction transaction = PaymentTransaction.forOrder(order, PaymentAction.CHARGE, amount);
        transaction.complete("PG-" + order.getOrderNumber());
        paymentTransactionRepository.save(transaction);
    }
}
