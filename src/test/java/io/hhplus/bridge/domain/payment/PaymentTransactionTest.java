package io.hhplus.bridge.domain.payment;

import io.hhplus.bridge.common.exception.BusinessException;
import io.hhplus.bridge.common.exception.ErrorCode;
import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.order.Order;
import io.hhplus.bridge.infrastructure.persistence.order.InMemoryOrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PaymentTransactionTest {

    private Order order;

    @BeforeEach
    void setUp() {
        InMemoryOrderRepository orderRepository = new InMemoryOrderRepository();
        order = orderRepository.save(Order.create("ORD-001", Customer.createForTest(1L, "홍길동", 0L), 10000L));
    }

    @Test
    @DisplayName("주문 결제 트랜잭션 생성 - 주문 클래스 이름과 ID로 참조")
    void forOrder_성공() {
        // When
        PaymentTransaction transaction = PaymentTransaction.forOrder(order, PaymentAction.CHARGE, 10000L);

        // Then
        assertThat(transaction.getEntityClass()).isEqualTo(Order.class.getName());
        assertThat(transaction.getEntityIdentifier()).isEqualTo(order.getId());
        assertThat(transaction.references(Order.class)).isTrue();
        assertThat(transaction.references(Customer.class)).isFalse();
        assertThat(transaction.isSuccessful()).isFalse();
    }

    @Test
    @DisplayName("저장되지 않은 주문에는 결제 트랜잭션을 만들 수 없다")
    void forOrder_미저장주문_예외발생() {
        Order transientOrder = Order.create("ORD-002", null, 1000L);

        assertThatThrownBy(() -> PaymentTransaction.forOrder(transientOrder, PaymentAction.CHARGE, 1000L))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PAYMENT_TRANSACTION);
    }

    @Test
    @DisplayName("결제 금액은 0보다 커야 한다")
    void forOrder_금액0_예외발생() {
        assertThatThrownBy(() -> PaymentTransaction.forOrder(order, PaymentAction.CHARGE, 0L))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PAYMENT_TRANSACTION);
    }

    @Test
    @DisplayName("반영 금액 - 성공한 결제는 +, 성공한 환불은 -, 실패/승인은 0")
    void paidAmount() {
        PaymentTransaction capture = PaymentTransaction.forOrder(order, PaymentAction.CAPTURE, 7000L);
        PaymentTransaction refund = PaymentTransaction.forOrder(order, PaymentAction.REFUND, 2000L);
        PaymentTransaction authorize = PaymentTransaction.forOrder(order, PaymentAction.AUTHORIZE, 10000L);
        PaymentTransaction failed = PaymentTransaction.forOrder(order, PaymentAction.PURCHASE, 10000L);

        capture.complete("PG-1");
        refund.complete("PG-2");
        authorize.complete("PG-3");
        failed.fail();

        assertThat(capture.paidAmount()).isEqualTo(7000L);
        assertThat(capture.getReference()).isEqualTo("PG-1");
        assertThat(refund.paidAmount()).isEqualTo(-2000L);
        assertThat(authorize.paidAmount()).isZero();
        assertThat(failed.paidAmount()).isZero();
    }

    @Test
    @DisplayName("변경 전 값으로 반영 금액 계산 - 값이 비어 있으면 0")
    void paidAmount_값기준() {
        assertThat(PaymentTransaction.paidAmount(PaymentAction.PURCHASE, 5000L, true)).isEqualTo(5000L);
        assertThat(PaymentTransaction.paidAmount(PaymentAction.REFUND, 5000L, true)).isEqualTo(-5000L);
        assertThat(PaymentTransaction.paidAmount(PaymentAction.PURCHASE, 5000L, false)).isZero();
        assertThat(PaymentTransaction.paidAmount(null, 5000L, true)).isZero();
        assertThat(PaymentTransaction.paidAmount(PaymentAction.CAPTURE, null, true)).isZero();
    }
}
