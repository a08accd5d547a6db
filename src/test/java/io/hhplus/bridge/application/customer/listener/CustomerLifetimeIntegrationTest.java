package io.hhplus.bridge.application.customer.listener;

import io.hhplus.bridge.config.TestContainersConfig;
import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.customer.CustomerRepository;
import io.hhplus.bridge.domain.order.Order;
import io.hhplus.bridge.domain.order.OrderRepository;
import io.hhplus.bridge.domain.payment.PaymentAction;
import io.hhplus.bridge.domain.payment.PaymentTransaction;
import io.hhplus.bridge.domain.payment.PaymentTransactionRepository;
import io.hhplus.bridge.infrastructure.persistence.customer.JpaCustomerRepository;
import io.hhplus.bridge.infrastructure.persistence.order.JpaOrderRepository;
import io.hhplus.bridge.infrastructure.persistence.payment.JpaPaymentTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 실제 트랜잭션(MySQL)에서 Interceptor → 리스너 → 커밋 후 재계산 흐름 검증
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@Import(TestContainersConfig.class)
class CustomerLifetimeIntegrationTest {

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private PaymentTransactionRepository paymentTransactionRepository;

    @Autowired
    private JpaCustomerRepository jpaCustomerRepository;

    @Autowired
    private JpaOrderRepository jpaOrderRepository;

    @Autowired
    private JpaPaymentTransactionRepository jpaPaymentTransactionRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        // 테이블 초기화
        jpaPaymentTransactionRepository.deleteAllInBatch();
        jpaOrderRepository.deleteAllInBatch();
        jpaCustomerRepository.deleteAllInBatch();

        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Test
    @DisplayName("결제 완료가 커밋되면 고객 생애 가치가 갱신된다")
    void 결제완료_생애가치갱신() {
        // Given
        Long customerId = saveCustomer("홍길동");
        Long orderId = saveOrder("ORD-IT-001", customerId, 30000L);
        assertThat(lifetimeOf(customerId)).isZero();

        // When
        pay(orderId, PaymentAction.PURCHASE, 30000L);

        // Then
        assertThat(lifetimeOf(customerId)).isEqualTo(30000L);
    }

    @Test
    @DisplayName("완납 주문이 전액 환불되면 고객 생애 가치에서 빠진다")
    void 전액환불_생애가치차감() {
        // Given
        Long customerId = saveCustomer("홍길동");
        Long orderId = saveOrder("ORD-IT-008", customerId, 30000L);
        pay(orderId, PaymentAction.PURCHASE, 30000L);
        assertThat(lifetimeOf(customerId)).isEqualTo(30000L);

        // When
        pay(orderId, PaymentAction.REFUND, 30000L);

        // Then
        assertThat(lifetimeOf(customerId)).isZero();
    }

    @Test
    @DisplayName("부분 결제는 생애 가치에 반영되지 않는다")
    void 부분결제_반영안됨() {
        Long customerId = saveCustomer("홍길동");
        Long orderId = saveOrder("ORD-IT-002", customerId, 30000L);

        pay(orderId, PaymentAction.CAPTURE, 10000L);

        assertThat(lifetimeOf(customerId)).isZero();
    }

    @Test
    @DisplayName("완납 주문의 소계가 바뀌면 dirty checking만으로도 재계산된다")
    void 소계변경_재계산() {
        // Given
        Long customerId = saveCustomer("홍길동");
        Long orderId = saveOrder("ORD-IT-003", customerId, 30000L);
        pay(orderId, PaymentAction.PURCHASE, 30000L);

        // When: 결제액보다 작은 소계로 변경 (여전히 FULL)
        transactionTemplate.executeWithoutResult(status -> {
            Order order = orderRepository.findByIdOrThrow(orderId);
            order.changeSubtotal(25000L);
        });

        // Then
        assertThat(lifetimeOf(customerId)).isEqualTo(25000L);
    }

    @Test
    @DisplayName("메모만 바뀐 주문은 재계산하지 않는다")
    void 메모변경_재계산없음() {
        // Given
        Long customerId = saveCustomer("홍길동");
        Long orderId = saveOrder("ORD-IT-004", customerId, 30000L);
        pay(orderId, PaymentAction.PURCHASE, 30000L);

        // 생애 가치를 어긋나게 만들어 재계산 여부를 드러낸다
        transactionTemplate.executeWithoutResult(status -> {
            Customer customer = customerRepository.findByIdOrThrow(customerId);
            customer.changeDerivedValue(1L);
        });

        // When
        transactionTemplate.executeWithoutResult(status -> {
            Order order = orderRepository.findByIdOrThrow(orderId);
            order.updateNotes("부재 시 경비실");
        });

        // Then
        assertThat(lifetimeOf(customerId)).isEqualTo(1L);
    }

    @Test
    @DisplayName("주문 고객이 바뀌면 이전 고객과 새 고객 모두 재계산된다")
    void 고객변경_양쪽재계산() {
        // Given
        Long previousId = saveCustomer("홍길동");
        Long nextId = saveCustomer("김철수");
        Long orderId = saveOrder("ORD-IT-005", previousId, 30000L);
        pay(orderId, PaymentAction.PURCHASE, 30000L);
        assertThat(lifetimeOf(previousId)).isEqualTo(30000L);

        // When
        transactionTemplate.executeWithoutResult(status -> {
            Order order = orderRepository.findByIdOrThrow(orderId);
            order.assignCustomer(customerRepository.findByIdOrThrow(nextId));
        });

        // Then
        assertThat(lifetimeOf(previousId)).isZero();
        assertThat(lifetimeOf(nextId)).isEqualTo(30000L);
    }

    @Test
    @DisplayName("완납 주문이 삭제되면 생애 가치에서 빠진다")
    void 주문삭제_재계산() {
        // Given
        Long customerId = saveCustomer("홍길동");
        Long orderId = saveOrder("ORD-IT-006", customerId, 30000L);
        pay(orderId, PaymentAction.PURCHASE, 30000L);

        // When
        transactionTemplate.executeWithoutResult(status ->
            orderRepository.delete(orderRepository.findByIdOrThrow(orderId))
        );

        // Then
        assertThat(lifetimeOf(customerId)).isZero();
    }

    @Test
    @DisplayName("롤백된 트랜잭션은 재계산하지 않는다")
    void 롤백_재계산없음() {
        // Given
        Long customerId = saveCustomer("홍길동");
        Long orderId = saveOrder("ORD-IT-007", customerId, 30000L);

        // When
        transactionTemplate.executeWithoutResult(status -> {
            Order order = orderRepository.findByIdOrThrow(orderId);
            PaymentTransaction transaction = PaymentTransaction.forOrder(order, PaymentAction.PURCHASE, 30000L);
            transaction.complete("PG-ROLLBACK");
            paymentTransactionRepository.save(transaction);
            status.setRollbackOnly();
        });

        // Then
        assertThat(lifetimeOf(customerId)).isZero();
    }

    private Long saveCustomer(String name) {
        return transactionTemplate.execute(status ->
            customerRepository.save(Customer.create(name, null)).getId()
        );
    }

    private Long saveOrder(String orderNumber, Long customerId, Long subtotal) {
        return transactionTemplate.execute(status -> {
            Customer customer = customerRepository.findByIdOrThrow(customerId);
            return orderRepository.save(Order.create(orderNumber, customer, subtotal)).getId();
        });
    }

    private void pay(Long orderId, PaymentAction action, Long amount) {
        transactionTemplate.executeWithoutResult(status -> {
            Order order = orderRepository.findByIdOrThrow(orderId);
            PaymentTransaction transaction = PaymentTransaction.forOrder(order, action, amount);
            transaction.complete("PG-" + orderId + "-" + action.name());
            paymentTransactionRepository.save(transaction);
        });
    }

    private Long lifetimeOf(Long customerId) {
        return transactionTemplate.execute(status ->
            customerRepository.findByIdOrThrow(customerId).getLifetime()
        );
    }
}
