package io.hhplus.bridge.domain.order;

import io.hhplus.bridge.common.exception.BusinessException;
import io.hhplus.bridge.common.exception.ErrorCode;
import io.hhplus.bridge.domain.common.BaseTimeEntity;
import io.hhplus.bridge.domain.customer.Customer;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(
    name = "orders",
    indexes = {
        @Index(name = "idx_order_customer", columnList = "customer_id")
    }
)
@Getter
@NoArgsConstructor
public class Order extends BaseTimeEntity {

    /**
     * 생애 가치에 영향을 주는 필드 이름 (Hibernate property name)
     */
    public static final String CUSTOMER_FIELD = "customer";
    public static final String SUBTOTAL_FIELD = "subtotalValue";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_number", unique = true, length = 30, nullable = false)
    private String orderNumber;  // Business ID (외부 노출용, e.g., "ORD-20250111-001")

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id", foreignKey = @ForeignKey(name = "fk_order_customer"))
    private Customer customer;  // 비회원 주문이면 null

    @Column(name = "subtotal_value", nullable = false)
    private Long subtotalValue;  // 소계 (생애 가치 합산 대상)

    @Column(name = "customer_notes", length = 500)
    private String customerNotes;  // 생애 가치와 무관

    public static Order create(String orderNumber, Customer customer, Long subtotalValue) {
        validateOrderNumber(orderNumber);
        validateSubtotal(subtotalValue);

        Order order = new Order();
        order.orderNumber = orderNumber;
        order.customer = customer;
        order.subtotalValue = subtotalValue;
        // createdAt / updatedAt은 JPA Auditing이 자동 처리

        return order;
    }

    public void changeSubtotal(Long subtotalValue) {
        validateSubtotal(subtotalValue);

        this.subtotalValue = subtotalValue;
    }

    public void assignCustomer(Customer customer) {
        this.customer = customer;
    }

    public void updateNotes(String customerNotes) {
        this.customerNotes = customerNotes;
    }

    public boolean hasCustomer() {
        return this.customer != null;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateOrderNumber(String orderNumber) {
        if (orderNumber == null || orderNumber.trim().isEmpty()) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "주문 번호는 필수입니다"
            );
        }
    }

    private static void validateSubtotal(Long subtotalValue) {
        if (subtotalValue == null || subtotalValue < 0) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "주문 소계는 0 이상이어야 합니다"
            );
        }
    }
}
