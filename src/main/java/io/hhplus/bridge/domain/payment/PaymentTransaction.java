package io.hhplus.bridge.domain.payment;

import io.hhplus.bridge.common.exception.BusinessException;
import io.hhplus.bridge.common.exception.ErrorCode;
import io.hhplus.bridge.domain.common.BaseTimeEntity;
import io.hhplus.bridge.domain.order.Order;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 트랜잭션
 *
 * 결제 대상은 (entityClass, entityIdentifier)로 느슨하게 참조한다.
 * 주문 결제는 entityClass = Order 클래스 이름.
 */
@Entity
@Table(
    name = "payment_transactions",
    indexes = {
        @Index(name = "idx_payment_entity", columnList = "entity_class, entity_identifier")
    }
)
@Getter
@NoArgsConstructor
public class PaymentTransaction extends BaseTimeEntity {

    /**
     * 결제 반영 금액에 영향을 주는 필드 이름 (Hibernate property name)
     */
    public static final String ACTION_FIELD = "action";
    public static final String AMOUNT_FIELD = "amount";
    public static final String SUCCESSFUL_FIELD = "successful";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_class", nullable = false)
    private String entityClass;

    @Column(name = "entity_identifier", nullable = false)
    private Long entityIdentifier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentAction action;

    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false)
    private boolean successful;

    @Column(length = 100)
    private String reference;  // PG 거래 번호

    public static PaymentTransaction forOrder(Order order, PaymentAction action, Long amount) {
        if (order == null || order.getId() == null) {
            throw new BusinessException(
                ErrorCode.INVALID_PAYMENT_TRANSACTION,
                "저장된 주문에 대해서만 결제 트랜잭션을 생성할 수 있습니다"
            );
        }
        validateAction(action);
        validateAmount(amount);

        PaymentTransaction transaction = new PaymentTransaction();
        transaction.entityClass = Order.class.getName();
        transaction.entityIdentifier = order.getId();
        transaction.action = action;
        transaction.amount = amount;
        transaction.successful = false;

        return transaction;
    }

    public void complete(String reference) {
        this.successful = true;
        this.reference = reference;
    }

    public void fail() {
        this.successful = false;
    }

    public boolean references(Class<?> entityType) {
        return entityType.getName().equals(this.entityClass);
    }

    /**
     * 결제 상태 계산에 반영되는 금액
     * 성공한 매입/결제는 +, 성공한 환불은 -, 나머지는 0
     */
    public long paidAmount() {
        return paidAmount(action, amount, successful);
    }

    public static long paidAmount(PaymentAction action, Long amount, boolean successful) {
        if (!successful || action == null || amount == null) {
            return 0L;
        }
        if (action.isPayment()) {
            return amount;
        }
        if (action == PaymentAction.REFUND) {
            return -amount;
        }
        return 0L;
    }

    private static void validateAction(PaymentAction action) {
        if (action == null) {
            throw new BusinessException(
                ErrorCode.INVALID_PAYMENT_TRANSACTION,
                "결제 액션은 필수입니다"
            );
        }
    }

    private static void validateAmount(Long amount) {
        if (amount == null || amount <= 0) {
            throw new BusinessException(
                ErrorCode.INVALID_PAYMENT_TRANSACTION,
                "결제 금액은 0보다 커야 합니다"
            );
        }
    }
}
