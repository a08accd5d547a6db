package io.hhplus.bridge.application.customer;

import io.hhplus.bridge.application.payment.PaymentStatusProvider;
import io.hhplus.bridge.config.LifetimeProperties;
import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.lifetime.ChangeKind;
import io.hhplus.bridge.domain.lifetime.LifetimeEntityRegistry;
import io.hhplus.bridge.domain.lifetime.PendingMutation;
import io.hhplus.bridge.domain.lifetime.RelatedEntityKind;
import io.hhplus.bridge.domain.order.Order;
import io.hhplus.bridge.domain.order.OrderRepository;
import io.hhplus.bridge.domain.payment.PaymentAction;
import io.hhplus.bridge.domain.payment.PaymentStatus;
import io.hhplus.bridge.domain.payment.PaymentTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Hibernate;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 트랜잭션 변경 목록 → 생애 가치 재계산 대상 고객
 *
 * <p>분류 규칙:
 * <ul>
 *   <li>Order INSERT/DELETE: 주문 고객은 항상 대상</li>
 *   <li>Order UPDATE: 변경 필드가 value-affecting 필드와 겹칠 때만 대상,
 *       고객이 바뀌었으면 이전 고객도 대상</li>
 *   <li>PaymentTransaction INSERT/UPDATE: 변경 전 또는 변경 후 주문 결제 상태가 FULL이면 주문 고객이 대상
 *       (완납, 환불/실패 처리로 완납 해제)</li>
 *   <li>같은 배치에서 삭제되는 고객은 대상에서 제외</li>
 * </ul>
 *
 * <p>커밋 전에 호출되며, 조회 외의 변경은 하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomerLifetimeChangeClassifier {

    private final LifetimeEntityRegistry entityRegistry;
    private final OrderRepository orderRepository;
    private final PaymentStatusProvider paymentStatusProvider;
    private final LifetimeProperties lifetimeProperties;

    public List<Customer> classify(List<PendingMutation> mutations) {
        Batch batch = new Batch(mutations);

        for (PendingMutation mutation : mutations) {
            RelatedEntityKind kind = entityRegistry.kindOf(mutation.entity());
            switch (kind) {
                case PRIMARY -> handleOrder((Order) mutation.entity(), mutation, batch);
                case SECONDARY -> handlePaymentTransaction((PaymentTransaction) mutation.entity(), mutation, batch);
                default -> {
                    // OWNER 삭제는 Batch에서 이미 반영, 그 외는 무관
                }
            }
        }

        return List.copyOf(batch.scheduled.values());
    }

    private void handleOrder(Order order, PendingMutation mutation, Batch batch) {
        switch (mutation.kind()) {
            case INSERT -> {
                if (batch.isDeleted(order)) {
                    log.debug("같은 트랜잭션에서 생성 후 삭제된 주문 무시: orderNumber={}", order.getOrderNumber());
                    return;
                }
                batch.schedule(order.getCustomer());
            }
            case DELETE -> {
                if (mutation.entityId() == null || batch.isInserted(order)) {
                    log.debug("저장된 적 없는 주문 삭제 무시: orderNumber={}", order.getOrderNumber());
                    return;
                }
                batch.schedule(order.getCustomer());
            }
            case UPDATE -> {
                if (!isChangeSetValuable(mutation)) {
                    return;
                }
                if (mutation.isChanged(Order.CUSTOMER_FIELD)
                        && mutation.previousValue(Order.CUSTOMER_FIELD) instanceof Customer previous) {
                    // 고객 변경: 이전 고객과 새 고객 모두 재계산
                    batch.schedule(previous);
                }
                batch.schedule(order.getCustomer());
            }
        }
    }

    private void handlePaymentTransaction(PaymentTransaction transaction, PendingMutation mutation, Batch batch) {
        if (mutation.kind() == ChangeKind.DELETE || !transaction.references(Order.class)) {
            return;
        }

        orderRepository.findById(transaction.getEntityIdentifier()).ifPresentOrElse(
            order -> {
                PaymentStatus after = paymentStatusProvider.computeStatus(order, List.of(transaction));
                PaymentStatus before = paymentStatusProvider.computeStatusBefore(
                    order, transaction, previousPaidAmount(transaction, mutation)
                );
                // FULL로 들어가거나 FULL에서 벗어나는 경우 모두 재계산
                if (after == PaymentStatus.FULL || before == PaymentStatus.FULL) {
                    batch.schedule(order.getCustomer());
                }
            },
            () -> log.debug("결제 대상 주문을 찾을 수 없어 무시: orderId={}", transaction.getEntityIdentifier())
        );
    }

    /**
     * 변경 전 트랜잭션의 반영 금액 (INSERT는 0)
     */
    private long previousPaidAmount(PaymentTransaction transaction, PendingMutation mutation) {
        if (mutation.kind() == ChangeKind.INSERT) {
            return 0L;
        }
        PaymentAction action = mutation.isChanged(PaymentTransaction.ACTION_FIELD)
            ? (PaymentAction) mutation.previousValue(PaymentTransaction.ACTION_FIELD)
            : transaction.getAction();
        Long amount = mutation.isChanged(PaymentTransaction.AMOUNT_FIELD)
            ? (Long) mutation.previousValue(PaymentTransaction.AMOUNT_FIELD)
            : transaction.getAmount();
        boolean successful = mutation.isChanged(PaymentTransaction.SUCCESSFUL_FIELD)
            ? Boolean.TRUE.equals(mutation.previousValue(PaymentTransaction.SUCCESSFUL_FIELD))
            : transaction.isSuccessful();
        return PaymentTransaction.paidAmount(action, amount, successful);
    }

    private boolean isChangeSetValuable(PendingMutation mutation) {
        return mutation.changedFields().stream()
            .anyMatch(lifetimeProperties.getValueAffectingFields()::contains);
    }

    /**
     * 한 번의 분류 호출 동안의 상태
     */
    private class Batch {

        private final Set<Object> insertedOrders = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<Object> deletedOrders = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<Object> deletedCustomerIds = new HashSet<>();
        private final Map<Object, Customer> scheduled = new LinkedHashMap<>();

        Batch(List<PendingMutation> mutations) {
            for (PendingMutation mutation : mutations) {
                RelatedEntityKind kind = entityRegistry.kindOf(mutation.entity());
                if (kind == RelatedEntityKind.PRIMARY && mutation.kind() == ChangeKind.INSERT) {
                    insertedOrders.add(mutation.entity());
                } else if (kind == RelatedEntityKind.PRIMARY && mutation.kind() == ChangeKind.DELETE) {
                    deletedOrders.add(mutation.entity());
                } else if (kind == RelatedEntityKind.OWNER && mutation.kind() == ChangeKind.DELETE
                        && mutation.entityId() != null) {
                    deletedCustomerIds.add(mutation.entityId());
                }
            }
        }

        boolean isInserted(Order order) {
            return insertedOrders.contains(order);
        }

        boolean isDeleted(Order order) {
            return deletedOrders.contains(order);
        }

        void schedule(Customer customer) {
            if (customer == null) {
                return;
            }
            // 커밋 이후 다른 영속성 컨텍스트에서 다루므로 프록시를 미리 초기화
            Customer owner = (Customer) Hibernate.unproxy(customer);
            if (owner.getId() != null && deletedCustomerIds.contains(owner.getId())) {
                log.debug("삭제 예정 고객은 재계산 대상에서 제외: customerId={}", owner.getId());
                return;
            }
            scheduled.putIfAbsent(owner.getId() != null ? owner.getId() : owner, owner);
        }
    }
}
