package io.hhplus.bridge.application.payment;

import io.hhplus.bridge.domain.order.Order;
import io.hhplus.bridge.domain.payment.PaymentStatus;
import io.hhplus.bridge.domain.payment.PaymentTransaction;
import io.hhplus.bridge.domain.payment.PaymentTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 주문 결제 상태 계산
 *
 * 결제액 = 성공한 매입/결제 합계 - 성공한 환불 합계
 * - 결제액 <= 0 → NONE
 * - 결제액 >= 주문 소계 → FULL
 * - 그 외 → PARTIAL
 */
@Component
@RequiredArgsConstructor
public class PaymentStatusProvider {

    private final PaymentTransactionRepository paymentTransactionRepository;

    public PaymentStatus getPaymentStatus(Order order) {
        return computeStatus(order, List.of());
    }

    /**
     * 저장된 트랜잭션 + 새 트랜잭션 기준 결제 상태
     * <p>
     * 이미 flush된 트랜잭션이 조회 결과에 포함될 수 있으므로 ID 기준으로 중복을 제거한다.
     *
     * @param order           결제 대상 주문
     * @param newTransactions 아직 커밋되지 않은 트랜잭션
     */
    public PaymentStatus computeStatus(Order order, Collection<PaymentTransaction> newTransactions) {
        return statusOf(order, paidAmount(order, newTransactions));
    }

    /**
     * 트랜잭션 하나가 바뀌기 전의 결제 상태
     * <p>
     * 현재 상태에서 해당 트랜잭션의 반영 금액을 빼고 변경 전 반영 금액을 더한다.
     * FULL에서 벗어나는 변경 (환불, 결제 실패 처리)을 잡기 위해 사용한다.
     *
     * @param previousPaidAmount 변경 전 반영 금액, 새로 생성된 트랜잭션이면 0
     */
    public PaymentStatus computeStatusBefore(Order order, PaymentTransaction transaction, long previousPaidAmount) {
        long paid = paidAmount(order, List.of(transaction)) - transaction.paidAmount() + previousPaidAmount;
        return statusOf(order, paid);
    }

    private long paidAmount(Order order, Collection<PaymentTransaction> newTransactions) {
        Map<Object, PaymentTransaction> transactions = new LinkedHashMap<>();

        if (order.getId() != null) {
            paymentTransactionRepository
                .findByEntityClassAndEntityIdentifier(Order.class.getName(), order.getId())
                .forEach(tx -> transactions.put(tx.getId(), tx));
        }
        for (PaymentTransaction tx : newTransactions) {
            transactions.put(tx.getId() != null ? tx.getId() : tx, tx);
        }

        return transactions.values().stream()
            .mapToLong(PaymentTransaction::paidAmount)
            .sum();
    }

    private PaymentStatus statusOf(Order order, long paid) {
        if (paid <= 0) {
            return PaymentStatus.NONE;
        }
        return paid >= order.getSubtotalValue() ? PaymentStatus.FULL : PaymentStatus.PARTIAL;
    }
}
