package io.hhplus.bridge.domain.payment;

/**
 * 결제 트랜잭션 액션
 */
public enum PaymentAction {
    /**
     * 승인 (금액 홀드, 결제 완료 아님)
     */
    AUTHORIZE,

    /**
     * 승인된 금액 매입
     */
    CAPTURE,

    /**
     * 즉시 결제
     */
    CHARGE,

    /**
     * 승인 + 매입
     */
    PURCHASE,

    /**
     * 환불
     */
    REFUND;

    public boolean isPayment() {
        return this == CAPTURE || this == CHARGE || this == PURCHASE;
    }
}
