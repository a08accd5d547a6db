package io.hhplus.bridge.domain.payment;

/**
 * 주문 결제 상태
 */
public enum PaymentStatus {
    /**
     * 결제 내역 없음
     */
    NONE,

    /**
     * 부분 결제
     */
    PARTIAL,

    /**
     * 완납 (생애 가치 합산 대상)
     */
    FULL
}
