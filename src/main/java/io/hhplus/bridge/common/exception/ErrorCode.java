package io.hhplus.bridge.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 고객 관련 (CU)
    // ====================================
    CUSTOMER_NOT_FOUND("CU001", "고객을 찾을 수 없습니다"),
    LIFETIME_RECALCULATION_FAILED("CU002", "고객 생애 가치 재계산에 실패했습니다"),

    // ====================================
    // 주문 관련 (O)
    // ====================================
    ORDER_NOT_FOUND("O001", "주문을 찾을 수 없습니다"),

    // ====================================
    // 결제 관련 (PAY)
    // ====================================
    INVALID_PAYMENT_TRANSACTION("PAY001", "결제 트랜잭션이 올바르지 않습니다"),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INTERNAL_SERVER_ERROR("COMMON001", "서버 내부 오류가 발생했습니다"),
    INVALID_INPUT("COMMON002", "입력값이 올바르지 않습니다");

    private final String code;
    private final String message;
}
