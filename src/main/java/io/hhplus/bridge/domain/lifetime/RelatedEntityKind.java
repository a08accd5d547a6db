package io.hhplus.bridge.domain.lifetime;

/**
 * 생애 가치 재계산 관점에서의 엔티티 분류
 */
public enum RelatedEntityKind {

    /**
     * 파생 값을 보유하는 엔티티 (Customer)
     * 삭제만 추적한다.
     */
    OWNER,

    /**
     * 소유자를 직접 참조하는 엔티티 (Order)
     */
    PRIMARY,

    /**
     * 부모 PRIMARY 엔티티를 통해 소유자에 닿는 엔티티 (PaymentTransaction)
     */
    SECONDARY,

    /**
     * 추적 대상 아님
     */
    UNTRACKED;

    public boolean isRelated() {
        return this == PRIMARY || this == SECONDARY;
    }
}
