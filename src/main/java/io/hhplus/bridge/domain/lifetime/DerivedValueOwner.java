package io.hhplus.bridge.domain.lifetime;

/**
 * 연관 엔티티로부터 계산되는 파생 값을 보유하는 엔티티 (예: 고객의 생애 가치)
 *
 * 식별자를 읽고 파생 값을 갱신하는 것 외에는 DeferredRecomputeQueue가 건드리지 않는다.
 */
public interface DerivedValueOwner {

    /**
     * @return 식별자, 아직 저장되지 않았으면 null
     */
    Long getId();

    Long getDerivedValue();

    void changeDerivedValue(Long value);
}
