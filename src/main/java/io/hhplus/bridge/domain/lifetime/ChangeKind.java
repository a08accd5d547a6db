package io.hhplus.bridge.domain.lifetime;

/**
 * 트랜잭션 내 엔티티 변경 종류
 */
public enum ChangeKind {
    INSERT,
    UPDATE,
    DELETE
}
