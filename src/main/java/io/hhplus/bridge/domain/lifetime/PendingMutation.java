package io.hhplus.bridge.domain.lifetime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 커밋 대기 중인 엔티티 변경 1건
 *
 * @param entity         변경된 엔티티
 * @param entityId       기록 시점의 식별자 (IDENTITY 전략의 INSERT는 null)
 * @param kind           변경 종류
 * @param previousValues UPDATE에서 변경된 필드 → 변경 전 값 (값은 null일 수 있음)
 */
public record PendingMutation(
    Object entity,
    Object entityId,
    ChangeKind kind,
    Map<String, Object> previousValues
) {

    public PendingMutation {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(kind, "kind");
        previousValues = previousValues == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(previousValues));
    }

    public static PendingMutation inserted(Object entity, Object entityId) {
        return new PendingMutation(entity, entityId, ChangeKind.INSERT, null);
    }

    public static PendingMutation updated(Object entity, Object entityId, Map<String, Object> previousValues) {
        return new PendingMutation(entity, entityId, ChangeKind.UPDATE, previousValues);
    }

    public static PendingMutation deleted(Object entity, Object entityId) {
        return new PendingMutation(entity, entityId, ChangeKind.DELETE, null);
    }

    public Set<String> changedFields() {
        return previousValues.keySet();
    }

    public boolean isChanged(String field) {
        return previousValues.containsKey(field);
    }

    public Object previousValue(String field) {
        return previousValues.get(field);
    }
}
