package io.hhplus.bridge.domain.lifetime;

import org.hibernate.Hibernate;

import java.util.Map;

/**
 * 엔티티 타입 → RelatedEntityKind 매핑
 *
 * 등록 시점에 한 번 결정되며, 변경 건마다 클래스 이름을 비교하지 않는다.
 * Hibernate 프록시는 실제 엔티티 클래스로 풀어서 조회한다.
 */
public class LifetimeEntityRegistry {

    private final Map<Class<?>, RelatedEntityKind> kinds;

    public LifetimeEntityRegistry(Map<Class<?>, RelatedEntityKind> kinds) {
        this.kinds = Map.copyOf(kinds);
    }

    public RelatedEntityKind kindOf(Object entity) {
        if (entity == null) {
            return RelatedEntityKind.UNTRACKED;
        }
        return kinds.getOrDefault(Hibernate.getClass(entity), RelatedEntityKind.UNTRACKED);
    }

    public boolean isTracked(Object entity) {
        return kindOf(entity) != RelatedEntityKind.UNTRACKED;
    }

    public boolean isRelated(Object entity) {
        return kindOf(entity).isRelated();
    }
}
