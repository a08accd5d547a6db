package io.hhplus.bridge.infrastructure.persistence.lifetime;

import io.hhplus.bridge.application.customer.listener.CustomerLifetimeListener;
import io.hhplus.bridge.domain.lifetime.LifetimeEntityRegistry;
import io.hhplus.bridge.domain.lifetime.PendingMutation;
import org.hibernate.Interceptor;
import org.hibernate.type.Type;
import org.springframework.beans.factory.ObjectProvider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Hibernate Interceptor → PendingMutation 변환
 *
 * <ul>
 *   <li>onSave: INSERT (IDENTITY 전략에서는 id 없이 호출됨)</li>
 *   <li>onFlushDirty: UPDATE, 변경 필드와 변경 전 값 포함</li>
 *   <li>onDelete: DELETE (고객 삭제 포함)</li>
 *   <li>onLoad: 연관 엔티티가 로드되면 트랜잭션 추적만 시작</li>
 * </ul>
 *
 * SessionFactory 생성 시점에 등록되므로 리스너는 ObjectProvider로 늦게 조회한다.
 * 항상 false를 반환해 엔티티 상태를 바꾸지 않는다.
 */
public class LifetimeTrackingInterceptor implements Interceptor {

    private final LifetimeEntityRegistry entityRegistry;
    private final ObjectProvider<CustomerLifetimeListener> listenerProvider;

    public LifetimeTrackingInterceptor(
            LifetimeEntityRegistry entityRegistry,
            ObjectProvider<CustomerLifetimeListener> listenerProvider
    ) {
        this.entityRegistry = entityRegistry;
        this.listenerProvider = listenerProvider;
    }

    @Override
    public boolean onLoad(Object entity, Object id, Object[] state, String[] propertyNames, Type[] types) {
        if (entityRegistry.isRelated(entity)) {
            withListener(CustomerLifetimeListener::track);
        }
        return false;
    }

    @Override
    public boolean onSave(Object entity, Object id, Object[] state, String[] propertyNames, Type[] types) {
        if (entityRegistry.isRelated(entity)) {
            withListener(listener -> listener.record(PendingMutation.inserted(entity, id)));
        }
        return false;
    }

    @Override
    public boolean onFlushDirty(
            Object entity,
            Object id,
            Object[] currentState,
            Object[] previousState,
            String[] propertyNames,
            Type[] types
    ) {
        if (entityRegistry.isRelated(entity)) {
            Map<String, Object> changed = changedValues(currentState, previousState, propertyNames);
            if (!changed.isEmpty()) {
                withListener(listener -> listener.record(PendingMutation.updated(entity, id, changed)));
            }
        }
        return false;
    }

    @Override
    public void onDelete(Object entity, Object id, Object[] state, String[] propertyNames, Type[] types) {
        if (entityRegistry.isTracked(entity)) {
            withListener(listener -> listener.record(PendingMutation.deleted(entity, id)));
        }
    }

    /**
     * 변경된 필드 → 변경 전 값
     * <p>
     * 이전 스냅샷이 없으면 (detached 엔티티 재부착) 모든 필드를 변경된 것으로 본다.
     */
    static Map<String, Object> changedValues(Object[] currentState, Object[] previousState, String[] propertyNames) {
        Map<String, Object> changed = new LinkedHashMap<>();
        for (int i = 0; i < propertyNames.length; i++) {
            if (previousState == null) {
                changed.put(propertyNames[i], null);
            } else if (!Objects.equals(currentState[i], previousState[i])) {
                changed.put(propertyNames[i], previousState[i]);
            }
        }
        return changed;
    }

    private void withListener(Consumer<CustomerLifetimeListener> action) {
        CustomerLifetimeListener listener = listenerProvider.getIfAvailable();
        if (listener != null) {
            action.accept(listener);
        }
    }
}
