package io.hhplus.bridge.infrastructure.persistence.order;

import io.hhplus.bridge.domain.order.Order;
import io.hhplus.bridge.domain.order.OrderRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * InMemory Order Repository
 *
 * DB 없이 도는 단위 테스트용 구현체입니다. @Profile("inmemory")에서만 등록됩니다.
 */
@Repository
@Profile("inmemory")
public class InMemoryOrderRepository implements OrderRepository {

    private final Map<Long, Order> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Optional<Order> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<Order> findByCustomerId(Long customerId) {
        return storage.values().stream()
                .filter(order -> order.hasCustomer() && customerId.equals(order.getCustomer().getId()))
                .sorted(Comparator.comparing(Order::getId))
                .toList();
    }

    @Override
    public Order save(Order order) {
        // ID가 없으면 새로 생성 (신규 저장)
        if (order.getId() == null) {
            Long newId = idGenerator.getAndIncrement();
            // Reflection으로 ID 설정 (JPA Entity는 setter가 없음)
            try {
                var idField = Order.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(order, newId);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to set ID", e);
            }
        }

        storage.put(order.getId(), order);
        return order;
    }

    @Override
    public void delete(Order order) {
        if (order.getId() != null) {
            storage.remove(order.getId());
        }
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
