package io.hhplus.bridge.infrastructure.persistence.customer;

import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.customer.CustomerRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * InMemory Customer Repository
 *
 * DB 없이 도는 단위 테스트용 구현체입니다. @Profile("inmemory")에서만 등록됩니다.
 */
@Repository
@Profile("inmemory")
public class InMemoryCustomerRepository implements CustomerRepository {

    private final Map<Long, Customer> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);
    private final AtomicLong saveAllCount = new AtomicLong();

    @Override
    public Optional<Customer> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public Customer save(Customer customer) {
        // ID가 없으면 새로 생성 (신규 저장)
        if (customer.getId() == null) {
            assignId(customer, idGenerator.getAndIncrement());
        }

        storage.put(customer.getId(), customer);
        return customer;
    }

    @Override
    public <S extends Customer> List<S> saveAll(Iterable<S> customers) {
        saveAllCount.incrementAndGet();
        List<S> saved = new ArrayList<>();
        for (S customer : customers) {
            save(customer);
            saved.add(customer);
        }
        return saved;
    }

    @Override
    public void delete(Customer customer) {
        if (customer.getId() != null) {
            storage.remove(customer.getId());
        }
    }

    /**
     * saveAll 호출 횟수 (배치 저장 검증용)
     */
    public long getSaveAllCount() {
        return saveAllCount.get();
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
        saveAllCount.set(0);
    }

    private void assignId(Customer customer, Long newId) {
        // Reflection으로 ID 설정 (JPA Entity는 setter가 없음)
        try {
            var idField = Customer.class.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(customer, newId);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to set ID", e);
        }
    }
}
