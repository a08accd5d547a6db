package io.hhplus.bridge.infrastructure.persistence.payment;

import io.hhplus.bridge.domain.payment.PaymentTransaction;
import io.hhplus.bridge.domain.payment.PaymentTransactionRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * InMemory PaymentTransaction Repository
 *
 * DB 없이 도는 단위 테스트용 구현체입니다. @Profile("inmemory")에서만 등록됩니다.
 */
@Repository
@Profile("inmemory")
public class InMemoryPaymentTransactionRepository implements PaymentTransactionRepository {

    private final Map<Long, PaymentTransaction> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Optional<PaymentTransaction> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<PaymentTransaction> findByEntityClassAndEntityIdentifier(String entityClass, Long entityIdentifier) {
        return storage.values().stream()
                .filter(tx -> entityClass.equals(tx.getEntityClass()))
                .filter(tx -> entityIdentifier.equals(tx.getEntityIdentifier()))
                .sorted(Comparator.comparing(PaymentTransaction::getId))
                .toList();
    }

    @Override
    public PaymentTransaction save(PaymentTransaction transaction) {
        if (transaction.getId() == null) {
            Long newId = idGenerator.getAndIncrement();
            try {
                var idField = PaymentTransaction.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(transaction, newId);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to set ID", e);
            }
        }

        storage.put(transaction.getId(), transaction);
        return transaction;
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
