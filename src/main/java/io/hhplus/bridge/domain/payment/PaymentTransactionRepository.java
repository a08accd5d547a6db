package io.hhplus.bridge.domain.payment;

import java.util.List;
import java.util.Optional;

public interface PaymentTransactionRepository {

    Optional<PaymentTransaction> findById(Long id);

    List<PaymentTransaction> findByEntityClassAndEntityIdentifier(String entityClass, Long entityIdentifier);

    PaymentTransaction save(PaymentTransaction transaction);
}
