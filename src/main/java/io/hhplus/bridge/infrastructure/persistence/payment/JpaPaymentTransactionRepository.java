package io.hhplus.bridge.infrastructure.persistence.payment;

import io.hhplus.bridge.domain.payment.PaymentTransaction;
import io.hhplus.bridge.domain.payment.PaymentTransactionRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaPaymentTransactionRepository
        extends JpaRepository<PaymentTransaction, Long>, PaymentTransactionRepository {

    @Override
    Optional<PaymentTransaction> findById(Long id);

    @Override
    PaymentTransaction save(PaymentTransaction transaction);

    /**
     * 결제 대상 엔티티의 트랜잭션 목록
     * 인덱스: idx_payment_entity
     */
    @Override
    List<PaymentTransaction> findByEntityClassAndEntityIdentifier(String entityClass, Long entityIdentifier);
}
