package io.hhplus.bridge.infrastructure.persistence.order;

import io.hhplus.bridge.domain.order.Order;
import io.hhplus.bridge.domain.order.OrderRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaOrderRepository extends JpaRepository<Order, Long>, OrderRepository {

    // Explicitly declare methods to resolve ambiguity with OrderRepository
    @Override
    Optional<Order> findById(Long id);

    @Override
    Order save(Order order);

    @Override
    void delete(Order order);

    /**
     * 고객의 주문 목록 (생애 가치 계산용)
     * 인덱스: idx_order_customer
     */
    @Override
    @Query("SELECT o FROM Order o WHERE o.customer.id = :customerId ORDER BY o.id")
    List<Order> findByCustomerId(@Param("customerId") Long customerId);
}
