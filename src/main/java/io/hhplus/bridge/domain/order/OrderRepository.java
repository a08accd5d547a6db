package io.hhplus.bridge.domain.order;

import io.hhplus.bridge.common.exception.BusinessException;
import io.hhplus.bridge.common.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

public interface OrderRepository {

    // Note: findById, save, delete are provided by JpaRepository
    // Only declare domain-specific methods here

    Optional<Order> findById(Long id);  // Declared for InMemoryOrderRepository compatibility

    List<Order> findByCustomerId(Long customerId);

    Order save(Order order);  // Declared for InMemoryOrderRepository compatibility

    void delete(Order order);  // Declared for InMemoryOrderRepository compatibility

    default Order findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.ORDER_NOT_FOUND,
                "주문을 찾을 수 없습니다. orderId: " + id
            ));
    }
}
