package io.hhplus.bridge.domain.customer;

import io.hhplus.bridge.common.exception.BusinessException;
import io.hhplus.bridge.common.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

public interface CustomerRepository {

    // Note: findById, save, saveAll, delete are provided by JpaRepository
    // Declared here for InMemoryCustomerRepository compatibility

    Optional<Customer> findById(Long id);

    Customer save(Customer customer);

    <S extends Customer> List<S> saveAll(Iterable<S> customers);

    void delete(Customer customer);

    default Customer findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CUSTOMER_NOT_FOUND,
                "고객을 찾을 수 없습니다. customerId: " + id
            ));
    }
}
