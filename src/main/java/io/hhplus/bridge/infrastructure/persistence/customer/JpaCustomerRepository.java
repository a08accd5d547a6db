package io.hhplus.bridge.infrastructure.persistence.customer;

import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.customer.CustomerRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaCustomerRepository extends JpaRepository<Customer, Long>, CustomerRepository {

    // Explicitly declare methods to resolve ambiguity with CustomerRepository
    @Override
    Optional<Customer> findById(Long id);

    @Override
    Customer save(Customer customer);

    @Override
    <S extends Customer> List<S> saveAll(Iterable<S> customers);

    @Override
    void delete(Customer customer);
}
