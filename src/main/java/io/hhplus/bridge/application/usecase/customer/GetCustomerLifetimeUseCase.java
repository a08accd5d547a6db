package io.hhplus.bridge.application.usecase.customer;

import io.hhplus.bridge.application.customer.dto.CustomerLifetimeResponse;
import io.hhplus.bridge.application.usecase.UseCase;
import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.customer.CustomerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

@UseCase
@RequiredArgsConstructor
public class GetCustomerLifetimeUseCase {

    private final CustomerRepository customerRepository;

    @Transactional(readOnly = true)
    public CustomerLifetimeResponse execute(Long customerId) {
        Customer customer = customerRepository.findByIdOrThrow(customerId);
        return CustomerLifetimeResponse.from(customer);
    }
}
