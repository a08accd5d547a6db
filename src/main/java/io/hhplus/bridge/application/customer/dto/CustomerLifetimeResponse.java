package io.hhplus.bridge.application.customer.dto;

import io.hhplus.bridge.domain.customer.Customer;

import java.time.LocalDateTime;

public record CustomerLifetimeResponse(
    Long customerId,
    String name,
    Long lifetime,
    LocalDateTime updatedAt
) {
    public static CustomerLifetimeResponse from(Customer customer) {
        return new CustomerLifetimeResponse(
            customer.getId(),
            customer.getName(),
            customer.getLifetime(),
            customer.getUpdatedAt()
        );
    }
}
