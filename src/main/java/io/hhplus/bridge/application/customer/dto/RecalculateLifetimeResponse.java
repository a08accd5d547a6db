package io.hhplus.bridge.application.customer.dto;

public record RecalculateLifetimeResponse(
    Long customerId,
    Long previousLifetime,
    Long lifetime,
    boolean changed
) {
    public static RecalculateLifetimeResponse of(Long customerId, Long previousLifetime, Long lifetime) {
        return new RecalculateLifetimeResponse(
            customerId,
            previousLifetime,
            lifetime,
            !previousLifetime.equals(lifetime)
        );
    }
}
