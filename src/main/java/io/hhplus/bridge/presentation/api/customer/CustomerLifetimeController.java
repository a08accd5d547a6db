package io.hhplus.bridge.presentation.api.customer;

import io.hhplus.bridge.application.customer.dto.CustomerLifetimeResponse;
import io.hhplus.bridge.application.customer.dto.RecalculateLifetimeResponse;
import io.hhplus.bridge.application.usecase.customer.GetCustomerLifetimeUseCase;
import io.hhplus.bridge.application.usecase.customer.RecalculateLifetimeUseCase;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerLifetimeController {

    private final GetCustomerLifetimeUseCase getCustomerLifetimeUseCase;
    private final RecalculateLifetimeUseCase recalculateLifetimeUseCase;

    @GetMapping("/{customerId}/lifetime")
    public ResponseEntity<CustomerLifetimeResponse> getLifetime(
            @PathVariable @Positive Long customerId
    ) {
        CustomerLifetimeResponse response = getCustomerLifetimeUseCase.execute(customerId);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{customerId}/lifetime/recalculate")
    public ResponseEntity<RecalculateLifetimeResponse> recalculateLifetime(
            @PathVariable @Positive Long customerId
    ) {
        RecalculateLifetimeResponse response = recalculateLifetimeUseCase.execute(customerId);
        return ResponseEntity.ok(response);
    }
}
