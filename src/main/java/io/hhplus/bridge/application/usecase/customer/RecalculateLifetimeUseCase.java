package io.hhplus.bridge.application.usecase.customer;

import io.hhplus.bridge.application.customer.LifetimeProcessor;
import io.hhplus.bridge.application.customer.dto.RecalculateLifetimeResponse;
import io.hhplus.bridge.application.usecase.UseCase;
import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.customer.CustomerRepository;
import io.hhplus.bridge.infrastructure.metrics.LifetimeMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

/**
 * 고객 생애 가치 수동 재계산 UseCase
 * <p>
 * 트랜잭션 리스너가 놓친 변경 (직접 SQL 수정, 리스너 비활성화 기간 등)을 보정할 때 사용한다.
 * 값이 바뀐 경우에만 저장한다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class RecalculateLifetimeUseCase {

    private final CustomerRepository customerRepository;
    private final LifetimeProcessor lifetimeProcessor;
    private final LifetimeMetrics metrics;

    @Transactional
    public RecalculateLifetimeResponse execute(Long customerId) {
        Customer customer = customerRepository.findByIdOrThrow(customerId);

        Long previousLifetime = customer.getLifetime();
        Long lifetime = lifetimeProcessor.calculateLifetimeValue(customer);

        RecalculateLifetimeResponse response =
                RecalculateLifetimeResponse.of(customerId, previousLifetime, lifetime);

        if (response.changed()) {
            customer.changeDerivedValue(lifetime);
            customerRepository.save(customer);
            log.info("생애 가치 수동 재계산: customerId={}, {} → {}", customerId, previousLifetime, lifetime);
        } else {
            log.debug("생애 가치 변경 없음: customerId={}, lifetime={}", customerId, lifetime);
        }
        metrics.recordManualRecalculation(response.changed());

        return response;
    }
}
