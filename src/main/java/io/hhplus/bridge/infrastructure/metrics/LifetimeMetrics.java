package io.hhplus.bridge.infrastructure.metrics;

import io.hhplus.bridge.domain.lifetime.DrainResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 고객 생애 가치 재계산 메트릭
 *
 * 수집 메트릭:
 * - lifetime_recalculation_total{result=updated|unchanged|skipped}: 소유자 단위 재계산 결과
 * - lifetime_drain_total{status=success|failure}: 커밋 후 drain 횟수
 * - lifetime_drain_duration_seconds: drain 처리 시간 (P50, P95, P99)
 */
@Component
public class LifetimeMetrics {

    private final Counter updatedCounter;
    private final Counter unchangedCounter;
    private final Counter skippedCounter;

    private final Counter drainSuccessCounter;
    private final Counter drainFailureCounter;
    private final Timer drainDurationTimer;

    public LifetimeMetrics(MeterRegistry meterRegistry) {
        this.updatedCounter = Counter.builder("lifetime_recalculation_total")
                .tag("result", "updated")
                .description("Customers whose lifetime value changed and was saved")
                .register(meterRegistry);

        this.unchangedCounter = Counter.builder("lifetime_recalculation_total")
                .tag("result", "unchanged")
                .description("Customers recalculated without a lifetime value change")
                .register(meterRegistry);

        this.skippedCounter = Counter.builder("lifetime_recalculation_total")
                .tag("result", "skipped")
                .description("Queued customers skipped because they were never persisted")
                .register(meterRegistry);

        this.drainSuccessCounter = Counter.builder("lifetime_drain_total")
                .tag("status", "success")
                .description("Successful post-commit lifetime drains")
                .register(meterRegistry);

        this.drainFailureCounter = Counter.builder("lifetime_drain_total")
                .tag("status", "failure")
                .description("Failed post-commit lifetime drains")
                .register(meterRegistry);

        this.drainDurationTimer = Timer.builder("lifetime_drain_duration_seconds")
                .description("Post-commit lifetime drain duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    public void recordDrain(DrainResult result, long startTimeMs) {
        updatedCounter.increment(result.updated());
        unchangedCounter.increment(result.unchanged());
        skippedCounter.increment(result.skipped());
        drainSuccessCounter.increment();
        recordDuration(startTimeMs);
    }

    public void recordDrainFailure(long startTimeMs) {
        drainFailureCounter.increment();
        recordDuration(startTimeMs);
    }

    public void recordManualRecalculation(boolean updated) {
        if (updated) {
            updatedCounter.increment();
        } else {
            unchangedCounter.increment();
        }
    }

    private void recordDuration(long startTimeMs) {
        long duration = System.currentTimeMillis() - startTimeMs;
        drainDurationTimer.record(duration, TimeUnit.MILLISECONDS);
    }
}
