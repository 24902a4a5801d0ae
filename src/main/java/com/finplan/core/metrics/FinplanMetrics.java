package com.finplan.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for projection runs.
 */
@Service
public class FinplanMetrics {

    private final MeterRegistry registry;

    public FinplanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunDuration(long ms) {
        Timer.builder("finplan.projection.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunResult(String status) {
        Counter.builder("finplan.projections.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param state terminal convergence state of the year
     */
    public void recordYearOutcome(String state) {
        Counter.builder("finplan.years.total")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordIterations(int iterations) {
        DistributionSummary.builder("finplan.convergence.iterations")
                .description("Convergence iterations consumed per year")
                .register(registry)
                .record(iterations);
    }

    public void recordEvaluationFailure(String kind) {
        Counter.builder("finplan.evaluation.failures")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordValuesWritten(int count) {
        DistributionSummary.builder("finplan.projection.values_written")
                .register(registry)
                .record(count);
    }
}
