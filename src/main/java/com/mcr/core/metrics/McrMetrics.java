package com.mcr.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for translation and reasoning.
 */
@Service
public class McrMetrics {

    private final MeterRegistry registry;

    public McrMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStrategyRun(String strategyId, String outcome, long ms) {
        Timer.builder("mcr.strategy.duration")
                .tag("strategy", strategyId)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRefinement(int iterations, boolean converged) {
        DistributionSummary.builder("mcr.refinement.iterations")
                .description("Iterations used per refinement loop")
                .register(registry)
                .record(iterations);
        Counter.builder("mcr.refinement.total")
                .tag("converged", String.valueOf(converged))
                .register(registry)
                .increment();
    }

    public void recordDeductionFallback() {
        Counter.builder("mcr.deduction.fallbacks")
                .description("Guided deductions answered by the deterministic query")
                .register(registry)
                .increment();
    }

    /**
     * Counts results scored with the configured default confidence because no
     * embedding backend was usable.
     */
    public void recordDefaultConfidence(String reason) {
        Counter.builder("mcr.deduction.default_confidence")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRouterDecision(String inputClass, boolean recommended) {
        Counter.builder("mcr.router.decisions")
                .tag("input_class", inputClass)
                .tag("result", recommended ? "recommended" : "none")
                .register(registry)
                .increment();
    }

    public void recordRequest(String inputClass, String status) {
        Counter.builder("mcr.requests.total")
                .tag("input_class", inputClass)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
