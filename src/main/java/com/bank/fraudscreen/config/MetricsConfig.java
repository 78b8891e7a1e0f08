package com.bank.fraudscreen.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Business and stage metrics for the screening workflow. Meters are registered lazily and
 * Micrometer makes increments safe from the concurrently running branches.
 */
@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStage(String stage, String outcome, long durationNanos) {
        Timer.builder("workflow.stage.duration")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRiskScore(String recommendation, double score) {
        DistributionSummary.builder("risk.score")
                .tag("recommendation", recommendation)
                .register(registry)
                .record(score);
    }

    public void recordDegradedAnalysis(String reason) {
        Counter.builder("risk.degraded.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordComplianceDecision(String rating) {
        Counter.builder("compliance.decision.count")
                .tag("rating", rating)
                .register(registry)
                .increment();
    }

    public void recordAlertOutcome(String outcome, String severity) {
        Counter.builder("alert.outcome.count")
                .tag("outcome", outcome)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordWorkflow(String outcome) {
        Counter.builder("workflow.run.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
