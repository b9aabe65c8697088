package com.comparo.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for comparison execution.
 */
@Service
public class ComparoMetrics {

    private final MeterRegistry registry;

    public ComparoMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordComparisonStarted(int targetCount) {
        DistributionSummary.builder("comparo.comparison.targets")
                .description("Number of targets per comparison")
                .register(registry)
                .record(targetCount);
    }

    public void recordComparisonDuration(long ms) {
        Timer.builder("comparo.comparison.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one target's end-to-end latency and outcome.
     *
     * @param targetId the target
     * @param outcome  "completed", "failed" or "cancelled"
     * @param ms       time from dispatch to terminal event
     */
    public void recordTargetResult(String targetId, String outcome, long ms) {
        Timer.builder("comparo.target.duration")
                .tag("target", targetId)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));

        Counter.builder("comparo.target.results")
                .tag("target", targetId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordToolProposed(String toolName) {
        Counter.builder("comparo.tools.proposed")
                .tag("tool", toolName)
                .register(registry)
                .increment();
    }

    /**
     * Records how a tool call was resolved.
     *
     * @param resolution "approved", "denied" or "executed"
     */
    public void recordToolResolution(String resolution) {
        Counter.builder("comparo.tools.resolutions")
                .description("Tool call approval outcomes")
                .tag("resolution", resolution)
                .register(registry)
                .increment();
    }

    public void recordApprovalDecision(String decision, int resolvedCount) {
        DistributionSummary.builder("comparo.approvals.resolved_per_decision")
                .tag("decision", decision)
                .register(registry)
                .record(resolvedCount);
    }
}
