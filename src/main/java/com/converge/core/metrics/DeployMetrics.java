package com.converge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for deployments.
 */
@Service
public class DeployMetrics {

    private final MeterRegistry registry;

    public DeployMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDeployDuration(String stage, long ms) {
        Timer.builder("converge.deploy.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPlanSize(int instructions) {
        DistributionSummary.builder("converge.plan.instructions")
                .description("Instructions per plan, sweeper deletions included")
                .register(registry)
                .record(instructions);
    }

    public void recordApiCall(String methodName) {
        Counter.builder("converge.api.calls")
                .tag("method", methodName)
                .register(registry)
                .increment();
    }

    /**
     * Records the API calls the sweeper appended to a plan, for resources no
     * longer declared or pointed at another source.
     */
    public void recordSweeperDeletions(int count) {
        Counter.builder("converge.sweeper.deletions")
                .description("Deletion instructions appended by the sweeper")
                .register(registry)
                .increment(count);
    }

    public void recordDeployResult(String status) {
        Counter.builder("converge.deploys.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
