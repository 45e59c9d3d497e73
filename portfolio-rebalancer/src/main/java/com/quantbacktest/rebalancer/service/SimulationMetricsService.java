package com.quantbacktest.rebalancer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for simulation jobs, exposed through Actuator.
 */
@Service
public class SimulationMetricsService {

    private final Counter jobsSubmittedCounter;
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;
    private final Counter jobsRetriedCounter;
    private final Counter tradesExecutedCounter;
    private final Timer executionTimer;

    public SimulationMetricsService(MeterRegistry meterRegistry) {
        this.jobsSubmittedCounter = Counter.builder("simulation.jobs.submitted")
                .description("Simulation jobs accepted for processing")
                .register(meterRegistry);

        this.jobsCompletedCounter = Counter.builder("simulation.jobs.completed")
                .description("Simulation jobs completed successfully")
                .register(meterRegistry);

        this.jobsFailedCounter = Counter.builder("simulation.jobs.failed")
                .description("Simulation jobs that exhausted their retries")
                .register(meterRegistry);

        this.jobsRetriedCounter = Counter.builder("simulation.jobs.retried")
                .description("Simulation job retry attempts")
                .register(meterRegistry);

        this.tradesExecutedCounter = Counter.builder("simulation.trades.executed")
                .description("Trades executed across all simulations")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("simulation.execution.time")
                .description("Simulation job execution time")
                .register(meterRegistry);
    }

    public void recordJobSubmitted() {
        jobsSubmittedCounter.increment();
    }

    /**
     * Record a successful run with its duration and trade count.
     */
    public void recordJobCompleted(long executionTimeMs, int tradeCount) {
        jobsCompletedCounter.increment();
        tradesExecutedCounter.increment(tradeCount);
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordJobFailed() {
        jobsFailedCounter.increment();
    }

    public void recordJobRetried() {
        jobsRetriedCounter.increment();
    }
}
