package com.quantbacktest.rebalancer.service;

import com.quantbacktest.rebalancer.domain.SimulationJob;

/**
 * Runs a queued simulation job and records its outcome.
 */
public interface SimulationExecutor {

    /**
     * Execute a job. Failures are recorded on the job and retried through the queue.
     *
     * @param job the job to execute
     */
    void executeSimulation(SimulationJob job);
}
