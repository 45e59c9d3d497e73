package com.quantbacktest.rebalancer.service;

/**
 * No simulation job exists with the requested id.
 */
public class SimulationNotFoundException extends RuntimeException {

    public SimulationNotFoundException(Long jobId) {
        super("Simulation job not found: " + jobId);
    }
}
