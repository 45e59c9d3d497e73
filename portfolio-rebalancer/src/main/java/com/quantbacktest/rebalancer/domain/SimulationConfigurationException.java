package com.quantbacktest.rebalancer.domain;

/**
 * Raised before a run starts when the simulation configuration cannot be used.
 */
public class SimulationConfigurationException extends IllegalArgumentException {

    public SimulationConfigurationException(String message) {
        super(message);
    }

    public SimulationConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
