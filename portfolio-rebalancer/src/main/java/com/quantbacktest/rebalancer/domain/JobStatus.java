package com.quantbacktest.rebalancer.domain;

/**
 * Status enum for simulation job lifecycle.
 */
public enum JobStatus {
    SUBMITTED,
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
