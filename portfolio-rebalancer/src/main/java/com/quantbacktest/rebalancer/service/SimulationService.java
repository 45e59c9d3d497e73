package com.quantbacktest.rebalancer.service;

import com.quantbacktest.rebalancer.controller.dto.SimulationRequest;
import com.quantbacktest.rebalancer.controller.dto.SimulationResponse;

/**
 * Service interface for simulation job operations.
 */
public interface SimulationService {

    /**
     * Submit a new simulation or return the existing job for an identical request.
     *
     * @param request the simulation request
     * @return the job id and status, with metrics if the job already completed
     */
    SimulationResponse submitSimulation(SimulationRequest request);

    /**
     * @throws SimulationNotFoundException if no job has this id
     */
    SimulationResponse getSimulation(Long jobId);

    long getQueueDepth();
}
