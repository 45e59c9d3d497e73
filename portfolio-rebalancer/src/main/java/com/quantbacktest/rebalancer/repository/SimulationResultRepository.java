package com.quantbacktest.rebalancer.repository;

import com.quantbacktest.rebalancer.domain.SimulationResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for SimulationResult entity.
 */
@Repository
public interface SimulationResultRepository extends JpaRepository<SimulationResult, Long> {

    /**
     * Find result by job ID.
     *
     * @param jobId the job ID
     * @return Optional containing the result if found
     */
    Optional<SimulationResult> findByJobId(Long jobId);

    boolean existsByJobId(Long jobId);
}
