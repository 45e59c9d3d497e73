package com.quantbacktest.rebalancer.repository;

import com.quantbacktest.rebalancer.domain.JobStatus;
import com.quantbacktest.rebalancer.domain.SimulationJob;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for SimulationJob entity.
 */
@Repository
public interface SimulationJobRepository extends JpaRepository<SimulationJob, Long> {

    /**
     * Find a job by its idempotency key.
     *
     * @param idempotencyKey the unique idempotency key
     * @return Optional containing the job if found
     */
    Optional<SimulationJob> findByIdempotencyKey(String idempotencyKey);

    /**
     * Find and lock a job by ID for update (pessimistic write lock).
     * Prevents two workers from starting the same job.
     *
     * @param id the job ID
     * @return Optional containing the locked job if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM SimulationJob j WHERE j.id = :id")
    Optional<SimulationJob> findByIdForUpdate(@Param("id") Long id);

    List<SimulationJob> findByStatus(JobStatus status);
}
