package com.quantbacktest.rebalancer.infrastructure;

/**
 * FIFO queue of simulation job ids shared by all workers.
 */
public interface QueueService {

    /**
     * Append a job id to the tail of the queue.
     *
     * @throws QueueUnavailableException if the queue backend cannot be reached
     */
    void push(Long jobId);

    /**
     * Take the job id at the head of the queue, waiting briefly.
     *
     * @return the job id, or null if nothing arrived in time
     */
    Long pop();

    /**
     * Number of job ids waiting.
     */
    long size();
}
