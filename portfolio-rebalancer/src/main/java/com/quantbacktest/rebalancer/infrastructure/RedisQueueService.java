package com.quantbacktest.rebalancer.infrastructure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Job queue on a Redis list: RPUSH to enqueue, blocking LPOP to dequeue.
 * Both commands are atomic, so any number of workers may share the list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisQueueService implements QueueService {

    static final String QUEUE_NAME = "simulation-jobs";
    private static final long POP_TIMEOUT_SECONDS = 1;

    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    public void push(Long jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job ID cannot be null");
        }

        try {
            Long queueSize = redisTemplate.opsForList().rightPush(QUEUE_NAME, jobId);
            log.info("Queued job {} on {} (depth {})", jobId, QUEUE_NAME, queueSize);
        } catch (DataAccessException e) {
            log.error("Redis error while queueing job {}: {}", jobId, e.getMessage());
            throw new QueueUnavailableException("Failed to enqueue job " + jobId, e);
        }
    }

    @Override
    public Long pop() {
        Object value;
        try {
            value = redisTemplate.opsForList().leftPop(QUEUE_NAME, POP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to dequeue from " + QUEUE_NAME, e);
        }

        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        log.error("Discarding non-numeric queue entry: {}", value);
        return null;
    }

    @Override
    public long size() {
        try {
            Long size = redisTemplate.opsForList().size(QUEUE_NAME);
            return size != null ? size : 0L;
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to read depth of " + QUEUE_NAME, e);
        }
    }
}
