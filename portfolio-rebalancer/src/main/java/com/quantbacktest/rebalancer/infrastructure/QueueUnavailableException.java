package com.quantbacktest.rebalancer.infrastructure;

/**
 * The job queue backend rejected or could not serve a request.
 */
public class QueueUnavailableException extends RuntimeException {

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
