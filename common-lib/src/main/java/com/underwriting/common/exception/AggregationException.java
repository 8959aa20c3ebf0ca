package com.underwriting.common.exception;

/**
 * Root of the errors an aggregation request can surface to its caller.
 *
 * <p>Individual provider failures never appear here; they are recovered inside the
 * adapters and recorded as failure provenance on the merged record.
 */
public abstract class AggregationException extends RuntimeException {

    protected AggregationException(String message) {
        super(message);
    }

    protected AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
