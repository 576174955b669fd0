package io.clusterprobe.orchestration;

/**
 * Base class for failures that end an aggregation run.
 */
public class AggregationException extends Exception {

    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
