package io.clusterprobe.orchestration;

/**
 * The result transport stopped before the run finished.
 */
public class TransportFailureException extends AggregationException {

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
