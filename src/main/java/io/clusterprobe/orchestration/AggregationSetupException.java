package io.clusterprobe.orchestration;

/**
 * The run could not be set up; no workload was dispatched.
 */
public class AggregationSetupException extends AggregationException {

    public AggregationSetupException(String message) {
        super(message);
    }

    public AggregationSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
