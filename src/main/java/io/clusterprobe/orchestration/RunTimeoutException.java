package io.clusterprobe.orchestration;

import io.clusterprobe.models.ExpectedResult;

import java.time.Duration;
import java.util.List;

/**
 * The hard deadline passed with results still pending.
 */
public class RunTimeoutException extends AggregationException {

    private final Duration timeout;
    private final List<ExpectedResult> pendingResults;

    public RunTimeoutException(Duration timeout, List<ExpectedResult> pendingResults) {
        super("timed out after " + timeout + " waiting for " + pendingResults.size() + " results");
        this.timeout = timeout;
        this.pendingResults = List.copyOf(pendingResults);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public List<ExpectedResult> getPendingResults() {
        return pendingResults;
    }
}
