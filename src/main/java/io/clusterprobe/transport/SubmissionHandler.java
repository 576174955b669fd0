package io.clusterprobe.transport;

import io.clusterprobe.aggregation.SubmissionOutcome;
import io.clusterprobe.models.Result;

/**
 * Capability the result transport hands authenticated submissions to.
 * Implementations must be safe to call from many handler threads at once.
 */
@FunctionalInterface
public interface SubmissionHandler {

    SubmissionOutcome handleSubmission(Result result);
}
