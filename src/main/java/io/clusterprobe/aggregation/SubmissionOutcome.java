package io.clusterprobe.aggregation;

/**
 * What happened to a result handed to the aggregator.
 */
public enum SubmissionOutcome {
    /**
     * The result filled a pending slot.
     */
    ACCEPTED,

    /**
     * The slot was already filled; the result was dropped.
     */
    DUPLICATE,

    /**
     * No slot matches the result; it was dropped.
     */
    UNEXPECTED
}
