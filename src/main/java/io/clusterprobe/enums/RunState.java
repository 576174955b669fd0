package io.clusterprobe.enums;

/**
 * States of a single aggregation run.
 *
 * <ul>
 *   <li><strong>RUNNING</strong> - Workloads dispatched, waiting for results</li>
 *   <li><strong>GRACEFULLY_STOPPING</strong> - Grace deadline reached, workloads are being asked to clean up</li>
 *   <li><strong>COMPLETED</strong> - Every expected result has been filled</li>
 *   <li><strong>TIMED_OUT</strong> - Hard deadline reached with results still pending</li>
 *   <li><strong>SERVER_FAILED</strong> - The result transport terminated before the run finished</li>
 * </ul>
 */
public enum RunState {
    RUNNING,

    /**
     * Not terminal; the run returns to RUNNING once cleanup has been attempted.
     */
    GRACEFULLY_STOPPING,

    COMPLETED,

    TIMED_OUT,

    SERVER_FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == SERVER_FAILED;
    }
}
