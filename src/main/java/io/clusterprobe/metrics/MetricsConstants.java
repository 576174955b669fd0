package io.clusterprobe.metrics;

/**
 * Constants for metrics names and tags used by the aggregation run.
 */
public class MetricsConstants {
    public final static String SUBMISSIONS_METRIC_NAME = "aggregation_submissions";
    public final static String PENDING_RESULTS_METRIC_NAME = "aggregation_pending_results";
    public final static String TRANSPORT_REJECTIONS_METRIC_NAME = "transport_rejected_requests";
    public final static String STATUS_ANNOTATION_FAILURES_METRIC_NAME = "status_annotation_failures";
    public final static String RUN_DURATION_METRIC_NAME = "aggregation_run_duration";
    public final static String RUN_OUTCOME_METRIC_NAME = "aggregation_run_outcome";
    public final static String INSTANCE_TAG = "instance";
    public final static String OUTCOME_TAG = "outcome";
    public final static String REASON_TAG = "reason";
    public final static String STATE_TAG = "state";

    private MetricsConstants() {}
}
