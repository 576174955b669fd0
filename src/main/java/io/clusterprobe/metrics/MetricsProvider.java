package io.clusterprobe.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.clusterprobe.aggregation.SubmissionOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import static io.clusterprobe.metrics.MetricsConstants.*;

/*
 * Meters reported by an aggregation run: submission outcomes, transport rejections,
 * annotation failures, the pending-results gauge and run outcomes.
 * Every meter carries the instance tag.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] RUN_DURATION_PERCENTILES = {0.5, 0.9, 0.99};

    private final MeterRegistry registry;
    private final Tags instanceTags;
    private final AtomicDouble pendingResults = new AtomicDouble(0);

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${probe.instance-id:cluster-probe}") String instanceId) {
        this.registry = registry;
        this.instanceTags = Tags.of(INSTANCE_TAG, instanceId);
        Gauge.builder(PENDING_RESULTS_METRIC_NAME, pendingResults::get)
            .tags(instanceTags)
            .register(registry);
        log.info("MetricsProvider initialized for instance: {}", instanceId);
    }

    /**
     * Count a submission by how it matched the expected slots.
     */
    public void recordSubmission(SubmissionOutcome outcome) {
        registry.counter(SUBMISSIONS_METRIC_NAME, instanceTags.and(OUTCOME_TAG, lowercase(outcome.name())))
            .increment();
    }

    /**
     * Count a request the transport refused before it reached the aggregator.
     *
     * @param reason one of method, identity, size or body
     */
    public void recordRejection(String reason) {
        registry.counter(TRANSPORT_REJECTIONS_METRIC_NAME, instanceTags.and(REASON_TAG, reason)).increment();
    }

    public void recordAnnotationFailure() {
        registry.counter(STATUS_ANNOTATION_FAILURES_METRIC_NAME, instanceTags).increment();
    }

    /**
     * Slots of the current run still waiting for a result. One gauge per provider; a later
     * run overwrites the value left by an earlier one.
     */
    public void setPendingResults(int pending) {
        pendingResults.set(pending);
    }

    /**
     * Record how a run ended and how long it took.
     *
     * @param outcome terminal state, or {@code setup_failed}
     */
    public void recordRun(String outcome, long durationNanos) {
        Timer.builder(RUN_DURATION_METRIC_NAME)
            .tags(instanceTags)
            .publishPercentiles(RUN_DURATION_PERCENTILES)
            .register(registry)
            .record(durationNanos, TimeUnit.NANOSECONDS);
        registry.counter(RUN_OUTCOME_METRIC_NAME, instanceTags.and(STATE_TAG, lowercase(outcome))).increment();
    }

    private static String lowercase(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
