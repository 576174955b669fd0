package io.clusterprobe.models;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

import static io.clusterprobe.config.Constants.*;

/**
 * Timing configuration for one run. A non-positive total timeout disables both deadlines.
 */
@Value
@Builder(toBuilder = true)
public class RunTimeline {

    @Builder.Default
    Duration totalTimeout = Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);

    @Builder.Default
    Duration gracePeriod = Duration.ofSeconds(DEFAULT_GRACE_PERIOD_SECONDS);

    @Builder.Default
    Duration annotationInterval = Duration.ofSeconds(DEFAULT_ANNOTATION_INTERVAL_SECONDS);

    @Builder.Default
    double jitterFactor = DEFAULT_JITTER_FACTOR;

    public boolean hasDeadline() {
        return totalTimeout != null && !totalTimeout.isNegative() && !totalTimeout.isZero();
    }

    /**
     * Delay from run start until workloads are asked to clean up; never negative.
     */
    public Duration graceDeadline() {
        Duration grace = totalTimeout.minus(gracePeriod);
        return grace.isNegative() ? Duration.ZERO : grace;
    }
}
