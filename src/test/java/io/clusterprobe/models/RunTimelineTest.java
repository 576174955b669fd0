package io.clusterprobe.models;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RunTimelineTest {

    @Test
    void testGraceDeadlineIsTimeoutMinusGracePeriod() {
        RunTimeline timeline = RunTimeline.builder()
            .totalTimeout(Duration.ofMinutes(10))
            .gracePeriod(Duration.ofMinutes(1))
            .build();

        assertThat(timeline.hasDeadline()).isTrue();
        assertThat(timeline.graceDeadline()).isEqualTo(Duration.ofMinutes(9));
    }

    @Test
    void testGraceDeadlineNeverNegative() {
        RunTimeline timeline = RunTimeline.builder()
            .totalTimeout(Duration.ofSeconds(10))
            .gracePeriod(Duration.ofSeconds(60))
            .build();

        assertThat(timeline.graceDeadline()).isEqualTo(Duration.ZERO);
    }

    @Test
    void testNonPositiveTimeoutDisablesDeadlines() {
        assertThat(RunTimeline.builder().totalTimeout(Duration.ZERO).build().hasDeadline()).isFalse();
        assertThat(RunTimeline.builder().totalTimeout(Duration.ofSeconds(-1)).build().hasDeadline()).isFalse();
    }

    @Test
    void testAdvertiseAddressDefaultsToBindAddress() {
        assertThat(AggregationConfig.builder().bindAddress("10.0.0.5").build().getAdvertiseAddress())
            .isEqualTo("10.0.0.5");
        assertThat(AggregationConfig.builder().bindAddress("10.0.0.5").advertiseAddress(" ").build().getAdvertiseAddress())
            .isEqualTo("10.0.0.5");
        assertThat(AggregationConfig.builder().advertiseAddress("aggregator:8080").build().getAdvertiseAddress())
            .isEqualTo("aggregator:8080");
    }
}
