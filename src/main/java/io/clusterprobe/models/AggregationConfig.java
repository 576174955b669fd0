package io.clusterprobe.models;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;

import static io.clusterprobe.config.Constants.*;

/**
 * Settings consumed by one aggregation run.
 */
@Value
@Builder(toBuilder = true)
public class AggregationConfig {

    @Builder.Default
    String bindAddress = DEFAULT_BIND_ADDRESS;

    @Builder.Default
    int bindPort = DEFAULT_BIND_PORT;

    /**
     * Address workloads use to reach the result transport; may carry a port.
     */
    String advertiseAddress;

    @Builder.Default
    String namespace = DEFAULT_NAMESPACE;

    @Builder.Default
    Path outputDir = Paths.get(DEFAULT_OUTPUT_DIR);

    /**
     * Name of the pod whose annotations carry the run status.
     */
    @Builder.Default
    String statusTarget = DEFAULT_STATUS_TARGET;

    @Builder.Default
    RunTimeline timeline = RunTimeline.builder().build();

    public String getAdvertiseAddress() {
        return advertiseAddress == null || advertiseAddress.isBlank() ? bindAddress : advertiseAddress;
    }
}
