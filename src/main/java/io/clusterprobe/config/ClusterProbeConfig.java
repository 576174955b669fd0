package io.clusterprobe.config;

import io.clusterprobe.models.AggregationConfig;
import io.clusterprobe.models.RunTimeline;
import io.clusterprobe.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import static io.clusterprobe.config.Constants.*;

/**
 * Configuration for an aggregation run.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class ClusterProbeConfig {

    private final String bindAddress;
    private final int bindPort;
    private final String advertiseAddress;
    private final long timeoutSeconds;
    private final long gracePeriodSeconds;
    private final String namespace;
    private final Path outputDir;
    private final String statusTarget;
    private final long annotationIntervalSeconds;
    private final double jitterFactor;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";

    public ClusterProbeConfig() {
        this(loadYamlConfig(),
            EnvironmentUtils.getEnv(ENV_HOSTNAME, DEFAULT_STATUS_TARGET),
            EnvironmentUtils.getEnv(ENV_POD_IP, null));
    }

    /**
     * @param podAddress used as the advertise address when none is configured; may be null
     */
    ClusterProbeConfig(ConfigModel config, String defaultStatusTarget, String podAddress) {
        Aggregation aggregation = config.getAggregation() != null ? config.getAggregation() : new Aggregation();
        Status status = config.getStatus() != null ? config.getStatus() : new Status();

        this.bindAddress = nonBlank(aggregation.getBind_address(), DEFAULT_BIND_ADDRESS);
        this.bindPort = parseBindPort(aggregation);
        // A wildcard bind address is never reachable; the certificate authority refuses it
        this.advertiseAddress = nonBlank(aggregation.getAdvertise_address(), nonBlank(podAddress, bindAddress));
        this.timeoutSeconds = aggregation.getTimeout_seconds() != null
            ? aggregation.getTimeout_seconds() : DEFAULT_TIMEOUT_SECONDS;
        this.gracePeriodSeconds = parseNonNegative(aggregation.getGrace_period_seconds(),
            DEFAULT_GRACE_PERIOD_SECONDS, "aggregation.grace_period_seconds");
        this.namespace = nonBlank(aggregation.getNamespace(), DEFAULT_NAMESPACE);
        this.outputDir = Paths.get(nonBlank(aggregation.getOutput_dir(), DEFAULT_OUTPUT_DIR));
        this.statusTarget = nonBlank(status.getTarget(), defaultStatusTarget);
        this.annotationIntervalSeconds = parseInterval(status);
        this.jitterFactor = parseJitterFactor(status);

        log.info("Loaded cluster probe config - bind: {}:{}, advertise: {}, timeout: {}s, grace: {}s, namespace: {}",
            bindAddress, bindPort, advertiseAddress, timeoutSeconds, gracePeriodSeconds, namespace);
    }

    /**
     * Settings for one run, as consumed by the orchestrator.
     */
    public AggregationConfig toAggregationConfig() {
        return AggregationConfig.builder()
            .bindAddress(bindAddress)
            .bindPort(bindPort)
            .advertiseAddress(advertiseAddress)
            .namespace(namespace)
            .outputDir(outputDir)
            .statusTarget(statusTarget)
            .timeline(RunTimeline.builder()
                .totalTimeout(Duration.ofSeconds(timeoutSeconds))
                .gracePeriod(Duration.ofSeconds(gracePeriodSeconds))
                .annotationInterval(Duration.ofSeconds(annotationIntervalSeconds))
                .jitterFactor(jitterFactor)
                .build())
            .build();
    }

    /**
     * Parse the file named by {@code PROBE_CONFIG_FILE}, or the bundled application.yml when
     * that is unset or missing. Any read or parse failure leaves every setting at its default.
     */
    private static ConfigModel loadYamlConfig() {
        String external = EnvironmentUtils.getEnv(ENV_CONFIG_FILE, null);
        Path externalPath = external == null ? null : Paths.get(external);
        if (externalPath != null && !Files.isRegularFile(externalPath)) {
            log.warn("{} points at {}, which is not a readable file; using {}",
                ENV_CONFIG_FILE, externalPath, DEFAULT_CONFIG_FILE_CLASSPATH);
            externalPath = null;
        }
        String source = externalPath != null ? externalPath.toString() : "classpath:" + DEFAULT_CONFIG_FILE_CLASSPATH;

        try (InputStream in = externalPath != null
            ? Files.newInputStream(externalPath)
            : ClusterProbeConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH)) {
            if (in == null) {
                log.warn("No configuration at {}, using defaults", source);
                return new ConfigModel();
            }
            ConfigModel config = new Yaml(new Constructor(ConfigModel.class)).load(in);
            log.info("Loaded configuration from {}", source);
            return config != null ? config : new ConfigModel();
        } catch (IOException | RuntimeException e) {
            log.warn("Couldn't read configuration from {}, using defaults: {}", source, e.getMessage());
            return new ConfigModel();
        }
    }

    private static int parseBindPort(Aggregation aggregation) {
        Integer port = aggregation.getBind_port();
        if (port == null) {
            return DEFAULT_BIND_PORT;
        }
        if (port < 0 || port > 65535) {
            log.warn("Invalid aggregation.bind_port {}, using default {}", port, DEFAULT_BIND_PORT);
            return DEFAULT_BIND_PORT;
        }
        return port;
    }

    private static long parseInterval(Status status) {
        Long interval = status.getInterval_seconds();
        if (interval == null) {
            return DEFAULT_ANNOTATION_INTERVAL_SECONDS;
        }
        if (interval <= 0) {
            log.warn("Invalid status.interval_seconds {}, using default {}", interval, DEFAULT_ANNOTATION_INTERVAL_SECONDS);
            return DEFAULT_ANNOTATION_INTERVAL_SECONDS;
        }
        return interval;
    }

    private static double parseJitterFactor(Status status) {
        Double jitter = status.getJitter_factor();
        if (jitter == null) {
            return DEFAULT_JITTER_FACTOR;
        }
        if (jitter < 0 || jitter.isNaN()) {
            log.warn("Invalid status.jitter_factor {}, using default {}", jitter, DEFAULT_JITTER_FACTOR);
            return DEFAULT_JITTER_FACTOR;
        }
        return jitter;
    }

    private static long parseNonNegative(Long value, long defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 0) {
            log.warn("Invalid {} {}, using default {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static String nonBlank(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Aggregation aggregation;
        private Status status;
    }

    @Data
    public static class Aggregation {
        private String bind_address;
        private Integer bind_port;
        private String advertise_address;
        private Long timeout_seconds;
        private Long grace_period_seconds;
        private String namespace;
        private String output_dir;
    }

    @Data
    public static class Status {
        private String target;
        private Long interval_seconds;
        private Double jitter_factor;
    }
}
