package io.clusterprobe;

import io.clusterprobe.cluster.ClusterClient;
import io.clusterprobe.cluster.KubernetesClusterClient;
import io.clusterprobe.config.ClusterProbeConfig;
import io.clusterprobe.metrics.MetricsProvider;
import io.clusterprobe.orchestration.Orchestrator;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Bean;

/**
 * Entry point for a single aggregation run. Starts a non-web Spring context, runs every
 * registered workload through the {@link Orchestrator} and exits with the run's outcome.
 */
@Slf4j
@SpringBootApplication
public class ClusterProbeApplication {

    public static void main(String[] args) {
        log.info("Starting cluster probe aggregation");
        try {
            SpringApplication application = new SpringApplicationBuilder(ClusterProbeApplication.class)
                .web(WebApplicationType.NONE)
                .build();
            System.exit(SpringApplication.exit(application.run(args)));
        } catch (Exception e) {
            log.error("Cluster probe failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    public ClusterProbeConfig config() {
        ClusterProbeConfig config = new ClusterProbeConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public KubernetesClient kubernetesClient() {
        log.info("Initializing Kubernetes client");
        return new KubernetesClientBuilder().build();
    }

    @Bean
    public ClusterClient clusterClient(KubernetesClient kubernetesClient) {
        return new KubernetesClusterClient(kubernetesClient);
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public Orchestrator orchestrator(ClusterProbeConfig config, ClusterClient clusterClient,
                                     MetricsProvider metricsProvider) {
        log.info("Initializing Orchestrator");
        return new Orchestrator(config.toAggregationConfig(), clusterClient, metricsProvider);
    }
}
