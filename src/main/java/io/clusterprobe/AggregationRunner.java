package io.clusterprobe;

import io.clusterprobe.cluster.ClusterClient;
import io.clusterprobe.enums.RunState;
import io.clusterprobe.orchestration.AggregationException;
import io.clusterprobe.orchestration.Orchestrator;
import io.clusterprobe.orchestration.WorkloadCleanup;
import io.clusterprobe.workloads.Workload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the registered workloads once the context is up, then tears them down.
 */
@Slf4j
@Component
public class AggregationRunner implements ApplicationRunner, ExitCodeGenerator {

    private final Orchestrator orchestrator;
    private final ClusterClient clusterClient;
    private final ObjectProvider<Workload> workloads;

    private volatile int exitCode = 1;

    public AggregationRunner(Orchestrator orchestrator, ClusterClient clusterClient,
                             ObjectProvider<Workload> workloads) {
        this.orchestrator = orchestrator;
        this.clusterClient = clusterClient;
        this.workloads = workloads;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<Workload> requested = workloads.orderedStream().collect(Collectors.toList());
        log.info("Requested workloads: {}",
            requested.stream().map(Workload::getName).collect(Collectors.toList()));
        try {
            RunState outcome = orchestrator.run(requested);
            exitCode = outcome == RunState.COMPLETED ? 0 : 1;
            log.info("Aggregation run finished: {}", outcome);
        } catch (AggregationException e) {
            exitCode = 1;
            log.error("Aggregation run failed in state {}: {}", orchestrator.getState(), e.getMessage(), e);
        } finally {
            WorkloadCleanup.cleanup(clusterClient, requested);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
