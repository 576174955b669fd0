package io.clusterprobe.orchestration;

import io.clusterprobe.cluster.ClusterClient;
import io.clusterprobe.workloads.Workload;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Best-effort teardown of every workload in a run.
 */
@Slf4j
public final class WorkloadCleanup {

    private WorkloadCleanup() {}

    /**
     * Call each workload's cleanup hook. A failing hook is logged and the rest still run.
     *
     * @return the number of workloads whose cleanup failed
     */
    public static int cleanup(ClusterClient clusterClient, List<? extends Workload> workloads) {
        int failures = 0;
        for (Workload workload : workloads) {
            try {
                log.info("Cleaning up workload {}", workload.getName());
                workload.cleanup(clusterClient);
            } catch (Exception e) {
                failures++;
                log.error("Failed to clean up workload {}: {}", workload.getName(), e.getMessage(), e);
            }
        }
        if (failures > 0) {
            log.warn("Cleanup failed for {} of {} workloads", failures, workloads.size());
        }
        return failures;
    }
}
