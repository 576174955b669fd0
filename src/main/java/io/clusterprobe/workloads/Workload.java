package io.clusterprobe.workloads;

import io.clusterprobe.aggregation.ResultQueue;
import io.clusterprobe.certs.ClientIdentity;
import io.clusterprobe.cluster.ClusterClient;
import io.clusterprobe.models.ExpectedResult;

import java.util.List;

/**
 * A pluggable unit of work dispatched against the cluster. The run only knows which
 * results a workload owes and when they arrive; what the workload does is its own business.
 */
public interface Workload {

    /**
     * Unique name of the workload within a run. Also the subject of its client certificate,
     * and therefore the producer of every result it submits.
     */
    String getName();

    String getResultKind();

    /**
     * Results this workload owes for the given node set.
     */
    List<ExpectedResult> expectedResults(List<String> nodes);

    /**
     * Launch the workload. Results are submitted to {@code advertiseAddress} using the
     * supplied client identity.
     */
    void run(ClusterClient clusterClient, String advertiseAddress, ClientIdentity identity) throws Exception;

    /**
     * Watch the running workload and feed error results for failures it cannot report itself.
     * Runs on its own thread until the workload is done or the thread is interrupted.
     */
    void monitor(ClusterClient clusterClient, List<String> nodes, ResultQueue resultQueue);

    /**
     * Remove whatever the workload created. May be called more than once.
     */
    void cleanup(ClusterClient clusterClient) throws Exception;
}
