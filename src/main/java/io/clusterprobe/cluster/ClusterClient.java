package io.clusterprobe.cluster;

import java.util.List;

/**
 * The slice of the cluster API a run depends on.
 */
public interface ClusterClient {

    /**
     * Names of the nodes the run covers.
     */
    List<String> listNodes() throws Exception;

    /**
     * Set (or replace) a single annotation on a pod.
     */
    void annotate(String namespace, String podName, String key, String value) throws Exception;
}
