package io.clusterprobe.cluster;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link ClusterClient} backed by the fabric8 Kubernetes client.
 */
@Slf4j
public class KubernetesClusterClient implements ClusterClient {

    private final KubernetesClient client;

    public KubernetesClusterClient(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public List<String> listNodes() throws Exception {
        List<String> nodes = client.nodes().list().getItems().stream()
            .map(Node::getMetadata)
            .filter(metadata -> metadata != null && metadata.getName() != null)
            .map(metadata -> metadata.getName())
            .collect(Collectors.toList());
        log.info("Found {} cluster nodes", nodes.size());
        return nodes;
    }

    @Override
    public void annotate(String namespace, String podName, String key, String value) throws Exception {
        client.pods().inNamespace(namespace).withName(podName).edit(pod -> new PodBuilder(pod)
            .editOrNewMetadata()
                .addToAnnotations(key, value)
            .endMetadata()
            .build());
        log.debug("Annotated pod {}/{} with {}", namespace, podName, key);
    }
}
