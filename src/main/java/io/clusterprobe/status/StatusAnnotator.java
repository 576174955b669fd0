package io.clusterprobe.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterprobe.aggregation.Aggregator;
import io.clusterprobe.cluster.ClusterClient;
import io.clusterprobe.enums.ResultStatus;
import io.clusterprobe.metrics.MetricsProvider;
import io.clusterprobe.models.ExpectedResult;
import io.clusterprobe.models.Result;
import io.clusterprobe.models.RunStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

import static io.clusterprobe.config.Constants.STATUS_ANNOTATION_KEY;

/**
 * Writes run progress as a JSON annotation on the status target pod.
 */
@Slf4j
public class StatusAnnotator {

    private final List<ExpectedResult> expectedResults;
    private final String namespace;
    private final String target;
    private final ClusterClient clusterClient;
    private final MetricsProvider metricsProvider;
    private final ObjectMapper objectMapper;

    public StatusAnnotator(List<ExpectedResult> expectedResults, String namespace, String target,
                           ClusterClient clusterClient, MetricsProvider metricsProvider) {
        this.expectedResults = List.copyOf(expectedResults);
        this.namespace = namespace;
        this.target = target;
        this.clusterClient = clusterClient;
        this.metricsProvider = metricsProvider;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Write the current progress. Failures are logged and reported as {@code false}.
     */
    public boolean annotate(List<Result> results) {
        try {
            String value = objectMapper.writeValueAsString(buildStatus(results));
            clusterClient.annotate(namespace, target, STATUS_ANNOTATION_KEY, value);
            log.debug("Annotated {}/{} with run status", namespace, target);
            return true;
        } catch (Exception e) {
            log.warn("Failed to annotate {}/{} with run status: {}", namespace, target, e.getMessage());
            metricsProvider.recordAnnotationFailure();
            return false;
        }
    }

    RunStatus buildStatus(List<Result> results) {
        Map<ExpectedResult, Result> filled = new HashMap<>();
        for (Result result : results) {
            filled.putIfAbsent(result.key(), result);
        }

        RunStatus status = new RunStatus();
        status.setExpected(expectedResults.size());
        boolean anyPending = false;
        boolean anyFailed = false;
        int filledCount = 0;
        for (ExpectedResult slot : expectedResults) {
            Result result = filled.get(slot);
            ResultStatus slotStatus;
            if (result == null) {
                slotStatus = ResultStatus.RUNNING;
                anyPending = true;
            } else if (result.isFailed()) {
                slotStatus = ResultStatus.FAILED;
                anyFailed = true;
                filledCount++;
            } else {
                slotStatus = ResultStatus.COMPLETE;
                filledCount++;
            }
            status.getPlugins().add(
                new RunStatus.SlotStatus(slot.getProducer(), slot.getLocus(), slot.getKind(), slotStatus));
        }
        status.setFilled(filledCount);
        if (anyPending) {
            status.setStatus(ResultStatus.RUNNING);
        } else if (anyFailed) {
            status.setStatus(ResultStatus.FAILED);
        } else {
            status.setStatus(ResultStatus.COMPLETE);
        }
        return status;
    }

    /**
     * Start annotating periodically on the given scheduler. The first annotation is immediate.
     */
    public AnnotationLoop start(Aggregator aggregator, Duration interval, double jitterFactor,
                                ScheduledExecutorService scheduler) {
        AnnotationLoop loop = new AnnotationLoop(this, aggregator, interval, jitterFactor, scheduler);
        loop.start();
        return loop;
    }

    public String getTarget() {
        return target;
    }
}
