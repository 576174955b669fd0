package io.clusterprobe.workloads;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.clusterprobe.models.ExpectedResult;
import io.clusterprobe.models.Result;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builders for error results standing in for output a workload never delivered.
 */
public final class WorkloadResults {

    public static final String ERROR_FIELD = "error";

    private WorkloadResults() {}

    public static Result errorResult(ExpectedResult slot, String message) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put(ERROR_FIELD, message);
        return Result.builder()
            .producer(slot.getProducer())
            .locus(slot.getLocus())
            .kind(slot.getKind())
            .payload(payload)
            .error(message)
            .build();
    }

    public static Result errorResult(Workload workload, String locus, String message) {
        return errorResult(new ExpectedResult(workload.getName(), locus, workload.getResultKind()), message);
    }

    /**
     * One error result per slot the workload owes in the expected set.
     */
    public static List<Result> errorResults(Workload workload, List<ExpectedResult> expected, String message) {
        return expected.stream()
            .filter(slot -> slot.getProducer().equals(workload.getName()))
            .map(slot -> errorResult(slot, message))
            .collect(Collectors.toList());
    }
}
