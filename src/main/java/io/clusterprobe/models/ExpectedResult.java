package io.clusterprobe.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Objects;

import static io.clusterprobe.config.Constants.GLOBAL_LOCUS;

/**
 * A result slot that must be filled before a run is judged complete.
 * Identified by the producing workload, the node (or global scope) it covers, and its result kind.
 */
@Value
public class ExpectedResult {

    @JsonProperty("producer")
    String producer;

    @JsonProperty("locus")
    String locus;

    @JsonProperty("kind")
    String kind;

    @JsonCreator
    public ExpectedResult(
            @JsonProperty("producer") String producer,
            @JsonProperty("locus") String locus,
            @JsonProperty("kind") String kind) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.locus = locus == null || locus.isBlank() ? GLOBAL_LOCUS : locus;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static ExpectedResult forNode(String producer, String node, String kind) {
        return new ExpectedResult(producer, node, kind);
    }

    public static ExpectedResult global(String producer, String kind) {
        return new ExpectedResult(producer, GLOBAL_LOCUS, kind);
    }

    @JsonIgnore
    public boolean isGlobal() {
        return GLOBAL_LOCUS.equals(locus);
    }
}
