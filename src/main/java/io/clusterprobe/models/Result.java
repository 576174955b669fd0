package io.clusterprobe.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

import static io.clusterprobe.config.Constants.GLOBAL_LOCUS;

/**
 * A filled (or failed) result for one slot. Either submitted by a workload over the
 * result transport, or synthesized as an error surrogate when a workload cannot report.
 *
 * <p>Instances are immutable: the payload is copied on the way in and on the way out.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Result {

    @JsonProperty("producer")
    String producer;

    @JsonProperty("locus")
    String locus;

    @JsonProperty("kind")
    String kind;

    @JsonProperty("payload")
    JsonNode payload;

    @JsonProperty("error")
    String error;

    @Builder(toBuilder = true)
    private Result(String producer, String locus, String kind, JsonNode payload, String error) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.locus = locus == null || locus.isBlank() ? GLOBAL_LOCUS : locus;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
        this.error = error == null || error.isBlank() ? null : error;
    }

    public JsonNode getPayload() {
        return payload.deepCopy();
    }

    /**
     * The slot this result fills.
     */
    @JsonIgnore
    public ExpectedResult key() {
        return new ExpectedResult(producer, locus, kind);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
