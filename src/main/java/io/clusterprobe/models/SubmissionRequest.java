package io.clusterprobe.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a result submission. The producer is taken from the caller's certificate;
 * a producer field in the body is only checked against it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmissionRequest {

    @JsonProperty("producer")
    private String producer;

    @JsonProperty("locus")
    private String locus;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("payload")
    private JsonNode payload;

    @JsonProperty("error")
    private String error;
}
