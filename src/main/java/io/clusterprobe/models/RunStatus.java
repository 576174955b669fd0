package io.clusterprobe.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterprobe.enums.ResultStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Progress summary written onto the status target while a run is in flight.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunStatus {

    @JsonProperty("status")
    private ResultStatus status;

    @JsonProperty("filled")
    private int filled;

    @JsonProperty("expected")
    private int expected;

    @JsonProperty("plugins")
    private List<SlotStatus> plugins = new ArrayList<>();

    /**
     * Status of one expected result slot.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SlotStatus {

        @JsonProperty("plugin")
        private String producer;

        @JsonProperty("node")
        private String locus;

        @JsonProperty("kind")
        private String kind;

        @JsonProperty("status")
        private ResultStatus status;
    }
}
