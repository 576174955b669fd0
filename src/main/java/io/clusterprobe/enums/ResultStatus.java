package io.clusterprobe.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of one expected result slot, or of the run as a whole, as reported in the status annotation.
 */
public enum ResultStatus {
    /**
     * Slot still pending.
     */
    RUNNING,

    /**
     * Slot filled by a result without an error.
     */
    COMPLETE,

    /**
     * Slot filled by an error result.
     */
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
