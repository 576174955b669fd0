package io.clusterprobe.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement returned for every result submission.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubmissionResponse {
    public static final String STATUS_ACCEPTED = "accepted";
    public static final String STATUS_IGNORED = "ignored";
    public static final String STATUS_REJECTED = "rejected";

    private String status;
    private String reason;
    private Integer code;

    public static SubmissionResponse accepted() {
        return SubmissionResponse.builder()
            .status(STATUS_ACCEPTED)
            .code(202)
            .build();
    }

    public static SubmissionResponse ignored(String reason) {
        return SubmissionResponse.builder()
            .status(STATUS_IGNORED)
            .reason(reason)
            .code(200)
            .build();
    }

    public static SubmissionResponse badRequest(String message) {
        return SubmissionResponse.builder()
            .status(STATUS_REJECTED)
            .reason(message)
            .code(400)
            .build();
    }

    public static SubmissionResponse forbidden(String message) {
        return SubmissionResponse.builder()
            .status(STATUS_REJECTED)
            .reason(message)
            .code(403)
            .build();
    }

    public static SubmissionResponse methodNotAllowed(String method) {
        return SubmissionResponse.builder()
            .status(STATUS_REJECTED)
            .reason(method + " is not supported")
            .code(405)
            .build();
    }

    public static SubmissionResponse internalError(String message) {
        return SubmissionResponse.builder()
            .status(STATUS_REJECTED)
            .reason(message)
            .code(500)
            .build();
    }
}
