package com.ivamare.hostbridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a single call within a {@code batch_invoke} response.
 *
 * @param id Id of the call this result answers
 * @param status ok or error
 * @param data Payload when status is ok (nullable)
 * @param error Error message when status is error (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResult(
    String id,
    BatchResultStatus status,
    Object data,
    String error
) {
    public static BatchResult ok(String id, Object data) {
        return new BatchResult(id, BatchResultStatus.OK, data, null);
    }

    public static BatchResult error(String id, String error) {
        return new BatchResult(id, BatchResultStatus.ERROR, null, error);
    }

    @JsonIgnore
    public boolean isOk() {
        return status == BatchResultStatus.OK;
    }
}
