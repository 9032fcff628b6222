package com.ivamare.hostbridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical request to the host command executor, as sent inside a {@code batch_invoke}.
 *
 * <p>Serializes as {@code {"id": ..., "cmd": ..., "args": {...}}}. Ids are only meaningful
 * within the batch that carries them.
 *
 * @param id Call id, unique within one batch
 * @param command Command name
 * @param args Command arguments (never null, empty when none were given)
 */
public record Call(
    String id,
    @JsonProperty("cmd") String command,
    Map<String, Object> args
) {
    public Call {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(command, "command");
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }
}
