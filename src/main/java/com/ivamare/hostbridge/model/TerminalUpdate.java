package com.ivamare.hostbridge.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Raw terminal output. Never merged or dropped.
 *
 * @param id Envelope id
 * @param timestamp Creation time
 * @param priority Delivery priority
 * @param output Terminal bytes as text
 * @param stream Source stream, "stdout" or "stderr"
 */
public record TerminalUpdate(
    String id,
    Instant timestamp,
    UpdatePriority priority,
    String output,
    String stream
) implements UpdateEnvelope {

    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";

    public TerminalUpdate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(output, "output");
        stream = stream == null || stream.isBlank() ? STDOUT : stream;
    }

    @Override
    public UpdateType type() {
        return UpdateType.TERMINAL;
    }

    @Override
    public String targetId() {
        return null;
    }
}
