package com.ivamare.hostbridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Optional;

/**
 * Immutable, typed incremental-update record delivered through the stream bus.
 *
 * <p>Instances are built by {@link com.ivamare.hostbridge.stream.UpdateEnvelopes}; the
 * implementations below are the only envelope shapes the bus knows about.
 *
 * @see TextUpdate
 * @see TerminalUpdate
 * @see ListUpdate
 * @see ProgressUpdate
 */
public interface UpdateEnvelope {

    /**
     * Globally unique envelope id.
     */
    String id();

    @JsonProperty("type")
    UpdateType type();

    Instant timestamp();

    UpdatePriority priority();

    /**
     * Id of the UI target this update applies to, or null when it has none.
     */
    String targetId();

    /**
     * Whether successive envelopes of this kind for the same target may be merged
     * while the bus is under backpressure.
     */
    @JsonIgnore
    default boolean isCoalescible() {
        return false;
    }

    /**
     * Merge a newer envelope into this one.
     *
     * @param newer Envelope queued after this one
     * @return the merged envelope, or empty when the two cannot be merged
     */
    default Optional<UpdateEnvelope> coalesce(UpdateEnvelope newer) {
        return Optional.empty();
    }
}
