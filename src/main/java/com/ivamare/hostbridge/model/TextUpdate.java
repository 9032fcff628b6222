package com.ivamare.hostbridge.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A text delta (for example a chunk of streamed AI tokens) for one target.
 *
 * @param id Envelope id
 * @param timestamp Creation time
 * @param priority Delivery priority
 * @param targetId Target region (nullable)
 * @param content Text delta
 */
public record TextUpdate(
    String id,
    Instant timestamp,
    UpdatePriority priority,
    String targetId,
    String content
) implements UpdateEnvelope {

    public TextUpdate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(content, "content");
    }

    @Override
    public UpdateType type() {
        return UpdateType.TEXT;
    }

    @Override
    public boolean isCoalescible() {
        return targetId != null && priority != UpdatePriority.HIGH;
    }

    /**
     * Deltas are appended, so the merged envelope carries both contents in order.
     */
    @Override
    public Optional<UpdateEnvelope> coalesce(UpdateEnvelope newer) {
        if (newer instanceof TextUpdate next
                && isCoalescible()
                && next.priority == priority
                && targetId.equals(next.targetId)) {
            return Optional.of(new TextUpdate(next.id, next.timestamp, priority, targetId, content + next.content));
        }
        return Optional.empty();
    }
}
