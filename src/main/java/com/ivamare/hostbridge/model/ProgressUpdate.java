package com.ivamare.hostbridge.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Progress of a long-running host task.
 *
 * @param id Envelope id
 * @param timestamp Creation time
 * @param priority Delivery priority
 * @param taskId Task reporting progress, also the envelope target (nullable)
 * @param progress Percentage between 0 and 100
 * @param message Status line (nullable)
 */
public record ProgressUpdate(
    String id,
    Instant timestamp,
    UpdatePriority priority,
    String taskId,
    double progress,
    String message
) implements UpdateEnvelope {

    public ProgressUpdate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(priority, "priority");
        if (Double.isNaN(progress) || progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be between 0 and 100: " + progress);
        }
    }

    @Override
    public UpdateType type() {
        return UpdateType.PROGRESS;
    }

    @Override
    public String targetId() {
        return taskId;
    }

    @Override
    public boolean isCoalescible() {
        return taskId != null && priority != UpdatePriority.HIGH;
    }

    /**
     * Only the latest progress matters; the newer envelope wins outright.
     */
    @Override
    public Optional<UpdateEnvelope> coalesce(UpdateEnvelope newer) {
        if (newer instanceof ProgressUpdate next
                && isCoalescible()
                && next.priority == priority
                && taskId.equals(next.taskId)) {
            return Optional.of(next);
        }
        return Optional.empty();
    }
}
