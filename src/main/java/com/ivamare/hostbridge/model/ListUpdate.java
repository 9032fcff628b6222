package com.ivamare.hostbridge.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A mutation of a list shown in the UI. Never merged or dropped.
 *
 * @param id Envelope id
 * @param timestamp Creation time
 * @param priority Delivery priority
 * @param listId List being mutated, also the envelope target
 * @param kind Kind of mutation
 * @param items Items added, removed, updated or replacing the list
 */
public record ListUpdate(
    String id,
    Instant timestamp,
    UpdatePriority priority,
    String listId,
    ListChangeKind kind,
    List<Object> items
) implements UpdateEnvelope {

    public ListUpdate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(listId, "listId");
        Objects.requireNonNull(kind, "kind");
        items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public UpdateType type() {
        return kind.updateType();
    }

    @Override
    public String targetId() {
        return listId;
    }
}
