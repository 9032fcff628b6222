package com.ivamare.hostbridge.stream;

import com.ivamare.hostbridge.model.ListChangeKind;
import com.ivamare.hostbridge.model.ListUpdate;
import com.ivamare.hostbridge.model.ProgressUpdate;
import com.ivamare.hostbridge.model.TerminalUpdate;
import com.ivamare.hostbridge.model.TextUpdate;
import com.ivamare.hostbridge.model.UpdatePriority;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Factory for update envelopes.
 *
 * <p>Every envelope gets a fresh id, the current timestamp and, unless told otherwise,
 * {@link UpdatePriority#NORMAL} priority.
 *
 * <p>Example:
 * <pre>
 * streamBus.queueUpdate(UpdateEnvelopes.createTextUpdate(token, "chat-42", null));
 * streamBus.queueUpdate(UpdateEnvelopes.createProgressUpdate(40, "index", "Indexing sources"));
 * </pre>
 */
public final class UpdateEnvelopes {

    private UpdateEnvelopes() {
    }

    public static TextUpdate createTextUpdate(String content) {
        return createTextUpdate(content, null, null);
    }

    /**
     * @param content Text delta
     * @param targetId Target region (nullable)
     * @param priority Priority (nullable, defaults to normal)
     */
    public static TextUpdate createTextUpdate(String content, String targetId, UpdatePriority priority) {
        return new TextUpdate(nextId(), Instant.now(), priorityOrDefault(priority), targetId, content);
    }

    public static TerminalUpdate createTerminalUpdate(String output) {
        return createTerminalUpdate(output, TerminalUpdate.STDOUT);
    }

    public static TerminalUpdate createTerminalUpdate(String output, String stream) {
        return new TerminalUpdate(nextId(), Instant.now(), UpdatePriority.NORMAL, output, stream);
    }

    public static ListUpdate createListUpdate(String listId, ListChangeKind kind, List<?> items) {
        List<Object> copy = items == null ? List.of() : new ArrayList<>(items);
        return new ListUpdate(nextId(), Instant.now(), UpdatePriority.NORMAL, listId, kind, copy);
    }

    public static ProgressUpdate createProgressUpdate(double progress) {
        return createProgressUpdate(progress, null, null);
    }

    /**
     * @param progress Percentage between 0 and 100
     * @param taskId Task id (nullable)
     * @param message Status line (nullable)
     */
    public static ProgressUpdate createProgressUpdate(double progress, String taskId, String message) {
        return new ProgressUpdate(nextId(), Instant.now(), UpdatePriority.NORMAL, taskId, progress, message);
    }

    private static UpdatePriority priorityOrDefault(UpdatePriority priority) {
        return priority != null ? priority : UpdatePriority.NORMAL;
    }

    private static String nextId() {
        return UUID.randomUUID().toString();
    }
}
