package com.ivamare.hostbridge.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.hostbridge.model.ListChangeKind;
import com.ivamare.hostbridge.model.ListUpdate;
import com.ivamare.hostbridge.model.ProgressUpdate;
import com.ivamare.hostbridge.model.TerminalUpdate;
import com.ivamare.hostbridge.model.TextUpdate;
import com.ivamare.hostbridge.model.UpdatePriority;
import com.ivamare.hostbridge.model.UpdateType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UpdateEnvelopes")
class UpdateEnvelopesTest {

    @Test
    @DisplayName("should create text updates with normal priority by default")
    void shouldCreateTextUpdate() {
        TextUpdate update = UpdateEnvelopes.createTextUpdate("hello");

        assertEquals(UpdateType.TEXT, update.type());
        assertEquals(UpdatePriority.NORMAL, update.priority());
        assertEquals("hello", update.content());
        assertNull(update.targetId());
        assertNotNull(update.timestamp());
        assertFalse(update.isCoalescible());
    }

    @Test
    @DisplayName("should create targeted text updates with the given priority")
    void shouldCreateTargetedTextUpdate() {
        TextUpdate update = UpdateEnvelopes.createTextUpdate("x", "editor", UpdatePriority.LOW);

        assertEquals("editor", update.targetId());
        assertEquals(UpdatePriority.LOW, update.priority());
        assertTrue(update.isCoalescible());
    }

    @Test
    @DisplayName("should default terminal output to stdout")
    void shouldDefaultTerminalStream() {
        TerminalUpdate update = UpdateEnvelopes.createTerminalUpdate("ok\n");

        assertEquals(UpdateType.TERMINAL, update.type());
        assertEquals(TerminalUpdate.STDOUT, update.stream());
        assertEquals(TerminalUpdate.STDERR, UpdateEnvelopes.createTerminalUpdate("err", "stderr").stream());
        assertFalse(update.isCoalescible());
    }

    @ParameterizedTest
    @EnumSource(ListChangeKind.class)
    @DisplayName("should derive the list update type from the change kind")
    void shouldDeriveListUpdateType(ListChangeKind kind) {
        ListUpdate update = UpdateEnvelopes.createListUpdate("files", kind, List.of("a"));

        assertEquals("list_" + kind.getValue(), update.type().getValue());
        assertEquals("files", update.targetId());
        assertFalse(update.isCoalescible());
    }

    @Test
    @DisplayName("should copy list items")
    void shouldCopyListItems() {
        List<String> items = new ArrayList<>(List.of("a"));

        ListUpdate update = UpdateEnvelopes.createListUpdate("files", ListChangeKind.ADD, items);
        items.add("b");

        assertEquals(List.of("a"), update.items());
        assertThrows(UnsupportedOperationException.class, () -> update.items().add("c"));
    }

    @Test
    @DisplayName("should create progress updates targeted at their task")
    void shouldCreateProgressUpdate() {
        ProgressUpdate update = UpdateEnvelopes.createProgressUpdate(42.5, "index", "scanning");

        assertEquals(UpdateType.PROGRESS, update.type());
        assertEquals("index", update.targetId());
        assertEquals(42.5, update.progress());
        assertEquals("scanning", update.message());
        assertTrue(update.isCoalescible());
        assertFalse(UpdateEnvelopes.createProgressUpdate(0).isCoalescible());
    }

    @ParameterizedTest
    @ValueSource(doubles = {-1, 100.5, Double.NaN})
    @DisplayName("should reject progress outside 0 to 100")
    void shouldRejectProgressOutOfRange(double progress) {
        assertThrows(IllegalArgumentException.class, () -> UpdateEnvelopes.createProgressUpdate(progress));
    }

    @Test
    @DisplayName("should give every envelope a unique id")
    void shouldGiveUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            ids.add(UpdateEnvelopes.createTerminalUpdate("x").id());
        }

        assertEquals(1_000, ids.size());
    }

    @Test
    @DisplayName("should merge text only with the same target and priority")
    void shouldMergeTextWithSameTargetAndPriority() {
        TextUpdate first = UpdateEnvelopes.createTextUpdate("a", "t", UpdatePriority.NORMAL);
        TextUpdate second = UpdateEnvelopes.createTextUpdate("b", "t", UpdatePriority.NORMAL);

        TextUpdate merged = (TextUpdate) first.coalesce(second).orElseThrow();

        assertEquals("ab", merged.content());
        assertEquals(second.id(), merged.id());
        assertTrue(first.coalesce(UpdateEnvelopes.createTextUpdate("b", "other", UpdatePriority.NORMAL)).isEmpty());
        assertTrue(first.coalesce(UpdateEnvelopes.createTextUpdate("b", "t", UpdatePriority.LOW)).isEmpty());
        assertTrue(first.coalesce(UpdateEnvelopes.createProgressUpdate(5, "t", null)).isEmpty());
    }

    @Test
    @DisplayName("should serialize envelopes with their wire type")
    void shouldSerializeWithWireType() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

        JsonNode json = mapper.valueToTree(
            UpdateEnvelopes.createListUpdate("files", ListChangeKind.REPLACE, List.of("a")));

        assertEquals("list_replace", json.get("type").asText());
        assertEquals("normal", json.get("priority").asText());
        assertEquals("files", json.get("listId").asText());
    }
}
