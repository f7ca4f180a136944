package io.shipgraph.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import io.shipgraph.model.ErrorCode;
import io.shipgraph.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

final class StateSchemaTest {

    private static StateSchema schema() {
        return StateSchema.builder()
                .replace("summary")
                .append("messages")
                .upsertById("findings", "id")
                .counter("count")
                .build();
    }

    @Test
    void initialStateUsesChannelDefaultsInDeclarationOrder() {
        Map<String, JsonNode> state = schema().initialState();
        Assertions.assertEquals(List.of("summary", "messages", "findings", "count"), new ArrayList<>(state.keySet()));
        Assertions.assertTrue(state.get("summary").isNull());
        Assertions.assertTrue(state.get("messages").isArray());
        Assertions.assertEquals(IntNode.valueOf(0), state.get("count"));
    }

    @Test
    void duplicateChannelIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> StateSchema.builder().replace("a").append("a"));
    }

    @Test
    void mergeFoldsInTaskIndexOrderNotArrivalOrder() {
        StateSchema schema = schema();
        List<StateUpdate> arrival = List.of(
                new StateUpdate(2, "w", Map.of("summary", Jsons.tree("third"), "messages", Jsons.tree("m2"))),
                new StateUpdate(0, "w", Map.of("summary", Jsons.tree("first"), "messages", Jsons.tree("m0"))),
                new StateUpdate(1, "w", Map.of("messages", Jsons.tree("m1"), "count", IntNode.valueOf(2)))
        );
        Map<String, JsonNode> merged = schema.merge(schema.initialState(), arrival);
        Assertions.assertEquals("third", merged.get("summary").asText());
        Assertions.assertEquals(Jsons.tree(List.of("m0", "m1", "m2")), merged.get("messages"));
        Assertions.assertEquals(2, merged.get("count").asInt());
    }

    @Test
    void fanOutMergeIsIndependentOfCompletionOrder() {
        StateSchema schema = schema();
        Random random = new Random(42L);
        for (int n = 3; n <= 8; n++) {
            List<StateUpdate> updates = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                updates.add(new StateUpdate(i, "collect", Map.of(
                        "findings", Jsons.tree(Map.of("id", "f" + (i % 3), "by", i)),
                        "messages", Jsons.tree("from-" + i),
                        "count", IntNode.valueOf(1),
                        "summary", Jsons.tree("s" + i))));
            }
            Map<String, JsonNode> expected = schema.merge(schema.initialState(), updates);
            for (int round = 0; round < 25; round++) {
                List<StateUpdate> shuffled = new ArrayList<>(updates);
                Collections.shuffle(shuffled, random);
                Assertions.assertEquals(expected, schema.merge(schema.initialState(), shuffled), "n=" + n + " round=" + round);
            }
            Assertions.assertEquals(Math.min(n, 3), expected.get("findings").size());
            Assertions.assertEquals(n, expected.get("count").asInt());
        }
    }

    @Test
    void undeclaredChannelFailsBeforeAnythingIsMerged() {
        StateSchema schema = schema();
        Map<String, JsonNode> before = schema.initialState();
        InvalidUpdateException error = Assertions.assertThrows(InvalidUpdateException.class, () -> schema.merge(before, List.of(
                new StateUpdate(0, "ok", Map.of("count", IntNode.valueOf(1))),
                new StateUpdate(1, "bad", Map.of("nope", Jsons.tree(1))))));
        Assertions.assertEquals(ErrorCode.NODE_EXECUTION, error.code());
        Assertions.assertTrue(error.getMessage().contains("nope"));
        Assertions.assertEquals(IntNode.valueOf(0), before.get("count"));
    }

    @Test
    void throwingReducerBecomesReducerConflict() {
        StateSchema schema = StateSchema.builder()
                .channel("strict", (current, update) -> {
                    throw new IllegalStateException("conflict on " + update);
                }, null)
                .build();
        ReducerConflictException error = Assertions.assertThrows(ReducerConflictException.class,
                () -> schema.merge(schema.initialState(), List.of(new StateUpdate(0, "writer", Map.of("strict", Jsons.tree(1))))));
        Assertions.assertEquals(ErrorCode.REDUCER_CONFLICT, error.code());
        Assertions.assertEquals("strict", error.channel());
    }

    @Test
    void alignAddsMissingChannelsAndDropsUnknownOnes() {
        StateSchema schema = schema();
        Map<String, JsonNode> aligned = schema.align(Map.of("summary", Jsons.tree("kept"), "legacy", Jsons.tree(1)));
        Assertions.assertEquals("kept", aligned.get("summary").asText());
        Assertions.assertFalse(aligned.containsKey("legacy"));
        Assertions.assertTrue(aligned.get("findings").isArray());
    }

    @Test
    void stateViewHandsOutCopies() {
        StateView view = new StateView(Map.of("messages", Jsons.tree(List.of("a"))));
        ((ArrayNode) view.get("messages")).add("mutated");
        Assertions.assertEquals(1, view.size("messages"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> view.get("missing"));
    }
}
