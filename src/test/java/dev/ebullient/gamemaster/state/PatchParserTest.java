package dev.ebullient.gamemaster.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class PatchParserTest {

    PatchParser parser = new PatchParser(new ObjectMapper());

    @Test
    void parse_nestedObjectsFlattenToLeaves() {
        Patch patch = parser.parse(4, """
                {"player_character_data": {"hp_current": 9, "abilities": {"strength": 16}}}
                """);

        assertEquals(4, patch.baseVersion());
        assertEquals(PatchSource.AUTHOR, patch.source());
        assertEquals(List.of(
                new PatchOp.Assign("player_character_data.hp_current", 9),
                new PatchOp.Assign("player_character_data.abilities.strength", 16)), patch.ops());
    }

    @Test
    void parse_sentinelsBecomeTaggedOps() {
        Patch patch = parser.parse(1, """
                {"world_data": {"weather": "__DELETE__"},
                 "custom_campaign_state": {"core_memories": {"append": ["a", "b"]},
                                           "active_missions": {"append": "m3"}}}
                """);

        assertEquals(new PatchOp.Delete("world_data.weather"), patch.ops().get(0));
        assertEquals(new PatchOp.Append("custom_campaign_state.core_memories", List.of("a", "b")), patch.ops().get(1));
        assertEquals(new PatchOp.Append("custom_campaign_state.active_missions", List.of("m3")), patch.ops().get(2));
    }

    @Test
    void parse_emptyObjectIsKept() {
        Patch patch = parser.parse(1, "{\"world_data\": {\"factions\": {}}}");
        PatchOp.Assign op = assertInstanceOf(PatchOp.Assign.class, patch.ops().get(0));
        assertEquals("world_data.factions", op.path());
        assertEquals(Map.of(), op.value());
    }

    @Test
    void parse_nullBodyIsEmptyPatch() {
        assertTrue(parser.parse(3, (JsonNode) null).isEmpty());
    }

    @Test
    void parse_rejectsNonObjects() {
        assertThrows(SchemaViolationException.class, () -> parser.parse(1, "[1, 2]"));
        assertThrows(SchemaViolationException.class, () -> parser.parse(1, "{not json"));
        assertThrows(SchemaViolationException.class, () -> parser.parse(1, "{\"world_data..weather\": 1}"));
    }
}
