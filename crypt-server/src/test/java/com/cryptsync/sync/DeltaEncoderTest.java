package com.cryptsync.sync;

import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Delta Encoder Tests")
class DeltaEncoderTest {

    private final DeltaEncoder encoder = new DeltaEncoder();

    private static EntityState record(String id, Object... keyValues) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return EntityState.of(id, fields);
    }

    private static StateSnapshot.Builder header(long revision) {
        return StateSnapshot.builder()
                .sessionId("S")
                .revision(revision)
                .status("ACTIVE")
                .roundNumber(1)
                .maxActions(4);
    }

    @Test
    @DisplayName("Added, changed and removed records are detected per field")
    void testDiff() {
        StateSnapshot base = header(1)
                .entity(record("a", "x", 1, "y", 1))
                .entity(record("b", "x", 5, "y", 5))
                .build();
        StateSnapshot next = header(2)
                .entity(record("a", "x", 2, "y", 1))
                .entity(record("c", "x", 0, "y", 0))
                .build();

        StateDelta delta = encoder.computeDelta(base, next, List.of("a moved"));
        assertEquals(1, delta.getBaseRevision());
        assertEquals(2, delta.getNewRevision());
        assertEquals(List.of("a moved"), delta.getEvents());

        Map<String, EntityChange> byId = new LinkedHashMap<>();
        delta.getEntities().forEach(c -> byId.put(c.getId(), c));
        assertEquals(3, byId.size());

        EntityChange changed = byId.get("a");
        assertEquals(EntityChange.Kind.CHANGED, changed.getKind());
        assertEquals(1, changed.getChanged().size());
        assertEquals(2, changed.getChanged().get("x").asInt());

        assertEquals(EntityChange.Kind.REMOVED, byId.get("b").getKind());
        assertEquals(EntityChange.Kind.ADDED, byId.get("c").getKind());
        assertEquals(0, byId.get("c").getFields().get("x").asInt());
    }

    @Test
    @DisplayName("A field that disappears is sent as null and removed on apply")
    void testFieldRemoval() {
        StateSnapshot base = header(1).entity(record("a", "x", 1, "carrying", "gem")).build();
        StateSnapshot next = header(2).entity(record("a", "x", 1)).build();

        StateDelta delta = encoder.computeDelta(base, next, null);
        assertEquals(NullNode.getInstance(), delta.getEntities().get(0).getChanged().get("carrying"));

        StateSnapshot applied = encoder.applyDelta(base, delta);
        assertEquals(next, applied);
        assertNull(applied.getEntities().get("a").get("carrying"));
    }

    @Test
    @DisplayName("Applying a delta reproduces the target snapshot, header included")
    void testApplyReproducesTarget() {
        StateSnapshot base = header(3)
                .entity(record("a", "hp", 10))
                .player(record("p1", "connected", true))
                .build();
        StateSnapshot next = header(4)
                .roundNumber(2)
                .actionsTaken(0)
                .status("ENDED")
                .gameOver(true)
                .victory(false)
                .entity(record("a", "hp", 0))
                .player(record("p1", "connected", false))
                .build();

        assertEquals(next, encoder.applyDelta(base, encoder.computeDelta(base, next, null)));
    }

    @Test
    @DisplayName("Header-only changes still make a non-empty delta")
    void testHeaderOnlyDelta() {
        StateSnapshot base = header(1).actionsTaken(1).build();
        assertFalse(encoder.computeDelta(base, header(2).actionsTaken(2).build(), null).isEmpty());
        assertTrue(encoder.computeDelta(base, header(2).actionsTaken(1).build(), null).isEmpty());
    }

    @Test
    @DisplayName("A delta only applies on top of its base revision")
    void testStaleRevision() {
        StateSnapshot base = header(1).entity(record("a", "x", 1)).build();
        StateSnapshot next = header(2).entity(record("a", "x", 2)).build();
        StateDelta delta = encoder.computeDelta(base, next, null);

        StaleRevisionException e = assertThrows(StaleRevisionException.class,
                () -> encoder.applyDelta(next, delta));
        assertEquals(1, e.getExpectedBase());
        assertEquals(2, e.getActualRevision());

        assertThrows(IllegalArgumentException.class, () -> encoder.computeDelta(next, base, null));
    }
}
