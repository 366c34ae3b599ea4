package com.cryptsync.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("State Synchronizer Tests")
class StateSynchronizerTest {

    private StateSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        synchronizer = new StateSynchronizer(new DeltaEncoder());
    }

    private static StateSnapshot.Builder draft(int x) {
        return StateSnapshot.builder()
                .sessionId("S")
                .status("ACTIVE")
                .roundNumber(1)
                .maxActions(4)
                .entity(EntityState.of("hero", Map.of("x", x)));
    }

    @Test
    @DisplayName("Revisions start at 1 and increase by one per publish")
    void testRevisionNumbering() {
        assertFalse(synchronizer.hasSnapshot());
        assertEquals(0, synchronizer.getRevision());
        assertThrows(IllegalStateException.class, () -> synchronizer.publishDelta(draft(0), null));

        assertEquals(1, synchronizer.publishSnapshot(draft(0)).getRevision());
        StateDelta d2 = synchronizer.publishDelta(draft(1), List.of("moved"));
        StateDelta d3 = synchronizer.publishDelta(draft(2), null);

        assertEquals(1, d2.getBaseRevision());
        assertEquals(2, d2.getNewRevision());
        assertEquals(2, d3.getBaseRevision());
        assertEquals(3, d3.getNewRevision());
        assertEquals(3, synchronizer.getCurrent().getRevision());
    }

    @Test
    @DisplayName("Unchanged state does not consume a revision")
    void testEmptyDeltaSkipped() {
        synchronizer.publishSnapshot(draft(0));
        assertNull(synchronizer.publishDelta(draft(0), List.of("nothing happened")));
        assertEquals(1, synchronizer.getRevision());
    }

    @Test
    @DisplayName("A replica follows in-order deltas and asks for a resync on a gap")
    void testReplicaGapDetection() {
        StateReplica replica = new StateReplica(new DeltaEncoder());
        assertTrue(replica.isResyncRequired());

        StateSnapshot start = synchronizer.publishSnapshot(draft(0));
        StateDelta d2 = synchronizer.publishDelta(draft(1), null);
        StateDelta d3 = synchronizer.publishDelta(draft(2), null);
        StateDelta d4 = synchronizer.publishDelta(draft(3), null);

        assertFalse(replica.acceptDelta(d2));
        assertTrue(replica.isResyncRequired());

        replica.acceptSnapshot(start);
        assertTrue(replica.acceptDelta(d2));
        assertFalse(replica.acceptDelta(d4));
        assertTrue(replica.isResyncRequired());
        assertEquals(2, replica.getRevision());

        replica.acceptSnapshot(synchronizer.getCurrent());
        assertFalse(replica.acceptDelta(d3));
        assertFalse(replica.isResyncRequired());
        assertEquals(synchronizer.getCurrent(), replica.getState());
        System.out.println("✓ Replica resynced at revision " + replica.getRevision());
    }
}
