package com.cryptsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes and applies deltas between two snapshots.
 *
 * Delta compression keeps steady-state traffic small: an action that moves
 * one player sends that player's changed coordinates and the round counters,
 * not the whole world.
 *
 * Every method is a pure function of its arguments; instances are stateless
 * and thread-safe.
 */
public class DeltaEncoder {

    /**
     * Calculates the difference between two snapshots.
     *
     * @param base   snapshot the receiver is assumed to hold
     * @param next   snapshot to move to
     * @param events display-only outcome messages to attach
     */
    public StateDelta computeDelta(StateSnapshot base, StateSnapshot next, List<String> events) {
        if (next.getRevision() <= base.getRevision()) {
            throw new IllegalArgumentException("Revision must increase: "
                    + base.getRevision() + " -> " + next.getRevision());
        }
        return new StateDelta(base, next,
                diff(base.getEntities(), next.getEntities()),
                diff(base.getPlayers(), next.getPlayers()),
                events == null ? Collections.emptyList() : new ArrayList<>(events));
    }

    /**
     * Applies a delta to the snapshot it was computed against.
     *
     * @throws StaleRevisionException if {@code snapshot} is not at the delta's base revision
     */
    public StateSnapshot applyDelta(StateSnapshot snapshot, StateDelta delta) {
        if (snapshot.getRevision() != delta.getBaseRevision()) {
            throw new StaleRevisionException(delta.getBaseRevision(), snapshot.getRevision());
        }
        return snapshot.toBuilder()
                .revision(delta.getNewRevision())
                .status(delta.getStatus())
                .roundNumber(delta.getRoundNumber())
                .actionsTaken(delta.getActionsTaken())
                .maxActions(delta.getMaxActions())
                .gameOver(delta.isGameOver())
                .victory(delta.getVictory())
                .entities(patch(snapshot.getEntities(), delta.getEntities()))
                .players(patch(snapshot.getPlayers(), delta.getPlayers()))
                .build();
    }

    /**
     * Per-id diff of two record maps, in id order.
     */
    List<EntityChange> diff(Map<String, EntityState> before, Map<String, EntityState> after) {
        List<EntityChange> changes = new ArrayList<>();

        for (Map.Entry<String, EntityState> entry : after.entrySet()) {
            EntityState old = before.get(entry.getKey());
            if (old == null) {
                changes.add(EntityChange.added(entry.getValue()));
            } else if (!old.equals(entry.getValue())) {
                changes.add(EntityChange.changed(entry.getKey(), changedFields(old, entry.getValue())));
            }
        }

        for (String id : before.keySet()) {
            if (!after.containsKey(id)) {
                changes.add(EntityChange.removed(id));
            }
        }
        return changes;
    }

    private Map<String, JsonNode> changedFields(EntityState old, EntityState current) {
        Map<String, JsonNode> changed = new TreeMap<>();
        current.getFields().forEach((field, value) -> {
            if (!value.equals(old.get(field))) {
                changed.put(field, value);
            }
        });
        for (String field : old.getFields().keySet()) {
            if (current.get(field) == null) {
                changed.put(field, NullNode.getInstance());
            }
        }
        return changed;
    }

    private Map<String, EntityState> patch(Map<String, EntityState> records, List<EntityChange> changes) {
        Map<String, EntityState> result = new TreeMap<>(records);
        for (EntityChange change : changes) {
            switch (change.getKind()) {
                case ADDED -> result.put(change.getId(), new EntityState(change.getId(), change.getFields()));
                case REMOVED -> result.remove(change.getId());
                case CHANGED -> {
                    EntityState existing = result.get(change.getId());
                    Map<String, JsonNode> fields = existing != null
                            ? new TreeMap<>(existing.getFields())
                            : new TreeMap<>();
                    change.getChanged().forEach((field, value) -> {
                        if (value == null || value.isNull()) {
                            fields.remove(field);
                        } else {
                            fields.put(field, value);
                        }
                    });
                    result.put(change.getId(), new EntityState(change.getId(), fields));
                }
            }
        }
        return result;
    }
}
