package com.cryptsync.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One per-id entry of a delta.
 *
 * Wire forms:
 * - added:   {"id": "m1", "added": true, "fields": {...}}
 * - changed: {"id": "p1", "changed": {"hp": 7, "x": 4}}
 * - removed: {"id": "m2", "removed": true}
 *
 * In a {@code changed} map a JSON null means the field was dropped.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EntityChange {

    public enum Kind {
        ADDED,
        CHANGED,
        REMOVED
    }

    private final String id;
    private final Kind kind;
    private final Map<String, JsonNode> fields;

    private EntityChange(String id, Kind kind, Map<String, JsonNode> fields) {
        this.id = id;
        this.kind = kind;
        this.fields = fields == null ? null : Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    public static EntityChange added(EntityState state) {
        return new EntityChange(state.getId(), Kind.ADDED, state.getFields());
    }

    public static EntityChange changed(String id, Map<String, JsonNode> changedFields) {
        return new EntityChange(id, Kind.CHANGED, changedFields);
    }

    public static EntityChange removed(String id) {
        return new EntityChange(id, Kind.REMOVED, null);
    }

    public String getId() {
        return id;
    }

    @JsonIgnore
    public Kind getKind() {
        return kind;
    }

    public Boolean getAdded() {
        return kind == Kind.ADDED ? Boolean.TRUE : null;
    }

    public Boolean getRemoved() {
        return kind == Kind.REMOVED ? Boolean.TRUE : null;
    }

    /**
     * Full record of a newly added entity.
     */
    public Map<String, JsonNode> getFields() {
        return kind == Kind.ADDED ? fields : null;
    }

    /**
     * Changed fields of an existing entity.
     */
    public Map<String, JsonNode> getChanged() {
        return kind == Kind.CHANGED ? fields : null;
    }

    @Override
    public String toString() {
        return "EntityChange{" + kind + " '" + id + "'" + (fields != null ? ", " + fields : "") + '}';
    }
}
