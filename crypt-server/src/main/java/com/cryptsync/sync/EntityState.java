package com.cryptsync.sync;

import com.cryptsync.game.EntityView;
import com.cryptsync.protocol.MessageSerializer;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable record of one entity's canonical fields at a given revision.
 *
 * Field values are Jackson trees so equality is structural and the record
 * can be written to the wire as-is. Null values are never stored.
 */
public final class EntityState {

    private static final ObjectMapper MAPPER = MessageSerializer.sharedMapper();

    private final String id;
    private final Map<String, JsonNode> fields;

    public EntityState(String id, Map<String, JsonNode> fields) {
        this.id = id;
        Map<String, JsonNode> copy = new TreeMap<>();
        fields.forEach((key, value) -> {
            if (value != null && !value.isNull() && !value.isMissingNode()) {
                copy.put(key, value.deepCopy());
            }
        });
        this.fields = Collections.unmodifiableMap(copy);
    }

    /**
     * Captures the canonical fields of a live entity. Display hints are not read.
     */
    public static EntityState capture(EntityView entity) {
        Map<String, JsonNode> fields = new TreeMap<>();
        entity.getCanonicalFields().forEach((key, value) -> {
            if (value != null) {
                fields.put(key, MAPPER.valueToTree(value));
            }
        });
        fields.put("kind", TextNode.valueOf(entity.getKind()));
        fields.put("alive", BooleanNode.valueOf(entity.isAlive()));
        return new EntityState(entity.getId(), fields);
    }

    /**
     * Builds a record from plain values.
     */
    public static EntityState of(String id, Map<String, ?> values) {
        Map<String, JsonNode> fields = new TreeMap<>();
        values.forEach((key, value) -> {
            if (value != null) {
                fields.put(key, MAPPER.valueToTree(value));
            }
        });
        return new EntityState(id, fields);
    }

    public String getId() {
        return id;
    }

    @JsonValue
    public Map<String, JsonNode> getFields() {
        return fields;
    }

    public JsonNode get(String field) {
        return fields.get(field);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EntityState)) {
            return false;
        }
        EntityState other = (EntityState) o;
        return id.equals(other.id) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return 31 * id.hashCode() + fields.hashCode();
    }

    @Override
    public String toString() {
        return "EntityState{id='" + id + "', fields=" + fields + '}';
    }
}
