package com.cryptsync.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Represents a message in the game protocol.
 *
 * This class is immutable once built, so a single instance can be serialized
 * once and fanned out to every connection in a session.
 *
 * JSON format:
 * {
 *     "type": "ACTION",
 *     "payload": { "action_type": "MOVE", "params": { "dx": 1, "dy": 0 } },
 *     "request_id": "c-17",
 *     "timestamp": 1234567890
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    private final MessageType type;
    private final JsonNode payload;
    private final String requestId;
    private final Long timestamp;

    private Message(MessageType type, JsonNode payload, String requestId, Long timestamp) {
        this.type = type;
        this.payload = payload;
        this.requestId = requestId;
        this.timestamp = timestamp;
    }

    public MessageType getType() {
        return type;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public String getRequestId() {
        return requestId;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    /**
     * Reads a text field from the payload.
     *
     * @return the field value, or null if absent or not textual
     */
    public String payloadText(String field) {
        if (payload == null) {
            return null;
        }
        JsonNode node = payload.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    /**
     * Returns a builder pre-filled with this message's fields.
     */
    public Builder toBuilder() {
        return new Builder()
                .type(type)
                .payload(payload)
                .requestId(requestId)
                .timestamp(timestamp);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MessageType type;
        private JsonNode payload;
        private String requestId;
        private Long timestamp;

        public Builder type(MessageType type) {
            this.type = type;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder timestamp(Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Message build() {
            if (type == null) {
                throw new IllegalStateException("Message type is required");
            }
            return new Message(type, payload, requestId,
                    timestamp != null ? timestamp : System.currentTimeMillis());
        }
    }

    @Override
    public String toString() {
        return "Message{" +
                "type=" + type +
                ", requestId='" + requestId + '\'' +
                '}';
    }
}
