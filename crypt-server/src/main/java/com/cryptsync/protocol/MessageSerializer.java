package com.cryptsync.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Handles serialization/deserialization of messages.
 *
 * Wire format is JSON text with snake_case property names. Inbound frames are
 * parsed through the tree model so that an unknown {@code type} is reported as
 * {@link ErrorCode#UNKNOWN_MESSAGE_TYPE} rather than a generic parse failure.
 *
 * The serializer is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class MessageSerializer {

    private static final Logger logger = LoggerFactory.getLogger(MessageSerializer.class);

    private static final ObjectMapper SHARED_MAPPER = createObjectMapper();

    private final ObjectMapper objectMapper;

    public MessageSerializer() {
        this.objectMapper = SHARED_MAPPER;
    }

    /**
     * Creates an ObjectMapper configured for the wire format.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }

    /**
     * Returns the process-wide mapper used for wire JSON.
     */
    public static ObjectMapper sharedMapper() {
        return SHARED_MAPPER;
    }

    /**
     * Serializes a Message to JSON string.
     *
     * @param message The message to serialize
     * @return JSON string representation
     */
    public String serialize(Message message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize message: {}", message, e);
            throw new IllegalStateException("Serialization failed", e);
        }
    }

    /**
     * Deserializes a JSON string to Message.
     *
     * @param json The JSON string to deserialize
     * @return Deserialized Message object
     * @throws ProtocolException if the frame is not a well-formed envelope
     */
    public Message deserialize(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            logger.debug("Rejected malformed frame: {}", e.getOriginalMessage());
            throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "Invalid JSON", e);
        }

        if (root == null || !root.isObject()) {
            throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "Message must be a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "Message type is required");
        }
        MessageType type = MessageType.fromWire(typeNode.asText());
        if (type == null) {
            throw new ProtocolException(ErrorCode.UNKNOWN_MESSAGE_TYPE,
                    "Unknown message type: " + typeNode.asText());
        }

        JsonNode payload = root.get("payload");
        if (payload != null && payload.isNull()) {
            payload = null;
        }
        if (payload != null && !payload.isObject()) {
            throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "Payload must be a JSON object");
        }

        JsonNode requestIdNode = root.get("request_id");
        String requestId = null;
        if (requestIdNode != null && !requestIdNode.isNull()) {
            if (!requestIdNode.isValueNode()) {
                throw new ProtocolException(ErrorCode.MALFORMED_MESSAGE, "request_id must be a scalar");
            }
            requestId = requestIdNode.asText();
        }

        return Message.builder()
                .type(type)
                .payload(payload)
                .requestId(requestId)
                .build();
    }

    /**
     * Creates a new JSON object node for building payloads.
     */
    public ObjectNode createObjectNode() {
        return objectMapper.createObjectNode();
    }

    /**
     * Converts a value object (snapshot, delta, listing) into a payload tree.
     */
    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }

    /**
     * Gets the underlying ObjectMapper for advanced operations.
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Estimates the byte size of a message for bandwidth monitoring.
     */
    public int estimateSize(Message message) {
        return serialize(message).getBytes(StandardCharsets.UTF_8).length;
    }
}
