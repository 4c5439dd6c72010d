package com.cellblock.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * A single message exchanged between the coordinator and a runtime.
 *
 * <p>Frames travel as one JSON object per line: {@code {"type": ..., "ref": ..., "body": {...}}}.
 * The {@code ref} correlates requests with replies and handshake announcements with acknowledgements.
 *
 * @param type message type, e.g. {@code "ready"}, {@code "ack"}, {@code "evaluate"}
 * @param ref  correlation reference (nullable for one-way events)
 * @param body message payload, never null (an empty payload is {@link NullNode})
 */
public record Frame(String type, String ref, JsonNode body) {

    public Frame {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("frame type cannot be blank");
        }
        if (body == null) {
            body = NullNode.getInstance();
        }
    }

    public static Frame of(String type, String ref, Object body) {
        return new Frame(type, ref, Frames.MAPPER.valueToTree(body));
    }

    public static Frame of(String type, Object body) {
        return of(type, null, body);
    }

    /**
     * Converts the body into the given value type.
     *
     * @throws WireException if the body does not match the type
     */
    public <T> T bodyAs(Class<T> valueType) {
        try {
            return Frames.MAPPER.treeToValue(body, valueType);
        } catch (JsonProcessingException e) {
            throw new WireException("Malformed " + type + " frame: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Returns a text field of the body, or {@code null} when absent.
     */
    public String text(String field) {
        JsonNode node = body.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
