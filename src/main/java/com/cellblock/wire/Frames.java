package com.cellblock.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Frame encoding helpers and the shared {@link ObjectMapper}.
 */
public final class Frames {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final String REPLY = "reply";

    private Frames() {}

    public static String encode(Frame frame) {
        try {
            return MAPPER.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new WireException("Cannot encode " + frame.type() + " frame", e);
        }
    }

    public static Frame decode(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            if (node == null || !node.isObject() || !node.hasNonNull("type")) {
                throw new WireException("Not a frame: " + abbreviate(line));
            }
            JsonNode ref = node.get("ref");
            return new Frame(node.get("type").asText(),
                    ref == null || ref.isNull() ? null : ref.asText(),
                    node.get("body"));
        } catch (JsonProcessingException e) {
            throw new WireException("Not a frame: " + abbreviate(line), e);
        }
    }

    /**
     * Successful reply to the request identified by {@code ref}.
     */
    public static Frame reply(String ref, Object value) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("ok", true);
        body.set("value", MAPPER.valueToTree(value));
        return new Frame(REPLY, ref, body);
    }

    /**
     * Failed reply to the request identified by {@code ref}.
     */
    public static Frame error(String ref, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("ok", false);
        body.put("error", message);
        return new Frame(REPLY, ref, body);
    }

    private static String abbreviate(String line) {
        return line.length() > 120 ? line.substring(0, 120) + "..." : line;
    }
}
