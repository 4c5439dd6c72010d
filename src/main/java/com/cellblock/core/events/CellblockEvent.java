package com.cellblock.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by a runtime connection, delivered to the connection's owner.
 *
 * @param eventType    e.g. "runtime.connected", "evaluation.completed", "container.down", "runtime.down"
 * @param runtimeId    identity of the runtime the event belongs to
 * @param containerRef the container this event relates to (nullable for runtime-level events)
 * @param payload      arbitrary key-value data associated with the event
 * @param timestamp    when the event occurred
 */
public record CellblockEvent(
    String eventType,
    String runtimeId,
    String containerRef,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUNTIME_CONNECTED = "runtime.connected";
    public static final String RUNTIME_DISCONNECTED = "runtime.disconnected";
    public static final String RUNTIME_DOWN = "runtime.down";
    public static final String EVALUATION_COMPLETED = "evaluation.completed";
    public static final String CONTAINER_DOWN = "container.down";

    public static CellblockEvent of(String eventType, String runtimeId, String containerRef, Map<String, Object> payload) {
        return new CellblockEvent(eventType, runtimeId, containerRef, payload, Instant.now());
    }
}
