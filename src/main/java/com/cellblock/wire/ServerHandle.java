package com.cellblock.wire;

/**
 * A per-connection runtime server started during bootstrap.
 */
public record ServerHandle(String serverId, NodeAddress address) {
}
