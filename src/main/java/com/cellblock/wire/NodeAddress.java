package com.cellblock.wire;

/**
 * A {@code host:port} endpoint. Used as the address of the coordinator, of runtimes
 * and of per-connection servers.
 */
public record NodeAddress(String host, int port) {

    public NodeAddress {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public static NodeAddress parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("expected host:port, got '" + value + "'");
        }
        try {
            return new NodeAddress(value.substring(0, colon), Integer.parseInt(value.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected host:port, got '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
