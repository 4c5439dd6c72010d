package com.cellblock.wire;

/**
 * The remote side answered a request with an error reply.
 */
public class RemoteCallException extends RuntimeException {

    private final String request;

    public RemoteCallException(String request, String message) {
        super(message);
        this.request = request;
    }

    /** The type of the request that failed. */
    public String request() {
        return request;
    }
}
