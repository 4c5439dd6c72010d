package com.cellblock.wire;

/**
 * Raised when a frame cannot be encoded, decoded or delivered.
 */
public class WireException extends RuntimeException {

    public WireException(String message) {
        super(message);
    }

    public WireException(String message, Throwable cause) {
        super(message, cause);
    }
}
