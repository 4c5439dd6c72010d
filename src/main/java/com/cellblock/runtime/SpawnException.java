package com.cellblock.runtime;

/**
 * The runtime process could not be started. Raised before any handshake state exists.
 */
public class SpawnException extends RuntimeException {

    public SpawnException(String message) {
        super(message);
    }

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
