package com.cellblock.runtime;

/**
 * The runtime became unreachable. Unlike a container crash this is not recoverable on the
 * same connection.
 */
public class RuntimeDownException extends RuntimeException {

    public RuntimeDownException(String message) {
        super(message);
    }

    public RuntimeDownException(String message, Throwable cause) {
        super(message, cause);
    }
}
