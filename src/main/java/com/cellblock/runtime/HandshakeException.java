package com.cellblock.runtime;

/**
 * A spawned runtime did not complete the handshake. The attempt is over; retrying means
 * spawning again under a new identity.
 */
public class HandshakeException extends RuntimeException {

    public enum Reason { PROCESS_TERMINATED, TIMEOUT }

    public static final String TERMINATED_MESSAGE = "process terminated unexpectedly, please check the log for errors";
    public static final String TIMEOUT_MESSAGE = "connection timed out";

    private final Reason reason;

    public HandshakeException(Reason reason) {
        super(reason == Reason.TIMEOUT ? TIMEOUT_MESSAGE : TERMINATED_MESSAGE);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
