package com.cellblock.runtime;

/**
 * Required code could not be loaded into a runtime. Never retried: the runtime may be
 * partially loaded and is not safe to use.
 */
public class BootstrapException extends RuntimeException {

    private final boolean versionMismatch;

    public BootstrapException(String message, boolean versionMismatch, Throwable cause) {
        super(message, cause);
        this.versionMismatch = versionMismatch;
    }

    public boolean isVersionMismatch() {
        return versionMismatch;
    }
}
