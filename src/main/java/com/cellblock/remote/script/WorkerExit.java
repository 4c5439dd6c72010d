package com.cellblock.remote.script;

/**
 * Abnormal termination of the worker running the code, raised by {@code exit(reason)} or when
 * the worker is interrupted. Not an evaluation error: it ends the worker.
 */
public class WorkerExit extends Error {

    public WorkerExit(String reason) {
        super(reason);
    }

    public WorkerExit(String reason, Throwable cause) {
        super(reason, cause);
    }
}
