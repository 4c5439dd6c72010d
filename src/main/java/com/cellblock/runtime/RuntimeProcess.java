package com.cellblock.runtime;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * The OS process behind a spawned runtime.
 */
public interface RuntimeProcess {

    long pid();

    /**
     * Combined stdout and stderr of the process.
     */
    InputStream output();

    /**
     * Completes with the exit status once the process has terminated.
     */
    CompletableFuture<Integer> onExit();

    boolean isAlive();

    void destroy();
}
