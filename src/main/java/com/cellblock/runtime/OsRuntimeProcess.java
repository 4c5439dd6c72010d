package com.cellblock.runtime;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * {@link RuntimeProcess} backed by a {@link Process}.
 */
public class OsRuntimeProcess implements RuntimeProcess {

    private final Process process;
    private final CompletableFuture<Integer> exit;

    public OsRuntimeProcess(Process process) {
        this.process = process;
        this.exit = process.onExit().thenApply(Process::exitValue);
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public InputStream output() {
        return process.getInputStream();
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void destroy() {
        process.destroyForcibly();
    }
}
