package com.cellblock.runtime;

import com.cellblock.node.BootScript;
import com.cellblock.node.RuntimeNode;
import com.cellblock.wire.NodeAddress;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs {@link RuntimeNode} on a thread of the test JVM instead of spawning a child process.
 */
class InProcessLauncher implements ProcessLauncher {

    private final long ackTimeoutMillis;
    volatile FakeProcess last;

    InProcessLauncher(long ackTimeoutMillis) {
        this.ackTimeoutMillis = ackTimeoutMillis;
    }

    @Override
    public RuntimeProcess launch(RuntimeIdentity identity, NodeAddress coordinator) {
        var process = new FakeProcess("runtime started\n");
        var thread = new Thread(() -> {
            int status = new CommandLine(new RuntimeNode()).execute(
                    "--name", identity.name(),
                    "--eval", BootScript.standard(ackTimeoutMillis),
                    "--", coordinator.toString());
            process.exit(status);
        }, identity.name() + "-main");
        thread.setDaemon(true);
        thread.start();
        last = process;
        return process;
    }

    /**
     * Process stand-in whose exit is driven by the test.
     */
    static class FakeProcess implements RuntimeProcess {

        private final CompletableFuture<Integer> exit = new CompletableFuture<>();
        private final InputStream output;
        final AtomicBoolean destroyed = new AtomicBoolean();

        FakeProcess(String output) {
            this.output = new ByteArrayInputStream(output.getBytes());
        }

        void exit(int status) {
            exit.complete(status);
        }

        @Override
        public long pid() {
            return 4242;
        }

        @Override
        public InputStream output() {
            return output;
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public boolean isAlive() {
            return !exit.isDone();
        }

        @Override
        public void destroy() {
            destroyed.set(true);
        }
    }
}
