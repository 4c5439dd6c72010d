package com.cellblock.runtime;

import com.cellblock.core.logging.MdcContext;
import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.wire.NodeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Initiating side of the runtime handshake.
 *
 * <p>Registers a mailbox for the identity, spawns the runtime and waits on four sources at once:
 * the ready announcement routed by the {@link NodeEndpoint}, lines of process output, process
 * termination and the deadline. Once the runtime is ready it is bootstrapped and then
 * acknowledged. A failed attempt destroys the process and is never retried here.
 */
public class ParentHandshake {

    private static final Logger log = LoggerFactory.getLogger(ParentHandshake.class);

    /**
     * A connected, bootstrapped runtime.
     *
     * @param controlAddress address of the runtime's control endpoint
     */
    public record Outcome(RuntimeIdentity identity, RuntimeProcess process, NodeAddress controlAddress,
                          BootstrapResult bootstrap) {}

    private final NodeEndpoint endpoint;
    private final ProcessLauncher launcher;
    private final RuntimeBootstrap bootstrap;
    private final NodeConnector connector;
    private final CellblockMetrics metrics;
    private final long timeoutMillis;

    public ParentHandshake(NodeEndpoint endpoint, ProcessLauncher launcher, RuntimeBootstrap bootstrap,
                           NodeConnector connector, CellblockMetrics metrics, long timeoutMillis) {
        this.endpoint = endpoint;
        this.launcher = launcher;
        this.bootstrap = bootstrap;
        this.connector = connector;
        this.metrics = metrics;
        this.timeoutMillis = timeoutMillis;
    }

    public Outcome connect(RuntimeIdentity identity, Map<String, Object> managerOptions,
                           Map<String, Object> serverOptions) {
        return connect(identity, managerOptions, serverOptions, process -> { });
    }

    /**
     * @param onSpawned receives the process as soon as it is started, whatever the outcome of the
     *                  handshake; the caller uses it to observe the process exit
     * @throws SpawnException     when the process cannot be started
     * @throws HandshakeException when the process exits or stays silent past the deadline
     * @throws BootstrapException when the ready runtime cannot be bootstrapped
     */
    public Outcome connect(RuntimeIdentity identity, Map<String, Object> managerOptions,
                           Map<String, Object> serverOptions, Consumer<RuntimeProcess> onSpawned) {
        long started = System.nanoTime();
        launcher.checkLaunchable();
        HandshakeMailbox mailbox = endpoint.register(identity.name());
        RuntimeProcess process;
        try {
            process = launcher.launch(identity, endpoint.address());
        } catch (RuntimeException e) {
            mailbox.close();
            throw e;
        }
        log.info("Spawned runtime {} (pid {})", identity, process.pid());
        onSpawned.accept(process);
        drainOutput(identity, process, mailbox);
        process.onExit().thenAccept(status -> mailbox.offer(new HandshakeSignal.Terminated(status)));

        try {
            Outcome outcome = awaitReady(identity, process, mailbox, managerOptions, serverOptions);
            metrics.recordHandshake("connected", elapsedMillis(started));
            return outcome;
        } catch (HandshakeException e) {
            metrics.recordHandshake(e.reason() == HandshakeException.Reason.TIMEOUT ? "timeout" : "terminated",
                    elapsedMillis(started));
            process.destroy();
            throw e;
        } catch (RuntimeException e) {
            metrics.recordHandshake("bootstrap_failed", elapsedMillis(started));
            process.destroy();
            throw e;
        } finally {
            mailbox.close();
        }
    }

    private Outcome awaitReady(RuntimeIdentity identity, RuntimeProcess process, HandshakeMailbox mailbox,
                               Map<String, Object> managerOptions, Map<String, Object> serverOptions) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        while (true) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            HandshakeSignal signal;
            try {
                signal = remaining > 0 ? mailbox.poll(remaining) : null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while connecting to " + identity, e);
            }
            if (signal == null) {
                log.warn("Runtime {} did not announce itself within {}ms", identity, timeoutMillis);
                throw new HandshakeException(HandshakeException.Reason.TIMEOUT);
            }
            if (signal instanceof HandshakeSignal.Ready ready) {
                // termination is observed by the caller from here on
                mailbox.close();
                return complete(identity, process, ready, managerOptions, serverOptions);
            }
            if (signal instanceof HandshakeSignal.Output output) {
                log.info("[{}] {}", identity, output.line());
            } else if (signal instanceof HandshakeSignal.Terminated terminated) {
                log.warn("Runtime {} exited with status {} before announcing itself", identity, terminated.exitStatus());
                throw new HandshakeException(HandshakeException.Reason.PROCESS_TERMINATED);
            }
        }
    }

    private Outcome complete(RuntimeIdentity identity, RuntimeProcess process, HandshakeSignal.Ready ready,
                             Map<String, Object> managerOptions, Map<String, Object> serverOptions) {
        log.debug("Runtime {} ready at {} (ref {})", identity, ready.address(), ready.ref());
        BootstrapResult result;
        try (NodeControl node = connector.connect(ready.address())) {
            result = bootstrap.bootstrap(node, managerOptions, serverOptions);
        } catch (IOException e) {
            ready.reject();
            throw new BootstrapException("cannot reach the remote runtime at " + ready.address() + ": "
                    + e.getMessage(), false, e);
        } catch (RuntimeException e) {
            ready.reject();
            throw e;
        }
        try {
            ready.acknowledge();
        } catch (IOException e) {
            throw new HandshakeException(HandshakeException.Reason.PROCESS_TERMINATED);
        }
        return new Outcome(identity, process, ready.address(), result);
    }

    private void drainOutput(RuntimeIdentity identity, RuntimeProcess process, HandshakeMailbox mailbox) {
        var drain = new Thread(() -> {
            MdcContext.setRuntime(identity.name());
            try (var reader = new BufferedReader(new InputStreamReader(process.output(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (!mailbox.offer(new HandshakeSignal.Output(line))) {
                        log.info("[{}] {}", identity, line);
                    }
                }
            } catch (IOException e) {
                log.debug("Output of runtime {} closed: {}", identity, e.getMessage());
            } finally {
                MdcContext.clear();
            }
        }, identity.name() + "-output");
        drain.setDaemon(true);
        drain.start();
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
