package com.cellblock.runtime;

import com.cellblock.core.events.CellblockEvent;
import com.cellblock.core.events.EventBus;
import com.cellblock.core.logging.MdcContext;
import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.wire.EvaluationRequest;
import com.cellblock.wire.EvaluationResponse;
import com.cellblock.wire.Frame;
import com.cellblock.wire.Frames;
import com.cellblock.wire.IntellisenseRequest;
import com.cellblock.wire.IntellisenseResponse;
import com.cellblock.wire.Locator;
import com.cellblock.wire.RemoteCallException;
import com.cellblock.wire.RpcClient;
import com.cellblock.wire.ServerHandle;
import com.cellblock.wire.ServerMessages;
import com.cellblock.wire.WireException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * The coordinator's handle on one connection server of a runtime.
 *
 * <p>Owns the attach channel: when it closes without {@link #disconnect()} the runtime is
 * treated as down, every pending evaluation fails with {@link RuntimeDownException} and a
 * {@code runtime.down} event is published. Notifications are published on the {@link EventBus}
 * under the runtime identity; {@link #takeOwnership(Consumer)} subscribes to them.
 */
public class RuntimeConnection {

    private static final Logger log = LoggerFactory.getLogger(RuntimeConnection.class);

    private final String kind;
    private final RuntimeIdentity identity;
    private final BootstrapResult bootstrap;
    private final RpcClient rpc;
    private final EventBus events;
    private final CellblockMetrics metrics;
    private final long callTimeoutMillis;

    private final Map<Locator, CompletableFuture<EvaluationResponse>> pending = new ConcurrentHashMap<>();
    private final List<Runnable> disconnectListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean disconnecting = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private RuntimeConnection(String kind, RuntimeIdentity identity, BootstrapResult bootstrap, RpcClient rpc,
                              EventBus events, CellblockMetrics metrics, long callTimeoutMillis) {
        this.kind = kind;
        this.identity = identity;
        this.bootstrap = bootstrap;
        this.rpc = rpc;
        this.events = events;
        this.metrics = metrics;
        this.callTimeoutMillis = callTimeoutMillis;
    }

    /**
     * Connects to the server started by {@code bootstrap} and attaches as its owner.
     *
     * @throws RuntimeDownException when the server cannot be reached or refuses the owner
     */
    public static RuntimeConnection open(String kind, RuntimeIdentity identity, BootstrapResult bootstrap,
                                         EventBus events, CellblockMetrics metrics, long callTimeoutMillis) {
        ServerHandle server = bootstrap.server();
        RpcClient rpc;
        try {
            rpc = RpcClient.connect(server.address(), identity.name() + "-connection",
                    (int) Math.min(callTimeoutMillis, Integer.MAX_VALUE));
        } catch (IOException e) {
            throw new RuntimeDownException("cannot reach " + server.serverId() + " at " + server.address(), e);
        }
        var connection = new RuntimeConnection(kind, identity, bootstrap, rpc, events, metrics, callTimeoutMillis);
        rpc.onEvent(connection::onFrame);
        rpc.onClose(connection::onChannelClosed);
        try {
            rpc.callSync(ServerMessages.ATTACH, Map.of(), String.class, callTimeoutMillis);
        } catch (RemoteCallException | WireException e) {
            connection.disconnecting.set(true);
            rpc.close();
            throw new RuntimeDownException("cannot attach to " + server.serverId() + ": " + e.getMessage(), e);
        }
        metrics.recordRuntimeStarted(kind);
        events.publish(CellblockEvent.of(CellblockEvent.RUNTIME_CONNECTED, identity.name(), null,
                Map.of("kind", kind, "server", server.serverId(), "manager", String.valueOf(bootstrap.managerId()))));
        log.info("Connected to {} runtime {} through {}", kind, identity, server.serverId());
        return connection;
    }

    public String kind() {
        return kind;
    }

    public RuntimeIdentity identity() {
        return identity;
    }

    public String managerId() {
        return bootstrap.managerId();
    }

    public ServerHandle server() {
        return bootstrap.server();
    }

    public boolean isConnected() {
        return rpc.isOpen();
    }

    /**
     * Routes every notification of this connection to {@code listener}.
     */
    public EventBus.Subscription takeOwnership(Consumer<CellblockEvent> listener) {
        return events.subscribe(identity.name(), listener);
    }

    /**
     * Runs once after the connection ended, whichever side ended it.
     */
    public void onDisconnect(Runnable listener) {
        disconnectListeners.add(listener);
        if (closed.get() && disconnectListeners.remove(listener)) {
            listener.run();
        }
    }

    public CompletableFuture<EvaluationResponse> evaluate(String container, String evaluation, String code) {
        return evaluate(new EvaluationRequest(container, evaluation, code, List.of(), Map.of()));
    }

    public CompletableFuture<EvaluationResponse> evaluate(String container, String evaluation, String code,
                                                          List<Locator> parentLocators) {
        return evaluate(new EvaluationRequest(container, evaluation, code, parentLocators, Map.of()));
    }

    /**
     * Submits an evaluation. The future completes with the response, or exceptionally with
     * {@link ContainerDownException} when the container's evaluator dies first and with
     * {@link RuntimeDownException} when the runtime goes away.
     */
    public CompletableFuture<EvaluationResponse> evaluate(EvaluationRequest request) {
        Locator locator = request.locator();
        var future = new CompletableFuture<EvaluationResponse>();
        if (!rpc.isOpen()) {
            future.completeExceptionally(new RuntimeDownException("runtime " + identity + " is not connected"));
            return future;
        }
        if (pending.putIfAbsent(locator, future) != null) {
            throw new IllegalArgumentException("evaluation " + locator + " is already pending");
        }
        rpc.call(ServerMessages.EVALUATE, request).whenComplete((accepted, error) -> {
            if (error != null) {
                pending.remove(locator, future);
                future.completeExceptionally(translate(unwrap(error)));
            }
        });
        return future;
    }

    public void forget(Locator locator) {
        rpc.callSync(ServerMessages.FORGET, locator, Boolean.class, callTimeoutMillis);
    }

    /**
     * Terminates the container's evaluator without a crash report. Its pending evaluations fail.
     */
    public void dropContainer(String container) {
        rpc.callSync(ServerMessages.DROP_CONTAINER, Map.of("container", container), Boolean.class, callTimeoutMillis);
        failContainer(container, new ContainerDownException(container, "container dropped"));
    }

    public CompletableFuture<IntellisenseResponse> intellisense(IntellisenseRequest request) {
        return rpc.call(ServerMessages.INTELLISENSE, request).thenApply(value -> {
            try {
                return Frames.MAPPER.treeToValue(value, IntellisenseResponse.class);
            } catch (JsonProcessingException e) {
                throw new CompletionException(new WireException("Malformed intellisense reply: " + e.getOriginalMessage(), e));
            }
        });
    }

    /**
     * Reads a file on the runtime's host.
     */
    public byte[] readFile(String path) throws IOException {
        try {
            return rpc.callSync(ServerMessages.READ_FILE, Map.of("path", path), byte[].class, callTimeoutMillis);
        } catch (RemoteCallException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    /**
     * Stops the connection server and closes the channel. Pending evaluations fail; no
     * {@code runtime.down} event is published.
     */
    public void disconnect() {
        if (!disconnecting.compareAndSet(false, true)) {
            return;
        }
        if (rpc.isOpen()) {
            try {
                rpc.callSync(ServerMessages.STOP, Map.of(), Boolean.class, callTimeoutMillis);
            } catch (RemoteCallException | WireException e) {
                log.debug("Stop request to {} failed: {}", server().serverId(), e.getMessage());
            }
        }
        rpc.close();
    }

    private void onFrame(Frame frame) {
        switch (frame.type()) {
            case ServerMessages.EVALUATION_RESPONSE -> onEvaluationResponse(frame.bodyAs(EvaluationResponse.class));
            case ServerMessages.CONTAINER_DOWN -> onContainerDown(frame.text("container"), frame.text("message"),
                    evaluations(frame));
            case ServerMessages.SERVER_STOPPED -> log.info("Connection server {} of {} stopped", frame.text("server"), identity);
            default -> log.warn("Unexpected {} frame from {}", frame.type(), identity);
        }
    }

    private void onEvaluationResponse(EvaluationResponse response) {
        Locator locator = response.locator();
        MdcContext.setRuntime(identity.name());
        MdcContext.setEvaluation(locator.container(), locator.evaluation());
        try {
            metrics.recordEvaluation(response.failed(), response.evaluationTimeMs());
            var future = pending.remove(locator);
            if (future == null) {
                log.debug("Response for unknown evaluation {}", locator);
            } else {
                future.complete(response);
            }
            var payload = new HashMap<String, Object>();
            payload.put("evaluation", locator.evaluation());
            payload.put("output", response.output());
            payload.put("error", response.error());
            payload.put("evaluationTimeMs", response.evaluationTimeMs());
            events.publish(CellblockEvent.of(CellblockEvent.EVALUATION_COMPLETED, identity.name(),
                    locator.container(), payload));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Only the evaluations the dead evaluator had accepted fail. Later ones already run on its
     * replacement and are answered from there.
     */
    private void onContainerDown(String container, String message, List<String> evaluations) {
        MdcContext.setContainer(identity.name(), container);
        try {
            log.warn("Container {} is down: {}", container, message);
            metrics.incrementContainerDown();
            var failure = new ContainerDownException(container, message);
            for (String evaluation : evaluations) {
                var future = pending.remove(new Locator(container, evaluation));
                if (future != null) {
                    future.completeExceptionally(failure);
                }
            }
            events.publish(CellblockEvent.of(CellblockEvent.CONTAINER_DOWN, identity.name(), container,
                    Map.of("message", String.valueOf(message), "evaluations", evaluations)));
        } finally {
            MdcContext.clear();
        }
    }

    private static List<String> evaluations(Frame frame) {
        JsonNode refs = frame.body().get("evaluations");
        if (refs == null || !refs.isArray()) {
            return List.of();
        }
        var evaluations = new ArrayList<String>(refs.size());
        refs.forEach(ref -> evaluations.add(ref.asText()));
        return evaluations;
    }

    private void failContainer(String container, RuntimeException failure) {
        pending.entrySet().removeIf(entry -> {
            if (entry.getKey().container().equals(container)) {
                entry.getValue().completeExceptionally(failure);
                return true;
            }
            return false;
        });
    }

    private void onChannelClosed() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean expected = disconnecting.get();
        var failure = new RuntimeDownException(expected
                ? "disconnected from runtime " + identity
                : "runtime " + identity + " is down");
        pending.values().forEach(future -> future.completeExceptionally(failure));
        pending.clear();
        if (expected) {
            log.info("Disconnected from runtime {}", identity);
            events.publish(CellblockEvent.of(CellblockEvent.RUNTIME_DISCONNECTED, identity.name(), null, Map.of("kind", kind)));
        } else {
            log.error("Lost connection to runtime {}", identity);
            metrics.recordRuntimeDown(kind);
            events.publish(CellblockEvent.of(CellblockEvent.RUNTIME_DOWN, identity.name(), null, Map.of("kind", kind)));
        }
        for (Runnable listener : disconnectListeners) {
            if (disconnectListeners.remove(listener)) {
                try {
                    listener.run();
                } catch (RuntimeException e) {
                    log.warn("Disconnect listener of {} failed", identity, e);
                }
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private Throwable translate(Throwable error) {
        if (error instanceof WireException) {
            return new RuntimeDownException("runtime " + identity + " is down", error);
        }
        return error;
    }

    @Override
    public String toString() {
        return kind + " runtime " + identity + " via " + server().serverId();
    }
}
