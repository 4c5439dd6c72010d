package com.cellblock.wire;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Request/reply client over a {@link FrameChannel}.
 *
 * <p>Every request carries a fresh ref; the matching {@code reply} frame completes its future.
 * Frames that are not replies are handed to the event listener on the reader thread.
 * When the channel ends, pending calls fail and the close listener runs once.
 */
public class RpcClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RpcClient.class);

    private final FrameChannel channel;
    private record PendingCall(String type, CompletableFuture<JsonNode> future) {}

    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Consumer<Frame> eventListener = frame -> log.debug("Unhandled {} frame", frame.type());
    private volatile Runnable closeListener = () -> {};

    public RpcClient(FrameChannel channel, String name) {
        this.channel = channel;
        var reader = new Thread(this::readLoop, name + "-reader");
        reader.setDaemon(true);
        reader.start();
    }

    public static RpcClient connect(NodeAddress address, String name, int connectTimeoutMillis) throws IOException {
        return new RpcClient(FrameChannel.connect(address, connectTimeoutMillis), name);
    }

    public void onEvent(Consumer<Frame> listener) {
        this.eventListener = listener;
    }

    /**
     * Runs when the channel ends, whether closed locally or by the peer.
     */
    public void onClose(Runnable listener) {
        this.closeListener = listener;
        if (closed.get()) {
            listener.run();
        }
    }

    public CompletableFuture<JsonNode> call(String type, Object body) {
        String ref = UUID.randomUUID().toString();
        var future = new CompletableFuture<JsonNode>();
        pending.put(ref, new PendingCall(type, future));
        if (closed.get()) {
            pending.remove(ref);
            future.completeExceptionally(new WireException("connection closed"));
            return future;
        }
        try {
            channel.send(Frame.of(type, ref, body));
        } catch (IOException e) {
            pending.remove(ref);
            future.completeExceptionally(new WireException("cannot send " + type + ": " + e.getMessage(), e));
        }
        return future;
    }

    /**
     * Blocking call that converts the reply value.
     *
     * @throws RemoteCallException when the peer replied with an error
     * @throws WireException       when the connection failed or the call timed out
     */
    public <T> T callSync(String type, Object body, Class<T> valueType, long timeoutMillis) {
        JsonNode value;
        try {
            value = call(type, body).get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WireException("interrupted while waiting for " + type, e);
        } catch (TimeoutException e) {
            throw new WireException(type + " timed out after " + timeoutMillis + "ms", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new WireException(type + " failed", e.getCause());
        }
        if (valueType == Void.class || value == null || value.isNull()) {
            return null;
        }
        try {
            return Frames.MAPPER.treeToValue(value, valueType);
        } catch (IOException e) {
            throw new WireException("Malformed reply to " + type + ": " + e.getMessage(), e);
        }
    }

    /**
     * One-way frame, no reply expected.
     */
    public void send(Frame frame) throws IOException {
        channel.send(frame);
    }

    public boolean isOpen() {
        return !closed.get();
    }

    private void readLoop() {
        try {
            Frame frame;
            while ((frame = channel.receive()) != null) {
                if (Frames.REPLY.equals(frame.type())) {
                    complete(frame);
                } else {
                    dispatch(frame);
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.debug("Connection to {} lost: {}", channel.remoteAddress(), e.getMessage());
            }
        } catch (WireException e) {
            log.warn("Dropping connection to {}: {}", channel.remoteAddress(), e.getMessage());
        } finally {
            shutdown();
        }
    }

    private void complete(Frame reply) {
        var call = reply.ref() == null ? null : pending.remove(reply.ref());
        if (call == null) {
            log.debug("Reply for unknown request {}", reply.ref());
            return;
        }
        JsonNode body = reply.body();
        if (body.path("ok").asBoolean(false)) {
            call.future().complete(body.get("value"));
        } else {
            call.future().completeExceptionally(
                    new RemoteCallException(call.type(), body.path("error").asText("unknown error")));
        }
    }

    private void dispatch(Frame frame) {
        try {
            eventListener.accept(frame);
        } catch (RuntimeException e) {
            log.warn("Event listener failed on {} frame", frame.type(), e);
        }
    }

    private void shutdown() {
        if (closed.compareAndSet(false, true)) {
            channel.close();
            var failure = new WireException("connection closed");
            pending.values().forEach(call -> call.future().completeExceptionally(failure));
            pending.clear();
            try {
                closeListener.run();
            } catch (RuntimeException e) {
                log.warn("Close listener failed", e);
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
