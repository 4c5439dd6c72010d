package com.cellblock.runtime;

import com.cellblock.node.RuntimeNode;
import com.cellblock.wire.Frame;
import com.cellblock.wire.FrameChannel;
import com.cellblock.wire.FrameServer;
import com.cellblock.wire.NodeAddress;
import com.cellblock.wire.WireException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The coordinator's own address. Spawned runtimes connect here to announce readiness; each
 * announcement is routed by identity to the mailbox of the handshake waiting for it.
 */
public class NodeEndpoint implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(NodeEndpoint.class);

    private final FrameServer server;
    private final long releaseTimeoutMillis;
    private final Map<String, HandshakeMailbox> mailboxes = new ConcurrentHashMap<>();

    private NodeEndpoint(String bindHost, long releaseTimeoutMillis) throws IOException {
        this.releaseTimeoutMillis = releaseTimeoutMillis;
        this.server = FrameServer.start("node-endpoint", bindHost, this::serve);
    }

    /**
     * @param releaseTimeoutMillis how long an announcing connection is held open for the acknowledgement
     */
    public static NodeEndpoint start(String bindHost, long releaseTimeoutMillis) throws IOException {
        return new NodeEndpoint(bindHost, releaseTimeoutMillis);
    }

    public NodeAddress address() {
        return server.address();
    }

    public boolean isOpen() {
        return server.isOpen();
    }

    /**
     * Opens the mailbox for a handshake with {@code identity}. Closing it unregisters it.
     *
     * @throws IllegalStateException when a handshake for the identity is already pending
     */
    public HandshakeMailbox register(String identity) {
        var mailbox = new HandshakeMailbox(identity, () -> mailboxes.remove(identity));
        if (mailboxes.putIfAbsent(identity, mailbox) != null) {
            throw new IllegalStateException("handshake with " + identity + " already pending");
        }
        return mailbox;
    }

    public int pendingHandshakes() {
        return mailboxes.size();
    }

    private void serve(FrameChannel channel) throws IOException {
        Frame frame = channel.receive();
        if (frame == null) {
            return;
        }
        if (!RuntimeNode.READY.equals(frame.type())) {
            log.warn("Unexpected {} frame from {}", frame.type(), channel.remoteAddress());
            return;
        }
        String identity = frame.text("identity");
        HandshakeMailbox mailbox = identity == null ? null : mailboxes.get(identity);
        if (mailbox == null) {
            log.warn("Ready signal from unknown runtime {} at {}", identity, channel.remoteAddress());
            return;
        }
        HandshakeSignal.Ready ready;
        try {
            ready = new HandshakeSignal.Ready(frame.ref(), identity, NodeAddress.parse(frame.text("address")),
                    frame.body().path("handle").asLong(-1), channel, new CompletableFuture<>());
        } catch (IllegalArgumentException | WireException e) {
            log.warn("Malformed ready signal from {}: {}", identity, e.getMessage());
            return;
        }
        if (!mailbox.offer(ready)) {
            log.warn("Handshake with {} is no longer pending", identity);
            return;
        }
        try {
            ready.released().get(releaseTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Ready signal from {} was not answered: {}", identity, e.getMessage());
        }
    }

    @Override
    public void close() {
        server.close();
    }
}
