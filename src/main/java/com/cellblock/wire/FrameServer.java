package com.cellblock.wire;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepts frame connections on an ephemeral port and serves each on its own daemon thread.
 *
 * <p>Used for every listening endpoint in the system: the coordinator's node endpoint,
 * a runtime's control endpoint and per-connection runtime servers.
 */
public class FrameServer implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(FrameServer.class);

    /**
     * Serves one accepted connection. The channel is closed once this returns.
     */
    @FunctionalInterface
    public interface ConnectionHandler {
        void serve(FrameChannel channel) throws IOException;
    }

    private final String name;
    private final ServerSocket serverSocket;
    private final ConnectionHandler handler;
    private final Set<FrameChannel> channels = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong connectionCounter = new AtomicLong();

    private FrameServer(String name, ServerSocket serverSocket, ConnectionHandler handler) {
        this.name = name;
        this.serverSocket = serverSocket;
        this.handler = handler;
    }

    /**
     * Binds to an ephemeral port on {@code bindHost} and starts accepting.
     */
    public static FrameServer start(String name, String bindHost, ConnectionHandler handler) throws IOException {
        var socket = new ServerSocket(0, 50, InetAddress.getByName(bindHost));
        var server = new FrameServer(name, socket, handler);
        var acceptor = new Thread(server::acceptLoop, name + "-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        log.debug("{} listening on {}", name, server.address());
        return server;
    }

    public NodeAddress address() {
        return new NodeAddress(serverSocket.getInetAddress().getHostAddress(), serverSocket.getLocalPort());
    }

    public boolean isOpen() {
        return !closed.get();
    }

    private void acceptLoop() {
        while (!closed.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (!closed.get()) {
                    log.warn("{} stopped accepting: {}", name, e.getMessage());
                }
                return;
            } catch (IOException e) {
                log.warn("{} accept failed: {}", name, e.getMessage());
                continue;
            }
            var thread = new Thread(() -> serve(socket), name + "-conn-" + connectionCounter.incrementAndGet());
            thread.setDaemon(true);
            thread.start();
        }
    }

    private void serve(Socket socket) {
        FrameChannel channel;
        try {
            channel = new FrameChannel(socket);
        } catch (IOException e) {
            log.warn("{} could not open channel: {}", name, e.getMessage());
            return;
        }
        channels.add(channel);
        try {
            handler.serve(channel);
        } catch (IOException e) {
            log.debug("{} connection {} ended: {}", name, channel.remoteAddress(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{} connection {} failed", name, channel.remoteAddress(), e);
        } finally {
            channels.remove(channel);
            channel.close();
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
            channels.forEach(FrameChannel::close);
            channels.clear();
        }
    }
}
