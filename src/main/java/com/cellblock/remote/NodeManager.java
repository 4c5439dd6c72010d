package com.cellblock.remote;

import com.cellblock.node.ManagementProcess;
import com.cellblock.node.Node;
import com.cellblock.wire.ServerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The management process of a runtime. Starts a {@link RuntimeServer} per coordinator connection
 * and, with {@code auto_termination}, terminates once the last of them has stopped. Since a spawned
 * runtime lives exactly as long as its manager, that ends the runtime too.
 *
 * <p>All state changes run on the manager's own thread, fed through a mailbox.
 */
public class NodeManager implements ManagementProcess {

    private static final Logger log = LoggerFactory.getLogger(NodeManager.class);

    public static final String AUTO_TERMINATION = "auto_termination";
    public static final String BIND_HOST = "bind_host";

    private final Node node;
    private final String id = "manager-" + UUID.randomUUID().toString().substring(0, 8);
    private final BlockingQueue<Runnable> mailbox = new LinkedBlockingQueue<>();
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicLong serverCounter = new AtomicLong();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile boolean running;
    private volatile boolean autoTermination;
    private volatile String bindHost = "127.0.0.1";

    private record Connection(RuntimeServer server, RuntimeServerEndpoint endpoint) {}

    public NodeManager(Node node) {
        this.node = node;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized void start(Map<String, Object> options) {
        if (running) {
            throw new IllegalStateException(id + " already started");
        }
        autoTermination = Boolean.TRUE.equals(options.get(AUTO_TERMINATION));
        if (options.get(BIND_HOST) instanceof String host && !host.isBlank()) {
            bindHost = host;
        }
        running = true;
        var thread = new Thread(this::loop, "cellblock-node-manager");
        thread.setDaemon(true);
        thread.start();
        log.debug("{} started on {} (auto_termination={})", id, node.name(), autoTermination);
    }

    @Override
    public ServerHandle startConnectionServer(Map<String, Object> options) {
        if (!running) {
            throw new IllegalStateException(id + " is not running");
        }
        String serverId = node.name() + "-server-" + serverCounter.incrementAndGet();
        var server = new RuntimeServer(serverId, options);
        RuntimeServerEndpoint endpoint;
        try {
            endpoint = RuntimeServerEndpoint.start(server, bindHost);
        } catch (IOException e) {
            throw new IllegalStateException("cannot start connection server: " + e.getMessage(), e);
        }
        connections.put(serverId, new Connection(server, endpoint));
        server.onStopped(stopped -> mailbox.add(() -> serverStopped(stopped.id())));
        server.start();
        log.info("Started connection server {} on {}", serverId, endpoint.address());
        return new ServerHandle(serverId, endpoint.address());
    }

    public List<String> serverIds() {
        return List.copyOf(connections.keySet());
    }

    @Override
    public boolean isAlive() {
        return running;
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    @Override
    public void stop() {
        mailbox.add(this::terminate);
    }

    private void loop() {
        try {
            while (running) {
                mailbox.take().run();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate();
        }
    }

    private void serverStopped(String serverId) {
        Connection connection = connections.remove(serverId);
        if (connection != null) {
            connection.endpoint().close();
            log.debug("Connection server {} stopped", serverId);
        }
        if (autoTermination && connections.isEmpty() && running) {
            log.info("Last connection server stopped, terminating {}", id);
            terminate();
        }
    }

    private void terminate() {
        if (!running) {
            return;
        }
        running = false;
        for (Connection connection : List.copyOf(connections.values())) {
            connection.server().stop();
            connection.endpoint().close();
        }
        connections.clear();
        log.info("{} on {} terminated", id, node.name());
        terminated.countDown();
    }
}
