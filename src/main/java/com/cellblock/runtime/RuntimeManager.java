package com.cellblock.runtime;

import com.cellblock.core.events.EventBus;
import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.node.Node;
import com.cellblock.wire.NodeAddress;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Creates runtimes of each kind and keeps track of the connections opened through it, so they
 * can be closed together when the coordinator shuts down.
 */
@Service
public class RuntimeManager {

    private static final Logger log = LoggerFactory.getLogger(RuntimeManager.class);

    private final IdentifierPool pool;
    private final ParentHandshake handshake;
    private final RuntimeBootstrap bootstrap;
    private final NodeConnector connector;
    private final EventBus events;
    private final CellblockMetrics metrics;
    private final RuntimeProperties properties;
    private final List<RuntimeConnection> connections = new CopyOnWriteArrayList<>();

    public RuntimeManager(IdentifierPool pool, ParentHandshake handshake, RuntimeBootstrap bootstrap,
                          NodeConnector connector, EventBus events, CellblockMetrics metrics,
                          RuntimeProperties properties) {
        this.pool = pool;
        this.handshake = handshake;
        this.bootstrap = bootstrap;
        this.connector = connector;
        this.events = events;
        this.metrics = metrics;
        this.properties = properties;
    }

    public StandaloneRuntime standalone() {
        return new StandaloneRuntime(pool, handshake, events, metrics, properties);
    }

    public AttachedRuntime attached(NodeAddress address, String name) {
        return new AttachedRuntime(address, name, pool, bootstrap, connector, events, metrics, properties);
    }

    public EmbeddedRuntime embedded() {
        return new EmbeddedRuntime(new Node(properties.getBaseLabel() + "-embedded"), pool, bootstrap, events,
                metrics, properties);
    }

    /**
     * @param type {@code standalone}, {@code embedded} or {@code attached}
     * @param address control address, only used by attached runtimes
     * @param name runtime name, only used by attached runtimes
     */
    public CellRuntime runtime(String type, NodeAddress address, String name) {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case StandaloneRuntime.TYPE -> standalone();
            case EmbeddedRuntime.TYPE -> embedded();
            case AttachedRuntime.TYPE -> {
                if (address == null || name == null || name.isBlank()) {
                    throw new IllegalArgumentException("an attached runtime needs an address and a name");
                }
                yield attached(address, name);
            }
            default -> throw new IllegalArgumentException("unknown runtime type: " + type);
        };
    }

    /**
     * Connects the runtime and tracks the connection until it ends.
     */
    public RuntimeConnection connect(CellRuntime runtime) {
        RuntimeConnection connection = runtime.connect();
        connections.add(connection);
        connection.onDisconnect(() -> connections.remove(connection));
        return connection;
    }

    public List<RuntimeConnection> connections() {
        return List.copyOf(connections);
    }

    @PreDestroy
    public void disconnectAll() {
        for (RuntimeConnection connection : connections) {
            log.info("Disconnecting {}", connection);
            connection.disconnect();
        }
        connections.clear();
    }
}
