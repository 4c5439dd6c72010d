package com.cellblock.runtime;

import com.cellblock.core.events.EventBus;
import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs code inside the coordinator JVM through an in-process {@link Node}. Evaluations still go
 * through a connection server over loopback, so the contract is the same as for the other kinds.
 * Disconnecting stops the management process and unloads the required code from the node.
 */
public class EmbeddedRuntime implements CellRuntime {

    public static final String TYPE = "embedded";

    private static final Logger log = LoggerFactory.getLogger(EmbeddedRuntime.class);

    private final Node node;
    private final IdentifierPool pool;
    private final RuntimeBootstrap bootstrap;
    private final EventBus events;
    private final CellblockMetrics metrics;
    private final RuntimeProperties properties;

    public EmbeddedRuntime(Node node, IdentifierPool pool, RuntimeBootstrap bootstrap, EventBus events,
                           CellblockMetrics metrics, RuntimeProperties properties) {
        this.node = node;
        this.pool = pool;
        this.bootstrap = bootstrap;
        this.events = events;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public RuntimeConnection connect() {
        RuntimeIdentity identity = pool.external(node.name());
        BootstrapResult result;
        try (var control = new LocalNodeControl(node)) {
            result = bootstrap.bootstrap(control, properties.managerOptions(true), properties.serverOptions());
        }
        RuntimeConnection connection;
        try {
            connection = RuntimeConnection.open(TYPE, identity, result, events, metrics,
                    properties.getCallTimeoutMillis());
        } catch (RuntimeDownException e) {
            bootstrap.unloadRequiredCode(node);
            throw e;
        }
        connection.onDisconnect(() -> {
            log.debug("Unloading required code from embedded node {}", node.name());
            bootstrap.unloadRequiredCode(node);
            pool.notifyDisconnected(identity);
        });
        return connection;
    }

    public Node node() {
        return node;
    }

    @Override
    public Map<String, String> describe() {
        var description = new LinkedHashMap<String, String>();
        description.put("type", TYPE);
        description.put("name", node.name());
        return description;
    }

    @Override
    public CellRuntime duplicate() {
        return new EmbeddedRuntime(new Node(node.name()), pool, bootstrap, events, metrics, properties);
    }
}
