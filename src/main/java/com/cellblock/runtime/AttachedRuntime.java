package com.cellblock.runtime;

import com.cellblock.core.events.EventBus;
import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.wire.NodeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A runtime somebody else started, typically with a {@code serve} boot script, reached at its
 * control address. Bootstrapping is repeated on every connect and skips whatever is already in
 * place. Disconnecting stops only this connection's server; the runtime keeps running.
 */
public class AttachedRuntime implements CellRuntime {

    public static final String TYPE = "attached";

    private static final Logger log = LoggerFactory.getLogger(AttachedRuntime.class);

    private final NodeAddress address;
    private final String name;
    private final IdentifierPool pool;
    private final RuntimeBootstrap bootstrap;
    private final NodeConnector connector;
    private final EventBus events;
    private final CellblockMetrics metrics;
    private final RuntimeProperties properties;

    public AttachedRuntime(NodeAddress address, String name, IdentifierPool pool, RuntimeBootstrap bootstrap,
                           NodeConnector connector, EventBus events, CellblockMetrics metrics,
                           RuntimeProperties properties) {
        this.address = address;
        this.name = name;
        this.pool = pool;
        this.bootstrap = bootstrap;
        this.connector = connector;
        this.events = events;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public RuntimeConnection connect() {
        RuntimeIdentity identity = pool.external(name);
        BootstrapResult result;
        try (NodeControl node = connector.connect(address)) {
            result = bootstrap.bootstrap(node, properties.managerOptions(false), properties.serverOptions());
        } catch (IOException e) {
            throw new RuntimeDownException("cannot reach runtime " + name + " at " + address + ": " + e.getMessage(), e);
        }
        RuntimeConnection connection = RuntimeConnection.open(TYPE, identity, result, events, metrics,
                properties.getCallTimeoutMillis());
        connection.onDisconnect(() -> {
            log.debug("Detached from runtime {} at {}", name, address);
            pool.notifyDisconnected(identity);
        });
        return connection;
    }

    public NodeAddress address() {
        return address;
    }

    @Override
    public Map<String, String> describe() {
        var description = new LinkedHashMap<String, String>();
        description.put("type", TYPE);
        description.put("name", name);
        description.put("address", address.toString());
        return description;
    }

    @Override
    public CellRuntime duplicate() {
        return new AttachedRuntime(address, name, pool, bootstrap, connector, events, metrics, properties);
    }
}
