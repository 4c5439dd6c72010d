package com.cellblock.runtime;

import com.cellblock.core.events.EventBus;
import com.cellblock.core.metrics.CellblockMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A runtime in a JVM of its own, spawned for this connection and named from the
 * {@link IdentifierPool}. It exits once its connection server stops, and its name goes back
 * to the pool when the process is gone.
 */
public class StandaloneRuntime implements CellRuntime {

    public static final String TYPE = "standalone";

    private static final Logger log = LoggerFactory.getLogger(StandaloneRuntime.class);

    private final IdentifierPool pool;
    private final ParentHandshake handshake;
    private final EventBus events;
    private final CellblockMetrics metrics;
    private final RuntimeProperties properties;
    private volatile RuntimeIdentity lastIdentity;

    public StandaloneRuntime(IdentifierPool pool, ParentHandshake handshake, EventBus events,
                             CellblockMetrics metrics, RuntimeProperties properties) {
        this.pool = pool;
        this.handshake = handshake;
        this.events = events;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public RuntimeConnection connect() {
        return connect(pool.acquire(properties.getBaseLabel()));
    }

    /**
     * Spawns the runtime under a given identity. The identity goes back to the pool once the
     * process is seen to exit, also when the handshake fails; only a process that was never
     * started releases it at once.
     */
    public RuntimeConnection connect(RuntimeIdentity identity) {
        lastIdentity = identity;
        var spawned = new AtomicBoolean(false);
        ParentHandshake.Outcome outcome;
        try {
            outcome = handshake.connect(identity, properties.managerOptions(true), properties.serverOptions(),
                    process -> {
                        spawned.set(true);
                        process.onExit().thenAccept(status -> {
                            log.info("Runtime {} exited with status {}", identity, status);
                            pool.notifyDisconnected(identity);
                        });
                    });
        } catch (RuntimeException e) {
            if (!spawned.get()) {
                pool.notifyDisconnected(identity);
            }
            throw e;
        }
        try {
            return RuntimeConnection.open(TYPE, identity, outcome.bootstrap(), events, metrics,
                    properties.getCallTimeoutMillis());
        } catch (RuntimeDownException e) {
            outcome.process().destroy();
            throw e;
        }
    }

    @Override
    public Map<String, String> describe() {
        var description = new LinkedHashMap<String, String>();
        description.put("type", TYPE);
        RuntimeIdentity identity = lastIdentity;
        description.put("name", identity == null ? "(not connected)" : identity.name());
        description.put("java", properties.getJavaExecutable());
        return description;
    }

    @Override
    public CellRuntime duplicate() {
        return new StandaloneRuntime(pool, handshake, events, metrics, properties);
    }
}
