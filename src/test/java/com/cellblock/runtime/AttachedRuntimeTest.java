package com.cellblock.runtime;

import com.cellblock.core.events.EventBus;
import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.node.ControlEndpoint;
import com.cellblock.node.Node;
import com.cellblock.wire.NodeAddress;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Attaches to a node served from the test JVM, as if it had been started by someone else.
 */
class AttachedRuntimeTest {

    private Node node;
    private ControlEndpoint control;
    private IdentifierPool pool;
    private AttachedRuntime runtime;

    @BeforeEach
    void setUp() throws IOException {
        node = new Node("shared");
        control = ControlEndpoint.start(node, "127.0.0.1");
        pool = new IdentifierPool(0);
        var metrics = new CellblockMetrics(new SimpleMeterRegistry());
        runtime = new AttachedRuntime(control.address(), "shared", pool, new RuntimeBootstrap(metrics),
                address -> RemoteNodeControl.connect(address, 5000), new EventBus(), metrics, new RuntimeProperties());
    }

    @AfterEach
    void tearDown() {
        node.stopManager();
        control.close();
        pool.shutdown();
    }

    @Test
    @DisplayName("several coordinators share one manager and outlive each other")
    void sharedManager() throws Exception {
        RuntimeConnection first = runtime.connect();
        RuntimeConnection second = runtime.duplicate().connect();

        assertEquals(first.managerId(), second.managerId());
        assertNotEquals(first.server().serverId(), second.server().serverId());
        assertFalse(first.identity().isSynthesized());
        assertEquals("shared", first.identity().name());

        first.disconnect();

        assertEquals("7", second.evaluate("main", "cell-1", "3 + 4").get(10, TimeUnit.SECONDS).output());
        second.disconnect();
        assertTrue(node.isManagerRunning());
        assertEquals(0, pool.freeCount());
    }

    @Test
    void unreachableRuntime() {
        var nowhere = new AttachedRuntime(new NodeAddress("127.0.0.1", 1), "ghost", pool,
                new RuntimeBootstrap(new CellblockMetrics(new SimpleMeterRegistry())),
                address -> RemoteNodeControl.connect(address, 1000), new EventBus(),
                new CellblockMetrics(new SimpleMeterRegistry()), new RuntimeProperties());

        var e = assertThrows(RuntimeDownException.class, nowhere::connect);
        assertTrue(e.getMessage().startsWith("cannot reach runtime ghost at 127.0.0.1:1"));
    }
}
