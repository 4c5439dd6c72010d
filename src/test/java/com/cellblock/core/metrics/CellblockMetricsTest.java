package com.cellblock.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellblockMetricsTest {

    private SimpleMeterRegistry registry;
    private CellblockMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CellblockMetrics(registry);
    }

    @Test
    @DisplayName("recordHandshake records a timer per outcome")
    void recordHandshake() {
        metrics.recordHandshake("connected", 800);
        metrics.recordHandshake("timeout", 30_000);
        metrics.recordHandshake("connected", 650);

        var connected = registry.find("cellblock.handshake.duration").tag("outcome", "connected").timer();
        var timeout = registry.find("cellblock.handshake.duration").tag("outcome", "timeout").timer();

        assertNotNull(connected);
        assertNotNull(timeout);
        assertEquals(2, connected.count());
        assertEquals(1, timeout.count());
    }

    @Test
    @DisplayName("runtime lifecycle counters are tagged by kind")
    void runtimeCounters() {
        metrics.recordRuntimeStarted("standalone");
        metrics.recordRuntimeStarted("embedded");
        metrics.recordRuntimeDown("standalone");

        assertEquals(1.0, registry.find("cellblock.runtimes.started").tag("kind", "standalone").counter().count());
        assertEquals(1.0, registry.find("cellblock.runtimes.started").tag("kind", "embedded").counter().count());
        assertEquals(1.0, registry.find("cellblock.runtimes.down").tag("kind", "standalone").counter().count());
    }

    @Test
    @DisplayName("recordEvaluation splits success and error")
    void recordEvaluation() {
        metrics.recordEvaluation(false, 12);
        metrics.recordEvaluation(true, 3);
        metrics.recordEvaluation(false, 5);

        assertEquals(2, registry.find("cellblock.evaluation.duration").tag("result", "success").timer().count());
        assertEquals(1, registry.find("cellblock.evaluation.duration").tag("result", "error").timer().count());
    }

    @Test
    @DisplayName("container and bootstrap counters increment")
    void counters() {
        metrics.incrementContainerDown();
        metrics.incrementContainerDown();
        metrics.recordBootstrap(true);
        metrics.recordBootstrap(false);

        assertEquals(2.0, registry.find("cellblock.containers.down").counter().count());
        assertEquals(1.0, registry.find("cellblock.bootstrap.total").tag("code_loaded", "true").counter().count());
        assertEquals(1.0, registry.find("cellblock.bootstrap.total").tag("code_loaded", "false").counter().count());
    }
}
