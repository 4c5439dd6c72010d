package com.cellblock.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for runtime lifecycles and evaluations.
 */
@Service
public class CellblockMetrics {

    private final MeterRegistry registry;

    public CellblockMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "connected", "terminated", "timeout" or "bootstrap_failed"
     */
    public void recordHandshake(String outcome, long ms) {
        Timer.builder("cellblock.handshake.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRuntimeStarted(String kind) {
        Counter.builder("cellblock.runtimes.started")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordRuntimeDown(String kind) {
        Counter.builder("cellblock.runtimes.down")
                .description("Runtimes that became unreachable while connected")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordEvaluation(boolean error, long ms) {
        Timer.builder("cellblock.evaluation.duration")
                .tag("result", error ? "error" : "success")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementContainerDown() {
        Counter.builder("cellblock.containers.down")
                .description("Evaluators that terminated abnormally")
                .register(registry)
                .increment();
    }

    public void recordBootstrap(boolean codeLoaded) {
        Counter.builder("cellblock.bootstrap.total")
                .tag("code_loaded", String.valueOf(codeLoaded))
                .register(registry)
                .increment();
    }
}
