package com.cellblock.core.health;

import com.cellblock.runtime.IdentifierPool;
import com.cellblock.runtime.NodeEndpoint;
import com.cellblock.runtime.RuntimeProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static HealthStatus find(List<HealthStatus> results, String component) {
        return results.stream()
                .filter(s -> component.equals(s.component()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns java, node-endpoint, identifier-pool components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(new RuntimeProperties(), null, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(List.of("java", "node-endpoint", "identifier-pool"),
                results.stream().map(HealthStatus::component).toList());
    }

    @Test
    @DisplayName("Missing endpoint and pool -> DOWN")
    void missingComponentsDown() {
        var service = new HealthCheckService(new RuntimeProperties(), null, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.DOWN, find(results, "node-endpoint").status());
        assertEquals(HealthStatus.Status.DOWN, find(results, "identifier-pool").status());
    }

    @Test
    @DisplayName("Running JVM -> java UP")
    void javaUp() {
        var service = new HealthCheckService(new RuntimeProperties(), null, null);

        HealthStatus java = find(service.checkAll(), "java");
        assertEquals(HealthStatus.Status.UP, java.status());
        assertTrue(java.metadata().get("path").endsWith("java"));
    }

    @Test
    @DisplayName("Unknown java executable -> java DOWN")
    void javaDown() {
        var properties = new RuntimeProperties();
        properties.getRuntime().setJavaExecutable("/no/such/java");
        var service = new HealthCheckService(properties, null, null);

        assertEquals(HealthStatus.Status.DOWN, find(service.checkAll(), "java").status());
    }

    @Test
    @DisplayName("Open endpoint -> node-endpoint UP, closed -> DOWN")
    void nodeEndpoint() throws Exception {
        NodeEndpoint endpoint = NodeEndpoint.start("127.0.0.1", 1000);
        var service = new HealthCheckService(new RuntimeProperties(), endpoint, null);
        try {
            HealthStatus open = find(service.checkAll(), "node-endpoint");
            assertEquals(HealthStatus.Status.UP, open.status());
            assertEquals(endpoint.address().toString(), open.metadata().get("address"));
        } finally {
            endpoint.close();
        }
        assertEquals(HealthStatus.Status.DOWN, find(service.checkAll(), "node-endpoint").status());
    }

    @Test
    @DisplayName("Pool available -> UP, pool failing -> DEGRADED")
    void identifierPool() {
        var pool = new IdentifierPool(0);
        try {
            var service = new HealthCheckService(new RuntimeProperties(), null, pool);
            assertEquals(HealthStatus.Status.UP, find(service.checkAll(), "identifier-pool").status());
        } finally {
            pool.shutdown();
        }

        var broken = mock(IdentifierPool.class);
        when(broken.freeCount()).thenThrow(new IllegalStateException("identifier pool task failed"));
        var service = new HealthCheckService(new RuntimeProperties(), null, broken);
        assertEquals(HealthStatus.Status.DEGRADED, find(service.checkAll(), "identifier-pool").status());
    }
}
