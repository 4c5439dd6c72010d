package com.cellblock.core.health;

import com.cellblock.runtime.IdentifierPool;
import com.cellblock.runtime.JvmProcessLauncher;
import com.cellblock.runtime.NodeEndpoint;
import com.cellblock.runtime.RuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final RuntimeProperties properties;
    private final NodeEndpoint nodeEndpoint;
    private final IdentifierPool identifierPool;

    public HealthCheckService(
            RuntimeProperties properties,
            @Autowired(required = false) NodeEndpoint nodeEndpoint,
            @Autowired(required = false) IdentifierPool identifierPool) {
        this.properties = properties;
        this.nodeEndpoint = nodeEndpoint;
        this.identifierPool = identifierPool;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkJavaExecutable());
        results.add(checkNodeEndpoint());
        results.add(checkIdentifierPool());
        return results;
    }

    private HealthStatus checkJavaExecutable() {
        String executable = properties.getJavaExecutable();
        return JvmProcessLauncher.resolveExecutable(executable)
                .map(path -> new HealthStatus("java", HealthStatus.Status.UP,
                        "Runtime JVM executable found", Map.of("path", path.toString())))
                .orElseGet(() -> new HealthStatus("java", HealthStatus.Status.DOWN,
                        "Java executable not found: " + executable, Map.of()));
    }

    private HealthStatus checkNodeEndpoint() {
        if (nodeEndpoint == null) {
            return new HealthStatus("node-endpoint", HealthStatus.Status.DOWN,
                    "No NodeEndpoint configured", Map.of());
        }
        if (!nodeEndpoint.isOpen()) {
            return new HealthStatus("node-endpoint", HealthStatus.Status.DOWN,
                    "Node endpoint closed", Map.of());
        }
        return new HealthStatus("node-endpoint", HealthStatus.Status.UP,
                "Listening for runtimes", Map.of(
                        "address", nodeEndpoint.address().toString(),
                        "pending", String.valueOf(nodeEndpoint.pendingHandshakes())));
    }

    private HealthStatus checkIdentifierPool() {
        if (identifierPool == null) {
            return new HealthStatus("identifier-pool", HealthStatus.Status.DOWN,
                    "No IdentifierPool configured", Map.of());
        }
        try {
            int free = identifierPool.freeCount();
            int generated = identifierPool.generatedCount();
            return new HealthStatus("identifier-pool", HealthStatus.Status.UP,
                    generated + " names generated, " + free + " free",
                    Map.of("bufferMillis", String.valueOf(identifierPool.bufferMillis())));
        } catch (IllegalStateException e) {
            log.warn("Identifier pool health check failed: {}", e.getMessage());
            return new HealthStatus("identifier-pool", HealthStatus.Status.DEGRADED,
                    "Identifier pool error: " + e.getMessage(), Map.of());
        }
    }
}
