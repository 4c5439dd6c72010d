package com.cellblock.runtime;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.cellblock.remote.NodeManager;
import com.cellblock.remote.RuntimeServer;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "cellblock")
public class RuntimeProperties {

    private Runtime runtime = new Runtime();

    // -- Runtime accessors (delegate to nested) --
    public long getNameBufferMillis() { return runtime.nameBufferMillis; }
    public long getHandshakeTimeoutMillis() { return runtime.handshakeTimeoutMillis; }
    public long getChildAckTimeoutMillis() { return runtime.childAckTimeoutMillis; }
    public long getAwaitOwnerMillis() { return runtime.awaitOwnerMillis; }
    public long getCallTimeoutMillis() { return runtime.callTimeoutMillis; }
    public String getBindAddress() { return runtime.bindAddress; }
    public String getBaseLabel() { return runtime.baseLabel; }
    public int getMaxWorkers() { return runtime.maxWorkers; }

    /**
     * The java executable used to spawn runtimes. Falls back to the one running the coordinator.
     */
    public String getJavaExecutable() {
        if (runtime.javaExecutable != null && !runtime.javaExecutable.isBlank()) {
            return runtime.javaExecutable;
        }
        return Path.of(System.getProperty("java.home"), "bin", "java").toString();
    }

    /**
     * Class path handed to spawned runtimes. Falls back to the coordinator's own class path.
     */
    public String getClasspath() {
        if (runtime.classpath != null && !runtime.classpath.isBlank()) {
            return runtime.classpath;
        }
        return System.getProperty("java.class.path");
    }

    /**
     * Options for the management process of a runtime this coordinator bootstraps.
     */
    public Map<String, Object> managerOptions(boolean autoTermination) {
        return Map.of(NodeManager.AUTO_TERMINATION, autoTermination, NodeManager.BIND_HOST, runtime.bindAddress);
    }

    /**
     * Options for each connection server this coordinator starts.
     */
    public Map<String, Object> serverOptions() {
        var options = new HashMap<String, Object>();
        options.put(RuntimeServer.AWAIT_OWNER_MILLIS, runtime.awaitOwnerMillis);
        if (runtime.maxWorkers > 0) {
            options.put(RuntimeServer.MAX_WORKERS, runtime.maxWorkers);
        }
        return options;
    }

    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }

    public static class Runtime {
        private long nameBufferMillis = 60_000;
        private long handshakeTimeoutMillis = 30_000;
        private long childAckTimeoutMillis = 10_000;
        private long awaitOwnerMillis = 5_000;
        private long callTimeoutMillis = 30_000;
        private String javaExecutable = "";
        private String classpath = "";
        private String bindAddress = "127.0.0.1";
        private String baseLabel = "cellblock";
        private int maxWorkers = 0;

        public long getNameBufferMillis() { return nameBufferMillis; }
        public void setNameBufferMillis(long nameBufferMillis) { this.nameBufferMillis = nameBufferMillis; }
        public long getHandshakeTimeoutMillis() { return handshakeTimeoutMillis; }
        public void setHandshakeTimeoutMillis(long handshakeTimeoutMillis) { this.handshakeTimeoutMillis = handshakeTimeoutMillis; }
        public long getChildAckTimeoutMillis() { return childAckTimeoutMillis; }
        public void setChildAckTimeoutMillis(long childAckTimeoutMillis) { this.childAckTimeoutMillis = childAckTimeoutMillis; }
        public long getAwaitOwnerMillis() { return awaitOwnerMillis; }
        public void setAwaitOwnerMillis(long awaitOwnerMillis) { this.awaitOwnerMillis = awaitOwnerMillis; }
        public long getCallTimeoutMillis() { return callTimeoutMillis; }
        public void setCallTimeoutMillis(long callTimeoutMillis) { this.callTimeoutMillis = callTimeoutMillis; }
        public String getJavaExecutable() { return javaExecutable; }
        public void setJavaExecutable(String javaExecutable) { this.javaExecutable = javaExecutable; }
        public String getClasspath() { return classpath; }
        public void setClasspath(String classpath) { this.classpath = classpath; }
        public String getBindAddress() { return bindAddress; }
        public void setBindAddress(String bindAddress) { this.bindAddress = bindAddress; }
        public String getBaseLabel() { return baseLabel; }
        public void setBaseLabel(String baseLabel) { this.baseLabel = baseLabel; }
        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
    }
}
