package com.cellblock.runtime;

import com.cellblock.core.metrics.CellblockMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class RuntimeConfig {

    @Bean(destroyMethod = "close")
    public NodeEndpoint nodeEndpoint(RuntimeProperties properties) throws IOException {
        // announcing connections stay open at most as long as a handshake may take
        return NodeEndpoint.start(properties.getBindAddress(), properties.getHandshakeTimeoutMillis());
    }

    @Bean
    public ProcessLauncher processLauncher(RuntimeProperties properties) {
        return new JvmProcessLauncher(properties);
    }

    @Bean
    public NodeConnector nodeConnector(RuntimeProperties properties) {
        return address -> RemoteNodeControl.connect(address, properties.getCallTimeoutMillis());
    }

    @Bean
    public ParentHandshake parentHandshake(NodeEndpoint endpoint, ProcessLauncher launcher,
                                           RuntimeBootstrap bootstrap, NodeConnector connector,
                                           CellblockMetrics metrics, RuntimeProperties properties) {
        return new ParentHandshake(endpoint, launcher, bootstrap, connector, metrics,
                properties.getHandshakeTimeoutMillis());
    }
}
