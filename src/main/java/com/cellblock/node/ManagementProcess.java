package com.cellblock.node;

import com.cellblock.wire.ServerHandle;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * The long-lived process a node runs after bootstrap. Its implementation is shipped
 * to the node as required code; the node only knows this contract.
 */
public interface ManagementProcess {

    String id();

    void start(Map<String, Object> options);

    /**
     * Starts a fresh per-connection server.
     */
    ServerHandle startConnectionServer(Map<String, Object> options);

    boolean isAlive();

    void awaitTermination() throws InterruptedException;

    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Stops every connection server and then the process itself.
     */
    void stop();
}
