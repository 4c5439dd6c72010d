package com.cellblock.runtime;

import com.cellblock.node.CodeLoadException;
import com.cellblock.wire.CodeUnit;
import com.cellblock.wire.ServerHandle;

import java.util.Map;

/**
 * Probe-and-act surface of a runtime node used by {@link RuntimeBootstrap}.
 */
public interface NodeControl extends AutoCloseable {

    boolean isCodePresent(String unit);

    /**
     * @throws CodeLoadException when the node rejects the unit
     */
    void loadCode(CodeUnit unit);

    String platformVersion();

    boolean isManagementProcessRunning();

    String managementProcessId();

    /**
     * @return id of the started (or already running) management process
     */
    String startManagementProcess(Map<String, Object> options);

    ServerHandle startConnectionServer(Map<String, Object> options);

    void stopManagementProcess();

    @Override
    void close();
}
