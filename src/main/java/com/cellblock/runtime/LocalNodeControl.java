package com.cellblock.runtime;

import com.cellblock.node.Node;
import com.cellblock.wire.CodeUnit;
import com.cellblock.wire.ServerHandle;

import java.util.Map;

/**
 * {@link NodeControl} over a {@link Node} in this JVM.
 */
public class LocalNodeControl implements NodeControl {

    private final Node node;

    public LocalNodeControl(Node node) {
        this.node = node;
    }

    @Override
    public boolean isCodePresent(String unit) {
        return node.isCodePresent(unit);
    }

    @Override
    public void loadCode(CodeUnit unit) {
        node.loadCode(unit);
    }

    @Override
    public String platformVersion() {
        return Node.platformVersion();
    }

    @Override
    public boolean isManagementProcessRunning() {
        return node.isManagerRunning();
    }

    @Override
    public String managementProcessId() {
        return node.managerId();
    }

    @Override
    public String startManagementProcess(Map<String, Object> options) {
        return node.startManager(options);
    }

    @Override
    public ServerHandle startConnectionServer(Map<String, Object> options) {
        return node.startConnectionServer(options);
    }

    @Override
    public void stopManagementProcess() {
        node.stopManager();
    }

    @Override
    public void close() {
        // the node outlives this view
    }
}
