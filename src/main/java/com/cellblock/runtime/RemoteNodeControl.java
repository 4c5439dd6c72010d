package com.cellblock.runtime;

import com.cellblock.node.CodeLoadException;
import com.cellblock.node.ControlEndpoint;
import com.cellblock.wire.CodeUnit;
import com.cellblock.wire.NodeAddress;
import com.cellblock.wire.RemoteCallException;
import com.cellblock.wire.RpcClient;
import com.cellblock.wire.ServerHandle;

import java.io.IOException;
import java.util.Map;

/**
 * {@link NodeControl} over the wire, talking to a runtime's {@link ControlEndpoint}.
 */
public class RemoteNodeControl implements NodeControl {

    private final RpcClient rpc;
    private final long timeoutMillis;

    public RemoteNodeControl(RpcClient rpc, long timeoutMillis) {
        this.rpc = rpc;
        this.timeoutMillis = timeoutMillis;
    }

    public static RemoteNodeControl connect(NodeAddress address, long timeoutMillis) throws IOException {
        var rpc = RpcClient.connect(address, "control-" + address.port(), (int) Math.min(timeoutMillis, Integer.MAX_VALUE));
        return new RemoteNodeControl(rpc, timeoutMillis);
    }

    @Override
    public boolean isCodePresent(String unit) {
        return Boolean.TRUE.equals(rpc.callSync(ControlEndpoint.PROBE_CODE, Map.of("unit", unit), Boolean.class, timeoutMillis));
    }

    @Override
    public void loadCode(CodeUnit unit) {
        try {
            rpc.callSync(ControlEndpoint.LOAD_CODE, unit, Boolean.class, timeoutMillis);
        } catch (RemoteCallException e) {
            throw new CodeLoadException(unit.name(), e.getMessage());
        }
    }

    @Override
    public String platformVersion() {
        return rpc.callSync(ControlEndpoint.PLATFORM_VERSION, Map.of(), String.class, timeoutMillis);
    }

    @Override
    public boolean isManagementProcessRunning() {
        return Boolean.TRUE.equals(rpc.callSync(ControlEndpoint.MANAGER_RUNNING, Map.of(), Boolean.class, timeoutMillis));
    }

    @Override
    public String managementProcessId() {
        return rpc.callSync(ControlEndpoint.MANAGER_ID, Map.of(), String.class, timeoutMillis);
    }

    @Override
    public String startManagementProcess(Map<String, Object> options) {
        return rpc.callSync(ControlEndpoint.START_MANAGER, Map.of("options", options), String.class, timeoutMillis);
    }

    @Override
    public ServerHandle startConnectionServer(Map<String, Object> options) {
        return rpc.callSync(ControlEndpoint.START_SERVER, Map.of("options", options), ServerHandle.class, timeoutMillis);
    }

    @Override
    public void stopManagementProcess() {
        rpc.callSync(ControlEndpoint.STOP_MANAGER, Map.of(), Boolean.class, timeoutMillis);
    }

    @Override
    public void close() {
        rpc.close();
    }
}
