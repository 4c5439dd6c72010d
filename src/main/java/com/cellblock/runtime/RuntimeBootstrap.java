package com.cellblock.runtime;

import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.node.CodeLoadException;
import com.cellblock.node.Node;
import com.cellblock.wire.CodeUnit;
import com.cellblock.wire.ServerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Brings a runtime node to a usable state: required code loaded, a management process
 * running, and a fresh connection server started for the caller.
 *
 * <p>Every step probes first, so bootstrapping the same node again only starts another
 * connection server.
 */
@Component
public class RuntimeBootstrap {

    private static final Logger log = LoggerFactory.getLogger(RuntimeBootstrap.class);

    private final Supplier<RequiredCode> requiredCode;
    private final CellblockMetrics metrics;
    private volatile RequiredCode scanned;

    @Autowired
    public RuntimeBootstrap(CellblockMetrics metrics) {
        this(RequiredCode::scan, metrics);
    }

    RuntimeBootstrap(Supplier<RequiredCode> requiredCode, CellblockMetrics metrics) {
        this.requiredCode = requiredCode;
        this.metrics = metrics;
    }

    /**
     * @throws BootstrapException when a unit cannot be loaded; the node must not be used afterwards
     */
    public BootstrapResult bootstrap(NodeControl node, Map<String, Object> managerOptions,
                                     Map<String, Object> serverOptions) {
        boolean loaded = false;
        if (!node.isCodePresent(RequiredCode.MARKER_UNIT)) {
            loadRequiredCode(node);
            loaded = true;
        }
        metrics.recordBootstrap(loaded);

        String managerId;
        if (node.isManagementProcessRunning()) {
            managerId = node.managementProcessId();
            log.debug("Management process {} already running", managerId);
        } else {
            managerId = node.startManagementProcess(managerOptions);
            log.info("Started management process {}", managerId);
        }

        ServerHandle server = node.startConnectionServer(serverOptions);
        log.info("Started connection server {} at {}", server.serverId(), server.address());
        return new BootstrapResult(managerId, server);
    }

    private void loadRequiredCode(NodeControl node) {
        RequiredCode code = requiredCode();
        log.info("Loading {} code units", code.units().size());
        for (CodeUnit unit : code.units()) {
            try {
                node.loadCode(unit);
            } catch (CodeLoadException e) {
                throw loadFailure(node, unit.name(), e);
            }
        }
    }

    private BootstrapException loadFailure(NodeControl node, String unit, CodeLoadException cause) {
        String local = Node.platformVersion();
        String remote;
        try {
            remote = node.platformVersion();
        } catch (RuntimeException e) {
            log.warn("Cannot read the platform version of the remote runtime: {}", e.getMessage());
            remote = local;
        }
        if (!local.equals(remote)) {
            return new BootstrapException("failed to load " + unit
                    + " into the remote runtime, potentially due to Java version mismatch, reason: "
                    + cause.getMessage() + " (local " + local + " != remote " + remote + ")", true, cause);
        }
        return new BootstrapException("failed to load " + unit + " into the remote runtime, reason: "
                + cause.getMessage(), false, cause);
    }

    /**
     * Stops the management process of an in-process node and purges every unit it loaded.
     * Afterwards the node reports the required code absent.
     */
    public int unloadRequiredCode(Node node) {
        node.stopManager();
        int purged = node.purgeCode();
        log.info("Unloaded {} code units from {}", purged, node.name());
        return purged;
    }

    private RequiredCode requiredCode() {
        RequiredCode code = scanned;
        if (code == null) {
            code = requiredCode.get();
            scanned = code;
        }
        return code;
    }
}
