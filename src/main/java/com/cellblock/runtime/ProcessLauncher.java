package com.cellblock.runtime;

import com.cellblock.wire.NodeAddress;

/**
 * Starts the OS process of a new runtime.
 */
public interface ProcessLauncher {

    /**
     * Fails fast when no runtime can be launched at all, before any handshake state exists.
     *
     * @throws SpawnException when the launcher is unusable
     */
    default void checkLaunchable() {
    }

    /**
     * @param identity    name the runtime announces itself with
     * @param coordinator address the runtime reports readiness to
     * @throws SpawnException when the process cannot be started
     */
    RuntimeProcess launch(RuntimeIdentity identity, NodeAddress coordinator);
}
