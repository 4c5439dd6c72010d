package com.cellblock.runtime;

import java.util.Map;

/**
 * A place code can run. Each kind knows how to reach (or create) its runtime and hands back
 * a {@link RuntimeConnection}.
 */
public interface CellRuntime {

    /**
     * @throws SpawnException       when a runtime process cannot be started
     * @throws HandshakeException   when a spawned runtime does not become ready
     * @throws BootstrapException   when required code cannot be loaded
     * @throws RuntimeDownException when the connection server cannot be reached
     */
    RuntimeConnection connect();

    /**
     * Human-readable description, at least {@code type} and {@code name}.
     */
    Map<String, String> describe();

    /**
     * A fresh, unconnected runtime of the same kind and configuration.
     */
    CellRuntime duplicate();
}
