package com.cellblock.runtime;

import com.cellblock.wire.ServerHandle;

/**
 * What {@link RuntimeBootstrap} leaves behind on a runtime.
 */
public record BootstrapResult(String managerId, ServerHandle server) {
}
