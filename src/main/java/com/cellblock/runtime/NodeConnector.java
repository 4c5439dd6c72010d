package com.cellblock.runtime;

import com.cellblock.wire.NodeAddress;

import java.io.IOException;

/**
 * Opens a {@link NodeControl} on the runtime listening at an address.
 */
@FunctionalInterface
public interface NodeConnector {

    NodeControl connect(NodeAddress address) throws IOException;
}
