package com.cellblock.runtime;

import com.cellblock.node.RuntimeNode;
import com.cellblock.wire.Frame;
import com.cellblock.wire.FrameChannel;
import com.cellblock.wire.NodeAddress;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Wake-up sources of a pending handshake. The deadline is the fourth source and has no signal:
 * it is the timeout of the mailbox poll.
 */
public interface HandshakeSignal {

    /**
     * The runtime announced itself. Exactly one of {@link #acknowledge()} or {@link #reject()}
     * releases the announcing connection.
     */
    record Ready(String ref, String identity, NodeAddress address, long handle,
                 FrameChannel channel, CompletableFuture<Void> released) implements HandshakeSignal {

        public void acknowledge() throws IOException {
            try {
                channel.send(Frame.of(RuntimeNode.ACK, ref, Map.of()));
            } finally {
                released.complete(null);
            }
        }

        public void reject() {
            released.complete(null);
        }
    }

    /**
     * A line of process output.
     */
    record Output(String line) implements HandshakeSignal {}

    /**
     * The process exited.
     */
    record Terminated(int exitStatus) implements HandshakeSignal {}
}
