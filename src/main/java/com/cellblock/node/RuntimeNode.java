package com.cellblock.node;

import com.cellblock.core.logging.MdcContext;
import com.cellblock.wire.Frame;
import com.cellblock.wire.FrameChannel;
import com.cellblock.wire.NodeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Entry point of a runtime JVM.
 *
 * <pre>
 * java -cp &lt;classpath&gt; com.cellblock.node.RuntimeNode --name &lt;identity&gt; --eval "&lt;boot script&gt;" -- &lt;coordinator&gt;
 * </pre>
 *
 * Starts the node and its control endpoint, then executes the {@link BootScript}.
 * The exit status is 0 after {@code halt} or a completed script and 1 when a directive fails.
 */
@Command(name = "cellblock-runtime", mixinStandardHelpOptions = true,
        description = "Isolated runtime node started by a Cellblock coordinator")
public class RuntimeNode implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RuntimeNode.class);

    public static final String READY = "ready";
    public static final String ACK = "ack";

    @Option(names = "--name", required = true, description = "Runtime identity")
    String name;

    @Option(names = "--eval", required = true, description = "Single-line boot script")
    String script;

    @Option(names = "--bind", defaultValue = "127.0.0.1", description = "Address the control endpoint binds to")
    String bindHost;

    @Parameters(index = "0", arity = "0..1", description = "Coordinator address (host:port)")
    String coordinator;

    private Node node;
    private ControlEndpoint endpoint;
    private FrameChannel readyChannel;
    private String readyRef;

    public static void main(String[] args) {
        int status = new CommandLine(new RuntimeNode()).execute(args);
        System.exit(status);
    }

    @Override
    public Integer call() throws Exception {
        BootScript boot = BootScript.parse(script);
        node = new Node(name);
        endpoint = ControlEndpoint.start(node, bindHost);
        MdcContext.setRuntime(name);
        try {
            log.info("Runtime {} listening on {}", name, endpoint.address());
            return execute(boot);
        } finally {
            closeReadyChannel();
            endpoint.close();
            MdcContext.clear();
        }
    }

    int execute(BootScript boot) throws InterruptedException {
        for (BootScript.Directive directive : boot.directives()) {
            try {
                switch (directive.name()) {
                    case BootScript.ANNOUNCE -> announce();
                    case BootScript.AWAIT_ACK -> awaitAck(directive.millisArg());
                    case BootScript.AWAIT_MANAGER -> node.awaitManager();
                    case BootScript.SERVE -> serve();
                    case BootScript.HALT -> {
                        log.info("Runtime {} halting", name);
                        return 0;
                    }
                    default -> throw new IllegalArgumentException("unknown boot directive " + directive.name());
                }
            } catch (IOException | IllegalStateException | IllegalArgumentException e) {
                log.error("Boot directive '{}' failed: {}", directive.name(), e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    private void announce() throws IOException {
        if (coordinator == null) {
            throw new IllegalStateException("no coordinator address given");
        }
        readyRef = UUID.randomUUID().toString();
        readyChannel = FrameChannel.connect(NodeAddress.parse(coordinator), 5000);
        readyChannel.send(Frame.of(READY, readyRef, Map.of(
                "identity", name,
                "address", endpoint.address().toString(),
                "handle", ProcessHandle.current().pid())));
        log.debug("Announced {} to {} with ref {}", name, coordinator, readyRef);
    }

    private void awaitAck(long timeoutMillis) throws IOException {
        if (readyChannel == null) {
            throw new IllegalStateException("await-ack before announce");
        }
        long deadline = System.currentTimeMillis() + timeoutMillis;
        try {
            while (true) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    throw new IllegalStateException("no acknowledgement within " + timeoutMillis + "ms");
                }
                readyChannel.setReadTimeout((int) Math.min(remaining, Integer.MAX_VALUE));
                Frame frame = readyChannel.receive();
                if (frame == null) {
                    throw new IllegalStateException("coordinator closed the handshake channel");
                }
                if (ACK.equals(frame.type()) && readyRef.equals(frame.ref())) {
                    log.debug("Acknowledged by coordinator");
                    return;
                }
                log.debug("Ignoring {} frame with ref {}", frame.type(), frame.ref());
            }
        } catch (SocketTimeoutException e) {
            throw new IllegalStateException("no acknowledgement within " + timeoutMillis + "ms", e);
        } finally {
            closeReadyChannel();
        }
    }

    private void serve() throws InterruptedException {
        System.out.println("cellblock runtime " + name + " control address " + endpoint.address());
        System.out.flush();
        node.awaitManagerLifecycle();
    }

    private void closeReadyChannel() {
        if (readyChannel != null) {
            readyChannel.close();
            readyChannel = null;
        }
    }

    Node node() {
        return node;
    }
}
