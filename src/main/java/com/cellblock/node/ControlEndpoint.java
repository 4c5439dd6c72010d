package com.cellblock.node;

import com.cellblock.wire.CodeUnit;
import com.cellblock.wire.Frame;
import com.cellblock.wire.FrameChannel;
import com.cellblock.wire.FrameServer;
import com.cellblock.wire.Frames;
import com.cellblock.wire.NodeAddress;
import com.cellblock.wire.WireException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * Exposes a {@link Node} to remote callers. Each request frame gets exactly one reply.
 */
public class ControlEndpoint implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ControlEndpoint.class);

    public static final String PROBE_CODE = "probe_code";
    public static final String LOAD_CODE = "load_code";
    public static final String PLATFORM_VERSION = "platform_version";
    public static final String MANAGER_RUNNING = "manager_running";
    public static final String MANAGER_ID = "manager_id";
    public static final String START_MANAGER = "start_manager";
    public static final String START_SERVER = "start_server";
    public static final String STOP_MANAGER = "stop_manager";

    private static final TypeReference<Map<String, Object>> OPTIONS = new TypeReference<>() {};

    private final Node node;
    private final FrameServer server;

    private ControlEndpoint(Node node, String bindHost) throws IOException {
        this.node = node;
        this.server = FrameServer.start("control-" + node.name(), bindHost, this::serve);
    }

    public static ControlEndpoint start(Node node, String bindHost) throws IOException {
        return new ControlEndpoint(node, bindHost);
    }

    public NodeAddress address() {
        return server.address();
    }

    private void serve(FrameChannel channel) throws IOException {
        Frame request;
        while ((request = channel.receive()) != null) {
            channel.send(handle(request));
        }
    }

    Frame handle(Frame request) {
        try {
            return Frames.reply(request.ref(), dispatch(request));
        } catch (CodeLoadException e) {
            return Frames.error(request.ref(), e.getMessage());
        } catch (IllegalStateException | IllegalArgumentException | WireException e) {
            log.warn("{} request on {} failed: {}", request.type(), node.name(), e.getMessage());
            return Frames.error(request.ref(), e.getMessage());
        }
    }

    private Object dispatch(Frame request) {
        return switch (request.type()) {
            case PROBE_CODE -> node.isCodePresent(request.text("unit"));
            case LOAD_CODE -> {
                node.loadCode(request.bodyAs(CodeUnit.class));
                yield true;
            }
            case PLATFORM_VERSION -> Node.platformVersion();
            case MANAGER_RUNNING -> node.isManagerRunning();
            case MANAGER_ID -> node.managerId();
            case START_MANAGER -> node.startManager(options(request.body()));
            case START_SERVER -> node.startConnectionServer(options(request.body()));
            case STOP_MANAGER -> {
                node.stopManager();
                yield true;
            }
            default -> throw new IllegalArgumentException("unknown request " + request.type());
        };
    }

    private static Map<String, Object> options(JsonNode body) {
        JsonNode options = body.get("options");
        if (options == null || options.isNull()) {
            return Map.of();
        }
        return Frames.MAPPER.convertValue(options, OPTIONS);
    }

    @Override
    public void close() {
        server.close();
    }
}
