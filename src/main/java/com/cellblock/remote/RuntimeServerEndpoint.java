package com.cellblock.remote;

import com.cellblock.wire.EvaluationRequest;
import com.cellblock.wire.EvaluationResponse;
import com.cellblock.wire.Frame;
import com.cellblock.wire.FrameChannel;
import com.cellblock.wire.FrameServer;
import com.cellblock.wire.Frames;
import com.cellblock.wire.IntellisenseRequest;
import com.cellblock.wire.Locator;
import com.cellblock.wire.NodeAddress;
import com.cellblock.wire.ServerMessages;
import com.cellblock.wire.WireException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Network face of a {@link RuntimeServer}.
 *
 * <p>The connection that sends {@code attach} becomes the owner: notifications are pushed to it as
 * event frames, and when it closes the server stops.
 */
public class RuntimeServerEndpoint implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RuntimeServerEndpoint.class);

    private final RuntimeServer server;
    private final FrameServer frames;

    private RuntimeServerEndpoint(RuntimeServer server, String bindHost) throws IOException {
        this.server = server;
        this.frames = FrameServer.start(server.id(), bindHost, this::serve);
    }

    public static RuntimeServerEndpoint start(RuntimeServer server, String bindHost) throws IOException {
        return new RuntimeServerEndpoint(server, bindHost);
    }

    public NodeAddress address() {
        return frames.address();
    }

    private void serve(FrameChannel channel) throws IOException {
        boolean owner = false;
        try {
            Frame request;
            while ((request = channel.receive()) != null) {
                if (ServerMessages.ATTACH.equals(request.type())) {
                    owner = attach(channel, request);
                } else {
                    handle(channel, request);
                }
            }
        } finally {
            if (owner && !server.isStopped()) {
                log.info("Owner of {} disconnected, stopping", server.id());
                server.stop();
            }
        }
    }

    private boolean attach(FrameChannel channel, Frame request) throws IOException {
        try {
            server.attach(new ChannelOwner(channel));
            channel.send(Frames.reply(request.ref(), server.id()));
            return true;
        } catch (IllegalStateException e) {
            channel.send(Frames.error(request.ref(), e.getMessage()));
            return false;
        }
    }

    private void handle(FrameChannel channel, Frame request) throws IOException {
        Frame reply;
        try {
            reply = switch (request.type()) {
                case ServerMessages.EVALUATE -> {
                    var evaluation = request.bodyAs(EvaluationRequest.class);
                    server.evaluateCode(evaluation.container(), evaluation.evaluation(), evaluation.code(),
                            evaluation.parentLocators(), evaluation.options());
                    yield Frames.reply(request.ref(), true);
                }
                case ServerMessages.FORGET -> {
                    server.forgetEvaluation(request.bodyAs(Locator.class));
                    yield Frames.reply(request.ref(), true);
                }
                case ServerMessages.DROP_CONTAINER -> {
                    server.dropContainer(request.text("container"));
                    yield Frames.reply(request.ref(), true);
                }
                case ServerMessages.READ_FILE -> readFile(request);
                case ServerMessages.INTELLISENSE -> {
                    intellisense(channel, request);
                    yield null;
                }
                case ServerMessages.STOP -> {
                    channel.send(Frames.reply(request.ref(), true));
                    server.stop();
                    yield null;
                }
                default -> Frames.error(request.ref(), "unknown request " + request.type());
            };
        } catch (IllegalStateException | IllegalArgumentException | WireException e) {
            reply = Frames.error(request.ref(), e.getMessage());
        }
        if (reply != null) {
            channel.send(reply);
        }
    }

    private Frame readFile(Frame request) {
        String path = request.text("path");
        if (path == null) {
            return Frames.error(request.ref(), "path is required");
        }
        try {
            return Frames.reply(request.ref(), server.readFile(path));
        } catch (IOException e) {
            return Frames.error(request.ref(), "cannot read " + path + ": " + e.getMessage());
        }
    }

    private void intellisense(FrameChannel channel, Frame request) {
        server.handleIntellisense(request.bodyAs(IntellisenseRequest.class)).whenComplete((response, error) -> {
            Throwable cause = error != null && error.getCause() != null ? error.getCause() : error;
            Frame reply = error == null
                    ? Frames.reply(request.ref(), response)
                    : Frames.error(request.ref(), String.valueOf(cause.getMessage()));
            try {
                channel.send(reply);
            } catch (IOException e) {
                log.debug("Cannot answer intellisense request on {}: {}", server.id(), e.getMessage());
            }
        });
    }

    @Override
    public void close() {
        frames.close();
    }

    /**
     * Pushes server notifications to the owning connection.
     */
    private final class ChannelOwner implements RuntimeOwner {

        private final FrameChannel channel;

        ChannelOwner(FrameChannel channel) {
            this.channel = channel;
        }

        @Override
        public void onEvaluationResponse(EvaluationResponse response) {
            push(Frame.of(ServerMessages.EVALUATION_RESPONSE, response));
        }

        @Override
        public void onContainerDown(String container, String message, List<String> evaluations) {
            push(Frame.of(ServerMessages.CONTAINER_DOWN,
                    Map.of("container", container, "message", message, "evaluations", evaluations)));
        }

        @Override
        public void onServerStopped(String serverId) {
            push(Frame.of(ServerMessages.SERVER_STOPPED, Map.of("server", serverId)));
        }

        private void push(Frame frame) {
            if (!channel.isOpen()) {
                log.debug("Owner of {} gone, dropping {}", server.id(), frame.type());
                return;
            }
            try {
                channel.send(frame);
            } catch (IOException e) {
                log.warn("Cannot push {} to owner of {}: {}", frame.type(), server.id(), e.getMessage());
            }
        }
    }
}
