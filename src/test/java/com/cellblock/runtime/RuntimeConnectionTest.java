package com.cellblock.runtime;

import com.cellblock.core.events.CellblockEvent;
import com.cellblock.core.events.EventBus;
import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.wire.EvaluationResponse;
import com.cellblock.wire.Frame;
import com.cellblock.wire.FrameChannel;
import com.cellblock.wire.FrameServer;
import com.cellblock.wire.Frames;
import com.cellblock.wire.Locator;
import com.cellblock.wire.ServerHandle;
import com.cellblock.wire.ServerMessages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Talks to a scripted connection server, so the order of notifications is under the test's control.
 */
class RuntimeConnectionTest {

    private final BlockingQueue<FrameChannel> channels = new LinkedBlockingQueue<>();
    private final BlockingQueue<CellblockEvent> published = new LinkedBlockingQueue<>();
    private FrameServer server;
    private RuntimeConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        server = FrameServer.start("scripted-server", "127.0.0.1", channel -> {
            channels.add(channel);
            Frame request;
            while ((request = channel.receive()) != null) {
                switch (request.type()) {
                    case ServerMessages.ATTACH -> channel.send(Frames.reply(request.ref(), "scripted"));
                    case ServerMessages.EVALUATE, ServerMessages.STOP -> channel.send(Frames.reply(request.ref(), true));
                    default -> channel.send(Frames.error(request.ref(), "unsupported " + request.type()));
                }
            }
        });
        var events = new EventBus();
        var identity = new RuntimeIdentity("scripted", "main", RuntimeIdentity.Origin.EXTERNAL);
        var bootstrap = new BootstrapResult("manager-1", new ServerHandle("server-1", server.address()));
        connection = RuntimeConnection.open("attached", identity, bootstrap, events,
                new CellblockMetrics(new SimpleMeterRegistry()), 5000);
        connection.takeOwnership(published::add);
    }

    @AfterEach
    void tearDown() {
        connection.disconnect();
        server.close();
    }

    private FrameChannel serverSide() throws InterruptedException {
        FrameChannel channel = channels.poll(5, TimeUnit.SECONDS);
        assertNotNull(channel, "connection never reached the server");
        return channel;
    }

    @Test
    @DisplayName("container down fails only the evaluations the dead evaluator had accepted")
    void containerDownSparesLaterEvaluations() throws Exception {
        FrameChannel channel = serverSide();
        var lost = connection.evaluate("a", "e1", "exit(\"boom\")");
        var rerun = connection.evaluate("a", "e2", "2");

        channel.send(Frame.of(ServerMessages.CONTAINER_DOWN,
                Map.of("container", "a", "message", "boom", "evaluations", List.of("e1"))));
        channel.send(Frame.of(ServerMessages.EVALUATION_RESPONSE,
                EvaluationResponse.success(new Locator("a", "e2"), "2", 1)));

        var e = assertThrows(ExecutionException.class, () -> lost.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ContainerDownException.class, e.getCause());
        EvaluationResponse response = rerun.get(5, TimeUnit.SECONDS);
        assertEquals("2", response.output());
        assertFalse(response.failed());
    }

    @Test
    @DisplayName("an error response keeps its message and output")
    void errorResponse() throws Exception {
        FrameChannel channel = serverSide();
        var future = connection.evaluate("a", "e1", "raise(\"bad\")");

        channel.send(Frame.of(ServerMessages.EVALUATION_RESPONSE,
                EvaluationResponse.failure(new Locator("a", "e1"), "printed\n", "line 1: bad", 2)));

        EvaluationResponse response = future.get(5, TimeUnit.SECONDS);
        assertTrue(response.failed());
        assertEquals("line 1: bad", response.error());
        assertEquals("printed\n", response.output());
    }

    @Test
    @DisplayName("the container down event lists the evaluations that were lost")
    void containerDownEvent() throws Exception {
        FrameChannel channel = serverSide();

        channel.send(Frame.of(ServerMessages.CONTAINER_DOWN,
                Map.of("container", "b", "message", "killed", "evaluations", List.of("e7", "e8"))));

        CellblockEvent event;
        do {
            event = published.poll(5, TimeUnit.SECONDS);
            assertNotNull(event, "no container.down event");
        } while (!CellblockEvent.CONTAINER_DOWN.equals(event.eventType()));
        assertEquals("b", event.containerRef());
        assertEquals(List.of("e7", "e8"), event.payload().get("evaluations"));
    }

    @Test
    @DisplayName("losing the channel fails every pending evaluation as runtime down")
    void channelLoss() throws Exception {
        FrameChannel channel = serverSide();
        var first = connection.evaluate("a", "e1", "1");
        var second = connection.evaluate("b", "e1", "1");

        channel.close();

        for (var future : List.of(first, second)) {
            var e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(RuntimeDownException.class, e.getCause());
        }
    }
}
