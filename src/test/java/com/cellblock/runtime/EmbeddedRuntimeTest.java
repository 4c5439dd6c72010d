package com.cellblock.runtime;

import com.cellblock.core.events.CellblockEvent;
import com.cellblock.core.events.EventBus;
import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.node.Node;
import com.cellblock.wire.EvaluationResponse;
import com.cellblock.wire.IntellisenseRequest;
import com.cellblock.wire.Locator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the full coordinator path against a node inside the test JVM.
 */
class EmbeddedRuntimeTest {

    private IdentifierPool pool;
    private SimpleMeterRegistry registry;
    private EventBus events;
    private Node node;
    private EmbeddedRuntime runtime;
    private RuntimeConnection connection;
    private final BlockingQueue<CellblockEvent> received = new LinkedBlockingQueue<>();

    @BeforeEach
    void setUp() {
        pool = new IdentifierPool(0);
        registry = new SimpleMeterRegistry();
        var metrics = new CellblockMetrics(registry);
        events = new EventBus();
        node = new Node("embedded-test");
        runtime = new EmbeddedRuntime(node, pool, new RuntimeBootstrap(metrics), events, metrics, new RuntimeProperties());
        connection = runtime.connect();
        connection.takeOwnership(received::add);
    }

    @AfterEach
    void tearDown() {
        connection.disconnect();
        node.stopManager();
        pool.shutdown();
    }

    private static EvaluationResponse await(CompletableFuture<EvaluationResponse> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    private CellblockEvent nextEvent(String type) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            CellblockEvent event = received.poll(100, TimeUnit.MILLISECONDS);
            if (event != null && event.eventType().equals(type)) {
                return event;
            }
        }
        fail("no " + type + " event within 5s");
        return null;
    }

    private void awaitCodeUnloaded() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (node.isCodePresent(RequiredCode.MARKER_UNIT) && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertFalse(node.isCodePresent(RequiredCode.MARKER_UNIT));
    }

    @Nested
    @DisplayName("evaluation")
    class Evaluation {

        @Test
        @DisplayName("bindings flow from a parent evaluation")
        void parentBindings() throws Exception {
            assertEquals("", await(connection.evaluate("main", "cell-1", "x = 41")).output());

            EvaluationResponse response = await(connection.evaluate("main", "cell-2", "x + 1",
                    List.of(new Locator("main", "cell-1"))));

            assertFalse(response.failed());
            assertEquals("42", response.output());
            CellblockEvent completed = nextEvent(CellblockEvent.EVALUATION_COMPLETED);
            assertEquals("main", completed.containerRef());
            assertEquals(node.name(), completed.runtimeId());
        }

        @Test
        @DisplayName("a script error completes the future with an error response")
        void scriptError() throws Exception {
            EvaluationResponse response = await(connection.evaluate("main", "cell-1", "print(\"hi\")\nraise(\"boom\")"));

            assertTrue(response.failed());
            assertEquals("line 2: boom", response.error());
            assertEquals("hi\n", response.output());
            assertEquals(1, registry.find("cellblock.evaluation.duration").tag("result", "error").timer().count());
        }

        @Test
        void duplicatePendingLocatorIsRejected() throws Exception {
            var first = connection.evaluate("a", "cell-1", "await(\"go\"); 1");

            assertThrows(IllegalArgumentException.class, () -> connection.evaluate("a", "cell-1", "2"));

            await(connection.evaluate("b", "cell-2", "signal(\"go\")"));
            assertEquals("1", await(first).output());
        }

        @Test
        void intellisenseAndReadFile(@TempDir Path dir) throws Exception {
            await(connection.evaluate("main", "cell-1", "total = 3"));
            Path file = dir.resolve("notes.txt");
            Files.writeString(file, "hello");

            var completion = connection.intellisense(new IntellisenseRequest("completion", "tot",
                    List.of(new Locator("main", "cell-1")))).get(10, TimeUnit.SECONDS);

            assertEquals(List.of("total"), completion.items());
            assertArrayEquals("hello".getBytes(), connection.readFile(file.toString()));
            assertThrows(IOException.class, () -> connection.readFile(dir.resolve("missing").toString()));
        }
    }

    @Nested
    @DisplayName("container failures")
    class ContainerFailures {

        @Test
        @DisplayName("an exiting evaluator fails its future and publishes container.down")
        void containerDown() throws Exception {
            var future = connection.evaluate("main", "cell-1", "exit(\"gave up\")");

            var e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
            var down = assertInstanceOf(ContainerDownException.class, e.getCause());
            assertEquals("main", down.container());
            assertEquals("gave up", nextEvent(CellblockEvent.CONTAINER_DOWN).payload().get("message"));

            assertEquals("1", await(connection.evaluate("main", "cell-2", "1")).output());
        }

        @Test
        @DisplayName("dropping a container fails its pending evaluations only")
        void dropContainer() throws Exception {
            var blocked = connection.evaluate("a", "cell-1", "await(\"never\")");

            connection.dropContainer("a");

            var e = assertThrows(ExecutionException.class, () -> blocked.get(10, TimeUnit.SECONDS));
            assertInstanceOf(ContainerDownException.class, e.getCause());
            assertEquals("2", await(connection.evaluate("b", "cell-2", "2")).output());
        }
    }

    @Nested
    @DisplayName("disconnect")
    class Disconnect {

        @Test
        @DisplayName("disconnecting publishes runtime.disconnected and unloads the code")
        void disconnect() throws Exception {
            var pending = connection.evaluate("a", "cell-1", "await(\"never\")");

            connection.disconnect();

            var e = assertThrows(ExecutionException.class, () -> pending.get(10, TimeUnit.SECONDS));
            assertInstanceOf(RuntimeDownException.class, e.getCause());
            nextEvent(CellblockEvent.RUNTIME_DISCONNECTED);
            awaitCodeUnloaded();
            assertNull(registry.find("cellblock.runtimes.down").counter());
            assertTrue(connection.evaluate("a", "cell-2", "1").isCompletedExceptionally());
        }

        @Test
        @DisplayName("a manager that stops underneath the connection is reported as runtime.down")
        void runtimeDown() throws Exception {
            var pending = connection.evaluate("a", "cell-1", "await(\"never\")");

            node.stopManager();

            var e = assertThrows(ExecutionException.class, () -> pending.get(10, TimeUnit.SECONDS));
            assertInstanceOf(RuntimeDownException.class, e.getCause());
            nextEvent(CellblockEvent.RUNTIME_DOWN);
            assertEquals(1.0, registry.find("cellblock.runtimes.down").tag("kind", "embedded").counter().count());
            awaitCodeUnloaded();
        }

        @Test
        @DisplayName("the node can be connected again after a disconnect")
        void reconnect() throws Exception {
            connection.disconnect();
            awaitCodeUnloaded();

            connection = runtime.connect();

            assertEquals("3", await(connection.evaluate("main", "cell-1", "1 + 2")).output());
        }
    }
}
