package com.cellblock.node;

import com.cellblock.remote.NodeManager;
import com.cellblock.runtime.RequiredCode;
import com.cellblock.wire.CodeUnit;
import com.cellblock.wire.ServerHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    private Node node;

    @BeforeEach
    void setUp() {
        node = new Node("test-node");
    }

    @AfterEach
    void tearDown() {
        node.stopManager();
    }

    private void loadRequiredCode() {
        for (CodeUnit unit : RequiredCode.scan().units()) {
            node.loadCode(unit);
        }
    }

    @Nested
    @DisplayName("code")
    class Code {

        @Test
        void tracksLoadedUnits() {
            assertFalse(node.isCodePresent(Node.MANAGER_CLASS));

            loadRequiredCode();

            assertTrue(node.isCodePresent(Node.MANAGER_CLASS));
        }

        @Test
        @DisplayName("purging drops every unit so the code can be loaded again")
        void purge() {
            loadRequiredCode();
            int loaded = node.codeLoader().size();

            assertEquals(loaded, node.purgeCode());
            assertFalse(node.isCodePresent(Node.MANAGER_CLASS));

            loadRequiredCode();
            assertTrue(node.isCodePresent(Node.MANAGER_CLASS));
        }

        @Test
        void purgeRefusedWhileManagerRuns() {
            loadRequiredCode();
            node.startManager(Map.of());

            assertThrows(IllegalStateException.class, node::purgeCode);
        }
    }

    @Nested
    @DisplayName("management process")
    class Manager {

        @Test
        void requiresLoadedCode() {
            var e = assertThrows(IllegalStateException.class, () -> node.startManager(Map.of()));
            assertEquals("management code is not loaded on test-node", e.getMessage());
            assertNull(node.managerId());
        }

        @Test
        @DisplayName("starting twice returns the running manager")
        void startIsIdempotent() {
            loadRequiredCode();

            String first = node.startManager(Map.of());
            String second = node.startManager(Map.of());

            assertEquals(first, second);
            assertEquals(first, node.managerId());
            assertTrue(node.isManagerRunning());
        }

        @Test
        @DisplayName("the manager runs from the pushed code, not the class path copy")
        void runsPushedCode() throws Exception {
            loadRequiredCode();
            node.startManager(Map.of());

            Class<?> managerType = node.codeLoader().loadClass(Node.MANAGER_CLASS);
            assertNotSame(NodeManager.class, managerType);
            assertSame(node.codeLoader(), managerType.getClassLoader());
        }

        @Test
        void startsConnectionServers() {
            loadRequiredCode();
            node.startManager(Map.of());

            ServerHandle first = node.startConnectionServer(Map.of());
            ServerHandle second = node.startConnectionServer(Map.of());

            assertNotEquals(first.serverId(), second.serverId());
            assertTrue(first.address().port() > 0);
        }

        @Test
        void connectionServerNeedsManager() {
            assertThrows(IllegalStateException.class, () -> node.startConnectionServer(Map.of()));
        }

        @Test
        @DisplayName("awaitManagerLifecycle returns once a started manager stops")
        void lifecycle() throws InterruptedException {
            loadRequiredCode();
            var returned = new CountDownLatch(1);
            var waiter = new Thread(() -> {
                try {
                    node.awaitManagerLifecycle();
                    returned.countDown();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            waiter.start();

            node.startManager(Map.of());
            assertFalse(returned.await(200, TimeUnit.MILLISECONDS));

            node.stopManager();
            assertTrue(returned.await(5, TimeUnit.SECONDS));
            assertFalse(node.isManagerRunning());
        }

        @Test
        @DisplayName("with auto termination the manager ends after its last server stops")
        void autoTermination() throws InterruptedException {
            loadRequiredCode();
            node.startManager(Map.of(NodeManager.AUTO_TERMINATION, true));
            node.startConnectionServer(Map.of("await_owner_millis", 100));

            var done = new Thread(() -> {
                try {
                    node.awaitManager();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            done.start();
            done.join(5000);

            assertFalse(done.isAlive());
            assertFalse(node.isManagerRunning());
        }
    }
}
