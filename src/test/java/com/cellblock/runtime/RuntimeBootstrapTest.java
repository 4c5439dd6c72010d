package com.cellblock.runtime;

import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.node.CodeLoadException;
import com.cellblock.node.Node;
import com.cellblock.wire.CodeUnit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RuntimeBootstrapTest {

    private SimpleMeterRegistry registry;
    private RuntimeBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        bootstrap = new RuntimeBootstrap(new CellblockMetrics(registry));
    }

    private double bootstraps(boolean codeLoaded) {
        var counter = registry.find("cellblock.bootstrap.total").tag("code_loaded", String.valueOf(codeLoaded)).counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("against an in-process node")
    class InProcess {

        private Node node;

        @BeforeEach
        void setUp() {
            node = new Node("bootstrap-test");
        }

        @AfterEach
        void tearDown() {
            node.stopManager();
        }

        @Test
        @DisplayName("loads the code, starts the manager and a connection server")
        void firstBootstrap() {
            BootstrapResult result = bootstrap.bootstrap(new LocalNodeControl(node), Map.of(), Map.of());

            assertTrue(node.isCodePresent(RequiredCode.MARKER_UNIT));
            assertEquals(node.managerId(), result.managerId());
            assertNotNull(result.server());
            assertEquals(1, bootstraps(true));
        }

        @Test
        @DisplayName("bootstrapping again skips loading and reuses the manager")
        void idempotent() {
            BootstrapResult first = bootstrap.bootstrap(new LocalNodeControl(node), Map.of(), Map.of());
            NodeControl control = spy(new LocalNodeControl(node));

            BootstrapResult second = bootstrap.bootstrap(control, Map.of(), Map.of());

            verify(control, never()).loadCode(any());
            verify(control, never()).startManagementProcess(any());
            assertEquals(first.managerId(), second.managerId());
            assertNotEquals(first.server().serverId(), second.server().serverId());
            assertEquals(1, bootstraps(false));
        }

        @Test
        @DisplayName("unloading stops the manager and purges the code")
        void unload() {
            bootstrap.bootstrap(new LocalNodeControl(node), Map.of(), Map.of());

            int purged = bootstrap.unloadRequiredCode(node);

            assertEquals(RequiredCode.scan().units().size(), purged);
            assertFalse(node.isManagerRunning());
            assertFalse(node.isCodePresent(RequiredCode.MARKER_UNIT));

            BootstrapResult again = bootstrap.bootstrap(new LocalNodeControl(node), Map.of(), Map.of());
            assertNotNull(again.managerId());
            assertEquals(2, bootstraps(true));
        }
    }

    @Nested
    @DisplayName("load failures")
    class LoadFailures {

        private final String firstUnit = RequiredCode.scan().units().get(0).name();

        private NodeControl rejectingNode(String remoteVersion) {
            NodeControl node = mock(NodeControl.class);
            when(node.isCodePresent(RequiredCode.MARKER_UNIT)).thenReturn(false);
            doThrow(new CodeLoadException(firstUnit, "unsupported class file version 61"))
                    .when(node).loadCode(any(CodeUnit.class));
            when(node.platformVersion()).thenReturn(remoteVersion);
            return node;
        }

        @Test
        @DisplayName("a version mismatch is named in the error")
        void versionMismatch() {
            NodeControl node = rejectingNode("1.8");

            var e = assertThrows(BootstrapException.class, () -> bootstrap.bootstrap(node, Map.of(), Map.of()));

            assertTrue(e.isVersionMismatch());
            assertEquals("failed to load " + firstUnit
                    + " into the remote runtime, potentially due to Java version mismatch, reason: "
                    + "unsupported class file version 61 (local " + Node.platformVersion() + " != remote 1.8)",
                    e.getMessage());
            verify(node, never()).startManagementProcess(any());
        }

        @Test
        void sameVersion() {
            NodeControl node = rejectingNode(Node.platformVersion());

            var e = assertThrows(BootstrapException.class, () -> bootstrap.bootstrap(node, Map.of(), Map.of()));

            assertFalse(e.isVersionMismatch());
            assertEquals("failed to load " + firstUnit + " into the remote runtime, reason: unsupported class file version 61",
                    e.getMessage());
        }

        @Test
        @DisplayName("an unreadable remote version is treated as equal")
        void unreadableVersion() {
            NodeControl node = rejectingNode("x");
            when(node.platformVersion()).thenThrow(new IllegalStateException("gone"));

            var e = assertThrows(BootstrapException.class, () -> bootstrap.bootstrap(node, Map.of(), Map.of()));

            assertFalse(e.isVersionMismatch());
        }
    }
}
