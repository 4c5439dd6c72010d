package com.cellblock.runtime;

import com.cellblock.core.events.EventBus;
import com.cellblock.core.metrics.CellblockMetrics;
import com.cellblock.wire.NodeAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RuntimeManagerTest {

    private RuntimeManager manager;

    @BeforeEach
    void setUp() {
        manager = new RuntimeManager(mock(IdentifierPool.class), mock(ParentHandshake.class),
                mock(RuntimeBootstrap.class), mock(NodeConnector.class), new EventBus(),
                mock(CellblockMetrics.class), new RuntimeProperties());
    }

    @Test
    @DisplayName("creates each runtime kind by name")
    void runtimeKinds() {
        assertInstanceOf(StandaloneRuntime.class, manager.runtime("standalone", null, null));
        assertInstanceOf(EmbeddedRuntime.class, manager.runtime("Embedded", null, null));
        var attached = assertInstanceOf(AttachedRuntime.class,
                manager.runtime("attached", new NodeAddress("10.0.0.5", 7000), "shared"));
        assertEquals(new NodeAddress("10.0.0.5", 7000), attached.address());
    }

    @Test
    void rejectsIncompleteOrUnknownKinds() {
        assertThrows(IllegalArgumentException.class, () -> manager.runtime("attached", null, "shared"));
        assertThrows(IllegalArgumentException.class,
                () -> manager.runtime("attached", new NodeAddress("10.0.0.5", 7000), " "));
        var e = assertThrows(IllegalArgumentException.class, () -> manager.runtime("docker", null, null));
        assertEquals("unknown runtime type: docker", e.getMessage());
    }

    @Test
    @DisplayName("duplicate yields an equivalent, independent runtime")
    void duplicate() {
        EmbeddedRuntime embedded = manager.embedded();
        var copy = assertInstanceOf(EmbeddedRuntime.class, embedded.duplicate());

        assertNotSame(embedded.node(), copy.node());
        assertEquals(embedded.describe(), copy.describe());
    }

    @Test
    @DisplayName("tracks connections until they end")
    void tracksConnections() {
        CellRuntime runtime = mock(CellRuntime.class);
        RuntimeConnection connection = mock(RuntimeConnection.class);
        when(runtime.connect()).thenReturn(connection);

        assertSame(connection, manager.connect(runtime));
        assertEquals(List.of(connection), manager.connections());

        ArgumentCaptor<Runnable> listener = ArgumentCaptor.forClass(Runnable.class);
        verify(connection).onDisconnect(listener.capture());
        listener.getValue().run();
        assertTrue(manager.connections().isEmpty());
    }

    @Test
    void disconnectAll() {
        CellRuntime runtime = mock(CellRuntime.class);
        RuntimeConnection connection = mock(RuntimeConnection.class);
        when(runtime.connect()).thenReturn(connection);
        manager.connect(runtime);

        manager.disconnectAll();

        verify(connection).disconnect();
        assertTrue(manager.connections().isEmpty());
    }
}
