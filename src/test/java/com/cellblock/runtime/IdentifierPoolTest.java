package com.cellblock.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierPoolTest {

    private IdentifierPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("names are distinct and carry the base label")
    void distinctNames() {
        pool = new IdentifierPool(60_000);
        var names = new HashSet<String>();

        for (int i = 0; i < 1000; i++) {
            RuntimeIdentity identity = pool.acquire("cellblock");
            assertTrue(identity.name().matches("[a-z2-7]{8}-cellblock"), identity.name());
            assertEquals("cellblock", identity.baseLabel());
            assertTrue(identity.isSynthesized());
            names.add(identity.name());
        }

        assertEquals(1000, names.size());
        assertEquals(1000, pool.generatedCount());
    }

    @Test
    @DisplayName("a released name is reused once the buffer delay has passed")
    void reuseAfterBuffer() {
        pool = new IdentifierPool(0);
        RuntimeIdentity first = pool.acquire("cellblock");

        pool.notifyDisconnected(first);

        assertEquals(1, pool.freeCount());
        assertEquals(first, pool.acquire("cellblock"));
        assertEquals(0, pool.freeCount());
    }

    @Test
    @DisplayName("a released name stays out of circulation during the buffer delay")
    void notReusedWithinBuffer() throws InterruptedException {
        pool = new IdentifierPool(300);
        RuntimeIdentity first = pool.acquire("cellblock");

        pool.notifyDisconnected(first);

        assertNotEquals(first, pool.acquire("cellblock"));
        TimeUnit.MILLISECONDS.sleep(600);
        assertEquals(first, pool.acquire("cellblock"));
    }

    @Test
    @DisplayName("the most recently freed name is handed out first")
    void mostRecentlyFreedFirst() {
        pool = new IdentifierPool(0);
        RuntimeIdentity a = pool.acquire("cellblock");
        RuntimeIdentity b = pool.acquire("cellblock");

        pool.notifyDisconnected(a);
        pool.notifyDisconnected(b);

        assertEquals(b, pool.acquire("cellblock"));
        assertEquals(a, pool.acquire("cellblock"));
    }

    @Test
    @DisplayName("external names are never recycled")
    void externalNamesDiscarded() {
        pool = new IdentifierPool(0);
        RuntimeIdentity external = pool.external("shared-runtime");

        pool.notifyDisconnected(external);

        assertFalse(external.isSynthesized());
        assertEquals(0, pool.freeCount());
        assertNotEquals(external, pool.acquire("shared-runtime"));
    }

    @Test
    @DisplayName("a name reported twice is freed once")
    void doubleReleaseIgnored() {
        pool = new IdentifierPool(0);
        RuntimeIdentity identity = pool.acquire("cellblock");

        pool.notifyDisconnected(identity);
        pool.notifyDisconnected(identity);

        assertEquals(1, pool.freeCount());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> new IdentifierPool(-1));
        pool = new IdentifierPool(0);
        assertThrows(IllegalArgumentException.class, () -> pool.acquire(" "));
    }
}
