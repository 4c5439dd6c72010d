package com.cellblock.runtime;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Issues runtime names and recycles the ones it generated.
 *
 * <p>Runtime names are never reclaimed on their own, so a long-running coordinator that keeps
 * spawning runtimes reuses them. A disconnected name returns to the free list only after a
 * buffer delay, so messages still in flight to the old runtime cannot reach a new one.
 *
 * <p>All state is owned by a single scheduler thread; callers only submit tasks to it.
 */
@Service
public class IdentifierPool {

    private static final Logger log = LoggerFactory.getLogger(IdentifierPool.class);

    private static final char[] BASE32 = "abcdefghijklmnopqrstuvwxyz234567".toCharArray();

    private final long bufferMillis;
    private final ScheduledExecutorService executor;
    private final SecureRandom random = new SecureRandom();

    // confined to the executor thread
    private final Deque<RuntimeIdentity> free = new ArrayDeque<>();
    private final Set<String> generated = new HashSet<>();

    @Autowired
    public IdentifierPool(RuntimeProperties properties) {
        this(properties.getNameBufferMillis());
    }

    public IdentifierPool(long bufferMillis) {
        if (bufferMillis < 0) {
            throw new IllegalArgumentException("buffer delay cannot be negative");
        }
        this.bufferMillis = bufferMillis;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "identifier-pool");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Returns the most recently freed generated identity, or a new {@code "<random>-<baseLabel>"} one.
     */
    public RuntimeIdentity acquire(String baseLabel) {
        if (baseLabel == null || baseLabel.isBlank()) {
            throw new IllegalArgumentException("base label cannot be blank");
        }
        return call(() -> {
            RuntimeIdentity recycled = free.pollFirst();
            if (recycled != null) {
                log.debug("Reusing runtime name {}", recycled.name());
                return recycled;
            }
            String name;
            do {
                name = randomShortId() + "-" + baseLabel;
            } while (generated.contains(name));
            generated.add(name);
            return new RuntimeIdentity(name, baseLabel, RuntimeIdentity.Origin.SYNTHESIZED);
        });
    }

    /**
     * Wraps a caller-supplied name. Such names are never recycled.
     */
    public RuntimeIdentity external(String name) {
        return new RuntimeIdentity(name, name, RuntimeIdentity.Origin.EXTERNAL);
    }

    /**
     * Reports that the runtime holding {@code identity} is gone.
     */
    public void notifyDisconnected(RuntimeIdentity identity) {
        executor.execute(() -> {
            if (!identity.isSynthesized() || !generated.contains(identity.name())) {
                log.debug("Discarding external runtime name {}", identity.name());
                return;
            }
            if (bufferMillis == 0) {
                release(identity);
            } else {
                executor.schedule(() -> release(identity), bufferMillis, TimeUnit.MILLISECONDS);
            }
        });
    }

    private void release(RuntimeIdentity identity) {
        boolean alreadyFree = free.stream().anyMatch(candidate -> candidate.name().equals(identity.name()));
        if (!alreadyFree) {
            free.addFirst(identity);
            log.debug("Runtime name {} is free again", identity.name());
        }
    }

    public int freeCount() {
        return call(free::size);
    }

    public int generatedCount() {
        return call(generated::size);
    }

    public long bufferMillis() {
        return bufferMillis;
    }

    private String randomShortId() {
        byte[] bytes = new byte[5];
        random.nextBytes(bytes);
        long bits = 0;
        for (byte b : bytes) {
            bits = (bits << 8) | (b & 0xFF);
        }
        var id = new StringBuilder(8);
        for (int shift = 35; shift >= 0; shift -= 5) {
            id.append(BASE32[(int) ((bits >>> shift) & 0x1F)]);
        }
        return id.toString();
    }

    private <T> T call(Callable<T> task) {
        try {
            return executor.submit(task).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for the identifier pool", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("identifier pool task failed", e.getCause());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
