package com.cellblock.runtime;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * The wait-set of one pending handshake. Once closed, further signals are refused, which is how
 * the handshake stops observing a source.
 */
public class HandshakeMailbox implements AutoCloseable {

    private final String identity;
    private final BlockingQueue<HandshakeSignal> signals = new LinkedBlockingQueue<>();
    private final Runnable onClose;
    private volatile boolean closed;

    HandshakeMailbox(String identity, Runnable onClose) {
        this.identity = identity;
        this.onClose = onClose;
    }

    public String identity() {
        return identity;
    }

    /**
     * @return {@code false} when the mailbox is already closed
     */
    public boolean offer(HandshakeSignal signal) {
        if (closed) {
            return false;
        }
        return signals.offer(signal);
    }

    /**
     * Next signal, or {@code null} once {@code timeoutMillis} elapsed without one.
     */
    public HandshakeSignal poll(long timeoutMillis) throws InterruptedException {
        return signals.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            onClose.run();
            // release announcers still parked in the queue
            HandshakeSignal leftover;
            while ((leftover = signals.poll()) != null) {
                if (leftover instanceof HandshakeSignal.Ready ready) {
                    ready.reject();
                }
            }
        }
    }
}
