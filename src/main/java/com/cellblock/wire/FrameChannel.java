package com.cellblock.wire;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bidirectional frame stream over one TCP socket.
 *
 * <p>Writes are serialised so several threads may {@link #send} concurrently.
 * Reads are expected from a single thread.
 */
public class FrameChannel implements Closeable {

    private final Socket socket;
    private final BufferedReader reader;
    private final Writer writer;
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FrameChannel(Socket socket) throws IOException {
        this.socket = socket;
        this.socket.setTcpNoDelay(true);
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Opens a channel to the given address.
     */
    public static FrameChannel connect(NodeAddress address, int connectTimeoutMillis) throws IOException {
        var socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(address.host(), address.port()), connectTimeoutMillis);
            return new FrameChannel(socket);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    public void send(Frame frame) throws IOException {
        String line = Frames.encode(frame);
        synchronized (writeLock) {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }
    }

    /**
     * Blocks for the next frame.
     *
     * @return the frame, or {@code null} once the peer closed the stream
     * @throws SocketTimeoutException when a read timeout is set and expires
     */
    public Frame receive() throws IOException {
        String line;
        do {
            line = reader.readLine();
            if (line == null) {
                return null;
            }
        } while (line.isBlank());
        return Frames.decode(line);
    }

    /**
     * Sets the read timeout for {@link #receive()}; zero waits forever.
     */
    public void setReadTimeout(int millis) throws IOException {
        socket.setSoTimeout(millis);
    }

    public boolean isOpen() {
        return !closed.get();
    }

    public String remoteAddress() {
        return String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                socket.close();
            } catch (IOException ignored) {
                // already broken
            }
        }
    }
}
