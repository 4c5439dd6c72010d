package com.cellblock.node;

import com.cellblock.wire.CodeUnit;
import com.cellblock.wire.ServerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * State of one runtime: its name, the code pushed to it and its management process.
 *
 * <p>A node lives in the runtime JVM, behind a {@link ControlEndpoint}. The embedded
 * runtime also creates one inside the coordinator.
 */
public class Node {

    private static final Logger log = LoggerFactory.getLogger(Node.class);

    public static final String MANAGER_NAME = "node-manager";
    public static final String MANAGER_CLASS = "com.cellblock.remote.NodeManager";

    private final String name;
    private final ClassLoader parentLoader;
    private volatile NodeCodeLoader codeLoader;
    private ManagementProcess manager;

    public Node(String name) {
        this(name, Node.class.getClassLoader());
    }

    public Node(String name, ClassLoader parentLoader) {
        this.name = name;
        this.parentLoader = parentLoader;
        this.codeLoader = new NodeCodeLoader(parentLoader);
    }

    public String name() {
        return name;
    }

    public static String platformVersion() {
        return System.getProperty("java.specification.version");
    }

    public boolean isCodePresent(String unit) {
        return codeLoader.contains(unit);
    }

    public void loadCode(CodeUnit unit) {
        codeLoader.register(unit.name(), unit.binary());
        log.debug("Loaded {} ({} bytes) into {}", unit.name(), unit.binary().length, name);
    }

    public NodeCodeLoader codeLoader() {
        return codeLoader;
    }

    public synchronized boolean isManagerRunning() {
        return manager != null && manager.isAlive();
    }

    /**
     * Id of the live management process, or {@code null} when none is running.
     */
    public synchronized String managerId() {
        return isManagerRunning() ? manager.id() : null;
    }

    /**
     * Starts the management process from the pushed code. A no-op returning the existing id
     * when one is already running.
     *
     * @throws IllegalStateException when the management code has not been loaded
     */
    public synchronized String startManager(Map<String, Object> options) {
        if (isManagerRunning()) {
            return manager.id();
        }
        ManagementProcess process = instantiateManager();
        process.start(options == null ? Map.of() : options);
        manager = process;
        notifyAll();
        log.info("Started {} {} on {}", MANAGER_NAME, process.id(), name);
        return process.id();
    }

    private ManagementProcess instantiateManager() {
        if (!codeLoader.contains(MANAGER_CLASS)) {
            throw new IllegalStateException("management code is not loaded on " + name);
        }
        try {
            Class<?> type = codeLoader.loadClass(MANAGER_CLASS);
            Object instance = type.getConstructor(Node.class).newInstance(this);
            return (ManagementProcess) instance;
        } catch (ClassNotFoundException | NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("cannot create " + MANAGER_NAME + ": " + e.getMessage(), e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("cannot create " + MANAGER_NAME + ": " + e.getCause(), e.getCause());
        }
    }

    public ServerHandle startConnectionServer(Map<String, Object> options) {
        ManagementProcess process;
        synchronized (this) {
            if (!isManagerRunning()) {
                throw new IllegalStateException(MANAGER_NAME + " is not running on " + name);
            }
            process = manager;
        }
        return process.startConnectionServer(options == null ? Map.of() : options);
    }

    /**
     * Stops the management process and waits briefly for it to finish.
     */
    public void stopManager() {
        ManagementProcess process;
        synchronized (this) {
            process = manager;
        }
        if (process == null) {
            return;
        }
        process.stop();
        try {
            if (!process.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} {} did not stop within 5s", MANAGER_NAME, process.id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Blocks until the current management process terminates. Returns at once when none runs.
     */
    public void awaitManager() throws InterruptedException {
        ManagementProcess process;
        synchronized (this) {
            process = manager;
        }
        if (process != null) {
            process.awaitTermination();
        }
    }

    /**
     * Blocks until a management process has been started, then until it terminates.
     */
    public void awaitManagerLifecycle() throws InterruptedException {
        ManagementProcess process;
        synchronized (this) {
            while (manager == null) {
                wait();
            }
            process = manager;
        }
        process.awaitTermination();
    }

    /**
     * Drops every pushed code unit.
     *
     * @return the number of units removed
     * @throws IllegalStateException while the management process still runs
     */
    public synchronized int purgeCode() {
        if (isManagerRunning()) {
            throw new IllegalStateException("cannot unload code while " + MANAGER_NAME + " is running");
        }
        int removed = codeLoader.size();
        codeLoader = new NodeCodeLoader(parentLoader);
        manager = null;
        log.debug("Purged {} code units from {}", removed, name);
        return removed;
    }
}
