package com.cellblock.remote;

import com.cellblock.remote.intellisense.Intellisense;
import com.cellblock.remote.script.SignalBoard;
import com.cellblock.wire.EvaluationResponse;
import com.cellblock.wire.IntellisenseRequest;
import com.cellblock.wire.IntellisenseResponse;
import com.cellblock.wire.Locator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Serves one coordinator connection: maps containers to evaluators and relays their results
 * to the attached owner.
 *
 * <p>The server expects an owner within {@code await_owner_millis} of starting and stops when none
 * attaches. Stopping terminates every evaluator and notifies the owner and stop listeners.
 */
public class RuntimeServer {

    private static final Logger log = LoggerFactory.getLogger(RuntimeServer.class);

    public static final String AWAIT_OWNER_MILLIS = "await_owner_millis";
    public static final String MAX_WORKERS = "max_workers";
    public static final long DEFAULT_AWAIT_OWNER_MILLIS = 5000;

    private final String id;
    private final long awaitOwnerMillis;
    private final EvaluatorSupervisor supervisor;
    private final Map<String, Evaluator> evaluators = new ConcurrentHashMap<>();
    private final SignalBoard signals = new SignalBoard();
    private final ExecutorService sideRequests;
    private final ScheduledExecutorService timer;
    private final List<Consumer<RuntimeServer>> stopListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch stoppedLatch = new CountDownLatch(1);
    private volatile RuntimeOwner owner;

    public RuntimeServer(String id, Map<String, Object> options) {
        this(id, options, new EvaluatorSupervisor(id, intOption(options, MAX_WORKERS, 0)));
    }

    RuntimeServer(String id, Map<String, Object> options, EvaluatorSupervisor supervisor) {
        this.id = id;
        this.awaitOwnerMillis = longOption(options, AWAIT_OWNER_MILLIS, DEFAULT_AWAIT_OWNER_MILLIS);
        this.supervisor = supervisor;
        this.sideRequests = Executors.newCachedThreadPool(daemon(id + "-intellisense"));
        this.timer = Executors.newSingleThreadScheduledExecutor(daemon(id + "-timer"));
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            var thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    public String id() {
        return id;
    }

    /**
     * Starts the owner deadline.
     */
    public void start() {
        timer.schedule(() -> {
            if (owner == null && !stopped.get()) {
                log.info("No owner attached to {} within {}ms, stopping", id, awaitOwnerMillis);
                stop();
            }
        }, awaitOwnerMillis, TimeUnit.MILLISECONDS);
    }

    public void onStopped(Consumer<RuntimeServer> listener) {
        stopListeners.add(listener);
    }

    /**
     * Makes {@code newOwner} the receiver of all notifications. A server has one owner for life.
     */
    public synchronized void attach(RuntimeOwner newOwner) {
        if (stopped.get()) {
            throw new IllegalStateException("runtime server " + id + " is stopped");
        }
        if (owner != null && owner != newOwner) {
            throw new IllegalStateException("runtime server " + id + " already has an owner");
        }
        owner = newOwner;
        log.debug("Owner attached to {}", id);
    }

    public boolean hasOwner() {
        return owner != null;
    }

    /**
     * Queues code on the container's evaluator, starting one when the container has none.
     * The response reaches the owner asynchronously.
     */
    public void evaluateCode(String container, String evaluation, String code,
                             List<Locator> parentLocators, Map<String, Object> options) {
        requireRunning();
        var locator = new Locator(container, evaluation);
        List<Locator> parents = parentLocators == null ? List.of() : parentLocators;
        // a dying evaluator refuses work; retry once on a fresh one
        for (int attempt = 0; attempt < 2; attempt++) {
            WorkerStart worker = evaluatorFor(container);
            if (!worker.isOk()) {
                deliver(EvaluationResponse.failure(locator, "", "cannot start evaluator: " + worker.error(), 0));
                return;
            }
            if (worker.evaluator().evaluate(evaluation, code, parents)) {
                return;
            }
        }
        deliver(EvaluationResponse.failure(locator, "", "evaluator for " + container + " is not accepting work", 0));
    }

    private synchronized WorkerStart evaluatorFor(String container) {
        Evaluator existing = evaluators.get(container);
        if (existing != null && existing.isAlive()) {
            return WorkerStart.ok(existing);
        }
        WorkerStart start = supervisor.startWorker(new Evaluator.Options(
                container, signals, this::completed, this::deliver, this::onEvaluatorCrash));
        if (start.isOk()) {
            evaluators.put(container, start.evaluator());
        }
        return start;
    }

    private Optional<EvaluationContext> completed(Locator locator) {
        Evaluator evaluator = evaluators.get(locator.container());
        return evaluator == null ? Optional.empty() : evaluator.completed(locator.evaluation());
    }

    private synchronized void onEvaluatorCrash(Evaluator evaluator, String reason, List<String> evaluations) {
        evaluators.remove(evaluator.container(), evaluator);
        RuntimeOwner current = owner;
        if (current != null && !stopped.get()) {
            current.onContainerDown(evaluator.container(), reason, evaluations);
        }
    }

    private void deliver(EvaluationResponse response) {
        RuntimeOwner current = owner;
        if (current != null) {
            current.onEvaluationResponse(response);
        } else {
            log.debug("Dropping response for {} with no owner attached", response.locator());
        }
    }

    public void forgetEvaluation(Locator locator) {
        Evaluator evaluator = evaluators.get(locator.container());
        if (evaluator != null) {
            evaluator.forget(locator.evaluation());
        }
    }

    /**
     * Terminates the container's evaluator without reporting it down.
     */
    public synchronized void dropContainer(String container) {
        Evaluator evaluator = evaluators.remove(container);
        supervisor.terminateWorker(evaluator);
    }

    public byte[] readFile(String path) throws IOException {
        return Files.readAllBytes(Path.of(path));
    }

    /**
     * Answers a side request on a separate pool, reading completed bindings without mutating them.
     */
    public CompletableFuture<IntellisenseResponse> handleIntellisense(IntellisenseRequest request) {
        var view = new LinkedHashMap<String, Object>();
        List<Locator> parents = request.parentLocators();
        for (int i = parents.size() - 1; i >= 0; i--) {
            completed(parents.get(i)).ifPresent(context -> view.putAll(context.bindings()));
        }
        try {
            return CompletableFuture.supplyAsync(() -> Intellisense.handle(request, view), sideRequests);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("runtime server " + id + " is stopped"));
        }
    }

    public Map<String, Evaluator> evaluators() {
        return Map.copyOf(evaluators);
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return stoppedLatch.await(timeout, unit);
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping runtime server {}", id);
        synchronized (this) {
            supervisor.stop();
            evaluators.clear();
        }
        timer.shutdownNow();
        sideRequests.shutdownNow();
        RuntimeOwner current = owner;
        if (current != null) {
            current.onServerStopped(id);
        }
        for (Consumer<RuntimeServer> listener : stopListeners) {
            try {
                listener.accept(this);
            } catch (RuntimeException e) {
                log.warn("Stop listener of {} failed", id, e);
            }
        }
        stoppedLatch.countDown();
    }

    private void requireRunning() {
        if (stopped.get()) {
            throw new IllegalStateException("runtime server " + id + " is stopped");
        }
    }

    private static long longOption(Map<String, Object> options, String key, long fallback) {
        Object value = options == null ? null : options.get(key);
        return value instanceof Number n ? n.longValue() : fallback;
    }

    private static int intOption(Map<String, Object> options, String key, int fallback) {
        return (int) longOption(options, key, fallback);
    }
}
