package com.cellblock.remote;

import com.cellblock.core.logging.MdcContext;
import com.cellblock.remote.script.Interpreter;
import com.cellblock.remote.script.ScriptException;
import com.cellblock.remote.script.SignalBoard;
import com.cellblock.remote.script.WorkerExit;
import com.cellblock.wire.EvaluationResponse;
import com.cellblock.wire.Locator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * The worker of one container.
 *
 * <p>Requests are queued and executed one at a time on the evaluator's own thread, so evaluations
 * of a container run strictly in submission order. Completed contexts are kept in a concurrent
 * map, which lets other containers and side requests read them without waiting in the queue.
 *
 * <p>Errors raised by the code become error responses. Anything else escaping an evaluation, or
 * {@link #kill()}, ends the worker and is reported exactly once through the crash listener.
 * {@link #terminate()} ends it without a report.
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    /**
     * Looks up a completed evaluation anywhere in the server.
     */
    @FunctionalInterface
    public interface ContextResolver {
        Optional<EvaluationContext> completed(Locator locator);
    }

    @FunctionalInterface
    public interface CrashListener {
        /**
         * @param evaluations refs that were running or queued and will never get a response
         */
        void onCrash(Evaluator evaluator, String reason, List<String> evaluations);
    }

    public record Options(String container,
                          SignalBoard signals,
                          ContextResolver resolver,
                          Consumer<EvaluationResponse> responses,
                          CrashListener crashListener) {
    }

    private final Options options;
    private final CrashListener crashListener;
    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    // evaluations accepted but not answered yet, guarded by lock
    private final Set<String> unanswered = new LinkedHashSet<>();
    private final ConcurrentHashMap<String, EvaluationContext> completed = new ConcurrentHashMap<>();
    private final AtomicBoolean reported = new AtomicBoolean(false);
    private final CountDownLatch exited = new CountDownLatch(1);
    private final Object lock = new Object();
    private volatile Thread thread;
    private volatile boolean alive = true;
    private volatile boolean killed;
    private volatile boolean terminated;

    Evaluator(Options options, CrashListener crashListener) {
        this.options = options;
        this.crashListener = crashListener;
    }

    void bind(Thread thread) {
        this.thread = thread;
    }

    public String container() {
        return options.container();
    }

    Options options() {
        return options;
    }

    /**
     * Queues an evaluation.
     *
     * @return {@code false} when the evaluator has already exited
     */
    public boolean evaluate(String evaluationRef, String code, List<Locator> parentLocators) {
        var locator = new Locator(options.container(), evaluationRef);
        synchronized (lock) {
            if (!enqueue(() -> runEvaluation(locator, code, parentLocators))) {
                return false;
            }
            unanswered.add(evaluationRef);
            return true;
        }
    }

    /**
     * Drops the stored context of an evaluation once everything queued before has run.
     */
    public boolean forget(String evaluationRef) {
        return enqueue(() -> completed.remove(evaluationRef));
    }

    private boolean enqueue(Runnable task) {
        synchronized (lock) {
            if (!alive) {
                return false;
            }
            queue.add(task);
            return true;
        }
    }

    public Optional<EvaluationContext> completed(String evaluationRef) {
        return Optional.ofNullable(completed.get(evaluationRef));
    }

    public boolean isAlive() {
        return alive;
    }

    /**
     * Ends the worker abruptly and reports it as a crash.
     */
    public void kill() {
        killed = true;
        interrupt();
    }

    /**
     * Ends the worker abruptly without reporting. Queued work is discarded.
     */
    void terminate() {
        terminated = true;
        interrupt();
    }

    private void interrupt() {
        Thread current = thread;
        if (current != null) {
            current.interrupt();
        }
    }

    public boolean awaitExit(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    void loop() {
        MdcContext.setContainer(null, options.container());
        String crash = null;
        try {
            while (!terminated && !killed) {
                queue.take().run();
            }
            if (killed) {
                crash = "evaluator killed";
            }
        } catch (InterruptedException e) {
            crash = killed ? "evaluator killed" : "evaluator interrupted";
        } catch (WorkerExit e) {
            crash = killed ? "evaluator killed" : e.getMessage();
        } catch (Throwable t) {
            crash = t.getClass().getName() + (t.getMessage() != null ? ": " + t.getMessage() : "");
            log.error("Evaluator of {} crashed", options.container(), t);
        } finally {
            int dropped;
            List<String> lost;
            synchronized (lock) {
                alive = false;
                dropped = queue.size();
                queue.clear();
                lost = List.copyOf(unanswered);
                unanswered.clear();
            }
            if (dropped > 0) {
                log.debug("Discarded {} queued requests of {}", dropped, options.container());
            }
            if (crash != null && !terminated) {
                report(crash, lost);
            }
            MdcContext.clear();
            exited.countDown();
        }
    }

    private void report(String reason, List<String> lost) {
        if (reported.compareAndSet(false, true)) {
            log.warn("Container {} down: {} (lost {})", options.container(), reason, lost);
            crashListener.onCrash(this, reason, lost);
        }
    }

    private void runEvaluation(Locator locator, String code, List<Locator> parentLocators) {
        MdcContext.setEvaluation(locator.container(), locator.evaluation());
        long started = System.nanoTime();
        EvaluationContext initial = EvaluationContext.fold(resolveParents(parentLocators));
        EvaluationContext working = initial.copy();
        var interpreter = new Interpreter(working.mutableBindings(), options.signals());
        EvaluationResponse response;
        try {
            var result = interpreter.run(code);
            completed.put(locator.evaluation(), working);
            response = EvaluationResponse.success(locator, result.rendered(), elapsedMillis(started));
        } catch (ScriptException e) {
            completed.put(locator.evaluation(), initial);
            response = EvaluationResponse.failure(locator, interpreter.printed(), e.getMessage(), elapsedMillis(started));
        } catch (RuntimeException e) {
            log.warn("Evaluation {} failed unexpectedly", locator, e);
            completed.put(locator.evaluation(), initial);
            response = EvaluationResponse.failure(locator, interpreter.printed(),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), elapsedMillis(started));
        } finally {
            MdcContext.clearEvaluation();
        }
        if (!terminated && !killed) {
            synchronized (lock) {
                unanswered.remove(locator.evaluation());
            }
            options.responses().accept(response);
        }
    }

    /**
     * Parents arrive most recent first and are folded oldest first. Unknown ones contribute nothing.
     */
    private List<EvaluationContext> resolveParents(List<Locator> parentLocators) {
        var contexts = new ArrayList<EvaluationContext>(parentLocators.size());
        for (int i = parentLocators.size() - 1; i >= 0; i--) {
            Locator parent = parentLocators.get(i);
            Optional<EvaluationContext> context = parent.container().equals(options.container())
                    ? completed(parent.evaluation())
                    : options.resolver().completed(parent);
            if (context.isPresent()) {
                contexts.add(context.get());
            } else {
                log.warn("Parent evaluation {} is not available, skipping it", parent);
            }
        }
        return contexts;
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
