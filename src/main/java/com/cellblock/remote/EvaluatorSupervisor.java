package com.cellblock.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Flat one-for-one supervision of evaluators. Workers are started on demand and never restarted;
 * a worker's crash only removes that worker.
 */
public class EvaluatorSupervisor {

    private static final Logger log = LoggerFactory.getLogger(EvaluatorSupervisor.class);

    private final ThreadFactory threadFactory;
    private final int maxWorkers;
    private final Set<Evaluator> workers = ConcurrentHashMap.newKeySet();
    private volatile boolean stopped;

    /**
     * @param maxWorkers upper bound of live workers, 0 for no bound
     */
    public EvaluatorSupervisor(String name, int maxWorkers) {
        this(daemonThreads(name), maxWorkers);
    }

    public EvaluatorSupervisor(ThreadFactory threadFactory, int maxWorkers) {
        this.threadFactory = threadFactory;
        this.maxWorkers = maxWorkers;
    }

    private static ThreadFactory daemonThreads(String name) {
        var counter = new AtomicLong();
        return runnable -> {
            var thread = new Thread(runnable, name + "-evaluator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Starts exactly one evaluator. Failures are returned, not thrown, and leave other workers alone.
     */
    public synchronized WorkerStart startWorker(Evaluator.Options options) {
        if (stopped) {
            return WorkerStart.error("supervisor is stopped");
        }
        if (maxWorkers > 0 && workers.size() >= maxWorkers) {
            return WorkerStart.error("maximum of " + maxWorkers + " evaluators reached");
        }
        var evaluator = new Evaluator(options, this::onCrash);
        Thread thread;
        try {
            thread = threadFactory.newThread(evaluator::loop);
            if (thread == null) {
                return WorkerStart.error("thread factory refused to create a thread");
            }
            evaluator.bind(thread);
            workers.add(evaluator);
            thread.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            workers.remove(evaluator);
            log.warn("Cannot start evaluator for {}: {}", options.container(), e.getMessage());
            return WorkerStart.error("cannot start evaluator thread: " + e.getMessage());
        }
        log.debug("Started evaluator for {}", options.container());
        return WorkerStart.ok(evaluator);
    }

    /**
     * Removes the worker immediately. Safe to call on a worker that already exited.
     */
    public void terminateWorker(Evaluator evaluator) {
        if (evaluator == null) {
            return;
        }
        workers.remove(evaluator);
        evaluator.terminate();
    }

    public int activeWorkers() {
        return workers.size();
    }

    public List<Evaluator> workers() {
        return List.copyOf(workers);
    }

    public boolean isStopped() {
        return stopped;
    }

    /**
     * Terminates every worker and refuses new ones.
     */
    public synchronized void stop() {
        stopped = true;
        for (Evaluator evaluator : List.copyOf(workers)) {
            terminateWorker(evaluator);
        }
    }

    private void onCrash(Evaluator evaluator, String reason, List<String> evaluations) {
        workers.remove(evaluator);
        try {
            evaluator.options().crashListener().onCrash(evaluator, reason, evaluations);
        } catch (RuntimeException e) {
            log.warn("Crash listener failed for {}", evaluator.container(), e);
        }
    }
}
