package com.cellblock.remote;

/**
 * Result of {@link EvaluatorSupervisor#startWorker}: either a running evaluator or the reason none was started.
 */
public record WorkerStart(Evaluator evaluator, String error) {

    public static WorkerStart ok(Evaluator evaluator) {
        return new WorkerStart(evaluator, null);
    }

    public static WorkerStart error(String reason) {
        return new WorkerStart(null, reason);
    }

    public boolean isOk() {
        return evaluator != null;
    }
}
