package com.cellblock.wire;

/**
 * Outcome of one evaluation.
 *
 * @param output           rendered result of the last expression plus anything printed
 * @param error            error message when the code failed, otherwise {@code null}
 * @param evaluationTimeMs wall clock time spent running the code
 */
public record EvaluationResponse(String container,
                                 String evaluation,
                                 String output,
                                 String error,
                                 long evaluationTimeMs) {

    public static EvaluationResponse success(Locator locator, String output, long evaluationTimeMs) {
        return new EvaluationResponse(locator.container(), locator.evaluation(), output, null, evaluationTimeMs);
    }

    public static EvaluationResponse failure(Locator locator, String output, String error, long evaluationTimeMs) {
        return new EvaluationResponse(locator.container(), locator.evaluation(), output, error, evaluationTimeMs);
    }

    public boolean failed() {
        return error != null;
    }

    public Locator locator() {
        return new Locator(container, evaluation);
    }
}
