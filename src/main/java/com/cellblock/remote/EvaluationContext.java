package com.cellblock.remote;

import com.cellblock.remote.script.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bindings produced by one evaluation.
 *
 * <p>A context is mutated only by the evaluation that builds it. Once stored as completed it is
 * never touched again; every reader either only reads it or takes a deep copy.
 */
public final class EvaluationContext {

    private final Map<String, Object> bindings;

    private EvaluationContext(Map<String, Object> bindings) {
        this.bindings = bindings;
    }

    public static EvaluationContext empty() {
        return new EvaluationContext(new LinkedHashMap<>());
    }

    /**
     * Merges deep copies of the given contexts; later entries win on name clashes.
     */
    public static EvaluationContext fold(List<EvaluationContext> oldestFirst) {
        var merged = new LinkedHashMap<String, Object>();
        for (EvaluationContext context : oldestFirst) {
            merged.putAll(Values.copyBindings(context.bindings));
        }
        return new EvaluationContext(merged);
    }

    public EvaluationContext copy() {
        return new EvaluationContext(Values.copyBindings(bindings));
    }

    public Map<String, Object> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    Map<String, Object> mutableBindings() {
        return bindings;
    }
}
