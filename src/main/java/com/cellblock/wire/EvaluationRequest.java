package com.cellblock.wire;

import java.util.List;
import java.util.Map;

/**
 * Code submitted to one container.
 *
 * @param parentLocators earlier evaluations whose bindings seed this one, most recent first
 */
public record EvaluationRequest(String container,
                                String evaluation,
                                String code,
                                List<Locator> parentLocators,
                                Map<String, Object> options) {

    public EvaluationRequest {
        parentLocators = parentLocators == null ? List.of() : List.copyOf(parentLocators);
        options = options == null ? Map.of() : Map.copyOf(options);
        if (code == null) {
            code = "";
        }
    }

    public Locator locator() {
        return new Locator(container, evaluation);
    }
}
