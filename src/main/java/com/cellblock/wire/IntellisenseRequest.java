package com.cellblock.wire;

import java.util.List;

/**
 * A side request answered from stored bindings without running code.
 *
 * @param kind           {@code completion}, {@code details}, {@code signature} or {@code format}
 * @param hint           text under the cursor, or the code to format
 * @param parentLocators evaluations whose bindings are visible, most recent first
 */
public record IntellisenseRequest(String kind, String hint, List<Locator> parentLocators) {

    public IntellisenseRequest {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be blank");
        }
        hint = hint == null ? "" : hint;
        parentLocators = parentLocators == null ? List.of() : List.copyOf(parentLocators);
    }
}
