package com.cellblock.wire;

/**
 * Points at one evaluation inside one container.
 */
public record Locator(String container, String evaluation) {

    public Locator {
        if (container == null || container.isBlank()) {
            throw new IllegalArgumentException("container cannot be blank");
        }
        if (evaluation == null || evaluation.isBlank()) {
            throw new IllegalArgumentException("evaluation cannot be blank");
        }
    }

    @Override
    public String toString() {
        return container + "/" + evaluation;
    }
}
