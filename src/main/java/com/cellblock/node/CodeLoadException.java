package com.cellblock.node;

/**
 * A code unit was rejected by the node it was shipped to.
 */
public class CodeLoadException extends RuntimeException {

    private final String unit;

    public CodeLoadException(String unit, String reason) {
        super(reason);
        this.unit = unit;
    }

    public String unit() {
        return unit;
    }
}
