package com.cellblock.runtime;

/**
 * The evaluator of a container terminated before answering. Submitting again to the same
 * container starts a fresh evaluator.
 */
public class ContainerDownException extends RuntimeException {

    private final String container;

    public ContainerDownException(String container, String message) {
        super(message);
        this.container = container;
    }

    public String container() {
        return container;
    }
}
