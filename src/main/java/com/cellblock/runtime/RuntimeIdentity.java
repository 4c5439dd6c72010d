package com.cellblock.runtime;

/**
 * Name under which a runtime is addressed.
 *
 * @param name      unique name, e.g. {@code "k3x9q2ab-cellblock"}
 * @param baseLabel human-readable part of the name
 * @param origin    whether the {@link IdentifierPool} made the name up or the caller supplied it
 */
public record RuntimeIdentity(String name, String baseLabel, Origin origin) {

    public enum Origin { SYNTHESIZED, EXTERNAL }

    public RuntimeIdentity {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("identity name cannot be blank");
        }
    }

    public boolean isSynthesized() {
        return origin == Origin.SYNTHESIZED;
    }

    @Override
    public String toString() {
        return name;
    }
}
