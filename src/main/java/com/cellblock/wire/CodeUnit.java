package com.cellblock.wire;

import java.util.Arrays;
import java.util.Objects;

/**
 * Binary form of one class, shipped to a runtime during bootstrap.
 */
public record CodeUnit(String name, byte[] binary) {

    public CodeUnit {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(binary, "binary");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CodeUnit other && name.equals(other.name) && Arrays.equals(binary, other.binary);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(binary);
    }

    @Override
    public String toString() {
        return "CodeUnit[" + name + ", " + binary.length + " bytes]";
    }
}
