package com.cellblock.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequiredCodeTest {

    private final RequiredCode code = RequiredCode.scan();

    @Test
    @DisplayName("the marker unit is loaded last")
    void markerLast() {
        List<String> names = code.unitNames();

        assertEquals(RequiredCode.MARKER_UNIT, names.get(names.size() - 1));
        assertEquals(1, names.stream().filter(RequiredCode.MARKER_UNIT::equals).count());
    }

    @Test
    @DisplayName("covers the runtime server, the interpreter and nested classes")
    void coversRemotePackages() {
        List<String> names = code.unitNames();

        assertTrue(names.contains("com.cellblock.remote.RuntimeServer"));
        assertTrue(names.contains("com.cellblock.remote.script.Interpreter"));
        assertTrue(names.contains("com.cellblock.remote.intellisense.Intellisense"));
        assertTrue(names.stream().anyMatch(name -> name.contains("$")));
        assertTrue(names.stream().allMatch(name -> name.startsWith("com.cellblock.remote")));
    }

    @Test
    void binariesAreClassFiles() {
        code.units().forEach(unit -> {
            byte[] b = unit.binary();
            assertEquals((byte) 0xCA, b[0], unit.name());
            assertEquals((byte) 0xFE, b[1], unit.name());
        });
    }
}
