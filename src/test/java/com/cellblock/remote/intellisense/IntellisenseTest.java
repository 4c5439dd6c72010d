package com.cellblock.remote.intellisense;

import com.cellblock.wire.IntellisenseRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntellisenseTest {

    private static final Map<String, Object> BINDINGS = new LinkedHashMap<>(Map.of(
            "total", 12L,
            "tags", List.of("a", "b")));

    private static IntellisenseRequest request(String kind, String hint) {
        return new IntellisenseRequest(kind, hint, List.of());
    }

    @Test
    @DisplayName("completion offers bindings and builtins matching the prefix")
    void completion() {
        var response = Intellisense.handle(request("completion", "x = t"), BINDINGS);
        assertEquals(List.of("tags", "total", "type"), response.items());
    }

    @Test
    @DisplayName("details describe a binding")
    void detailsOfBinding() {
        var response = Intellisense.handle(request("details", "tags"), BINDINGS);
        assertEquals("tags : list = [\"a\", \"b\"]", response.content());
    }

    @Test
    @DisplayName("details document a builtin")
    void detailsOfBuiltin() {
        var response = Intellisense.handle(request("details", "append"), BINDINGS);
        assertTrue(response.content().startsWith("append(list, value)"));
    }

    @Test
    @DisplayName("signature of the innermost open call")
    void signature() {
        var response = Intellisense.handle(request("signature", "print(len(tags), put("), BINDINGS);
        assertEquals(List.of("put(map, key, value)"), response.items());
        assertEquals(List.of(), Intellisense.handle(request("signature", "len(x)"), BINDINGS).items());
    }

    @Test
    @DisplayName("format prints canonical layout")
    void format() {
        var response = Intellisense.handle(request("format", "x=[1,2];print( x[0]+1 )"), BINDINGS);
        assertEquals("x = [1, 2]\nprint(x[0] + 1)", response.content());
    }

    @Test
    @DisplayName("format of broken code has no content")
    void formatBroken() {
        assertNull(Intellisense.handle(request("format", "x = ("), BINDINGS).content());
    }

    @Test
    @DisplayName("unknown kinds are rejected")
    void unknownKind() {
        assertThrows(IllegalArgumentException.class, () -> Intellisense.handle(request("hover", ""), BINDINGS));
    }
}
