package com.cellblock.remote.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helpers for cell values: {@code Long}, {@code String}, {@code Boolean}, {@code null},
 * {@code List<Object>} and {@code Map<Object, Object>}.
 */
public final class Values {

    private Values() {}

    public static String typeName(Object value) {
        if (value == null) return "nil";
        if (value instanceof Long) return "int";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "bool";
        if (value instanceof List) return "list";
        if (value instanceof Map) return "map";
        return value.getClass().getSimpleName();
    }

    /**
     * Source-like rendering; strings are quoted.
     */
    public static String render(Object value) {
        if (value == null) return "nil";
        if (value instanceof String s) return quote(s);
        if (value instanceof List<?> list) {
            var joiner = new StringJoiner(", ", "[", "]");
            list.forEach(item -> joiner.add(render(item)));
            return joiner.toString();
        }
        if (value instanceof Map<?, ?> map) {
            var joiner = new StringJoiner(", ", "{", "}");
            map.forEach((k, v) -> joiner.add(render(k) + ": " + render(v)));
            return joiner.toString();
        }
        return String.valueOf(value);
    }

    /**
     * Like {@link #render} but strings come out unquoted.
     */
    public static String text(Object value) {
        return value instanceof String s ? s : render(value);
    }

    /**
     * Copies lists and maps recursively. Scalars are immutable and shared.
     */
    @SuppressWarnings("unchecked")
    public static Object deepCopy(Object value) {
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<Object, Object>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(deepCopy(entry.getKey()), deepCopy(entry.getValue()));
            }
            return copy;
        }
        return value;
    }

    public static Map<String, Object> copyBindings(Map<String, Object> bindings) {
        var copy = new LinkedHashMap<String, Object>();
        bindings.forEach((name, value) -> copy.put(name, deepCopy(value)));
        return copy;
    }

    static String quote(String s) {
        var out = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }
}
