package com.cellblock.remote.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signatures and one-line documentation of the builtin functions.
 */
public final class Builtins {

    public record Builtin(String name, String signature, String doc) {}

    public static final Map<String, Builtin> ALL;

    static {
        var all = new LinkedHashMap<String, Builtin>();
        add(all, "len", "len(value)", "Length of a string, list or map.");
        add(all, "str", "str(value)", "Text form of a value.");
        add(all, "type", "type(value)", "Type name: int, string, bool, nil, list or map.");
        add(all, "print", "print(values...)", "Writes the values, separated by spaces, to the evaluation output.");
        add(all, "append", "append(list, value)", "Adds value to the end of list in place and returns the list.");
        add(all, "put", "put(map, key, value)", "Stores value under key in place and returns the map.");
        add(all, "sleep", "sleep(millis)", "Pauses the evaluation.");
        add(all, "await", "await(name)", "Blocks until the named gate is signalled.");
        add(all, "signal", "signal(name)", "Opens the named gate for every waiter.");
        add(all, "raise", "raise(message)", "Fails the evaluation with message.");
        add(all, "exit", "exit(reason)", "Terminates the evaluator of this container.");
        ALL = Collections.unmodifiableMap(all);
    }

    private Builtins() {}

    private static void add(Map<String, Builtin> all, String name, String signature, String doc) {
        all.put(name, new Builtin(name, signature, doc));
    }

    public static boolean isBuiltin(String name) {
        return ALL.containsKey(name);
    }
}
