package com.cellblock.remote.intellisense;

import com.cellblock.remote.script.Builtins;
import com.cellblock.remote.script.ScriptException;
import com.cellblock.remote.script.Values;
import com.cellblock.wire.IntellisenseRequest;
import com.cellblock.wire.IntellisenseResponse;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Answers completion, details, signature and format requests from a read-only view of bindings.
 */
public final class Intellisense {

    public static final String COMPLETION = "completion";
    public static final String DETAILS = "details";
    public static final String SIGNATURE = "signature";
    public static final String FORMAT = "format";

    private Intellisense() {}

    public static IntellisenseResponse handle(IntellisenseRequest request, Map<String, Object> bindings) {
        return switch (request.kind()) {
            case COMPLETION -> IntellisenseResponse.ofItems(COMPLETION, complete(request.hint(), bindings));
            case DETAILS -> IntellisenseResponse.ofContent(DETAILS, details(request.hint().trim(), bindings));
            case SIGNATURE -> IntellisenseResponse.ofItems(SIGNATURE, signature(request.hint()));
            case FORMAT -> IntellisenseResponse.ofContent(FORMAT, format(request.hint()));
            default -> throw new IllegalArgumentException("unknown intellisense request " + request.kind());
        };
    }

    static List<String> complete(String hint, Map<String, Object> bindings) {
        String prefix = trailingIdentifier(hint);
        var names = new TreeSet<String>();
        for (String name : bindings.keySet()) {
            if (name.startsWith(prefix)) names.add(name);
        }
        for (String name : Builtins.ALL.keySet()) {
            if (name.startsWith(prefix)) names.add(name);
        }
        return List.copyOf(names);
    }

    static String details(String name, Map<String, Object> bindings) {
        if (bindings.containsKey(name)) {
            Object value = bindings.get(name);
            return name + " : " + Values.typeName(value) + " = " + Values.render(value);
        }
        Builtins.Builtin builtin = Builtins.ALL.get(name);
        if (builtin != null) {
            return builtin.signature() + "\n\n" + builtin.doc();
        }
        return null;
    }

    /**
     * Signature of the call the cursor is inside, found from the last unclosed parenthesis.
     */
    static List<String> signature(String hint) {
        int depth = 0;
        for (int i = hint.length() - 1; i >= 0; i--) {
            char c = hint.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                if (depth == 0) {
                    Builtins.Builtin builtin = Builtins.ALL.get(trailingIdentifier(hint.substring(0, i)));
                    return builtin == null ? List.of() : List.of(builtin.signature());
                }
                depth--;
            }
        }
        return List.of();
    }

    static String format(String code) {
        try {
            return CodeFormatter.format(code);
        } catch (ScriptException e) {
            return null;
        }
    }

    private static String trailingIdentifier(String text) {
        int end = text.length();
        int start = end;
        while (start > 0 && (Character.isLetterOrDigit(text.charAt(start - 1)) || text.charAt(start - 1) == '_')) {
            start--;
        }
        return text.substring(start, end);
    }
}
