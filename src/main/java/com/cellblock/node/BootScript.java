package com.cellblock.node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * The one-line program a runtime JVM executes after start, passed with {@code --eval}.
 *
 * <p>Directives are separated by {@code ;}:
 * <ul>
 *   <li>{@code announce} sends the ready frame to the coordinator</li>
 *   <li>{@code await-ack <millis>} waits for the matching acknowledgement</li>
 *   <li>{@code await-manager} blocks until the management process terminates</li>
 *   <li>{@code serve} blocks until a management process has started and terminated</li>
 *   <li>{@code halt} ends the runtime with status 0</li>
 * </ul>
 * The script travels as a single process argument and so may not contain line breaks.
 */
public final class BootScript {

    public static final String ANNOUNCE = "announce";
    public static final String AWAIT_ACK = "await-ack";
    public static final String AWAIT_MANAGER = "await-manager";
    public static final String SERVE = "serve";
    public static final String HALT = "halt";

    private static final Set<String> KNOWN = Set.of(ANNOUNCE, AWAIT_ACK, AWAIT_MANAGER, SERVE, HALT);

    public record Directive(String name, List<String> args) {

        public long millisArg() {
            if (args.size() != 1) {
                throw new IllegalArgumentException(name + " expects one argument");
            }
            try {
                return Long.parseLong(args.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " expects milliseconds, got " + args.get(0), e);
            }
        }
    }

    private final String source;
    private final List<Directive> directives;

    private BootScript(String source, List<Directive> directives) {
        this.source = source;
        this.directives = directives;
    }

    /**
     * Script run by every spawned runtime: announce, wait for the acknowledgement, then live
     * exactly as long as the management process.
     */
    public static String standard(long ackTimeoutMillis) {
        return ANNOUNCE + "; " + AWAIT_ACK + " " + ackTimeoutMillis + "; " + AWAIT_MANAGER + "; " + HALT;
    }

    public static BootScript parse(String source) {
        requireSingleLine(source);
        var directives = new ArrayList<Directive>();
        for (String part : source.split(";")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] words = trimmed.split("\\s+");
            if (!KNOWN.contains(words[0])) {
                throw new IllegalArgumentException("unknown boot directive '" + words[0] + "'");
            }
            var directive = new Directive(words[0], List.of(Arrays.copyOfRange(words, 1, words.length)));
            if (AWAIT_ACK.equals(directive.name())) {
                directive.millisArg();
            }
            directives.add(directive);
        }
        if (directives.isEmpty()) {
            throw new IllegalArgumentException("boot script is empty");
        }
        return new BootScript(source, List.copyOf(directives));
    }

    public static void requireSingleLine(String script) {
        if (script == null) {
            throw new IllegalArgumentException("boot script cannot be null");
        }
        if (script.indexOf('\n') >= 0 || script.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("boot script must not contain line breaks");
        }
    }

    public List<Directive> directives() {
        return directives;
    }

    @Override
    public String toString() {
        return source;
    }
}
