package com.cellblock.remote.script;

/**
 * An error raised by cell code: a syntax error, a type error or an explicit {@code raise}.
 * The evaluator reports it as a failed evaluation and keeps running.
 */
public class ScriptException extends RuntimeException {

    private final int line;

    public ScriptException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int line() {
        return line;
    }

    @Override
    public String getMessage() {
        return line > 0 ? "line " + line + ": " + super.getMessage() : super.getMessage();
    }
}
