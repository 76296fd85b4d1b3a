package com.quill.script;

import java.util.Map;

import com.quill.script.errors.QuillError;
import com.quill.script.parser.Value;

/** Outcome of {@link QuillScript#tryRun(String)}: a value or the error that stopped the run. */
public class RunResult {
    private final Value value;
    private final QuillError error;
    private final Map<String, Value> globals;

    private RunResult(Value value, QuillError error, Map<String, Value> globals) {
        this.value = value;
        this.error = error;
        this.globals = globals;
    }

    static RunResult ok(Value value, Map<String, Value> globals) {
        return new RunResult(value, null, globals);
    }

    static RunResult failed(QuillError error, Map<String, Value> globals) {
        return new RunResult(Value.nil(), error, globals);
    }

    public boolean isOk() { return error == null; }

    /** Last statement's value; null-valued when the run failed. */
    public Value value() { return value; }

    /** The failure, or null. */
    public QuillError error() { return error; }

    /** Variables visible at top level after the run (partial on failure). */
    public Map<String, Value> globals() { return globals; }

    @Override
    public String toString() {
        return isOk() ? "ok(" + value + ")" : "failed(" + error.kind() + ": " + error.getMessage() + ")";
    }
}
