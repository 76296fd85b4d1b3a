package com.quill.script.errors;

/** Wrong argument count for a native function, or access to an absent argument. */
public class ArityError extends QuillError {
    private static final long serialVersionUID = 1L;

    public ArityError(String message) {
        this(message, NO_POSITION, NO_POSITION, null);
    }

    public ArityError(String message, int line, int column) {
        this(message, line, column, null);
    }

    public ArityError(String message, int line, int column, Throwable cause) {
        super(ErrorKind.ARITY, message, line, column, cause);
    }
}
