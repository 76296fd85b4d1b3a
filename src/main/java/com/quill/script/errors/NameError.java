package com.quill.script.errors;

/** Redeclaration in one scope, unresolved names and calls to unregistered functions. */
public class NameError extends QuillError {
    private static final long serialVersionUID = 1L;

    public NameError(String message) {
        this(message, NO_POSITION, NO_POSITION, null);
    }

    public NameError(String message, int line, int column) {
        this(message, line, column, null);
    }

    public NameError(String message, int line, int column, Throwable cause) {
        super(ErrorKind.NAME, message, line, column, cause);
    }
}
