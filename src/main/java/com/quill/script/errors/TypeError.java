package com.quill.script.errors;

/** Operand or argument of a kind the operation does not accept. */
public class TypeError extends QuillError {
    private static final long serialVersionUID = 1L;

    public TypeError(String message) {
        this(message, NO_POSITION, NO_POSITION, null);
    }

    public TypeError(String message, int line, int column) {
        this(message, line, column, null);
    }

    public TypeError(String message, int line, int column, Throwable cause) {
        super(ErrorKind.TYPE, message, line, column, cause);
    }
}
