package com.quill.script.errors;

/** Division by exactly zero. */
public class ArithmeticError extends QuillError {
    private static final long serialVersionUID = 1L;

    public ArithmeticError(String message) {
        this(message, NO_POSITION, NO_POSITION, null);
    }

    public ArithmeticError(String message, int line, int column) {
        this(message, line, column, null);
    }

    public ArithmeticError(String message, int line, int column, Throwable cause) {
        super(ErrorKind.ARITHMETIC, message, line, column, cause);
    }
}
