package com.quill.script.errors;

/** Unrecognized characters, unterminated strings and malformed numbers. */
public class LexError extends QuillError {
    private static final long serialVersionUID = 1L;

    public LexError(String message, int line, int column) {
        this(message, line, column, null);
    }

    public LexError(String message, int line, int column, Throwable cause) {
        super(ErrorKind.LEX, message, line, column, cause);
    }
}
