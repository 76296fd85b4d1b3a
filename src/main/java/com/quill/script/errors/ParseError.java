package com.quill.script.errors;

/** An expected token was missing or a different one was found. */
public class ParseError extends QuillError {
    private static final long serialVersionUID = 1L;

    public ParseError(String message, int line, int column) {
        this(message, line, column, null);
    }

    public ParseError(String message, int line, int column, Throwable cause) {
        super(ErrorKind.PARSE, message, line, column, cause);
    }
}
