package com.quill.script.errors;

/**
 * A native function failed for a reason of its own: an index out of range, a console
 * read failure, or an unexpected exception thrown by a host callback (kept as the cause).
 */
public class NativeError extends QuillError {
    private static final long serialVersionUID = 1L;

    public NativeError(String message) {
        this(message, NO_POSITION, NO_POSITION, null);
    }

    public NativeError(String message, Throwable cause) {
        this(message, NO_POSITION, NO_POSITION, cause);
    }

    public NativeError(String message, int line, int column, Throwable cause) {
        super(ErrorKind.NATIVE, message, line, column, cause);
    }
}
