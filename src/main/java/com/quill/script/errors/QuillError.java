package com.quill.script.errors;

/**
 * Base of all script failures.
 *
 * Carries the {@link ErrorKind} and, when the failure can be tied to a token, its
 * 1-based line and column. {@link #getMessage()} is prefixed with the position;
 * {@link #detail()} is the bare message.
 */
public abstract class QuillError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public static final int NO_POSITION = -1;

    private final ErrorKind kind;
    private final String detail;
    private int line;
    private int column;

    protected QuillError(ErrorKind kind, String detail, int line, int column, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    public ErrorKind kind() { return kind; }

    public String detail() { return detail; }

    public int line() { return line; }

    public int column() { return column; }

    public boolean hasPosition() { return line != NO_POSITION; }

    /**
     * Ties this error to a source position and returns it. The first position set sticks,
     * so the innermost node wins. Type, cause and stack trace are untouched.
     */
    public QuillError at(int line, int column) {
        if (!hasPosition()) {
            this.line = line;
            this.column = column;
        }
        return this;
    }

    @Override
    public String getMessage() {
        if (line == NO_POSITION) return detail;
        return "[line " + line + ":" + column + "] " + detail;
    }
}
