package com.quill.debug;

import java.io.PrintStream;

/** Writes "LEVEL [tag] message" lines at or above a threshold to a stream. */
public final class StreamDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel threshold;

    public StreamDebugSink(PrintStream out, DebugLevel threshold) {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        this.out = out;
        this.threshold = (threshold == null) ? DebugLevel.INFO : threshold;
    }

    public DebugLevel threshold() { return threshold; }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(threshold)) return;
        synchronized (out) {
            out.println(level + " [" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
