package com.quill.debug;

/** Pluggable debug output target (stderr, test capture, host logger bridge, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
