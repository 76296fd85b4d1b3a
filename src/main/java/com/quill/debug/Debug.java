package com.quill.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all Quill components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...); null restores the silent default
 * - Silent by default: nothing is written until a host installs a sink
 */
public final class Debug {

    // Must be initialised before INSTANCE, whose constructor reads it.
    private static final DebugSink SILENT = (level, tag, message, error) -> {
        // discards everything
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef;

    private Debug() {
        this.sinkRef = new AtomicReference<>(SILENT);
    }

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? SILENT : sink);
    }

    /** Current sink; never null. */
    public DebugSink getSink() {
        return sinkRef.get();
    }

    public boolean isSilent() {
        return sinkRef.get() == SILENT;
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
