package com.quill.debug;

/** Severity of a debug message, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel threshold) {
        return ordinal() >= threshold.ordinal();
    }

    /** Case-insensitive lookup; throws IllegalArgumentException for unknown names. */
    public static DebugLevel parse(String name) {
        if (name == null) throw new IllegalArgumentException("Debug level must not be null");
        for (DebugLevel l : values()) {
            if (l.name().equalsIgnoreCase(name.trim())) return l;
        }
        throw new IllegalArgumentException("Unknown debug level: " + name);
    }
}
