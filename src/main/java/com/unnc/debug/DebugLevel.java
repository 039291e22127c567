package com.unnc.debug;

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

    /** Case-insensitive lookup; unknown names fall back to {@code fallback}. */
    public static DebugLevel parse(String name, DebugLevel fallback) {
        if (name == null) return fallback;
        for (DebugLevel l : values()) {
            if (l.name().equalsIgnoreCase(name.trim())) return l;
        }
        return fallback;
    }
}
