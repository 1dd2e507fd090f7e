package io.github.jbellis.testdigest.dedup;

import java.util.Locale;

/**
 * Console levels. The lowercase {@link #id()} is what appears in dedup keys and serialized events.
 */
public enum LogLevel {
    LOG, INFO, WARN, ERROR, DEBUG, TRACE;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isDebugLike() {
        return this == DEBUG || this == TRACE;
    }

    public static LogLevel fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
