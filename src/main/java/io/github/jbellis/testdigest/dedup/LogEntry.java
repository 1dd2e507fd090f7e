package io.github.jbellis.testdigest.dedup;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

public record LogEntry(String message, LogLevel level, Instant timestamp, @Nullable String testId) {
    public LogEntry(String message, LogLevel level) {
        this(message, level, Instant.now(), null);
    }
}
