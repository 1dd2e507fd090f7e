package io.github.jbellis.testdigest.console;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.jbellis.testdigest.dedup.LogLevel;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * One line of console output attributed to a test.
 *
 * @param timestampMs milliseconds since the test's capture started, when known
 * @param args        individual serialized arguments, kept when there was more than one or a non-string one
 * @param deduplication repeat metadata, attached by {@link ConsoleCapture#stopCapture} to the first
 *                    occurrence of a line that was seen more than once
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsoleEvent(LogLevel level,
                           String text,
                           Origin origin,
                           @Nullable Long timestampMs,
                           @Nullable List<String> args,
                           @Nullable String testId,
                           @Nullable DeduplicationInfo deduplication) {

    public enum Origin {
        /** Routed from the patched console surface or intercepted stdio. */
        INTERCEPTED,
        /** Handed over by the host runner through {@link ConsoleCapture#ingest}. */
        TASK
    }

    public record DeduplicationInfo(int count, Instant firstSeen, Instant lastSeen, List<String> sources) {
    }

    public ConsoleEvent {
        if (args != null) {
            args = List.copyOf(args);
        }
    }

    public static ConsoleEvent of(LogLevel level, String text, Origin origin) {
        return new ConsoleEvent(level, text, origin, null, null, null, null);
    }

    public ConsoleEvent withDeduplication(DeduplicationInfo info) {
        return new ConsoleEvent(level, text, origin, timestampMs, args, testId, info);
    }
}
