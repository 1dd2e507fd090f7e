package io.github.jbellis.testdigest.console;

import io.github.jbellis.testdigest.dedup.LogLevel;
import io.github.jbellis.testdigest.util.PatternConstants;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, byte- and line-capped console output of a single test.
 *
 * The first write that would overflow either cap is replaced by a single truncation marker and
 * every later write is ignored. Sizes are UTF-8 bytes of the rendered text.
 */
public class ConsoleBuffer {
    public static final String TRUNCATION_MARKER = "[Console output truncated - limit reached]";

    private final int maxBytes;
    private final int maxLines;
    private final boolean stripAnsi;

    private final List<ConsoleEvent> events = new ArrayList<>();
    private final Set<String> seenKeys = new HashSet<>();
    private long totalBytes;
    private boolean truncated;

    public record Stats(long totalBytes, int eventCount, boolean truncated) {
    }

    public ConsoleBuffer(int maxBytes, int maxLines, boolean stripAnsi) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive, got " + maxBytes);
        }
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive, got " + maxLines);
        }
        this.maxBytes = maxBytes;
        this.maxLines = maxLines;
        this.stripAnsi = stripAnsi;
    }

    public ConsoleBuffer(CaptureConfig config) {
        this(config.maxBytes(), config.maxLines(), config.stripAnsi());
    }

    public boolean add(LogLevel level, @Nullable Object[] args, @Nullable Long timestampMs, ConsoleEvent.Origin origin) {
        return add(level, args, timestampMs, origin, false, null, null);
    }

    /**
     * Appends an event.
     *
     * @param isDuplicate set when the caller already knows the line repeats an earlier one
     * @param dedupKey    key under which this buffer remembers the line; a key seen before is dropped
     * @return false if the line was dropped (limit reached, already truncated, or a known dedup key)
     */
    public synchronized boolean add(LogLevel level,
                                    @Nullable Object[] args,
                                    @Nullable Long timestampMs,
                                    ConsoleEvent.Origin origin,
                                    boolean isDuplicate,
                                    @Nullable String dedupKey,
                                    @Nullable String testId) {
        if (truncated) {
            return false;
        }

        if (dedupKey != null) {
            if (!seenKeys.add(dedupKey)) {
                return false;
            }
            if (isDuplicate) {
                return false;
            }
        }

        var text = ConsoleArgFormatter.formatAll(args);
        if (stripAnsi) {
            text = PatternConstants.stripAnsi(text);
        }

        long bytes = text.getBytes(StandardCharsets.UTF_8).length;
        if (totalBytes + bytes > maxBytes || events.size() >= maxLines) {
            events.add(new ConsoleEvent(LogLevel.WARN, TRUNCATION_MARKER, origin, timestampMs, null, testId, null));
            truncated = true;
            return false;
        }

        events.add(new ConsoleEvent(level, text, origin, timestampMs, retainedArgs(args), testId, null));
        totalBytes += bytes;
        return true;
    }

    private static @Nullable List<String> retainedArgs(@Nullable Object[] args) {
        if (args == null) {
            return null;
        }
        boolean keep = args.length > 1 || (args.length == 1 && args[0] != null && !(args[0] instanceof CharSequence));
        if (!keep) {
            return null;
        }
        return Arrays.stream(args).map(ConsoleArgFormatter::format).toList();
    }

    public synchronized List<ConsoleEvent> getEvents() {
        return List.copyOf(events);
    }

    public synchronized boolean isTruncated() {
        return truncated;
    }

    public synchronized void clear() {
        events.clear();
        seenKeys.clear();
        totalBytes = 0;
        truncated = false;
    }

    public synchronized Stats getStats() {
        return new Stats(totalBytes, events.size(), truncated);
    }
}
