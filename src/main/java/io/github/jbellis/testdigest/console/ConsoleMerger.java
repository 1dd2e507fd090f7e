package io.github.jbellis.testdigest.console;

import io.github.jbellis.testdigest.dedup.DeduplicationConfig;
import io.github.jbellis.testdigest.dedup.MessageNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Combines output the host runner captured itself with intercepted output for the same test.
 */
public final class ConsoleMerger {
    private static final Logger logger = LogManager.getLogger(ConsoleMerger.class);

    static final long SIMULTANEOUS_WINDOW_MS = 5;

    // timestamped events first, by time; the rest keep their relative order
    private static final Comparator<ConsoleEvent> BY_TIMESTAMP = (a, b) -> {
        if (a.timestampMs() != null && b.timestampMs() != null) {
            return Long.compare(a.timestampMs(), b.timestampMs());
        }
        if (a.timestampMs() != null) {
            return -1;
        }
        return b.timestampMs() != null ? 1 : 0;
    };

    // "[12ms] " / "[12] " prefixes some runners put on lines they collect
    private static final Pattern ELAPSED_PREFIX = Pattern.compile("^\\[\\d+(?:ms)?]\\s*");

    private final DeduplicationConfig normalization = DeduplicationConfig.defaults();

    /**
     * Intercepted events come first; when both sides carry timestamps the result is ordered by time
     * (stable for ties). An event equal to the one kept right before it is dropped.
     */
    public List<ConsoleEvent> merge(@Nullable List<ConsoleEvent> taskEvents,
                                    @Nullable List<ConsoleEvent> interceptedEvents) {
        if (taskEvents == null || taskEvents.isEmpty()) {
            return interceptedEvents == null ? List.of() : List.copyOf(interceptedEvents);
        }
        if (interceptedEvents == null || interceptedEvents.isEmpty()) {
            return List.copyOf(taskEvents);
        }

        logger.debug("Merging {} task and {} intercepted console events", taskEvents.size(), interceptedEvents.size());

        var merged = new ArrayList<ConsoleEvent>(interceptedEvents.size() + taskEvents.size());
        merged.addAll(interceptedEvents);
        merged.addAll(taskEvents);

        boolean taskTimed = taskEvents.stream().anyMatch(e -> e.timestampMs() != null);
        boolean interceptedTimed = interceptedEvents.stream().anyMatch(e -> e.timestampMs() != null);
        if (taskTimed && interceptedTimed) {
            merged.sort(BY_TIMESTAMP);
        }
        return dropAdjacentRepeats(merged);
    }

    private List<ConsoleEvent> dropAdjacentRepeats(List<ConsoleEvent> events) {
        var kept = new ArrayList<ConsoleEvent>(events.size());
        @Nullable ConsoleEvent previous = null;
        for (var event : events) {
            if (previous != null && sameLine(previous, event)) {
                continue;
            }
            kept.add(event);
            previous = event;
        }
        return kept;
    }

    private boolean sameLine(ConsoleEvent a, ConsoleEvent b) {
        if (a.level() != b.level()) {
            return false;
        }
        if (a.timestampMs() != null && b.timestampMs() != null
            && Math.abs(a.timestampMs() - b.timestampMs()) > SIMULTANEOUS_WINDOW_MS) {
            return false;
        }
        return Objects.equals(canonicalText(a), canonicalText(b));
    }

    // case matters here: "Done" and "DONE" are different lines
    private String canonicalText(ConsoleEvent event) {
        var text = ELAPSED_PREFIX.matcher(event.text()).replaceFirst("");
        return MessageNormalizer.canonicalize(text, normalization);
    }
}
