package io.github.jbellis.testdigest.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.jbellis.testdigest.console.ConsoleEvent;
import io.github.jbellis.testdigest.truncation.ContentCategory;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Console output of one failing test, bucketed by level. Empty buckets are null so they vanish
 * from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsoleOutput(@Nullable List<String> logs,
                            @Nullable List<String> errors,
                            @Nullable List<String> warns,
                            @Nullable List<String> info,
                            @Nullable List<String> debug) {
    public ConsoleOutput {
        logs = emptyToNull(logs);
        errors = emptyToNull(errors);
        warns = emptyToNull(warns);
        info = emptyToNull(info);
        debug = emptyToNull(debug);
    }

    public static ConsoleOutput empty() {
        return new ConsoleOutput(null, null, null, null, null);
    }

    /**
     * Buckets events in order. TRACE goes with DEBUG; a deduplicated line carries its repeat count.
     */
    public static ConsoleOutput fromEvents(List<ConsoleEvent> events) {
        var buckets = new EnumMap<ContentCategory, List<String>>(ContentCategory.class);
        for (var event : events) {
            var category = switch (event.level()) {
                case LOG -> ContentCategory.LOGS;
                case ERROR -> ContentCategory.ERRORS;
                case WARN -> ContentCategory.WARNS;
                case INFO -> ContentCategory.INFO;
                case DEBUG, TRACE -> ContentCategory.DEBUG;
            };
            var text = event.deduplication() != null
                       ? event.text() + " (x" + event.deduplication().count() + ")"
                       : event.text();
            buckets.computeIfAbsent(category, k -> new ArrayList<>()).add(text);
        }
        return fromCategories(buckets);
    }

    public static ConsoleOutput fromCategories(Map<ContentCategory, List<String>> categories) {
        return new ConsoleOutput(categories.get(ContentCategory.LOGS),
                                 categories.get(ContentCategory.ERRORS),
                                 categories.get(ContentCategory.WARNS),
                                 categories.get(ContentCategory.INFO),
                                 categories.get(ContentCategory.DEBUG));
    }

    public @Nullable List<String> category(ContentCategory category) {
        return switch (category) {
            case LOGS -> logs;
            case ERRORS -> errors;
            case WARNS -> warns;
            case INFO -> info;
            case DEBUG -> debug;
        };
    }

    public ConsoleOutput withCategory(ContentCategory category, @Nullable List<String> lines) {
        return switch (category) {
            case LOGS -> new ConsoleOutput(lines, errors, warns, info, debug);
            case ERRORS -> new ConsoleOutput(logs, lines, warns, info, debug);
            case WARNS -> new ConsoleOutput(logs, errors, lines, info, debug);
            case INFO -> new ConsoleOutput(logs, errors, warns, lines, debug);
            case DEBUG -> new ConsoleOutput(logs, errors, warns, info, lines);
        };
    }

    @JsonIgnore
    public boolean isEmpty() {
        return logs == null && errors == null && warns == null && info == null && debug == null;
    }

    private static @Nullable List<String> emptyToNull(@Nullable List<String> lines) {
        return lines == null || lines.isEmpty() ? null : List.copyOf(lines);
    }
}
