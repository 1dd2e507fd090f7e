package io.github.jbellis.testdigest.console;

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Renders console arguments to text without ever throwing. Nested values are depth-limited and
 * long collections and strings are capped; anything that fails to render becomes
 * {@link #FAILED_PLACEHOLDER}.
 */
public final class ConsoleArgFormatter {
    public static final String FAILED_PLACEHOLDER = "[Failed to serialize]";
    public static final String TRUNCATED_SUFFIX = "... [truncated]";

    static final int MAX_STRING_LENGTH = 1000;
    static final int MAX_NESTED_STRING_LENGTH = 200;
    static final int MAX_ITEMS = 10;
    static final int MAX_DEPTH = 3;

    private ConsoleArgFormatter() {
    }

    public static String format(@Nullable Object arg) {
        try {
            if (arg == null) {
                return "null";
            }
            if (arg instanceof CharSequence cs) {
                return cap(cs.toString(), MAX_STRING_LENGTH, TRUNCATED_SUFFIX);
            }
            var seen = Collections.newSetFromMap(new IdentityHashMap<>());
            return cap(render(arg, 0, seen), MAX_STRING_LENGTH, TRUNCATED_SUFFIX);
        } catch (RuntimeException | StackOverflowError e) {
            // user toString() implementations can fail in any way
            return FAILED_PLACEHOLDER;
        }
    }

    /**
     * Formats each argument and joins them with a single space, the way a console prints them.
     */
    public static String formatAll(@Nullable Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        var joiner = new StringJoiner(" ");
        for (var arg : args) {
            joiner.add(format(arg));
        }
        return joiner.toString();
    }

    private static String render(@Nullable Object value, int depth, Set<Object> seen) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence cs) {
            return depth == 0 ? cs.toString() : "'" + cap(cs.toString(), MAX_NESTED_STRING_LENGTH, "...") + "'";
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character || value instanceof Enum<?>) {
            return String.valueOf(value);
        }
        if (value instanceof Throwable t) {
            return t.toString();
        }
        if (value instanceof Optional<?> opt) {
            return opt.isPresent() ? "Optional[" + render(opt.get(), depth, seen) + "]" : "Optional.empty";
        }

        boolean container = value.getClass().isArray() || value instanceof Iterable<?> || value instanceof Map<?, ?>;
        if (!container) {
            return cap(String.valueOf(value), depth == 0 ? MAX_STRING_LENGTH : MAX_NESTED_STRING_LENGTH, "...");
        }
        if (!seen.add(value)) {
            return "[Circular]";
        }
        try {
            if (value instanceof Map<?, ?> map) {
                if (depth >= MAX_DEPTH) {
                    return "[Object]";
                }
                var joiner = new StringJoiner(", ", "{", "}");
                int shown = 0;
                for (var e : map.entrySet()) {
                    if (shown == MAX_ITEMS) {
                        joiner.add("... " + (map.size() - MAX_ITEMS) + " more items");
                        break;
                    }
                    joiner.add(render(e.getKey(), depth + 1, seen) + ": " + render(e.getValue(), depth + 1, seen));
                    shown++;
                }
                return joiner.toString();
            }

            if (depth >= MAX_DEPTH) {
                return "[Array]";
            }
            var joiner = new StringJoiner(", ", "[", "]");
            if (value.getClass().isArray()) {
                int length = Array.getLength(value);
                for (int i = 0; i < Math.min(length, MAX_ITEMS); i++) {
                    joiner.add(render(Array.get(value, i), depth + 1, seen));
                }
                if (length > MAX_ITEMS) {
                    joiner.add("... " + (length - MAX_ITEMS) + " more items");
                }
                return joiner.toString();
            }

            int index = 0;
            for (var item : (Iterable<?>) value) {
                if (index == MAX_ITEMS) {
                    joiner.add(value instanceof Collection<?> c
                               ? "... " + (c.size() - MAX_ITEMS) + " more items"
                               : "... more items");
                    break;
                }
                joiner.add(render(item, depth + 1, seen));
                index++;
            }
            return joiner.toString();
        } finally {
            seen.remove(value);
        }
    }

    private static String cap(String s, int max, String suffix) {
        return s.length() > max ? s.substring(0, max) + suffix : s;
    }
}
