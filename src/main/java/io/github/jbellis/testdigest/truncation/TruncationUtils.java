package io.github.jbellis.testdigest.truncation;

import io.github.jbellis.testdigest.util.Json;
import io.github.jbellis.testdigest.util.PatternConstants;
import org.jetbrains.annotations.Nullable;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Text helpers shared by the strategies and the early/late truncators. All budgets here are in
 * characters.
 */
public final class TruncationUtils {
    public static final double DEFAULT_TRIM_SAFETY = 0.1;
    public static final double DEFAULT_CHARS_PER_TOKEN = 3.5;

    private TruncationUtils() {
    }

    public static String safeTrimToChars(String text, int targetChars) {
        return safeTrimToChars(text, targetChars, true, DEFAULT_TRIM_SAFETY);
    }

    /**
     * Cuts {@code text} to {@code targetChars * (1 - safety)} characters. With
     * {@code preferBoundaries}, and a target above 100 characters, the cut moves back to the last
     * space, newline, period or comma as long as that keeps at least 80% of the target.
     */
    public static String safeTrimToChars(String text, int targetChars, boolean preferBoundaries, double safety) {
        if (text.length() <= targetChars) {
            return text;
        }
        int safeTarget = Math.max(0, (int) Math.floor(targetChars * (1 - safety)));
        var trimmed = text.substring(0, Math.min(safeTarget, text.length()));

        if (preferBoundaries && safeTarget > 100) {
            int boundary = Math.max(Math.max(trimmed.lastIndexOf(' '), trimmed.lastIndexOf('\n')),
                                    Math.max(trimmed.lastIndexOf('.'), trimmed.lastIndexOf(',')));
            if (boundary > safeTarget * 0.8) {
                trimmed = text.substring(0, boundary + 1);
            }
        }
        return trimmed;
    }

    public static String joinWithEllipsis(List<String> chunks, String ellipsis) {
        return chunks.stream().filter(c -> !c.isBlank()).collect(Collectors.joining(ellipsis));
    }

    public static int estimateCharsForTokens(int tokens) {
        return (int) Math.floor(tokens * DEFAULT_CHARS_PER_TOKEN);
    }

    /**
     * Deterministic output for budgets too small for any heuristic.
     */
    public static String handleTinyLimit(int maxTokens, String content) {
        if (maxTokens < 5) {
            return "...";
        }
        if (maxTokens < 10) {
            var source = content.lines().filter(PatternConstants::isErrorMessageLine).findFirst().orElse(content);
            return safeTrimToChars(source, maxTokens * 3, false, DEFAULT_TRIM_SAFETY) + "...";
        }
        return safeTrimToChars(content, maxTokens * 3 - 10, true, 0.2) + "\n...[cut]";
    }

    /**
     * Sorted indices of the matches plus {@code contextLines} on either side.
     */
    public static List<Integer> extractLinesWithContext(int lineCount, Collection<Integer> matchIndices, int contextLines) {
        var selected = new TreeSet<Integer>();
        for (int idx : matchIndices) {
            for (int i = Math.max(0, idx - contextLines); i <= Math.min(lineCount - 1, idx + contextLines); i++) {
                selected.add(i);
            }
        }
        return List.copyOf(selected);
    }

    /**
     * Keeps error headers, then up to {@code maxFrames} frames: user frames first, then other frames,
     * then dependency frames, followed by a count of what was left out.
     */
    public static String truncateStackTrace(String stack, int maxFrames) {
        var headers = new ArrayList<String>();
        var user = new ArrayList<String>();
        var dependency = new ArrayList<String>();
        var other = new ArrayList<String>();

        for (var line : stack.split("\n", -1)) {
            if (PatternConstants.isErrorMessageLine(line)) {
                headers.add(line);
            } else if (PatternConstants.isStackFrameLine(line)) {
                if (PatternConstants.ELIDED_FRAMES.matcher(line).matches()) {
                    continue;
                }
                if (PatternConstants.isUserCodePath(line)) {
                    user.add(line);
                } else if (line.contains("node_modules") || PatternConstants.JAVA_FRAME.matcher(line).matches()) {
                    dependency.add(line);
                } else {
                    other.add(line);
                }
            }
        }

        var result = new ArrayList<>(headers);
        int kept = 0;
        for (var group : List.of(user, other, dependency)) {
            if (kept >= maxFrames) {
                break;
            }
            int take = Math.min(group.size(), maxFrames - kept);
            result.addAll(group.subList(0, take));
            kept += take;
        }
        int total = user.size() + other.size() + dependency.size();
        if (total > kept) {
            result.add("    ... " + (total - kept) + " frames omitted");
        }
        return String.join("\n", result);
    }

    /**
     * Lines around the failing one ({@code lineNumber}, 0-based), with {@code "..."} where lines were dropped.
     */
    public static List<String> truncateCodeContext(List<String> code, @Nullable Integer lineNumber, int contextLines) {
        if (code.isEmpty()) {
            return List.of();
        }
        if (lineNumber == null || lineNumber < 0) {
            return List.copyOf(code.subList(0, Math.min(contextLines * 2 + 1, code.size())));
        }
        int start = Math.max(0, Math.min(lineNumber - contextLines, code.size()));
        int end = Math.min(code.size(), lineNumber + contextLines + 1);
        var result = new ArrayList<String>();
        if (start > 0) {
            result.add("...");
        }
        if (start < end) {
            result.addAll(code.subList(start, end));
        }
        if (end < code.size()) {
            result.add("...");
        }
        return result;
    }

    /**
     * Shortens an expected/actual value. Numbers, booleans and null pass through; strings are cut;
     * structured values stay as they are when their JSON fits and otherwise become a cut JSON string.
     */
    public static @Nullable Object truncateAssertionValue(@Nullable Object value, int maxChars) {
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof CharSequence cs) {
            var s = cs.toString();
            return s.length() <= maxChars ? s : safeTrimToChars(s, maxChars - 3) + "...";
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value.getClass().isArray()) {
            String json;
            try {
                json = Json.toPrettyJson(value);
            } catch (UncheckedIOException e) {
                return "[object]";
            }
            if (json.length() <= maxChars) {
                return value;
            }
            if (json.startsWith("{") || json.startsWith("[")) {
                var head = json.substring(0, Math.max(0, maxChars - 10));
                int lastNewline = head.lastIndexOf('\n');
                if (lastNewline > maxChars * 0.5) {
                    return head.substring(0, lastNewline) + "\n  ...\n" + (json.startsWith("{") ? "}" : "]");
                }
            }
            return safeTrimToChars(json, maxChars - 3) + "...";
        }
        var s = String.valueOf(value);
        return s.length() <= maxChars ? s : safeTrimToChars(s, maxChars - 3) + "...";
    }

    /**
     * Shares {@code totalBudget} characters between items, each getting at least {@code minPerItem}
     * (budget permitting). Items over their share are cut and marked; items past the budget are dropped.
     */
    public static List<String> applyFairCaps(List<String> items, int totalBudget, int minPerItem) {
        if (items.isEmpty()) {
            return List.of();
        }
        int fairShare = Math.max(minPerItem, totalBudget / items.size());
        int remaining = totalBudget;
        var result = new ArrayList<String>();
        for (var item : items) {
            if (remaining <= 0) {
                break;
            }
            int itemBudget = Math.min(fairShare, remaining);
            if (item.length() <= itemBudget) {
                result.add(item);
                remaining -= item.length();
            } else {
                var cut = safeTrimToChars(item, itemBudget - 10) + "\n...[cut]";
                result.add(cut);
                remaining -= cut.length();
            }
        }
        return result;
    }

    public static List<String> splitLines(String content) {
        return Arrays.asList(content.split("\n", -1));
    }
}
