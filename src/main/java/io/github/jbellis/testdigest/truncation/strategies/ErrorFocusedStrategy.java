package io.github.jbellis.testdigest.truncation.strategies;

import io.github.jbellis.testdigest.tokens.TokenCounter;
import io.github.jbellis.testdigest.truncation.ContentType;
import io.github.jbellis.testdigest.truncation.TruncationContext;
import io.github.jbellis.testdigest.truncation.TruncationResult;
import io.github.jbellis.testdigest.truncation.TruncationStrategy;
import io.github.jbellis.testdigest.truncation.TruncationUtils;
import io.github.jbellis.testdigest.util.PatternConstants;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keeps error, assertion and failure lines with two lines of context each. Overlapping windows are
 * merged and then chosen by priority while they fit; the window holding the first error line is
 * always chosen first, cut down to that line alone if necessary.
 */
public class ErrorFocusedStrategy implements TruncationStrategy {
    private static final Logger logger = LogManager.getLogger(ErrorFocusedStrategy.class);

    public static final String NAME = "error-focused";

    static final int CONTEXT_LINES = 2;
    static final int MIN_PARTIAL_TOKENS = 50;

    private static final Set<ContentType> SUPPORTED = EnumSet.of(ContentType.ERROR, ContentType.TEST, ContentType.LOG);

    private static final List<String> ERROR_MARKERS = List.of(
            "error:", "exception:", "assertionerror", "typeerror:", "referenceerror:", "syntaxerror:", "rangeerror:",
            "failed:", "expected:", "actual:", "received:", "diff:", "caused by:",
            "✗", "❌", "×", "fail");

    private static final List<String> ASSERTION_MARKERS = List.of(
            "expect(", "expect.", "assert(", "assert.", "assertEquals", "assertTrue", "assertThat", "assertThrows",
            "should", "toBe", "toEqual", "toMatch", "toContain", "toHaveBeenCalled", "toThrow", "toReject");

    private static final List<String> KEYWORDS = List.of("fail", "error", "exception", "timeout", "undefined", "null");

    private static final List<String> USER_CODE_MARKERS = List.of("src/", "test/", "spec/");

    private record Section(int start, int end, double priority) {
        boolean contains(int line) {
            return line >= start && line <= end;
        }
    }

    private record Chosen(Section section, @Nullable String partialContent) {
    }

    private final TokenCounter tokenCounter;

    public ErrorFocusedStrategy(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 5;
    }

    @Override
    public boolean canTruncate(String content, TruncationContext context) {
        return SUPPORTED.contains(context.contentType());
    }

    @Override
    public TruncationResult truncate(String content, int maxTokens, TruncationContext context) {
        int originalTokens = tokenCounter.countTokens(content, context.model());
        if (originalTokens <= maxTokens) {
            return TruncationResult.unchanged(content, originalTokens);
        }

        var lines = TruncationUtils.splitLines(content);
        var errorLines = new ArrayList<Integer>();
        for (int i = 0; i < lines.size(); i++) {
            if (isErrorLine(lines.get(i))) {
                errorLines.add(i);
            }
        }

        String result = errorLines.isEmpty()
                        ? leadingLines(lines, maxTokens, context)
                        : focusOnErrors(lines, errorLines, maxTokens, context);
        return TruncationResult.truncated(result, originalTokens, tokenCounter.countTokens(result, context.model()), NAME);
    }

    private String focusOnErrors(List<String> lines, List<Integer> errorLines, int maxTokens, TruncationContext context) {
        var sections = merge(buildSections(lines, errorLines));
        int firstError = errorLines.get(0);

        var firstSection = sections.stream().filter(s -> s.contains(firstError)).findFirst().orElseThrow();
        var chosen = new ArrayList<Chosen>();
        chosen.add(new Chosen(firstSection, null));
        if (tokens(render(lines, chosen), context) > maxTokens) {
            // the window does not fit: keep the first error line, cut to the budget
            var line = lines.get(firstError);
            int chars = Math.max(0, maxTokens * 4);
            while (chars > 0 && tokenCounter.countTokens(TruncationUtils.safeTrimToChars(line, chars, false, 0), context.model()) > maxTokens) {
                chars = (int) (chars * 0.9);
            }
            return TruncationUtils.safeTrimToChars(line, chars, false, 0);
        }

        var byPriority = new ArrayList<>(sections);
        byPriority.remove(firstSection);
        byPriority.sort(Comparator.comparingDouble(Section::priority).reversed().thenComparingInt(Section::start));
        for (var section : byPriority) {
            var candidate = new ArrayList<>(chosen);
            candidate.add(new Chosen(section, null));
            if (tokens(render(lines, candidate), context) <= maxTokens) {
                chosen = candidate;
                continue;
            }

            int remaining = maxTokens - tokens(render(lines, chosen), context);
            if (remaining > MIN_PARTIAL_TOKENS) {
                var full = String.join("\n", lines.subList(section.start(), section.end() + 1));
                var partial = full.substring(0, Math.min(full.length(), Math.max(0, remaining * 4 - 10))) + "...";
                var withPartial = new ArrayList<>(chosen);
                withPartial.add(new Chosen(section, partial));
                if (tokens(render(lines, withPartial), context) <= maxTokens) {
                    chosen = withPartial;
                }
            }
            break;
        }
        logger.debug("Kept {} of {} error sections", chosen.size(), sections.size());
        return render(lines, chosen);
    }

    private List<Section> buildSections(List<String> lines, List<Integer> errorLines) {
        var sections = new ArrayList<Section>();
        for (int idx : errorLines) {
            var line = lines.get(idx);
            double priority = 1.0;
            if (matchesErrorMarker(line)) {
                priority += 0.5;
            }
            if (matchesAssertionMarker(line)) {
                priority += 0.3;
            }
            if (containsUserCode(line)) {
                priority += 0.2;
            }
            sections.add(new Section(Math.max(0, idx - CONTEXT_LINES), Math.min(lines.size() - 1, idx + CONTEXT_LINES), priority));
        }
        return sections;
    }

    private static List<Section> merge(List<Section> sections) {
        var sorted = new ArrayList<>(sections);
        sorted.sort(Comparator.comparingInt(Section::start));
        var merged = new ArrayList<Section>();
        for (var next : sorted) {
            if (!merged.isEmpty() && next.start() <= merged.get(merged.size() - 1).end() + 1) {
                var current = merged.remove(merged.size() - 1);
                merged.add(new Section(current.start(), Math.max(current.end(), next.end()),
                                       Math.max(current.priority(), next.priority())));
            } else {
                merged.add(next);
            }
        }
        return merged;
    }

    private static String render(List<String> lines, List<Chosen> chosen) {
        var ordered = new ArrayList<>(chosen);
        ordered.sort(Comparator.comparingInt(c -> c.section().start()));
        var out = new ArrayList<String>();
        int lastEnd = -1;
        for (var c : ordered) {
            if (lastEnd != -1 && c.section().start() > lastEnd + 1) {
                out.add("...");
            }
            out.add(c.partialContent() != null
                    ? c.partialContent()
                    : String.join("\n", lines.subList(c.section().start(), c.section().end() + 1)));
            lastEnd = c.section().end();
        }
        return String.join("\n", out);
    }

    private String leadingLines(List<String> lines, int maxTokens, TruncationContext context) {
        var kept = new ArrayList<String>();
        for (var line : lines) {
            kept.add(line);
            if (tokenCounter.countTokens(String.join("\n", kept), context.model()) > maxTokens) {
                kept.remove(kept.size() - 1);
                break;
            }
        }
        return String.join("\n", kept);
    }

    private int tokens(String text, TruncationContext context) {
        return tokenCounter.countTokens(text, context.model());
    }

    boolean isErrorLine(String line) {
        return matchesErrorMarker(line) || matchesAssertionMarker(line) || containsKeyword(line)
               || PatternConstants.isErrorMessageLine(line);
    }

    private static boolean matchesErrorMarker(String line) {
        var lower = line.toLowerCase(Locale.ROOT);
        return ERROR_MARKERS.stream().anyMatch(lower::contains);
    }

    private static boolean matchesAssertionMarker(String line) {
        return ASSERTION_MARKERS.stream().anyMatch(line::contains);
    }

    private static boolean containsKeyword(String line) {
        var lower = line.toLowerCase(Locale.ROOT);
        return KEYWORDS.stream().anyMatch(lower::contains);
    }

    private static boolean containsUserCode(String line) {
        if (PatternConstants.JAVA_FRAME.matcher(line).matches()) {
            return PatternConstants.isUserCodePath(line);
        }
        return USER_CODE_MARKERS.stream().anyMatch(line::contains) && !line.contains("node_modules");
    }

    @Override
    public int estimateSavings(String content, int maxTokens, TruncationContext context) {
        int originalTokens = tokenCounter.countTokens(content, context.model());
        if (originalTokens <= maxTokens) {
            return 0;
        }
        var lines = TruncationUtils.splitLines(content);
        long errorLines = lines.stream().filter(this::isErrorLine).count();
        double preservedRatio = Math.min(0.7, (double) errorLines / lines.size() * 2 + 0.3);
        int estimatedFinal = Math.min((int) Math.floor(originalTokens * preservedRatio), maxTokens);
        return Math.max(0, originalTokens - estimatedFinal);
    }
}
