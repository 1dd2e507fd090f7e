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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Scores lines by importance, grows each important line into a block with one line of context on
 * either side, and keeps the best blocks that fit. Gaps are marked with {@code "..."}.
 * Falls back to {@link HeadTailStrategy} when nothing important is found or scoring fails.
 */
public class SmartStrategy implements TruncationStrategy {
    private static final Logger logger = LogManager.getLogger(SmartStrategy.class);

    public static final String NAME = "smart";

    static final double IMPORTANCE_THRESHOLD = 0.3;
    static final int CONTEXT_LINES = 1;

    private static final List<String> KEYWORDS = List.of(
            "error", "fail", "expect", "assert", "throw", "reject", "timeout", "missing",
            "undefined", "null", "cannot", "invalid", "exception");

    private static final Map<String, List<String>> MARKERS = Map.of(
            "error", List.of("Error:", "Exception:", "Failed:", "✗", "❌", "AssertionError", "Caused by:"),
            "assertion", List.of("expect(", "assert(", "assertEquals", "assertThat", "should", "toBe", "toEqual", "toMatch"),
            "userCode", List.of("src/", "test/", "spec/"));

    private static final Pattern ERROR_WORD = Pattern.compile("\\b(error|fail|exception|throw)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");
    private static final Pattern QUOTED = Pattern.compile("[\"'].*[\"']");

    private record Block(int start, int end, double score) {
    }

    private final TokenCounter tokenCounter;
    private final HeadTailStrategy fallback;

    public SmartStrategy(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
        this.fallback = new HeadTailStrategy(tokenCounter);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 4;
    }

    @Override
    public boolean canTruncate(String content, TruncationContext context) {
        return context.contentType() != ContentType.JSON || !context.preserveStructure();
    }

    @Override
    public TruncationResult truncate(String content, int maxTokens, TruncationContext context) {
        int originalTokens = tokenCounter.countTokens(content, context.model());
        if (originalTokens <= maxTokens) {
            return TruncationResult.unchanged(content, originalTokens);
        }
        if (maxTokens < 10) {
            var tiny = TruncationUtils.handleTinyLimit(maxTokens, content);
            return TruncationResult.truncated(tiny, originalTokens, tokenCounter.countTokens(tiny, context.model()), NAME);
        }

        try {
            var lines = TruncationUtils.splitLines(content);
            var selected = selectBlocks(lines, maxTokens, context);
            if (selected.isEmpty()) {
                return fallBack(content, maxTokens, context, "No important lines fit; used head/tail");
            }
            var result = render(lines, selected);
            return TruncationResult.truncated(result, originalTokens, tokenCounter.countTokens(result, context.model()), NAME);
        } catch (RuntimeException e) {
            logger.warn("Smart truncation failed, falling back to head/tail", e);
            return fallBack(content, maxTokens, context, "Smart analysis failed, used head/tail fallback");
        }
    }

    private TruncationResult fallBack(String content, int maxTokens, TruncationContext context, String warning) {
        return fallback.truncate(content, maxTokens, context).withWarning(warning);
    }

    private TreeSet<Integer> selectBlocks(List<String> lines, int maxTokens, TruncationContext context) {
        var scores = new double[lines.size()];
        var important = new ArrayList<Integer>();
        for (int i = 0; i < lines.size(); i++) {
            scores[i] = lineImportance(lines.get(i), context.contentType());
            if (scores[i] >= IMPORTANCE_THRESHOLD) {
                important.add(i);
            }
        }

        // merge context windows of neighbouring important lines into blocks
        var blocks = new ArrayList<Block>();
        for (int idx : important) {
            int start = Math.max(0, idx - CONTEXT_LINES);
            int end = Math.min(lines.size() - 1, idx + CONTEXT_LINES);
            if (!blocks.isEmpty() && start <= blocks.get(blocks.size() - 1).end() + 1) {
                var last = blocks.remove(blocks.size() - 1);
                blocks.add(new Block(last.start(), Math.max(last.end(), end), Math.max(last.score(), scores[idx])));
            } else {
                blocks.add(new Block(start, end, scores[idx]));
            }
        }

        blocks.sort(Comparator.comparingDouble(Block::score).reversed().thenComparingInt(Block::start));
        var selected = new TreeSet<Integer>();
        for (var block : blocks) {
            var candidate = new TreeSet<>(selected);
            for (int i = block.start(); i <= block.end(); i++) {
                candidate.add(i);
            }
            if (tokenCounter.countTokens(render(lines, candidate), context.model()) <= maxTokens) {
                selected = candidate;
            }
        }
        if (selected.isEmpty() && !important.isEmpty()) {
            // no whole block fits; try the best single line on its own
            int best = important.stream().max(Comparator.comparingDouble(i -> scores[i])).orElseThrow();
            if (tokenCounter.countTokens(lines.get(best), context.model()) <= maxTokens) {
                selected.add(best);
            }
        }
        return selected;
    }

    private static String render(List<String> lines, TreeSet<Integer> selected) {
        var out = new ArrayList<String>();
        int last = -1;
        for (int idx : selected) {
            if ((last == -1 && idx > 0) || (last != -1 && idx > last + 1)) {
                out.add("...");
            }
            out.add(lines.get(idx));
            last = idx;
        }
        if (last != -1 && last < lines.size() - 1) {
            out.add("...");
        }
        return String.join("\n", out);
    }

    double lineImportance(String line, ContentType contentType) {
        var trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        double score = 0.1;
        var lower = trimmed.toLowerCase(Locale.ROOT);
        for (var keyword : KEYWORDS) {
            if (lower.contains(keyword)) {
                score += 0.3;
            }
        }
        for (var entry : MARKERS.entrySet()) {
            for (var marker : entry.getValue()) {
                if (trimmed.contains(marker)) {
                    score += entry.getKey().equals("error") ? 0.4 : 0.2;
                }
            }
        }
        switch (contentType) {
            case ERROR -> {
                if (ERROR_WORD.matcher(line).find() || PatternConstants.isErrorMessageLine(trimmed)) {
                    score += 0.5;
                }
            }
            case TEST -> {
                if (line.contains("expect") || line.contains("assert")) {
                    score += 0.4;
                }
            }
            case CODE -> {
                if (PatternConstants.isStackFrameLine(line) && PatternConstants.isUserCodePath(line)) {
                    score += 0.3;
                }
            }
            default -> {
            }
        }
        if (NUMBER.matcher(trimmed).find()) {
            score += 0.1;
        }
        if (QUOTED.matcher(trimmed).find()) {
            score += 0.1;
        }
        return Math.min(score, 1.0);
    }

    @Override
    public int estimateSavings(String content, int maxTokens, TruncationContext context) {
        int originalTokens = tokenCounter.countTokens(content, context.model());
        if (originalTokens <= maxTokens) {
            return 0;
        }
        var lines = TruncationUtils.splitLines(content);
        long important = lines.stream().filter(l -> lineImportance(l, context.contentType()) >= IMPORTANCE_THRESHOLD).count();
        double preservedRatio = Math.min(0.8, (double) important / lines.size() + 0.3);
        int estimatedFinal = Math.min((int) Math.floor(originalTokens * preservedRatio), maxTokens);
        return Math.max(0, originalTokens - estimatedFinal);
    }
}
