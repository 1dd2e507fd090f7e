package io.github.jbellis.testdigest.truncation;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a truncation. {@code tokenCount} is measured on {@code content} as returned.
 */
public record TruncationResult(String content,
                               int tokenCount,
                               int tokensSaved,
                               boolean wasTruncated,
                               String strategyUsed,
                               List<String> warnings) {
    public static final String NONE = "none";

    public TruncationResult {
        warnings = List.copyOf(warnings);
    }

    public static TruncationResult unchanged(String content, int tokenCount) {
        return new TruncationResult(content, tokenCount, 0, false, NONE, List.of());
    }

    public static TruncationResult truncated(String content, int originalTokens, int tokenCount, String strategy) {
        return new TruncationResult(content, tokenCount, Math.max(0, originalTokens - tokenCount), true, strategy, List.of());
    }

    public TruncationResult withWarning(String warning) {
        var all = new ArrayList<>(warnings);
        all.add(warning);
        return new TruncationResult(content, tokenCount, tokensSaved, wasTruncated, strategyUsed, all);
    }
}
