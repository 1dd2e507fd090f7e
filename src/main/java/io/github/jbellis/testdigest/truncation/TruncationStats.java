package io.github.jbellis.testdigest.truncation;

import java.util.Map;

/**
 * Cumulative engine statistics. Only results that actually truncated are counted.
 *
 * @param strategyUsage        truncations per strategy name
 * @param contentTypeBreakdown truncations per content type id
 */
public record TruncationStats(int totalTruncations,
                              long totalTokensSaved,
                              double averageTokensSaved,
                              Map<String, Integer> strategyUsage,
                              Map<String, Integer> contentTypeBreakdown) {
    public TruncationStats {
        strategyUsage = Map.copyOf(strategyUsage);
        contentTypeBreakdown = Map.copyOf(contentTypeBreakdown);
    }

    public static TruncationStats empty() {
        return new TruncationStats(0, 0, 0.0, Map.of(), Map.of());
    }
}
