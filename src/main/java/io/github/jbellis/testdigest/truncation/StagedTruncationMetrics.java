package io.github.jbellis.testdigest.truncation;

import org.jetbrains.annotations.Nullable;

/**
 * One truncation as seen by {@link MetricsTracker}.
 *
 * @param processingTimeMs null when the stage does not time itself
 * @param testId           test the content belonged to, if known
 */
public record StagedTruncationMetrics(TruncationStage stage,
                                      int originalTokens,
                                      int truncatedTokens,
                                      boolean wasTruncated,
                                      String strategy,
                                      @Nullable Long processingTimeMs,
                                      @Nullable String testId,
                                      long timestamp) {
    public int tokensRemoved() {
        return Math.max(0, originalTokens - truncatedTokens);
    }
}
