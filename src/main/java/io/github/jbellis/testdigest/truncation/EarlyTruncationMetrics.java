package io.github.jbellis.testdigest.truncation;

import org.jetbrains.annotations.Nullable;

/**
 * One early truncation, recorded when it removed tokens.
 */
public record EarlyTruncationMetrics(int originalTokens,
                                     int truncatedTokens,
                                     int tokensRemoved,
                                     String strategy,
                                     @Nullable ContentCategory category,
                                     long timestamp) {
}
