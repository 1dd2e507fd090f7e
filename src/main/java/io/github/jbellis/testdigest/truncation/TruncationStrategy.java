package io.github.jbellis.testdigest.truncation;

/**
 * A way of cutting content down to a token budget. The engine orders applicable strategies by
 * descending {@link #priority()}.
 */
public interface TruncationStrategy {
    String name();

    int priority();

    boolean canTruncate(String content, TruncationContext context);

    /**
     * Returns content that should fit in {@code maxTokens}. The engine re-measures the result, so
     * a strategy may return a best effort.
     */
    TruncationResult truncate(String content, int maxTokens, TruncationContext context);

    /**
     * Tokens this strategy expects to save at most.
     */
    int estimateSavings(String content, int maxTokens, TruncationContext context);
}
