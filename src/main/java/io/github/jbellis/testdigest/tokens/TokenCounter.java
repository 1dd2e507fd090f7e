package io.github.jbellis.testdigest.tokens;

import java.util.concurrent.CompletableFuture;

/**
 * Integer token counts for a piece of text.
 *
 * Model-specific tokenizers plug in through {@link #countTokens}; everything in the pipeline
 * must also work when only the cheap {@link #estimateTokens} approximation is available.
 */
public interface TokenCounter {
    /**
     * Counts tokens for the given model. Implementations without a real tokenizer
     * return the estimate.
     */
    int countTokens(String text, String model);

    /**
     * Cheap synchronous approximation, used on hot paths (strategy shrink loops, late truncation).
     */
    int estimateTokens(String text);

    default CompletableFuture<Integer> countTokensAsync(String text, String model) {
        return CompletableFuture.supplyAsync(() -> countTokens(text, model));
    }
}
