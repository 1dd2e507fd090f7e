package io.github.jbellis.testdigest.truncation;

/**
 * @param defaultModel             model used when a caller passes none
 * @param maxAttempts              strategies tried per call before giving up
 * @param enableAggressiveFallback cut by character ratio when no strategy fits
 */
public record TruncationEngineConfig(String defaultModel, int maxAttempts, boolean enableAggressiveFallback) {
    public TruncationEngineConfig {
        if (defaultModel == null || defaultModel.isBlank()) {
            throw new IllegalArgumentException("defaultModel must not be blank");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
    }

    public static TruncationEngineConfig defaults() {
        return new TruncationEngineConfig(ModelContextWindows.DEFAULT_MODEL, 3, true);
    }

    public TruncationEngineConfig withMaxAttempts(int maxAttempts) {
        return new TruncationEngineConfig(defaultModel, maxAttempts, enableAggressiveFallback);
    }

    public TruncationEngineConfig withAggressiveFallback(boolean enabled) {
        return new TruncationEngineConfig(defaultModel, maxAttempts, enabled);
    }
}
