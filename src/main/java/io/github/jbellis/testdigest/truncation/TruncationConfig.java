package io.github.jbellis.testdigest.truncation;

import org.jetbrains.annotations.Nullable;

/**
 * Settings for report-level truncation.
 *
 * @param maxTokens budget for the whole report; unset means the model's effective budget for early
 *                  truncation and {@link LateTruncator#DEFAULT_MAX_TOKENS} for late truncation
 * @param model     model whose context window sizes the budget; unset means gpt-4
 */
public record TruncationConfig(boolean enabled,
                               @Nullable Integer maxTokens,
                               @Nullable String model,
                               Strategy strategy,
                               boolean enableEarlyTruncation,
                               boolean enableLateTruncation) {
    public enum Strategy {
        SIMPLE,
        SMART,
        PRIORITY
    }

    public TruncationConfig {
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive when set, got " + maxTokens);
        }
    }

    public static TruncationConfig defaults() {
        return new TruncationConfig(false, null, null, Strategy.SMART, true, true);
    }

    public String modelOrDefault() {
        return model == null || model.isBlank() ? ModelContextWindows.DEFAULT_MODEL : model;
    }

    public TruncationConfig withEnabled(boolean enabled) {
        return new TruncationConfig(enabled, maxTokens, model, strategy, enableEarlyTruncation, enableLateTruncation);
    }

    public TruncationConfig withMaxTokens(@Nullable Integer maxTokens) {
        return new TruncationConfig(enabled, maxTokens, model, strategy, enableEarlyTruncation, enableLateTruncation);
    }

    public TruncationConfig withModel(@Nullable String model) {
        return new TruncationConfig(enabled, maxTokens, model, strategy, enableEarlyTruncation, enableLateTruncation);
    }

    public TruncationConfig withStrategy(Strategy strategy) {
        return new TruncationConfig(enabled, maxTokens, model, strategy, enableEarlyTruncation, enableLateTruncation);
    }

    public TruncationConfig withPhases(boolean early, boolean late) {
        return new TruncationConfig(enabled, maxTokens, model, strategy, early, late);
    }
}
