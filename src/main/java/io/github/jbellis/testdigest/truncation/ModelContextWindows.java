package io.github.jbellis.testdigest.truncation;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Context window sizes and safety margins per model. Models missing from the table are treated
 * like {@link #DEFAULT_MODEL}.
 */
public final class ModelContextWindows {
    public static final String DEFAULT_MODEL = "gpt-4";

    static final double WARNING_THRESHOLD = 0.8;
    static final double REQUIRED_THRESHOLD = 0.95;

    private record Window(int contextWindow, double safetyMargin) {
    }

    private static final Map<String, Window> WINDOWS = new LinkedHashMap<>();

    static {
        // GPT models leave more room for the response
        WINDOWS.put("gpt-4", new Window(128_000, 0.15));
        WINDOWS.put("gpt-4-turbo", new Window(128_000, 0.15));
        WINDOWS.put("gpt-4o", new Window(128_000, 0.15));
        WINDOWS.put("gpt-4o-mini", new Window(128_000, 0.15));
        WINDOWS.put("gpt-3.5-turbo", new Window(16_385, 0.2));
        WINDOWS.put("claude-3-opus", new Window(200_000, 0.1));
        WINDOWS.put("claude-3-sonnet", new Window(200_000, 0.1));
        WINDOWS.put("claude-3-haiku", new Window(200_000, 0.1));
        WINDOWS.put("claude-3-5-sonnet", new Window(200_000, 0.1));
        WINDOWS.put("claude-3-5-haiku", new Window(200_000, 0.1));
    }

    public record ModelContextInfo(String model,
                                   int contextWindow,
                                   double safetyMargin,
                                   int effectiveMaxTokens,
                                   int warningThreshold,
                                   int requiredThreshold) {
    }

    private ModelContextWindows() {
    }

    private static Window lookup(String model) {
        var window = WINDOWS.get(model);
        return window != null ? window : WINDOWS.get(DEFAULT_MODEL);
    }

    public static int getContextWindowSize(String model) {
        return lookup(model).contextWindow();
    }

    public static double getSafetyMargin(String model) {
        return lookup(model).safetyMargin();
    }

    /**
     * {@code floor(min(customMax ?? window, window) * (1 - margin))}. A non-positive custom limit
     * counts as unset.
     */
    public static int getEffectiveMaxTokens(String model, @Nullable Integer customMaxTokens) {
        var window = lookup(model);
        int requested = customMaxTokens != null && customMaxTokens > 0 ? customMaxTokens : window.contextWindow();
        int limit = Math.min(requested, window.contextWindow());
        return (int) Math.floor(limit * (1 - window.safetyMargin()));
    }

    public static int getEffectiveMaxTokens(String model) {
        return getEffectiveMaxTokens(model, null);
    }

    public static boolean wouldExceedContext(int tokenCount, String model, @Nullable Integer customMaxTokens) {
        return tokenCount > getEffectiveMaxTokens(model, customMaxTokens);
    }

    public static boolean isModelSupported(String model) {
        return WINDOWS.containsKey(model);
    }

    public static List<String> getSupportedModels() {
        return List.copyOf(WINDOWS.keySet());
    }

    public static ModelContextInfo getModelContextInfo(String model, @Nullable Integer customMaxTokens) {
        var window = lookup(model);
        int effective = getEffectiveMaxTokens(model, customMaxTokens);
        return new ModelContextInfo(model, window.contextWindow(), window.safetyMargin(), effective,
                                    (int) Math.floor(effective * WARNING_THRESHOLD),
                                    (int) Math.floor(effective * REQUIRED_THRESHOLD));
    }

    /**
     * Token target for content of the given priority. Higher priorities are cut less, even if that
     * leaves the target above {@code maxTokens}; DISPOSABLE content is cut to fit exactly.
     */
    public static int calculateTruncationTarget(int currentTokens, int maxTokens, ContentPriority priority) {
        if (currentTokens <= maxTokens) {
            return currentTokens;
        }
        double budgetShare = (double) maxTokens / currentTokens;
        double factor = switch (priority) {
            case CRITICAL -> Math.max(0.9, budgetShare);
            case HIGH -> Math.max(0.7, 0.85 * budgetShare);
            case MEDIUM -> Math.max(0.6, 0.8 * budgetShare);
            case LOW -> Math.max(0.4, 0.6 * budgetShare);
            case DISPOSABLE -> budgetShare;
        };
        return (int) Math.floor(currentTokens * factor);
    }
}
