package io.github.jbellis.testdigest.truncation;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Per-call overrides for {@link TruncationEngine#truncate}. Unset values fall back to the model's
 * effective budget, the priority model and the content type's configuration.
 */
public record TruncationOptions(@Nullable Integer maxTokens,
                                @Nullable ContentPriority priority,
                                @Nullable Boolean preserveStructure,
                                List<String> preferredStrategies,
                                Map<String, Object> metadata) {
    public TruncationOptions {
        preferredStrategies = List.copyOf(preferredStrategies);
        metadata = Map.copyOf(metadata);
    }

    public static TruncationOptions defaults() {
        return new TruncationOptions(null, null, null, List.of(), Map.of());
    }

    public static TruncationOptions ofMaxTokens(int maxTokens) {
        return defaults().withMaxTokens(maxTokens);
    }

    public TruncationOptions withMaxTokens(@Nullable Integer maxTokens) {
        return new TruncationOptions(maxTokens, priority, preserveStructure, preferredStrategies, metadata);
    }

    public TruncationOptions withPriority(@Nullable ContentPriority priority) {
        return new TruncationOptions(maxTokens, priority, preserveStructure, preferredStrategies, metadata);
    }

    public TruncationOptions withPreserveStructure(@Nullable Boolean preserveStructure) {
        return new TruncationOptions(maxTokens, priority, preserveStructure, preferredStrategies, metadata);
    }

    public TruncationOptions withPreferredStrategies(List<String> preferredStrategies) {
        return new TruncationOptions(maxTokens, priority, preserveStructure, preferredStrategies, metadata);
    }

    public TruncationOptions withMetadata(Map<String, Object> metadata) {
        return new TruncationOptions(maxTokens, priority, preserveStructure, preferredStrategies, metadata);
    }
}
