package io.github.jbellis.testdigest.truncation;

import java.util.List;
import java.util.Map;

/**
 * Read-only inputs of one truncation call.
 *
 * @param metadata strategy tuning, e.g. {@code headRatio}, {@code minUserFrames}, {@code userPackages}
 */
public record TruncationContext(String model,
                                int maxTokens,
                                ContentType contentType,
                                ContentPriority priority,
                                boolean preserveStructure,
                                Map<String, Object> metadata) {
    public TruncationContext {
        metadata = Map.copyOf(metadata);
    }

    public static TruncationContext of(String model, int maxTokens, ContentType contentType) {
        return new TruncationContext(model, maxTokens, contentType, ContentPriority.MEDIUM, false, Map.of());
    }

    public TruncationContext withMaxTokens(int maxTokens) {
        return new TruncationContext(model, maxTokens, contentType, priority, preserveStructure, metadata);
    }

    public double metadataDouble(String key, double defaultValue) {
        return metadata.get(key) instanceof Number n ? n.doubleValue() : defaultValue;
    }

    public int metadataInt(String key, int defaultValue) {
        return metadata.get(key) instanceof Number n ? n.intValue() : defaultValue;
    }

    public boolean metadataBoolean(String key, boolean defaultValue) {
        return metadata.get(key) instanceof Boolean b ? b : defaultValue;
    }

    public String metadataString(String key, String defaultValue) {
        return metadata.get(key) instanceof String s ? s : defaultValue;
    }

    public List<String> metadataStrings(String key) {
        if (metadata.get(key) instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
