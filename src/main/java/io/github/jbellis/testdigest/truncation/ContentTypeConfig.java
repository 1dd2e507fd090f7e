package io.github.jbellis.testdigest.truncation;

import java.util.List;

/**
 * Per content type defaults.
 *
 * @param preferredStrategies strategy names tried first when the caller names none
 * @param maxTruncationPercent largest share of the content that may be cut
 */
public record ContentTypeConfig(ContentType type,
                                ContentPriority defaultPriority,
                                boolean preserveStructure,
                                List<String> preferredStrategies,
                                double maxTruncationPercent) {
    public ContentTypeConfig {
        preferredStrategies = List.copyOf(preferredStrategies);
        if (maxTruncationPercent < 0 || maxTruncationPercent > 1) {
            throw new IllegalArgumentException("maxTruncationPercent must be within [0, 1], got " + maxTruncationPercent);
        }
    }
}
