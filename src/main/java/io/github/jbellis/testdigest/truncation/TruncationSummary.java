package io.github.jbellis.testdigest.truncation;

import java.util.Map;

/**
 * Aggregate of everything a {@link MetricsTracker} recorded.
 *
 * @param totalTruncations records that actually removed content
 * @param byStage          records per stage, truncating or not; every stage is present
 * @param tokensSaved      tokens removed by the truncating records
 * @param avgProcessingMs  mean over all records, untimed ones counting as zero
 * @param mostActiveStage  stage with the most records; the earliest stage wins ties
 */
public record TruncationSummary(int totalTruncations,
                                Map<TruncationStage, Integer> byStage,
                                long tokensSaved,
                                double avgProcessingMs,
                                TruncationStage mostActiveStage) {
    public TruncationSummary {
        byStage = Map.copyOf(byStage);
    }
}
