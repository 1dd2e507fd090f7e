package io.github.jbellis.testdigest.truncation;

import java.util.List;

/**
 * One late truncation of a whole report.
 *
 * @param phasesApplied names of the phases that ran, in order
 */
public record LateTruncationMetrics(int originalTokens,
                                    int truncatedTokens,
                                    int tokensRemoved,
                                    List<String> phasesApplied,
                                    long timestamp) {
    public LateTruncationMetrics {
        phasesApplied = List.copyOf(phasesApplied);
    }
}
