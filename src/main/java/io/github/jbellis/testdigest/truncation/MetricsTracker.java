package io.github.jbellis.testdigest.truncation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;

/**
 * Collects truncations from every stage of the pipeline so a run can report, in one place, how much
 * was cut where. Keeps the most recent {@link #MAX_RECORDS} records.
 */
public class MetricsTracker {
    private static final Logger logger = LogManager.getLogger(MetricsTracker.class);

    static final int MAX_RECORDS = 10_000;

    public record Export(TruncationSummary summary, List<StagedTruncationMetrics> details, Instant exportTime) {
        public Export {
            details = List.copyOf(details);
        }
    }

    // guarded by this
    private final Deque<StagedTruncationMetrics> records = new ArrayDeque<>();
    private boolean enabled;

    public MetricsTracker(boolean enabled) {
        this.enabled = enabled;
    }

    public MetricsTracker() {
        this(true);
    }

    public void record(TruncationStage stage, int originalTokens, int truncatedTokens, String strategy,
                       @Nullable Long processingTimeMs, @Nullable String testId) {
        record(new StagedTruncationMetrics(stage, originalTokens, truncatedTokens, truncatedTokens < originalTokens,
                                           strategy, processingTimeMs, testId, System.currentTimeMillis()));
    }

    public synchronized void record(StagedTruncationMetrics metrics) {
        if (!enabled) {
            return;
        }
        records.addLast(metrics);
        if (records.size() > MAX_RECORDS) {
            records.removeFirst();
        }
    }

    public synchronized List<StagedTruncationMetrics> getAllMetrics() {
        return List.copyOf(records);
    }

    public synchronized List<StagedTruncationMetrics> getMetricsByStage(TruncationStage stage) {
        return records.stream().filter(m -> m.stage() == stage).toList();
    }

    public synchronized List<StagedTruncationMetrics> getTestMetrics(String testId) {
        return records.stream().filter(m -> testId.equals(m.testId())).toList();
    }

    public synchronized TruncationSummary getSummary() {
        var byStage = new EnumMap<TruncationStage, Integer>(TruncationStage.class);
        for (var stage : TruncationStage.values()) {
            byStage.put(stage, 0);
        }

        int truncations = 0;
        long saved = 0;
        long processingMs = 0;
        for (var metrics : records) {
            byStage.merge(metrics.stage(), 1, Integer::sum);
            if (metrics.wasTruncated()) {
                truncations++;
                saved += metrics.tokensRemoved();
            }
            if (metrics.processingTimeMs() != null) {
                processingMs += metrics.processingTimeMs();
            }
        }

        var mostActive = TruncationStage.EARLY;
        for (var stage : TruncationStage.values()) {
            if (byStage.get(stage) > byStage.get(mostActive)) {
                mostActive = stage;
            }
        }
        double average = records.isEmpty() ? 0.0 : (double) processingMs / records.size();
        return new TruncationSummary(truncations, byStage, saved, average, mostActive);
    }

    public synchronized Export export() {
        return new Export(getSummary(), List.copyOf(records), Instant.now());
    }

    public synchronized void clear() {
        records.clear();
    }

    /**
     * Disabling also drops what was recorded so far.
     */
    public synchronized void setEnabled(boolean enabled) {
        this.enabled = enabled;
        if (!enabled) {
            records.clear();
        }
        logger.debug("Truncation metrics {}", enabled ? "enabled" : "disabled");
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }
}
