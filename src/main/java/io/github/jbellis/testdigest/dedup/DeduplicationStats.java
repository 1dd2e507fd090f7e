package io.github.jbellis.testdigest.dedup;

public record DeduplicationStats(long totalLogs,
                                 long uniqueLogs,
                                 long duplicatesRemoved,
                                 int cacheSize,
                                 long processingTimeMs) {
}
