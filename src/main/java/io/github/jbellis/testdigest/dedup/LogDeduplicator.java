package io.github.jbellis.testdigest.dedup;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded dedup cache. When full, inserting a new key evicts the entry with the smallest
 * {@code lastSeen}; entries are scanned in insertion order so the earliest inserted wins ties.
 *
 * All public methods are synchronized: tests run on separate threads and share one cache.
 */
public class LogDeduplicator implements ILogDeduplicator {
    private static final Logger logger = LogManager.getLogger(LogDeduplicator.class);

    private final DeduplicationConfig config;
    private final LinkedHashMap<String, DedupEntry> cache = new LinkedHashMap<>();

    private long totalLogs;
    private long uniqueLogs;
    private long duplicatesRemoved;
    private long processingNanos;

    public LogDeduplicator(DeduplicationConfig config) {
        this.config = config;
    }

    public LogDeduplicator() {
        this(DeduplicationConfig.defaults());
    }

    @Override
    public synchronized boolean isDuplicate(LogEntry entry) {
        if (!config.enabled()) {
            return false;
        }

        long start = System.nanoTime();
        try {
            totalLogs++;
            var normalized = MessageNormalizer.normalize(entry.message(), config);
            var key = keyFor(entry.level(), normalized);

            var existing = cache.get(key);
            if (existing != null) {
                existing.recordRepeat(entry.timestamp(), entry.testId(), config.includeSources());
                duplicatesRemoved++;
                return true;
            }

            if (cache.size() >= config.maxCacheEntries()) {
                evictOldest();
            }
            cache.put(key, new DedupEntry(key, entry.level(), entry.message(), normalized,
                                          entry.timestamp(), entry.testId()));
            uniqueLogs++;
            return false;
        } finally {
            processingNanos += System.nanoTime() - start;
        }
    }

    @Override
    public String generateKey(LogEntry entry) {
        return keyFor(entry.level(), MessageNormalizer.normalize(entry.message(), config));
    }

    private static String keyFor(LogLevel level, String normalized) {
        return level.id() + ":" + MessageNormalizer.hash(normalized);
    }

    private void evictOldest() {
        @Nullable DedupEntry oldest = null;
        for (var candidate : cache.values()) {
            if (oldest == null || candidate.lastSeen().isBefore(oldest.lastSeen())) {
                oldest = candidate;
            }
        }
        if (oldest != null) {
            cache.remove(oldest.key());
            logger.debug("Evicted dedup entry {} (count {})", oldest.key(), oldest.count());
        }
    }

    @Override
    public synchronized Optional<DedupEntry> getMetadata(String key) {
        return Optional.ofNullable(cache.get(key)).map(DedupEntry::copy);
    }

    @Override
    public synchronized Map<String, DedupEntry> getAllEntries() {
        var copy = new LinkedHashMap<String, DedupEntry>();
        cache.forEach((key, entry) -> copy.put(key, entry.copy()));
        return copy;
    }

    @Override
    public synchronized DeduplicationStats getStats() {
        return new DeduplicationStats(totalLogs, uniqueLogs, duplicatesRemoved, cache.size(),
                                      processingNanos / 1_000_000);
    }

    @Override
    public synchronized void clear() {
        cache.clear();
        totalLogs = 0;
        uniqueLogs = 0;
        duplicatesRemoved = 0;
        processingNanos = 0;
    }

    @Override
    public boolean isEnabled() {
        return config.enabled();
    }

    @Override
    public DeduplicationConfig config() {
        return config;
    }
}
