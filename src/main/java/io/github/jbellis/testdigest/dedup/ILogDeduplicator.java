package io.github.jbellis.testdigest.dedup;

import java.util.Map;
import java.util.Optional;

/**
 * Collapses repeated log lines per (level, normalized message) key.
 */
public interface ILogDeduplicator {
    /**
     * Returns false the first time a key is seen and true for every repeat. Always false when disabled.
     */
    boolean isDuplicate(LogEntry entry);

    /**
     * {@code level ":" hash(normalize(message))}. Pure given the configuration.
     */
    String generateKey(LogEntry entry);

    Optional<DedupEntry> getMetadata(String key);

    Map<String, DedupEntry> getAllEntries();

    DeduplicationStats getStats();

    void clear();

    boolean isEnabled();

    DeduplicationConfig config();
}
