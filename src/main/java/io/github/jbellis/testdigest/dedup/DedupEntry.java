package io.github.jbellis.testdigest.dedup;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Bookkeeping for one dedup key. Mutated in place by {@link LogDeduplicator}, which hands out
 * copies to callers.
 */
public final class DedupEntry {
    private final String key;
    private final LogLevel level;
    private final String originalMessage;
    private final String normalizedMessage;
    private final Instant firstSeen;
    private Instant lastSeen;
    private int count;
    private final Set<String> sources;

    DedupEntry(String key, LogLevel level, String originalMessage, String normalizedMessage,
               Instant firstSeen, @Nullable String testId) {
        this.key = key;
        this.level = level;
        this.originalMessage = originalMessage;
        this.normalizedMessage = normalizedMessage;
        this.firstSeen = firstSeen;
        this.lastSeen = firstSeen;
        this.count = 1;
        this.sources = new LinkedHashSet<>();
        if (testId != null) {
            sources.add(testId);
        }
    }

    private DedupEntry(DedupEntry other) {
        this.key = other.key;
        this.level = other.level;
        this.originalMessage = other.originalMessage;
        this.normalizedMessage = other.normalizedMessage;
        this.firstSeen = other.firstSeen;
        this.lastSeen = other.lastSeen;
        this.count = other.count;
        this.sources = new LinkedHashSet<>(other.sources);
    }

    void recordRepeat(Instant seenAt, @Nullable String testId, boolean trackSource) {
        count++;
        lastSeen = seenAt;
        if (trackSource && testId != null) {
            sources.add(testId);
        }
    }

    DedupEntry copy() {
        return new DedupEntry(this);
    }

    public String key() {
        return key;
    }

    public LogLevel level() {
        return level;
    }

    public String originalMessage() {
        return originalMessage;
    }

    public String normalizedMessage() {
        return normalizedMessage;
    }

    public Instant firstSeen() {
        return firstSeen;
    }

    public Instant lastSeen() {
        return lastSeen;
    }

    public int count() {
        return count;
    }

    public Set<String> sources() {
        return Collections.unmodifiableSet(sources);
    }

    @Override
    public String toString() {
        return "DedupEntry{key='%s', count=%d, sources=%s}".formatted(key, count, sources);
    }
}
