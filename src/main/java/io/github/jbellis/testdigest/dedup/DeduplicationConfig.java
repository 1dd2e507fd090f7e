package io.github.jbellis.testdigest.dedup;

/**
 * Settings for {@link LogDeduplicator}. Invalid limits are rejected on construction.
 */
public record DeduplicationConfig(boolean enabled,
                                  int maxCacheEntries,
                                  boolean includeSources,
                                  boolean normalizeWhitespace,
                                  boolean stripTimestamps,
                                  boolean stripAnsiCodes,
                                  Scope scope) {
    public static final int DEFAULT_MAX_CACHE_ENTRIES = 10_000;
    public static final int MAX_CACHE_ENTRIES_LIMIT = 100_000;

    public enum Scope {
        /** Counts span the whole run. */
        GLOBAL,
        /** Counts reported by a capture only reflect that test's output. */
        PER_TEST
    }

    public DeduplicationConfig {
        if (maxCacheEntries <= 0) {
            throw new IllegalArgumentException("maxCacheEntries must be positive, got " + maxCacheEntries);
        }
        if (maxCacheEntries > MAX_CACHE_ENTRIES_LIMIT) {
            throw new IllegalArgumentException("maxCacheEntries must not exceed " + MAX_CACHE_ENTRIES_LIMIT
                                               + ", got " + maxCacheEntries);
        }
        if (scope == null) {
            scope = Scope.GLOBAL;
        }
    }

    public static DeduplicationConfig defaults() {
        return new DeduplicationConfig(true, DEFAULT_MAX_CACHE_ENTRIES, false, true, true, true, Scope.GLOBAL);
    }

    public static DeduplicationConfig disabled() {
        return defaults().withEnabled(false);
    }

    public DeduplicationConfig withEnabled(boolean enabled) {
        return new DeduplicationConfig(enabled, maxCacheEntries, includeSources, normalizeWhitespace,
                                       stripTimestamps, stripAnsiCodes, scope);
    }

    public DeduplicationConfig withMaxCacheEntries(int maxCacheEntries) {
        return new DeduplicationConfig(enabled, maxCacheEntries, includeSources, normalizeWhitespace,
                                       stripTimestamps, stripAnsiCodes, scope);
    }

    public DeduplicationConfig withIncludeSources(boolean includeSources) {
        return new DeduplicationConfig(enabled, maxCacheEntries, includeSources, normalizeWhitespace,
                                       stripTimestamps, stripAnsiCodes, scope);
    }

    public DeduplicationConfig withScope(Scope scope) {
        return new DeduplicationConfig(enabled, maxCacheEntries, includeSources, normalizeWhitespace,
                                       stripTimestamps, stripAnsiCodes, scope);
    }

    public DeduplicationConfig withNormalization(boolean normalizeWhitespace, boolean stripTimestamps, boolean stripAnsiCodes) {
        return new DeduplicationConfig(enabled, maxCacheEntries, includeSources, normalizeWhitespace,
                                       stripTimestamps, stripAnsiCodes, scope);
    }
}
