package io.github.jbellis.testdigest.dedup;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import io.github.jbellis.testdigest.util.PatternConstants;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form and hash of a log message, so that lines differing only in colors, timestamps,
 * spacing or case collapse onto the same dedup key.
 */
public final class MessageNormalizer {
    static final Pattern ANSI = PatternConstants.ANSI_ESCAPE;
    static final Pattern ISO_TIMESTAMP =
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}[Tt]\\d{2}:\\d{2}:\\d{2}(\\.\\d{3})?[Zz]?");
    static final Pattern DATE_TIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2}");
    static final Pattern UNIX_TIMESTAMP = Pattern.compile("\\b\\d{10}(\\d{3})?\\b");
    static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final int HASH_LENGTH = 16;

    private static final HashFunction HASH = Hashing.murmur3_128();

    private MessageNormalizer() {
    }

    public static String normalize(String message, DeduplicationConfig config) {
        return canonicalize(message, config).toLowerCase(Locale.ROOT);
    }

    /**
     * {@link #normalize} without case folding.
     */
    public static String canonicalize(String message, DeduplicationConfig config) {
        var normalized = message;
        // removing one token can expose another (e.g. "\u001B[\u001B[0m0m"), so strip to a fixpoint
        String previous;
        do {
            previous = normalized;
            if (config.stripAnsiCodes()) {
                normalized = ANSI.matcher(normalized).replaceAll("");
            }
            if (config.stripTimestamps()) {
                normalized = ISO_TIMESTAMP.matcher(normalized).replaceAll("");
                normalized = DATE_TIME.matcher(normalized).replaceAll("");
                normalized = UNIX_TIMESTAMP.matcher(normalized).replaceAll("");
            }
        } while (!normalized.equals(previous));

        if (config.normalizeWhitespace()) {
            normalized = WHITESPACE.matcher(normalized).replaceAll(" ").trim();
        }
        return normalized;
    }

    /**
     * Stable, non-cryptographic hash; the first 16 hex characters of murmur3-128.
     */
    public static String hash(String normalized) {
        return HASH.hashString(normalized, StandardCharsets.UTF_8).toString().substring(0, HASH_LENGTH);
    }
}
