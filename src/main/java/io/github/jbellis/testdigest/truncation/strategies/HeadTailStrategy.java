package io.github.jbellis.testdigest.truncation.strategies;

import io.github.jbellis.testdigest.tokens.TokenCounter;
import io.github.jbellis.testdigest.truncation.ContentType;
import io.github.jbellis.testdigest.truncation.TruncationContext;
import io.github.jbellis.testdigest.truncation.TruncationResult;
import io.github.jbellis.testdigest.truncation.TruncationStrategy;
import io.github.jbellis.testdigest.truncation.TruncationUtils;

import java.util.List;

/**
 * Keeps the beginning and the end, joined by a separator.
 *
 * Metadata: {@code headRatio} (0.4), {@code tailRatio} (0.4), {@code separator} ({@code "\n...\n"}),
 * {@code preserveLines} (true; false cuts by characters instead).
 */
public class HeadTailStrategy implements TruncationStrategy {
    public static final String NAME = "head-tail";
    public static final String DEFAULT_SEPARATOR = "\n...\n";

    private final TokenCounter tokenCounter;

    public HeadTailStrategy(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 2;
    }

    @Override
    public boolean canTruncate(String content, TruncationContext context) {
        return !(context.preserveStructure() && context.contentType() == ContentType.JSON);
    }

    @Override
    public TruncationResult truncate(String content, int maxTokens, TruncationContext context) {
        int originalTokens = tokenCounter.countTokens(content, context.model());
        if (originalTokens <= maxTokens) {
            return TruncationResult.unchanged(content, originalTokens);
        }

        double headRatio = context.metadataDouble("headRatio", 0.4);
        double tailRatio = context.metadataDouble("tailRatio", 0.4);
        var separator = context.metadataString("separator", DEFAULT_SEPARATOR);

        var truncated = context.metadataBoolean("preserveLines", true)
                        ? byLines(content, maxTokens, headRatio, tailRatio, separator, context)
                        : byCharacters(content, maxTokens, headRatio, tailRatio, separator, context);
        if (truncated.equals(content)) {
            return TruncationResult.unchanged(content, originalTokens);
        }
        return TruncationResult.truncated(truncated, originalTokens,
                                          tokenCounter.countTokens(truncated, context.model()), NAME);
    }

    private String byLines(String content, int maxTokens, double headRatio, double tailRatio,
                           String separator, TruncationContext context) {
        var lines = TruncationUtils.splitLines(content);
        int total = lines.size();
        if (total <= 3) {
            return content;
        }

        int head = Math.max(1, (int) Math.floor(total * headRatio));
        int tail = Math.max(1, (int) Math.floor(total * tailRatio));
        if (head + tail >= total) {
            head = Math.max(1, (int) Math.floor(total * 0.4));
            tail = Math.max(1, (int) Math.floor(total * 0.4));
        }

        var result = join(lines, head, tail, separator);
        while (head + tail > 2 && tokenCounter.countTokens(result, context.model()) > maxTokens) {
            if (head > tail) {
                head--;
            } else {
                tail--;
            }
            result = join(lines, head, tail, separator);
        }
        return result;
    }

    private static String join(List<String> lines, int head, int tail, String separator) {
        if (head + tail >= lines.size()) {
            return String.join("\n", lines);
        }
        return String.join("\n", lines.subList(0, head))
               + separator
               + String.join("\n", lines.subList(lines.size() - tail, lines.size()));
    }

    private String byCharacters(String content, int maxTokens, double headRatio, double tailRatio,
                                String separator, TruncationContext context) {
        int available = maxTokens * 4 - separator.length();
        int headChars = (int) Math.floor(available * headRatio);
        int tailChars = (int) Math.floor(available * tailRatio);
        if (headChars + tailChars >= content.length()) {
            return content;
        }

        var result = content.substring(0, Math.max(0, headChars)) + separator
                     + content.substring(content.length() - Math.max(0, tailChars));
        // the 4-chars-per-token guess can be off for the configured counter
        while ((headChars > 0 || tailChars > 0) && tokenCounter.countTokens(result, context.model()) > maxTokens) {
            headChars = (int) (headChars * 0.9);
            tailChars = (int) (tailChars * 0.9);
            result = content.substring(0, headChars) + separator + content.substring(content.length() - tailChars);
        }
        return result;
    }

    @Override
    public int estimateSavings(String content, int maxTokens, TruncationContext context) {
        int originalTokens = tokenCounter.countTokens(content, context.model());
        if (originalTokens <= maxTokens) {
            return 0;
        }
        int estimatedFinal = Math.min((int) Math.floor(originalTokens * 0.75), maxTokens);
        return Math.max(0, originalTokens - estimatedFinal);
    }
}
