package io.github.jbellis.testdigest.tokens;

/**
 * Character-ratio estimator: {@code ceil(chars / charsPerToken)}.
 */
public final class EstimatingTokenCounter implements TokenCounter {
    public static final double DEFAULT_CHARS_PER_TOKEN = 4.0;

    private static final EstimatingTokenCounter DEFAULT = new EstimatingTokenCounter(DEFAULT_CHARS_PER_TOKEN);

    private final double charsPerToken;

    public EstimatingTokenCounter(double charsPerToken) {
        if (!(charsPerToken > 0)) {
            throw new IllegalArgumentException("charsPerToken must be positive, got " + charsPerToken);
        }
        this.charsPerToken = charsPerToken;
    }

    public static EstimatingTokenCounter defaultCounter() {
        return DEFAULT;
    }

    public double charsPerToken() {
        return charsPerToken;
    }

    @Override
    public int countTokens(String text, String model) {
        return estimateTokens(text);
    }

    @Override
    public int estimateTokens(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / charsPerToken);
    }

    /**
     * Inverse of {@link #estimateTokens}: the number of characters that fit in {@code tokens}.
     */
    public int charsForTokens(int tokens) {
        return (int) Math.floor(Math.max(0, tokens) * charsPerToken);
    }
}
