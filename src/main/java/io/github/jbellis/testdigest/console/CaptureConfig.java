package io.github.jbellis.testdigest.console;

/**
 * Settings for {@link ConsoleCapture}.
 *
 * @param gracePeriodMs how long a stopped buffer survives to admit late asynchronous output
 */
public record CaptureConfig(boolean enabled,
                            long gracePeriodMs,
                            int maxBytes,
                            int maxLines,
                            boolean includeDebugOutput,
                            boolean stripAnsi) {
    public static final long DEFAULT_GRACE_PERIOD_MS = 100;
    public static final int DEFAULT_MAX_BYTES = 50_000;
    public static final int DEFAULT_MAX_LINES = 100;

    public CaptureConfig {
        if (gracePeriodMs < 0) {
            throw new IllegalArgumentException("gracePeriodMs must not be negative, got " + gracePeriodMs);
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive, got " + maxBytes);
        }
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive, got " + maxLines);
        }
    }

    public static CaptureConfig defaults() {
        return new CaptureConfig(true, DEFAULT_GRACE_PERIOD_MS, DEFAULT_MAX_BYTES, DEFAULT_MAX_LINES, false, true);
    }

    public CaptureConfig withGracePeriodMs(long gracePeriodMs) {
        return new CaptureConfig(enabled, gracePeriodMs, maxBytes, maxLines, includeDebugOutput, stripAnsi);
    }

    public CaptureConfig withLimits(int maxBytes, int maxLines) {
        return new CaptureConfig(enabled, gracePeriodMs, maxBytes, maxLines, includeDebugOutput, stripAnsi);
    }

    public CaptureConfig withIncludeDebugOutput(boolean includeDebugOutput) {
        return new CaptureConfig(enabled, gracePeriodMs, maxBytes, maxLines, includeDebugOutput, stripAnsi);
    }

    public CaptureConfig withEnabled(boolean enabled) {
        return new CaptureConfig(enabled, gracePeriodMs, maxBytes, maxLines, includeDebugOutput, stripAnsi);
    }
}
