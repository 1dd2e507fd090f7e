package io.github.jbellis.testdigest.console;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * What a test wrote while captured.
 *
 * @param failure what the test body threw, for {@link ConsoleCapture#runWithCapture}; null otherwise
 */
public record CaptureResult(String testId, List<ConsoleEvent> entries, @Nullable Throwable failure) {
    public CaptureResult {
        entries = List.copyOf(entries);
    }

    public static CaptureResult empty(String testId) {
        return new CaptureResult(testId, List.of(), null);
    }

    public CaptureResult withFailure(@Nullable Throwable failure) {
        return new CaptureResult(testId, entries, failure);
    }

    public boolean failed() {
        return failure != null;
    }
}
