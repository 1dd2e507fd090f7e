package io.github.jbellis.testdigest.console;

public record CaptureStats(boolean patched, int activeBuffers, int pendingCleanups, int trackedGenerations) {
}
