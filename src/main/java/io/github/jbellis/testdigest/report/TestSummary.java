package io.github.jbellis.testdigest.report;

/**
 * @param duration  run time in milliseconds
 * @param timestamp ISO-8601 start of the run
 */
public record TestSummary(int total, int passed, int failed, int skipped, long duration, String timestamp) {
    public TestSummary {
        if (total != passed + failed + skipped) {
            throw new IllegalArgumentException("total %d != passed %d + failed %d + skipped %d"
                                                       .formatted(total, passed, failed, skipped));
        }
    }
}
