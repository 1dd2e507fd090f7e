package io.github.jbellis.testdigest.truncation;

/**
 * Where in the pipeline a truncation happened.
 */
public enum TruncationStage {
    /** single console categories, while the report is assembled */
    EARLY,
    /** direct {@link TruncationEngine} calls */
    ENGINE,
    /** the finished report */
    LATE
}
