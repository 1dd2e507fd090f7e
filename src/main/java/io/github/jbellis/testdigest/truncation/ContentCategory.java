package io.github.jbellis.testdigest.truncation;

/**
 * Console output buckets of a failure, as the truncators see them.
 */
public enum ContentCategory {
    ERRORS,
    LOGS,
    WARNS,
    INFO,
    DEBUG
}
