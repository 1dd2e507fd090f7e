package io.github.jbellis.testdigest.console;

/**
 * One method of the console surface, e.g. {@code log} or {@code warn}.
 */
@FunctionalInterface
public interface ConsoleFunction {
    void write(Object... args);
}
