package io.github.jbellis.testdigest.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * @param line  line where the test is declared
 * @param suite enclosing suites, outermost first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestFailure(String test,
                          String file,
                          int line,
                          @Nullable List<String> suite,
                          TestError error,
                          @Nullable ConsoleOutput console) {
    public TestFailure {
        if (suite != null) {
            suite = List.copyOf(suite);
        }
    }

    public TestFailure withError(TestError error) {
        return new TestFailure(test, file, line, suite, error, console);
    }

    public TestFailure withConsole(@Nullable ConsoleOutput console) {
        return new TestFailure(test, file, line, suite, error, console);
    }
}
