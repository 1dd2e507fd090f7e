package io.github.jbellis.testdigest.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A passed or skipped test, reported in verbose runs only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestResult(String test,
                         String file,
                         int line,
                         @Nullable Long duration,
                         Status status,
                         @Nullable List<String> suite) {
    public enum Status {
        @JsonProperty("passed") PASSED,
        @JsonProperty("skipped") SKIPPED
    }

    public TestResult {
        if (suite != null) {
            suite = List.copyOf(suite);
        }
    }
}
