package io.github.jbellis.testdigest.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The whole report handed to the model. Truncation only removes or shrinks parts of it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmReporterOutput(TestSummary summary,
                                @Nullable List<TestFailure> failures,
                                @Nullable List<TestResult> passed,
                                @Nullable List<TestResult> skipped) {
    public LlmReporterOutput {
        if (failures != null) {
            failures = List.copyOf(failures);
        }
        if (passed != null) {
            passed = List.copyOf(passed);
        }
        if (skipped != null) {
            skipped = List.copyOf(skipped);
        }
    }

    public LlmReporterOutput withFailures(@Nullable List<TestFailure> failures) {
        return new LlmReporterOutput(summary, failures, passed, skipped);
    }

    public LlmReporterOutput withPassed(@Nullable List<TestResult> passed) {
        return new LlmReporterOutput(summary, failures, passed, skipped);
    }

    public LlmReporterOutput withSkipped(@Nullable List<TestResult> skipped) {
        return new LlmReporterOutput(summary, failures, passed, skipped);
    }

    public boolean hasFailures() {
        return failures != null && !failures.isEmpty();
    }
}
