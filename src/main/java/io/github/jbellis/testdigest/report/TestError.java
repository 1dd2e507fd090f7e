package io.github.jbellis.testdigest.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * @param type exception or error class name, e.g. {@code AssertionFailedError}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestError(String message,
                        String type,
                        @Nullable String stack,
                        @Nullable ErrorContext context,
                        @Nullable AssertionDetails assertion) {

    public static TestError of(String message, String type) {
        return new TestError(message, type, null, null, null);
    }

    public TestError withMessage(String message) {
        return new TestError(message, type, stack, context, assertion);
    }

    public TestError withStack(@Nullable String stack) {
        return new TestError(message, type, stack, context, assertion);
    }

    public TestError withContext(@Nullable ErrorContext context) {
        return new TestError(message, type, stack, context, assertion);
    }

    public TestError withAssertion(@Nullable AssertionDetails assertion) {
        return new TestError(message, type, stack, context, assertion);
    }
}
