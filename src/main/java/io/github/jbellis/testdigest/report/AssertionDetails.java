package io.github.jbellis.testdigest.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Map;

/**
 * Expected/actual pair of a failed assertion. The type fields describe the values before any
 * truncation turned them into strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssertionDetails(@Nullable Object expected,
                               @Nullable Object actual,
                               @Nullable String operator,
                               @Nullable String expectedType,
                               @Nullable String actualType) {

    public static AssertionDetails of(@Nullable Object expected, @Nullable Object actual, @Nullable String operator) {
        return new AssertionDetails(expected, actual, operator, valueType(expected), valueType(actual));
    }

    public AssertionDetails withValues(@Nullable Object expected, @Nullable Object actual) {
        return new AssertionDetails(expected, actual, operator,
                                    expectedType != null ? expectedType : valueType(expected),
                                    actualType != null ? actualType : valueType(actual));
    }

    public static String valueType(@Nullable Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return "string";
    }
}
