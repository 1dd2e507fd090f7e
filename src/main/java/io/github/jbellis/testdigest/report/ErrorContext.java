package io.github.jbellis.testdigest.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Source lines around a failure.
 *
 * @param lineNumber    source line of the failure
 * @param codeStartLine source line of {@code code.get(0)}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorContext(List<String> code,
                           @Nullable Object expected,
                           @Nullable Object actual,
                           @Nullable Integer lineNumber,
                           @Nullable Integer columnNumber,
                           @Nullable Integer codeStartLine) {
    public ErrorContext {
        code = List.copyOf(code);
    }

    /**
     * Index into {@code code} of the failing line, if it can be located.
     */
    public @Nullable Integer failingIndex() {
        if (lineNumber == null) {
            return null;
        }
        int index = lineNumber - (codeStartLine == null ? 1 : codeStartLine);
        return index >= 0 && index < code.size() ? index : null;
    }

    public ErrorContext withCode(List<String> code) {
        return new ErrorContext(code, expected, actual, lineNumber, columnNumber, codeStartLine);
    }

    public ErrorContext withCode(List<String> code, @Nullable Integer codeStartLine) {
        return new ErrorContext(code, expected, actual, lineNumber, columnNumber, codeStartLine);
    }

    public ErrorContext withValues(@Nullable Object expected, @Nullable Object actual) {
        return new ErrorContext(code, expected, actual, lineNumber, columnNumber, codeStartLine);
    }
}
