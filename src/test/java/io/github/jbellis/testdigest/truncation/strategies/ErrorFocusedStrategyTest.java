package io.github.jbellis.testdigest.truncation.strategies;

import io.github.jbellis.testdigest.tokens.EstimatingTokenCounter;
import io.github.jbellis.testdigest.truncation.ContentType;
import io.github.jbellis.testdigest.truncation.TruncationContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ErrorFocusedStrategyTest {
    private static final String EXPECTATION = "expected: 5 but got 4";
    private static final String ASSERTION = "AssertionError: values differ";

    private final ErrorFocusedStrategy strategy = new ErrorFocusedStrategy(EstimatingTokenCounter.defaultCounter());

    private static String testOutput() {
        var lines = new ArrayList<>(IntStream.range(0, 40)
                                            .mapToObj(i -> String.format("step %02d: preparing widget data", i))
                                            .toList());
        lines.set(20, EXPECTATION);
        lines.set(35, ASSERTION);
        return String.join("\n", lines);
    }

    private static TruncationContext context(int maxTokens) {
        return TruncationContext.of("gpt-4", maxTokens, ContentType.TEST);
    }

    @Test
    void keepsErrorSectionsSeparatedByEllipsis() {
        var result = strategy.truncate(testOutput(), 100, context(100));

        assertEquals(ErrorFocusedStrategy.NAME, result.strategyUsed());
        var content = result.content();
        assertTrue(content.startsWith("step 18: preparing widget data"));
        assertTrue(content.contains(EXPECTATION));
        assertTrue(content.contains("step 22: preparing widget data\n...\nstep 33: preparing widget data"));
        assertTrue(content.contains(ASSERTION));
        assertFalse(content.contains("step 00"));
        assertTrue(result.tokenCount() <= 100);
    }

    @Test
    void firstErrorSectionWinsWhenOnlyOneFits() {
        var result = strategy.truncate(testOutput(), 50, context(50));

        assertTrue(result.content().contains(EXPECTATION));
        assertFalse(result.content().contains(ASSERTION));
        assertTrue(result.tokenCount() <= 50);
    }

    @Test
    void firstErrorLineAloneUnderATightBudget() {
        var result = strategy.truncate(testOutput(), 3, context(3));

        assertTrue(EXPECTATION.startsWith(result.content()), result.content());
        assertFalse(result.content().isEmpty());
        assertTrue(result.tokenCount() <= 3);
    }

    @Test
    void keepsLeadingLinesWithoutErrors() {
        var content = String.join("\n", IntStream.range(0, 40)
                .mapToObj(i -> String.format("step %02d: preparing widget data", i)).toList());
        var result = strategy.truncate(content, 20, context(20));

        assertTrue(result.content().startsWith("step 00: preparing widget data\nstep 01"));
        assertTrue(result.tokenCount() <= 20);
    }

    @Test
    void appliesToFailureShapedContentOnly() {
        assertTrue(strategy.canTruncate("x", TruncationContext.of("gpt-4", 10, ContentType.LOG)));
        assertFalse(strategy.canTruncate("x", TruncationContext.of("gpt-4", 10, ContentType.CODE)));
    }

    @Test
    void recognizesErrorLines() {
        assertTrue(strategy.isErrorLine("java.lang.NullPointerException"));
        assertTrue(strategy.isErrorLine("assertThat(total).isEqualTo(5)"));
        assertTrue(strategy.isErrorLine("Caused by: timeout"));
        assertFalse(strategy.isErrorLine("step 01: preparing widget data"));
    }
}
