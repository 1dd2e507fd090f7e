package io.github.jbellis.testdigest.truncation;

import io.github.jbellis.testdigest.tokens.EstimatingTokenCounter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class EarlyTruncatorTest {
    private static final EstimatingTokenCounter COUNTER = EstimatingTokenCounter.defaultCounter();
    // effective budget is floor(100 * 0.85) = 85 tokens
    private static final TruncationConfig CONFIG = TruncationConfig.defaults().withEnabled(true).withMaxTokens(100);
    private static final int BUDGET = 85;

    private static List<String> ordinaryLines() {
        return IntStream.range(0, 100).mapToObj(i -> String.format("line %02d with some ordinary text", i)).toList();
    }

    private static String ordinary() {
        return String.join("\n", ordinaryLines());
    }

    private static String withLine(int index, String line) {
        var lines = new ArrayList<>(ordinaryLines());
        lines.set(index, line);
        return String.join("\n", lines);
    }

    private static EarlyTruncator truncator(TruncationConfig.Strategy strategy) {
        return new EarlyTruncator(CONFIG.withStrategy(strategy), COUNTER);
    }

    @Test
    void smallContentPassesThrough() {
        var truncator = truncator(TruncationConfig.Strategy.SMART);
        var result = truncator.truncate("a short line", ContentCategory.LOGS);

        assertEquals("a short line", result.content());
        assertFalse(result.wasTruncated());
        assertEquals(TruncationResult.NONE, result.metrics().strategy());
        assertTrue(truncator.getMetrics().isEmpty());
        assertFalse(truncator.needsTruncation("   "));
        assertTrue(truncator.needsTruncation(ordinary()));
    }

    @Test
    void simpleKeepsHeadAndTail() {
        var result = truncator(TruncationConfig.Strategy.SIMPLE).truncate(ordinary(), ContentCategory.LOGS);

        assertEquals("simple", result.metrics().strategy());
        assertTrue(result.content().startsWith("line 00 with some ordinary text\nline 01"));
        assertTrue(result.content().contains("\n...\n"));
        assertTrue(result.content().endsWith("line 99 with some ordinary text"));
        assertTrue(COUNTER.estimateTokens(result.content()) <= BUDGET);
    }

    @Test
    void smartKeepsImportantLinesWithContext() {
        var content = withLine(50, "ERROR: payment declined for order 42");
        var result = truncator(TruncationConfig.Strategy.SMART).truncate(content, ContentCategory.LOGS);

        assertEquals("smart", result.metrics().strategy());
        assertEquals("line 49 with some ordinary text\nERROR: payment declined for order 42\nline 51 with some ordinary text",
                     result.content());
    }

    @Test
    void smartFallsBackToHeadTailWithoutImportantLines() {
        var result = truncator(TruncationConfig.Strategy.SMART).truncate(ordinary(), ContentCategory.INFO);

        assertEquals("smart", result.metrics().strategy());
        assertTrue(result.content().contains("\n...\n"));
        assertTrue(result.content().startsWith("line 00"));
    }

    @Test
    void errorsWithStackFramesKeepUserFrames() {
        var lines = new ArrayList<String>();
        lines.add("java.lang.IllegalStateException: boom");
        lines.add("\tat com.acme.Service.handle(Service.java:10)");
        lines.add("\tat com.acme.Controller.post(Controller.java:20)");
        for (int i = 0; i < 50; i++) {
            lines.add("\tat org.junit.platform.Engine.step" + i + "(Engine.java:" + i + ")");
        }
        lines.add("\tat com.acme.Main.main(Main.java:3)");

        var result = truncator(TruncationConfig.Strategy.SMART).truncate(String.join("\n", lines), ContentCategory.ERRORS);

        assertEquals("error-strategy", result.metrics().strategy());
        assertEquals(List.of("java.lang.IllegalStateException: boom",
                             "Stack trace (user code):",
                             "\tat com.acme.Service.handle(Service.java:10)",
                             "\tat com.acme.Controller.post(Controller.java:20)",
                             "\tat com.acme.Main.main(Main.java:3)",
                             "...[50 dependency frames omitted]"),
                     List.of(result.content().split("\n")));
    }

    @Test
    void priorityCutsLowValueCategoriesHardest() {
        var truncator = truncator(TruncationConfig.Strategy.PRIORITY);

        var debug = truncator.truncate(ordinary(), ContentCategory.DEBUG);
        assertEquals("priority", debug.metrics().strategy());
        assertTrue(debug.content().endsWith(EarlyTruncator.TRUNCATED_SUFFIX));
        // LOW keeps 30% of the budget
        assertTrue(COUNTER.estimateTokens(debug.content()) <= BUDGET * 0.3 + 5);

        var errors = truncator.truncate(withLine(70, "Expected 3 but got 4"), ContentCategory.ERRORS);
        // the failure line is picked first, then earlier lines fill the rest in their original order
        assertTrue(errors.content().startsWith("line 00"));
        assertTrue(errors.content().endsWith("line 06 with some ordinary text\nExpected 3 but got 4" + EarlyTruncator.PRIORITY_SUFFIX));
        assertTrue(COUNTER.estimateTokens(errors.content()) <= BUDGET);
    }

    @Test
    void tinyBudgets() {
        var result = truncator(TruncationConfig.Strategy.SMART).truncate(ordinary(), ContentCategory.LOGS, 8);
        assertEquals("tiny-limit", result.metrics().strategy());
        assertTrue(result.content().endsWith("..."));
    }

    @Test
    void overrideReplacesTheConfiguredBudget() {
        var truncator = truncator(TruncationConfig.Strategy.SMART);
        assertFalse(truncator.truncate(ordinary(), ContentCategory.LOGS, 10_000).wasTruncated());
    }

    @Test
    void metricsAreBounded() {
        var truncator = truncator(TruncationConfig.Strategy.SIMPLE);
        for (int i = 0; i < EarlyTruncator.MAX_METRICS + 5; i++) {
            truncator.truncate(ordinary(), ContentCategory.LOGS);
        }
        var metrics = truncator.getMetrics();
        assertEquals(EarlyTruncator.MAX_METRICS, metrics.size());
        var first = metrics.get(0);
        assertEquals(ContentCategory.LOGS, first.category());
        assertEquals(first.originalTokens() - first.truncatedTokens(), first.tokensRemoved());

        truncator.clearMetrics();
        assertTrue(truncator.getMetrics().isEmpty());
    }

    @Test
    void configCanBeSwapped() {
        var truncator = truncator(TruncationConfig.Strategy.SIMPLE);
        truncator.updateConfig(CONFIG.withStrategy(TruncationConfig.Strategy.PRIORITY));
        assertEquals("priority", truncator.truncate(ordinary(), ContentCategory.DEBUG).metrics().strategy());
        assertEquals(TruncationConfig.Strategy.PRIORITY, truncator.config().strategy());
    }

    @Test
    void onlyActualTruncationsReachTheTracker() {
        var tracker = new MetricsTracker();
        var truncator = new EarlyTruncator(CONFIG.withStrategy(TruncationConfig.Strategy.SIMPLE), COUNTER,
                                           new PriorityManager(), tracker);

        truncator.truncate("a short line", ContentCategory.LOGS, null, "CartTest.empty");
        truncator.truncate(ordinary(), ContentCategory.LOGS, null, "CartTest.full");

        var recorded = tracker.getAllMetrics();
        assertEquals(1, recorded.size());
        assertEquals(TruncationStage.EARLY, recorded.get(0).stage());
        assertEquals("simple", recorded.get(0).strategy());
        assertEquals("CartTest.full", recorded.get(0).testId());
        assertEquals(COUNTER.estimateTokens(ordinary()), recorded.get(0).originalTokens());
        assertTrue(recorded.get(0).truncatedTokens() <= BUDGET);
    }
}
