package io.github.jbellis.testdigest.truncation.strategies;

import io.github.jbellis.testdigest.tokens.EstimatingTokenCounter;
import io.github.jbellis.testdigest.truncation.ContentType;
import io.github.jbellis.testdigest.truncation.TruncationContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SmartStrategyTest {
    private static final String ERROR_LINE = "ERROR: connection refused by db-host";

    private final SmartStrategy strategy = new SmartStrategy(EstimatingTokenCounter.defaultCounter());

    private static List<String> noise(int count) {
        return IntStream.range(0, count).mapToObj(i -> String.format("processing item %02d of the batch", i)).toList();
    }

    private static String withErrorAt(int index, int count) {
        var lines = new ArrayList<>(noise(count));
        lines.set(index, ERROR_LINE);
        return String.join("\n", lines);
    }

    @Test
    void keepsImportantLinesWithContext() {
        var content = withErrorAt(25, 50);
        var result = strategy.truncate(content, 40, TruncationContext.of("gpt-4", 40, ContentType.LOG));

        assertEquals(SmartStrategy.NAME, result.strategyUsed());
        assertTrue(result.content().contains("processing item 24 of the batch\n" + ERROR_LINE + "\nprocessing item 26 of the batch"));
        assertTrue(result.content().startsWith("...\n"));
        assertTrue(result.content().endsWith("\n..."));
        assertTrue(result.tokenCount() <= 40);
    }

    @Test
    void fallsBackToHeadTailWithoutImportantLines() {
        var content = String.join("\n", noise(50));
        var result = strategy.truncate(content, 40, TruncationContext.of("gpt-4", 40, ContentType.LOG));

        assertEquals(HeadTailStrategy.NAME, result.strategyUsed());
        assertTrue(result.warnings().contains("No important lines fit; used head/tail"));
        assertTrue(result.content().startsWith("processing item 00"));
    }

    @Test
    void tinyBudgetsAreHandledDeterministically() {
        var content = String.join("\n", noise(50));
        var first = strategy.truncate(content, 5, TruncationContext.of("gpt-4", 5, ContentType.LOG));
        var second = strategy.truncate(content, 5, TruncationContext.of("gpt-4", 5, ContentType.LOG));

        assertEquals(first, second);
        assertTrue(first.wasTruncated());
        assertTrue(first.content().endsWith("..."));
    }

    @Test
    void scoresLines() {
        assertEquals(0, strategy.lineImportance("   ", ContentType.TEST));
        assertEquals(1.0, strategy.lineImportance("expect(total).toBe(5)", ContentType.TEST), 1e-9);
        assertTrue(strategy.lineImportance("processing item 01 of the batch", ContentType.LOG) < SmartStrategy.IMPORTANCE_THRESHOLD);
        assertTrue(strategy.lineImportance(ERROR_LINE, ContentType.LOG) >= SmartStrategy.IMPORTANCE_THRESHOLD);
    }
}
