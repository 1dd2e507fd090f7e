package io.github.jbellis.testdigest.report;

import io.github.jbellis.testdigest.tokens.EstimatingTokenCounter;
import io.github.jbellis.testdigest.truncation.EarlyTruncator;
import io.github.jbellis.testdigest.truncation.LateTruncator;
import io.github.jbellis.testdigest.truncation.TruncationConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ReportReducerTest {
    private static final EstimatingTokenCounter COUNTER = EstimatingTokenCounter.defaultCounter();
    private static final List<String> ERRORS = List.of("connection reset", "retry budget exhausted");

    private static LlmReporterOutput noisyReport() {
        var logs = IntStream.range(0, 300).mapToObj(i -> "log line " + i + " " + "x".repeat(40)).toList();
        var failure = new TestFailure("saves the order", "src/test/java/com/acme/OrderTest.java", 12, null,
                                      TestError.of("expected 201 but was 500", "AssertionFailedError"),
                                      new ConsoleOutput(logs, ERRORS, null, null, null));
        return new LlmReporterOutput(new TestSummary(1, 0, 1, 0, 900L, "2024-05-01T10:00:00Z"),
                                     List.of(failure), null, null);
    }

    private static ReportReducer reducer(TruncationConfig config, LateTruncator late) {
        return new ReportReducer(new EarlyTruncator(config, COUNTER), late);
    }

    @Test
    void disabledTruncationLeavesTheReportAlone() {
        var config = TruncationConfig.defaults();
        var report = noisyReport();
        assertSame(report, reducer(config, new LateTruncator(config, COUNTER)).reduce(report));
    }

    @Test
    void earlyTruncationShrinksConsoleCategories() {
        var config = TruncationConfig.defaults().withEnabled(true).withMaxTokens(2_000);
        var late = new LateTruncator(config, COUNTER);
        var report = noisyReport();

        var result = reducer(config, late).reduce(report);

        var console = result.failures().get(0).console();
        assertTrue(console.logs().size() < 300);
        assertTrue(console.logs().contains("..."));
        assertEquals(ERRORS, console.errors());
        assertTrue(late.estimate(result) <= 2_000);
        // early truncation was enough
        assertTrue(late.getMetrics().isEmpty());
    }

    @Test
    void lateTruncationAloneWhenEarlyIsOff() {
        var config = TruncationConfig.defaults().withEnabled(true).withMaxTokens(2_000).withPhases(false, true);
        var late = new LateTruncator(config, COUNTER);

        var result = reducer(config, late).reduce(noisyReport());

        assertEquals(1, late.getMetrics().size());
        assertTrue(String.join("\n", result.failures().get(0).console().logs()).length() <= 100);
    }
}
