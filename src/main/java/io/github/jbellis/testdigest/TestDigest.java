package io.github.jbellis.testdigest;

import io.github.jbellis.testdigest.console.Console;
import io.github.jbellis.testdigest.console.ConsoleCapture;
import io.github.jbellis.testdigest.console.StdioFilter;
import io.github.jbellis.testdigest.console.StdioInterceptor;
import io.github.jbellis.testdigest.dedup.LogDeduplicator;
import io.github.jbellis.testdigest.report.LlmReporterOutput;
import io.github.jbellis.testdigest.report.ReportReducer;
import io.github.jbellis.testdigest.tokens.EstimatingTokenCounter;
import io.github.jbellis.testdigest.tokens.TokenCounter;
import io.github.jbellis.testdigest.truncation.EarlyTruncator;
import io.github.jbellis.testdigest.truncation.LateTruncator;
import io.github.jbellis.testdigest.truncation.MetricsTracker;
import io.github.jbellis.testdigest.truncation.PriorityManager;
import io.github.jbellis.testdigest.truncation.TruncationSummary;
import io.github.jbellis.testdigest.truncation.TruncationEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Wires the pipeline for one test run from a {@link TestDigestConfig}. Closing it stops capture and
 * restores the console.
 */
public class TestDigest implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TestDigest.class);

    private final TestDigestConfig config;
    private final TokenCounter tokenCounter;
    private final LogDeduplicator deduplicator;
    private final ConsoleCapture capture;
    private final StdioInterceptor stdioInterceptor;
    private final MetricsTracker metrics;
    private final TruncationEngine engine;
    private final EarlyTruncator earlyTruncator;
    private final LateTruncator lateTruncator;
    private final ReportReducer reducer;

    public TestDigest(TestDigestConfig config) {
        this(config, EstimatingTokenCounter.defaultCounter(), Console.global());
    }

    public TestDigest(TestDigestConfig config, TokenCounter tokenCounter, Console console) {
        this.config = config;
        this.tokenCounter = tokenCounter;
        this.deduplicator = new LogDeduplicator(config.deduplication());
        this.capture = new ConsoleCapture(config.capture(), deduplicator, console);
        this.stdioInterceptor = new StdioInterceptor((level, line) -> capture.captureAmbient(level, new Object[] {line}),
                                                     new StdioFilter(config.stdio()));
        this.metrics = new MetricsTracker();
        this.engine = TruncationEngine.withDefaultStrategies(config.engine(), tokenCounter, metrics);
        this.earlyTruncator = new EarlyTruncator(config.truncation(), tokenCounter, new PriorityManager(), metrics);
        this.lateTruncator = new LateTruncator(config.truncation(), tokenCounter, metrics);
        this.reducer = new ReportReducer(earlyTruncator, lateTruncator);
        logger.debug("Initialized with {}", config);
    }

    public static TestDigest fromFile(Path path) throws IOException {
        return new TestDigest(TestDigestConfig.load(path));
    }

    /**
     * The interceptor that routes stdout/stderr lines to the current test's buffer, filtered by
     * {@link TestDigestConfig#stdio()}. The caller enables it; {@link #close()} restores the streams.
     */
    public StdioInterceptor stdioInterceptor() {
        return stdioInterceptor;
    }

    public LlmReporterOutput reduce(LlmReporterOutput report) {
        return reducer.reduce(report);
    }

    public TestDigestConfig config() {
        return config;
    }

    public TokenCounter tokenCounter() {
        return tokenCounter;
    }

    public LogDeduplicator deduplicator() {
        return deduplicator;
    }

    public ConsoleCapture capture() {
        return capture;
    }

    public TruncationEngine engine() {
        return engine;
    }

    public EarlyTruncator earlyTruncator() {
        return earlyTruncator;
    }

    public LateTruncator lateTruncator() {
        return lateTruncator;
    }

    public MetricsTracker metrics() {
        return metrics;
    }

    /**
     * What the engine and both truncators have cut so far.
     */
    public TruncationSummary metricsSummary() {
        return metrics.getSummary();
    }

    @Override
    public void close() {
        stdioInterceptor.restore();
        capture.close();
    }
}
