package io.github.jbellis.testdigest.truncation;

import io.github.jbellis.testdigest.report.ConsoleOutput;
import io.github.jbellis.testdigest.report.ErrorContext;
import io.github.jbellis.testdigest.report.LlmReporterOutput;
import io.github.jbellis.testdigest.report.TestError;
import io.github.jbellis.testdigest.report.TestFailure;
import io.github.jbellis.testdigest.tokens.TokenCounter;
import io.github.jbellis.testdigest.util.Json;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Enforces the token budget on a finished report. Runs in three phases and stops as soon as the
 * pretty-printed JSON estimate fits:
 * <ol>
 *   <li>drop passed tests, then skipped tests</li>
 *   <li>cap each failure's console output and trim its stack, code context and assertion values</li>
 *   <li>up to five rounds of tighter caps; from round two stacks, messages and code context shrink,
 *       from round four only the first five failures are kept</li>
 * </ol>
 */
public class LateTruncator {
    private static final Logger logger = LogManager.getLogger(LateTruncator.class);

    public static final int DEFAULT_MAX_TOKENS = 100_000;
    public static final String PHASE_REMOVE_LOW_VALUE = "remove-low-value";
    public static final String PHASE_TRIM_FAILURES = "trim-failures";
    public static final String PHASE_PROGRESSIVE = "progressive-tightening";
    public static final String CODE_CONTEXT_TRUNCATED = "[code context truncated]";

    static final int MAX_METRICS = 100;
    static final int MAX_ROUNDS = 5;
    static final int MAX_FAILURES_KEPT = 5;
    static final int STACK_FRAMES = 10;
    static final int ASSERTION_VALUE_CHARS = 200;
    static final int CODE_CONTEXT_LINES = 2;
    static final int MESSAGE_CHARS = 512;

    private static final Map<ContentCategory, Integer> TRIM_LIMITS = limits(0, 100, 100, 100, 400);
    private static final Map<ContentCategory, Integer> TIGHTENING_BASE = limits(0, 50, 50, 50, 200);

    private final TokenCounter tokenCounter;
    private final @Nullable MetricsTracker tracker;
    private final Deque<LateTruncationMetrics> metrics = new ArrayDeque<>();
    private volatile TruncationConfig config;

    public LateTruncator(TruncationConfig config, TokenCounter tokenCounter) {
        this(config, tokenCounter, null);
    }

    public LateTruncator(TruncationConfig config, TokenCounter tokenCounter, @Nullable MetricsTracker tracker) {
        this.config = config;
        this.tokenCounter = tokenCounter;
        this.tracker = tracker;
    }

    public LlmReporterOutput apply(LlmReporterOutput report) {
        return apply(report, config);
    }

    /**
     * Returns {@code report} itself when truncation is off or the report already fits.
     */
    public LlmReporterOutput apply(LlmReporterOutput report, TruncationConfig config) {
        if (!config.enabled() || !config.enableLateTruncation()) {
            return report;
        }
        long start = System.nanoTime();
        int budget = budget(config);
        int originalTokens = estimate(report);
        if (originalTokens <= budget) {
            return report;
        }

        var phases = new ArrayList<String>();
        var current = removeLowValueSections(report, budget);
        phases.add(PHASE_REMOVE_LOW_VALUE);

        if (estimate(current) > budget) {
            current = trimFailures(current);
            phases.add(PHASE_TRIM_FAILURES);
        }
        if (estimate(current) > budget) {
            current = tightenProgressively(current, budget);
            phases.add(PHASE_PROGRESSIVE);
        }

        int finalTokens = estimate(current);
        recordMetrics(originalTokens, finalTokens, phases);
        if (tracker != null) {
            tracker.record(TruncationStage.LATE, originalTokens, finalTokens, String.join("+", phases),
                           TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), null);
        }
        if (finalTokens > budget) {
            logger.warn("Report still at {} tokens after late truncation (budget {})", finalTokens, budget);
        } else {
            logger.debug("Late truncation {} -> {} tokens via {}", originalTokens, finalTokens, phases);
        }
        return current;
    }

    public boolean needsTruncation(LlmReporterOutput report) {
        var current = config;
        return current.enabled() && current.enableLateTruncation() && estimate(report) > budget(current);
    }

    public int estimate(LlmReporterOutput report) {
        return tokenCounter.estimateTokens(Json.toPrettyJson(report));
    }

    private static int budget(TruncationConfig config) {
        return config.maxTokens() != null ? config.maxTokens() : DEFAULT_MAX_TOKENS;
    }

    LlmReporterOutput removeLowValueSections(LlmReporterOutput report, int budget) {
        var result = report;
        if (result.passed() != null) {
            result = result.withPassed(null);
            if (estimate(result) <= budget) {
                return result;
            }
        }
        if (result.skipped() != null) {
            result = result.withSkipped(null);
        }
        return result;
    }

    LlmReporterOutput trimFailures(LlmReporterOutput report) {
        if (!report.hasFailures()) {
            return report;
        }
        return report.withFailures(report.failures().stream().map(f -> truncateFailure(f, TRIM_LIMITS)).toList());
    }

    LlmReporterOutput tightenProgressively(LlmReporterOutput report, int budget) {
        var result = report;
        for (int round = 1; round <= MAX_ROUNDS && estimate(result) > budget; round++) {
            if (!result.hasFailures()) {
                break;
            }
            double ratio = 1 - round * 0.2;
            var limits = new EnumMap<ContentCategory, Integer>(ContentCategory.class);
            TIGHTENING_BASE.forEach((category, base) -> limits.put(category, (int) Math.floor(base * ratio)));

            int finalRound = round;
            var failures = result.failures().stream()
                    .map(f -> truncateFailure(f, limits))
                    .map(f -> finalRound >= 2 ? shrinkError(f, finalRound) : f)
                    .toList();
            if (round >= 4 && failures.size() > MAX_FAILURES_KEPT) {
                logger.debug("Dropping {} failures beyond the first {}", failures.size() - MAX_FAILURES_KEPT, MAX_FAILURES_KEPT);
                failures = failures.subList(0, MAX_FAILURES_KEPT);
            }
            result = result.withFailures(failures);
        }
        return result;
    }

    private static TestFailure shrinkError(TestFailure failure, int round) {
        var error = failure.error();
        if (error.stack() != null) {
            error = error.withStack(TruncationUtils.truncateStackTrace(error.stack(), Math.max(3, STACK_FRAMES - round * 2)));
        }
        if (error.message().length() > MESSAGE_CHARS) {
            error = error.withMessage(TruncationUtils.safeTrimToChars(error.message(), MESSAGE_CHARS - round * 100) + "...");
        }
        if (error.context() != null && error.context().code().size() > 1) {
            error = error.withContext(error.context().withCode(List.of(CODE_CONTEXT_TRUNCATED)));
        }
        return failure.withError(error);
    }

    private static TestFailure truncateFailure(TestFailure failure, Map<ContentCategory, Integer> limits) {
        var result = failure;
        if (failure.console() != null) {
            result = result.withConsole(capConsole(failure.console(), limits));
        }
        return result.withError(truncateErrorDetails(result.error()));
    }

    private static @Nullable ConsoleOutput capConsole(ConsoleOutput console, Map<ContentCategory, Integer> limits) {
        var capped = console;
        for (var category : ContentCategory.values()) {
            var lines = console.category(category);
            if (lines != null) {
                capped = capped.withCategory(category, capCategory(lines, limits.get(category)));
            }
        }
        return capped.isEmpty() ? null : capped;
    }

    static List<String> capCategory(List<String> lines, int charLimit) {
        if (charLimit <= 0) {
            return List.of();
        }
        if (String.join("\n", lines).length() <= charLimit) {
            return lines;
        }
        var capped = TruncationUtils.applyFairCaps(lines, charLimit, 50);
        var combined = String.join("\n", capped);
        if (combined.length() > charLimit) {
            return List.of(TruncationUtils.safeTrimToChars(combined, charLimit - 20) + "\n...[truncated]");
        }
        return capped;
    }

    private static TestError truncateErrorDetails(TestError error) {
        var result = error;
        if (error.stack() != null) {
            result = result.withStack(TruncationUtils.truncateStackTrace(error.stack(), STACK_FRAMES));
        }
        var context = error.context();
        if (context != null) {
            context = trimCodeContext(context)
                    .withValues(TruncationUtils.truncateAssertionValue(context.expected(), ASSERTION_VALUE_CHARS),
                                TruncationUtils.truncateAssertionValue(context.actual(), ASSERTION_VALUE_CHARS));
            result = result.withContext(context);
        }
        var assertion = error.assertion();
        if (assertion != null) {
            result = result.withAssertion(assertion.withValues(
                    TruncationUtils.truncateAssertionValue(assertion.expected(), ASSERTION_VALUE_CHARS),
                    TruncationUtils.truncateAssertionValue(assertion.actual(), ASSERTION_VALUE_CHARS)));
        }
        return result;
    }

    /**
     * Keeps {@link #CODE_CONTEXT_LINES} lines around the failing line and moves {@code codeStartLine}
     * along, so the failing line can still be located when the context is trimmed again.
     */
    static ErrorContext trimCodeContext(ErrorContext context) {
        var failing = context.failingIndex();
        var code = TruncationUtils.truncateCodeContext(context.code(), failing, CODE_CONTEXT_LINES);
        if (failing == null || context.lineNumber() == null) {
            return context.withCode(code);
        }
        int first = Math.max(0, failing - CODE_CONTEXT_LINES);
        // a leading "..." takes the slot before the first kept line
        int startLine = context.lineNumber() - failing + first - (first > 0 ? 1 : 0);
        return context.withCode(code, startLine);
    }

    private void recordMetrics(int originalTokens, int finalTokens, List<String> phases) {
        synchronized (metrics) {
            metrics.addLast(new LateTruncationMetrics(originalTokens, finalTokens, originalTokens - finalTokens, phases,
                                                      System.currentTimeMillis()));
            while (metrics.size() > MAX_METRICS) {
                metrics.removeFirst();
            }
        }
    }

    public List<LateTruncationMetrics> getMetrics() {
        synchronized (metrics) {
            return List.copyOf(metrics);
        }
    }

    public TruncationConfig config() {
        return config;
    }

    public void updateConfig(TruncationConfig config) {
        this.config = config;
    }

    private static Map<ContentCategory, Integer> limits(int debug, int info, int warns, int logs, int errors) {
        var limits = new EnumMap<ContentCategory, Integer>(ContentCategory.class);
        limits.put(ContentCategory.DEBUG, debug);
        limits.put(ContentCategory.INFO, info);
        limits.put(ContentCategory.WARNS, warns);
        limits.put(ContentCategory.LOGS, logs);
        limits.put(ContentCategory.ERRORS, errors);
        return Map.copyOf(limits);
    }
}
