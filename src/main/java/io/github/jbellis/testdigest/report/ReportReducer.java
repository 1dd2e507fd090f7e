package io.github.jbellis.testdigest.report;

import io.github.jbellis.testdigest.truncation.ContentCategory;
import io.github.jbellis.testdigest.truncation.EarlyTruncator;
import io.github.jbellis.testdigest.truncation.LateTruncator;
import io.github.jbellis.testdigest.truncation.ModelContextWindows;
import io.github.jbellis.testdigest.truncation.TruncationConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Brings an assembled report under the configured token budget: early truncation of every failure's
 * console categories, then late truncation of the whole report.
 */
public class ReportReducer {
    private static final Logger logger = LogManager.getLogger(ReportReducer.class);

    static final int MIN_CATEGORY_TOKENS = 10;

    private final EarlyTruncator early;
    private final LateTruncator late;

    public ReportReducer(EarlyTruncator early, LateTruncator late) {
        this.early = early;
        this.late = late;
    }

    public LlmReporterOutput reduce(LlmReporterOutput report) {
        var config = late.config();
        if (!config.enabled()) {
            return report;
        }

        int before = late.estimate(report);
        var result = config.enableEarlyTruncation() ? truncateConsoles(report, config) : report;
        result = late.apply(result, config);
        int after = late.estimate(result);
        if (after < before) {
            logger.info("Reduced report from {} to {} tokens", before, after);
        }
        return result;
    }

    private LlmReporterOutput truncateConsoles(LlmReporterOutput report, TruncationConfig config) {
        if (!report.hasFailures()) {
            return report;
        }

        int categories = 0;
        for (var failure : report.failures()) {
            if (failure.console() != null) {
                categories += (int) Arrays.stream(ContentCategory.values())
                        .filter(c -> failure.console().category(c) != null)
                        .count();
            }
        }
        if (categories == 0) {
            return report;
        }
        int budget = config.maxTokens() != null
                     ? config.maxTokens()
                     : ModelContextWindows.getEffectiveMaxTokens(config.modelOrDefault());
        int share = Math.max(MIN_CATEGORY_TOKENS, budget / categories);

        var failures = new ArrayList<TestFailure>();
        for (var failure : report.failures()) {
            var console = failure.console();
            if (console == null) {
                failures.add(failure);
                continue;
            }
            for (var category : ContentCategory.values()) {
                var lines = console.category(category);
                if (lines == null) {
                    continue;
                }
                var truncated = early.truncate(String.join("\n", lines), category, share, failure.test());
                if (truncated.wasTruncated()) {
                    console = console.withCategory(category, Arrays.asList(truncated.content().split("\n", -1)));
                }
            }
            failures.add(failure.withConsole(console));
        }
        return report.withFailures(failures);
    }
}
