package io.github.jbellis.testdigest.truncation;

import io.github.jbellis.testdigest.tokens.TokenCounter;
import io.github.jbellis.testdigest.truncation.strategies.ErrorFocusedStrategy;
import io.github.jbellis.testdigest.truncation.strategies.HeadTailStrategy;
import io.github.jbellis.testdigest.truncation.strategies.SmartStrategy;
import io.github.jbellis.testdigest.truncation.strategies.StackTraceStrategy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Fits content into a model's token budget by trying the registered strategies in order and
 * re-measuring each result. When nothing fits, an aggressive character-ratio cut is the last
 * resort; with that disabled the original content comes back with a warning.
 */
public class TruncationEngine {
    private static final Logger logger = LogManager.getLogger(TruncationEngine.class);

    public static final String EMPTY_CONTENT = "empty-content";
    public static final String AGGRESSIVE_FALLBACK = "aggressive-fallback";
    public static final String NO_STRATEGIES = "no-strategies";
    public static final String ALL_STRATEGIES_FAILED = "all-strategies-failed";
    public static final String FALLBACK_MARKER = "\n... [Content truncated by aggressive fallback]";
    public static final String FAILURE_WARNING = "Truncation failed - content exceeds token limits";

    private final TruncationEngineConfig config;
    private final TokenCounter tokenCounter;
    private final PriorityManager priorityManager;
    private final @Nullable MetricsTracker tracker;
    private final Map<String, TruncationStrategy> strategies = new LinkedHashMap<>();

    // stats, guarded by this
    private int totalTruncations;
    private long totalTokensSaved;
    private final Map<String, Integer> strategyUsage = new HashMap<>();
    private final Map<String, Integer> contentTypeBreakdown = new HashMap<>();

    public TruncationEngine(TruncationEngineConfig config, TokenCounter tokenCounter, PriorityManager priorityManager) {
        this(config, tokenCounter, priorityManager, null);
    }

    public TruncationEngine(TruncationEngineConfig config, TokenCounter tokenCounter, PriorityManager priorityManager,
                            @Nullable MetricsTracker tracker) {
        this.config = config;
        this.tokenCounter = tokenCounter;
        this.priorityManager = priorityManager;
        this.tracker = tracker;
    }

    public static TruncationEngine withDefaultStrategies(TruncationEngineConfig config, TokenCounter tokenCounter) {
        return withDefaultStrategies(config, tokenCounter, null);
    }

    /**
     * An engine with the head-tail, smart, error-focused and stack-trace strategies registered.
     */
    public static TruncationEngine withDefaultStrategies(TruncationEngineConfig config, TokenCounter tokenCounter,
                                                         @Nullable MetricsTracker tracker) {
        var engine = new TruncationEngine(config, tokenCounter, new PriorityManager(), tracker);
        engine.registerStrategy(new HeadTailStrategy(tokenCounter));
        engine.registerStrategy(new SmartStrategy(tokenCounter));
        engine.registerStrategy(new ErrorFocusedStrategy(tokenCounter));
        engine.registerStrategy(new StackTraceStrategy(tokenCounter));
        return engine;
    }

    public synchronized void registerStrategy(TruncationStrategy strategy) {
        strategies.put(strategy.name(), strategy);
    }

    public synchronized void unregisterStrategy(String name) {
        strategies.remove(name);
    }

    public synchronized List<TruncationStrategy> getStrategies() {
        return List.copyOf(strategies.values());
    }

    public TruncationEngineConfig config() {
        return config;
    }

    public TruncationResult truncate(String content, ContentType contentType) {
        return truncate(content, config.defaultModel(), contentType, TruncationOptions.defaults());
    }

    public TruncationResult truncate(String content, @Nullable String model, ContentType contentType,
                                     TruncationOptions options) {
        long start = System.nanoTime();
        var result = truncateContent(content, model, contentType, options);
        if (tracker != null && !result.strategyUsed().equals(TruncationResult.NONE)
            && !result.strategyUsed().equals(EMPTY_CONTENT)) {
            tracker.record(TruncationStage.ENGINE, result.tokenCount() + result.tokensSaved(), result.tokenCount(),
                           result.strategyUsed(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), null);
        }
        return result;
    }

    private TruncationResult truncateContent(String content, @Nullable String model, ContentType contentType,
                                             TruncationOptions options) {
        if (content.isBlank()) {
            return new TruncationResult(content, 0, 0, false, EMPTY_CONTENT, List.of());
        }

        var resolvedModel = resolveModel(model);
        int originalTokens = tokenCounter.countTokens(content, resolvedModel);
        int maxTokens = ModelContextWindows.getEffectiveMaxTokens(resolvedModel, options.maxTokens());
        if (originalTokens <= maxTokens) {
            return TruncationResult.unchanged(content, originalTokens);
        }

        var context = createContext(content, resolvedModel, maxTokens, contentType, options);
        var applicable = findApplicableStrategies(content, context, preferredStrategies(contentType, options));
        var warnings = new ArrayList<String>();
        if (applicable.isEmpty()) {
            logger.debug("No strategy applies to {} content of {} tokens", contentType.id(), originalTokens);
            return fallbackOrFail(content, content, originalTokens, context, warnings, NO_STRATEGIES);
        }

        @Nullable TruncationResult closest = null;
        int attempts = 0;
        for (var strategy : applicable) {
            if (attempts >= config.maxAttempts()) {
                break;
            }
            attempts++;
            try {
                var attempt = strategy.truncate(content, maxTokens, context);
                int actualTokens = tokenCounter.countTokens(attempt.content(), resolvedModel);
                if (actualTokens <= maxTokens && attempt.wasTruncated()) {
                    var result = new TruncationResult(attempt.content(), actualTokens, Math.max(0, originalTokens - actualTokens),
                                                      true, strategy.name(), concat(warnings, attempt.warnings()));
                    logger.debug("Strategy {} reduced {} tokens to {}", strategy.name(), originalTokens, actualTokens);
                    recordStats(result, contentType);
                    return result;
                }
                warnings.add("Strategy " + strategy.name() + " did not achieve target token count");
                if (closest == null || actualTokens < closest.tokenCount()) {
                    closest = new TruncationResult(attempt.content(), actualTokens, Math.max(0, originalTokens - actualTokens),
                                                   true, strategy.name(), attempt.warnings());
                }
            } catch (RuntimeException e) {
                logger.warn("Truncation strategy {} failed", strategy.name(), e);
                warnings.add("Strategy " + strategy.name() + " failed: " + e.getMessage());
            }
        }

        // the closest attempt is a better starting point for the character cut than the original
        var source = closest != null && closest.tokenCount() < originalTokens ? closest.content() : content;
        return fallbackOrFail(content, source, originalTokens, context, warnings, ALL_STRATEGIES_FAILED);
    }

    private TruncationResult fallbackOrFail(String content, String source, int originalTokens, TruncationContext context,
                                            List<String> warnings, String failure) {
        if (!config.enableAggressiveFallback()) {
            logger.warn("Unable to fit {} tokens into {} and aggressive fallback is disabled",
                        originalTokens, context.maxTokens());
            var all = new ArrayList<>(warnings);
            all.add(FAILURE_WARNING);
            return new TruncationResult(content, originalTokens, 0, false, failure, all);
        }
        var result = aggressiveFallback(source, originalTokens, context, warnings);
        recordStats(result, context.contentType());
        return result;
    }

    TruncationResult aggressiveFallback(String source, int originalTokens, TruncationContext context, List<String> warnings) {
        int maxTokens = context.maxTokens();
        int sourceTokens = Math.max(1, tokenCounter.countTokens(source, context.model()));
        int targetTokens = Math.min(maxTokens,
                                    ModelContextWindows.calculateTruncationTarget(sourceTokens, maxTokens, context.priority()));
        int targetLength = (int) Math.floor(source.length() * ((double) targetTokens / sourceTokens) * 0.9);

        var candidate = cutAtBoundary(source, targetLength) + FALLBACK_MARKER;
        while (targetLength > 0 && tokenCounter.countTokens(candidate, context.model()) > maxTokens) {
            targetLength = (int) Math.floor(targetLength * 0.9);
            candidate = cutAtBoundary(source, targetLength) + FALLBACK_MARKER;
        }
        if (tokenCounter.countTokens(candidate, context.model()) > maxTokens) {
            // budget smaller than the marker itself
            candidate = TruncationUtils.handleTinyLimit(maxTokens, source);
        }

        int tokens = tokenCounter.countTokens(candidate, context.model());
        logger.warn("Aggressive fallback cut {} tokens to {} (budget {})", originalTokens, tokens, maxTokens);
        return new TruncationResult(candidate, tokens, Math.max(0, originalTokens - tokens), true, AGGRESSIVE_FALLBACK,
                                    concat(warnings, List.of("Used aggressive fallback truncation - content may be incomplete")));
    }

    private static String cutAtBoundary(String text, int targetLength) {
        var truncated = text.substring(0, Math.min(text.length(), Math.max(0, targetLength)));
        int boundary = Math.max(truncated.lastIndexOf(' '), Math.max(truncated.lastIndexOf('\n'), truncated.lastIndexOf('.')));
        if (boundary > targetLength * 0.8) {
            truncated = truncated.substring(0, boundary + 1);
        }
        return truncated;
    }

    /**
     * Largest savings any applicable strategy predicts, without truncating.
     */
    public int estimateSavings(String content, @Nullable String model, ContentType contentType, TruncationOptions options) {
        var resolvedModel = resolveModel(model);
        int originalTokens = tokenCounter.countTokens(content, resolvedModel);
        int maxTokens = ModelContextWindows.getEffectiveMaxTokens(resolvedModel, options.maxTokens());
        if (originalTokens <= maxTokens) {
            return 0;
        }

        var context = createContext(content, resolvedModel, maxTokens, contentType, options);
        var applicable = findApplicableStrategies(content, context, preferredStrategies(contentType, options));
        if (applicable.isEmpty()) {
            return originalTokens - maxTokens;
        }
        int best = 0;
        for (var strategy : applicable) {
            try {
                best = Math.max(best, strategy.estimateSavings(content, maxTokens, context));
            } catch (RuntimeException e) {
                logger.debug("Savings estimate from {} failed", strategy.name(), e);
            }
        }
        return best;
    }

    public boolean needsTruncation(String content, @Nullable String model, @Nullable Integer maxTokens) {
        var resolvedModel = resolveModel(model);
        return ModelContextWindows.wouldExceedContext(tokenCounter.countTokens(content, resolvedModel), resolvedModel, maxTokens);
    }

    public synchronized TruncationStats getStats() {
        double average = totalTruncations == 0 ? 0.0 : (double) totalTokensSaved / totalTruncations;
        return new TruncationStats(totalTruncations, totalTokensSaved, average, strategyUsage, contentTypeBreakdown);
    }

    public synchronized void resetStats() {
        totalTruncations = 0;
        totalTokensSaved = 0;
        strategyUsage.clear();
        contentTypeBreakdown.clear();
    }

    private synchronized void recordStats(TruncationResult result, ContentType contentType) {
        if (!result.wasTruncated()) {
            return;
        }
        totalTruncations++;
        totalTokensSaved += result.tokensSaved();
        strategyUsage.merge(result.strategyUsed(), 1, Integer::sum);
        contentTypeBreakdown.merge(contentType.id(), 1, Integer::sum);
    }

    private String resolveModel(@Nullable String model) {
        return model == null || model.isBlank() ? config.defaultModel() : model;
    }

    private TruncationContext createContext(String content, String model, int maxTokens, ContentType contentType,
                                            TruncationOptions options) {
        var priority = options.priority() != null
                       ? options.priority()
                       : priorityManager.determinePriority(content, contentType);
        boolean preserveStructure = options.preserveStructure() != null
                                    ? options.preserveStructure()
                                    : priorityManager.getContentTypeConfig(contentType).preserveStructure();
        return new TruncationContext(model, maxTokens, contentType, priority, preserveStructure, options.metadata());
    }

    private List<String> preferredStrategies(ContentType contentType, TruncationOptions options) {
        return options.preferredStrategies().isEmpty()
               ? priorityManager.getContentTypeConfig(contentType).preferredStrategies()
               : options.preferredStrategies();
    }

    /**
     * Strategies that accept the content: preferred ones first in the caller's order, then the rest by
     * descending priority.
     */
    synchronized List<TruncationStrategy> findApplicableStrategies(String content, TruncationContext context,
                                                                   List<String> preferred) {
        var ordered = new ArrayList<TruncationStrategy>();
        for (var name : preferred) {
            var strategy = strategies.get(name);
            if (strategy != null && !ordered.contains(strategy) && strategy.canTruncate(content, context)) {
                ordered.add(strategy);
            }
        }
        strategies.values().stream()
                .filter(s -> !ordered.contains(s) && s.canTruncate(content, context))
                .sorted(Comparator.comparingInt(TruncationStrategy::priority).reversed())
                .forEach(ordered::add);
        return ordered;
    }

    private static List<String> concat(List<String> first, List<String> second) {
        var all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
