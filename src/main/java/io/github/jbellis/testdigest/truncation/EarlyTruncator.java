package io.github.jbellis.testdigest.truncation;

import io.github.jbellis.testdigest.tokens.TokenCounter;
import io.github.jbellis.testdigest.util.PatternConstants;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Synchronous truncation of single report fragments while the report is assembled. Works on the
 * cheap token estimate only.
 */
public class EarlyTruncator {
    private static final Logger logger = LogManager.getLogger(EarlyTruncator.class);

    static final int MAX_METRICS = 100;
    static final int MAX_USER_FRAMES = 5;

    public static final String PRIORITY_SUFFIX = "\n...[priority-based truncation]";
    public static final String TRUNCATED_SUFFIX = "\n...[truncated]";

    public record Result(String content, EarlyTruncationMetrics metrics) {
        public boolean wasTruncated() {
            return !metrics.strategy().equals(TruncationResult.NONE);
        }
    }

    private final TokenCounter tokenCounter;
    private final PriorityManager priorityManager;
    private final @Nullable MetricsTracker tracker;
    private final Deque<EarlyTruncationMetrics> metrics = new ArrayDeque<>();
    private volatile TruncationConfig config;

    public EarlyTruncator(TruncationConfig config, TokenCounter tokenCounter) {
        this(config, tokenCounter, new PriorityManager());
    }

    public EarlyTruncator(TruncationConfig config, TokenCounter tokenCounter, PriorityManager priorityManager) {
        this(config, tokenCounter, priorityManager, null);
    }

    public EarlyTruncator(TruncationConfig config, TokenCounter tokenCounter, PriorityManager priorityManager,
                          @Nullable MetricsTracker tracker) {
        this.config = config;
        this.tokenCounter = tokenCounter;
        this.priorityManager = priorityManager;
        this.tracker = tracker;
    }

    public boolean needsTruncation(String content) {
        return needsTruncation(content, null);
    }

    private boolean needsTruncation(String content, @Nullable Integer maxTokensOverride) {
        if (content.isBlank()) {
            return false;
        }
        return tokenCounter.estimateTokens(content) > budget(maxTokensOverride);
    }

    public Result truncate(String content, @Nullable ContentCategory category) {
        return truncate(content, category, null);
    }

    public Result truncate(String content, @Nullable ContentCategory category, @Nullable Integer maxTokensOverride) {
        return truncate(content, category, maxTokensOverride, null);
    }

    /**
     * @param maxTokensOverride budget for this fragment instead of the configured one
     * @param testId            test the fragment belongs to, passed on to the {@link MetricsTracker}
     */
    public Result truncate(String content, @Nullable ContentCategory category, @Nullable Integer maxTokensOverride,
                           @Nullable String testId) {
        long start = System.nanoTime();
        var result = truncateFragment(content, category, maxTokensOverride);
        if (tracker != null && result.wasTruncated()) {
            var recorded = result.metrics();
            tracker.record(TruncationStage.EARLY, recorded.originalTokens(), recorded.truncatedTokens(),
                           recorded.strategy(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), testId);
        }
        return result;
    }

    private Result truncateFragment(String content, @Nullable ContentCategory category, @Nullable Integer maxTokensOverride) {
        int originalTokens = tokenCounter.estimateTokens(content);
        if (!needsTruncation(content, maxTokensOverride)) {
            return record(content, originalTokens, TruncationResult.NONE, category);
        }

        int maxTokens = budget(maxTokensOverride);
        if (maxTokens < 10) {
            return record(TruncationUtils.handleTinyLimit(maxTokens, content), originalTokens, "tiny-limit", category);
        }

        var current = config;
        String strategy;
        String truncated;
        switch (current.strategy()) {
            case SIMPLE -> {
                strategy = "simple";
                truncated = applySimple(content, maxTokens);
            }
            case PRIORITY -> {
                strategy = "priority";
                truncated = applyPriority(content, maxTokens, category);
            }
            default -> {
                if (category == ContentCategory.ERRORS && PatternConstants.containsStackFrame(content)) {
                    strategy = "error-strategy";
                    truncated = applyErrorStrategy(content, maxTokens);
                } else {
                    strategy = "smart";
                    truncated = applySmart(content, maxTokens, category);
                }
            }
        }
        if (truncated.isBlank()) {
            truncated = applySimple(content, maxTokens);
        }
        return record(fit(truncated, maxTokens), originalTokens, strategy, category);
    }

    private int budget(@Nullable Integer maxTokensOverride) {
        var current = config;
        var requested = maxTokensOverride != null ? maxTokensOverride : current.maxTokens();
        return ModelContextWindows.getEffectiveMaxTokens(current.modelOrDefault(), requested);
    }

    String applySimple(String content, int maxTokens) {
        int targetChars = TruncationUtils.estimateCharsForTokens(maxTokens);
        var lines = TruncationUtils.splitLines(content);
        if (lines.size() <= 3) {
            return TruncationUtils.safeTrimToChars(content, targetChars);
        }

        double perSection = targetChars * 0.4;
        int span = (int) Math.floor(lines.size() * 0.4);
        var head = new ArrayList<String>();
        int headChars = 0;
        for (int i = 0; i < span; i++) {
            var line = lines.get(i);
            if (headChars + line.length() > perSection) {
                break;
            }
            head.add(line);
            headChars += line.length() + 1;
        }

        var tail = new ArrayDeque<String>();
        int tailChars = 0;
        for (int i = lines.size() - 1; i >= lines.size() - span; i--) {
            var line = lines.get(i);
            if (tailChars + line.length() > perSection) {
                break;
            }
            tail.addFirst(line);
            tailChars += line.length() + 1;
        }
        return TruncationUtils.joinWithEllipsis(List.of(String.join("\n", head), String.join("\n", tail)), "\n...\n");
    }

    String applySmart(String content, int maxTokens, @Nullable ContentCategory category) {
        var lines = TruncationUtils.splitLines(content);
        int targetChars = TruncationUtils.estimateCharsForTokens(maxTokens);

        var important = new ArrayList<Integer>();
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (PatternConstants.isErrorMessageLine(line)
                || PatternConstants.hasPriorityKeyword(line)
                || (category == ContentCategory.ERRORS && PatternConstants.isStackFrameLine(line)
                    && PatternConstants.isUserCodePath(line))) {
                important.add(i);
            }
        }

        var chunks = new ArrayList<String>();
        var chunk = new ArrayList<String>();
        int lastIndex = -2;
        int totalChars = 0;
        for (int idx : TruncationUtils.extractLinesWithContext(lines.size(), important, 1)) {
            if (idx > lastIndex + 1 && !chunk.isEmpty()) {
                chunks.add(String.join("\n", chunk));
                chunk.clear();
            }
            var line = lines.get(idx);
            if (totalChars + line.length() > targetChars * 0.9) {
                break;
            }
            chunk.add(line);
            totalChars += line.length() + 1;
            lastIndex = idx;
        }
        if (!chunk.isEmpty()) {
            chunks.add(String.join("\n", chunk));
        }

        if (chunks.isEmpty() || totalChars < targetChars * 0.3) {
            logger.debug("Too little important content ({} chars), using head/tail", totalChars);
            return applySimple(content, maxTokens);
        }
        return TruncationUtils.joinWithEllipsis(chunks, "\n...\n");
    }

    String applyPriority(String content, int maxTokens, @Nullable ContentCategory category) {
        ContentPriority priority;
        if (category == null) {
            priority = priorityManager.determinePriority(content, ContentType.LOG);
        } else {
            priority = switch (category) {
                case ERRORS -> ContentPriority.CRITICAL;
                case WARNS -> ContentPriority.HIGH;
                case INFO -> ContentPriority.MEDIUM;
                case DEBUG -> ContentPriority.LOW;
                case LOGS -> priorityManager.determinePriority(content, ContentType.LOG);
            };
        }

        int targetTokens = (int) Math.floor(maxTokens * priority.preservationRatio());
        int targetChars = TruncationUtils.estimateCharsForTokens(targetTokens);
        if (priority.level() > ContentPriority.HIGH.level()) {
            return TruncationUtils.safeTrimToChars(content, targetChars, true, 0.1) + TRUNCATED_SUFFIX;
        }

        var lines = TruncationUtils.splitLines(content);
        var kept = new TreeSet<Integer>();
        int totalChars = 0;
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if ((PatternConstants.hasPriorityKeyword(line) || PatternConstants.isErrorMessageLine(line))
                && totalChars + line.length() < targetChars * 0.8) {
                kept.add(i);
                totalChars += line.length() + 1;
            }
        }
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (!kept.contains(i) && totalChars + line.length() < targetChars) {
                kept.add(i);
                totalChars += line.length() + 1;
            }
        }

        var out = new ArrayList<String>();
        for (int i : kept) {
            out.add(lines.get(i));
        }
        return String.join("\n", out) + PRIORITY_SUFFIX;
    }

    String applyErrorStrategy(String content, int maxTokens) {
        var lines = TruncationUtils.splitLines(content);
        int targetChars = TruncationUtils.estimateCharsForTokens(maxTokens);
        var result = new ArrayList<String>();
        int currentChars = 0;

        for (var line : lines) {
            if (PatternConstants.isErrorMessageLine(line)) {
                result.add(line);
                currentChars += line.length() + 1;
                if (currentChars > targetChars * 0.3) {
                    break;
                }
            }
        }

        var userFrames = new ArrayList<String>();
        int dependencyFrames = 0;
        for (var line : lines) {
            if (!PatternConstants.isStackFrameLine(line) || PatternConstants.isErrorMessageLine(line)) {
                continue;
            }
            if (PatternConstants.ELIDED_FRAMES.matcher(line).matches() || !PatternConstants.isUserCodePath(line)) {
                dependencyFrames++;
            } else if (userFrames.size() < MAX_USER_FRAMES) {
                userFrames.add(line);
            }
        }

        if (!userFrames.isEmpty()) {
            result.add("Stack trace (user code):");
            for (var frame : userFrames) {
                if (currentChars + frame.length() > targetChars * 0.8) {
                    break;
                }
                result.add(frame);
                currentChars += frame.length() + 1;
            }
            if (dependencyFrames > 0) {
                result.add("...[" + dependencyFrames + " dependency frames omitted]");
            }
        }
        return String.join("\n", result);
    }

    // strategies size by characters; make sure the estimate agrees
    private String fit(String text, int maxTokens) {
        var result = text;
        while (!result.isEmpty() && tokenCounter.estimateTokens(result) > maxTokens) {
            int estimate = tokenCounter.estimateTokens(result);
            int target = (int) Math.floor(result.length() * ((double) maxTokens / estimate) * 0.95);
            result = TruncationUtils.safeTrimToChars(result, Math.min(target, result.length() - 1), true, 0);
        }
        return result;
    }

    private Result record(String content, int originalTokens, String strategy, @Nullable ContentCategory category) {
        int truncatedTokens = tokenCounter.estimateTokens(content);
        int removed = Math.max(0, originalTokens - truncatedTokens);
        var entry = new EarlyTruncationMetrics(originalTokens, truncatedTokens, removed, strategy, category,
                                               System.currentTimeMillis());
        if (removed > 0) {
            synchronized (metrics) {
                metrics.addLast(entry);
                while (metrics.size() > MAX_METRICS) {
                    metrics.removeFirst();
                }
            }
            logger.debug("Early truncation ({}) of {}: {} -> {} tokens", strategy, category, originalTokens, truncatedTokens);
        }
        return new Result(content, entry);
    }

    public List<EarlyTruncationMetrics> getMetrics() {
        synchronized (metrics) {
            return List.copyOf(metrics);
        }
    }

    public void clearMetrics() {
        synchronized (metrics) {
            metrics.clear();
        }
    }

    public TruncationConfig config() {
        return config;
    }

    public void updateConfig(TruncationConfig config) {
        this.config = config;
    }
}
