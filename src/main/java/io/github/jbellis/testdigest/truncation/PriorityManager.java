package io.github.jbellis.testdigest.truncation;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Classifies fragments by importance. A fragment starts at its content type's default priority
 * and is raised by matching rules; rules never lower it.
 */
public class PriorityManager {
    public static final List<PriorityRule> DEFAULT_RULES = List.of(
            new PriorityRule(Pattern.compile("\\b(error|exception|failed|failure|crash|panic)\\b", Pattern.CASE_INSENSITIVE),
                             ContentPriority.CRITICAL, null, "Error-related content"),
            new PriorityRule(Pattern.compile("\\b(test.*failed|assertion.*failed|expect.*to)\\b", Pattern.CASE_INSENSITIVE),
                             ContentPriority.CRITICAL, ContentType.TEST, "Test failure information"),
            new PriorityRule(Pattern.compile("\\b(function|class|interface|type|export|import)\\b", Pattern.CASE_INSENSITIVE),
                             ContentPriority.HIGH, ContentType.CODE, "Important code structures"),
            new PriorityRule(Pattern.compile("\\b(warning|warn|deprecated|todo|fixme)\\b", Pattern.CASE_INSENSITIVE),
                             ContentPriority.MEDIUM, null, "Warning and maintenance notices"),
            new PriorityRule(Pattern.compile("\\b(debug|trace|verbose|log)\\b", Pattern.CASE_INSENSITIVE),
                             ContentPriority.LOW, null, "Debug and logging information"),
            new PriorityRule(Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}"),
                             ContentPriority.DISPOSABLE, null, "Timestamp information"));

    private final Map<ContentType, ContentTypeConfig> contentTypeConfigs = new EnumMap<>(ContentType.class);
    private final List<PriorityRule> rules;

    public PriorityManager() {
        this(DEFAULT_RULES);
    }

    public PriorityManager(List<PriorityRule> rules) {
        this.rules = new ArrayList<>(rules);
        for (var config : defaultContentTypeConfigs()) {
            contentTypeConfigs.put(config.type(), config);
        }
    }

    public static List<ContentTypeConfig> defaultContentTypeConfigs() {
        return List.of(
                new ContentTypeConfig(ContentType.TEXT, ContentPriority.MEDIUM, false, List.of(), 0.7),
                new ContentTypeConfig(ContentType.JSON, ContentPriority.HIGH, true, List.of(), 0.5),
                new ContentTypeConfig(ContentType.CODE, ContentPriority.HIGH, true, List.of("smart"), 0.4),
                new ContentTypeConfig(ContentType.ERROR, ContentPriority.CRITICAL, true,
                                      List.of("stack-trace", "error-focused"), 0.2),
                new ContentTypeConfig(ContentType.TEST, ContentPriority.HIGH, false, List.of("error-focused"), 0.6),
                new ContentTypeConfig(ContentType.LOG, ContentPriority.LOW, false, List.of("smart"), 0.8),
                new ContentTypeConfig(ContentType.MARKDOWN, ContentPriority.MEDIUM, true, List.of(), 0.6));
    }

    public synchronized ContentPriority determinePriority(String content, ContentType contentType) {
        var priority = getContentTypeConfig(contentType).defaultPriority();
        for (var rule : rules) {
            if (rule.appliesTo(contentType) && rule.priority().isHigherThan(priority) && rule.matches(content)) {
                priority = rule.priority();
            }
        }
        return priority;
    }

    public synchronized ContentTypeConfig getContentTypeConfig(ContentType contentType) {
        var config = contentTypeConfigs.get(contentType);
        return config != null ? config : contentTypeConfigs.get(ContentType.TEXT);
    }

    public synchronized void updateContentTypeConfig(ContentTypeConfig config) {
        contentTypeConfigs.put(config.type(), config);
    }

    public synchronized void addPriorityRule(PriorityRule rule) {
        rules.add(rule);
    }

    public synchronized List<PriorityRule> getPriorityRules() {
        return List.copyOf(rules);
    }

    /**
     * Importance on a 0..100 scale: 20 per priority step above DISPOSABLE, a bonus for content types
     * that default to CRITICAL, plus the optional caller-supplied factors.
     *
     * @param fileImportance   0..1
     * @param contextRelevance 0..1
     */
    public double scoreContentImportance(String content, ContentType contentType,
                                         double fileImportance, double contextRelevance, boolean userSpecified) {
        var priority = determinePriority(content, contentType);
        double score = (6 - priority.level()) * 20;
        if (getContentTypeConfig(contentType).defaultPriority() == ContentPriority.CRITICAL) {
            score += 10;
        }
        score += fileImportance * 20;
        score += contextRelevance * 15;
        if (userSpecified) {
            score += 25;
        }
        return Math.min(100, Math.max(0, score));
    }

    public double scoreContentImportance(String content, ContentType contentType) {
        return scoreContentImportance(content, contentType, 0, 0, false);
    }

    public static boolean shouldPreserveContent(ContentPriority priority, double truncationPressure) {
        return priority.survives(truncationPressure);
    }
}
