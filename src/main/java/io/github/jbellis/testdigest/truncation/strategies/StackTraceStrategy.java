package io.github.jbellis.testdigest.truncation.strategies;

import io.github.jbellis.testdigest.tokens.TokenCounter;
import io.github.jbellis.testdigest.truncation.ContentType;
import io.github.jbellis.testdigest.truncation.TruncationContext;
import io.github.jbellis.testdigest.truncation.TruncationResult;
import io.github.jbellis.testdigest.truncation.TruncationStrategy;
import io.github.jbellis.testdigest.truncation.TruncationUtils;
import io.github.jbellis.testdigest.util.PatternConstants;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Trims stack traces frame by frame. Error headers and {@code Caused by:} lines always survive, as do
 * the first {@code minUserFrames} user-code frames (metadata, default 3). The remaining budget goes to
 * user frames and then to dependency frames, by importance. Output keeps the original order and
 * replaces each omitted run with {@code "    ... N more frame(s)"}.
 *
 * <p>Metadata {@code userPackages} (list of class-name prefixes) narrows what counts as user code
 * in JVM traces.
 */
public class StackTraceStrategy implements TruncationStrategy {
    private static final Logger logger = LogManager.getLogger(StackTraceStrategy.class);

    public static final String NAME = "stack-trace";
    public static final int DEFAULT_MIN_USER_FRAMES = 3;

    private static final Pattern FRAME_START = Pattern.compile("^\\s*at\\s");
    private static final List<String> IMPORTANT_FUNCTION_KEYWORDS = List.of("test", "spec", "describe", "it", "expect", "assert");
    private static final List<String> ENTRY_POINTS = List.of("main", "index", "app", "run");

    enum Kind {
        HEADER,
        FRAME
    }

    record TraceLine(int index, String text, Kind kind, boolean userCode, double importance) {
    }

    private final TokenCounter tokenCounter;

    public StackTraceStrategy(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 6;
    }

    @Override
    public boolean canTruncate(String content, TruncationContext context) {
        return context.contentType() == ContentType.ERROR
               && content.lines().anyMatch(line -> FRAME_START.matcher(line).find());
    }

    @Override
    public TruncationResult truncate(String content, int maxTokens, TruncationContext context) {
        int originalTokens = tokenCounter.countTokens(content, context.model());
        if (originalTokens <= maxTokens) {
            return TruncationResult.unchanged(content, originalTokens);
        }

        var lines = parse(content, context.metadataStrings("userPackages"));
        int minUserFrames = Math.max(0, context.metadataInt("minUserFrames", DEFAULT_MIN_USER_FRAMES));

        var kept = new HashSet<Integer>();
        var guaranteed = new HashSet<Integer>();
        int userTaken = 0;
        for (var line : lines) {
            if (line.kind() == Kind.HEADER) {
                kept.add(line.index());
                guaranteed.add(line.index());
            } else if (line.userCode() && userTaken < minUserFrames) {
                kept.add(line.index());
                guaranteed.add(line.index());
                userTaken++;
            }
        }

        var byImportance = Comparator.comparingDouble(TraceLine::importance).reversed()
                .thenComparingInt(TraceLine::index);
        var userCandidates = lines.stream()
                .filter(l -> l.kind() == Kind.FRAME && l.userCode() && !kept.contains(l.index()))
                .sorted(byImportance)
                .toList();
        var dependencyCandidates = lines.stream()
                .filter(l -> l.kind() == Kind.FRAME && !l.userCode())
                .sorted(byImportance)
                .toList();

        for (var group : List.of(userCandidates, dependencyCandidates)) {
            for (var candidate : group) {
                kept.add(candidate.index());
                if (tokens(render(lines, kept), context) > maxTokens) {
                    kept.remove(candidate.index());
                }
            }
        }

        // markers can push a guaranteed-only selection over; shed optional frames, least important first
        var optional = lines.stream()
                .filter(l -> kept.contains(l.index()) && !guaranteed.contains(l.index()))
                .sorted(byImportance.reversed())
                .toList();
        var result = render(lines, kept);
        for (var frame : optional) {
            if (tokens(result, context) <= maxTokens) {
                break;
            }
            kept.remove(frame.index());
            result = render(lines, kept);
        }

        if (result.equals(content)) {
            return TruncationResult.unchanged(content, originalTokens);
        }
        int resultTokens = tokens(result, context);
        logger.debug("Stack trace reduced from {} to {} tokens, {} of {} lines kept",
                     originalTokens, resultTokens, kept.size(), lines.size());
        var truncated = TruncationResult.truncated(result, originalTokens, resultTokens, NAME);
        return resultTokens > maxTokens
               ? truncated.withWarning("Required stack trace lines exceed the token limit")
               : truncated;
    }

    List<TraceLine> parse(String content, List<String> userPackages) {
        var parsed = new ArrayList<TraceLine>();
        var raw = TruncationUtils.splitLines(content);
        for (int i = 0; i < raw.size(); i++) {
            var text = raw.get(i);
            if (text.isBlank()) {
                continue;
            }
            if (PatternConstants.ELIDED_FRAMES.matcher(text).matches()) {
                parsed.add(new TraceLine(i, text, Kind.FRAME, false, 0.0));
            } else if (FRAME_START.matcher(text).find()) {
                boolean user = PatternConstants.isUserCodePath(text, userPackages);
                parsed.add(new TraceLine(i, text, Kind.FRAME, user, frameImportance(text, user)));
            } else {
                // error headers, Caused by:, and message continuation lines
                parsed.add(new TraceLine(i, text, Kind.HEADER, false, 1.0));
            }
        }
        return parsed;
    }

    static double frameImportance(String frame, boolean userCode) {
        double importance = 0.1;
        if (userCode) {
            importance += 0.4;
        }
        var function = functionName(frame).toLowerCase(Locale.ROOT);
        if (IMPORTANT_FUNCTION_KEYWORDS.stream().anyMatch(function::contains)) {
            importance += 0.2;
        }
        if (ENTRY_POINTS.stream().anyMatch(function::contains)) {
            importance += 0.1;
        }
        if (function.contains("<anonymous>") || function.contains("lambda$") || function.isEmpty()) {
            importance -= 0.1;
        }
        if (frame.contains("internal/") || frame.contains("node:") || frame.contains("jdk.internal.")) {
            importance -= 0.2;
        }
        return Math.max(0.0, Math.min(1.0, importance));
    }

    private static String functionName(String frame) {
        var java = PatternConstants.JAVA_FRAME.matcher(frame);
        if (java.matches()) {
            var qualified = java.group(1);
            int dot = qualified.lastIndexOf('.');
            return dot >= 0 ? qualified.substring(dot + 1) : qualified;
        }
        var js = PatternConstants.JS_FRAME.matcher(frame);
        if (js.matches() && js.group(1) != null) {
            return js.group(1);
        }
        return "";
    }

    static String render(List<TraceLine> lines, Set<Integer> kept) {
        var out = new ArrayList<String>();
        int omitted = 0;
        for (var line : lines) {
            if (kept.contains(line.index())) {
                if (omitted > 0) {
                    out.add(omittedMarker(omitted));
                    omitted = 0;
                }
                out.add(line.text());
            } else {
                omitted++;
            }
        }
        if (omitted > 0) {
            out.add(omittedMarker(omitted));
        }
        return String.join("\n", out);
    }

    private static String omittedMarker(int count) {
        return "    ... " + count + " more frame(s)";
    }

    private int tokens(String text, TruncationContext context) {
        return tokenCounter.countTokens(text, context.model());
    }

    @Override
    public int estimateSavings(String content, int maxTokens, TruncationContext context) {
        int originalTokens = tokenCounter.countTokens(content, context.model());
        if (originalTokens <= maxTokens) {
            return 0;
        }
        var lines = parse(content, context.metadataStrings("userPackages"));
        long frames = lines.stream().filter(l -> l.kind() == Kind.FRAME).count();
        long userFrames = lines.stream().filter(TraceLine::userCode).count();
        if (frames == 0) {
            return 0;
        }
        double keptRatio = Math.max(0.2, (double) (lines.size() - frames + userFrames) / lines.size());
        int estimatedFinal = Math.min((int) Math.floor(originalTokens * keptRatio), maxTokens);
        return Math.max(0, originalTokens - estimatedFinal);
    }
}
