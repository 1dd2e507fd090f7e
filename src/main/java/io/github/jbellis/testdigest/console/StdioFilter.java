package io.github.jbellis.testdigest.console;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a stdout/stderr line is noise: the patterns of the selected
 * {@link FrameworkLogPreset}s first, then the user's own. A pattern listed twice is checked once.
 */
public final class StdioFilter {
    private final boolean suppressAll;
    private final List<Pattern> patterns;

    public StdioFilter(boolean suppressAll, List<FrameworkLogPreset> presets, List<String> userPatterns) {
        this.suppressAll = suppressAll;
        var byRegex = new LinkedHashMap<String, Pattern>();
        for (var preset : presets) {
            for (var pattern : preset.patterns()) {
                byRegex.putIfAbsent(pattern.pattern(), pattern);
            }
        }
        for (var regex : userPatterns) {
            byRegex.computeIfAbsent(regex, Pattern::compile);
        }
        this.patterns = List.copyOf(byRegex.values());
    }

    public StdioFilter(StdioConfig config) {
        this(config.suppressAll(), config.resolvePresets(), config.filterPatterns());
    }

    public static StdioFilter defaults() {
        return new StdioFilter(StdioConfig.defaults());
    }

    /**
     * A filter that lets every line through.
     */
    public static StdioFilter none() {
        return new StdioFilter(false, List.of(), List.of());
    }

    public boolean shouldSuppress(String line) {
        if (suppressAll) {
            return true;
        }
        for (var pattern : patterns) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

    List<Pattern> patterns() {
        return patterns;
    }
}
