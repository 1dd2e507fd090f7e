package io.github.jbellis.testdigest.console;

import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Which {@code System.out}/{@code System.err} lines {@link StdioInterceptor} keeps out of the
 * per-test buffers. Filtered lines still reach the original stream.
 *
 * @param suppressAll      route nothing at all
 * @param frameworkPresets noise presets to apply
 * @param filterPatterns   extra regular expressions, matched with {@code find()}
 * @param detectPresets    also apply the presets {@link FrameworkLogPreset#detectFromRuntime()} finds
 */
public record StdioConfig(boolean suppressAll,
                          List<FrameworkLogPreset> frameworkPresets,
                          List<String> filterPatterns,
                          boolean detectPresets) {
    public static final List<FrameworkLogPreset> DEFAULT_PRESETS = List.of(FrameworkLogPreset.SPRING_BOOT,
                                                                           FrameworkLogPreset.MAVEN,
                                                                           FrameworkLogPreset.SLF4J,
                                                                           FrameworkLogPreset.JDK);

    public StdioConfig {
        frameworkPresets = List.copyOf(frameworkPresets);
        filterPatterns = List.copyOf(filterPatterns);
        for (var pattern : filterPatterns) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid filter pattern '" + pattern + "': " + e.getDescription(), e);
            }
        }
    }

    public static StdioConfig defaults() {
        return new StdioConfig(false, DEFAULT_PRESETS, List.of(), false);
    }

    /**
     * The configured presets plus, when enabled, the detected ones; in declaration order.
     */
    public List<FrameworkLogPreset> resolvePresets() {
        var resolved = new TreeSet<>(frameworkPresets);
        if (detectPresets) {
            resolved.addAll(FrameworkLogPreset.detectFromRuntime());
        }
        return List.copyOf(resolved);
    }

    public StdioConfig withFrameworkPresets(List<FrameworkLogPreset> frameworkPresets) {
        return new StdioConfig(suppressAll, frameworkPresets, filterPatterns, detectPresets);
    }

    public StdioConfig withFilterPatterns(List<String> filterPatterns) {
        return new StdioConfig(suppressAll, frameworkPresets, filterPatterns, detectPresets);
    }

    public StdioConfig withSuppressAll(boolean suppressAll) {
        return new StdioConfig(suppressAll, frameworkPresets, filterPatterns, detectPresets);
    }
}
