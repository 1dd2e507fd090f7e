package io.github.jbellis.testdigest.util;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-classification patterns shared by the normalizer, the console buffer and the truncators.
 */
public final class PatternConstants {

    private PatternConstants() {
        // Utility class - prevent instantiation
    }

    /**
     * SGR escape sequences ({@code ESC [ ... m}).
     */
    public static final Pattern ANSI_ESCAPE = Pattern.compile("\\u001B\\[[0-9;]*[mM]");

    /**
     * Java frame: {@code at com.acme.Foo.bar(Foo.java:12)}, optionally with a module prefix
     * such as {@code java.base/}. Group 1 is the qualified method.
     */
    public static final Pattern JAVA_FRAME = Pattern.compile("^\\s*at\\s+([^\\s(]+)\\(([^)]*)\\)\\s*$");

    /**
     * V8 frame: {@code at fn (file:line:col)} or {@code at file:line:col}.
     * Group 1 is the function (may be null), group 2 the location.
     */
    public static final Pattern JS_FRAME =
            Pattern.compile("^\\s*at\\s+(?:(.+?)\\s+\\()?(.+?:\\d+:\\d+)\\)?\\s*$");

    /**
     * Java's elided-frames line, {@code ... 12 more}.
     */
    public static final Pattern ELIDED_FRAMES = Pattern.compile("^\\s*\\.\\.\\.\\s+\\d+\\s+more\\s*$");

    private static final List<Pattern> FRAME_PATTERNS = List.of(
            Pattern.compile("^\\s*at\\s+"),          // JVM and V8
            Pattern.compile("^\\s*↳\\s+"),
            Pattern.compile("^\\s*[├└│]\\s*"),        // tree-style reporters
            Pattern.compile("^\\s*\\d+\\)\\s+"),
            Pattern.compile("^\\s*#\\d+\\s+"),
            Pattern.compile(":\\d+:\\d+"),           // file:line:col anywhere
            ELIDED_FRAMES);

    private static final List<Pattern> ERROR_PATTERNS = List.of(
            Pattern.compile("^(Error|TypeError|ReferenceError|SyntaxError|RangeError|AssertionError):"),
            Pattern.compile("^[A-Z]\\w*Error:"),
            Pattern.compile("^(?:Caused by:\\s+|Suppressed:\\s+|Exception in thread \"[^\"]*\"\\s+)?"
                            + "(?:[a-z_$][\\w$]*\\.)*[A-Z][\\w$]*(?:Error|Exception|Throwable|Failure)(?::|\\s*$)"),
            Pattern.compile("^\\s*(Expected|Received|Actual|Assert)"),
            Pattern.compile("^(FAIL|FAILED|✖|✗|×)"));

    /**
     * Class-name prefixes of JVM frames that belong to the runtime, test framework or build tool.
     */
    public static final List<String> JVM_DEPENDENCY_PACKAGES = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.",
            "org.junit.", "org.opentest4j.", "org.apache.maven.", "org.gradle.");

    /**
     * Path fragments of non-JVM frames that mark library or runtime code.
     */
    public static final List<String> PATH_DEPENDENCY_MARKERS =
            List.of("node_modules", "internal/", "<anonymous>", "[native code]");

    private static final List<String> PATH_DEPENDENCY_PREFIXES = List.of("node:", "async ", "timers.");

    /**
     * Case-insensitive substrings that make a line worth keeping.
     */
    public static final List<String> PRIORITY_KEYWORDS = List.of(
            "error", "fail", "failure", "exception", "throw", "crash", "fatal",
            "assert", "expect", "should", "must", "require",
            "test", "describe", "it(", "spec", "scenario",
            "warning", "critical", "important", "bug", "issue", "problem");

    public static String stripAnsi(String text) {
        return ANSI_ESCAPE.matcher(text).replaceAll("");
    }

    public static boolean isStackFrameLine(String line) {
        return FRAME_PATTERNS.stream().anyMatch(p -> p.matcher(line).find());
    }

    public static boolean isErrorMessageLine(String line) {
        return ERROR_PATTERNS.stream().anyMatch(p -> p.matcher(line).find());
    }

    public static boolean containsStackFrame(String content) {
        return content.lines().anyMatch(PatternConstants::isStackFrameLine);
    }

    public static boolean isUserCodePath(String line) {
        return isUserCodePath(line, List.of());
    }

    /**
     * Classifies a frame (or a bare path) as user code. When {@code userPackages} is non-empty a
     * JVM frame is user code exactly when its class starts with one of them; otherwise any JVM
     * frame outside {@link #JVM_DEPENDENCY_PACKAGES} counts. Other frames are judged by their
     * location against {@link #PATH_DEPENDENCY_MARKERS}.
     */
    public static boolean isUserCodePath(String line, Collection<String> userPackages) {
        Matcher javaFrame = JAVA_FRAME.matcher(line);
        if (javaFrame.matches()) {
            var qualified = stripModulePrefix(javaFrame.group(1));
            if (!userPackages.isEmpty()) {
                return userPackages.stream().anyMatch(qualified::startsWith);
            }
            return JVM_DEPENDENCY_PACKAGES.stream().noneMatch(qualified::startsWith);
        }

        var jsFrame = JS_FRAME.matcher(line);
        var location = jsFrame.matches() ? jsFrame.group(2).trim() : line.trim();
        return PATH_DEPENDENCY_MARKERS.stream().noneMatch(location::contains)
               && PATH_DEPENDENCY_PREFIXES.stream().noneMatch(location::startsWith);
    }

    // "java.base/java.lang.Thread.run" and "app//com.acme.Main.main" -> "java.lang.Thread.run"
    private static String stripModulePrefix(String qualified) {
        int slash = qualified.lastIndexOf('/');
        return slash >= 0 ? qualified.substring(slash + 1) : qualified;
    }

    public static boolean hasPriorityKeyword(String line) {
        var lower = line.toLowerCase(Locale.ROOT);
        return PRIORITY_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
