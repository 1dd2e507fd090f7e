package io.github.jbellis.testdigest.console;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Curated patterns for banner and housekeeping lines that JVM frameworks and build tools print while
 * tests run. The patterns are anchored and specific so that real test output is not mistaken for
 * noise.
 */
public enum FrameworkLogPreset {
    SPRING_BOOT("spring-boot", "Spring Boot banner and context startup lines",
                List.of("^\\s*:: Spring Boot ::",
                        "^\\s*\\.\\s+____\\s+_\\s+__ _ _",
                        "Started \\S+ in \\d+(?:\\.\\d+)? seconds \\(",
                        "^\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2}\\S*\\s+INFO \\d+ --- \\["),
                List.of("spring-boot"),
                List.of("SPRING_PROFILES_ACTIVE", "SPRING_APPLICATION_JSON")),
    HIBERNATE("hibernate", "Hibernate SQL echo and HHH startup messages",
              List.of("^Hibernate: (?:select|insert|update|delete|create|drop|alter) ",
                      "\\bHHH\\d{6}: "),
              List.of("hibernate-core"),
              List.of()),
    MAVEN("maven", "Maven build and download progress",
          List.of("^\\[(?:INFO|WARNING)\\] ",
                  "^Download(?:ing|ed) from \\S+: "),
          List.of("maven-surefire", "surefire-booter"),
          List.of("MAVEN_PROJECTBASEDIR", "MAVEN_HOME")),
    GRADLE("gradle", "Gradle task and build status lines",
           List.of("^> Task :",
                   "^BUILD (?:SUCCESSFUL|FAILED) in ",
                   "^Gradle Test Executor \\d+"),
           List.of("gradle-worker", "gradle-api"),
           List.of("GRADLE_USER_HOME")),
    SLF4J("slf4j", "SLF4J binding diagnostics",
          List.of("^SLF4J(?:\\([A-Z]\\))?: "),
          List.of("slf4j-api"),
          List.of()),
    LOGBACK("logback", "Logback status messages",
            List.of("^\\d{2}:\\d{2}:\\d{2},\\d{3} \\|-(?:INFO|WARN) in ch\\.qos\\.logback"),
            List.of("logback-classic", "logback-core"),
            List.of()),
    JDK("jdk", "JVM warnings about agents, deprecated internals and picked-up options",
        List.of("^WARNING: (?:A terminally deprecated method|An illegal reflective access|sun\\.misc\\.Unsafe"
                + "|A Java agent has been loaded|Use -XX:\\+EnableDynamicAgentLoading|Please consider reporting)",
                "^OpenJDK 64-Bit Server VM warning:",
                "^Picked up (?:_JAVA_OPTIONS|JAVA_TOOL_OPTIONS):"),
        List.of(),
        List.of());

    private final String id;
    private final String description;
    private final List<Pattern> patterns;
    private final List<String> artifactHints;
    private final List<String> envHints;

    FrameworkLogPreset(String id, String description, List<String> patterns, List<String> artifactHints,
                       List<String> envHints) {
        this.id = id;
        this.description = description;
        this.patterns = patterns.stream().map(Pattern::compile).toList();
        this.artifactHints = artifactHints;
        this.envHints = envHints;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    public List<Pattern> patterns() {
        return patterns;
    }

    @JsonCreator
    public static FrameworkLogPreset fromId(String id) {
        var normalized = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(p -> p.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown framework preset '" + id + "', expected one of "
                                                                + Arrays.stream(values()).map(FrameworkLogPreset::id).toList()));
    }

    /**
     * Presets whose artifacts appear on the classpath or whose environment variables are set, in
     * declaration order.
     *
     * @param classpathEntries jar paths or file names
     */
    public static List<FrameworkLogPreset> detect(Collection<String> classpathEntries, Map<String, String> env) {
        var jarNames = classpathEntries.stream()
                .filter(entry -> !entry.isBlank())
                .map(entry -> entry.substring(Math.max(entry.lastIndexOf('/'), entry.lastIndexOf('\\')) + 1))
                .toList();

        var detected = new ArrayList<FrameworkLogPreset>();
        for (var preset : values()) {
            boolean onClasspath = preset.artifactHints.stream()
                    .anyMatch(hint -> jarNames.stream().anyMatch(name -> name.startsWith(hint)));
            boolean inEnv = preset.envHints.stream().anyMatch(env::containsKey);
            if (onClasspath || inEnv) {
                detected.add(preset);
            }
        }
        return detected;
    }

    /**
     * {@link #detect} against this JVM's {@code java.class.path} and environment.
     */
    public static List<FrameworkLogPreset> detectFromRuntime() {
        var classpath = System.getProperty("java.class.path", "");
        return detect(Arrays.asList(classpath.split(Pattern.quote(File.pathSeparator))), System.getenv());
    }
}
