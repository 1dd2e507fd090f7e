package io.github.jbellis.testdigest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.jbellis.testdigest.console.CaptureConfig;
import io.github.jbellis.testdigest.console.StdioConfig;
import io.github.jbellis.testdigest.dedup.DeduplicationConfig;
import io.github.jbellis.testdigest.truncation.TruncationConfig;
import io.github.jbellis.testdigest.truncation.TruncationEngineConfig;
import io.github.jbellis.testdigest.util.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * All settings of the pipeline. A JSON file only needs the values it changes: it is merged over
 * {@link #defaults()} before binding, and unknown properties are rejected.
 *
 * <pre>{@code
 * {
 *   "capture": { "gracePeriodMs": 250 },
 *   "deduplication": { "scope": "PER_TEST" },
 *   "truncation": { "enabled": true, "maxTokens": 20000 },
 *   "stdio": { "frameworkPresets": ["spring-boot", "hibernate"], "filterPatterns": ["^heartbeat "] }
 * }
 * }</pre>
 */
public record TestDigestConfig(CaptureConfig capture,
                               DeduplicationConfig deduplication,
                               TruncationEngineConfig engine,
                               TruncationConfig truncation,
                               StdioConfig stdio) {

    public static TestDigestConfig defaults() {
        return new TestDigestConfig(CaptureConfig.defaults(),
                                    DeduplicationConfig.defaults(),
                                    TruncationEngineConfig.defaults(),
                                    TruncationConfig.defaults(),
                                    StdioConfig.defaults());
    }

    public static TestDigestConfig load(Path path) throws IOException {
        try {
            return parse(Files.readString(path));
        } catch (IOException | IllegalArgumentException e) {
            throw new IOException("Invalid configuration in " + path + ": " + e.getMessage(), e);
        }
    }

    public static TestDigestConfig parse(String json) throws IOException {
        var overrides = Json.mapper.readTree(json);
        if (overrides == null || overrides.isMissingNode() || overrides.isNull()) {
            return defaults();
        }
        if (!overrides.isObject()) {
            throw new IOException("Configuration must be a JSON object");
        }
        ObjectNode merged = Json.mapper.valueToTree(defaults());
        merge(merged, overrides);
        return Json.mapper.treeToValue(merged, TestDigestConfig.class);
    }

    private static void merge(ObjectNode target, JsonNode overrides) {
        var fields = overrides.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue().isObject()) {
                merge(existingObject, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    public String toJson() {
        return Json.toPrettyJson(this);
    }

    public TestDigestConfig withCapture(CaptureConfig capture) {
        return new TestDigestConfig(capture, deduplication, engine, truncation, stdio);
    }

    public TestDigestConfig withDeduplication(DeduplicationConfig deduplication) {
        return new TestDigestConfig(capture, deduplication, engine, truncation, stdio);
    }

    public TestDigestConfig withEngine(TruncationEngineConfig engine) {
        return new TestDigestConfig(capture, deduplication, engine, truncation, stdio);
    }

    public TestDigestConfig withTruncation(TruncationConfig truncation) {
        return new TestDigestConfig(capture, deduplication, engine, truncation, stdio);
    }

    public TestDigestConfig withStdio(StdioConfig stdio) {
        return new TestDigestConfig(capture, deduplication, engine, truncation, stdio);
    }
}
