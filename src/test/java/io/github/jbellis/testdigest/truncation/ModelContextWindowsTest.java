package io.github.jbellis.testdigest.truncation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelContextWindowsTest {

    @Test
    void effectiveLimitAppliesTheSafetyMargin() {
        assertEquals(108_800, ModelContextWindows.getEffectiveMaxTokens("gpt-4"));
        assertEquals(180_000, ModelContextWindows.getEffectiveMaxTokens("claude-3-opus"));
        assertEquals(13_108, ModelContextWindows.getEffectiveMaxTokens("gpt-3.5-turbo"));
    }

    @Test
    void customLimitIsCappedByTheWindow() {
        assertEquals(8_500, ModelContextWindows.getEffectiveMaxTokens("gpt-4", 10_000));
        assertEquals(13_108, ModelContextWindows.getEffectiveMaxTokens("gpt-3.5-turbo", 50_000));
        assertEquals(108_800, ModelContextWindows.getEffectiveMaxTokens("gpt-4", 0));
    }

    @Test
    void unknownModelsFallBackToTheDefault() {
        assertFalse(ModelContextWindows.isModelSupported("my-local-llm"));
        assertEquals(ModelContextWindows.getEffectiveMaxTokens(ModelContextWindows.DEFAULT_MODEL),
                     ModelContextWindows.getEffectiveMaxTokens("my-local-llm"));
        assertTrue(ModelContextWindows.getSupportedModels().contains("claude-3-5-sonnet"));
    }

    @Test
    void exceedsContextOnlyAboveTheEffectiveLimit() {
        assertFalse(ModelContextWindows.wouldExceedContext(108_800, "gpt-4", null));
        assertTrue(ModelContextWindows.wouldExceedContext(108_801, "gpt-4", null));
    }

    @Test
    void contextInfoCarriesThresholds() {
        var info = ModelContextWindows.getModelContextInfo("gpt-4", null);
        assertEquals(128_000, info.contextWindow());
        assertEquals(108_800, info.effectiveMaxTokens());
        assertEquals(87_040, info.warningThreshold());
        assertEquals(103_360, info.requiredThreshold());
    }

    @Test
    void truncationTargetDependsOnPriority() {
        assertEquals(1_000, ModelContextWindows.calculateTruncationTarget(1_000, 2_000, ContentPriority.LOW));
        assertEquals(900, ModelContextWindows.calculateTruncationTarget(1_000, 500, ContentPriority.CRITICAL));
        assertEquals(400, ModelContextWindows.calculateTruncationTarget(1_000, 500, ContentPriority.LOW));
        assertEquals(500, ModelContextWindows.calculateTruncationTarget(1_000, 500, ContentPriority.DISPOSABLE));
    }
}
