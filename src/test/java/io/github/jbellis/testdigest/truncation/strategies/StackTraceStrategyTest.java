package io.github.jbellis.testdigest.truncation.strategies;

import io.github.jbellis.testdigest.tokens.EstimatingTokenCounter;
import io.github.jbellis.testdigest.truncation.ContentPriority;
import io.github.jbellis.testdigest.truncation.ContentType;
import io.github.jbellis.testdigest.truncation.TruncationContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StackTraceStrategyTest {
    private static final String HEADER = "java.lang.IllegalStateException: order rejected";
    private static final String CAUSE = "Caused by: java.io.IOException: disk full";

    private final StackTraceStrategy strategy = new StackTraceStrategy(EstimatingTokenCounter.defaultCounter());

    private static String trace() {
        var lines = new ArrayList<String>();
        lines.add(HEADER);
        lines.add("\tat com.acme.OrderService.place(OrderService.java:42)");
        for (int i = 0; i < 15; i++) {
            lines.add("\tat org.junit.platform.engine.Executor.execute" + i + "(Executor.java:" + (100 + i) + ")");
        }
        lines.add("\tat com.acme.OrderController.post(OrderController.java:17)");
        for (int i = 0; i < 15; i++) {
            lines.add("\tat java.base/java.lang.reflect.Method.invoke" + i + "(Method.java:" + (500 + i) + ")");
        }
        lines.add("\tat com.acme.Main.main(Main.java:9)");
        lines.add(CAUSE);
        lines.add("\tat com.acme.Disk.write(Disk.java:3)");
        lines.add("\t... 31 more");
        return String.join("\n", lines);
    }

    private static TruncationContext errorContext(int maxTokens) {
        return TruncationContext.of("gpt-4", maxTokens, ContentType.ERROR);
    }

    @Test
    void keepsHeadersAndUserFramesInOrder() {
        var result = strategy.truncate(trace(), 120, errorContext(120));
        var content = result.content();

        assertEquals(StackTraceStrategy.NAME, result.strategyUsed());
        assertTrue(result.tokenCount() <= 120, "got " + result.tokenCount());
        int header = content.indexOf(HEADER);
        int place = content.indexOf("OrderService.place");
        int post = content.indexOf("OrderController.post");
        int main = content.indexOf("Main.main");
        int cause = content.indexOf(CAUSE);
        assertTrue(header == 0 && header < place && place < post && post < main && main < cause, content);
        assertTrue(content.contains("more frame(s)"));
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void guaranteedLinesSurviveAnImpossibleBudget() {
        var result = strategy.truncate(trace(), 10, errorContext(10));

        assertTrue(result.content().contains(HEADER));
        assertTrue(result.content().contains(CAUSE));
        assertTrue(result.content().contains("OrderService.place"));
        assertFalse(result.content().contains("Executor.execute"));
        assertTrue(result.warnings().contains("Required stack trace lines exceed the token limit"));
    }

    @Test
    void userPackagesNarrowUserCode() {
        var context = new TruncationContext("gpt-4", 10, ContentType.ERROR, ContentPriority.CRITICAL, true,
                                            Map.of("userPackages", List.of("com.acme.Order"), "minUserFrames", 1));
        var result = strategy.truncate(trace(), 10, context);

        assertTrue(result.content().contains("OrderService.place"));
        assertFalse(result.content().contains("Main.main"));
    }

    @Test
    void rendersOmittedRunsWithCounts() {
        var lines = strategy.parse("Boom\n\tat a.B.c(B.java:1)\n\tat a.B.d(B.java:2)\n\tat a.B.e(B.java:3)\n\tat a.B.f(B.java:4)",
                                   List.of());
        assertEquals("Boom\n    ... 3 more frame(s)\n\tat a.B.f(B.java:4)",
                     StackTraceStrategy.render(lines, Set.of(0, 4)));
        assertEquals("Boom\n    ... 4 more frame(s)", StackTraceStrategy.render(lines, Set.of(0)));
    }

    @Test
    void parsesLineKinds() {
        var lines = strategy.parse(trace(), List.of());
        assertEquals(StackTraceStrategy.Kind.HEADER, lines.get(0).kind());
        assertTrue(lines.get(1).userCode());
        assertFalse(lines.get(2).userCode());
        var elided = lines.get(lines.size() - 1);
        assertEquals(StackTraceStrategy.Kind.FRAME, elided.kind());
        assertEquals(0.0, elided.importance());
    }

    @Test
    void weighsFrames() {
        assertEquals(0.7, StackTraceStrategy.frameImportance("\tat com.acme.CartTest.testTotals(CartTest.java:1)", true), 1e-9);
        assertEquals(0.0, StackTraceStrategy.frameImportance("\tat jdk.internal.reflect.Accessor.invoke(Accessor.java:1)", false), 1e-9);
    }

    @Test
    void onlyAppliesToErrorsWithFrames() {
        assertTrue(strategy.canTruncate(trace(), errorContext(10)));
        assertFalse(strategy.canTruncate("no frames here", errorContext(10)));
        assertFalse(strategy.canTruncate(trace(), TruncationContext.of("gpt-4", 10, ContentType.TEST)));
    }
}
