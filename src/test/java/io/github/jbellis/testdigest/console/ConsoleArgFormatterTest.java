package io.github.jbellis.testdigest.console;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleArgFormatterTest {

    @Test
    void plainValues() {
        assertEquals("null", ConsoleArgFormatter.format(null));
        assertEquals("hello", ConsoleArgFormatter.format("hello"));
        assertEquals("42", ConsoleArgFormatter.format(42));
        assertEquals("true", ConsoleArgFormatter.format(true));
    }

    @Test
    void longStringsAreCapped() {
        var result = ConsoleArgFormatter.format("x".repeat(1500));
        assertEquals(1000 + ConsoleArgFormatter.TRUNCATED_SUFFIX.length(), result.length());
        assertTrue(result.endsWith(ConsoleArgFormatter.TRUNCATED_SUFFIX));
    }

    @Test
    void collectionsAreCappedAtTenItems() {
        var numbers = IntStream.range(0, 15).boxed().toList();
        var result = ConsoleArgFormatter.format(numbers);
        assertTrue(result.startsWith("[0, 1, 2"));
        assertTrue(result.contains("... 5 more items"), result);
        assertFalse(result.contains("14"));
    }

    @Test
    void nestingIsDepthLimited() {
        var deep = Map.of("a", Map.of("b", Map.of("c", Map.of("d", 1))));
        var result = ConsoleArgFormatter.format(deep);
        assertEquals("{'a': {'b': {'c': [Object]}}}", result);
    }

    @Test
    void nestedStringsAreQuotedAndCapped() {
        var result = ConsoleArgFormatter.format(List.of("y".repeat(300)));
        assertTrue(result.startsWith("['yyy"));
        assertTrue(result.endsWith("...']"));
        assertTrue(result.length() < 220);
    }

    @Test
    void circularStructuresDoNotRecurse() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", "loop");
        map.put("self", map);
        var result = ConsoleArgFormatter.format(map);
        assertEquals("{'name': 'loop', 'self': [Circular]}", result);

        var list = new ArrayList<Object>();
        list.add(list);
        assertEquals("[[Circular]]", ConsoleArgFormatter.format(list));
    }

    @Test
    void failingToStringFallsBackToPlaceholder() {
        var hostile = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("boom");
            }
        };
        assertEquals(ConsoleArgFormatter.FAILED_PLACEHOLDER, ConsoleArgFormatter.format(hostile));
        assertEquals("before " + ConsoleArgFormatter.FAILED_PLACEHOLDER + " after",
                     ConsoleArgFormatter.formatAll(new Object[] {"before", hostile, "after"}));
    }

    @Test
    void formatAllJoinsWithSpaces() {
        assertEquals("count: 3 [1, 2]", ConsoleArgFormatter.formatAll(new Object[] {"count:", 3, List.of(1, 2)}));
        assertEquals("", ConsoleArgFormatter.formatAll(new Object[0]));
        assertEquals("", ConsoleArgFormatter.formatAll(null));
    }
}
