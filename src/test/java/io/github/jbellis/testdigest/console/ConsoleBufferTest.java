package io.github.jbellis.testdigest.console;

import io.github.jbellis.testdigest.dedup.LogLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleBufferTest {

    private static Object[] args(Object... values) {
        return values;
    }

    @Test
    void keepsEventsInOrder() {
        var buffer = new ConsoleBuffer(1000, 10, true);
        assertTrue(buffer.add(LogLevel.LOG, args("one"), 1L, ConsoleEvent.Origin.INTERCEPTED));
        assertTrue(buffer.add(LogLevel.ERROR, args("two"), 2L, ConsoleEvent.Origin.TASK));

        var events = buffer.getEvents();
        assertEquals(List.of("one", "two"), events.stream().map(ConsoleEvent::text).toList());
        assertEquals(LogLevel.ERROR, events.get(1).level());
        assertEquals(ConsoleEvent.Origin.TASK, events.get(1).origin());
        assertEquals(2L, events.get(1).timestampMs());
    }

    @Test
    void lineLimitAddsOneMarker() {
        var buffer = new ConsoleBuffer(10_000, 3, true);
        for (int i = 0; i < 3; i++) {
            assertTrue(buffer.add(LogLevel.LOG, args("line " + i), null, ConsoleEvent.Origin.INTERCEPTED));
        }
        assertFalse(buffer.add(LogLevel.LOG, args("line 3"), null, ConsoleEvent.Origin.INTERCEPTED));
        assertFalse(buffer.add(LogLevel.LOG, args("line 4"), null, ConsoleEvent.Origin.INTERCEPTED));

        var events = buffer.getEvents();
        assertEquals(4, events.size());
        var marker = events.get(3);
        assertEquals(ConsoleBuffer.TRUNCATION_MARKER, marker.text());
        assertEquals(LogLevel.WARN, marker.level());
        assertTrue(buffer.isTruncated());
    }

    @Test
    void byteLimitCountsUtf8Bytes() {
        // each "é" is two bytes in UTF-8
        var buffer = new ConsoleBuffer(9, 100, true);
        assertTrue(buffer.add(LogLevel.LOG, args("ééé"), null, ConsoleEvent.Origin.INTERCEPTED));
        assertFalse(buffer.add(LogLevel.LOG, args("éé"), null, ConsoleEvent.Origin.INTERCEPTED));

        var stats = buffer.getStats();
        assertEquals(6, stats.totalBytes());
        assertTrue(stats.truncated());
        assertEquals(2, stats.eventCount());
    }

    @Test
    void repeatedDedupKeyIsDroppedPerBuffer() {
        var buffer = new ConsoleBuffer(1000, 10, true);
        assertTrue(buffer.add(LogLevel.LOG, args("a"), null, ConsoleEvent.Origin.INTERCEPTED, false, "log:k1", "t"));
        assertFalse(buffer.add(LogLevel.LOG, args("a"), null, ConsoleEvent.Origin.INTERCEPTED, false, "log:k1", "t"));
        assertTrue(buffer.add(LogLevel.LOG, args("b"), null, ConsoleEvent.Origin.INTERCEPTED, false, "log:k2", "t"));

        var other = new ConsoleBuffer(1000, 10, true);
        assertTrue(other.add(LogLevel.LOG, args("a"), null, ConsoleEvent.Origin.INTERCEPTED, false, "log:k1", "t"));
    }

    @Test
    void ansiIsStrippedWhenConfigured() {
        var stripping = new ConsoleBuffer(1000, 10, true);
        stripping.add(LogLevel.LOG, args("\u001B[32mgreen\u001B[0m"), null, ConsoleEvent.Origin.INTERCEPTED);
        assertEquals("green", stripping.getEvents().get(0).text());

        var raw = new ConsoleBuffer(1000, 10, false);
        raw.add(LogLevel.LOG, args("\u001B[32mgreen\u001B[0m"), null, ConsoleEvent.Origin.INTERCEPTED);
        assertEquals("\u001B[32mgreen\u001B[0m", raw.getEvents().get(0).text());
    }

    @Test
    void argsAreRetainedOnlyWhenInformative() {
        var buffer = new ConsoleBuffer(1000, 10, true);
        buffer.add(LogLevel.LOG, args("just text"), null, ConsoleEvent.Origin.INTERCEPTED);
        buffer.add(LogLevel.LOG, args("count", 2), null, ConsoleEvent.Origin.INTERCEPTED);
        buffer.add(LogLevel.LOG, args(List.of(1, 2)), null, ConsoleEvent.Origin.INTERCEPTED);

        var events = buffer.getEvents();
        assertNull(events.get(0).args());
        assertEquals(List.of("count", "2"), events.get(1).args());
        assertEquals("count 2", events.get(1).text());
        assertEquals(List.of("[1, 2]"), events.get(2).args());
    }

    @Test
    void clearResetsEverything() {
        var buffer = new ConsoleBuffer(1000, 1, true);
        buffer.add(LogLevel.LOG, args("a"), null, ConsoleEvent.Origin.INTERCEPTED);
        buffer.add(LogLevel.LOG, args("b"), null, ConsoleEvent.Origin.INTERCEPTED);
        assertTrue(buffer.isTruncated());

        buffer.clear();
        assertEquals(new ConsoleBuffer.Stats(0, 0, false), buffer.getStats());
        assertTrue(buffer.add(LogLevel.LOG, args("c"), null, ConsoleEvent.Origin.INTERCEPTED));
    }

    @Test
    void invalidLimitsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ConsoleBuffer(0, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new ConsoleBuffer(10, 0, true));
    }
}
