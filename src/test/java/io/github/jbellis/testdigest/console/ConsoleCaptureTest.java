package io.github.jbellis.testdigest.console;

import io.github.jbellis.testdigest.dedup.DeduplicationConfig;
import io.github.jbellis.testdigest.dedup.LogDeduplicator;
import io.github.jbellis.testdigest.dedup.LogEntry;
import io.github.jbellis.testdigest.dedup.LogLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleCaptureTest {
    private static final long GRACE_MS = 40;

    private Console console;
    private ConsoleCapture capture;

    @BeforeEach
    void setUp() {
        console = new Console(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
                              new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        capture = new ConsoleCapture(CaptureConfig.defaults().withGracePeriodMs(GRACE_MS), null, console);
    }

    @AfterEach
    void tearDown() {
        capture.close();
    }

    /**
     * Records cleanups instead of running them, so a test decides when (and whether) each one runs.
     */
    private static final class ManualScheduler extends ScheduledThreadPoolExecutor {
        final List<Runnable> cleanups = new CopyOnWriteArrayList<>();

        ManualScheduler() {
            super(1);
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            cleanups.add(command);
            return super.schedule(() -> { }, 1, TimeUnit.HOURS);
        }
    }

    private static List<String> texts(CaptureResult result) {
        return result.entries().stream().map(ConsoleEvent::text).toList();
    }

    @Test
    void capturesOutputOfTheCurrentTest() {
        try (var ignored = CaptureContext.startingNow("t1").open()) {
            capture.startCapture("t1");
            console.log("hello");
            console.error("oops", 42);
            var result = capture.stopCapture("t1");

            assertEquals(List.of("hello", "oops 42"), texts(result));
            assertEquals(LogLevel.ERROR, result.entries().get(1).level());
            assertEquals(ConsoleEvent.Origin.INTERCEPTED, result.entries().get(0).origin());
            assertNotNull(result.entries().get(0).timestampMs());
            assertEquals("t1", result.entries().get(0).testId());
        }
    }

    @Test
    void outputWithoutContextIsDropped() {
        capture.startCapture("t1");
        console.log("nobody's");
        assertTrue(capture.stopCapture("t1").entries().isEmpty());
    }

    @Test
    void restartBeforeGracePeriodDoesNotMixAttempts() throws Exception {
        try (var ignored = CaptureContext.startingNow("retry").open()) {
            capture.startCapture("retry");
            console.log("first");
            var first = capture.stopCapture("retry");

            capture.startCapture("retry", true);
            console.log("second");
            var second = capture.stopCapture("retry");

            assertEquals(List.of("first"), texts(first));
            assertEquals(List.of("second"), texts(second));
        }
    }

    @Test
    void staleCleanupDoesNotDestroyTheNewAttempt() throws Exception {
        try (var ignored = CaptureContext.startingNow("retry").open()) {
            capture.startCapture("retry");
            console.log("first");
            capture.stopCapture("retry");

            capture.startCapture("retry", true);
            // let the first attempt's grace period run out while the second is capturing
            Thread.sleep(GRACE_MS * 4);
            console.log("second");

            assertEquals(1, capture.getStats().activeBuffers());
            assertEquals(List.of("second"), texts(capture.stopCapture("retry")));
        }
    }

    @Test
    void cleanupAlreadyRunningWhenTheTestRestartsLeavesTheNewBufferAlone() {
        var scheduler = new ManualScheduler();
        try (var manual = new ConsoleCapture(CaptureConfig.defaults(), null, console, scheduler);
             var ignored = CaptureContext.startingNow("retry").open()) {
            manual.startCapture("retry");
            console.log("first");
            manual.stopCapture("retry");
            assertEquals(1, scheduler.cleanups.size());
            var staleCleanup = scheduler.cleanups.get(0);

            // the timer fired and its task is past cancellation when the retry starts
            manual.startCapture("retry", true);
            console.log("second");
            staleCleanup.run();

            assertEquals(1, manual.getStats().activeBuffers());
            assertEquals(List.of("second"), texts(manual.stopCapture("retry")));

            // the cleanup belonging to the latest stop still does its job
            scheduler.cleanups.get(scheduler.cleanups.size() - 1).run();
            assertEquals(0, manual.getStats().activeBuffers());
            assertEquals(0, manual.getStats().trackedGenerations());
        }
    }

    @Test
    void ingestedOutputWithoutACaptureIsCleanedUp() {
        var scheduler = new ManualScheduler();
        try (var manual = new ConsoleCapture(CaptureConfig.defaults(), null, console, scheduler)) {
            manual.ingest("orphan", LogLevel.LOG, new Object[] {"after the test ended"}, null);
            assertEquals(1, manual.getStats().activeBuffers());
            assertEquals(1, manual.getStats().pendingCleanups());

            scheduler.cleanups.get(0).run();
            assertEquals(new CaptureStats(false, 0, 0, 0), manual.getStats());
        }
    }

    @Test
    void startCaptureClaimsAnIngestedBuffer() {
        var scheduler = new ManualScheduler();
        try (var manual = new ConsoleCapture(CaptureConfig.defaults(), null, console, scheduler)) {
            manual.ingest("early", LogLevel.LOG, new Object[] {"before start"}, null);
            manual.startCapture("early");
            assertEquals(0, manual.getStats().pendingCleanups());

            scheduler.cleanups.get(0).run();
            assertEquals(List.of("before start"), texts(manual.stopCapture("early")));
        }
    }

    @Test
    void bufferIsDestroyedAfterTheGracePeriod() throws Exception {
        capture.startCapture("t1");
        capture.stopCapture("t1");
        assertEquals(1, capture.getStats().pendingCleanups());

        Thread.sleep(GRACE_MS * 5);
        var stats = capture.getStats();
        assertEquals(0, stats.activeBuffers());
        assertEquals(0, stats.pendingCleanups());
        assertEquals(0, stats.trackedGenerations());
    }

    @Test
    void lateOutputWithinGracePeriodIsStillBuffered() {
        try (var ignored = CaptureContext.startingNow("t1").open()) {
            capture.startCapture("t1");
            console.log("before stop");
            capture.stopCapture("t1");
            console.log("late");
            assertEquals(List.of("before stop", "late"), texts(capture.stopCapture("t1")));
        }
    }

    @Test
    void concurrentTestsAreIsolated() throws Exception {
        int tests = 4;
        int lines = 25;
        ExecutorService pool = Executors.newFixedThreadPool(tests);
        var barrier = new CyclicBarrier(tests);
        try {
            var futures = new java.util.ArrayList<Future<CaptureResult>>();
            for (int i = 0; i < tests; i++) {
                var testId = "test-" + i;
                futures.add(pool.submit(() -> capture.runWithCapture(testId, () -> {
                    barrier.await(5, TimeUnit.SECONDS);
                    for (int line = 0; line < lines; line++) {
                        console.log(testId, line);
                        Thread.yield();
                    }
                })));
            }
            for (int i = 0; i < tests; i++) {
                var result = futures.get(i).get(10, TimeUnit.SECONDS);
                assertFalse(result.failed());
                assertEquals(lines, result.entries().size());
                var testId = "test-" + i;
                assertTrue(result.entries().stream().allMatch(e -> e.text().startsWith(testId + " ")),
                           "foreign output in " + testId);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void asyncWorkFollowsThePropagatedContext() throws Exception {
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            var result = capture.runWithCapture("async", () -> {
                var done = new CountDownLatch(1);
                CaptureContext.propagating(worker).execute(() -> {
                    console.info("from worker");
                    done.countDown();
                });
                assertTrue(done.await(5, TimeUnit.SECONDS));
            });
            assertEquals(List.of("from worker"), texts(result));
        } finally {
            worker.shutdownNow();
        }
    }

    @Test
    void ingestBypassesTheContext() {
        capture.startCapture("t1");
        capture.ingest("t1", LogLevel.WARN, new Object[] {"from runner"}, 12L);
        capture.ingest("t2", LogLevel.LOG, new Object[] {"new buffer"}, null);

        var result = capture.stopCapture("t1");
        assertEquals(List.of("from runner"), texts(result));
        assertEquals(ConsoleEvent.Origin.TASK, result.entries().get(0).origin());
        assertEquals(12L, result.entries().get(0).timestampMs());
        assertEquals(List.of("new buffer"), texts(capture.stopCapture("t2")));
    }

    @Test
    void ingestDuringGracePeriodKeepsTheBuffer() throws Exception {
        try (var slow = new ConsoleCapture(CaptureConfig.defaults().withGracePeriodMs(300), null, console)) {
            slow.startCapture("t1");
            slow.stopCapture("t1");
            Thread.sleep(200);
            slow.ingest("t1", LogLevel.LOG, new Object[] {"flushed late"}, null);
            // past the first deadline, well inside the renewed one
            Thread.sleep(200);

            assertEquals(1, slow.getStats().activeBuffers());
            assertEquals(List.of("flushed late"), texts(slow.stopCapture("t1")));
        }
    }

    @Test
    void debugOutputIsFilteredUnlessEnabled() {
        try (var ignored = CaptureContext.startingNow("t1").open()) {
            capture.startCapture("t1");
            console.debug("noisy");
            console.trace("noisier");
            console.info("kept");
            capture.ingest("t1", LogLevel.DEBUG, new Object[] {"ingested noise"}, null);
            assertEquals(List.of("kept"), texts(capture.stopCapture("t1")));
        }

        try (var verbose = new ConsoleCapture(CaptureConfig.defaults().withIncludeDebugOutput(true), null, console);
             var ignored = CaptureContext.startingNow("t2").open()) {
            verbose.startCapture("t2");
            console.debug("noisy");
            assertEquals(List.of("noisy"), texts(verbose.stopCapture("t2")));
        }
    }

    @Test
    void repeatedLinesAreCollapsedWithMetadata() {
        var deduplicator = new LogDeduplicator(DeduplicationConfig.defaults().withIncludeSources(true));
        try (var deduping = new ConsoleCapture(CaptureConfig.defaults(), deduplicator, console)) {
            var result = deduping.runWithCapture("t1", () -> {
                console.log("retrying connection");
                console.log("retrying   connection");
                console.warn("retrying connection");
                console.log("retrying connection");
                console.log("connected");
            });

            assertEquals(List.of("retrying connection", "retrying connection", "connected"), texts(result));
            var first = result.entries().get(0);
            assertNotNull(first.deduplication());
            assertEquals(3, first.deduplication().count());
            assertEquals(List.of("t1"), first.deduplication().sources());
            assertNull(result.entries().get(1).deduplication(), "the warn line is a different key");
            assertNull(result.entries().get(2).deduplication());
        }
    }

    @Test
    void perTestScopeCountsOnlyThatTest() {
        var deduplicator = new LogDeduplicator(DeduplicationConfig.defaults().withScope(DeduplicationConfig.Scope.PER_TEST));
        deduplicator.isDuplicate(new LogEntry("tick", LogLevel.LOG));
        try (var deduping = new ConsoleCapture(CaptureConfig.defaults(), deduplicator, console)) {
            var result = deduping.runWithCapture("t1", () -> {
                console.log("tick");
                console.log("tick");
            });
            assertEquals(2, result.entries().get(0).deduplication().count());
        }
    }

    @Test
    void runWithCaptureReportsTheFailure() {
        var result = capture.runWithCapture("failing", () -> {
            console.error("about to fail");
            throw new AssertionError("expected 1 but was 2");
        });

        assertTrue(result.failed());
        assertInstanceOf(AssertionError.class, result.failure());
        assertEquals(List.of("about to fail"), texts(result));
        assertTrue(CaptureContext.current().isEmpty());
    }

    @Test
    void clearBufferIsImmediate() {
        capture.startCapture("t1");
        capture.clearBuffer("t1");
        var stats = capture.getStats();
        assertEquals(0, stats.activeBuffers());
        assertEquals(0, stats.trackedGenerations());
        assertTrue(capture.stopCapture("t1").entries().isEmpty());
    }

    @Test
    void resetCancelsTimersAndRestoresTheConsole() {
        var original = console.function(LogLevel.LOG);
        capture.startCapture("t1");
        capture.startCapture("t2");
        capture.stopCapture("t1");
        assertTrue(capture.getStats().patched());
        assertNotSame(original, console.function(LogLevel.LOG));

        capture.reset();

        assertEquals(new CaptureStats(false, 0, 0, 0), capture.getStats());
        assertSame(original, console.function(LogLevel.LOG));
    }

    @Test
    void disabledCaptureRecordsNothing() {
        try (var disabled = new ConsoleCapture(CaptureConfig.defaults().withEnabled(false), null, console);
             var ignored = CaptureContext.startingNow("t1").open()) {
            disabled.startCapture("t1");
            console.log("ignored");
            assertTrue(disabled.stopCapture("t1").entries().isEmpty());
            assertFalse(disabled.getStats().patched());
        }
    }
}
