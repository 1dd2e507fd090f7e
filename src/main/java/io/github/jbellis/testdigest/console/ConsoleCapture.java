package io.github.jbellis.testdigest.console;

import io.github.jbellis.testdigest.dedup.DeduplicationConfig;
import io.github.jbellis.testdigest.dedup.ILogDeduplicator;
import io.github.jbellis.testdigest.dedup.LogDeduplicator;
import io.github.jbellis.testdigest.dedup.LogEntry;
import io.github.jbellis.testdigest.dedup.LogLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Routes console output to per-test buffers while tests run concurrently.
 *
 * Per testId a buffer goes Unstarted -> Capturing -> StoppedPendingCleanup -> Destroyed.
 * {@link #stopCapture} does not destroy the buffer right away: destruction is scheduled after the
 * grace period so output flushed late by asynchronous code still lands somewhere. Each scheduled
 * cleanup carries a generation tag; starting, ingesting into, or re-stopping the same testId moves
 * the generation on, and a cleanup whose tag no longer matches does nothing. That is what keeps a
 * retried test's fresh buffer safe from the previous attempt's timer.
 *
 * Intercepted output is attributed through {@link CaptureContext#current()}; output from a thread
 * without a context is dropped and should be handed over with {@link #ingest} instead.
 */
public class ConsoleCapture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ConsoleCapture.class);

    /**
     * A test body, allowed to throw anything the way test frameworks do.
     */
    @FunctionalInterface
    public interface TestBody {
        void run() throws Throwable;
    }

    private final CaptureConfig config;
    private final @Nullable ILogDeduplicator deduplicator;
    private final ConsoleInterceptor interceptor;
    private final ScheduledThreadPoolExecutor scheduler;

    // guarded by this
    private final Map<String, ConsoleBuffer> buffers = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> cleanupTimers = new HashMap<>();
    private final Map<String, Long> generations = new HashMap<>();
    // shared across testIds so a tag is never reused, even after reset()
    private long generationSeq;

    public ConsoleCapture(CaptureConfig config, @Nullable ILogDeduplicator deduplicator, Console console) {
        this(config, deduplicator, console, new ScheduledThreadPoolExecutor(1, r -> {
            var t = new Thread(r, "Console-Capture-Cleanup");
            t.setDaemon(true);
            return t;
        }));
    }

    ConsoleCapture(CaptureConfig config, @Nullable ILogDeduplicator deduplicator, Console console,
                   ScheduledThreadPoolExecutor scheduler) {
        this.config = config;
        this.deduplicator = deduplicator;
        this.interceptor = new ConsoleInterceptor(console);
        this.scheduler = scheduler;
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    public ConsoleCapture(CaptureConfig config, @Nullable ILogDeduplicator deduplicator) {
        this(config, deduplicator, Console.global());
    }

    public ConsoleCapture(CaptureConfig config) {
        this(config, null);
    }

    public void startCapture(String testId) {
        startCapture(testId, false);
    }

    /**
     * Begins (or resumes) capturing for {@code testId}. With {@code forceNew} any existing buffer is
     * discarded, so a retried test never sees output of an earlier attempt.
     */
    public synchronized void startCapture(String testId, boolean forceNew) {
        if (!config.enabled()) {
            return;
        }

        cancelPendingCleanup(testId);
        bumpGeneration(testId);

        var existing = buffers.get(testId);
        if (existing == null) {
            buffers.put(testId, new ConsoleBuffer(config));
        } else if (forceNew) {
            existing.clear();
            buffers.put(testId, new ConsoleBuffer(config));
            logger.debug("Restarted capture for {} with a fresh buffer", testId);
        }

        if (!interceptor.isPatched()) {
            interceptor.patchAll(this::captureAmbient);
        }
    }

    /**
     * Returns the captured events and schedules the buffer for destruction after the grace period.
     * With an enabled deduplicator only the first occurrence of each line is returned, carrying
     * repeat metadata when it occurred more than once.
     */
    public CaptureResult stopCapture(String testId) {
        List<ConsoleEvent> events;
        synchronized (this) {
            var buffer = buffers.get(testId);
            if (buffer == null) {
                return CaptureResult.empty(testId);
            }
            events = buffer.getEvents();
            scheduleCleanup(testId);
        }
        return new CaptureResult(testId, deduplicate(testId, events), null);
    }

    /**
     * Runs {@code body} as test {@code testId}: opens its context, captures around it and reports
     * what it threw, if anything.
     */
    public CaptureResult runWithCapture(String testId, TestBody body) {
        var context = CaptureContext.startingNow(testId);
        try (var ignored = context.open()) {
            startCapture(testId);
            @Nullable Throwable failure = null;
            try {
                body.run();
            } catch (Throwable t) {
                if (t instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                failure = t;
            }
            // still inside the scope so output written while stopping is attributed
            return stopCapture(testId).withFailure(failure);
        }
    }

    /**
     * Adds output the host runner collected itself, bypassing the ambient context. A buffer waiting
     * for cleanup gets a fresh grace period. A buffer created here is scheduled for cleanup like a
     * stopped one, unless {@link #startCapture} claims it first.
     */
    public void ingest(String testId, LogLevel level, @Nullable Object[] args, @Nullable Long elapsedMs) {
        if (!config.enabled() || skipLevel(level)) {
            return;
        }

        ConsoleBuffer buffer;
        synchronized (this) {
            buffer = buffers.get(testId);
            if (buffer == null) {
                buffer = new ConsoleBuffer(config);
                buffers.put(testId, buffer);
                logger.debug("Ingest created a buffer for {} outside of a capture", testId);
                scheduleCleanup(testId);
            } else if (cleanupTimers.containsKey(testId)) {
                scheduleCleanup(testId);
            }
        }
        buffer.add(level, args, elapsedMs, ConsoleEvent.Origin.TASK, false, null, testId);
    }

    /**
     * Records output for the test of the calling thread's {@link CaptureContext}.
     *
     * @return false if there is no context, no live buffer for it, or the level is filtered
     */
    public boolean captureAmbient(LogLevel level, @Nullable Object[] args) {
        var context = CaptureContext.current();
        if (context.isEmpty() || skipLevel(level)) {
            return false;
        }

        var ctx = context.get();
        ConsoleBuffer buffer;
        synchronized (this) {
            buffer = buffers.get(ctx.testId());
        }
        if (buffer == null) {
            return false;
        }
        return buffer.add(level, args, ctx.elapsedMs(), ConsoleEvent.Origin.INTERCEPTED, false, null, ctx.testId());
    }

    private boolean skipLevel(LogLevel level) {
        return level.isDebugLike() && !config.includeDebugOutput();
    }

    /**
     * Destroys the buffer for {@code testId} now, without a grace period.
     */
    public synchronized void clearBuffer(String testId) {
        cancelPendingCleanup(testId);
        var buffer = buffers.remove(testId);
        if (buffer != null) {
            buffer.clear();
        }
        generations.remove(testId);
    }

    /**
     * Cancels every pending cleanup, drops all buffers, clears the deduplicator and restores the console.
     */
    public synchronized void reset() {
        cleanupTimers.values().forEach(f -> f.cancel(false));
        cleanupTimers.clear();
        buffers.values().forEach(ConsoleBuffer::clear);
        buffers.clear();
        generations.clear();
        if (deduplicator != null) {
            deduplicator.clear();
        }
        interceptor.unpatchAll();
    }

    public synchronized CaptureStats getStats() {
        return new CaptureStats(interceptor.isPatched(), buffers.size(), cleanupTimers.size(), generations.size());
    }

    public CaptureConfig config() {
        return config;
    }

    public ConsoleInterceptor interceptor() {
        return interceptor;
    }

    @Override
    public void close() {
        reset();
        scheduler.shutdownNow();
    }

    private void cancelPendingCleanup(String testId) {
        assert Thread.holdsLock(this);
        var pending = cleanupTimers.remove(testId);
        if (pending != null) {
            pending.cancel(false);
        }
    }

    private long bumpGeneration(String testId) {
        assert Thread.holdsLock(this);
        long generation = ++generationSeq;
        generations.put(testId, generation);
        return generation;
    }

    private void scheduleCleanup(String testId) {
        assert Thread.holdsLock(this);
        cancelPendingCleanup(testId);
        long generation = bumpGeneration(testId);
        var future = scheduler.schedule(() -> cleanupIfCurrent(testId, generation),
                                        config.gracePeriodMs(), TimeUnit.MILLISECONDS);
        cleanupTimers.put(testId, future);
    }

    private synchronized void cleanupIfCurrent(String testId, long generation) {
        try {
            if (!Objects.equals(generations.get(testId), generation)) {
                logger.debug("Skipping stale cleanup for {} (generation {})", testId, generation);
                return;
            }
            cleanupTimers.remove(testId);
            generations.remove(testId);
            var buffer = buffers.remove(testId);
            if (buffer != null) {
                buffer.clear();
            }
        } catch (RuntimeException e) {
            logger.error("Cleanup failed for {}", testId, e);
        }
    }

    private List<ConsoleEvent> deduplicate(String testId, List<ConsoleEvent> events) {
        if (deduplicator == null || !deduplicator.isEnabled() || events.isEmpty()) {
            return events;
        }

        ILogDeduplicator counter = deduplicator.config().scope() == DeduplicationConfig.Scope.PER_TEST
                                   ? new LogDeduplicator(deduplicator.config())
                                   : deduplicator;

        var firstByKey = new LinkedHashMap<String, ConsoleEvent>();
        for (var event : events) {
            var entry = new LogEntry(event.text(), event.level(), Instant.now(), testId);
            var key = counter.generateKey(entry);
            counter.isDuplicate(entry);
            firstByKey.putIfAbsent(key, event);
        }

        var result = new ArrayList<ConsoleEvent>(firstByKey.size());
        firstByKey.forEach((key, event) -> result.add(
                counter.getMetadata(key)
                        .filter(meta -> meta.count() > 1)
                        .map(meta -> event.withDeduplication(new ConsoleEvent.DeduplicationInfo(
                                meta.count(), meta.firstSeen(), meta.lastSeen(), List.copyOf(meta.sources()))))
                        .orElse(event)));
        return result;
    }
}
