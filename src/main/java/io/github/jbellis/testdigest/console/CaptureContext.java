package io.github.jbellis.testdigest.console;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;

/**
 * The test a thread is currently working for.
 *
 * The value is thread-confined and scoped: {@link #open()} installs it and the returned
 * {@link Scope} reinstates whatever was there before. Work handed to other threads carries the
 * caller's context through {@link #wrap(Runnable)}, {@link #wrap(Callable)} or an executor
 * obtained from {@link #propagating(Executor)}; without that, output from those threads has no
 * owner and is dropped by the interceptor.
 */
public record CaptureContext(String testId, long startTimeMs) {
    private static final ThreadLocal<@Nullable CaptureContext> CURRENT = new ThreadLocal<>();

    public CaptureContext {
        Objects.requireNonNull(testId, "testId");
    }

    public static CaptureContext startingNow(String testId) {
        return new CaptureContext(testId, System.currentTimeMillis());
    }

    public static Optional<CaptureContext> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    /**
     * Makes this the current context of the calling thread until the scope is closed.
     */
    public Scope open() {
        var previous = CURRENT.get();
        CURRENT.set(this);
        return new Scope(previous);
    }

    public static final class Scope implements AutoCloseable {
        private final @Nullable CaptureContext previous;
        private boolean closed;

        private Scope(@Nullable CaptureContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }

    /**
     * Binds the caller's current context (if any) to the task.
     */
    public static Runnable wrap(Runnable task) {
        var captured = CURRENT.get();
        if (captured == null) {
            return task;
        }
        return () -> {
            try (var ignored = captured.open()) {
                task.run();
            }
        };
    }

    public static <T> Callable<T> wrap(Callable<T> task) {
        var captured = CURRENT.get();
        if (captured == null) {
            return task;
        }
        return () -> {
            try (var ignored = captured.open()) {
                return task.call();
            }
        };
    }

    /**
     * An executor that runs every submitted task under the context current at submission time.
     */
    public static Executor propagating(Executor delegate) {
        Objects.requireNonNull(delegate, "delegate");
        return command -> delegate.execute(wrap(command));
    }
}
