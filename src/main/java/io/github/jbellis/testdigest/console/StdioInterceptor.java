package io.github.jbellis.testdigest.console;

import io.github.jbellis.testdigest.dedup.LogLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Routes lines written to {@code System.out} (as LOG) and {@code System.err} (as ERROR) to a
 * {@link LineSink}, typically {@link ConsoleCapture#captureAmbient}. Bytes always reach the original
 * stream; lines the {@link StdioFilter} calls noise are not routed.
 */
public class StdioInterceptor implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(StdioInterceptor.class);

    @FunctionalInterface
    public interface LineSink {
        void accept(LogLevel level, String line);
    }

    private final LineSink sink;
    private final StdioFilter filter;
    // lines produced while routing (e.g. by a sink that logs) are not routed again
    private final ThreadLocal<Boolean> routing = ThreadLocal.withInitial(() -> false);

    private @Nullable PrintStream originalOut;
    private @Nullable PrintStream originalErr;
    private @Nullable PrintStream routedOut;
    private @Nullable PrintStream routedErr;

    public StdioInterceptor(LineSink sink, StdioFilter filter) {
        this.sink = sink;
        this.filter = filter;
    }

    public StdioInterceptor(LineSink sink) {
        this(sink, StdioFilter.defaults());
    }

    public synchronized void enable() {
        if (originalOut != null) {
            return;
        }
        originalOut = System.out;
        originalErr = System.err;
        routedOut = new PrintStream(new LineRoutingStream(originalOut, LogLevel.LOG), true, StandardCharsets.UTF_8);
        routedErr = new PrintStream(new LineRoutingStream(originalErr, LogLevel.ERROR), true, StandardCharsets.UTF_8);
        System.setOut(routedOut);
        System.setErr(routedErr);
        logger.debug("Stdio interception enabled");
    }

    /**
     * Routes any pending partial lines and reinstates the exact original streams.
     */
    public synchronized void restore() {
        if (originalOut == null || originalErr == null) {
            return;
        }
        if (routedOut != null) {
            routedOut.close();
        }
        if (routedErr != null) {
            routedErr.close();
        }
        System.setOut(originalOut);
        System.setErr(originalErr);
        originalOut = null;
        originalErr = null;
        routedOut = null;
        routedErr = null;
        logger.debug("Stdio interception disabled");
    }

    public synchronized boolean isEnabled() {
        return originalOut != null;
    }

    @Override
    public void close() {
        restore();
    }

    boolean isNoise(String line) {
        return filter.shouldSuppress(line);
    }

    private void route(LogLevel level, String line) {
        if (routing.get() || line.isBlank() || isNoise(line)) {
            return;
        }
        routing.set(true);
        try {
            sink.accept(level, line);
        } catch (RuntimeException e) {
            logger.warn("Stdio sink failed", e);
        } finally {
            routing.set(false);
        }
    }

    private final class LineRoutingStream extends OutputStream {
        private final OutputStream target;
        private final LogLevel level;
        private final ByteArrayOutputStream line = new ByteArrayOutputStream();

        LineRoutingStream(OutputStream target, LogLevel level) {
            this.target = target;
            this.level = level;
        }

        @Override
        public synchronized void write(int b) throws IOException {
            target.write(b);
            if (b == '\n') {
                emitLine();
            } else {
                line.write(b);
            }
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) throws IOException {
            target.write(b, off, len);
            int start = off;
            for (int i = off; i < off + len; i++) {
                if (b[i] == '\n') {
                    line.write(b, start, i - start);
                    emitLine();
                    start = i + 1;
                }
            }
            line.write(b, start, off + len - start);
        }

        @Override
        public void flush() throws IOException {
            target.flush();
        }

        @Override
        public synchronized void close() throws IOException {
            if (line.size() > 0) {
                emitLine();
            }
            // the original stream stays open
            target.flush();
        }

        private void emitLine() {
            var text = line.toString(StandardCharsets.UTF_8);
            line.reset();
            if (text.endsWith("\r")) {
                text = text.substring(0, text.length() - 1);
            }
            route(level, text);
        }
    }
}
