package io.github.jbellis.testdigest.console;

import io.github.jbellis.testdigest.dedup.LogLevel;

import java.io.PrintStream;
import java.util.EnumMap;
import java.util.Map;

/**
 * A console surface: one replaceable {@link ConsoleFunction} per {@link LogLevel}.
 *
 * {@link #global()} is the process-wide instance that application and test code write to; it is the
 * one piece of global mutable state the capture pipeline patches, and only
 * {@link ConsoleInterceptor} swaps its functions.
 */
public final class Console {
    private static final Console GLOBAL = new Console(System.out, System.err);

    private final Map<LogLevel, ConsoleFunction> functions = new EnumMap<>(LogLevel.class);

    public Console(PrintStream out, PrintStream err) {
        for (var level : LogLevel.values()) {
            var stream = (level == LogLevel.WARN || level == LogLevel.ERROR) ? err : out;
            functions.put(level, args -> stream.println(ConsoleArgFormatter.formatAll(args)));
        }
    }

    public static Console global() {
        return GLOBAL;
    }

    public void log(Object... args) {
        function(LogLevel.LOG).write(args);
    }

    public void info(Object... args) {
        function(LogLevel.INFO).write(args);
    }

    public void warn(Object... args) {
        function(LogLevel.WARN).write(args);
    }

    public void error(Object... args) {
        function(LogLevel.ERROR).write(args);
    }

    public void debug(Object... args) {
        function(LogLevel.DEBUG).write(args);
    }

    public void trace(Object... args) {
        function(LogLevel.TRACE).write(args);
    }

    public synchronized ConsoleFunction function(LogLevel level) {
        return functions.get(level);
    }

    synchronized void install(LogLevel level, ConsoleFunction function) {
        functions.put(level, function);
    }
}
