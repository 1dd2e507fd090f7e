package io.github.jbellis.testdigest.console;

import io.github.jbellis.testdigest.dedup.LogLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/**
 * Owns the table of original versus wrapped console functions for one {@link Console}.
 *
 * A wrapped function first hands the call to the {@link Handler}, then always calls the original.
 * Handler failures are logged and never reach the code that wrote to the console.
 * {@link #patch} is idempotent per level and {@link #unpatchAll} reinstates the exact original
 * function objects.
 */
public class ConsoleInterceptor {
    private static final Logger logger = LogManager.getLogger(ConsoleInterceptor.class);

    @FunctionalInterface
    public interface Handler {
        void intercept(LogLevel level, Object[] args);
    }

    private record Patch(ConsoleFunction original, ConsoleFunction wrapped) {
    }

    private final Console console;
    private final Map<LogLevel, Patch> patches = new EnumMap<>(LogLevel.class);

    public ConsoleInterceptor(Console console) {
        this.console = console;
    }

    public synchronized void patch(LogLevel level, Handler handler) {
        if (patches.containsKey(level)) {
            logger.debug("console.{} already patched", level.id());
            return;
        }

        var original = console.function(level);
        ConsoleFunction wrapped = args -> {
            try {
                handler.intercept(level, args);
            } catch (RuntimeException e) {
                logger.warn("Console handler failed for console.{}", level.id(), e);
            }
            original.write(args);
        };
        patches.put(level, new Patch(original, wrapped));
        console.install(level, wrapped);
    }

    public synchronized void patchAll(Handler handler) {
        for (var level : LogLevel.values()) {
            patch(level, handler);
        }
    }

    public synchronized void unpatch(LogLevel level) {
        var patch = patches.remove(level);
        if (patch == null) {
            return;
        }
        if (console.function(level) != patch.wrapped()) {
            logger.warn("console.{} was replaced by someone else while patched; restoring the original anyway",
                        level.id());
        }
        console.install(level, patch.original());
    }

    public synchronized void unpatchAll() {
        for (var level : LogLevel.values()) {
            unpatch(level);
        }
    }

    public synchronized boolean isPatched(LogLevel level) {
        return patches.containsKey(level);
    }

    public synchronized boolean isPatched() {
        return !patches.isEmpty();
    }

    public Console console() {
        return console;
    }
}
