package org.stianloader.picodep.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used throughout picodep.
 *
 * <p>The default implementation uses SLF4J as the log sink if it exists,
 * otherwise it will fall back to using JUL as the logger, as defined by
 * {@link java.util.logging.Logger}. SLF4J is an optional dependency of picodep,
 * so embedding applications that do not ship it still get log output.
 *
 * <p>This facade supports "standard" SLF4J placeholders via "{}".
 * Not all arguments may map to a placeholder and in case they do not then they
 * should simply be appended to the end of the message. Leftover "{}"
 * placeholders need to be kept as-is. If the last argument is a {@link Throwable},
 * it's stacktrace should be logged.
 */
public abstract class LoggingAdapter {

    /**
     * The currently active default logger.
     */
    @NotNull
    static LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance);
    }

    public abstract void debug(Class<?> clazz, String message, Object... args);
    public abstract void error(Class<?> clazz, String message, Object... args);
    public abstract void info(Class<?> clazz, String message, Object... args);
    public abstract void warn(Class<?> clazz, String message, Object... args);
}
