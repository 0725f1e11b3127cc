package org.stianloader.picodep.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LoggingAdapter} forwarding to SLF4J. Loggers are looked up once per class as update
 * workers and the install pipeline log from many threads.
 */
class SLF4JLogAdapter extends LoggingAdapter {

    @NotNull
    private static final ClassValue<Logger> LOGGERS = new ClassValue<>() {
        @Override
        protected Logger computeValue(Class<?> type) {
            return LoggerFactory.getLogger(type);
        }
    };

    @Override
    public void debug(Class<?> clazz, String message, Object... args) {
        Logger logger = SLF4JLogAdapter.LOGGERS.get(clazz);
        if (logger.isDebugEnabled()) {
            logger.debug(message, args);
        }
    }

    @Override
    public void error(Class<?> clazz, String message, Object... args) {
        SLF4JLogAdapter.LOGGERS.get(clazz).error(message, args);
    }

    @Override
    public void info(Class<?> clazz, String message, Object... args) {
        SLF4JLogAdapter.LOGGERS.get(clazz).info(message, args);
    }

    @Override
    public void warn(Class<?> clazz, String message, Object... args) {
        SLF4JLogAdapter.LOGGERS.get(clazz).warn(message, args);
    }
}
