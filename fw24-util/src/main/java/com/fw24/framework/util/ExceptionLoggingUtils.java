package com.fw24.framework.util;

import org.jboss.logging.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Utility class for consistent exception logging across the framework.
 * Callers pass their own logger so the category reflects the failing component.
 */
public final class ExceptionLoggingUtils {

    private ExceptionLoggingUtils() {
    }

    /**
     * Log exception with full stack trace at ERROR level
     *
     * @param log the logger of the calling component
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logError(Logger log, Throwable exception, String message, Object... args) {
        log(log, Logger.Level.ERROR, exception, message, args);
    }

    /**
     * Log exception with full stack trace at WARN level
     *
     * @param log the logger of the calling component
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logWarn(Logger log, Throwable exception, String message, Object... args) {
        log(log, Logger.Level.WARN, exception, message, args);
    }

    /**
     * Get stack trace as string
     *
     * @param exception the exception
     * @return stack trace as string
     */
    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        exception.printStackTrace(pw);
        return sw.toString();
    }

    /**
     * Unwraps the wrapper exceptions thrown by futures and reflective calls so the
     * logged message names the real failure.
     */
    public static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current != null && current.getCause() != null && current.getCause() != current
                && (current instanceof java.util.concurrent.CompletionException
                    || current instanceof java.util.concurrent.ExecutionException
                    || current instanceof java.lang.reflect.InvocationTargetException)) {
            current = current.getCause();
        }
        return current;
    }

    private static void log(Logger log, Logger.Level level, Throwable exception, String message, Object... args) {
        String formattedMessage = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            log.log(level, formattedMessage);
            return;
        }
        log.logf(level, "%s: %s%n%s", formattedMessage,
                exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName(),
                getStackTrace(exception));
    }
}
