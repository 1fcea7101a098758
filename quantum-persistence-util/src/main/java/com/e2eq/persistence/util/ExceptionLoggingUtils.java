package com.e2eq.persistence.util;

import org.jboss.logging.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Utility class for consistent exception logging across the persistence modules.
 * Every method logs through the caller's logger so the category stays the caller's.
 */
public class ExceptionLoggingUtils {

    /**
     * Log exception with full stack trace at ERROR level
     *
     * @param log the caller's logger
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logError(Logger log, Throwable exception, String message, Object... args) {
        if (exception == null) {
            if (args.length > 0) {
                log.errorf(message, args);
            } else {
                log.error(message);
            }
            return;
        }

        log.errorf("%s: %s%n%s", format(message, args), describe(exception), getStackTrace(exception));
    }

    /**
     * Log exception at WARN level. The stack trace is only appended when debug is enabled,
     * warnings are expected to be read by operators.
     *
     * @param log the caller's logger
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logWarn(Logger log, Throwable exception, String message, Object... args) {
        if (exception == null) {
            if (args.length > 0) {
                log.warnf(message, args);
            } else {
                log.warn(message);
            }
            return;
        }

        if (log.isDebugEnabled()) {
            log.warnf("%s: %s%n%s", format(message, args), describe(exception), getStackTrace(exception));
        } else {
            log.warnf("%s: %s", format(message, args), describe(exception));
        }
    }

    /**
     * Log exception with full stack trace at DEBUG level
     *
     * @param log the caller's logger
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logDebug(Logger log, Throwable exception, String message, Object... args) {
        if (!log.isDebugEnabled()) {
            return;
        }

        if (exception == null) {
            if (args.length > 0) {
                log.debugf(message, args);
            } else {
                log.debug(message);
            }
            return;
        }

        log.debugf("%s: %s%n%s", format(message, args), describe(exception), getStackTrace(exception));
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
     * The exception message, or its class name when it carries none.
     */
    public static String describe(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }

    private static String format(String message, Object... args) {
        if (args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
