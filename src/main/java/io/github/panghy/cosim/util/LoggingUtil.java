package io.github.panghy.cosim.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility class for logging in the cosim engine.
 * Provides caller-aware logging methods on top of JUL (java.util.logging). The
 * {@code long simTimeMillis} overloads prefix the message with the simulated time
 * ({@code [1500ms] message}) so that log lines of a run can be ordered by simulated
 * time rather than by wall-clock time.
 */
public final class LoggingUtil {

  private LoggingUtil() {
    // Utility class should not be instantiated
  }

  /**
   * Gets the caller information from the stack trace.
   * Skips LoggingUtil frames to find the actual caller.
   */
  private static StackTraceElement getCaller() {
    StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // Skip: 0=getStackTrace, 1=getCaller, 2=log
    for (int i = 3; i < stack.length; i++) {
      StackTraceElement element = stack[i];
      if (!element.getClassName().equals(LoggingUtil.class.getName())) {
        return element;
      }
    }
    return stack.length > 3 ? stack[3] : stack[stack.length - 1];
  }

  private static void log(Logger logger, Level level, String message, Throwable throwable) {
    if (logger.isLoggable(level)) {
      StackTraceElement caller = getCaller();
      if (throwable == null) {
        logger.logp(level, caller.getClassName(), caller.getMethodName(), message);
      } else {
        logger.logp(level, caller.getClassName(), caller.getMethodName(), message, throwable);
      }
    }
  }

  /**
   * Formats a message with a simulated-time prefix.
   *
   * @param simTimeMillis the simulated time in milliseconds
   * @param message       the message
   * @return the prefixed message
   */
  public static String atSimTime(long simTimeMillis, String message) {
    return "[" + simTimeMillis + "ms] " + message;
  }

  /**
   * Logs a debug message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void debug(Logger logger, String message) {
    log(logger, Level.FINE, message, null);
  }

  /**
   * Logs a debug message stamped with the simulated time.
   *
   * @param logger        The logger to use
   * @param simTimeMillis The simulated time in milliseconds
   * @param message       The message to log
   */
  public static void debug(Logger logger, long simTimeMillis, String message) {
    if (logger.isLoggable(Level.FINE)) {
      log(logger, Level.FINE, atSimTime(simTimeMillis, message), null);
    }
  }

  /**
   * Logs an info message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, message, null);
  }

  /**
   * Logs an info message stamped with the simulated time.
   *
   * @param logger        The logger to use
   * @param simTimeMillis The simulated time in milliseconds
   * @param message       The message to log
   */
  public static void info(Logger logger, long simTimeMillis, String message) {
    if (logger.isLoggable(Level.INFO)) {
      log(logger, Level.INFO, atSimTime(simTimeMillis, message), null);
    }
  }

  /**
   * Logs a warning message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void warn(Logger logger, String message) {
    log(logger, Level.WARNING, message, null);
  }

  /**
   * Logs a warning message stamped with the simulated time.
   *
   * @param logger        The logger to use
   * @param simTimeMillis The simulated time in milliseconds
   * @param message       The message to log
   */
  public static void warn(Logger logger, long simTimeMillis, String message) {
    if (logger.isLoggable(Level.WARNING)) {
      log(logger, Level.WARNING, atSimTime(simTimeMillis, message), null);
    }
  }

  /**
   * Logs an exception at the warning level with full stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void warn(Logger logger, String message, Throwable throwable) {
    log(logger, Level.WARNING, message, throwable);
  }

  /**
   * Logs an error message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void error(Logger logger, String message) {
    log(logger, Level.SEVERE, message, null);
  }

  /**
   * Logs an exception at the error level with full stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void error(Logger logger, String message, Throwable throwable) {
    log(logger, Level.SEVERE, message, throwable);
  }
}
