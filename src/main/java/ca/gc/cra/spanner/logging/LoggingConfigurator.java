package ca.gc.cra.spanner.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the running Logback configuration: root verbosity and the capture appender.
 * <p><strong>Why:</strong> Log capture is wired at startup from configuration rather than from
 * {@code logback.xml}, so the appender can share the composition root's event registry.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup and shutdown; Logback synchronizes
 * appender attachment internally.</p>
 * <p><strong>Observability:</strong> Emits SLF4J warnings when the backend is not Logback.</p>
 *
 * @implNote Other SLF4J bindings fall back to a warning and keep their defaults.
 * @since Spanner 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    Logger root = rootLogger("Verbose logging");
    if (root != null && !Level.DEBUG.equals(root.getLevel())) {
      root.setLevel(Level.DEBUG);
    }
  }

  /**
   * Starts {@code appender} in the active Logback context and attaches it to the root logger.
   *
   * @param appender appender to attach
   * @return {@code true} when attached; {@code false} when the backend is not Logback
   */
  public static boolean attachToRoot(Appender<ILoggingEvent> appender) {
    Logger root = rootLogger("Log capture");
    if (root == null) {
      return false;
    }
    if (!appender.isStarted()) {
      appender.setContext(root.getLoggerContext());
      appender.start();
    }
    root.addAppender(appender);
    return true;
  }

  /**
   * Detaches and stops {@code appender} if it is attached to the root logger.
   *
   * @param appender previously attached appender
   */
  public static void detachFromRoot(Appender<ILoggingEvent> appender) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).detachAppender(appender);
    }
    appender.stop();
  }

  private static Logger rootLogger(String feature) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
    log.warn("{} requested but backend {} does not support dynamic configuration",
        feature, factory.getClass().getName());
    return null;
  }
}
