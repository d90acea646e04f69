package ca.gc.cra.spanner.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spanner.application.capture.EventFactory;
import ca.gc.cra.spanner.application.capture.SpanTracker;
import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.infrastructure.logback.SpannerAppender;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @Test
  void attachAndDetachRootAppender() {
    List<Event> captured = new CopyOnWriteArrayList<>();
    SpannerAppender appender = new SpannerAppender(captured::add, new EventFactory(null, new SpanTracker()));
    org.slf4j.Logger logger = LoggerFactory.getLogger("spanner.test.root");

    assertTrue(LoggingConfigurator.attachToRoot(appender));
    try {
      assertTrue(appender.isStarted());
      logger.error("captured");
    } finally {
      LoggingConfigurator.detachFromRoot(appender);
    }
    logger.error("not captured");

    assertFalse(appender.isStarted());
    assertEquals(1, captured.size());
    assertEquals("captured", captured.get(0).message());
  }

  @Test
  void enableVerboseLoggingRaisesRootToDebug() {
    Logger root = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level previous = root.getLevel();
    try {
      LoggingConfigurator.enableVerboseLogging();
      assertEquals(Level.DEBUG, root.getLevel());
    } finally {
      root.setLevel(previous);
    }
  }
}
