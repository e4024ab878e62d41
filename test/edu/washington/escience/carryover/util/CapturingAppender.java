package edu.washington.escience.carryover.util;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;

/**
 * Collects the log events of the project's loggers while attached.
 */
public final class CapturingAppender extends AppenderSkeleton {

  /** The events seen so far. */
  private final List<LoggingEvent> events = new ArrayList<>();

  /**
   * @return an appender attached to the root logger. Detach it with {@link #close()}.
   */
  public static CapturingAppender attach() {
    CapturingAppender appender = new CapturingAppender();
    Logger.getRootLogger().addAppender(appender);
    return appender;
  }

  @Override
  protected synchronized void append(final LoggingEvent event) {
    events.add(event);
  }

  /**
   * @param level the minimum level.
   * @return the messages logged at the given level or above.
   */
  public synchronized List<String> messagesAtLeast(final Level level) {
    List<String> ret = new ArrayList<>();
    for (LoggingEvent event : events) {
      if (event.getLevel().isGreaterOrEqual(level)) {
        ret.add(event.getRenderedMessage());
      }
    }
    return ret;
  }

  @Override
  public void close() {
    Logger.getRootLogger().removeAppender(this);
  }

  @Override
  public boolean requiresLayout() {
    return false;
  }
}
