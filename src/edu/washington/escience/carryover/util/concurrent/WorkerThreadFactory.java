package edu.washington.escience.carryover.util.concurrent;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates daemon worker threads named by a prefix and a sequence number starting at 0. A worker that dies of an
 * uncaught error has it logged.
 */
public final class WorkerThreadFactory implements ThreadFactory {

  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerThreadFactory.class);

  /** Logs errors that escape a worker. */
  private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT =
      new Thread.UncaughtExceptionHandler() {
        @Override
        public void uncaughtException(final Thread t, final Throwable e) {
          LOGGER.error("Uncaught exception in worker thread {}", t.getName(), e);
        }
      };

  /** Thread name prefix. */
  private final String prefix;
  /** Number of the next thread. */
  private final AtomicInteger seq = new AtomicInteger(0);

  /**
   * @param prefix thread name prefix.
   */
  public WorkerThreadFactory(final String prefix) {
    this.prefix = prefix;
  }

  @Override
  public Thread newThread(final Runnable r) {
    Thread t = new Thread(r, prefix + "#" + seq.getAndIncrement());
    t.setDaemon(true);
    t.setUncaughtExceptionHandler(LOG_UNCAUGHT);
    return t;
  }
}
