package edu.washington.escience.carryover.operator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import edu.washington.escience.carryover.CarryoverConstants;
import edu.washington.escience.carryover.EvaluatorException;
import edu.washington.escience.carryover.Row;
import edu.washington.escience.carryover.util.concurrent.WorkerThreadFactory;

/**
 * Evaluates many partitions of a {@link CarryForwardWindow} concurrently. Partitions share nothing: every one gets its
 * own evaluator on some worker thread, and a partition that fails does not affect the others.
 */
public final class PartitionedWindowRunner implements AutoCloseable {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionedWindowRunner.class);

  /** The window evaluated on every partition. */
  private final CarryForwardWindow window;
  /** The worker pool. */
  private final ListeningExecutorService executor;
  /** The number of workers. */
  private final int numWorkers;

  /**
   * @param window the window evaluated on every partition.
   * @param numWorkers the number of worker threads.
   */
  public PartitionedWindowRunner(@Nonnull final CarryForwardWindow window, final int numWorkers) {
    this.window = Objects.requireNonNull(window, "window");
    Preconditions.checkArgument(numWorkers > 0, "numWorkers must be positive, got %s", numWorkers);
    this.numWorkers = numWorkers;
    executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                numWorkers,
                new WorkerThreadFactory(CarryoverConstants.PARTITION_WORKER_THREAD_PREFIX)));
  }

  /**
   * Evaluate independent partitions concurrently.
   *
   * @param partitions the partitions. Each cursor must be safe to read from another thread.
   * @return one result per partition, in the order of the partitions.
   * @throws InterruptedException if interrupted while waiting for the workers.
   */
  public List<PartitionResult> run(@Nonnull final List<? extends PartitionCursor> partitions)
      throws InterruptedException {
    Objects.requireNonNull(partitions, "partitions");
    List<List<Object>> keys = new ArrayList<>(partitions.size());
    List<ListenableFuture<List<Row>>> futures = new ArrayList<>(partitions.size());
    for (PartitionCursor cursor : partitions) {
      keys.add(cursor.getPartitionKey());
      futures.add(submit(cursor));
    }
    return collect(keys, futures);
  }

  /**
   * Split an input sorted on the window's partition columns and evaluate its partitions concurrently. Splitting reads
   * the input on the calling thread; each partition is handed to a worker as soon as its last row has been read, so
   * workers evaluate earlier partitions while later ones are still being split. A partition whose rows arrive out of
   * order fails on its own.
   *
   * @param sortedRows the input, sorted on the partition columns.
   * @return one result per partition, in input order.
   * @throws InterruptedException if interrupted while waiting for the workers.
   */
  public List<PartitionResult> runSorted(@Nonnull final Iterator<Row> sortedRows)
      throws InterruptedException {
    SortedPartitionSplitter splitter = window.newSplitter(sortedRows);
    List<List<Object>> keys = new ArrayList<>();
    List<ListenableFuture<List<Row>>> futures = new ArrayList<>();
    try {
      PartitionCursor cursor;
      while ((cursor = splitter.nextPartition()) != null) {
        keys.add(cursor.getPartitionKey());
        ListenableFuture<List<Row>> future;
        try {
          future = submit(ListPartitionCursor.drain(cursor));
        } catch (EvaluatorException e) {
          future = Futures.immediateFailedFuture(e);
        }
        futures.add(future);
      }
    } catch (RuntimeException e) {
      cancelAll(futures);
      throw e;
    }
    return collect(keys, futures);
  }

  /**
   * @param cursor a partition.
   * @return the pending evaluation of the partition on a worker.
   */
  private ListenableFuture<List<Row>> submit(final PartitionCursor cursor) {
    return executor.submit(
        new Callable<List<Row>>() {
          @Override
          public List<Row> call() throws EvaluatorException {
            return window.evaluate(cursor);
          }
        });
  }

  /**
   * Wait for every partition and turn its outcome into a result.
   *
   * @param keys the partition keys.
   * @param futures the pending evaluations, parallel to keys.
   * @return one result per partition, in order.
   * @throws InterruptedException if interrupted while waiting. Pending evaluations are cancelled.
   */
  private List<PartitionResult> collect(
      final List<List<Object>> keys, final List<ListenableFuture<List<Row>>> futures)
      throws InterruptedException {
    List<PartitionResult> results = new ArrayList<>(futures.size());
    int numFailed = 0;
    for (int i = 0; i < futures.size(); ++i) {
      List<Object> key = keys.get(i);
      try {
        results.add(PartitionResult.success(key, futures.get(i).get()));
      } catch (ExecutionException e) {
        ++numFailed;
        LOGGER.warn("Partition {} failed: {}", key, e.getCause().getMessage());
        results.add(PartitionResult.failure(key, e.getCause()));
      } catch (InterruptedException e) {
        cancelAll(futures);
        throw e;
      }
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "{} partitions evaluated on {} workers, {} failed", futures.size(), numWorkers, numFailed);
    }
    return results;
  }

  /**
   * @param futures evaluations to cancel.
   */
  private static void cancelAll(final List<ListenableFuture<List<Row>>> futures) {
    for (ListenableFuture<List<Row>> f : futures) {
      f.cancel(true);
    }
  }

  /**
   * @return the number of worker threads.
   */
  public int getNumWorkers() {
    return numWorkers;
  }

  @Override
  public void close() throws InterruptedException {
    executor.shutdownNow();
    if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
      LOGGER.warn("Partition workers did not terminate within one minute");
    }
  }
}
