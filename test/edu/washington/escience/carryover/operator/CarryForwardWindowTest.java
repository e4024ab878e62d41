package edu.washington.escience.carryover.operator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.carryover.EvaluatorException;
import edu.washington.escience.carryover.Row;
import edu.washington.escience.carryover.UnsortedInputException;
import edu.washington.escience.carryover.util.TestUtils;
import edu.washington.escience.carryover.window.EvaluatorMode;
import edu.washington.escience.carryover.window.ExecutionStrategy;
import edu.washington.escience.carryover.window.InvalidFlagException;
import edu.washington.escience.carryover.window.UnsupportedModeException;
import edu.washington.escience.carryover.window.WindowFrame;

public class CarryForwardWindowTest {

  private static CarryForwardWindow buffered() throws UnsupportedModeException {
    return new CarryForwardWindow(
        TestUtils.function(), EvaluatorMode.COMPLETE, null, new int[] {TestUtils.PK}, TestUtils.TS);
  }

  private static CarryForwardWindow streaming() throws UnsupportedModeException {
    return new CarryForwardWindow(
        TestUtils.function(),
        EvaluatorMode.STREAMING_INCREMENTAL,
        WindowFrame.UNBOUNDED_PRECEDING_TO_CURRENT_ROW,
        new int[] {TestUtils.PK},
        TestUtils.TS);
  }

  private static List<Object> carriedColumn(final List<Row> rows) {
    List<Object> ret = new ArrayList<>();
    for (Row row : rows) {
      ret.add(row.getObject(TestUtils.SIGNAL + 1));
    }
    return ret;
  }

  @Test
  public void testScenario() throws EvaluatorException {
    for (CarryForwardWindow window : ImmutableList.of(buffered(), streaming())) {
      List<Row> out =
          window.evaluate(new ListPartitionCursor(ImmutableList.<Object>of(7L), TestUtils.scenario()));
      assertEquals(6, out.size());
      assertEquals(window.getOutputSchema(), out.get(0).getSchema());
      assertEquals(TestUtils.scenario().get(2).getValues(), out.get(2).getValues().subList(0, 4));
      assertEquals(Arrays.asList(null, null, "27", "27", null, "08"), carriedColumn(out));
    }
  }

  @Test
  public void testStrategy() throws UnsupportedModeException {
    assertEquals(ExecutionStrategy.BUFFERED, buffered().getStrategy());
    assertEquals(ExecutionStrategy.STREAMING, streaming().getStrategy());
  }

  @Test(expected = UnsupportedModeException.class)
  public void testRejectedBeforeInput() throws UnsupportedModeException {
    new CarryForwardWindow(
        TestUtils.function(),
        EvaluatorMode.PARTIAL_INIT,
        null,
        new int[] {TestUtils.PK},
        SortedPartitionSplitter.NO_ORDER_COLUMN);
  }

  @Test
  public void testStreamingPushesBeforeFinish() throws EvaluatorException {
    final List<Row> seen = new ArrayList<>();
    List<Row> rows = TestUtils.partition(1, new int[] {1, 0, 0, 7}, new String[] {"a", null, null, null});
    try {
      streaming()
          .evaluate(
              new ListPartitionCursor(ImmutableList.<Object>of(1L), rows),
              new RowSink() {
                @Override
                public void put(final Row row) {
                  seen.add(row);
                }
              });
      fail("flag 7 must be rejected");
    } catch (InvalidFlagException e) {
      assertEquals(3, e.getRowIndex());
    }
    assertEquals(3, seen.size());
  }

  @Test
  public void testBufferedPushesNothingOnFailure() throws EvaluatorException {
    final List<Row> seen = new ArrayList<>();
    List<Row> rows = TestUtils.partition(1, new int[] {1, 0, 0, 7}, new String[] {"a", null, null, null});
    try {
      buffered()
          .evaluate(
              new ListPartitionCursor(ImmutableList.<Object>of(1L), rows),
              new RowSink() {
                @Override
                public void put(final Row row) {
                  seen.add(row);
                }
              });
      fail("flag 7 must be rejected");
    } catch (InvalidFlagException e) {
      assertEquals(3, e.getRowIndex());
    }
    assertTrue(seen.isEmpty());
  }

  @Test
  public void testEvaluateAllResetsBetweenPartitions() throws EvaluatorException {
    List<Row> input = new ArrayList<>();
    input.addAll(TestUtils.partition(1, new int[] {0, 1, 0}, new String[] {"x", "a", "y"}));
    input.addAll(TestUtils.partition(2, new int[] {0, 0, 1}, new String[] {"x", "y", "b"}));
    input.addAll(TestUtils.partition(3, new int[] {1, 0}, new String[] {"c", "z"}));
    for (CarryForwardWindow window : ImmutableList.of(buffered(), streaming())) {
      List<Row> out = window.evaluateAll(input.iterator());
      assertEquals(input.size(), out.size());
      assertEquals(
          Arrays.asList(null, null, "a", null, null, null, null, "c"), carriedColumn(out));
    }
  }

  @Test
  public void testEvaluateAllMatchesPerPartition() throws EvaluatorException {
    List<Row> input = new ArrayList<>();
    for (long pk = 0; pk < 20; ++pk) {
      input.addAll(TestUtils.randomPartition(pk, 50, 15));
    }
    assertEquals(
        carriedColumn(buffered().evaluateAll(input.iterator())),
        carriedColumn(streaming().evaluateAll(input.iterator())));
  }

  @Test(expected = UnsortedInputException.class)
  public void testEvaluateAllStopsOnUnsortedInput() throws EvaluatorException {
    List<Row> input =
        ImmutableList.of(
            Row.of(TestUtils.SCHEMA, 1L, 5L, 1, "a"), Row.of(TestUtils.SCHEMA, 1L, 4L, 0, "b"));
    streaming().evaluateAll(input.iterator());
  }
}
