package edu.washington.escience.carryover.api.encoding;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.carryover.EvaluatorException;
import edu.washington.escience.carryover.Row;
import edu.washington.escience.carryover.operator.CarryForwardWindow;
import edu.washington.escience.carryover.operator.PartitionResult;
import edu.washington.escience.carryover.operator.PartitionedWindowRunner;
import edu.washington.escience.carryover.util.TestUtils;
import edu.washington.escience.carryover.window.EvaluatorMode;
import edu.washington.escience.carryover.window.ExecutionStrategy;
import edu.washington.escience.carryover.window.NullSignalPolicy;
import edu.washington.escience.carryover.window.UnsupportedModeException;
import edu.washington.escience.carryover.window.WindowFrame;

public class CarryForwardEncodingTest {

  private static CarryForwardEncoding fixture() throws IOException {
    try (InputStream in = CarryForwardEncodingTest.class.getResourceAsStream("/carry_forward_streaming.json")) {
      return CarryForwardEncoding.fromJson(in);
    }
  }

  @Test
  public void testFixture() throws Exception {
    CarryForwardEncoding encoding = fixture();
    assertEquals(EvaluatorMode.STREAMING_INCREMENTAL, encoding.getMode());
    assertEquals(WindowFrame.UNBOUNDED_PRECEDING_TO_CURRENT_ROW, encoding.getFrame());
    assertEquals(ImmutableList.of("pk"), encoding.getPartitionColumns());
    assertEquals(2, encoding.getNumWorkers());

    CarryForwardWindow window = encoding.construct(TestUtils.SCHEMA);
    assertEquals(ExecutionStrategy.STREAMING, window.getStrategy());
    assertEquals("last_signal", window.getOutputSchema().getColumnName(4));

    try (PartitionedWindowRunner runner = encoding.newRunner(TestUtils.SCHEMA)) {
      assertEquals(2, runner.getNumWorkers());
      List<PartitionResult> results = runner.runSorted(TestUtils.scenario().iterator());
      assertEquals(1, results.size());
      List<Row> rows = results.get(0).getRows();
      assertNull(rows.get(1).getObject(4));
      assertEquals("27", rows.get(2).getString(4));
      assertEquals("08", rows.get(5).getString(4));
    }
  }

  @Test
  public void testToJson() throws IOException {
    CarryForwardEncoding encoding = fixture();
    encoding.nullSignalPolicy = NullSignalPolicy.OVERWRITE;
    CarryForwardEncoding read = CarryForwardEncoding.fromJson(encoding.toJson());
    assertEquals("flag", read.flagColumn);
    assertEquals(EvaluatorMode.STREAMING_INCREMENTAL, read.getMode());
    assertEquals(encoding.getFrame(), read.getFrame());
    assertEquals(ImmutableList.of("pk"), read.getPartitionColumns());
    assertEquals("ts", read.orderColumn);
    assertEquals(NullSignalPolicy.OVERWRITE, read.getNullSignalPolicy());
    assertEquals(2, read.getNumWorkers());
  }

  @Test
  public void testDefaults() throws EvaluatorException {
    CarryForwardEncoding encoding =
        CarryForwardEncoding.fromJson("{\"flagColumn\":\"flag\",\"signalColumn\":\"signal\",\"mode\":\"COMPLETE\"}");
    assertEquals("carried", encoding.getOutputColumn());
    assertTrue(encoding.getPartitionColumns().isEmpty());
    assertEquals(WindowFrame.UNBOUNDED_PRECEDING_TO_CURRENT_ROW, encoding.getFrame());
    assertEquals(NullSignalPolicy.IGNORE, encoding.getNullSignalPolicy());
    assertTrue(encoding.getNumWorkers() > 0);

    CarryForwardWindow window = encoding.construct(TestUtils.SCHEMA);
    assertEquals(ExecutionStrategy.BUFFERED, window.getStrategy());
    assertEquals(NullSignalPolicy.IGNORE, window.getFunction().getNullSignalPolicy());
    assertEquals(TestUtils.FLAG, window.getFunction().getFlagColumn());
    assertEquals(TestUtils.SIGNAL, window.getFunction().getSignalColumn());
  }

  @Test
  public void testMissingRequiredFields() {
    try {
      CarryForwardEncoding.fromJson("{\"signalColumn\":\"signal\"}");
      fail();
    } catch (InvalidEncodingException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("flagColumn"));
      assertFalse(e.getMessage(), e.getMessage().contains("mode"));
    }
  }

  @Test
  public void testStreamingByDefault() throws EvaluatorException {
    CarryForwardEncoding encoding =
        CarryForwardEncoding.fromJson("{\"flagColumn\":\"flag\",\"signalColumn\":\"signal\"}");
    assertNull(encoding.mode);
    assertEquals(EvaluatorMode.STREAMING_INCREMENTAL, encoding.getMode());
    assertEquals(ExecutionStrategy.STREAMING, encoding.construct(TestUtils.SCHEMA).getStrategy());
  }

  @Test(expected = InvalidEncodingException.class)
  public void testMalformedJson() {
    CarryForwardEncoding.fromJson("{\"flagColumn\":");
  }

  @Test(expected = InvalidEncodingException.class)
  public void testUnknownMode() {
    CarryForwardEncoding.fromJson(
        "{\"flagColumn\":\"flag\",\"signalColumn\":\"signal\",\"mode\":\"SOMETIMES\"}");
  }

  @Test(expected = InvalidEncodingException.class)
  public void testBadFrame() {
    CarryForwardEncoding.fromJson(
        "{\"flagColumn\":\"flag\",\"signalColumn\":\"signal\",\"mode\":\"COMPLETE\","
            + "\"frame\":{\"start\":\"PRECEDING\",\"end\":\"CURRENT_ROW\"}}");
  }

  @Test(expected = InvalidEncodingException.class)
  public void testNonPositiveWorkers() {
    CarryForwardEncoding.fromJson(
        "{\"flagColumn\":\"flag\",\"signalColumn\":\"signal\",\"mode\":\"COMPLETE\",\"workers\":0}");
  }

  @Test(expected = InvalidEncodingException.class)
  public void testUnknownColumn() throws UnsupportedModeException {
    CarryForwardEncoding.fromJson(
            "{\"flagColumn\":\"kind\",\"signalColumn\":\"signal\",\"mode\":\"COMPLETE\"}")
        .construct(TestUtils.SCHEMA);
  }

  @Test(expected = InvalidEncodingException.class)
  public void testSignalAsFlagColumn() throws UnsupportedModeException {
    CarryForwardEncoding.fromJson(
            "{\"flagColumn\":\"signal\",\"signalColumn\":\"flag\",\"mode\":\"COMPLETE\"}")
        .construct(TestUtils.SCHEMA);
  }

  @Test(expected = InvalidEncodingException.class)
  public void testOutputColumnClash() throws UnsupportedModeException {
    CarryForwardEncoding.fromJson(
            "{\"flagColumn\":\"flag\",\"signalColumn\":\"signal\",\"mode\":\"COMPLETE\","
                + "\"outputColumn\":\"ts\"}")
        .construct(TestUtils.SCHEMA);
  }

  @Test
  public void testPartialMergeRejected() {
    CarryForwardEncoding encoding =
        CarryForwardEncoding.fromJson(
            "{\"flagColumn\":\"flag\",\"signalColumn\":\"signal\",\"mode\":\"PARTIAL_MERGE\"}");
    try {
      encoding.construct(TestUtils.SCHEMA);
      fail("PARTIAL_MERGE must be rejected");
    } catch (UnsupportedModeException e) {
      assertEquals(EvaluatorMode.PARTIAL_MERGE, e.getMode());
    }
  }
}
