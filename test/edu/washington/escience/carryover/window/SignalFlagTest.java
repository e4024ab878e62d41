package edu.washington.escience.carryover.window;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import edu.washington.escience.carryover.Type;

public class SignalFlagTest {

  @Test
  public void testDecodeIntegral() throws InvalidFlagException {
    assertEquals(SignalFlag.SUBJECT, SignalFlag.decode(0, 0));
    assertEquals(SignalFlag.CARRIER, SignalFlag.decode(0, 1));
    assertEquals(SignalFlag.SUBJECT, SignalFlag.decode(0, 0L));
    assertEquals(SignalFlag.CARRIER, SignalFlag.decode(0, 1L));
  }

  @Test
  public void testDecodeBoolean() throws InvalidFlagException {
    assertEquals(SignalFlag.SUBJECT, SignalFlag.decode(0, false));
    assertEquals(SignalFlag.CARRIER, SignalFlag.decode(0, true));
  }

  @Test
  public void testNeverDefaults() {
    Object[] invalid = {2, -1, 2L, Long.MAX_VALUE, null, "1", 1.0};
    for (int i = 0; i < invalid.length; ++i) {
      try {
        SignalFlag.decode(i, invalid[i]);
        throw new AssertionError(invalid[i] + " must be rejected");
      } catch (InvalidFlagException e) {
        assertEquals(i, e.getRowIndex());
        assertEquals(invalid[i], e.getFlag());
      }
    }
  }

  @Test
  public void testFlagTypes() {
    assertTrue(SignalFlag.isFlagType(Type.INT_TYPE));
    assertTrue(SignalFlag.isFlagType(Type.LONG_TYPE));
    assertTrue(SignalFlag.isFlagType(Type.BOOLEAN_TYPE));
    assertFalse(SignalFlag.isFlagType(Type.STRING_TYPE));
    assertFalse(SignalFlag.isFlagType(Type.DOUBLE_TYPE));
    assertFalse(SignalFlag.isFlagType(Type.DATETIME_TYPE));
  }
}
