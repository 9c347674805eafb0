package exm.dec.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.dec.common.exceptions.DECRuntimeError;
import exm.dec.common.exceptions.InvalidOptionException;
import exm.dec.common.lang.Operators.IntDivMode;

public class SettingsTest {

  @After
  public void resetSettings() {
    Settings.reset();
    System.clearProperty(Settings.EVAL_INT_DIVISION);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(4, Settings.getInt(Settings.UNPARSE_INDENT_WIDTH));
    assertEquals(IntDivMode.TRUNCATE, Settings.getIntDivMode());
    assertFalse(Settings.getBoolean(Settings.BUILDER_TRACE));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertTrue(Settings.getKeys().contains(Settings.LOG_TRACE));
  }

  @Test
  public void testOverrideAndReset() throws InvalidOptionException {
    Settings.set(Settings.EVAL_INT_DIVISION, "Floor");
    assertEquals(IntDivMode.FLOOR, Settings.getIntDivMode());
    Settings.reset();
    assertEquals(IntDivMode.TRUNCATE, Settings.getIntDivMode());
  }

  @Test
  public void testSystemProperty() throws InvalidOptionException {
    System.setProperty(Settings.EVAL_INT_DIVISION, "floor");
    Settings.initDECProperties();
    assertEquals(IntDivMode.FLOOR, Settings.getIntDivMode());
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadIntDivMode() throws InvalidOptionException {
    Settings.set(Settings.EVAL_INT_DIVISION, "round");
    Settings.getIntDivMode();
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.BUILDER_TRACE, "yes");
    Settings.getBoolean(Settings.BUILDER_TRACE);
  }

  @Test(expected=DECRuntimeError.class)
  public void testBadIndentWidth() {
    Settings.set(Settings.UNPARSE_INDENT_WIDTH, "four");
    Settings.indentWidth();
  }
}
