package exm.dec.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.dec.common.exceptions.DECRuntimeError;

public class ValueTest {

  @Test
  public void testEquality() {
    assertEquals(Value.createInt(3), Value.createInt(3));
    assertEquals(Value.createInt(3).hashCode(),
                 Value.createInt(3).hashCode());
    assertFalse("Kinds differ",
                Value.createInt(3).equals(Value.createFloat(3.0)));
  }

  @Test
  public void testToString() {
    assertEquals("5", Value.createInt(5).toString());
    assertEquals("2.5", Value.createFloat(2.5).toString());
    assertEquals("2.0", Value.createFloat(2).toString());
  }

  @Test
  public void testZero() {
    assertTrue(Value.createInt(0).isZero());
    assertTrue(Value.createFloat(-0.0).isZero());
    assertFalse(Value.NONE.isZero());
  }

  @Test(expected=DECRuntimeError.class)
  public void testWrongAccessor() {
    Value.createFloat(1.0).getInt();
  }
}
