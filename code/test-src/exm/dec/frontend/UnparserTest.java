package exm.dec.frontend;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.dec.ast.Block;
import exm.dec.ast.Expression;
import exm.dec.ast.NodeBuilder;

public class UnparserTest {

  private final NodeBuilder b = new NodeBuilder(false);

  private final Unparser unparser = new Unparser(4);

  @Test
  public void testNestedExpression() {
    // (2+3)*(4-1)
    Expression e = b.createTimes(
        b.createPlus(b.createLiteral(2), b.createLiteral(3)),
        b.createMinus(b.createLiteral(4), b.createLiteral(1)));
    assertEquals("((2 + 3) * (4 - 1))", e.accept(unparser, 0));
  }

  @Test
  public void testOperatorSymbols() {
    assertEquals("(a / b)", b.createFloatDiv(b.createVariable("a"),
                 b.createVariable("b")).accept(unparser, 0));
    assertEquals("(a // b)", b.createIntDiv(b.createVariable("a"),
                 b.createVariable("b")).accept(unparser, 0));
    assertEquals("(a % b)", b.createModulus(b.createVariable("a"),
                 b.createVariable("b")).accept(unparser, 0));
    assertEquals("(a ** 2.5)", b.createExponentiation(b.createVariable("a"),
                 b.createLiteral(2.5)).accept(unparser, 0));
  }

  @Test
  public void testBlock() {
    Block outer = b.createEmptyBlock(null);
    Block inner = b.createEmptyBlock(outer.getScope());
    inner.addStatement(b.createReturn(b.createVariable("x")));
    outer.addStatement(b.createAssignment("x",
                    b.createPlus(b.createLiteral(1), b.createLiteral(2))));
    outer.addStatement(inner);

    String expected =
        "{\n" +
        "    x := (1 + 2)\n" +
        "    {\n" +
        "        return x\n" +
        "    }\n" +
        "}";
    assertEquals(expected, outer.accept(unparser, 0));
  }

  @Test
  public void testIndentation() {
    assertEquals("        return 1",
                 b.createReturn(b.createLiteral(1)).accept(unparser, 2));
    assertEquals("Negative level means no indent", "y := 1",
                 b.createAssignment("y", b.createLiteral(1))
                  .accept(unparser, -3));
    assertEquals("  return 1", b.createReturn(b.createLiteral(1))
                                .accept(new Unparser(2), 1));
  }

  @Test
  public void testEmptyBlock() {
    assertEquals("    {\n    }", b.createBlock().accept(unparser, 1));
  }
}
