package exm.dec.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.dec.ast.Block;
import exm.dec.ast.NodeBuilder;
import exm.dec.common.Logging;
import exm.dec.common.lang.Value;
import exm.dec.common.util.SymbolTable;

public class NameResolverTest {

  private final NodeBuilder b = new NodeBuilder(false);

  @BeforeClass
  public static void setupLogging() {
    Logging.setupLogging(null, false);
  }

  private boolean resolve(Block block) {
    return block.accept(new NameResolver(), block.getScope());
  }

  @Test
  public void testDeclaredBeforeUse() {
    // { x := 1; return x + 2 }
    Block prog = b.createBlock(
        b.createAssignment("x", b.createLiteral(1)),
        b.createReturn(b.createPlus(b.createVariable("x"),
                                    b.createLiteral(2))));
    assertTrue(resolve(prog));
    assertTrue(prog.getScope().containsLocal("x"));
    assertEquals(Value.NONE, prog.getScope().lookup("x"));
  }

  @Test
  public void testUseBeforeDeclaration() {
    // { return y; y := 1 }
    Block prog = b.createBlock(
        b.createReturn(b.createVariable("y")),
        b.createAssignment("y", b.createLiteral(1)));
    NameResolver resolver = new NameResolver();
    assertFalse(prog.accept(resolver, null));
    assertEquals(Arrays.asList("y"),
                 new ArrayList<String>(resolver.getUndeclaredNames()));
  }

  @Test
  public void testAssignmentDeclaresDespiteInvalidInit() {
    // { x := z; return x }: x still declared
    Block prog = b.createBlock(
        b.createAssignment("x", b.createVariable("z")),
        b.createReturn(b.createVariable("x")));
    NameResolver resolver = new NameResolver();
    assertFalse(prog.accept(resolver, null));
    assertTrue(prog.getScope().containsLocal("x"));
    assertEquals("Only z should be reported",
                 Arrays.asList("z"),
                 new ArrayList<String>(resolver.getUndeclaredNames()));
  }

  @Test
  public void testSelfReference() {
    Block prog = b.createBlock(
        b.createAssignment("x", b.createVariable("x")));
    assertFalse(resolve(prog));
  }

  @Test
  public void testBothOperandsChecked() {
    Block prog = b.createBlock(
        b.createReturn(b.createTimes(b.createVariable("a"),
                                     b.createVariable("b"))));
    NameResolver resolver = new NameResolver();
    assertFalse(prog.accept(resolver, null));
    assertEquals(Arrays.asList("a", "b"),
                 new ArrayList<String>(resolver.getUndeclaredNames()));
  }

  @Test
  public void testParentScope() {
    SymbolTable<String, Value> globals = new SymbolTable<String, Value>();
    globals.declare("g", Value.createInt(7));
    Block prog = b.createEmptyBlock(globals);
    prog.addStatement(b.createReturn(b.createVariable("g")));
    assertTrue(resolve(prog));
    assertFalse("Resolution must not write to the parent",
                globals.contains("x"));
  }

  @Test
  public void testNestedBlock() {
    // { x := 1; { y := x; x := 2 }; return y }
    Block outer = b.createEmptyBlock(null);
    Block inner = b.createEmptyBlock(outer.getScope());
    inner.addStatement(b.createAssignment("y", b.createVariable("x")));
    inner.addStatement(b.createAssignment("x", b.createLiteral(2)));
    outer.addStatement(b.createAssignment("x", b.createLiteral(1)));
    outer.addStatement(inner);
    outer.addStatement(b.createReturn(b.createVariable("y")));

    assertFalse("y is local to the inner block", resolve(outer));
    assertTrue(inner.getScope().containsLocal("x"));
    assertFalse(outer.getScope().containsLocal("y"));
  }

  @Test
  public void testEmptyBlock() {
    assertTrue(resolve(b.createBlock()));
  }

  @Test
  public void testAssignmentWithoutScope() {
    NameResolver resolver = new NameResolver();
    assertTrue(b.createAssignment("x", b.createLiteral(1))
                .accept(resolver, null));
    assertFalse(b.createAssignment("x", b.createVariable("w"))
                 .accept(resolver, null));
    assertEquals(Arrays.asList("w"),
                 new ArrayList<String>(resolver.getUndeclaredNames()));
  }
}
