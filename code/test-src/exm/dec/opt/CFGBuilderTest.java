package exm.dec.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.dec.ast.Assignment;
import exm.dec.ast.Block;
import exm.dec.ast.NodeBuilder;
import exm.dec.ast.Return;
import exm.dec.ast.Statement;
import exm.dec.common.Logging;
import exm.dec.common.util.Reachability;

public class CFGBuilderTest {

  private final NodeBuilder b = new NodeBuilder(false);

  @BeforeClass
  public static void setupLogging() {
    Logging.setupLogging(null, false);
  }

  private Assignment assign(String name, long val) {
    return b.createAssignment(name, b.createLiteral(val));
  }

  private CFG build(Statement root) {
    CFGBuilder builder = new CFGBuilder();
    root.accept(builder, null);
    return builder.getCFG();
  }

  @Test
  public void testStraightLine() {
    Assignment s1 = assign("a", 1);
    Assignment s2 = assign("b", 2);
    Return r = b.createReturn(b.createVariable("b"));
    CFG cfg = build(b.createBlock(s1, s2, r));

    assertSame(s1, cfg.getStart());
    assertEquals(3, cfg.vertexCount());
    assertEquals(2, cfg.edgeCount());
    assertTrue(cfg.hasEdge(s1, s2));
    assertTrue(cfg.hasEdge(s2, r));
  }

  @Test
  public void testDeadCodeAfterReturn() {
    // { s1; return r; s2 }
    Assignment s1 = assign("a", 1);
    Return r = b.createReturn(b.createLiteral(0));
    Assignment s2 = assign("c", 3);
    CFG cfg = build(b.createBlock(s1, r, s2));

    assertEquals("Dead statement is still a vertex", 3, cfg.vertexCount());
    assertEquals(1, cfg.edgeCount());
    assertFalse(cfg.hasEdge(r, s2));

    Reachability<Statement> reach = cfg.reachability();
    assertEquals(Arrays.<Statement>asList(s1, r),
                 new ArrayList<Statement>(reach.getReachable()));
    assertEquals(Arrays.<Statement>asList(s2),
                 new ArrayList<Statement>(reach.getUnreachable()));
  }

  @Test
  public void testNestedBlocks() {
    // { s1; { s2; s3 }; s4 }
    Assignment s1 = assign("a", 1);
    Assignment s2 = assign("b", 2);
    Assignment s3 = assign("c", 3);
    Assignment s4 = assign("d", 4);
    Block outer = b.createEmptyBlock(null);
    Block inner = b.createEmptyBlock(outer.getScope());
    inner.addStatement(s2);
    inner.addStatement(s3);
    outer.addStatement(s1);
    outer.addStatement(inner);
    outer.addStatement(s4);
    CFG cfg = build(outer);

    assertEquals("Blocks are not vertices", 4, cfg.vertexCount());
    assertFalse(cfg.hasVertex(inner));
    assertTrue(cfg.hasEdge(s1, s2));
    assertTrue(cfg.hasEdge(s2, s3));
    assertTrue(cfg.hasEdge(s3, s4));
    assertTrue(cfg.reachability().getUnreachable().isEmpty());
  }

  @Test
  public void testReturnInNestedBlock() {
    // { s1; { return r; s2 }; s3; { s4 } }
    Assignment s1 = assign("a", 1);
    Return r = b.createReturn(b.createLiteral(0));
    Assignment s2 = assign("b", 2);
    Assignment s3 = assign("c", 3);
    Assignment s4 = assign("d", 4);
    Block outer = b.createEmptyBlock(null);
    Block inner = b.createEmptyBlock(outer.getScope());
    inner.addStatement(r);
    inner.addStatement(s2);
    Block dead = b.createEmptyBlock(outer.getScope());
    dead.addStatement(s4);
    outer.addStatement(s1);
    outer.addStatement(inner);
    outer.addStatement(s3);
    outer.addStatement(dead);
    CFG cfg = build(outer);

    assertEquals(5, cfg.vertexCount());
    assertEquals(1, cfg.edgeCount());
    for (Statement s: Arrays.<Statement>asList(s2, s3, s4)) {
      assertTrue("No edges into dead statement " + s,
                 incoming(cfg, s).isEmpty());
      assertTrue(cfg.neighbors(s).isEmpty());
    }
    assertEquals(Arrays.<Statement>asList(s2, s3, s4),
        new ArrayList<Statement>(cfg.reachability().getUnreachable()));
  }

  @Test
  public void testExpressionsAddNothing() {
    CFGBuilder builder = new CFGBuilder();
    assertNull(b.createPlus(b.createLiteral(1), b.createLiteral(2))
                .accept(builder, null));
    assertEquals(0, builder.getCFG().vertexCount());
  }

  @Test
  public void testEmptyBlock() {
    Assignment s1 = assign("a", 1);
    CFGBuilder builder = new CFGBuilder();
    assertSame("Empty block passes prev through",
               s1, b.createBlock().accept(builder, s1));

    CFG cfg = build(b.createBlock());
    assertNull(cfg.getStart());
    assertTrue(cfg.reachability().getReachable().isEmpty());
    assertTrue(cfg.reachability().getUnreachable().isEmpty());
  }

  @Test
  public void testSingletonComponents() {
    CFG cfg = build(b.createBlock(assign("a", 1), assign("b", 2),
                      b.createReturn(b.createVariable("a")), assign("c", 3)));
    List<List<Statement>> sccs = cfg.stronglyConnectedComponents();
    assertEquals(4, sccs.size());
    for (List<Statement> scc: sccs) {
      assertEquals(1, scc.size());
    }
  }

  private List<Statement> incoming(CFG cfg, Statement dst) {
    List<Statement> result = new ArrayList<Statement>();
    for (Statement src: cfg.vertices()) {
      if (cfg.hasEdge(src, dst)) {
        result.add(src);
      }
    }
    return result;
  }
}
