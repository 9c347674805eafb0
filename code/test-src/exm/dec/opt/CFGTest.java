package exm.dec.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;

import exm.dec.ast.NodeBuilder;
import exm.dec.ast.Statement;

public class CFGTest {

  private final NodeBuilder b = new NodeBuilder(false);

  @Test
  public void testStartIsFirstVertex() {
    Statement s1 = b.createAssignment("a", b.createLiteral(1));
    Statement s2 = b.createAssignment("b", b.createLiteral(2));
    CFG cfg = new CFG();
    cfg.addVertex(s1);
    cfg.addVertex(s2);
    cfg.addVertex(s1);
    assertSame(s1, cfg.getStart());
    assertEquals(2, cfg.vertexCount());

    cfg.removeVertex(s1);
    assertNull(cfg.getStart());
  }

  @Test
  public void testIdentityVertices() {
    // Structurally equal statements are distinct vertices
    Statement s1 = b.createAssignment("a", b.createLiteral(1));
    Statement s2 = b.createAssignment("a", b.createLiteral(1));
    CFG cfg = new CFG();
    cfg.addVertex(s1);
    cfg.addVertex(s2);
    cfg.addEdge(s1, s2);
    cfg.addEdge(s1, s2);
    assertEquals(2, cfg.vertexCount());
    assertEquals(1, cfg.edgeCount());
  }

  @Test
  public void testReachabilityOrder() {
    Statement s1 = b.createAssignment("a", b.createLiteral(1));
    Statement s2 = b.createAssignment("b", b.createLiteral(2));
    Statement s3 = b.createAssignment("c", b.createLiteral(3));
    CFG cfg = new CFG();
    cfg.addVertex(s1);
    cfg.addVertex(s3);
    cfg.addVertex(s2);
    cfg.addEdge(s1, s2);
    assertEquals(Arrays.asList(s1, s2),
        new ArrayList<Statement>(cfg.reachability().getReachable()));
    assertEquals(Arrays.asList(s3),
        new ArrayList<Statement>(cfg.reachability().getUnreachable()));
  }
}
