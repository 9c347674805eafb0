package exm.dec.opt;

import exm.dec.ast.Statement;
import exm.dec.common.util.DiGraph;
import exm.dec.common.util.Reachability;

/**
 * Control flow graph over statements.  An edge means the destination
 * executes directly after the source.  The first statement added is the
 * entry point.
 */
public class CFG extends DiGraph<Statement> {

  private Statement start = null;

  @Override
  public boolean addVertex(Statement vertex) {
    boolean added = super.addVertex(vertex);
    if (start == null) {
      start = vertex;
    }
    return added;
  }

  @Override
  public boolean removeVertex(Statement vertex) {
    boolean removed = super.removeVertex(vertex);
    if (removed && vertex == start) {
      start = null;
    }
    return removed;
  }

  /**
   * @return entry statement, or null if the graph is empty
   */
  public Statement getStart() {
    return start;
  }

  /**
   * Split statements into those reachable from the entry and dead code.
   */
  public Reachability<Statement> reachability() {
    return breadthFirstSearch(start);
  }
}
