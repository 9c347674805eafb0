package exm.dec.ast;

/**
 * A pass over the DEC syntax tree.  There is one visit method per node
 * variant, so adding a variant forces every pass to handle it.
 *
 * @param <P> per-visit parameter threaded down the tree
 * @param <R> result of visiting a node
 */
public interface ASTVisitor<P, R> {
  public R visit(Plus node, P param);
  public R visit(Minus node, P param);
  public R visit(Times node, P param);
  public R visit(FloatDiv node, P param);
  public R visit(IntDiv node, P param);
  public R visit(Modulus node, P param);
  public R visit(Exponentiation node, P param);
  public R visit(Literal node, P param);
  public R visit(Variable node, P param);
  public R visit(Assignment node, P param);
  public R visit(Return node, P param);
  public R visit(Block node, P param);
}
