package exm.dec.ast;

/**
 * Base class for expression nodes
 */
public abstract class Expression {

  /**
   * Dispatch to the visit method for this node's variant
   */
  public abstract <P, R> R accept(ASTVisitor<P, R> visitor, P param);
}
