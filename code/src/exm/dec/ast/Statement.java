package exm.dec.ast;

/**
 * Base class for statement nodes.  Statements are vertices of the
 * control flow graph, so equality is identity.
 */
public abstract class Statement {

  public abstract <P, R> R accept(ASTVisitor<P, R> visitor, P param);
}
