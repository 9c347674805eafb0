package exm.dec.ast;

/**
 * <code>target := value</code>.  Declares target in the enclosing block.
 */
public class Assignment extends Statement {
  private final Variable target;
  private final Expression value;

  public Assignment(Variable target, Expression value) {
    this.target = target;
    this.value = value;
  }

  public Variable getTarget() {
    return target;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }

  @Override
  public String toString() {
    return target + " := " + value;
  }
}
