package exm.dec.ast;

public class Return extends Statement {
  private final Expression value;

  public Return(Expression value) {
    this.value = value;
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
    return "return " + value;
  }
}
