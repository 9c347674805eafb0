package exm.dec.ast;

public class Variable extends Expression {
  private final String name;

  public Variable(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }

  @Override
  public String toString() {
    return name;
  }
}
