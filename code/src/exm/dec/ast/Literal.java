package exm.dec.ast;

import exm.dec.common.lang.Value;

/**
 * Numeric constant
 */
public class Literal extends Expression {
  private final Value value;

  public Literal(Value value) {
    this.value = value;
  }

  public Value getValue() {
    return value;
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
