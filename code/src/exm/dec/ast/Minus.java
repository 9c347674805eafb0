package exm.dec.ast;

import exm.dec.common.lang.Operators.BinaryOp;

public class Minus extends BinaryOperator {

  public Minus(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public BinaryOp getOp() {
    return BinaryOp.MINUS;
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }
}
