package exm.dec.ast;

import exm.dec.common.lang.Operators.BinaryOp;

public class Plus extends BinaryOperator {

  public Plus(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public BinaryOp getOp() {
    return BinaryOp.PLUS;
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }
}
