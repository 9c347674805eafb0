package exm.dec.ast;

import exm.dec.common.lang.Operators.BinaryOp;

public class IntDiv extends BinaryOperator {

  public IntDiv(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public BinaryOp getOp() {
    return BinaryOp.INT_DIV;
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }
}
