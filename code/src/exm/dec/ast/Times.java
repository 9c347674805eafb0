package exm.dec.ast;

import exm.dec.common.lang.Operators.BinaryOp;

public class Times extends BinaryOperator {

  public Times(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public BinaryOp getOp() {
    return BinaryOp.TIMES;
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }
}
