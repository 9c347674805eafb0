package exm.dec.ast;

import exm.dec.common.lang.Operators.BinaryOp;

public class FloatDiv extends BinaryOperator {

  public FloatDiv(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public BinaryOp getOp() {
    return BinaryOp.FLOAT_DIV;
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }
}
