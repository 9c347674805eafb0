package exm.dec.ast;

import exm.dec.common.lang.Operators.BinaryOp;

public class Modulus extends BinaryOperator {

  public Modulus(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public BinaryOp getOp() {
    return BinaryOp.MODULUS;
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }
}
