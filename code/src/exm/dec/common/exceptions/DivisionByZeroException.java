package exm.dec.common.exceptions;

import exm.dec.common.lang.Operators.BinaryOp;

public class DivisionByZeroException extends EvaluationException {

  private static final long serialVersionUID = 1L;

  private final BinaryOp op;

  public DivisionByZeroException(BinaryOp op) {
    super("division by zero in operator " + op.symbol());
    this.op = op;
  }

  /**
   * @return the operator whose divisor was zero
   */
  public BinaryOp getOp() {
    return op;
  }
}
