package exm.dec.common.exceptions;

/**
 * A malformed node or operand reached the evaluator.  Should not happen
 * for trees that passed name resolution.
 */
public class InvalidOperationException extends EvaluationException {

  private static final long serialVersionUID = 1L;

  private final String operation;

  public InvalidOperationException(String operation, String message) {
    super(operation + ": " + message);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
