package exm.dec.common.exceptions;

/**
 * A configuration property was missing or had an invalid value
 */
public class InvalidOptionException extends Exception {

  private static final long serialVersionUID = 1L;

  public InvalidOptionException(String message) {
    super(message);
  }
}
