package exm.dec.common.exceptions;

/**
 * This represents an internal error.
 * These always indicate a bug (or missing feature).
 * */
public class DECRuntimeError extends RuntimeException
{
  public DECRuntimeError(String msg)
  {
    super(msg);
  }

  public DECRuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
