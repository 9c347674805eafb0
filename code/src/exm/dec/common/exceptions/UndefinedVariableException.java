package exm.dec.common.exceptions;

public class UndefinedVariableException
extends EvaluationException
{
  private final String varName;

  public UndefinedVariableException(String varName, String msg)
  {
    super(msg);
    this.varName = varName;
  }

  public static UndefinedVariableException undefined(String varName) {
    return new UndefinedVariableException(varName,
                          "undefined variable: " + varName);
  }

  public static UndefinedVariableException unassigned(String varName) {
    return new UndefinedVariableException(varName,
              "variable declared but never assigned: " + varName);
  }

  public String getVarName() {
    return varName;
  }

  private static final long serialVersionUID = 1L;
}
