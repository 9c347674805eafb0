/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.dec.common.lang;

import java.util.HashMap;
import java.util.Map;

/**
 * This class serves to define details of the builtin binary operators in DEC
 */
public class Operators {

  /**
   * Binary arithmetic operators.  <code>/</code> is floating division
   * and <code>//</code> is integral division.
   */
  public static enum BinaryOp {
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    FLOAT_DIV("/"),
    INT_DIV("//"),
    MODULUS("%"),
    EXPONENTIATION("**");

    private final String symbol;

    private BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    /**
     * @return the source lexeme for the operator
     */
    public String symbol() {
      return symbol;
    }

    /**
     * @return true if a zero right operand is an error
     */
    public boolean divides() {
      return this == FLOAT_DIV || this == INT_DIV || this == MODULUS;
    }
  }

  /**
   * Rounding behaviour for integral division and remainder
   */
  public static enum IntDivMode {
    /** Round quotient toward zero; remainder has sign of dividend */
    TRUNCATE,
    /** Round quotient toward negative infinity; remainder has sign of divisor */
    FLOOR;

    public static IntDivMode fromString(String s) {
      return IntDivMode.valueOf(s.trim().toUpperCase());
    }
  }

  /** Map of lexeme -> operator */
  private static final Map<String, BinaryOp> bySymbol =
                                  new HashMap<String, BinaryOp>();

  static {
    for (BinaryOp op: BinaryOp.values()) {
      bySymbol.put(op.symbol(), op);
    }
  }

  /**
   * @param symbol
   * @return operator for the lexeme, or null if not an operator
   */
  public static BinaryOp fromSymbol(String symbol) {
    return bySymbol.get(symbol);
  }
}
