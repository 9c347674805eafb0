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

import exm.dec.common.exceptions.DivisionByZeroException;
import exm.dec.common.exceptions.EvaluationException;
import exm.dec.common.exceptions.InvalidOperationException;
import exm.dec.common.lang.Operators.BinaryOp;
import exm.dec.common.lang.Operators.IntDivMode;

/**
 * Evaluation of binary arithmetic ops on runtime values.
 *
 * Promotion: if either operand is a float the op is done in floating
 * point, otherwise on integers.  Exponentiation always gives a float and
 * integral division always gives an integer.
 */
public class OpEvaluator {

  /** 2^63: doubles with magnitude at least this don't fit in a long */
  private static final double LONG_RANGE = 9.223372036854775807E18;

  /**
   * @param op
   * @param left
   * @param right
   * @param mode rounding used for integral division and remainder
   * @return result of op
   * @throws DivisionByZeroException if op divides and right is zero
   * @throws InvalidOperationException if an operand is not numeric
   */
  public static Value eval(BinaryOp op, Value left, Value right,
                           IntDivMode mode) throws EvaluationException {
    checkOperand(op, left, "left");
    checkOperand(op, right, "right");

    if (op.divides() && right.isZero()) {
      throw new DivisionByZeroException(op);
    }

    switch (op) {
      case EXPONENTIATION:
        return Value.createFloat(Math.pow(left.asDouble(), right.asDouble()));
      case FLOAT_DIV:
        return Value.createFloat(left.asDouble() / right.asDouble());
      case INT_DIV:
        if (left.isInt() && right.isInt()) {
          return Value.createInt(intDiv(left.getInt(), right.getInt(), mode));
        } else {
          double quotient = left.asDouble() / right.asDouble();
          // NaN fails both comparisons
          if (!(quotient > -LONG_RANGE && quotient < LONG_RANGE)) {
            throw new InvalidOperationException(op.name(),
                  "quotient " + quotient + " has no integral value");
          }
          return Value.createInt(roundQuotient(quotient, mode));
        }
      default:
        if (left.isInt() && right.isInt()) {
          return evalIntOp(op, left.getInt(), right.getInt(), mode);
        } else {
          return evalFloatOp(op, left.asDouble(), right.asDouble(), mode);
        }
    }
  }

  private static void checkOperand(BinaryOp op, Value v, String side)
      throws InvalidOperationException {
    if (v == null) {
      throw new InvalidOperationException(op.name(),
                                          side + " operand missing");
    } else if (v.isNone()) {
      throw new InvalidOperationException(op.name(),
                            side + " operand has no numeric value");
    }
  }

  private static Value evalIntOp(BinaryOp op, long arg1, long arg2,
                                 IntDivMode mode)
      throws InvalidOperationException {
    switch (op) {
      case PLUS:
        return Value.createInt(arg1 + arg2);
      case MINUS:
        return Value.createInt(arg1 - arg2);
      case TIMES:
        return Value.createInt(arg1 * arg2);
      case MODULUS:
        if (mode == IntDivMode.FLOOR) {
          return Value.createInt(Math.floorMod(arg1, arg2));
        } else {
          return Value.createInt(arg1 % arg2);
        }
      default:
        throw new InvalidOperationException(op.name(),
                                  "not an integer operator");
    }
  }

  private static Value evalFloatOp(BinaryOp op, double arg1, double arg2,
                                   IntDivMode mode)
      throws InvalidOperationException {
    switch (op) {
      case PLUS:
        return Value.createFloat(arg1 + arg2);
      case MINUS:
        return Value.createFloat(arg1 - arg2);
      case TIMES:
        return Value.createFloat(arg1 * arg2);
      case MODULUS:
        if (mode == IntDivMode.FLOOR) {
          return Value.createFloat(arg1 - Math.floor(arg1 / arg2) * arg2);
        } else {
          return Value.createFloat(arg1 % arg2);
        }
      default:
        throw new InvalidOperationException(op.name(),
                                  "not a float operator");
    }
  }

  private static long intDiv(long arg1, long arg2, IntDivMode mode) {
    if (mode == IntDivMode.FLOOR) {
      return Math.floorDiv(arg1, arg2);
    } else {
      return arg1 / arg2;
    }
  }

  private static long roundQuotient(double quotient, IntDivMode mode) {
    if (mode == IntDivMode.FLOOR) {
      return (long) Math.floor(quotient);
    } else {
      // Cast truncates toward zero
      return (long) quotient;
    }
  }
}
