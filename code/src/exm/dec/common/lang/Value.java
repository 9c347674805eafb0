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

import exm.dec.common.exceptions.DECRuntimeError;

/**
 * Runtime value produced by the evaluator: an integer, a float, or the
 * NONE sentinel.  Immutable, with value equality.
 */
public class Value {
  public static enum ValueKind {
    INT, FLOAT, NONE
  }

  /**
   * Result of an empty block.  Also bound by name resolution for names
   * that are declared but have no value yet.
   */
  public static final Value NONE = new Value(ValueKind.NONE, 0, 0.0);

  public final ValueKind kind;

  /** Storage for value, dependent on kind */
  private final long intval;
  private final double floatval;

  /**
   * Private constructor so that it can only be built using static builder
   * methods (below)
   */
  private Value(ValueKind kind, long intval, double floatval) {
    this.kind = kind;
    this.intval = intval;
    this.floatval = floatval;
  }

  public static Value createInt(long v) {
    return new Value(ValueKind.INT, v, 0.0);
  }

  public static Value createFloat(double v) {
    return new Value(ValueKind.FLOAT, 0, v);
  }

  public ValueKind getKind() {
    return kind;
  }

  public boolean isInt() {
    return kind == ValueKind.INT;
  }

  public boolean isFloat() {
    return kind == ValueKind.FLOAT;
  }

  public boolean isNone() {
    return kind == ValueKind.NONE;
  }

  public long getInt() {
    if (kind == ValueKind.INT) {
      return intval;
    } else {
      throw new DECRuntimeError("getInt for non-int value " + this);
    }
  }

  public double getFloat() {
    if (kind == ValueKind.FLOAT) {
      return floatval;
    } else {
      throw new DECRuntimeError("getFloat for non-float value " + this);
    }
  }

  /**
   * Numeric value widened to double
   */
  public double asDouble() {
    switch (kind) {
      case INT:
        return intval;
      case FLOAT:
        return floatval;
      default:
        throw new DECRuntimeError("No numeric value for " + kind);
    }
  }

  /**
   * @return true if this is numerically zero
   */
  public boolean isZero() {
    switch (kind) {
      case INT:
        return intval == 0;
      case FLOAT:
        return floatval == 0.0;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case INT:
        return Long.toString(intval);
      case FLOAT:
        return Double.toString(floatval);
      case NONE:
        return "<none>";
      default:
        throw new DECRuntimeError("Unknown value kind " + kind);
    }
  }

  /**
   * Define hashCode and equals so this can be compared in tests and
   * used as key in hash table
   */
  @Override
  public int hashCode() {
    int hash1;
    switch (kind) {
      case INT:
        hash1 = Long.valueOf(intval).hashCode();
        break;
      case FLOAT:
        hash1 = Double.valueOf(floatval).hashCode();
        break;
      default:
        hash1 = 0;
        break;
    }
    return kind.hashCode() ^ (hash1 * 31);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Value)) {
      return false;
    }
    Value other = (Value) obj;
    if (kind != other.kind) {
      return false;
    }
    switch (kind) {
      case INT:
        return intval == other.intval;
      case FLOAT:
        return Double.compare(floatval, other.floatval) == 0;
      default:
        return true;
    }
  }
}
