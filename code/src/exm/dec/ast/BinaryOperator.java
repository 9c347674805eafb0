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
package exm.dec.ast;

import exm.dec.common.lang.Operators.BinaryOp;

/**
 * Expression with two operands.  Subclasses only fix the operator so that
 * visitors can dispatch on it.
 */
public abstract class BinaryOperator extends Expression {
  private final Expression left;
  private final Expression right;

  protected BinaryOperator(Expression left, Expression right) {
    this.left = left;
    this.right = right;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  public abstract BinaryOp getOp();

  @Override
  public String toString() {
    return getOp().name() + "(" + left + ", " + right + ")";
  }
}
