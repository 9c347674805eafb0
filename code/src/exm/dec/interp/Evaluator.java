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
package exm.dec.interp;

import org.apache.log4j.Logger;

import exm.dec.ast.ASTVisitor;
import exm.dec.ast.Assignment;
import exm.dec.ast.BinaryOperator;
import exm.dec.ast.Block;
import exm.dec.ast.Exponentiation;
import exm.dec.ast.Expression;
import exm.dec.ast.FloatDiv;
import exm.dec.ast.IntDiv;
import exm.dec.ast.Literal;
import exm.dec.ast.Minus;
import exm.dec.ast.Modulus;
import exm.dec.ast.Plus;
import exm.dec.ast.Return;
import exm.dec.ast.Statement;
import exm.dec.ast.Times;
import exm.dec.ast.Variable;
import exm.dec.common.Logging;
import exm.dec.common.Settings;
import exm.dec.common.exceptions.EvaluationException;
import exm.dec.common.exceptions.InvalidOperationException;
import exm.dec.common.exceptions.InvalidOptionException;
import exm.dec.common.exceptions.UndefinedVariableException;
import exm.dec.common.lang.OpEvaluator;
import exm.dec.common.lang.Operators.IntDivMode;
import exm.dec.common.lang.Value;
import exm.dec.common.util.SymbolTable;

/**
 * Tree-walking interpreter for DEC.
 *
 * Assignments bind values in the scope of the enclosing block.  A block's
 * value is the value of its return statement if one executes (also one in
 * a nested block), otherwise that of its last statement, or
 * {@link Value#NONE} if it is empty.
 *
 * Use {@link #evaluate(Statement, SymbolTable)} or
 * {@link #evaluate(Expression, SymbolTable)}: the visit methods report
 * errors with an unchecked wrapper that only the entry points unwrap.
 */
public class Evaluator
        implements ASTVisitor<SymbolTable<String, Value>, Value> {

  private final Logger logger = Logging.getDECLogger();

  private final IntDivMode intDivMode;

  /** Set once a return statement has executed */
  private boolean returned = false;

  public Evaluator() throws InvalidOptionException {
    this(Settings.getIntDivMode());
  }

  public Evaluator(IntDivMode intDivMode) {
    this.intDivMode = intDivMode;
  }

  public Value evaluate(Statement node, SymbolTable<String, Value> scope)
      throws EvaluationException {
    returned = false;
    try {
      return node.accept(this, scope);
    } catch (EvaluationFailure e) {
      throw e.getCause();
    }
  }

  public Value evaluate(Expression node, SymbolTable<String, Value> scope)
      throws EvaluationException {
    returned = false;
    try {
      return node.accept(this, scope);
    } catch (EvaluationFailure e) {
      throw e.getCause();
    }
  }

  /**
   * @return true if the last evaluation executed a return statement
   */
  public boolean hasReturned() {
    return returned;
  }

  @Override
  public Value visit(Plus node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Value visit(Minus node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Value visit(Times node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Value visit(FloatDiv node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Value visit(IntDiv node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Value visit(Modulus node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Value visit(Exponentiation node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  private Value binary(BinaryOperator node,
                       SymbolTable<String, Value> scope) {
    if (node.getLeft() == null || node.getRight() == null) {
      throw new EvaluationFailure(new InvalidOperationException(
          node.getOp().name(), "operand missing for " + node.getOp().symbol()));
    }
    Value left = node.getLeft().accept(this, scope);
    Value right = node.getRight().accept(this, scope);
    try {
      Value result = OpEvaluator.eval(node.getOp(), left, right, intDivMode);
      if (logger.isTraceEnabled()) {
        logger.trace(left + " " + node.getOp().symbol() + " " + right
                   + " => " + result);
      }
      return result;
    } catch (EvaluationException e) {
      throw new EvaluationFailure(e);
    }
  }

  @Override
  public Value visit(Literal node, SymbolTable<String, Value> scope) {
    if (node.getValue() == null) {
      throw new EvaluationFailure(new InvalidOperationException(
                      "Literal", "literal has no value"));
    }
    return node.getValue();
  }

  @Override
  public Value visit(Variable node, SymbolTable<String, Value> scope) {
    String name = node.getName();
    if (scope == null || !scope.contains(name)) {
      throw new EvaluationFailure(UndefinedVariableException.undefined(name));
    }
    Value val = scope.lookup(name);
    if (val == null || val.isNone()) {
      // Declared by name resolution but not yet assigned
      throw new EvaluationFailure(UndefinedVariableException.unassigned(name));
    }
    return val;
  }

  @Override
  public Value visit(Assignment node, SymbolTable<String, Value> scope) {
    String name = node.getTarget().getName();
    if (scope == null) {
      throw new EvaluationFailure(new InvalidOperationException(
          "Assignment", "no scope to assign " + name + " in"));
    }
    Value val = node.getValue().accept(this, scope);
    scope.declare(name, val);
    logger.trace(name + " := " + val);
    return val;
  }

  @Override
  public Value visit(Return node, SymbolTable<String, Value> scope) {
    Value val = node.getValue().accept(this, scope);
    returned = true;
    return val;
  }

  @Override
  public Value visit(Block node, SymbolTable<String, Value> scope) {
    SymbolTable<String, Value> blockScope = node.getScope();
    Value result = Value.NONE;
    for (Statement stmt: node.getStatements()) {
      result = stmt.accept(this, blockScope);
      if (returned) {
        break;
      }
    }
    return result;
  }

  /**
   * Carries a checked evaluation error out through the visitor methods
   */
  private static class EvaluationFailure extends RuntimeException {
    private static final long serialVersionUID = 1L;

    EvaluationFailure(EvaluationException cause) {
      super(cause);
    }

    @Override
    public synchronized EvaluationException getCause() {
      return (EvaluationException)super.getCause();
    }
  }
}
