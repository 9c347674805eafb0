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

import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.dec.common.Logging;
import exm.dec.common.Settings;
import exm.dec.common.exceptions.InvalidNodeException;
import exm.dec.common.lang.Operators.BinaryOp;
import exm.dec.common.lang.Value;
import exm.dec.common.util.SymbolTable;

/**
 * Factory for syntax tree nodes.  Every method checks that the parts of
 * the node are present and throws {@link InvalidNodeException} otherwise.
 * If {@link Settings#BUILDER_TRACE} is set, each node is logged as it is
 * created.
 */
public class NodeBuilder {

  private final Logger logger = Logging.getDECLogger();

  private final boolean trace;

  public NodeBuilder() {
    this(Settings.flag(Settings.BUILDER_TRACE));
  }

  public NodeBuilder(boolean trace) {
    this.trace = trace;
  }

  public Plus createPlus(Expression left, Expression right) {
    checkOperands("Plus", left, right);
    return created(new Plus(left, right));
  }

  public Minus createMinus(Expression left, Expression right) {
    checkOperands("Minus", left, right);
    return created(new Minus(left, right));
  }

  public Times createTimes(Expression left, Expression right) {
    checkOperands("Times", left, right);
    return created(new Times(left, right));
  }

  public FloatDiv createFloatDiv(Expression left, Expression right) {
    checkOperands("FloatDiv", left, right);
    return created(new FloatDiv(left, right));
  }

  public IntDiv createIntDiv(Expression left, Expression right) {
    checkOperands("IntDiv", left, right);
    return created(new IntDiv(left, right));
  }

  public Modulus createModulus(Expression left, Expression right) {
    checkOperands("Modulus", left, right);
    return created(new Modulus(left, right));
  }

  public Exponentiation createExponentiation(Expression left,
                                             Expression right) {
    checkOperands("Exponentiation", left, right);
    return created(new Exponentiation(left, right));
  }

  /**
   * Create the node for an operator chosen at runtime, e.g. by a parser
   */
  public BinaryOperator createBinary(BinaryOp op, Expression left,
                                     Expression right) {
    if (op == null) {
      throw InvalidNodeException.missing("binary operator", "operator");
    }
    switch (op) {
      case PLUS:
        return createPlus(left, right);
      case MINUS:
        return createMinus(left, right);
      case TIMES:
        return createTimes(left, right);
      case FLOAT_DIV:
        return createFloatDiv(left, right);
      case INT_DIV:
        return createIntDiv(left, right);
      case MODULUS:
        return createModulus(left, right);
      case EXPONENTIATION:
        return createExponentiation(left, right);
      default:
        throw new InvalidNodeException("unknown operator " + op);
    }
  }

  public Literal createLiteral(long value) {
    return createLiteral(Value.createInt(value));
  }

  public Literal createLiteral(double value) {
    return createLiteral(Value.createFloat(value));
  }

  public Literal createLiteral(Value value) {
    if (value == null) {
      throw InvalidNodeException.missing("Literal", "value");
    }
    if (value.isNone()) {
      throw new InvalidNodeException("cannot create Literal: "
                                   + "value must be numeric");
    }
    return created(new Literal(value));
  }

  public Variable createVariable(String name) {
    if (StringUtils.isEmpty(name)) {
      throw InvalidNodeException.missing("Variable", "name");
    }
    return created(new Variable(name));
  }

  public Assignment createAssignment(Variable target, Expression value) {
    if (target == null) {
      throw InvalidNodeException.missing("Assignment", "target");
    }
    if (value == null) {
      throw InvalidNodeException.missing("Assignment", "value");
    }
    return created(new Assignment(target, value));
  }

  public Assignment createAssignment(String target, Expression value) {
    return createAssignment(createVariable(target), value);
  }

  public Return createReturn(Expression value) {
    if (value == null) {
      throw InvalidNodeException.missing("Return", "value");
    }
    return created(new Return(value));
  }

  /**
   * Create a top-level block with no enclosing scope
   */
  public Block createBlock(Statement... statements) {
    return createBlock(null, Arrays.asList(statements));
  }

  public Block createBlock(List<? extends Statement> statements) {
    return createBlock(null, statements);
  }

  /**
   * @param parentScope scope of the enclosing block, or null for the
   *              outermost block
   */
  public Block createBlock(SymbolTable<String, Value> parentScope,
                           List<? extends Statement> statements) {
    if (statements == null) {
      throw InvalidNodeException.missing("Block", "statement list");
    }
    for (int i = 0; i < statements.size(); i++) {
      if (statements.get(i) == null) {
        throw InvalidNodeException.missing("Block", "statement " + i);
      }
    }
    return created(new Block(parentScope, statements));
  }

  /**
   * Create an empty block, to be filled with
   * {@link Block#addStatement(Statement)}.  Use the enclosing block's
   * scope as parentScope so that names resolve through it.
   */
  public Block createEmptyBlock(SymbolTable<String, Value> parentScope) {
    return created(new Block(parentScope));
  }

  private void checkOperands(String kind, Expression left, Expression right) {
    if (left == null) {
      throw InvalidNodeException.missing(kind, "left operand");
    }
    if (right == null) {
      throw InvalidNodeException.missing(kind, "right operand");
    }
  }

  private <T> T created(T node) {
    if (trace && logger.isDebugEnabled()) {
      logger.debug("created " + node.getClass().getSimpleName() + ": " + node);
    }
    return node;
  }
}
