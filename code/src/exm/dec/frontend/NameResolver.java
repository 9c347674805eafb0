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
package exm.dec.frontend;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.dec.ast.ASTVisitor;
import exm.dec.ast.Assignment;
import exm.dec.ast.BinaryOperator;
import exm.dec.ast.Block;
import exm.dec.ast.Exponentiation;
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
import exm.dec.common.lang.Value;
import exm.dec.common.util.SymbolTable;

/**
 * Checks that every variable is declared before it is read.
 *
 * An assignment declares its target in the enclosing block's scope even
 * when its right hand side is invalid, so one bad statement doesn't cause
 * follow-on errors.  Names are bound to {@link Value#NONE} until the
 * program is evaluated.  All statements are checked, so every undeclared
 * name is reported, not just the first.
 */
public class NameResolver
        implements ASTVisitor<SymbolTable<String, Value>, Boolean> {

  private final Logger logger = Logging.getDECLogger();

  /** Undeclared names seen, in order of first use */
  private final Set<String> undeclared = new LinkedHashSet<String>();

  public Set<String> getUndeclaredNames() {
    return Collections.unmodifiableSet(undeclared);
  }

  @Override
  public Boolean visit(Plus node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Boolean visit(Minus node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Boolean visit(Times node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Boolean visit(FloatDiv node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Boolean visit(IntDiv node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Boolean visit(Modulus node, SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  @Override
  public Boolean visit(Exponentiation node,
                       SymbolTable<String, Value> scope) {
    return binary(node, scope);
  }

  /**
   * Check both sides so all undeclared names are found
   */
  private Boolean binary(BinaryOperator node,
                         SymbolTable<String, Value> scope) {
    boolean leftOk = node.getLeft().accept(this, scope);
    boolean rightOk = node.getRight().accept(this, scope);
    return leftOk && rightOk;
  }

  @Override
  public Boolean visit(Literal node, SymbolTable<String, Value> scope) {
    return true;
  }

  @Override
  public Boolean visit(Variable node, SymbolTable<String, Value> scope) {
    String name = node.getName();
    if (scope != null && scope.contains(name)) {
      return true;
    }
    logger.debug("Variable " + name + " used before declaration");
    undeclared.add(name);
    return false;
  }

  @Override
  public Boolean visit(Assignment node, SymbolTable<String, Value> scope) {
    // Check initializer first: x := x is invalid without an outer x
    boolean ok = node.getValue().accept(this, scope);

    String name = node.getTarget().getName();
    if (scope == null) {
      // Statement outside any block: nowhere to keep the declaration
      logger.debug("No scope to declare " + name + " in");
      return ok;
    }
    if (scope.isShadowing(name)) {
      Logging.uniqueWarn("Declaration of " + name
                       + " shadows a variable in an enclosing block");
    }
    scope.declare(name, Value.NONE);
    return ok;
  }

  @Override
  public Boolean visit(Return node, SymbolTable<String, Value> scope) {
    return node.getValue().accept(this, scope);
  }

  @Override
  public Boolean visit(Block node, SymbolTable<String, Value> scope) {
    SymbolTable<String, Value> blockScope = node.getScope();
    boolean ok = true;
    for (Statement stmt: node.getStatements()) {
      // No short circuit: keep declaring names after an error
      if (!stmt.accept(this, blockScope)) {
        ok = false;
      }
    }
    if (logger.isTraceEnabled()) {
      logger.trace("Resolved block " + blockScope + ": " + ok);
    }
    return ok;
  }
}
