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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.dec.common.lang.Value;
import exm.dec.common.util.SymbolTable;

/**
 * Ordered sequence of statements with its own scope.  The scope's parent
 * is fixed when the block is created; passes that visit a block always
 * use this scope, whatever table they were handed.
 */
public class Block extends Statement {
  private final List<Statement> statements;
  private final SymbolTable<String, Value> scope;

  public Block(SymbolTable<String, Value> parentScope,
               List<? extends Statement> statements) {
    this.scope = new SymbolTable<String, Value>(parentScope);
    this.statements = new ArrayList<Statement>(statements);
  }

  public Block(SymbolTable<String, Value> parentScope) {
    this(parentScope, Collections.<Statement>emptyList());
  }

  public void addStatement(Statement stmt) {
    statements.add(stmt);
  }

  public List<Statement> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  public SymbolTable<String, Value> getScope() {
    return scope;
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  /**
   * Remove local bindings from this block and all nested blocks so
   * another pass can run over the same tree.
   */
  public void clearScopes() {
    scope.clear();
    for (Statement stmt: statements) {
      if (stmt instanceof Block) {
        ((Block)stmt).clearScopes();
      }
    }
  }

  @Override
  public <P, R> R accept(ASTVisitor<P, R> visitor, P param) {
    return visitor.visit(this, param);
  }

  @Override
  public String toString() {
    return "{" + statements.size() + " statements}";
  }
}
