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
package exm.dec.opt;

import org.apache.log4j.Logger;

import exm.dec.ast.ASTVisitor;
import exm.dec.ast.Assignment;
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

/**
 * Build the control flow graph of a program.
 *
 * The parameter of each visit is the statement that executed just before
 * the node (null at the entry point) and the result is the statement that
 * will have executed last afterwards.  Expressions don't contribute to
 * the graph.  Statements after a return are still added to the graph, but
 * with no edges, so that they show up as unreachable.
 */
public class CFGBuilder implements ASTVisitor<Statement, Statement> {

  private final Logger logger = Logging.getDECLogger();

  private final CFG cfg;

  public CFGBuilder() {
    this(new CFG());
  }

  /**
   * @param cfg graph to add to
   */
  public CFGBuilder(CFG cfg) {
    this.cfg = cfg;
  }

  public CFG getCFG() {
    return cfg;
  }

  @Override
  public Statement visit(Plus node, Statement prev) {
    return null;
  }

  @Override
  public Statement visit(Minus node, Statement prev) {
    return null;
  }

  @Override
  public Statement visit(Times node, Statement prev) {
    return null;
  }

  @Override
  public Statement visit(FloatDiv node, Statement prev) {
    return null;
  }

  @Override
  public Statement visit(IntDiv node, Statement prev) {
    return null;
  }

  @Override
  public Statement visit(Modulus node, Statement prev) {
    return null;
  }

  @Override
  public Statement visit(Exponentiation node, Statement prev) {
    return null;
  }

  @Override
  public Statement visit(Literal node, Statement prev) {
    return null;
  }

  @Override
  public Statement visit(Variable node, Statement prev) {
    return null;
  }

  @Override
  public Statement visit(Assignment node, Statement prev) {
    return addStatement(node, prev);
  }

  @Override
  public Statement visit(Return node, Statement prev) {
    return addStatement(node, prev);
  }

  private Statement addStatement(Statement node, Statement prev) {
    cfg.addVertex(node);
    if (prev != null) {
      cfg.addEdge(prev, node);
    }
    return node;
  }

  @Override
  public Statement visit(Block node, Statement prev) {
    Statement curr = prev;
    for (Statement stmt: node.getStatements()) {
      if (curr instanceof Return) {
        addUnreachable(stmt);
      } else {
        curr = stmt.accept(this, curr);
      }
    }
    return curr;
  }

  /**
   * Add dead statement as vertex with no edges
   */
  private void addUnreachable(Statement stmt) {
    if (stmt instanceof Block) {
      for (Statement inner: ((Block)stmt).getStatements()) {
        addUnreachable(inner);
      }
    } else {
      if (logger.isDebugEnabled()) {
        logger.debug("Unreachable statement after return: " + stmt);
      }
      cfg.addVertex(stmt);
    }
  }
}
