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
package exm.dec;

import exm.dec.ast.Block;
import exm.dec.ast.Statement;
import exm.dec.common.exceptions.EvaluationException;
import exm.dec.common.exceptions.InvalidOptionException;
import exm.dec.common.lang.Value;
import exm.dec.common.util.SymbolTable;
import exm.dec.frontend.NameResolver;
import exm.dec.frontend.Unparser;
import exm.dec.interp.Evaluator;
import exm.dec.opt.CFG;
import exm.dec.opt.CFGBuilder;

/**
 * Entry points for running each pass over a program.  Each call uses a
 * fresh pass object.  Name resolution and evaluation write to the scopes
 * of the blocks they visit, so both clear the scopes under a block root
 * before starting.
 */
public class Passes {

  /**
   * @param root program or statement to check
   * @param scope scope to resolve in when root is not a block
   * @return true if every variable read is declared before use
   */
  public static boolean resolveNames(Statement root,
                                     SymbolTable<String, Value> scope) {
    resetScopes(root);
    if (scope == null) {
      scope = new SymbolTable<String, Value>();
    }
    return root.accept(new NameResolver(), scope);
  }

  /**
   * @return value of the program
   * @throws EvaluationException
   */
  public static Value evaluate(Statement root,
                               SymbolTable<String, Value> scope)
                                   throws EvaluationException {
    Evaluator evaluator;
    try {
      evaluator = new Evaluator();
    } catch (InvalidOptionException e) {
      throw new EvaluationException("Invalid setting: " + e.getMessage());
    }
    resetScopes(root);
    if (scope == null) {
      scope = new SymbolTable<String, Value>();
    }
    return evaluator.evaluate(root, scope);
  }

  /**
   * Drop bindings left in block scopes by an earlier run, so each run
   * sees the program as built.  Tables outside root are left alone.
   */
  private static void resetScopes(Statement root) {
    if (root instanceof Block) {
      ((Block)root).clearScopes();
    }
  }

  public static String unparse(Statement root, int level) {
    return root.accept(new Unparser(), level);
  }

  public static CFG buildCFG(Statement root) {
    CFGBuilder builder = new CFGBuilder();
    root.accept(builder, null);
    return builder.getCFG();
  }
}
