/*
 * Copyright 2025 The Threadline Authors
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
 * limitations under the License.
 */

package org.threadline.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.threadline.ast.NodeKind;
import org.threadline.ast.Nodes;
import org.threadline.ast.Stmt;

/**
 * Binds each variable that a function's control flow creates to an {@code UndefinedVar} sentinel
 * at the top of the function, so that it is bound on every path once the branches and loops are
 * lowered into separate functions. For example
 *
 * <pre>
 *   def f(x):
 *       if x:
 *           y = 1
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   def f(x):
 *       y = UndefinedVar('y')
 *       if x:
 *           y = 1
 * </pre>
 */
public final class UndefinedVarDeclarer {

  /** The name of the sentinel constructor called by the inserted statements. */
  public static final String SENTINEL_CONSTRUCTOR = "UndefinedVar";

  private UndefinedVarDeclarer() {}

  /**
   * Inserts the declarations into every function definition in the analyzed tree (including nested
   * ones), in sorted order. Modifies the tree in place and returns the number of statements
   * inserted.
   */
  public static int declare(ScopeAnalysis analysis) {
    int count = 0;
    for (NameScope scope : analysis.scopes()) {
      if (scope.kind() != NodeKind.FUNCTION_DEF) {
        continue;
      }
      ImmutableSortedSet<String> created = scope.createdVars();
      if (created.isEmpty()) {
        continue;
      }
      Stmt.FunctionDef function = (Stmt.FunctionDef) scope.node;
      function.body.addAll(0, declarations(created));
      count += created.size();
    }
    return count;
  }

  /** Returns {@code name = UndefinedVar('name')} for each of the given names, in order. */
  static ImmutableList<Stmt> declarations(Iterable<String> names) {
    ImmutableList.Builder<Stmt> builder = ImmutableList.builder();
    for (String name : names) {
      builder.add(
          Nodes.assign(
              Nodes.store(name),
              Nodes.call(Nodes.name(SENTINEL_CONSTRUCTOR), Nodes.constant(name))));
    }
    return builder.build();
  }
}
