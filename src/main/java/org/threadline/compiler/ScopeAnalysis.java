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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.threadline.ast.Stmt;

/**
 * The result of running {@link LivenessAnalysis} on a function: one {@link NameScope} for each
 * scope node in the function's tree (including the function itself).
 *
 * <p>NameScopes are stored in the order they were created (a preorder walk of the tree) and refer
 * to their father and parent by index, so the scope chain is a tree rather than a web of
 * references. A completed ScopeAnalysis is immutable and may be shared between threads.
 */
public final class ScopeAnalysis {

  public final Stmt.FunctionDef root;

  /** Receives diagnostics from {@link NameScope#variadicLengthVars}. */
  final Diagnostics diagnostics;

  private final List<NameScope> scopes = new ArrayList<>();

  private final Map<Stmt, NameScope> byNode = new IdentityHashMap<>();

  /** Set when the analysis has completed; NameScopes are read-only after this. */
  private volatile boolean frozen;

  ScopeAnalysis(Stmt.FunctionDef root, Diagnostics diagnostics) {
    this.root = root;
    this.diagnostics = diagnostics;
  }

  /**
   * Creates and returns the NameScope for the given node.
   *
   * @param parentIndex the index of the immediately enclosing scope, or -1 for the root
   * @param fatherIndex the index of the nearest enclosing function scope, or -1 for the root
   */
  NameScope newScope(Stmt node, int parentIndex, int fatherIndex) {
    Preconditions.checkState(!frozen);
    if (byNode.containsKey(node)) {
      throw AnalysisError.error(node, "Node appears more than once in the tree");
    }
    NameScope scope = new NameScope(this, scopes.size(), node, parentIndex, fatherIndex);
    scopes.add(scope);
    byNode.put(node, scope);
    return scope;
  }

  void freeze() {
    frozen = true;
  }

  boolean isFrozen() {
    return frozen;
  }

  /** Returns the NameScope at the given index. */
  public NameScope get(int index) {
    return scopes.get(index);
  }

  /** Returns the number of scopes. */
  public int size() {
    return scopes.size();
  }

  /** Returns all of the scopes, in preorder. */
  public ImmutableList<NameScope> scopes() {
    return ImmutableList.copyOf(scopes);
  }

  /** Returns the NameScope of {@link #root}. */
  public NameScope rootScope() {
    return scopes.get(0);
  }

  /**
   * Returns the NameScope for the given function definition, if, while, or for node.
   *
   * @throws IllegalArgumentException if the node is not a scope node in this analysis' tree
   */
  public NameScope scopeOf(Stmt node) {
    NameScope result = byNode.get(node);
    Preconditions.checkArgument(result != null, "Not a scope node of this analysis: %s", node);
    return result;
  }
}
