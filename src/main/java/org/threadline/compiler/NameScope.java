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
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.threadline.ast.Expr;
import org.threadline.ast.NodeKind;
import org.threadline.ast.QualifiedNames;
import org.threadline.ast.Stmt;

/**
 * A NameScope classifies the variable names that appear in one scope node (a function definition,
 * if, while, or for). There is exactly one NameScope per scope node, created by {@link
 * LivenessAnalysis}; all of a function's NameScopes live in a single {@link ScopeAnalysis}, and
 * refer to each other by index in it.
 *
 * <p>NameScopes are only modified while the analysis is running (including when the sets of a
 * nested scope are merged into an enclosing one); once the analysis completes they are read-only
 * and any attempt to modify them throws an IllegalStateException.
 *
 * <p>We don't track variables that are only read, since they don't affect which variables must be
 * threaded through lowered control flow.
 */
public final class NameScope {

  private final ScopeAnalysis analysis;

  /** This scope's index in {@link #analysis}. */
  final int index;

  /**
   * The index of the nearest enclosing function scope, or -1 if this is the root. Control-flow
   * scopes are never fathers.
   */
  final int fatherIndex;

  /** The index of the immediately enclosing scope (of any kind), or -1 if this is the root. */
  final int parentIndex;

  /** The node that introduced this scope. */
  public final Stmt node;

  private final TreeSet<String> globals = new TreeSet<>();
  private final TreeSet<String> nonlocals = new TreeSet<>();
  private final TreeSet<String> args = new TreeSet<>();

  /** All simple and qualified names that are assigned or deleted in this scope. */
  private final TreeSet<String> written = new TreeSet<>();

  /**
   * For each qualified name in {@link #written}, the first target expression it was printed from.
   * These belong to the analyzed tree and must be copied before being used elsewhere.
   */
  private final TreeMap<String, Expr> qualifiedTargets = new TreeMap<>();

  /**
   * For a control-flow scope, names that first exist in the enclosing function because of this
   * node. For a function scope, the union of those sets over all of its control-flow scopes.
   */
  private final TreeSet<String> created = new TreeSet<>();

  /**
   * Receivers of {@code append} or {@code pop} calls. These are not necessarily in {@link
   * #written}: {@code a.append(x)} changes the contents of {@code a}, not the binding.
   */
  private final TreeSet<String> variadicMutated = new TreeSet<>();

  NameScope(ScopeAnalysis analysis, int index, Stmt node, int parentIndex, int fatherIndex) {
    Preconditions.checkArgument(node.kind().isScope());
    this.analysis = analysis;
    this.index = index;
    this.node = node;
    this.parentIndex = parentIndex;
    this.fatherIndex = fatherIndex;
  }

  /** Returns the kind of node that introduced this scope. */
  public NodeKind kind() {
    return node.kind();
  }

  /** Returns the nearest enclosing function scope, or null if this is the root. */
  public @Nullable NameScope father() {
    return (fatherIndex < 0) ? null : analysis.get(fatherIndex);
  }

  /** Returns the immediately enclosing scope, or null if this is the root. */
  public @Nullable NameScope parent() {
    return (parentIndex < 0) ? null : analysis.get(parentIndex);
  }

  public ImmutableSortedSet<String> globals() {
    return ImmutableSortedSet.copyOf(globals);
  }

  public ImmutableSortedSet<String> nonlocals() {
    return ImmutableSortedSet.copyOf(nonlocals);
  }

  public ImmutableSortedSet<String> args() {
    return ImmutableSortedSet.copyOf(args);
  }

  /** All names (simple or qualified) assigned or deleted in this scope. */
  public ImmutableSortedSet<String> modifiedVars() {
    return ImmutableSortedSet.copyOf(written);
  }

  /**
   * Returns the target expression behind each qualified name in {@link #modifiedVars}, keyed by
   * that name. The expressions are nodes of the analyzed tree; copy them (e.g. with {@link
   * org.threadline.ast.Nodes#copy}) rather than reusing them in another tree.
   */
  public ImmutableSortedMap<String, Expr> qualifiedTargets() {
    return ImmutableSortedMap.copyOfSorted(qualifiedTargets);
  }

  public ImmutableSortedSet<String> createdVars() {
    return ImmutableSortedSet.copyOf(created);
  }

  /** The raw set of {@code append}/{@code pop} receivers, before any global names are removed. */
  public ImmutableSortedSet<String> variadicMutatedVars() {
    return ImmutableSortedSet.copyOf(variadicMutated);
  }

  /**
   * Returns the simple names that are genuinely local to this scope, i.e. written here but not
   * declared global or nonlocal and not a parameter.
   */
  public ImmutableSortedSet<String> existedVars() {
    ImmutableSortedSet.Builder<String> builder = ImmutableSortedSet.naturalOrder();
    for (String name : written) {
      if (QualifiedNames.isSimpleName(name)
          && !globals.contains(name)
          && !nonlocals.contains(name)
          && !args.contains(name)) {
        builder.add(name);
      }
    }
    return builder.build();
  }

  /**
   * Returns true if the given simple name refers to a variable in the global scope when used here.
   *
   * <p>Starting with this scope and continuing through its fathers, the first scope that declares
   * {@code name} global, declares it nonlocal, or writes it decides: global in the first case,
   * not global otherwise. A name that no scope mentions is global.
   *
   * @throws IllegalArgumentException if {@code name} is qualified
   */
  public boolean isGlobalVar(String name) {
    Preconditions.checkArgument(
        QualifiedNames.isSimpleName(name), "isGlobalVar requires a simple name, not '%s'", name);
    for (NameScope scope = this; scope != null; scope = scope.father()) {
      if (scope.globals.contains(name)) {
        return true;
      } else if (scope.nonlocals.contains(name) || scope.written.contains(name)) {
        return false;
      }
    }
    return true;
  }

  public boolean isLocalVar(String name) {
    return !isGlobalVar(name);
  }

  /**
   * Returns the variables whose containers are mutated with {@code append} or {@code pop} and can
   * be threaded through lowered control flow: {@link #variadicMutatedVars} minus any simple name
   * that {@link #isGlobalVar}. Each name that is dropped is reported to the analysis' {@link
   * Diagnostics} (once per call).
   */
  public ImmutableSortedSet<String> variadicLengthVars() {
    ImmutableSortedSet.Builder<String> builder = ImmutableSortedSet.naturalOrder();
    for (String name : variadicMutated) {
      if (QualifiedNames.isSimpleName(name) && isGlobalVar(name)) {
        analysis.diagnostics.report(Diagnostic.globalContainerMutation(name));
      } else {
        builder.add(name);
      }
    }
    return builder.build();
  }

  // Mutators; only called by LivenessAnalysis while the analysis is in progress.

  private void checkMutable() {
    Preconditions.checkState(!analysis.isFrozen(), "Scope analysis is complete");
  }

  void addGlobals(Collection<String> names) {
    checkMutable();
    globals.addAll(names);
  }

  void addNonlocals(Collection<String> names) {
    checkMutable();
    nonlocals.addAll(names);
  }

  void addArgs(Collection<String> names) {
    checkMutable();
    args.addAll(names);
  }

  void addWritten(String name) {
    checkMutable();
    written.add(name);
  }

  /** Records a write to an attribute target whose printed form is {@code name}. */
  void addWritten(String name, Expr target) {
    addWritten(name);
    qualifiedTargets.putIfAbsent(name, target);
  }

  private void addTargets(NameScope other) {
    other.qualifiedTargets.forEach(qualifiedTargets::putIfAbsent);
  }

  void addVariadicMutated(String name) {
    checkMutable();
    variadicMutated.add(name);
  }

  void addCreated(Collection<String> names) {
    checkMutable();
    created.addAll(names);
  }

  /**
   * Folds the effects of a lowered function body (its writes and container mutations) into this
   * scope.
   */
  void foldLoweredBody(NameScope body) {
    checkMutable();
    written.addAll(body.written);
    addTargets(body);
    variadicMutated.addAll(body.variadicMutated);
  }

  /**
   * Adds every classification of {@code other} except {@code created} to this scope. Used to make
   * the effects of a control-flow scope visible to the scopes that enclose it.
   */
  void mergeFrom(NameScope other) {
    checkMutable();
    globals.addAll(other.globals);
    nonlocals.addAll(other.nonlocals);
    args.addAll(other.args);
    written.addAll(other.written);
    addTargets(other);
    variadicMutated.addAll(other.variadicMutated);
  }

  @Override
  public String toString() {
    return String.format(
        "%s@%s{globals=%s, nonlocals=%s, args=%s, written=%s, created=%s, variadic=%s}",
        kind(), index, globals, nonlocals, args, written, created, variadicMutated);
  }
}
