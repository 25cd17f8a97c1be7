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
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.threadline.ast.Context;
import org.threadline.ast.Expr;
import org.threadline.ast.FunctionRole;
import org.threadline.ast.NodeKind;
import org.threadline.ast.Nodes;
import org.threadline.ast.QualifiedNames;
import org.threadline.ast.Stmt;

/**
 * Builds the getter and setter that a lowered branch or loop uses to read and write the variables
 * it shares with its enclosing function. For names {@code [a, b.c]} the result is
 *
 * <pre>
 *   def get_args_0():
 *       nonlocal a
 *       return a, b.c
 *
 *   def set_args_0(__args):
 *       nonlocal a
 *       a, b.c = __args
 * </pre>
 *
 * Both functions are built from the same list in a single call, so their tuple positions always
 * agree. Qualified names are left out of the {@code nonlocal} declaration, since they aren't
 * variables; they are rebuilt as attribute or subscript expressions instead.
 */
public final class AccessorSynthesizer {

  /** The name of the setter's single parameter. */
  public static final String ARGS_NAME = "__args";

  static final String GETTER_PREFIX = "get_args";
  static final String SETTER_PREFIX = "set_args";

  private final UniqueNames uniqueNames;

  public AccessorSynthesizer(UniqueNames uniqueNames) {
    this.uniqueNames = uniqueNames;
  }

  /** Uses the process-wide {@link UniqueNames#GLOBAL} generator. */
  public AccessorSynthesizer() {
    this(UniqueNames.GLOBAL);
  }

  /**
   * Returns a getter and setter for the given names, which must be distinct valid variable names
   * (simple or qualified) that {@link QualifiedNames#toExpression} can read.
   *
   * @throws AnalysisError if any name is invalid or repeated
   */
  public Accessors synthesize(List<String> names) {
    return synthesize(names, ImmutableMap.of());
  }

  /**
   * Returns a getter and setter for the given names, rebuilding each qualified name from its entry
   * in {@code targets} if there is one (typically {@link NameScope#qualifiedTargets}) and from its
   * text otherwise. The target expressions are copied, never shared.
   *
   * @throws AnalysisError if any name is repeated, or has no target and can't be read
   */
  public Accessors synthesize(List<String> names, Map<String, ? extends Expr> targets) {
    ImmutableMap<String, Expr> templates = resolve(names, targets);
    ImmutableList<String> ordered = templates.keySet().asList();
    ImmutableList<String> simple =
        ordered.stream()
            .filter(QualifiedNames::isSimpleName)
            .collect(ImmutableList.toImmutableList());
    Optional<Stmt.Declaration> nonlocal =
        simple.isEmpty() ? Optional.empty() : Optional.of(Nodes.nonlocal(simple));

    ImmutableList.Builder<Stmt> getterBody = ImmutableList.builder();
    nonlocal.ifPresent(getterBody::add);
    getterBody.add(
        Nodes.returnStmt(ordered.isEmpty() ? null : tuple(templates.values(), Context.LOAD)));
    Stmt.FunctionDef getter =
        Nodes.functionDef(
            uniqueNames.generate(GETTER_PREFIX),
            Stmt.Arguments.NONE,
            getterBody.build(),
            FunctionRole.ORDINARY);

    ImmutableList.Builder<Stmt> setterBody = ImmutableList.builder();
    if (ordered.isEmpty()) {
      setterBody.add(Nodes.pass());
    } else {
      // Each function gets its own copy of the declaration; nodes are never shared between trees.
      if (!simple.isEmpty()) {
        setterBody.add(Nodes.nonlocal(simple));
      }
      setterBody.add(
          Nodes.assign(tuple(templates.values(), Context.STORE), Nodes.name(ARGS_NAME)));
    }
    Stmt.FunctionDef setter =
        Nodes.functionDef(
            uniqueNames.generate(SETTER_PREFIX),
            new Stmt.Arguments(ImmutableList.of(ARGS_NAME), null, null, ImmutableList.of()),
            setterBody.build(),
            FunctionRole.ORDINARY);
    return new Accessors(ordered, getter, setter, nonlocal);
  }

  /** Returns a tuple of fresh copies of {@code templates}, each with context {@code ctx}. */
  private static Expr.Tuple tuple(Collection<Expr> templates, Context ctx) {
    ImmutableList<Expr> elts =
        templates.stream().map(t -> Nodes.copy(t, ctx)).collect(ImmutableList.toImmutableList());
    return new Expr.Tuple(elts, ctx);
  }

  /**
   * Returns an expression for each name, in order: the name's target if it is qualified and has
   * one, otherwise the expression read from its text.
   */
  private static ImmutableMap<String, Expr> resolve(
      List<String> names, Map<String, ? extends Expr> targets) {
    Map<String, Expr> result = new LinkedHashMap<>();
    for (String name : names) {
      if (result.containsKey(name)) {
        throw AnalysisError.error(null, "Duplicate name '%s' in accessor list", name);
      }
      Expr target = QualifiedNames.isSimpleName(name) ? null : targets.get(name);
      if (target == null) {
        target = QualifiedNames.parse(name, Context.LOAD);
      } else if (!isTargetKind(target.kind())) {
        throw AnalysisError.error(target, "'%s' is not an attribute or subscript", name);
      }
      if (target == null) {
        throw AnalysisError.error(null, "'%s' is not a valid variable name", name);
      }
      result.put(name, target);
    }
    return ImmutableMap.copyOf(result);
  }

  private static boolean isTargetKind(NodeKind kind) {
    return kind == NodeKind.ATTRIBUTE || kind == NodeKind.SUBSCRIPT;
  }
}
