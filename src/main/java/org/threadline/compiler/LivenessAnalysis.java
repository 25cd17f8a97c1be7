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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadline.ast.AstVisitor;
import org.threadline.ast.Context;
import org.threadline.ast.Expr;
import org.threadline.ast.NodeKind;
import org.threadline.ast.QualifiedNames;
import org.threadline.ast.SourcePrinter;
import org.threadline.ast.Stmt;

/**
 * A single walk over a function's syntax tree that creates a {@link NameScope} for each scope node
 * and classifies every variable that is written, declared global or nonlocal, bound as a
 * parameter, or mutated with {@code append}/{@code pop}.
 *
 * <p>For example, after analyzing
 *
 * <pre>
 *   def func(*args, **kwargs):
 *       a = 12
 *       global i, j
 *       nonlocal x, y
 *       print(a)
 *       i = k
 *       b = []
 *       c = [1, 2, 3]
 *       for m in range(10):
 *           q = 12
 *           b.append(1)
 *           c.pop()
 * </pre>
 *
 * the NameScope for {@code func} has globals {i, j}, nonlocals {x, y}, args {args, kwargs},
 * written {a, b, c, i, m, q}, variadic-mutated {b, c}, and created {m, q} (the variables that first
 * exist because of the for loop).
 *
 * <p>Control-flow scopes (if, while, for) have the nearest enclosing function scope as their
 * father; when one completes, its sets are merged into both its immediate parent and that function
 * scope, and its {@code created} set is computed by comparing the function's {@link
 * NameScope#existedVars} before and after.
 */
public final class LivenessAnalysis extends AstVisitor<Void> {

  private static final Logger logger = LoggerFactory.getLogger(LivenessAnalysis.class);

  /** Calls to methods with these names are treated as changing the length of their receiver. */
  private static final ImmutableSet<String> VARIADIC_LENGTH_METHODS =
      ImmutableSet.of("append", "pop");

  /** Analyzes the given function, logging any diagnostics. */
  public static ScopeAnalysis analyze(Stmt root) {
    return analyze(root, Diagnostics.LOGGING);
  }

  /**
   * Analyzes the given function.
   *
   * @param root must be a function definition
   * @param diagnostics will receive any diagnostics produced when the result is queried
   * @throws AnalysisError if the tree is malformed
   */
  public static ScopeAnalysis analyze(Stmt root, Diagnostics diagnostics) {
    if (root.kind() != NodeKind.FUNCTION_DEF) {
      throw AnalysisError.error(root, "Scope analysis must start at a function definition");
    }
    Stmt.FunctionDef function = (Stmt.FunctionDef) root;
    ScopeAnalysis analysis = new ScopeAnalysis(function, diagnostics);
    new LivenessAnalysis(analysis).visit(function);
    analysis.freeze();
    logger.debug("Analyzed '{}': {} scopes", function.name, analysis.size());
    return analysis;
  }

  private final ScopeAnalysis analysis;

  /** The scopes of the scope nodes currently being visited, innermost first. */
  private final ArrayDeque<NameScope> open = new ArrayDeque<>();

  private LivenessAnalysis(ScopeAnalysis analysis) {
    this.analysis = analysis;
  }

  private NameScope current() {
    return open.peek();
  }

  /**
   * Creates a NameScope for the given node and makes it current. Its father is the nearest open
   * function scope; control-flow scopes are skipped.
   */
  private NameScope openScope(Stmt node) {
    NameScope enclosing = open.peek();
    int parentIndex = -1;
    int fatherIndex = -1;
    if (enclosing != null) {
      parentIndex = enclosing.index;
      fatherIndex =
          (enclosing.kind() == NodeKind.FUNCTION_DEF) ? enclosing.index : enclosing.fatherIndex;
    }
    NameScope scope = analysis.newScope(node, parentIndex, fatherIndex);
    open.push(scope);
    return scope;
  }

  private void closeScope(NameScope scope) {
    NameScope popped = open.pop();
    assert popped == scope;
  }

  /** Throws an AnalysisError unless {@code target} is something that can be assigned or deleted. */
  private void checkTarget(Expr target) {
    Context ctx;
    switch (target.kind()) {
      case NAME:
        ctx = ((Expr.Name) target).ctx;
        break;
      case ATTRIBUTE:
        ctx = ((Expr.Attribute) target).ctx;
        break;
      case SUBSCRIPT:
        ctx = ((Expr.Subscript) target).ctx;
        break;
      case TUPLE:
        ctx = ((Expr.Tuple) target).ctx;
        ((Expr.Tuple) target).elts.forEach(this::checkTarget);
        break;
      case LIST:
        ctx = ((Expr.ListExpr) target).ctx;
        ((Expr.ListExpr) target).elts.forEach(this::checkTarget);
        break;
      default:
        throw AnalysisError.error(target, "Cannot assign to '%s'", target);
    }
    if (!ctx.isWrite()) {
      throw AnalysisError.error(target, "Target '%s' is not in a store or delete context", target);
    }
  }

  // Scope nodes

  @Override
  protected Void visitFunctionDef(Stmt.FunctionDef node) {
    NameScope scope = openScope(node);
    scope.addArgs(node.params.allNames());
    visitChildren(node);
    closeScope(scope);
    // A lowered branch or loop body will be called from inside the enclosing scope's compiled
    // form, so whatever it writes is written there too.
    NameScope parent = scope.parent();
    if (parent != null && node.role.isControlFlowBody()) {
      parent.foldLoweredBody(scope);
    }
    return null;
  }

  @Override
  protected Void visitIf(Stmt.If node) {
    return visitControlFlow(node);
  }

  @Override
  protected Void visitWhile(Stmt.While node) {
    return visitControlFlow(node);
  }

  @Override
  protected Void visitFor(Stmt.For node) {
    checkTarget(node.target);
    return visitControlFlow(node);
  }

  private Void visitControlFlow(Stmt node) {
    NameScope scope = openScope(node);
    NameScope function = scope.father();
    // The root is always a function, so every control-flow scope has one.
    assert function != null;
    ImmutableSortedSet<String> before = function.existedVars();
    visitChildren(node);
    closeScope(scope);
    scope.parent().mergeFrom(scope);
    function.mergeFrom(scope);
    // Anything that exists now but didn't before must be pre-declared ahead of this node, since
    // after lowering it has to be bound on paths that skip the node entirely.
    ImmutableSortedSet<String> created =
        ImmutableSortedSet.copyOf(Sets.difference(function.existedVars(), before));
    scope.addCreated(created);
    function.addCreated(created);
    return null;
  }

  // Other statements

  @Override
  protected Void visitAssign(Stmt.Assign node) {
    node.targets.forEach(this::checkTarget);
    return visitChildren(node);
  }

  @Override
  protected Void visitAugAssign(Stmt.AugAssign node) {
    checkTarget(node.target);
    return visitChildren(node);
  }

  @Override
  protected Void visitDelete(Stmt.Delete node) {
    node.targets.forEach(this::checkTarget);
    return visitChildren(node);
  }

  @Override
  protected Void visitExprStmt(Stmt.ExprStmt node) {
    return visitChildren(node);
  }

  @Override
  protected Void visitReturn(Stmt.Return node) {
    return visitChildren(node);
  }

  @Override
  protected Void visitSimple(Stmt.Simple node) {
    return null;
  }

  @Override
  protected Void visitGlobal(Stmt.Declaration node) {
    checkDeclared(node);
    current().addGlobals(node.names);
    return null;
  }

  @Override
  protected Void visitNonlocal(Stmt.Declaration node) {
    checkDeclared(node);
    current().addNonlocals(node.names);
    return null;
  }

  /** Throws an AnalysisError if a global or nonlocal declaration names anything but variables. */
  private static void checkDeclared(Stmt.Declaration node) {
    for (String name : node.names) {
      if (!QualifiedNames.isIdentifier(name)) {
        throw AnalysisError.error(
            node, "'%s' cannot be declared %s", name, Ascii.toLowerCase(node.kind().name()));
      }
    }
  }

  // Expressions

  @Override
  protected Void visitName(Expr.Name node) {
    if (node.ctx.isWrite()) {
      current().addWritten(node.id);
    }
    return null;
  }

  @Override
  protected Void visitAttribute(Expr.Attribute node) {
    visitChildren(node);
    if (node.ctx.isWrite()) {
      current().addWritten(SourcePrinter.toSource(node), node);
    }
    return null;
  }

  @Override
  protected Void visitSubscript(Expr.Subscript node) {
    visitChildren(node);
    if (node.ctx.isWrite()) {
      // "a[i][j] = x" modifies the container a rather than the binding, but code that threads
      // variables still has to treat a as modified.
      Expr base = node.value;
      while (base.kind() == NodeKind.SUBSCRIPT) {
        base = ((Expr.Subscript) base).value;
      }
      if (base.kind() == NodeKind.NAME) {
        current().addWritten(((Expr.Name) base).id);
      }
    }
    return null;
  }

  @Override
  protected Void visitCall(Expr.Call node) {
    visitChildren(node);
    if (node.func.kind() == NodeKind.ATTRIBUTE) {
      Expr.Attribute method = (Expr.Attribute) node.func;
      if (VARIADIC_LENGTH_METHODS.contains(method.attr)) {
        current().addVariadicMutated(SourcePrinter.toSource(method.value));
      }
    }
    return null;
  }

  @Override
  protected Void visitComprehension(Expr.Comprehension node) {
    // The comprehension's variables are local to it, so nothing inside can affect this scope.
    return null;
  }

  @Override
  protected Void visitSlice(Expr.Slice node) {
    return visitChildren(node);
  }

  @Override
  protected Void visitKeyword(Expr.Keyword node) {
    return visitChildren(node);
  }

  @Override
  protected Void visitConstant(Expr.Constant node) {
    return null;
  }

  @Override
  protected Void visitTuple(Expr.Tuple node) {
    return visitChildren(node);
  }

  @Override
  protected Void visitList(Expr.ListExpr node) {
    return visitChildren(node);
  }

  @Override
  protected Void visitBinOp(Expr.BinOp node) {
    return visitChildren(node);
  }

  @Override
  protected Void visitUnaryOp(Expr.UnaryOp node) {
    return visitChildren(node);
  }
}
