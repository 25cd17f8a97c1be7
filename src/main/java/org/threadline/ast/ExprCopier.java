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


package org.threadline.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Makes a deep copy of an expression, so that a piece of one tree can be reused in another without
 * sharing nodes. The outermost node of the copy gets the requested context; everything inside it
 * keeps its own.
 */
final class ExprCopier extends AstVisitor<Expr> {

  private final Expr root;
  private final Context ctx;

  private ExprCopier(Expr root, Context ctx) {
    this.root = root;
    this.ctx = ctx;
  }

  static Expr copy(Expr expr, Context ctx) {
    return new ExprCopier(expr, ctx).visit(expr);
  }

  /** Returns the context for a copy of {@code node}. */
  private Context contextFor(Expr node, Context original) {
    return (node == root) ? ctx : original;
  }

  private Expr copyOf(Expr expr) {
    return visit(expr);
  }

  private @Nullable Expr copyOrNull(@Nullable Expr expr) {
    return (expr == null) ? null : visit(expr);
  }

  private ImmutableList<Expr> copyAll(List<Expr> exprs) {
    return exprs.stream().map(this::copyOf).collect(ImmutableList.toImmutableList());
  }

  @Override
  protected Expr visitName(Expr.Name node) {
    return new Expr.Name(node.id, contextFor(node, node.ctx));
  }

  @Override
  protected Expr visitAttribute(Expr.Attribute node) {
    return new Expr.Attribute(copyOf(node.value), node.attr, contextFor(node, node.ctx));
  }

  @Override
  protected Expr visitSubscript(Expr.Subscript node) {
    return new Expr.Subscript(copyOf(node.value), copyOf(node.slice), contextFor(node, node.ctx));
  }

  @Override
  protected Expr visitSlice(Expr.Slice node) {
    return new Expr.Slice(copyOrNull(node.lower), copyOrNull(node.upper), copyOrNull(node.step));
  }

  @Override
  protected Expr visitCall(Expr.Call node) {
    ImmutableList<Expr.Keyword> keywords =
        node.keywords.stream()
            .map(k -> new Expr.Keyword(k.arg, copyOf(k.value)))
            .collect(ImmutableList.toImmutableList());
    return new Expr.Call(copyOf(node.func), copyAll(node.args), keywords);
  }

  @Override
  protected Expr visitConstant(Expr.Constant node) {
    return new Expr.Constant(node.value);
  }

  @Override
  protected Expr visitTuple(Expr.Tuple node) {
    return new Expr.Tuple(copyAll(node.elts), contextFor(node, node.ctx));
  }

  @Override
  protected Expr visitList(Expr.ListExpr node) {
    return new Expr.ListExpr(copyAll(node.elts), contextFor(node, node.ctx));
  }

  @Override
  protected Expr visitBinOp(Expr.BinOp node) {
    return new Expr.BinOp(copyOf(node.left), node.op, copyOf(node.right));
  }

  @Override
  protected Expr visitUnaryOp(Expr.UnaryOp node) {
    return new Expr.UnaryOp(node.op, copyOf(node.operand));
  }

  @Override
  protected Expr visitComprehension(Expr.Comprehension node) {
    ImmutableList.Builder<Expr.Comprehension.Clause> clauses = ImmutableList.builder();
    for (Expr.Comprehension.Clause c : node.clauses) {
      clauses.add(new Expr.Comprehension.Clause(copyOf(c.target), copyOf(c.iter), copyAll(c.ifs)));
    }
    return new Expr.Comprehension(
        node.comprehensionKind, copyOf(node.element), copyOrNull(node.value), clauses.build());
  }
}
