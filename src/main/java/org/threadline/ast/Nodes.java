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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Static factory methods for syntax tree nodes. Intended to be statically imported; the names
 * follow the source constructs they build (e.g. {@code assign(store("x"), constant(1))} for
 * {@code x = 1}).
 */
public final class Nodes {

  // Static methods only
  private Nodes() {}

  /** Sets the source line of {@code node} and returns it. */
  @CanIgnoreReturnValue
  public static <T extends Node> T atLine(int lineNum, T node) {
    node.setLineNum(lineNum);
    return node;
  }

  // Expressions

  /** A name being read. */
  public static Expr.Name name(String id) {
    return new Expr.Name(id, Context.LOAD);
  }

  /** A name being assigned. */
  public static Expr.Name store(String id) {
    return new Expr.Name(id, Context.STORE);
  }

  public static Expr.Name name(String id, Context ctx) {
    return new Expr.Name(id, ctx);
  }

  /** {@code value.attr}, read. */
  public static Expr.Attribute attr(Expr value, String attr) {
    return new Expr.Attribute(value, attr, Context.LOAD);
  }

  /** {@code value.attr}, in the given context. */
  public static Expr.Attribute attr(Expr value, String attr, Context ctx) {
    return new Expr.Attribute(value, attr, ctx);
  }

  /** {@code value[slice]}, read. */
  public static Expr.Subscript subscript(Expr value, Expr slice) {
    return new Expr.Subscript(value, slice, Context.LOAD);
  }

  /** {@code value[slice]}, in the given context. */
  public static Expr.Subscript subscript(Expr value, Expr slice, Context ctx) {
    return new Expr.Subscript(value, slice, ctx);
  }

  public static Expr.Slice slice(@Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step) {
    return new Expr.Slice(lower, upper, step);
  }

  public static Expr.Constant constant(@Nullable Object value) {
    return new Expr.Constant(value);
  }

  /** A call with positional arguments only. */
  public static Expr.Call call(Expr func, Expr... args) {
    return new Expr.Call(func, Arrays.asList(args), ImmutableList.of());
  }

  /** A call with positional and keyword arguments. */
  public static Expr.Call call(Expr func, List<Expr> args, List<Expr.Keyword> keywords) {
    return new Expr.Call(func, args, keywords);
  }

  /** {@code receiver.method(args)}. */
  public static Expr.Call callMethod(Expr receiver, String method, Expr... args) {
    return call(attr(receiver, method), args);
  }

  public static Expr.Keyword keyword(String arg, Expr value) {
    return new Expr.Keyword(arg, value);
  }

  public static Expr.Tuple tuple(Context ctx, Expr... elts) {
    return new Expr.Tuple(Arrays.asList(elts), ctx);
  }

  public static Expr.ListExpr list(Context ctx, Expr... elts) {
    return new Expr.ListExpr(Arrays.asList(elts), ctx);
  }

  public static Expr.BinOp binOp(Expr left, String op, Expr right) {
    return new Expr.BinOp(left, op, right);
  }

  public static Expr.UnaryOp unaryOp(String op, Expr operand) {
    return new Expr.UnaryOp(op, operand);
  }

  /** {@code [element for target in iter]}. */
  public static Expr.Comprehension listComp(Expr element, Expr target, Expr iter) {
    return new Expr.Comprehension(
        Expr.Comprehension.Kind.LIST,
        element,
        null,
        ImmutableList.of(new Expr.Comprehension.Clause(target, iter, ImmutableList.of())));
  }

  /** {@code {key: value for target in iter}}. */
  public static Expr.Comprehension dictComp(Expr key, Expr value, Expr target, Expr iter) {
    return new Expr.Comprehension(
        Expr.Comprehension.Kind.DICT,
        key,
        value,
        ImmutableList.of(new Expr.Comprehension.Clause(target, iter, ImmutableList.of())));
  }

  // Statements

  /** {@code target = value}. */
  public static Stmt.Assign assign(Expr target, Expr value) {
    return new Stmt.Assign(ImmutableList.of(target), value);
  }

  /** {@code target op= value}. */
  public static Stmt.AugAssign augAssign(Expr target, String op, Expr value) {
    return new Stmt.AugAssign(target, op, value);
  }

  public static Stmt.Delete delete(Expr... targets) {
    return new Stmt.Delete(Arrays.asList(targets));
  }

  public static Stmt.ExprStmt exprStmt(Expr value) {
    return new Stmt.ExprStmt(value);
  }

  public static Stmt.Return returnStmt(@Nullable Expr value) {
    return new Stmt.Return(value);
  }

  public static Stmt.Simple pass() {
    return new Stmt.Simple(NodeKind.PASS);
  }

  public static Stmt.Simple breakStmt() {
    return new Stmt.Simple(NodeKind.BREAK);
  }

  public static Stmt.Simple continueStmt() {
    return new Stmt.Simple(NodeKind.CONTINUE);
  }

  public static Stmt.Declaration global(String... names) {
    return new Stmt.Declaration(NodeKind.GLOBAL, Arrays.asList(names));
  }

  /**
   * A {@code nonlocal} declaration.
   *
   * @throws IllegalArgumentException if the list is empty
   */
  public static Stmt.Declaration nonlocal(List<String> names) {
    return new Stmt.Declaration(NodeKind.NONLOCAL, names);
  }

  public static Stmt.Declaration nonlocal(String... names) {
    return nonlocal(Arrays.asList(names));
  }

  public static Stmt.If ifStmt(Expr test, List<Stmt> body, List<Stmt> orelse) {
    return new Stmt.If(test, body, orelse);
  }

  public static Stmt.If ifStmt(Expr test, Stmt... body) {
    return new Stmt.If(test, Arrays.asList(body), ImmutableList.of());
  }

  public static Stmt.While whileLoop(Expr test, Stmt... body) {
    return new Stmt.While(test, Arrays.asList(body), ImmutableList.of());
  }

  public static Stmt.For forLoop(Expr target, Expr iter, Stmt... body) {
    return new Stmt.For(target, iter, Arrays.asList(body), ImmutableList.of());
  }

  /** An ordinary function definition with positional parameters only. */
  public static Stmt.FunctionDef functionDef(String name, List<String> params, Stmt... body) {
    return new Stmt.FunctionDef(
        name,
        new Stmt.Arguments(params, null, null, ImmutableList.of()),
        Arrays.asList(body),
        FunctionRole.ORDINARY);
  }

  /** A function definition with the given parameters and role. */
  public static Stmt.FunctionDef functionDef(
      String name, Stmt.Arguments params, List<Stmt> body, FunctionRole role) {
    return new Stmt.FunctionDef(name, params, body, role);
  }

  /**
   * Wraps the given statements in a new function definition with the given role, appending a
   * return statement: {@code return} if {@code returnNames} is empty, otherwise a return of the
   * named variables (a single name, or a tuple if there are several).
   */
  public static Stmt.FunctionDef functionDef(
      String name,
      Stmt.Arguments params,
      List<Stmt> body,
      List<String> returnNames,
      FunctionRole role) {
    List<Stmt> statements = new ArrayList<>(body);
    statements.add(
        returnStmt(returnNames.isEmpty() ? null : nameNode(returnNames, Context.LOAD, false)));
    return new Stmt.FunctionDef(name, params, statements, role);
  }

  /**
   * Returns an expression for the given variable names: if there is exactly one and {@code
   * tupleIfSingle} is false, the corresponding name (or qualified expression); otherwise a tuple of
   * them.
   */
  public static Expr nameNode(List<String> names, Context ctx, boolean tupleIfSingle) {
    Preconditions.checkArgument(!names.isEmpty() || tupleIfSingle, "No names");
    ImmutableList<Expr> exprs =
        names.stream()
            .map(n -> QualifiedNames.toExpression(n, ctx))
            .collect(ImmutableList.toImmutableList());
    if (exprs.size() == 1 && !tupleIfSingle) {
      return exprs.get(0);
    }
    return new Expr.Tuple(exprs, ctx);
  }

  /**
   * Returns a deep copy of {@code expr} whose outermost node has the given context. Use this to
   * put an expression taken from one tree into another.
   */
  public static Expr copy(Expr expr, Context ctx) {
    return ExprCopier.copy(expr, ctx);
  }

  /** Returns an assignment of {@code value} to the given variable name(s). */
  public static Stmt.Assign assignNames(List<String> names, Expr value) {
    return assign(nameNode(names, Context.STORE, false), value);
  }
}
