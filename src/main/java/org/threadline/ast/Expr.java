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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The base class for expression nodes. The concrete subclasses are nested here; use {@link Nodes}
 * for a more compact way to construct them.
 */
public abstract class Expr extends Node {

  Expr() {}

  /** A bare identifier, e.g. {@code x}. */
  public static final class Name extends Expr {
    public final String id;
    public final Context ctx;

    public Name(String id, Context ctx) {
      Preconditions.checkArgument(QualifiedNames.isIdentifier(id), "Bad identifier '%s'", id);
      this.id = id;
      this.ctx = ctx;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.NAME;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of();
    }
  }

  /** An attribute reference, e.g. {@code a.b}. */
  public static final class Attribute extends Expr {
    public final Expr value;
    public final String attr;
    public final Context ctx;

    public Attribute(Expr value, String attr, Context ctx) {
      Preconditions.checkArgument(QualifiedNames.isIdentifier(attr), "Bad attribute '%s'", attr);
      this.value = value;
      this.attr = attr;
      this.ctx = ctx;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ATTRIBUTE;
    }

    @Override
    public List<Node> children() {
      return childList(value);
    }
  }

  /** An indexing expression, e.g. {@code a[i]} or {@code a[1:n]}. */
  public static final class Subscript extends Expr {
    public final Expr value;
    public final Expr slice;
    public final Context ctx;

    public Subscript(Expr value, Expr slice, Context ctx) {
      this.value = value;
      this.slice = slice;
      this.ctx = ctx;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SUBSCRIPT;
    }

    @Override
    public List<Node> children() {
      return childList(value, slice);
    }
  }

  /** The {@code lower:upper:step} part of a subscript; any of the three may be omitted. */
  public static final class Slice extends Expr {
    public final @Nullable Expr lower;
    public final @Nullable Expr upper;
    public final @Nullable Expr step;

    public Slice(@Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step) {
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SLICE;
    }

    @Override
    public List<Node> children() {
      return childList(lower, upper, step);
    }
  }

  /** A function or method call. */
  public static final class Call extends Expr {
    public final Expr func;
    public final ImmutableList<Expr> args;
    public final ImmutableList<Keyword> keywords;

    public Call(Expr func, List<Expr> args, List<Keyword> keywords) {
      this.func = func;
      this.args = ImmutableList.copyOf(args);
      this.keywords = ImmutableList.copyOf(keywords);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CALL;
    }

    @Override
    public List<Node> children() {
      return childList(func, args, keywords);
    }
  }

  /** A {@code name=value} argument in a {@link Call}. Not itself an expression. */
  public static final class Keyword extends Node {
    public final String arg;
    public final Expr value;

    public Keyword(String arg, Expr value) {
      Preconditions.checkArgument(QualifiedNames.isIdentifier(arg), "Bad keyword '%s'", arg);
      this.arg = arg;
      this.value = value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.KEYWORD;
    }

    @Override
    public List<Node> children() {
      return childList(value);
    }
  }

  /**
   * A literal. The value must be null (printed as {@code None}), a Boolean, a String, or a Number.
   */
  public static final class Constant extends Expr {
    public final @Nullable Object value;

    public Constant(@Nullable Object value) {
      Preconditions.checkArgument(
          value == null
              || value instanceof Boolean
              || value instanceof String
              || value instanceof Number,
          "Unsupported constant %s",
          value);
      this.value = value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CONSTANT;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of();
    }
  }

  /** A tuple display; with a write context it is an unpacking target, e.g. {@code x, y = p}. */
  public static final class Tuple extends Expr {
    public final ImmutableList<Expr> elts;
    public final Context ctx;

    public Tuple(List<Expr> elts, Context ctx) {
      this.elts = ImmutableList.copyOf(elts);
      this.ctx = ctx;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.TUPLE;
    }

    @Override
    public List<Node> children() {
      return childList(elts);
    }
  }

  /** A list display; like a Tuple it may be an unpacking target. */
  public static final class ListExpr extends Expr {
    public final ImmutableList<Expr> elts;
    public final Context ctx;

    public ListExpr(List<Expr> elts, Context ctx) {
      this.elts = ImmutableList.copyOf(elts);
      this.ctx = ctx;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.LIST;
    }

    @Override
    public List<Node> children() {
      return childList(elts);
    }
  }

  /**
   * A binary operation, including comparisons and boolean operators; {@code op} is the operator's
   * source text (e.g. {@code "+"}, {@code "<="}, {@code "and"}).
   */
  public static final class BinOp extends Expr {
    public final Expr left;
    public final String op;
    public final Expr right;

    public BinOp(Expr left, String op, Expr right) {
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BIN_OP;
    }

    @Override
    public List<Node> children() {
      return childList(left, right);
    }
  }

  /** A unary operation; {@code op} is e.g. {@code "-"} or {@code "not"}. */
  public static final class UnaryOp extends Expr {
    public final String op;
    public final Expr operand;

    public UnaryOp(String op, Expr operand) {
      this.op = op;
      this.operand = operand;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.UNARY_OP;
    }

    @Override
    public List<Node> children() {
      return childList(operand);
    }
  }

  /**
   * A list, set, or dict comprehension or a generator expression. The variables bound by its
   * clauses are local to the comprehension.
   */
  public static final class Comprehension extends Expr {
    /** The kinds of comprehension differ only in their brackets (and dicts' key/value pairs). */
    public enum Kind {
      LIST("[", "]"),
      SET("{", "}"),
      GENERATOR("(", ")"),
      DICT("{", "}");

      final String open;
      final String close;

      Kind(String open, String close) {
        this.open = open;
        this.close = close;
      }
    }

    /** One {@code for target in iter if cond ...} clause. */
    public static final class Clause {
      public final Expr target;
      public final Expr iter;
      public final ImmutableList<Expr> ifs;

      public Clause(Expr target, Expr iter, List<Expr> ifs) {
        this.target = target;
        this.iter = iter;
        this.ifs = ImmutableList.copyOf(ifs);
      }
    }

    public final Kind comprehensionKind;

    /** The element (or, for a DICT, the key). */
    public final Expr element;

    /** The value of a DICT comprehension; null for other kinds. */
    public final @Nullable Expr value;

    public final ImmutableList<Clause> clauses;

    public Comprehension(
        Kind comprehensionKind, Expr element, @Nullable Expr value, List<Clause> clauses) {
      Preconditions.checkArgument((comprehensionKind == Kind.DICT) == (value != null));
      Preconditions.checkArgument(!clauses.isEmpty());
      this.comprehensionKind = comprehensionKind;
      this.element = element;
      this.value = value;
      this.clauses = ImmutableList.copyOf(clauses);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.COMPREHENSION;
    }

    @Override
    public List<Node> children() {
      ImmutableList.Builder<Node> builder = ImmutableList.builder();
      builder.add(element);
      if (value != null) {
        builder.add(value);
      }
      for (Clause clause : clauses) {
        builder.add(clause.target).add(clause.iter).addAll(clause.ifs);
      }
      return builder.build();
    }
  }
}
