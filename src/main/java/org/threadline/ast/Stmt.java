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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The base class for statement nodes. The concrete subclasses are nested here.
 *
 * <p>Statement bodies are mutable lists, so that transformations can insert new statements (e.g.
 * accessor definitions or undefined-variable declarations) in place.
 */
public abstract class Stmt extends Node {

  Stmt() {}

  /** The parameters of a {@link FunctionDef}. */
  public static final class Arguments {
    public static final Arguments NONE =
        new Arguments(ImmutableList.of(), null, null, ImmutableList.of());

    /** The names of the positional parameters. */
    public final ImmutableList<String> args;

    /** The name of the {@code *args} parameter, if any. */
    public final @Nullable String vararg;

    /** The name of the {@code **kwargs} parameter, if any. */
    public final @Nullable String kwarg;

    /** Default values for the last {@code defaults.size()} positional parameters. */
    public final ImmutableList<Expr> defaults;

    public Arguments(
        List<String> args, @Nullable String vararg, @Nullable String kwarg, List<Expr> defaults) {
      Preconditions.checkArgument(defaults.size() <= args.size(), "More defaults than parameters");
      this.args = ImmutableList.copyOf(args);
      this.vararg = vararg;
      this.kwarg = kwarg;
      this.defaults = ImmutableList.copyOf(defaults);
    }

    /** Returns all parameter names: positional, then vararg, then kwarg. */
    public ImmutableList<String> allNames() {
      ImmutableList.Builder<String> builder = ImmutableList.<String>builder().addAll(args);
      if (vararg != null) {
        builder.add(vararg);
      }
      if (kwarg != null) {
        builder.add(kwarg);
      }
      return builder.build();
    }
  }

  /** A function definition. Introduces a function scope. */
  public static final class FunctionDef extends Stmt {
    public final String name;
    public final Arguments params;
    public final List<Stmt> body;

    /** Set at construction; never inferred from {@link #name}. */
    public final FunctionRole role;

    public FunctionDef(String name, Arguments params, List<Stmt> body, FunctionRole role) {
      Preconditions.checkArgument(
          QualifiedNames.isIdentifier(name), "Bad function name '%s'", name);
      this.name = name;
      this.params = params;
      this.body = new ArrayList<>(body);
      this.role = role;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.FUNCTION_DEF;
    }

    @Override
    public List<Node> children() {
      return childList(params.defaults, body);
    }
  }

  /** An if statement; {@code elif} chains are nested Ifs in {@code orelse}. */
  public static final class If extends Stmt {
    public final Expr test;
    public final List<Stmt> body;
    public final List<Stmt> orelse;

    public If(Expr test, List<Stmt> body, List<Stmt> orelse) {
      this.test = test;
      this.body = new ArrayList<>(body);
      this.orelse = new ArrayList<>(orelse);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.IF;
    }

    @Override
    public List<Node> children() {
      return childList(test, body, orelse);
    }
  }

  /** A while loop. */
  public static final class While extends Stmt {
    public final Expr test;
    public final List<Stmt> body;
    public final List<Stmt> orelse;

    public While(Expr test, List<Stmt> body, List<Stmt> orelse) {
      this.test = test;
      this.body = new ArrayList<>(body);
      this.orelse = new ArrayList<>(orelse);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.WHILE;
    }

    @Override
    public List<Node> children() {
      return childList(test, body, orelse);
    }
  }

  /** A for loop; {@code target} is written on each iteration. */
  public static final class For extends Stmt {
    public final Expr target;
    public final Expr iter;
    public final List<Stmt> body;
    public final List<Stmt> orelse;

    public For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse) {
      this.target = target;
      this.iter = iter;
      this.body = new ArrayList<>(body);
      this.orelse = new ArrayList<>(orelse);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.FOR;
    }

    @Override
    public List<Node> children() {
      return childList(target, iter, body, orelse);
    }
  }

  /** {@code t1 = t2 = value}. */
  public static final class Assign extends Stmt {
    public final ImmutableList<Expr> targets;
    public final Expr value;

    public Assign(List<Expr> targets, Expr value) {
      Preconditions.checkArgument(!targets.isEmpty());
      this.targets = ImmutableList.copyOf(targets);
      this.value = value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ASSIGN;
    }

    @Override
    public List<Node> children() {
      return childList(targets, value);
    }
  }

  /** {@code target op= value}; {@code op} is the binary operator, e.g. {@code "+"}. */
  public static final class AugAssign extends Stmt {
    public final Expr target;
    public final String op;
    public final Expr value;

    public AugAssign(Expr target, String op, Expr value) {
      this.target = target;
      this.op = op;
      this.value = value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.AUG_ASSIGN;
    }

    @Override
    public List<Node> children() {
      return childList(target, value);
    }
  }

  /** {@code del t1, t2}. */
  public static final class Delete extends Stmt {
    public final ImmutableList<Expr> targets;

    public Delete(List<Expr> targets) {
      Preconditions.checkArgument(!targets.isEmpty());
      this.targets = ImmutableList.copyOf(targets);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.DELETE;
    }

    @Override
    public List<Node> children() {
      return childList(targets);
    }
  }

  /** An expression evaluated for its side effects. */
  public static final class ExprStmt extends Stmt {
    public final Expr value;

    public ExprStmt(Expr value) {
      this.value = value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.EXPR_STMT;
    }

    @Override
    public List<Node> children() {
      return childList(value);
    }
  }

  /** {@code return} or {@code return value}. */
  public static final class Return extends Stmt {
    public final @Nullable Expr value;

    public Return(@Nullable Expr value) {
      this.value = value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.RETURN;
    }

    @Override
    public List<Node> children() {
      return childList(value);
    }
  }

  /** {@code pass}, {@code break}, or {@code continue}. */
  public static final class Simple extends Stmt {
    private final NodeKind kind;

    public Simple(NodeKind kind) {
      Preconditions.checkArgument(
          kind == NodeKind.PASS || kind == NodeKind.BREAK || kind == NodeKind.CONTINUE);
      this.kind = kind;
    }

    @Override
    public NodeKind kind() {
      return kind;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of();
    }
  }

  /**
   * A {@code global} or {@code nonlocal} declaration. Only simple names can be declared, but that
   * is checked by analysis (which reports an AnalysisError with the declaration's line) rather than
   * here.
   */
  public static final class Declaration extends Stmt {
    private final NodeKind kind;
    public final ImmutableList<String> names;

    public Declaration(NodeKind kind, List<String> names) {
      Preconditions.checkArgument(kind == NodeKind.GLOBAL || kind == NodeKind.NONLOCAL);
      Preconditions.checkArgument(!names.isEmpty(), "Empty %s declaration", kind);
      this.kind = kind;
      this.names = ImmutableList.copyOf(names);
    }

    @Override
    public NodeKind kind() {
      return kind;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of();
    }
  }
}
