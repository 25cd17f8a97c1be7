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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A base class for syntax tree visitors. {@link #visit} dispatches on {@link Node#kind} with an
 * explicit switch, so adding a NodeKind without handling it here fails to compile cleanly rather
 * than silently doing nothing.
 *
 * <p>Like an ANTLR visitor, there is one {@code visitXxx} method per kind, but the defaults are
 * not "do nothing": visiting a node whose method hasn't been overridden throws an AssertionError.
 * Subclasses that want the generic behavior call {@link #visitChildren} explicitly.
 *
 * <p>The node currently being visited is available from {@link #currentNode}, for error
 * reporting.
 */
public abstract class AstVisitor<T> {

  /** The node currently being visited. */
  private Node currentNode;

  /**
   * Visits the given node, binding {@link #currentNode} for the duration of the call.
   *
   * <p>If the visit throws, no attempt is made to restore the previous current node; the visitor
   * should not be used again.
   */
  @CanIgnoreReturnValue
  public final T visit(Node node) {
    Node prevNode = currentNode;
    currentNode = node;
    T result = dispatch(node);
    currentNode = prevNode;
    return result;
  }

  private T dispatch(Node node) {
    switch (node.kind()) {
      case FUNCTION_DEF:
        return visitFunctionDef((Stmt.FunctionDef) node);
      case IF:
        return visitIf((Stmt.If) node);
      case WHILE:
        return visitWhile((Stmt.While) node);
      case FOR:
        return visitFor((Stmt.For) node);
      case ASSIGN:
        return visitAssign((Stmt.Assign) node);
      case AUG_ASSIGN:
        return visitAugAssign((Stmt.AugAssign) node);
      case DELETE:
        return visitDelete((Stmt.Delete) node);
      case EXPR_STMT:
        return visitExprStmt((Stmt.ExprStmt) node);
      case RETURN:
        return visitReturn((Stmt.Return) node);
      case PASS:
      case BREAK:
      case CONTINUE:
        return visitSimple((Stmt.Simple) node);
      case GLOBAL:
        return visitGlobal((Stmt.Declaration) node);
      case NONLOCAL:
        return visitNonlocal((Stmt.Declaration) node);
      case NAME:
        return visitName((Expr.Name) node);
      case ATTRIBUTE:
        return visitAttribute((Expr.Attribute) node);
      case SUBSCRIPT:
        return visitSubscript((Expr.Subscript) node);
      case SLICE:
        return visitSlice((Expr.Slice) node);
      case CALL:
        return visitCall((Expr.Call) node);
      case KEYWORD:
        return visitKeyword((Expr.Keyword) node);
      case CONSTANT:
        return visitConstant((Expr.Constant) node);
      case TUPLE:
        return visitTuple((Expr.Tuple) node);
      case LIST:
        return visitList((Expr.ListExpr) node);
      case BIN_OP:
        return visitBinOp((Expr.BinOp) node);
      case UNARY_OP:
        return visitUnaryOp((Expr.UnaryOp) node);
      case COMPREHENSION:
        return visitComprehension((Expr.Comprehension) node);
    }
    throw new AssertionError(node.kind());
  }

  /** Returns the node currently being visited, or null if no visit is in progress. */
  protected @Nullable Node currentNode() {
    return currentNode;
  }

  /** Visits each of the node's children in order; returns null. */
  protected final @Nullable T visitChildren(Node node) {
    visitAll(node.children());
    return null;
  }

  /** Visits each of the given nodes in order. */
  protected final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  /** Called for any node kind whose visit method has not been overridden. */
  protected T unhandled(Node node) {
    throw new AssertionError("No visit method for " + node.kind());
  }

  protected T visitFunctionDef(Stmt.FunctionDef node) {
    return unhandled(node);
  }

  protected T visitIf(Stmt.If node) {
    return unhandled(node);
  }

  protected T visitWhile(Stmt.While node) {
    return unhandled(node);
  }

  protected T visitFor(Stmt.For node) {
    return unhandled(node);
  }

  protected T visitAssign(Stmt.Assign node) {
    return unhandled(node);
  }

  protected T visitAugAssign(Stmt.AugAssign node) {
    return unhandled(node);
  }

  protected T visitDelete(Stmt.Delete node) {
    return unhandled(node);
  }

  protected T visitExprStmt(Stmt.ExprStmt node) {
    return unhandled(node);
  }

  protected T visitReturn(Stmt.Return node) {
    return unhandled(node);
  }

  /** Called for {@code pass}, {@code break}, and {@code continue}. */
  protected T visitSimple(Stmt.Simple node) {
    return unhandled(node);
  }

  protected T visitGlobal(Stmt.Declaration node) {
    return unhandled(node);
  }

  protected T visitNonlocal(Stmt.Declaration node) {
    return unhandled(node);
  }

  protected T visitName(Expr.Name node) {
    return unhandled(node);
  }

  protected T visitAttribute(Expr.Attribute node) {
    return unhandled(node);
  }

  protected T visitSubscript(Expr.Subscript node) {
    return unhandled(node);
  }

  protected T visitSlice(Expr.Slice node) {
    return unhandled(node);
  }

  protected T visitCall(Expr.Call node) {
    return unhandled(node);
  }

  protected T visitKeyword(Expr.Keyword node) {
    return unhandled(node);
  }

  protected T visitConstant(Expr.Constant node) {
    return unhandled(node);
  }

  protected T visitTuple(Expr.Tuple node) {
    return unhandled(node);
  }

  protected T visitList(Expr.ListExpr node) {
    return unhandled(node);
  }

  protected T visitBinOp(Expr.BinOp node) {
    return unhandled(node);
  }

  protected T visitUnaryOp(Expr.UnaryOp node) {
    return unhandled(node);
  }

  protected T visitComprehension(Expr.Comprehension node) {
    return unhandled(node);
  }
}
