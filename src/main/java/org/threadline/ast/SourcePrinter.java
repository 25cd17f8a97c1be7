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

import com.google.common.base.Strings;
import java.util.List;

/**
 * Converts syntax trees back to source text. Expressions print on a single line with no trailing
 * newline; statements print as complete, newline-terminated lines indented four spaces per level.
 *
 * <p>The text of an attribute or subscript expression printed by this class is its qualified
 * variable name (e.g. {@code self.x} or {@code a[0]}), so the output must be stable: the same tree
 * always prints the same way.
 */
public final class SourcePrinter extends AstVisitor<Void> {

  private static final String INDENT = "    ";

  private final StringBuilder out = new StringBuilder();
  private int depth;

  private SourcePrinter() {}

  /** Returns the source text for the given node. */
  public static String toSource(Node node) {
    SourcePrinter printer = new SourcePrinter();
    printer.visit(node);
    return printer.out.toString();
  }

  /** Returns the source text for a sequence of statements. */
  public static String toSource(List<? extends Stmt> statements) {
    SourcePrinter printer = new SourcePrinter();
    printer.visitAll(statements);
    return printer.out.toString();
  }

  private void startLine() {
    out.append(Strings.repeat(INDENT, depth));
  }

  private void endLine() {
    out.append('\n');
  }

  /** Emits a complete line containing just {@code text}. */
  private void line(String text) {
    startLine();
    out.append(text);
    endLine();
  }

  /** Emits an indented block; an empty block is printed as {@code pass}. */
  private void block(List<Stmt> body) {
    depth++;
    if (body.isEmpty()) {
      line("pass");
    } else {
      visitAll(body);
    }
    depth--;
  }

  /**
   * Emits an expression in a position where a tuple doesn't need parentheses (the value or target
   * of an assignment, a return value, a for loop target, or a subscript index).
   */
  private void topLevel(Expr expr) {
    if (expr.kind() == NodeKind.TUPLE && !((Expr.Tuple) expr).elts.isEmpty()) {
      elements(((Expr.Tuple) expr).elts);
    } else {
      visit(expr);
    }
  }

  /** Emits comma-separated tuple elements, with a trailing comma if there is only one. */
  private void elements(List<Expr> elts) {
    commaSeparated(elts);
    if (elts.size() == 1) {
      out.append(',');
    }
  }

  private void commaSeparated(List<? extends Node> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i != 0) {
        out.append(", ");
      }
      visit(nodes.get(i));
    }
  }

  /** Emits an operand, parenthesized if it is itself an operation. */
  private void operand(Expr expr) {
    NodeKind kind = expr.kind();
    if (kind == NodeKind.BIN_OP || kind == NodeKind.UNARY_OP) {
      out.append('(');
      visit(expr);
      out.append(')');
    } else {
      visit(expr);
    }
  }

  /** Emits the value of an attribute or subscript, parenthesized unless it is a primary. */
  private void primary(Expr expr) {
    switch (expr.kind()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
      case CALL:
      case LIST:
      case TUPLE:
      case COMPREHENSION:
        visit(expr);
        break;
      default:
        out.append('(');
        visit(expr);
        out.append(')');
    }
  }

  // Statements

  @Override
  protected Void visitFunctionDef(Stmt.FunctionDef node) {
    startLine();
    out.append("def ").append(node.name).append('(');
    Stmt.Arguments params = node.params;
    int firstDefault = params.args.size() - params.defaults.size();
    String separator = "";
    for (int i = 0; i < params.args.size(); i++) {
      out.append(separator).append(params.args.get(i));
      if (i >= firstDefault) {
        out.append('=');
        visit(params.defaults.get(i - firstDefault));
      }
      separator = ", ";
    }
    if (params.vararg != null) {
      out.append(separator).append('*').append(params.vararg);
      separator = ", ";
    }
    if (params.kwarg != null) {
      out.append(separator).append("**").append(params.kwarg);
    }
    out.append("):");
    endLine();
    block(node.body);
    return null;
  }

  @Override
  protected Void visitIf(Stmt.If node) {
    return ifChain("if ", node);
  }

  private Void ifChain(String keyword, Stmt.If node) {
    startLine();
    out.append(keyword);
    visit(node.test);
    out.append(':');
    endLine();
    block(node.body);
    if (node.orelse.size() == 1 && node.orelse.get(0).kind() == NodeKind.IF) {
      return ifChain("elif ", (Stmt.If) node.orelse.get(0));
    }
    elseBlock(node.orelse);
    return null;
  }

  private void elseBlock(List<Stmt> orelse) {
    if (!orelse.isEmpty()) {
      line("else:");
      block(orelse);
    }
  }

  @Override
  protected Void visitWhile(Stmt.While node) {
    startLine();
    out.append("while ");
    visit(node.test);
    out.append(':');
    endLine();
    block(node.body);
    elseBlock(node.orelse);
    return null;
  }

  @Override
  protected Void visitFor(Stmt.For node) {
    startLine();
    out.append("for ");
    topLevel(node.target);
    out.append(" in ");
    visit(node.iter);
    out.append(':');
    endLine();
    block(node.body);
    elseBlock(node.orelse);
    return null;
  }

  @Override
  protected Void visitAssign(Stmt.Assign node) {
    startLine();
    for (Expr target : node.targets) {
      topLevel(target);
      out.append(" = ");
    }
    topLevel(node.value);
    endLine();
    return null;
  }

  @Override
  protected Void visitAugAssign(Stmt.AugAssign node) {
    startLine();
    visit(node.target);
    out.append(' ').append(node.op).append("= ");
    visit(node.value);
    endLine();
    return null;
  }

  @Override
  protected Void visitDelete(Stmt.Delete node) {
    startLine();
    out.append("del ");
    commaSeparated(node.targets);
    endLine();
    return null;
  }

  @Override
  protected Void visitExprStmt(Stmt.ExprStmt node) {
    startLine();
    topLevel(node.value);
    endLine();
    return null;
  }

  @Override
  protected Void visitReturn(Stmt.Return node) {
    startLine();
    out.append("return");
    if (node.value != null) {
      out.append(' ');
      topLevel(node.value);
    }
    endLine();
    return null;
  }

  @Override
  protected Void visitSimple(Stmt.Simple node) {
    line(node.kind().name().toLowerCase());
    return null;
  }

  @Override
  protected Void visitGlobal(Stmt.Declaration node) {
    line("global " + String.join(", ", node.names));
    return null;
  }

  @Override
  protected Void visitNonlocal(Stmt.Declaration node) {
    line("nonlocal " + String.join(", ", node.names));
    return null;
  }

  // Expressions

  @Override
  protected Void visitName(Expr.Name node) {
    out.append(node.id);
    return null;
  }

  @Override
  protected Void visitAttribute(Expr.Attribute node) {
    primary(node.value);
    out.append('.').append(node.attr);
    return null;
  }

  @Override
  protected Void visitSubscript(Expr.Subscript node) {
    primary(node.value);
    out.append('[');
    topLevel(node.slice);
    out.append(']');
    return null;
  }

  @Override
  protected Void visitSlice(Expr.Slice node) {
    if (node.lower != null) {
      visit(node.lower);
    }
    out.append(':');
    if (node.upper != null) {
      visit(node.upper);
    }
    if (node.step != null) {
      out.append(':');
      visit(node.step);
    }
    return null;
  }

  @Override
  protected Void visitCall(Expr.Call node) {
    primary(node.func);
    out.append('(');
    commaSeparated(node.args);
    if (!node.args.isEmpty() && !node.keywords.isEmpty()) {
      out.append(", ");
    }
    commaSeparated(node.keywords);
    out.append(')');
    return null;
  }

  @Override
  protected Void visitKeyword(Expr.Keyword node) {
    out.append(node.arg).append('=');
    visit(node.value);
    return null;
  }

  @Override
  protected Void visitConstant(Expr.Constant node) {
    Object value = node.value;
    if (value == null) {
      out.append("None");
    } else if (value instanceof Boolean) {
      out.append(((Boolean) value) ? "True" : "False");
    } else if (value instanceof String) {
      out.append('\'');
      String s = (String) value;
      for (int i = 0; i < s.length(); i++) {
        char c = s.charAt(i);
        switch (c) {
          case '\\':
            out.append("\\\\");
            break;
          case '\'':
            out.append("\\'");
            break;
          case '\n':
            out.append("\\n");
            break;
          default:
            out.append(c);
        }
      }
      out.append('\'');
    } else {
      out.append(value);
    }
    return null;
  }

  @Override
  protected Void visitTuple(Expr.Tuple node) {
    out.append('(');
    elements(node.elts);
    out.append(')');
    return null;
  }

  @Override
  protected Void visitList(Expr.ListExpr node) {
    out.append('[');
    commaSeparated(node.elts);
    out.append(']');
    return null;
  }

  @Override
  protected Void visitBinOp(Expr.BinOp node) {
    operand(node.left);
    out.append(' ').append(node.op).append(' ');
    operand(node.right);
    return null;
  }

  @Override
  protected Void visitUnaryOp(Expr.UnaryOp node) {
    out.append(node.op);
    if (Character.isLetter(node.op.charAt(node.op.length() - 1))) {
      out.append(' ');
    }
    operand(node.operand);
    return null;
  }

  @Override
  protected Void visitComprehension(Expr.Comprehension node) {
    out.append(node.comprehensionKind.open);
    visit(node.element);
    if (node.value != null) {
      out.append(": ");
      visit(node.value);
    }
    for (Expr.Comprehension.Clause clause : node.clauses) {
      out.append(" for ");
      topLevel(clause.target);
      out.append(" in ");
      visit(clause.iter);
      for (Expr cond : clause.ifs) {
        out.append(" if ");
        visit(cond);
      }
    }
    out.append(node.comprehensionKind.close);
    return null;
  }
}
