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

/**
 * The closed set of node kinds. Every {@link Node} returns exactly one of these from {@link
 * Node#kind}, and {@link AstVisitor#visit} dispatches on it.
 */
public enum NodeKind {
  // Statements
  FUNCTION_DEF(true, false),
  IF(true, true),
  WHILE(true, true),
  FOR(true, true),
  ASSIGN,
  AUG_ASSIGN,
  DELETE,
  EXPR_STMT,
  RETURN,
  PASS,
  BREAK,
  CONTINUE,
  GLOBAL,
  NONLOCAL,

  // Expressions
  NAME,
  ATTRIBUTE,
  SUBSCRIPT,
  SLICE,
  CALL,
  KEYWORD,
  CONSTANT,
  TUPLE,
  LIST,
  BIN_OP,
  UNARY_OP,
  COMPREHENSION;

  private final boolean isScope;
  private final boolean isControlFlow;

  NodeKind() {
    this(false, false);
  }

  NodeKind(boolean isScope, boolean isControlFlow) {
    this.isScope = isScope;
    this.isControlFlow = isControlFlow;
  }

  /** True for function definitions and control flow, which each get their own name scope. */
  public boolean isScope() {
    return isScope;
  }

  /** True for if, while, and for. */
  public boolean isControlFlow() {
    return isControlFlow;
  }
}
