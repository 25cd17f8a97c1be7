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
 * Why a function definition exists. Every function the user wrote is {@link #ORDINARY}; the others
 * are attached when control-flow lowering wraps the body or condition of a branch or loop in a new
 * function, which will be called from inside the enclosing function's lowered form.
 *
 * <p>The role is fixed when the {@link Stmt.FunctionDef} is constructed; the function's name only
 * carries {@link #prefix} by convention and is never consulted.
 */
public enum FunctionRole {
  ORDINARY(""),
  WHILE_CONDITION("while_condition"),
  WHILE_BODY("while_body"),
  FOR_CONDITION("for_loop_condition"),
  FOR_BODY("for_loop_body"),
  TRUE_BRANCH("true_fn"),
  FALSE_BRANCH("false_fn");

  /** The prefix used when generating names for functions with this role. */
  public final String prefix;

  FunctionRole(String prefix) {
    this.prefix = prefix;
  }

  /**
   * Returns true if functions with this role hold a lowered branch or loop; their writes are
   * treated as writes of the enclosing scope.
   */
  public boolean isControlFlowBody() {
    return this != ORDINARY;
  }
}
