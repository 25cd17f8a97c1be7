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
import java.util.Optional;
import org.threadline.ast.Stmt;

/**
 * The result of {@link AccessorSynthesizer#synthesize}: a getter and setter for one ordered list of
 * variable names, ready to be inserted as sibling statements ahead of the lowered code that uses
 * them.
 */
public final class Accessors {

  /** The names the accessors were generated for, in tuple order. */
  public final ImmutableList<String> names;

  /** {@code def get_args_N(): ...}; returns the current values as a tuple. */
  public final Stmt.FunctionDef getter;

  /** {@code def set_args_N(__args): ...}; assigns the elements of its argument. */
  public final Stmt.FunctionDef setter;

  /** The {@code nonlocal} declaration shared by both functions; empty if no name is simple. */
  public final Optional<Stmt.Declaration> nonlocal;

  Accessors(
      ImmutableList<String> names,
      Stmt.FunctionDef getter,
      Stmt.FunctionDef setter,
      Optional<Stmt.Declaration> nonlocal) {
    this.names = names;
    this.getter = getter;
    this.setter = setter;
    this.nonlocal = nonlocal;
  }

  /** Returns the getter and setter definitions, in that order. */
  public ImmutableList<Stmt> statements() {
    return ImmutableList.of(getter, setter);
  }
}
