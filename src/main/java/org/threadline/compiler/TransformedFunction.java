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

import java.nio.file.Path;
import java.util.Optional;
import org.threadline.ast.Stmt;

/** The result of {@link FunctionTransformer#transform}. */
public final class TransformedFunction {

  /**
   * The function that was transformed. Its body has been modified in place to declare the
   * variables its control flow creates.
   */
  public final Stmt.FunctionDef function;

  public final ScopeAnalysis analysis;

  /** The printed source of the transformed function. */
  public final String source;

  /** Where {@link #source} was staged, if it was. */
  public final Optional<Path> stagedPath;

  TransformedFunction(
      Stmt.FunctionDef function, ScopeAnalysis analysis, String source, Optional<Path> stagedPath) {
    this.function = function;
    this.analysis = analysis;
    this.source = source;
    this.stagedPath = stagedPath;
  }

  @Override
  public String toString() {
    return String.format("TransformedFunction{%s, staged=%s}", function.name, stagedPath);
  }
}
