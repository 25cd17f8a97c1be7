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

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;
import org.threadline.ast.Node;

/**
 * All problems with the input to scope analysis or accessor synthesis throw an AnalysisError. They
 * are detected before any code is generated.
 */
public class AnalysisError extends RuntimeException {
  public final String msg;

  /** The source line of the offending node, or 0 if unknown. */
  public final int lineNum;

  public AnalysisError(String msg, int lineNum) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
  }

  @Override
  public String getMessage() {
    return (lineNum == 0) ? msg : String.format("%s (line %s)", msg, lineNum);
  }

  /** Returns a new AnalysisError referring to the given node. */
  @FormatMethod
  static AnalysisError error(@Nullable Node node, String fmt, Object... fmtArgs) {
    // A null node is less useful, but still better than a NullPointerException.
    return new AnalysisError(String.format(fmt, fmtArgs), (node == null) ? 0 : node.lineNum());
  }
}
