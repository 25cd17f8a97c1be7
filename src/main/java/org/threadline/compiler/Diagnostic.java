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

import com.google.common.base.Preconditions;

/**
 * A non-fatal problem found while classifying variables. Reporting a Diagnostic never changes how
 * any other variable is handled.
 */
public final class Diagnostic {

  /** The kinds of problem that are reported rather than thrown. */
  public enum Kind {
    /**
     * {@code append} or {@code pop} was called on a variable that resolves to the global scope;
     * the container cannot be threaded through lowered control flow, so it is left out.
     */
    GLOBAL_CONTAINER_MUTATION
  }

  public final Kind kind;

  /** The variable the diagnostic is about. */
  public final String name;

  public final String message;

  Diagnostic(Kind kind, String name, String message) {
    this.kind = Preconditions.checkNotNull(kind);
    this.name = Preconditions.checkNotNull(name);
    this.message = Preconditions.checkNotNull(message);
  }

  static Diagnostic globalContainerMutation(String name) {
    return new Diagnostic(
        Kind.GLOBAL_CONTAINER_MUTATION,
        name,
        String.format(
            "Variable '%1$s' is defined in the global scope; calls to %1$s.append() or %1$s.pop()"
                + " are ignored and it will not be threaded through control flow",
            name));
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
