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

/**
 * Thrown by {@link FunctionTransformer#transform} when transforming a function failed with a
 * checked exception (usually an IOException while staging the result). Unchecked failures are
 * rethrown unwrapped.
 */

public class TransformException extends RuntimeException {
  /** The name of the function that could not be transformed. */
  public final String functionName;

  public TransformException(String functionName, Throwable cause) {
    super(String.format("Unable to transform '%s': %s", functionName, cause.getMessage()), cause);
    this.functionName = functionName;
  }
}
