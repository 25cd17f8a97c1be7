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

/** How a name, attribute, subscript, tuple, or list expression is being used. */
public enum Context {
  LOAD,
  STORE,
  AUG_STORE,
  DEL;

  /** Returns true if an expression in this context binds, rebinds, or unbinds its target. */
  public boolean isWrite() {
    return this != LOAD;
  }
}
