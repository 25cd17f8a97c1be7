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

package org.threadline.impl;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * The value given to a variable on paths where it has not been assigned yet. After lowering, a
 * variable that is only assigned in one branch of an {@code if} must still have a value on the
 * other branch; it gets one of these, and any attempt to actually use it reports the same error as
 * reading an unassigned local would have.
 */
public final class UndefinedVar {
  public final String name;

  public UndefinedVar(String name) {
    this.name = Preconditions.checkNotNull(name);
  }

  /** Always throws; called when this value is used. */
  public void check() {
    throw new UnboundVariableError(name);
  }

  /**
   * Returns {@code value} unchanged unless it is an UndefinedVar.
   *
   * @throws UnboundVariableError if {@code value} is an UndefinedVar
   */
  public static <T> @Nullable T saw(@Nullable T value) {
    if (value instanceof UndefinedVar) {
      ((UndefinedVar) value).check();
    }
    return value;
  }

  @Override
  public String toString() {
    return "UndefinedVar('" + name + "')";
  }
}
