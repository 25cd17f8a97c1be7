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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Describes a tensor argument of a transformed function: its shape, element type, and optional
 * name. A dimension that is null or negative is unknown and matches any size.
 */
public final class InputSpec {
  private final List<@Nullable Integer> shape;
  public final DataType dtype;
  public final @Nullable String name;

  public InputSpec(List<@Nullable Integer> shape, DataType dtype, @Nullable String name) {
    this.shape = Collections.unmodifiableList(new ArrayList<>(shape));
    this.dtype = Preconditions.checkNotNull(dtype);
    this.name = name;
  }

  /** Returns an unnamed InputSpec. */
  public static InputSpec of(DataType dtype, @Nullable Integer... shape) {
    return new InputSpec(Arrays.asList(shape), dtype, null);
  }

  public List<@Nullable Integer> shape() {
    return shape;
  }

  public int rank() {
    return shape.size();
  }

  /** Returns true if dimension {@code i} has a known size. */
  public boolean isKnown(int i) {
    Integer dim = shape.get(i);
    return dim != null && dim >= 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof InputSpec)) {
      return false;
    }
    InputSpec other = (InputSpec) obj;
    return shape.equals(other.shape) && dtype == other.dtype && Objects.equals(name, other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(shape, dtype, name);
  }

  @Override
  public String toString() {
    String dims = shape.toString().replace("null", "None");
    return (name == null)
        ? String.format("InputSpec(%s, %s)", dims, dtype)
        : String.format("InputSpec(%s, %s, '%s')", dims, dtype, name);
  }
}
