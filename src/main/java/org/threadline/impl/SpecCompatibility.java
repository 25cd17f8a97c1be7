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

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether a function transformed for one list of argument specs can be reused for another.
 * Each spec is either an {@link InputSpec} (for a tensor argument) or an arbitrary value (for
 * anything else). These checks never throw.
 */
public final class SpecCompatibility {

  private SpecCompatibility() {}

  /**
   * Returns true if {@code src} is compatible with {@code desired}.
   *
   * <p>If the lists have the same length they are compared element by element: a pair in which
   * either spec is an InputSpec is compatible if both are InputSpecs with the same rank, the same
   * size in each dimension known to both, and the same dtype; any other pair is compatible if their
   * {@link Hashables#makeHashable hashable forms} are equal.
   *
   * <p>If the lengths differ, {@code src} is compatible if each of its specs appears in {@code
   * desired} (i.e. {@code src} describes a subset of the arguments).
   */
  public static boolean inputSpecsCompatible(
      List<? extends @Nullable Object> src, List<? extends @Nullable Object> desired) {
    if (src.size() != desired.size()) {
      for (Object spec : src) {
        if (!desired.contains(spec)) {
          return false;
        }
      }
      return true;
    }
    for (int i = 0; i < src.size(); i++) {
      Object srcSpec = src.get(i);
      Object desiredSpec = desired.get(i);
      boolean compatible =
          (srcSpec instanceof InputSpec || desiredSpec instanceof InputSpec)
              ? tensorSpecsCompatible(srcSpec, desiredSpec)
              : Objects.equals(
                  Hashables.makeHashable(srcSpec), Hashables.makeHashable(desiredSpec));
      if (!compatible) {
        return false;
      }
    }
    return true;
  }

  static boolean tensorSpecsCompatible(@Nullable Object src, @Nullable Object desired) {
    if (!(src instanceof InputSpec && desired instanceof InputSpec)) {
      return false;
    }
    InputSpec a = (InputSpec) src;
    InputSpec b = (InputSpec) desired;
    if (a.rank() != b.rank()) {
      return false;
    }
    for (int i = 0; i < a.rank(); i++) {
      if (a.isKnown(i) && b.isKnown(i) && !a.shape().get(i).equals(b.shape().get(i))) {
        return false;
      }
    }
    return a.dtype == b.dtype;
  }
}
