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

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Converts values to a form whose equals and hashCode depend only on their contents, so that two
 * separately constructed but structurally equal values can be compared or used as map keys.
 */
public final class Hashables {

  private Hashables() {}

  /**
   * Returns a value-based form of {@code value}:
   *
   * <ul>
   *   <li>a {@link StructuralKind#SCALAR} or {@link StructuralKind#OPAQUE} value is returned as-is;
   *   <li>a list or array becomes an unmodifiable list of its converted elements, and any other
   *       collection an unmodifiable set of them;
   *   <li>a map becomes an unmodifiable map from each key to its converted value.
   * </ul>
   *
   * Never throws for any input other than a structure that contains itself.
   */
  public static @Nullable Object makeHashable(@Nullable Object value) {
    switch (StructuralKind.of(value)) {
      case SCALAR:
      case OPAQUE:
        return value;
      case SEQUENCE:
        if (value instanceof Collection && !(value instanceof List)) {
          Set<@Nullable Object> set = new HashSet<>();
          for (Object element : (Collection<?>) value) {
            set.add(makeHashable(element));
          }
          return Collections.unmodifiableSet(set);
        }
        return Collections.unmodifiableList(elements(value));
      case MAPPING:
        Map<@Nullable Object, @Nullable Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
          map.put(entry.getKey(), makeHashable(entry.getValue()));
        }
        return Collections.unmodifiableMap(map);
    }
    throw new AssertionError();
  }

  /** Returns the converted elements of a list or array (of objects or primitives). */
  private static List<@Nullable Object> elements(Object sequence) {
    List<@Nullable Object> result = new ArrayList<>();
    if (sequence instanceof List) {
      for (Object element : (List<?>) sequence) {
        result.add(makeHashable(element));
      }
    } else {
      int length = Array.getLength(sequence);
      for (int i = 0; i < length; i++) {
        result.add(makeHashable(Array.get(sequence, i)));
      }
    }
    return result;
  }
}
