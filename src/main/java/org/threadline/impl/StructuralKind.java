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

import java.util.Collection;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * How {@link Hashables#makeHashable} treats a value. The kind is determined from the value's class
 * alone.
 */
public enum StructuralKind {
  /** null, numbers, strings, characters, booleans, and enum constants; used as-is. */
  SCALAR,
  /** Collections and arrays; their elements are converted recursively. */
  SEQUENCE,
  /** Maps; their values are converted recursively. */
  MAPPING,
  /** Anything else; used as-is, relying on the value's own equals and hashCode. */
  OPAQUE;

  public static StructuralKind of(@Nullable Object value) {
    if (value == null
        || value instanceof Number
        || value instanceof CharSequence
        || value instanceof Character
        || value instanceof Boolean
        || value instanceof Enum) {
      return SCALAR;
    } else if (value instanceof Collection || value.getClass().isArray()) {
      return SEQUENCE;
    } else if (value instanceof Map) {
      return MAPPING;
    }
    return OPAQUE;
  }
}
