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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;

/** The element type of a tensor described by an {@link InputSpec}. */
public enum DataType {
  BOOL("bool"),
  INT8("int8"),
  UINT8("uint8"),
  INT16("int16"),
  INT32("int32"),
  INT64("int64"),
  FLOAT16("float16"),
  BFLOAT16("bfloat16"),
  FLOAT32("float32"),
  FLOAT64("float64"),
  COMPLEX64("complex64"),
  COMPLEX128("complex128");

  /** The canonical lower-case name. */
  public final String canonicalName;

  DataType(String canonicalName) {
    this.canonicalName = canonicalName;
  }

  private static final ImmutableMap<String, DataType> ALIASES =
      ImmutableMap.of(
          "int", INT64,
          "float", FLOAT32,
          "double", FLOAT64,
          "half", FLOAT16);

  /**
   * Returns the DataType with the given name (case-insensitive), accepting a few common aliases
   * such as {@code "float"} and {@code "double"}.
   *
   * @throws IllegalArgumentException if the name is not recognized
   */
  public static DataType parse(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    for (DataType type : values()) {
      if (type.canonicalName.equals(lower)) {
        return type;
      }
    }
    DataType alias = ALIASES.get(lower);
    if (alias == null) {
      throw new IllegalArgumentException("Unknown data type '" + name + "'");
    }
    return alias;
  }

  @Override
  public String toString() {
    return canonicalName;
  }
}
