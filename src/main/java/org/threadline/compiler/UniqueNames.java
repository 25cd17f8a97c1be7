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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.threadline.ast.FunctionRole;
import org.threadline.ast.QualifiedNames;

/**
 * Generates identifiers of the form {@code <prefix>_<n>}, with a separate counter for each prefix.
 * Safe for concurrent use; no two calls on the same instance return the same name.
 */
public final class UniqueNames {

  /** A process-wide generator, used when no other is specified. */
  public static final UniqueNames GLOBAL = new UniqueNames();

  private final ConcurrentHashMap<String, AtomicInteger> counters = new ConcurrentHashMap<>();

  /** Returns the next identifier for the given prefix. */
  public String generate(String prefix) {
    Preconditions.checkArgument(QualifiedNames.isIdentifier(prefix), "Bad prefix '%s'", prefix);
    int n = counters.computeIfAbsent(prefix, k -> new AtomicInteger()).getAndIncrement();
    return prefix + "_" + n;
  }

  /** Returns a new name for a function that will hold a lowered body with the given role. */
  public String forRole(FunctionRole role) {
    Preconditions.checkArgument(role.isControlFlowBody(), "%s functions are not generated", role);
    return generate(role.prefix);
  }
}
