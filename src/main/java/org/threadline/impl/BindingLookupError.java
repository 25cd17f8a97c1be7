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

import com.google.common.collect.ImmutableList;

/**
 * Thrown by a {@link BindingMediator} when asked for a variable that isn't in its name table. This
 * means the lowering code and the accessors it generated disagree, so the current lowering cannot
 * continue.
 */
public class BindingLookupError extends RuntimeException {
  /** The name that was requested. */
  public final String name;

  /** The names the mediator does know, in slot order. */
  public final ImmutableList<String> known;

  public BindingLookupError(String name, ImmutableList<String> known) {
    super(String.format("'%s' not found in %s", name, known));
    this.name = name;
    this.known = known;
  }
}
