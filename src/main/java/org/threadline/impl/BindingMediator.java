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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Gives access by name to the variables threaded through a lowered branch or loop.
 *
 * <p>A lowered body reads and writes its enclosing function's variables through a getter that
 * returns all of them as one tuple and a setter that takes such a tuple. The tuple's layout is the
 * sorted union of every name list the mediator was given (for example, the names written by each
 * arm of an {@code if}), computed once when it is constructed, so every branch agrees on which slot
 * holds which variable.
 *
 * <p>The getter may return null, meaning there is nothing to thread; {@link #get} then returns an
 * empty list and {@link #set} does nothing.
 */
public final class BindingMediator {

  private final Supplier<? extends @Nullable List<?>> getter;
  private final Consumer<? super List<@Nullable Object>> setter;

  /** The names, in slot order. */
  private final ImmutableList<String> union;

  private final ImmutableMap<String, Integer> slots;

  /**
   * @param nameLists lists of variable names; duplicates within or across lists are fine, and null
   *     lists are treated as empty
   */
  public BindingMediator(
      Supplier<? extends @Nullable List<?>> getter,
      Consumer<? super List<@Nullable Object>> setter,
      List<? extends @Nullable List<String>> nameLists) {
    this.getter = Preconditions.checkNotNull(getter);
    this.setter = Preconditions.checkNotNull(setter);
    ImmutableSortedSet.Builder<String> names = ImmutableSortedSet.naturalOrder();
    for (List<String> list : nameLists) {
      if (list != null) {
        names.addAll(list);
      }
    }
    this.union = names.build().asList();
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 0; i < union.size(); i++) {
      builder.put(union.get(i), i);
    }
    this.slots = builder.buildOrThrow();
  }

  @SafeVarargs
  public static BindingMediator of(
      Supplier<? extends @Nullable List<?>> getter,
      Consumer<? super List<@Nullable Object>> setter,
      List<String>... nameLists) {
    return new BindingMediator(getter, setter, Arrays.asList(nameLists));
  }

  /** Returns the names this mediator knows, in slot order. */
  public ImmutableList<String> union() {
    return union;
  }

  /**
   * Returns the current values of the given variables, in the same order.
   *
   * @throws BindingLookupError if any of {@code names} is not known to this mediator
   */
  public List<@Nullable Object> get(List<String> names) {
    List<?> current = getter.get();
    if (current == null) {
      return ImmutableList.of();
    }
    checkLayout(current);
    int[] indices = slotsOf(names);
    List<@Nullable Object> result = new ArrayList<>(indices.length);
    for (int index : indices) {
      result.add(current.get(index));
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Replaces the values of the given variables, pairing {@code names} with {@code values} by
   * position; unpaired names or values are ignored. The other variables keep their current values.
   *
   * @throws BindingLookupError if any of {@code names} is not known to this mediator
   */
  public void set(List<String> names, List<?> values) {
    List<?> current = getter.get();
    if (current == null) {
      return;
    }
    checkLayout(current);
    int[] indices = slotsOf(names);
    List<@Nullable Object> updated = new ArrayList<>(current);
    int n = Math.min(indices.length, values.size());
    for (int i = 0; i < n; i++) {
      updated.set(indices[i], values.get(i));
    }
    setter.accept(Collections.unmodifiableList(updated));
  }

  private int[] slotsOf(List<String> names) {
    int[] result = new int[names.size()];
    for (int i = 0; i < result.length; i++) {
      String name = names.get(i);
      Integer slot = slots.get(name);
      if (slot == null) {
        throw new BindingLookupError(name, union);
      }
      result[i] = slot;
    }
    return result;
  }

  private void checkLayout(List<?> current) {
    Preconditions.checkState(
        current.size() == union.size(),
        "Getter returned %s values for %s names",
        current.size(),
        union.size());
  }

  @Override
  public String toString() {
    return "BindingMediator" + union;
  }
}
