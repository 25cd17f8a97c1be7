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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The base class of all syntax tree nodes. Concrete node classes are nested in {@link Expr} and
 * {@link Stmt}; each reports its {@link NodeKind}, which is what visitors dispatch on.
 *
 * <p>Nodes use identity equality, so they can be used as keys when associating analysis results
 * with a particular occurrence in the tree.
 */
public abstract class Node {

  /** The source line this node came from, or 0 if unknown. */
  private int lineNum;

  Node() {}

  /** Returns this node's kind. */
  public abstract NodeKind kind();

  /** Returns the direct children of this node, in source order. */
  public abstract List<Node> children();

  public int lineNum() {
    return lineNum;
  }

  void setLineNum(int lineNum) {
    this.lineNum = lineNum;
  }

  @Override
  public String toString() {
    return SourcePrinter.toSource(this);
  }

  /**
   * Returns a list of the given parts in order, where each part is either a Node, a List of Nodes,
   * or null (skipped).
   */
  static ImmutableList<Node> childList(Object... parts) {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Object part : parts) {
      if (part instanceof Node) {
        builder.add((Node) part);
      } else if (part instanceof List) {
        for (Object element : (List<?>) part) {
          builder.add((Node) element);
        }
      } else {
        assert part == null;
      }
    }
    return builder.build();
  }
}
