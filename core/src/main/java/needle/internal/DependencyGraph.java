/*
 * Copyright (C) 2026 The Needle Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package needle.internal;

import com.google.common.collect.ImmutableList;
import needle.Dependant;
import needle.Key;

/**
 * A closed dependency graph stored as an arena: nodes are addressed by their index, which is the
 * order in which they were first discovered from the root. The root is always node 0.
 */
final class DependencyGraph {
  /** Marks an optional parameter that nothing satisfies. */
  static final int ABSENT = -1;

  private final ImmutableList<Node> nodes;

  DependencyGraph(ImmutableList<Node> nodes) {
    this.nodes = nodes;
  }

  Node root() {
    return nodes.get(0);
  }

  Node node(int index) {
    return nodes.get(index);
  }

  ImmutableList<Node> nodes() {
    return nodes;
  }

  int size() {
    return nodes.size();
  }

  static final class Node {
    final int index;
    final Dependant<?> dependant;

    /** Node index of each declared parameter, or {@link #ABSENT}. */
    final ImmutableList<Integer> parameters;

    Node(int index, Dependant<?> dependant, ImmutableList<Integer> parameters) {
      this.index = index;
      this.dependant = dependant;
      this.parameters = parameters;
    }

    Key<?> key() {
      return dependant.key();
    }

    String scope() {
      return dependant.scope();
    }

    @Override
    public String toString() {
      return index + ":" + dependant.key();
    }
  }
}
