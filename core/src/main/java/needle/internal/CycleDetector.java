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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import needle.CycleException;
import needle.Key;

/**
 * Detects dependency cycles. Parameters are followed depth first in declaration order, so the
 * reported cycle is the first one reachable from the root. The walk keeps its own stack and
 * handles graphs of any depth.
 */
final class CycleDetector {
  private final DependencyGraph graph;
  private final boolean[] visiting;
  private final boolean[] cycleFree;

  /** Position of the next parameter to follow, per node on the active path. */
  private final int[] cursor;

  /** The active path from the root, innermost last. */
  private final List<DependencyGraph.Node> path = new ArrayList<>();
  private final Deque<DependencyGraph.Node> stack = new ArrayDeque<>();

  private CycleDetector(DependencyGraph graph) {
    this.graph = graph;
    this.visiting = new boolean[graph.size()];
    this.cycleFree = new boolean[graph.size()];
    this.cursor = new int[graph.size()];
  }

  /** @throws CycleException if any node can reach itself */
  static void detectCycles(DependencyGraph graph) {
    new CycleDetector(graph).walk(graph.root());
  }

  private void walk(DependencyGraph.Node root) {
    enter(root);
    while (!stack.isEmpty()) {
      DependencyGraph.Node node = stack.peek();
      if (cursor[node.index] == node.parameters.size()) {
        leave(node);
        continue;
      }
      int parameter = node.parameters.get(cursor[node.index]++);
      if (parameter == DependencyGraph.ABSENT || cycleFree[parameter]) {
        continue;
      }
      DependencyGraph.Node dependency = graph.node(parameter);
      if (visiting[parameter]) {
        throw new CycleException(cycleEndingAt(dependency));
      }
      enter(dependency);
    }
  }

  private void enter(DependencyGraph.Node node) {
    visiting[node.index] = true;
    cursor[node.index] = 0;
    path.add(node);
    stack.push(node);
  }

  private void leave(DependencyGraph.Node node) {
    stack.pop();
    path.remove(path.size() - 1);
    visiting[node.index] = false;
    cycleFree[node.index] = true;
  }

  private List<Key<?>> cycleEndingAt(DependencyGraph.Node node) {
    List<Key<?>> cycle = new ArrayList<>();
    for (int i = path.indexOf(node); i < path.size(); i++) {
      cycle.add(path.get(i).key());
    }
    cycle.add(node.key());
    return cycle;
  }
}
