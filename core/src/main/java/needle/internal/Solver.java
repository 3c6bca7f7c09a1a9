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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import needle.BindingTable;
import needle.Dependant;
import needle.ExecutionPlan;
import needle.Key;
import needle.ScopeMismatchException;

/**
 * Turns a root {@link Dependant} into an {@link ExecutionPlan}.
 *
 * <p>The graph is fully validated before a plan is produced: every required key must be bound or
 * defaulted, every scope must be declared, the graph must be acyclic, and no dependant may depend
 * on a value from a shorter-lived scope. A dependant may depend on values of its own scope or of
 * any enclosing one.
 *
 * <p>Steps are staged by their longest distance from a leaf, and steps within a stage keep their
 * breadth-first discovery order, so the same request always produces an equal plan.
 */
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  private final ImmutableList<String> scopes;

  /** @param scopes every scope name, outermost first */
  public Solver(Iterable<String> scopes) {
    this.scopes = ImmutableList.copyOf(scopes);
    checkArgument(!this.scopes.isEmpty(), "at least one scope must be declared");
    checkArgument(
        ImmutableSet.copyOf(this.scopes).size() == this.scopes.size(),
        "duplicate scope in %s",
        this.scopes);
  }

  /** The declared scopes, outermost first. */
  public ImmutableList<String> scopes() {
    return scopes;
  }

  public <T> ExecutionPlan<T> solve(Dependant<T> root, BindingTable bindings) {
    DependencyGraph graph = GraphBuilder.build(root, bindings);
    checkScopesDeclared(graph);
    CycleDetector.detectCycles(graph);
    checkScopeLifetimes(graph);
    ImmutableList<ExecutionPlan.Stage> stages = stage(graph);

    // The bound root satisfies the requested key, which BindingTable checks on bind.
    @SuppressWarnings("unchecked")
    Key<? extends T> rootKey = (Key<? extends T>) graph.root().key();
    ExecutionPlan<T> plan = ExecutionPlan.create(root.key(), rootKey, scopes, stages);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Solved " + root.key() + ": " + graph.size() + " steps in " + stages.size() + " stages");
    }
    return plan;
  }

  private void checkScopesDeclared(DependencyGraph graph) {
    for (DependencyGraph.Node node : graph.nodes()) {
      if (!scopes.contains(node.scope())) {
        throw new ScopeMismatchException(
            node.key() + " is in scope " + node.scope() + ", which is not one of " + scopes);
      }
    }
  }

  private void checkScopeLifetimes(DependencyGraph graph) {
    for (DependencyGraph.Node node : graph.nodes()) {
      int depth = scopes.indexOf(node.scope());
      for (int parameter : node.parameters) {
        if (parameter == DependencyGraph.ABSENT) {
          continue;
        }
        DependencyGraph.Node dependency = graph.node(parameter);
        if (scopes.indexOf(dependency.scope()) > depth) {
          throw new ScopeMismatchException(
              node.key()
                  + " in scope "
                  + node.scope()
                  + " cannot depend on "
                  + dependency.key()
                  + " in shorter-lived scope "
                  + dependency.scope());
        }
      }
    }
  }

  private static ImmutableList<ExecutionPlan.Stage> stage(DependencyGraph graph) {
    int[] levels = levels(graph);
    List<List<ExecutionPlan.Step>> byLevel = new ArrayList<>();
    for (DependencyGraph.Node node : graph.nodes()) {
      int level = levels[node.index];
      while (byLevel.size() <= level) {
        byLevel.add(new ArrayList<ExecutionPlan.Step>());
      }
      byLevel.get(level).add(step(graph, node));
    }

    ImmutableList.Builder<ExecutionPlan.Stage> stages = ImmutableList.builder();
    for (int i = 0; i < byLevel.size(); i++) {
      stages.add(ExecutionPlan.Stage.create(i, byLevel.get(i)));
    }
    return stages.build();
  }

  /**
   * Computes each node's longest distance from a leaf in post order, using an explicit stack. The
   * graph is known to be acyclic, so a node is never on the stack twice.
   */
  private static int[] levels(DependencyGraph graph) {
    int[] levels = new int[graph.size()];
    Arrays.fill(levels, -1);
    Deque<DependencyGraph.Node> stack = new ArrayDeque<>();
    for (DependencyGraph.Node start : graph.nodes()) {
      if (levels[start.index] >= 0) {
        continue;
      }
      stack.push(start);
      while (!stack.isEmpty()) {
        DependencyGraph.Node node = stack.peek();
        int level = 0;
        boolean ready = true;
        for (int parameter : node.parameters) {
          if (parameter == DependencyGraph.ABSENT) {
            continue;
          }
          if (levels[parameter] < 0) {
            stack.push(graph.node(parameter));
            ready = false;
            break;
          }
          level = Math.max(level, levels[parameter] + 1);
        }
        if (ready) {
          stack.pop();
          levels[node.index] = level;
        }
      }
    }
    return levels;
  }

  private static ExecutionPlan.Step step(DependencyGraph graph, DependencyGraph.Node node) {
    List<Optional<Key<?>>> parameters = new ArrayList<>();
    for (int parameter : node.parameters) {
      parameters.add(
          parameter == DependencyGraph.ABSENT
              ? Optional.<Key<?>>empty()
              : Optional.<Key<?>>of(graph.node(parameter).key()));
    }
    return ExecutionPlan.Step.create(node.dependant, parameters);
  }
}
