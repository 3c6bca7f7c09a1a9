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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import needle.BindingTable;
import needle.ConflictingDependantException;
import needle.Dependant;
import needle.DependencyParameter;
import needle.Key;
import needle.MissingBindingException;

/**
 * Links a root {@link Dependant} to everything it transitively needs. Each parameter is replaced
 * by its binding when one exists, otherwise by its default; nodes are deduplicated by key and
 * numbered breadth-first from the root.
 *
 * <p>Unsatisfied keys are collected rather than failing on the first one, so a single {@link
 * MissingBindingException} reports them all.
 */
final class GraphBuilder {
  private final BindingTable bindings;

  /** Every dependant seen so far, in discovery order. */
  private final List<Dependant<?>> dependants = new ArrayList<>();
  private final Map<Key<?>, Integer> indices = new HashMap<>();
  private final Map<Key<?>, Key<?>> missing = new LinkedHashMap<>();

  private GraphBuilder(BindingTable bindings) {
    this.bindings = bindings;
  }

  static DependencyGraph build(Dependant<?> root, BindingTable bindings) {
    checkNotNull(root, "root");
    checkNotNull(bindings, "bindings");
    return new GraphBuilder(bindings).link(root);
  }

  private DependencyGraph link(Dependant<?> requestedRoot) {
    Optional<? extends Dependant<?>> boundRoot = resolve(requestedRoot.key());
    register(boundRoot.isPresent() ? boundRoot.get() : requestedRoot);

    // Nodes are appended while iterating, which makes this a breadth-first walk.
    List<ImmutableList<Integer>> edges = new ArrayList<>();
    for (int i = 0; i < dependants.size(); i++) {
      Dependant<?> dependant = dependants.get(i);
      ImmutableList.Builder<Integer> parameters = ImmutableList.builder();
      for (DependencyParameter parameter : dependant.parameters()) {
        parameters.add(linkParameter(dependant, parameter));
      }
      edges.add(parameters.build());
    }

    if (!missing.isEmpty()) {
      throw new MissingBindingException(missing);
    }

    ImmutableList.Builder<DependencyGraph.Node> nodes = ImmutableList.builder();
    for (int i = 0; i < dependants.size(); i++) {
      nodes.add(new DependencyGraph.Node(i, dependants.get(i), edges.get(i)));
    }
    return new DependencyGraph(nodes.build());
  }

  private int linkParameter(Dependant<?> requiredBy, DependencyParameter parameter) {
    Optional<? extends Dependant<?>> target = resolve(parameter.key());
    if (!target.isPresent()) {
      target = parameter.defaultDependant();
    }
    if (target.isPresent()) {
      return register(target.get());
    }
    if (parameter.required()) {
      missing.putIfAbsent(parameter.key(), requiredBy.key());
    }
    return DependencyGraph.ABSENT;
  }

  private Optional<? extends Dependant<?>> resolve(Key<?> key) {
    return bindings.get(key);
  }

  private int register(Dependant<?> dependant) {
    Integer existing = indices.get(dependant.key());
    if (existing != null) {
      Dependant<?> registered = dependants.get(existing);
      if (!registered.scope().equals(dependant.scope())) {
        throw new ConflictingDependantException(registered, dependant);
      }
      return existing;
    }
    int index = dependants.size();
    dependants.add(dependant);
    indices.put(dependant.key(), index);
    return index;
  }
}
