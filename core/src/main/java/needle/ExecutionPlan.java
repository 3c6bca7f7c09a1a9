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

package needle;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Optional;

/**
 * The solved form of a request: the closed dependency graph laid out as ordered {@linkplain Stage
 * stages}. Every step appears in a later stage than all of the steps it depends on, and steps
 * within a stage keep the order in which they were first discovered from the root, so solving the
 * same graph twice yields an equal plan.
 *
 * <p>Plans are immutable and may be executed any number of times, from any number of threads.
 */
@AutoValue
public abstract class ExecutionPlan<T> {
  /** The key that was requested. */
  public abstract Key<T> requestedKey();

  /**
   * The key of the step whose value is returned. Differs from {@link #requestedKey()} when the
   * requested key was bound to another dependant.
   */
  public abstract Key<? extends T> rootKey();

  /** The scopes the plan was solved against, outermost first. */
  public abstract ImmutableList<String> scopes();

  public abstract ImmutableList<Stage> stages();

  /** All steps indexed by key, in stage order. */
  @Memoized
  public ImmutableMap<Key<?>, Step> steps() {
    ImmutableMap.Builder<Key<?>, Step> steps = ImmutableMap.builder();
    for (Stage stage : stages()) {
      for (Step step : stage.steps()) {
        steps.put(step.key(), step);
      }
    }
    return steps.build();
  }

  /** The scopes at least one step executes in, outermost first. */
  @Memoized
  public ImmutableSet<String> usedScopes() {
    ImmutableSet.Builder<String> used = ImmutableSet.builder();
    for (String scope : scopes()) {
      for (Step step : steps().values()) {
        if (step.scope().equals(scope)) {
          used.add(scope);
          break;
        }
      }
    }
    return used.build();
  }

  public Step rootStep() {
    return steps().get(rootKey());
  }

  /** Creates a plan. Intended for the solver; the stages must already be in dependency order. */
  public static <T> ExecutionPlan<T> create(
      Key<T> requestedKey,
      Key<? extends T> rootKey,
      List<String> scopes,
      List<Stage> stages) {
    ExecutionPlan<T> plan =
        new AutoValue_ExecutionPlan<T>(
            requestedKey, rootKey, ImmutableList.copyOf(scopes), ImmutableList.copyOf(stages));
    checkArgument(plan.steps().containsKey(rootKey), "%s is not part of the plan", rootKey);
    return plan;
  }

  ExecutionPlan() {}

  /** A group of steps whose parameters were all produced by earlier stages. */
  @AutoValue
  public abstract static class Stage {
    public abstract int index();

    public abstract ImmutableList<Step> steps();

    /** The scopes of this stage's steps, in order of first appearance. */
    @Memoized
    public ImmutableSet<String> scopes() {
      ImmutableSet.Builder<String> scopes = ImmutableSet.builder();
      for (Step step : steps()) {
        scopes.add(step.scope());
      }
      return scopes.build();
    }

    public static Stage create(int index, List<Step> steps) {
      checkArgument(!steps.isEmpty(), "stage %s is empty", index);
      return new AutoValue_ExecutionPlan_Stage(index, ImmutableList.copyOf(steps));
    }

    Stage() {}
  }

  /** The construction of one dependant, labeled with the scope it executes in. */
  @AutoValue
  public abstract static class Step {
    public abstract Dependant<?> dependant();

    public abstract String scope();

    /**
     * The step key each declared parameter resolved to, parallel to {@code
     * dependant().parameters()}. An optional parameter that could not be resolved is empty.
     */
    public abstract ImmutableList<Optional<Key<?>>> parameters();

    public Key<?> key() {
      return dependant().key();
    }

    public static Step create(Dependant<?> dependant, List<Optional<Key<?>>> parameters) {
      checkArgument(
          dependant.parameters().size() == parameters.size(),
          "%s declares %s parameters but %s were resolved",
          dependant,
          dependant.parameters().size(),
          parameters.size());
      return new AutoValue_ExecutionPlan_Step(
          dependant, dependant.scope(), ImmutableList.copyOf(parameters));
    }

    Step() {}
  }
}
