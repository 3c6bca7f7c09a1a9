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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.util.concurrent.Futures.getDone;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static com.google.common.util.concurrent.Uninterruptibles.getUninterruptibly;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import needle.Arguments;
import needle.Cleanup;
import needle.ConstructionException;
import needle.Dependant;
import needle.ExecutionPlan;
import needle.ExecutionPlan.Stage;
import needle.ExecutionPlan.Step;
import needle.Factory;
import needle.InactiveScopeException;
import needle.Key;
import needle.MissingBindingException;
import needle.ScopeCache;
import needle.ScopeOrderException;
import needle.ScopeStack;

/**
 * Runs an {@link ExecutionPlan} against the active scopes of a {@link ScopeStack}.
 *
 * <p>Stages run one after another; the steps of a stage are submitted to the executor together
 * and may run in parallel on a multi-threaded executor. Shared values go through their scope's
 * {@link ScopeCache}, so concurrent executions never construct the same shared value twice.
 *
 * <p>A step is skipped when its value was supplied by the caller or is already cached in its
 * scope. Steps that only feed skipped steps are skipped as well.
 *
 * <p>If a factory fails, the steps already running in the same stage are left to finish, no later
 * stage starts, and the execution fails with a {@link ConstructionException}. Values that did
 * complete remain owned by their scope.
 */
public final class PlanExecutor {
  private static final Logger logger = Logger.getLogger(PlanExecutor.class.getName());

  private final Executor executor;

  public PlanExecutor(Executor executor) {
    this.executor = checkNotNull(executor, "executor");
  }

  /** Executes {@code plan} and waits for its result. */
  public <T> T execute(ExecutionPlan<T> plan, ScopeStack scopes, Map<Key<?>, ?> values) {
    ListenableFuture<T> result = executeAsync(plan, scopes, values);
    try {
      return getUninterruptibly(result);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new ConstructionException(plan.rootKey(), e.getCause());
    }
  }

  /**
   * Starts executing {@code plan}. Problems that can be detected before any factory runs, such as
   * an inactive scope or an unwired step with no supplied value, are thrown from this method
   * rather than reported through the returned future.
   *
   * @param values values for keys of the plan that should not be constructed
   * @throws InactiveScopeException if a scope the plan needs has not been entered
   * @throws ScopeOrderException if the active scopes are nested differently than declared
   * @throws MissingBindingException if an unwired step is needed and no value was supplied
   */
  public <T> ListenableFuture<T> executeAsync(
      ExecutionPlan<T> plan, ScopeStack scopes, Map<Key<?>, ?> values) {
    checkNotNull(plan, "plan");
    checkNotNull(scopes, "scopes");
    checkNotNull(values, "values");
    Execution<T> execution = new Execution<T>(plan, frames(plan, scopes), values);
    return execution.start();
  }

  private static ImmutableMap<String, ScopeCache> frames(ExecutionPlan<?> plan, ScopeStack scopes) {
    ImmutableList<ScopeCache> active = scopes.frames();
    int previous = -1;
    for (ScopeCache frame : active) {
      int depth = plan.scopes().indexOf(frame.scope());
      if (depth < 0) {
        continue;
      }
      if (depth < previous) {
        throw new ScopeOrderException(
            "Active scopes "
                + scopes.activeScopes()
                + " are not nested in the declared order "
                + plan.scopes());
      }
      previous = depth;
    }

    Map<String, ScopeCache> frames = new HashMap<>();
    for (ScopeCache frame : active) {
      frames.put(frame.scope(), frame);
    }
    ImmutableMap.Builder<String, ScopeCache> used = ImmutableMap.builder();
    for (String scope : plan.usedScopes()) {
      ScopeCache frame = frames.get(scope);
      if (frame == null) {
        throw new InactiveScopeException(scope, firstStepIn(plan, scope), scopes.activeScopes());
      }
      used.put(scope, frame);
    }
    return used.build();
  }

  private static Key<?> firstStepIn(ExecutionPlan<?> plan, String scope) {
    for (Step step : plan.steps().values()) {
      if (step.scope().equals(scope)) {
        return step.key();
      }
    }
    throw new AssertionError(scope);
  }

  /** The state of one execution of a plan. */
  private final class Execution<T> {
    private final ExecutionPlan<T> plan;
    private final ImmutableMap<String, ScopeCache> frames;

    /** Every value available to factories, by key. */
    private final Map<Key<?>, Object> results = new ConcurrentHashMap<>();

    private final Set<Key<?>> toConstruct = new HashSet<>();

    private final SettableFuture<T> result = SettableFuture.create();

    /** Index of the next stage to run. Only the thread running {@link #advance}'s loop uses it. */
    private int next;

    private final AtomicInteger advanceRequests = new AtomicInteger();

    Execution(
        ExecutionPlan<T> plan, ImmutableMap<String, ScopeCache> frames, Map<Key<?>, ?> values) {
      this.plan = plan;
      this.frames = frames;
      prune(values);
    }

    /**
     * Walks the plan from the root toward the leaves, deciding which steps must run. Consumers
     * live in later stages than their dependencies, so each step is reached after all of its
     * consumers have been decided.
     */
    private void prune(Map<Key<?>, ?> values) {
      Set<Key<?>> needed = new HashSet<>();
      needed.add(plan.rootKey());
      for (Stage stage : plan.stages().reverse()) {
        for (Step step : stage.steps()) {
          Key<?> key = step.key();
          if (!needed.contains(key)) {
            continue;
          }
          Object supplied = values.get(key);
          if (supplied != null) {
            checkArgument(
                key.type().getRawType().isInstance(supplied),
                "%s was supplied for %s",
                supplied,
                key);
            results.put(key, supplied);
            continue;
          }
          if (step.dependant().isShared()) {
            Optional<?> cached = frames.get(step.scope()).getIfPresent(key);
            if (cached.isPresent()) {
              results.put(key, cached.get());
              continue;
            }
          }
          if (step.dependant().isUnwired()) {
            throw new MissingBindingException(key, "is unwired and no value was supplied for it");
          }
          toConstruct.add(key);
          for (Optional<Key<?>> parameter : step.parameters()) {
            if (parameter.isPresent()) {
              needed.add(parameter.get());
            }
          }
        }
      }
    }

    ListenableFuture<T> start() {
      advance();
      return result;
    }

    /**
     * Runs stages until one is still pending, then resumes from that stage's listener. Stages that
     * complete synchronously are handled in a loop, so the call depth does not grow with the number
     * of stages. A request that arrives while another thread, or an enclosing call, is running the
     * loop is picked up by that loop.
     */
    private void advance() {
      if (advanceRequests.getAndIncrement() != 0) {
        return;
      }
      do {
        runReadyStages();
      } while (advanceRequests.decrementAndGet() != 0);
    }

    private void runReadyStages() {
      while (!result.isDone()) {
        if (next == plan.stages().size()) {
          result.set(rootValue());
          return;
        }
        Stage stage = plan.stages().get(next++);
        List<Step> steps = new ArrayList<>();
        for (Step step : stage.steps()) {
          if (toConstruct.contains(step.key())) {
            steps.add(step);
          }
        }
        if (steps.isEmpty()) {
          continue;
        }
        final ListenableFuture<Void> completion = run(stage, steps);
        if (!completion.isDone()) {
          completion.addListener(
              () -> {
                if (succeeded(completion)) {
                  advance();
                }
              },
              directExecutor());
          return;
        }
        if (!succeeded(completion)) {
          return;
        }
      }
    }

    /** Returns true if {@code stage} succeeded, otherwise fails the execution with its cause. */
    private boolean succeeded(ListenableFuture<Void> stage) {
      try {
        getDone(stage);
        return true;
      } catch (ExecutionException e) {
        result.setException(e.getCause());
      } catch (CancellationException e) {
        result.cancel(false);
      }
      return false;
    }

    @SuppressWarnings("unchecked") // the root step produces a T
    private T rootValue() {
      return (T) results.get(plan.rootKey());
    }

    /** Runs the given steps of {@code stage}, completing once every one of them has completed. */
    private ListenableFuture<Void> run(Stage stage, List<Step> steps) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(
            "Running stage " + stage.index() + " of " + plan.rootKey() + ": " + keys(steps));
      }
      final List<ListenableFuture<?>> tasks = new ArrayList<>();
      for (final Step step : steps) {
        ListenableFuture<Void> task = Futures.submitAsync(() -> construct(step), executor);
        // A failed sibling must not cancel steps that are already running.
        tasks.add(Futures.nonCancellationPropagating(task));
      }
      return Futures.whenAllComplete(tasks)
          .call(
              () -> {
                for (ListenableFuture<?> task : tasks) {
                  getDone(task);
                }
                return null;
              },
              directExecutor());
    }

    private ListenableFuture<Void> construct(Step step) {
      return construct(step.dependant(), step);
    }

    /** Constructs one step and records its value once it is available. */
    private <V> ListenableFuture<Void> construct(final Dependant<V> dependant, final Step step) {
      final Key<V> key = dependant.key();
      ScopeCache frame = frames.get(step.scope());
      Cleanup<? super V> cleanup = dependant.cleanup().orElse(null);

      ListenableFuture<V> value;
      if (dependant.isShared()) {
        Callable<V> constructor = () -> invoke(dependant, step);
        value = frame.getOrCreateFuture(key, constructor, cleanup);
      } else {
        V constructed = invoke(dependant, step);
        if (cleanup != null && !frame.registerCleanup(key, constructed, cleanup)) {
          throw new IllegalStateException(
              "Scope " + step.scope() + " exited while " + key + " was being constructed");
        }
        value = Futures.immediateFuture(constructed);
      }
      return Futures.transform(
          value,
          v -> {
            results.put(key, v);
            return null;
          },
          directExecutor());
    }

    private <V> V invoke(Dependant<V> dependant, Step step) {
      Factory<V> factory = dependant.factory().get();
      List<Object> values = new ArrayList<>();
      for (Optional<Key<?>> parameter : step.parameters()) {
        values.add(parameter.isPresent() ? results.get(parameter.get()) : null);
      }
      Arguments arguments = Arguments.of(dependant.parameters(), values);
      V value;
      try {
        value = factory.create(arguments);
      } catch (Exception e) {
        throw new ConstructionException(dependant.key(), e);
      }
      if (value == null) {
        throw new ConstructionException(
            dependant.key(), new NullPointerException("factory returned null"));
      }
      return value;
    }
  }

  private static List<Key<?>> keys(List<Step> steps) {
    List<Key<?>> keys = new ArrayList<>();
    for (Step step : steps) {
      keys.add(step.key());
    }
    return keys;
  }
}
