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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.MapMaker;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import needle.internal.PlanExecutor;
import needle.internal.Solver;

/**
 * Entry point for resolving dependants. A container holds the declared scope order, a mutable
 * registry of bindings, and the executor that runs construction.
 *
 * <pre>{@code
 * Container container = Container.builder().scopes("app", "request").build();
 * ExecutionPlan<Handler> plan = container.solve(handler);
 * ScopeStack scopes = container.newScopeStack();
 * try (ScopeHandle app = scopes.enter("app");
 *     ScopeHandle request = scopes.enter("request")) {
 *   Handler h = container.execute(plan, scopes);
 * }
 * }</pre>
 *
 * <p>Plans returned by {@link #solve} are memoized per root dependant until the bindings change.
 * Containers are safe for use from multiple threads.
 */
public final class Container {
  private static final Logger logger = Logger.getLogger(Container.class.getName());

  private final Solver solver;
  private final PlanExecutor executor;
  @Nullable private final String executionScope;

  // Guarded by this.
  private final Map<Key<?>, Dependant<?>> bindings = new LinkedHashMap<>();
  private BindingTable bindingTable = BindingTable.empty();

  /** Solved plans by root dependant instance. Cleared whenever the bindings change. */
  private final ConcurrentMap<Dependant<?>, ExecutionPlan<?>> plans =
      new MapMaker().weakKeys().makeMap();

  private Container(Builder builder) {
    this.solver = new Solver(builder.scopes);
    this.executor = new PlanExecutor(builder.executor);
    this.executionScope = builder.executionScope;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The declared scopes, outermost first. */
  public ImmutableList<String> scopes() {
    return solver.scopes();
  }

  /**
   * Binds {@code key} to {@code dependant}, replacing any existing binding until the returned
   * registration is closed.
   */
  @CanIgnoreReturnValue
  public <T> Registration bind(Key<T> key, Dependant<? extends T> dependant) {
    BindingTable.checkBindable(key, dependant);
    Dependant<?> previous;
    synchronized (this) {
      previous = bindings.put(key, dependant);
      bindingsChanged();
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Bound " + key + " to " + dependant);
    }
    return new BindingRegistration(key, dependant, previous);
  }

  /** A snapshot of the current bindings. */
  public synchronized BindingTable bindings() {
    return bindingTable;
  }

  /**
   * Solves {@code root} against the current bindings. Solving the same dependant instance again
   * returns the same plan unless the bindings changed in between.
   */
  @SuppressWarnings("unchecked") // plans only maps a Dependant<T> to an ExecutionPlan<T>
  public <T> ExecutionPlan<T> solve(Dependant<T> root) {
    checkNotNull(root, "root");
    BindingTable table = bindings();
    ExecutionPlan<T> plan = (ExecutionPlan<T>) plans.get(root);
    if (plan == null) {
      plan = solver.solve(root, table);
      synchronized (this) {
        // Only remember plans solved against the current bindings.
        if (table == bindingTable) {
          plans.put(root, plan);
        }
      }
    }
    return plan;
  }

  /** Returns an empty scope stack for use with this container. */
  public ScopeStack newScopeStack() {
    return ScopeStack.create();
  }

  /** Executes {@code plan} against the active scopes of {@code scopes}. */
  public <T> T execute(ExecutionPlan<T> plan, ScopeStack scopes) {
    return execute(plan, scopes, ImmutableMap.<Key<?>, Object>of());
  }

  /**
   * Executes {@code plan}, using {@code values} instead of constructing the keys they contain. If
   * this container has an execution scope that is not already active, it is entered for the
   * duration of the call.
   */
  public <T> T execute(ExecutionPlan<T> plan, ScopeStack scopes, Map<Key<?>, ?> values) {
    checkNotNull(scopes, "scopes");
    if (executionScope == null || scopes.isActive(executionScope)) {
      return executor.execute(plan, scopes, values);
    }
    try (ScopeHandle execution = scopes.enter(executionScope)) {
      return executor.execute(plan, scopes, values);
    }
  }

  /**
   * Starts executing {@code plan}. An execution scope entered by this call is exited when the
   * returned future completes.
   */
  public <T> ListenableFuture<T> executeAsync(
      ExecutionPlan<T> plan, ScopeStack scopes, Map<Key<?>, ?> values) {
    checkNotNull(scopes, "scopes");
    if (executionScope == null || scopes.isActive(executionScope)) {
      return executor.executeAsync(plan, scopes, values);
    }
    final ScopeHandle execution = scopes.enter(executionScope);
    ListenableFuture<T> result;
    try {
      result = executor.executeAsync(plan, scopes, values);
    } catch (RuntimeException e) {
      execution.exit();
      throw e;
    }
    result.addListener(
        () -> {
          try {
            execution.exit();
          } catch (ResolutionException e) {
            logger.log(Level.WARNING, "Failed to exit " + execution, e);
          }
        },
        directExecutor());
    return result;
  }

  /** Solves and executes {@code root} in one call. */
  public <T> T resolve(Dependant<T> root, ScopeStack scopes) {
    return execute(solve(root), scopes);
  }

  private void bindingsChanged() {
    bindingTable = BindingTable.copyOf(bindings);
    plans.clear();
  }

  @Override
  public String toString() {
    return "Container{scopes=" + scopes() + ", bindings=" + bindings().size() + "}";
  }

  /** Undoes a {@link Container#bind}. Closing it more than once has no further effect. */
  public interface Registration extends AutoCloseable {
    Key<?> key();

    /**
     * Removes the binding, restoring the one it replaced. Has no effect if the key has been bound
     * again since.
     */
    @Override
    void close();
  }

  private final class BindingRegistration implements Registration {
    private final Key<?> key;
    private final Dependant<?> dependant;
    @Nullable private final Dependant<?> previous;
    private boolean closed;

    BindingRegistration(Key<?> key, Dependant<?> dependant, @Nullable Dependant<?> previous) {
      this.key = key;
      this.dependant = dependant;
      this.previous = previous;
    }

    @Override
    public Key<?> key() {
      return key;
    }

    @Override
    public void close() {
      synchronized (Container.this) {
        if (closed) {
          return;
        }
        closed = true;
        if (bindings.get(key) != dependant) {
          return;
        }
        if (previous == null) {
          bindings.remove(key);
        } else {
          bindings.put(key, previous);
        }
        bindingsChanged();
      }
    }

    @Override
    public String toString() {
      return "Registration{" + key + " -> " + dependant + "}";
    }
  }

  /** Configures a {@link Container}. */
  public static final class Builder {
    @Nullable private ImmutableList<String> scopes;
    @Nullable private String executionScope;
    private Executor executor = directExecutor();

    private Builder() {}

    /** Declares every scope name, outermost first. Required. */
    @CanIgnoreReturnValue
    public Builder scopes(String... scopes) {
      return scopes(Arrays.asList(scopes));
    }

    @CanIgnoreReturnValue
    public Builder scopes(Iterable<String> scopes) {
      this.scopes = ImmutableList.copyOf(scopes);
      return this;
    }

    /**
     * Names a scope that each execution enters for its own duration when it is not already
     * active. Values in it live for exactly one execution.
     */
    @CanIgnoreReturnValue
    public Builder executionScope(String executionScope) {
      this.executionScope = checkNotNull(executionScope, "executionScope");
      return this;
    }

    /**
     * The executor that runs factories. Defaults to {@link
     * com.google.common.util.concurrent.MoreExecutors#directExecutor()}, which constructs
     * everything on the calling thread.
     */
    @CanIgnoreReturnValue
    public Builder executor(Executor executor) {
      this.executor = checkNotNull(executor, "executor");
      return this;
    }

    public Container build() {
      checkState(scopes != null, "scopes must be declared");
      checkArgument(
          executionScope == null || scopes.contains(executionScope),
          "execution scope %s is not one of %s",
          executionScope,
          scopes);
      return new Container(this);
    }
  }
}
