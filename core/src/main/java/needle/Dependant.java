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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Describes how to produce the value for a {@link Key}: the {@link Factory} to call, the
 * parameters it needs, the scope whose lifetime the value shares, and whether that value is
 * cached within the scope.
 *
 * <p>Dependants are immutable. Equality is defined by {@link #key()} alone, so two dependants built
 * independently for the same key are interchangeable as far as the solver is concerned.
 *
 * <p>A dependant built without a factory is <em>unwired</em>: its value must be supplied by the
 * caller when the plan is executed, for instance an incoming request.
 */
public final class Dependant<T> {
  private final Key<T> key;
  @Nullable private final Factory<T> factory;
  private final ImmutableList<DependencyParameter> parameters;
  private final String scope;
  private final boolean shared;
  @Nullable private final Cleanup<? super T> cleanup;

  private Dependant(Builder<T> builder) {
    this.key = builder.key;
    this.factory = builder.factory;
    this.parameters = builder.parameters.build();
    this.scope = builder.scope;
    this.shared = builder.shared;
    this.cleanup = builder.cleanup;
  }

  public Key<T> key() {
    return key;
  }

  /** The factory, or empty for an unwired dependant. */
  public Optional<Factory<T>> factory() {
    return Optional.ofNullable(factory);
  }

  public ImmutableList<DependencyParameter> parameters() {
    return parameters;
  }

  /** The name of the scope that owns values of this dependant. */
  public String scope() {
    return scope;
  }

  /**
   * Returns true if the value is cached in its scope and reused by every later request in that
   * scope instance. Unshared dependants are constructed once per execution that needs them.
   */
  public boolean isShared() {
    return shared;
  }

  public Optional<Cleanup<? super T>> cleanup() {
    return Optional.<Cleanup<? super T>>ofNullable(cleanup);
  }

  public boolean isUnwired() {
    return factory == null;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Dependant && ((Dependant<?>) o).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return "Dependant{key=" + key + ", scope=" + scope + (shared ? "" : ", unshared") + "}";
  }

  public static <T> Builder<T> builder(Key<T> key) {
    return new Builder<T>(key);
  }

  public static <T> Builder<T> builder(Class<T> type) {
    return new Builder<T>(Key.get(type));
  }

  /** Returns a dependant whose value is always supplied at execution time. */
  public static <T> Dependant<T> unwired(Key<T> key, String scope) {
    return builder(key).scope(scope).build();
  }

  /** Builds {@link Dependant} instances. Every dependant needs a scope. */
  public static final class Builder<T> {
    private final Key<T> key;
    @Nullable private Factory<T> factory;
    private final ImmutableList.Builder<DependencyParameter> parameters = ImmutableList.builder();
    @Nullable private String scope;
    private boolean shared = true;
    @Nullable private Cleanup<? super T> cleanup;

    private Builder(Key<T> key) {
      this.key = checkNotNull(key, "key");
    }

    @CanIgnoreReturnValue
    public Builder<T> factory(Factory<T> factory) {
      this.factory = checkNotNull(factory, "factory");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> scope(String scope) {
      checkNotNull(scope, "scope");
      checkArgument(!scope.isEmpty(), "scope must not be empty");
      this.scope = scope;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> shared(boolean shared) {
      this.shared = shared;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> cleanup(Cleanup<? super T> cleanup) {
      this.cleanup = checkNotNull(cleanup, "cleanup");
      return this;
    }

    /** Adds a required parameter that must be satisfied by a binding. */
    @CanIgnoreReturnValue
    public Builder<T> dependsOn(Key<?> key) {
      return addParameter(DependencyParameter.required(key));
    }

    /** Adds a required parameter defaulting to {@code dependant}. */
    @CanIgnoreReturnValue
    public Builder<T> dependsOn(Dependant<?> dependant) {
      return addParameter(DependencyParameter.required(dependant));
    }

    @CanIgnoreReturnValue
    public Builder<T> optionallyDependsOn(Key<?> key) {
      return addParameter(DependencyParameter.optional(key));
    }

    @CanIgnoreReturnValue
    public Builder<T> addParameter(DependencyParameter parameter) {
      parameters.add(checkNotNull(parameter, "parameter"));
      return this;
    }

    public Dependant<T> build() {
      checkState(scope != null, "%s has no scope", key);
      checkState(
          factory != null || cleanup == null,
          "%s is unwired and cannot declare a cleanup",
          key);
      return new Dependant<T>(this);
    }
  }
}
