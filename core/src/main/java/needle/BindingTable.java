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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable set of overrides mapping a {@link Key} to the {@link Dependant} that satisfies it.
 * A binding wins over the default dependant of any parameter that references its key, and over
 * the root dependant itself.
 */
public final class BindingTable {
  private static final BindingTable EMPTY =
      new BindingTable(ImmutableMap.<Key<?>, Dependant<?>>of());

  private final ImmutableMap<Key<?>, Dependant<?>> bindings;

  private BindingTable(ImmutableMap<Key<?>, Dependant<?>> bindings) {
    this.bindings = bindings;
  }

  public static BindingTable empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the dependant bound to {@code key}, if any. */
  @SuppressWarnings("unchecked") // bind() only accepts dependants of a subtype of the key's type
  public <T> Optional<Dependant<? extends T>> get(Key<T> key) {
    return Optional.<Dependant<? extends T>>ofNullable((Dependant<? extends T>) bindings.get(key));
  }

  public boolean contains(Key<?> key) {
    return bindings.containsKey(key);
  }

  public int size() {
    return bindings.size();
  }

  public ImmutableMap<Key<?>, Dependant<?>> asMap() {
    return bindings;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BindingTable && ((BindingTable) o).bindings.equals(bindings);
  }

  @Override
  public int hashCode() {
    return bindings.hashCode();
  }

  @Override
  public String toString() {
    return "BindingTable" + bindings;
  }

  /** Builds a {@link BindingTable}. Later bindings for a key replace earlier ones. */
  public static final class Builder {
    private final Map<Key<?>, Dependant<?>> bindings = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public <T> Builder bind(Key<T> key, Dependant<? extends T> dependant) {
      checkBindable(key, dependant);
      bindings.put(key, dependant);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder bindAll(BindingTable table) {
      bindings.putAll(table.bindings);
      return this;
    }

    public BindingTable build() {
      return bindings.isEmpty() ? EMPTY : new BindingTable(ImmutableMap.copyOf(bindings));
    }
  }

  /** Copies a map whose entries were each checked with {@link #checkBindable}. */
  static BindingTable copyOf(Map<Key<?>, Dependant<?>> bindings) {
    return bindings.isEmpty() ? EMPTY : new BindingTable(ImmutableMap.copyOf(bindings));
  }

  static void checkBindable(Key<?> key, Dependant<?> dependant) {
    checkNotNull(key, "key");
    checkNotNull(dependant, "dependant");
    checkArgument(
        key.type().isSupertypeOf(dependant.key().type()),
        "%s cannot be bound to %s",
        key,
        dependant);
  }
}
