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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The resolved parameter values handed to a {@link Factory}, in the order the parameters were
 * declared on the {@link Dependant}. Values of optional parameters that could not be resolved are
 * absent.
 */
public final class Arguments {
  private final ImmutableList<DependencyParameter> parameters;
  private final List<Object> values;

  private Arguments(ImmutableList<DependencyParameter> parameters, List<Object> values) {
    this.parameters = parameters;
    this.values = values;
  }

  /**
   * Creates the arguments for a factory call. {@code values} must be parallel to {@code
   * parameters}, with {@code null} marking an absent optional value.
   */
  public static Arguments of(List<DependencyParameter> parameters, List<?> values) {
    checkArgument(
        parameters.size() == values.size(),
        "%s parameters but %s values",
        parameters.size(),
        values.size());
    for (int i = 0; i < parameters.size(); i++) {
      checkArgument(
          values.get(i) != null || !parameters.get(i).required(),
          "no value for required parameter %s",
          parameters.get(i).key());
    }
    return new Arguments(
        ImmutableList.copyOf(parameters), Collections.unmodifiableList(new ArrayList<>(values)));
  }

  public int size() {
    return values.size();
  }

  /** Returns the value at {@code index}, or null if that optional parameter is absent. */
  @SuppressWarnings("unchecked") // the caller knows the parameter's type
  @Nullable
  public <V> V get(int index) {
    checkElementIndex(index, values.size());
    return (V) values.get(index);
  }

  /**
   * Returns the value for the first parameter declared with {@code key}.
   *
   * @throws IllegalArgumentException if no parameter was declared with that key
   * @throws IllegalStateException if the parameter is optional and absent
   */
  public <V> V get(Key<V> key) {
    Optional<V> value = getOptional(key);
    if (!value.isPresent()) {
      throw new IllegalStateException("optional parameter " + key + " is absent");
    }
    return value.get();
  }

  /** Returns the value for the first parameter declared with {@code key}, if present. */
  @SuppressWarnings("unchecked") // the executor resolved this value for the key
  public <V> Optional<V> getOptional(Key<V> key) {
    checkNotNull(key, "key");
    for (int i = 0; i < parameters.size(); i++) {
      if (parameters.get(i).key().equals(key)) {
        return Optional.ofNullable((V) values.get(i));
      }
    }
    throw new IllegalArgumentException("no parameter declared for " + key);
  }

  @Override
  public String toString() {
    return "Arguments" + values;
  }
}
