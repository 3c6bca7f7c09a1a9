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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * A reference from a {@link Dependant} to one of the values it needs.
 *
 * <p>The reference names a {@link Key}. When the graph is built, a binding for that key takes
 * precedence; otherwise the {@linkplain #defaultDependant() default} is used. A required
 * reference with neither fails the solve with a {@link MissingBindingException}; an optional one
 * is passed to the factory as absent.
 */
@AutoValue
public abstract class DependencyParameter {
  public abstract Key<?> key();

  public abstract boolean required();

  public abstract Optional<Dependant<?>> defaultDependant();

  /** A required reference that must be satisfied by a binding. */
  public static DependencyParameter required(Key<?> key) {
    return create(key, true, Optional.<Dependant<?>>empty());
  }

  /** A required reference satisfied by {@code dependant} unless its key is bound elsewhere. */
  public static DependencyParameter required(Dependant<?> dependant) {
    return create(dependant.key(), true, Optional.<Dependant<?>>of(dependant));
  }

  /** A reference that is passed as absent when nothing is bound for {@code key}. */
  public static DependencyParameter optional(Key<?> key) {
    return create(key, false, Optional.<Dependant<?>>empty());
  }

  public static DependencyParameter create(
      Key<?> key, boolean required, Optional<Dependant<?>> defaultDependant) {
    checkNotNull(key, "key");
    checkNotNull(defaultDependant, "defaultDependant");
    return new AutoValue_DependencyParameter(key, required, defaultDependant);
  }

  DependencyParameter() {}
}
