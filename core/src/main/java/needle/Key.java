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

import com.google.auto.value.AutoValue;
import com.google.common.reflect.TypeToken;
import java.util.Optional;

/**
 * A {@linkplain TypeToken type} and an optional qualifier that together identify what a {@link
 * Dependant} satisfies. Two keys are equal when both their types and their qualifiers are equal;
 * this is the only notion of identity the solver uses.
 *
 * <p>Primitive types are boxed, so {@code Key.get(int.class)} and {@code Key.get(Integer.class)}
 * are the same key.
 */
@AutoValue
public abstract class Key<T> {
  /** The type represented by this key. */
  public abstract TypeToken<T> type();

  /** A name that distinguishes several keys of the same type, such as two {@code String}s. */
  public abstract Optional<String> qualifier();

  public static <T> Key<T> get(Class<T> type) {
    return get(TypeToken.of(type));
  }

  public static <T> Key<T> get(Class<T> type, String qualifier) {
    return get(TypeToken.of(type), qualifier);
  }

  public static <T> Key<T> get(TypeToken<T> type) {
    return new AutoValue_Key<T>(type.wrap(), Optional.<String>empty());
  }

  public static <T> Key<T> get(TypeToken<T> type, String qualifier) {
    checkNotNull(qualifier, "qualifier");
    checkArgument(!qualifier.isEmpty(), "qualifier must not be empty");
    return new AutoValue_Key<T>(type.wrap(), Optional.of(qualifier));
  }

  /** Returns this key's qualifier and type, formatted like {@code @name/java.lang.String}. */
  @Override
  public final String toString() {
    return qualifier().isPresent() ? "@" + qualifier().get() + "/" + type() : type().toString();
  }

  Key() {}
}
