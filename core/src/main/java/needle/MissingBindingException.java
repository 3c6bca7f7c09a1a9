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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Thrown when a required key has neither a binding nor a default dependant. Every unsatisfied key
 * found while building the graph is reported at once.
 */
public final class MissingBindingException extends ResolutionException {
  private final ImmutableList<Key<?>> missingKeys;
  private final ImmutableMap<Key<?>, Key<?>> requiredBy;

  /** @param requiredBy each missing key mapped to the key of the dependant that needs it */
  public MissingBindingException(Map<Key<?>, Key<?>> requiredBy) {
    super(message(requiredBy));
    this.requiredBy = ImmutableMap.copyOf(requiredBy);
    this.missingKeys = this.requiredBy.keySet().asList();
  }

  /** Reports a key that was solved but cannot be satisfied when the plan executes. */
  public MissingBindingException(Key<?> key, String reason) {
    super(key + " " + reason);
    this.missingKeys = ImmutableList.<Key<?>>of(key);
    this.requiredBy = ImmutableMap.of();
  }

  /** The first unsatisfied key. */
  public Key<?> key() {
    return missingKeys().get(0);
  }

  public ImmutableList<Key<?>> missingKeys() {
    return missingKeys;
  }

  /** Maps each missing key to the key that required it. Empty for execution-time failures. */
  public ImmutableMap<Key<?>, Key<?>> requiredBy() {
    return requiredBy;
  }

  private static String message(Map<Key<?>, Key<?>> requiredBy) {
    StringBuilder message = new StringBuilder("Missing bindings:");
    for (Map.Entry<Key<?>, Key<?>> entry : requiredBy.entrySet()) {
      message
          .append("\n  ")
          .append(entry.getKey())
          .append(" has no binding and no default, required by ")
          .append(entry.getValue());
    }
    return message.toString();
  }
}
