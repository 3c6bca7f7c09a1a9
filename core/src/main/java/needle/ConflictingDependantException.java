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

/**
 * Thrown when two dependants with the same {@link Key} declare different scopes. Dependants are
 * deduplicated by key, so the solver cannot tell which lifetime was meant.
 */
public final class ConflictingDependantException extends ResolutionException {
  public ConflictingDependantException(Dependant<?> first, Dependant<?> second) {
    super(
        "The dependants "
            + first
            + " and "
            + second
            + " have the same key but different scopes ("
            + first.scope()
            + " and "
            + second.scope()
            + ")");
  }
}
