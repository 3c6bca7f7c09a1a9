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
 * Thrown when a {@link Factory} fails. The original failure is the {@linkplain #getCause cause}.
 */
public final class ConstructionException extends ResolutionException {
  private final Key<?> key;

  public ConstructionException(Key<?> key, Throwable cause) {
    super("Failed to construct " + key + ": " + cause, cause);
    this.key = key;
  }

  /** The key whose factory failed. */
  public Key<?> key() {
    return key;
  }
}
