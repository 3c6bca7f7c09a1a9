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
 * An entered scope. {@link #exit()} (or {@link #close()}, for try-with-resources) leaves the scope
 * and runs the cleanups of every value it owns.
 */
public final class ScopeHandle implements AutoCloseable {
  private final ScopeStack stack;
  private final ScopeCache cache;

  ScopeHandle(ScopeStack stack, ScopeCache cache) {
    this.stack = stack;
    this.cache = cache;
  }

  public String scope() {
    return cache.scope();
  }

  /** The cache owned by this scope instance. */
  public ScopeCache cache() {
    return cache;
  }

  public boolean isActive() {
    return !cache.isClosed();
  }

  /**
   * Exits this scope.
   *
   * @throws ScopeOrderException if this is not the innermost scope entered on its stack, or if it
   *     has already exited
   * @throws CleanupException if any cleanup failed; the scope has exited regardless
   */
  public void exit() {
    stack.exit(this);
  }

  /** Equivalent to {@link #exit()}. */
  @Override
  public void close() {
    exit();
  }

  @Override
  public String toString() {
    return "ScopeHandle{" + scope() + (isActive() ? "" : ", exited") + "}";
  }
}
