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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The scopes that are currently active, outermost first. Scopes are entered with {@link #enter}
 * and exited through the returned {@link ScopeHandle} in strict last-in, first-out order; exiting
 * a scope releases every value its {@link ScopeCache} owns.
 *
 * <p>A stack is an ordinary object passed to the executor rather than global state. To run
 * independent requests concurrently inside a long-lived scope, {@linkplain #fork() fork} the stack:
 * the fork shares the caches of the scopes active at the time of the fork, and each fork can enter
 * its own inner scopes without affecting the others.
 *
 * <pre>{@code
 * ScopeStack app = ScopeStack.create();
 * try (ScopeHandle appScope = app.enter("app")) {
 *   ScopeStack request = app.fork();
 *   try (ScopeHandle requestScope = request.enter("request")) {
 *     container.execute(plan, request);
 *   }
 * }
 * }</pre>
 */
public final class ScopeStack {
  private static final Logger logger = Logger.getLogger(ScopeStack.class.getName());

  /** Frames shared with the stack this one was forked from. Never exited through this stack. */
  private final ImmutableList<ScopeCache> inherited;

  // Guarded by this.
  private final List<ScopeCache> entered = new ArrayList<>();

  private ScopeStack(ImmutableList<ScopeCache> inherited) {
    this.inherited = inherited;
  }

  /** Returns a stack with no active scopes. */
  public static ScopeStack create() {
    return new ScopeStack(ImmutableList.<ScopeCache>of());
  }

  /**
   * Enters {@code scope} with a fresh, empty cache.
   *
   * @throws DuplicateScopeException if a scope with that name is already active on this stack
   */
  public synchronized ScopeHandle enter(String scope) {
    checkNotNull(scope, "scope");
    checkArgument(!scope.isEmpty(), "scope must not be empty");
    if (find(scope).isPresent()) {
      throw new DuplicateScopeException(scope);
    }
    ScopeCache cache = new ScopeCache(scope);
    entered.add(cache);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Entered scope " + scope + ", active: " + activeScopes());
    }
    return new ScopeHandle(this, cache);
  }

  /**
   * Returns a new stack that starts with this stack's active scopes. Values cached in those scopes
   * are shared with the fork; scopes entered on either stack afterwards are not.
   */
  public synchronized ScopeStack fork() {
    return new ScopeStack(frames());
  }

  /** The names of the active scopes, outermost first. */
  public synchronized ImmutableList<String> activeScopes() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (ScopeCache cache : frames()) {
      names.add(cache.scope());
    }
    return names.build();
  }

  public synchronized boolean isActive(String scope) {
    return find(scope).isPresent();
  }

  /** Returns the cache of the active scope named {@code scope}. */
  public synchronized Optional<ScopeCache> cache(String scope) {
    return find(scope);
  }

  /** The caches of the active scopes, outermost first. */
  public synchronized ImmutableList<ScopeCache> frames() {
    return ImmutableList.<ScopeCache>builder().addAll(inherited).addAll(entered).build();
  }

  void exit(ScopeHandle handle) {
    ScopeCache cache = handle.cache();
    synchronized (this) {
      int index = entered.lastIndexOf(cache);
      if (index < 0) {
        throw new ScopeOrderException("Scope " + cache.scope() + " has already exited");
      }
      if (index != entered.size() - 1) {
        throw new ScopeOrderException(
            "Cannot exit scope "
                + cache.scope()
                + " while "
                + entered.get(entered.size() - 1).scope()
                + " is still active; scopes must exit in reverse order of entry");
      }
      entered.remove(index);
    }
    cache.close();
  }

  private Optional<ScopeCache> find(String scope) {
    for (ScopeCache cache : inherited) {
      if (cache.scope().equals(scope)) {
        return Optional.of(cache);
      }
    }
    for (ScopeCache cache : entered) {
      if (cache.scope().equals(scope)) {
        return Optional.of(cache);
      }
    }
    return Optional.empty();
  }

  @Override
  public synchronized String toString() {
    return "ScopeStack" + activeScopes();
  }
}
