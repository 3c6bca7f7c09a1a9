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
import static com.google.common.util.concurrent.Futures.getDone;
import static com.google.common.util.concurrent.Uninterruptibles.getUninterruptibly;

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * The values owned by one instance of a scope.
 *
 * <p>{@link #getOrCreate} guarantees single-flight construction: while a key is being constructed,
 * every other caller for that key receives the same pending result instead of starting a second
 * construction. A failed construction is forgotten so that a later caller may retry it; a
 * successful one is kept until the scope exits.
 *
 * <p>Values registered with a {@link Cleanup} are released in reverse construction order when the
 * scope exits. After that the cache is closed and rejects further use. A construction that
 * completes after the scope exited is released at once and fails with an {@link
 * IllegalStateException}.
 */
public final class ScopeCache {
  private static final Logger logger = Logger.getLogger(ScopeCache.class.getName());

  private final String scope;
  private final ConcurrentMap<Key<?>, ListenableFuture<?>> entries = new ConcurrentHashMap<>();

  // Guarded by itself. Also guards closed.
  private final Deque<Registration<?>> registrations = new ArrayDeque<>();
  private boolean closed;

  ScopeCache(String scope) {
    this.scope = checkNotNull(scope, "scope");
  }

  public String scope() {
    return scope;
  }

  /**
   * Returns the value for {@code key}, constructing it with {@code constructor} if no construction
   * has completed or is in flight. Blocks while another caller's construction of the same key is
   * in flight.
   *
   * @throws ConstructionException if the construction this call observed failed with a checked
   *     exception; unchecked failures are rethrown as-is
   */
  public <T> T getOrCreate(Key<T> key, Callable<? extends T> constructor) {
    return getOrCreate(key, constructor, null);
  }

  /** Like {@link #getOrCreate(Key, Callable)}, registering {@code cleanup} for a new value. */
  public <T> T getOrCreate(
      Key<T> key, Callable<? extends T> constructor, @Nullable Cleanup<? super T> cleanup) {
    ListenableFuture<T> future = getOrCreateFuture(key, constructor, cleanup);
    try {
      return getUninterruptibly(future);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new ConstructionException(key, e.getCause());
    }
  }

  /**
   * Returns a future for the value of {@code key}. If this call wins the right to construct the
   * value, {@code constructor} runs on the calling thread before this method returns; otherwise the
   * returned future is the pending or completed result of the earlier construction.
   *
   * <p>Cancelling the returned future never cancels the construction, which other callers may be
   * waiting on.
   */
  public <T> ListenableFuture<T> getOrCreateFuture(
      Key<T> key, Callable<? extends T> constructor, @Nullable Cleanup<? super T> cleanup) {
    checkNotNull(key, "key");
    checkNotNull(constructor, "constructor");
    checkOpen();
    ListenableFuture<T> existing = lookup(key);
    if (existing == null) {
      SettableFuture<T> pending = SettableFuture.create();
      @SuppressWarnings("unchecked") // entries only maps Key<T> to futures of T
      ListenableFuture<T> raced = (ListenableFuture<T>) entries.putIfAbsent(key, pending);
      if (raced == null) {
        construct(key, pending, constructor, cleanup);
        return pending.isDone() ? pending : Futures.nonCancellationPropagating(pending);
      }
      existing = raced;
    }
    return existing.isDone() ? existing : Futures.nonCancellationPropagating(existing);
  }

  /** Returns the completed value of {@code key}, if one is cached. */
  public <T> Optional<T> getIfPresent(Key<T> key) {
    ListenableFuture<T> future = lookup(key);
    if (future == null || !future.isDone() || future.isCancelled()) {
      return Optional.empty();
    }
    try {
      return Optional.of(getDone(future));
    } catch (ExecutionException e) {
      return Optional.empty(); // failed constructions are not cached
    }
  }

  /** Returns true if a value for {@code key} has been constructed successfully. */
  public boolean contains(Key<?> key) {
    return getIfPresent(key).isPresent();
  }

  /** Returns true if a construction of {@code key} has started but not yet completed. */
  public boolean isInFlight(Key<?> key) {
    ListenableFuture<?> future = entries.get(key);
    return future != null && !future.isDone();
  }

  /**
   * Registers {@code cleanup} to release {@code value} when this scope exits. Used for values that
   * are owned by the scope without being cached, such as unshared dependants. If the scope has
   * already exited, the cleanup runs immediately.
   *
   * @return false if the scope had already exited and the value has been released
   */
  @CanIgnoreReturnValue
  public <T> boolean registerCleanup(Key<T> key, T value, Cleanup<? super T> cleanup) {
    checkNotNull(key, "key");
    checkNotNull(value, "value");
    checkNotNull(cleanup, "cleanup");
    Registration<T> registration = new Registration<T>(key, value, cleanup);
    if (register(registration)) {
      return true;
    }
    releaseLate(registration);
    return false;
  }

  public boolean isClosed() {
    synchronized (registrations) {
      return closed;
    }
  }

  /**
   * Closes this cache and runs every registered cleanup, most recently constructed first. All
   * cleanups run even if some fail.
   *
   * @throws CleanupException if any cleanup failed
   */
  void close() {
    List<Registration<?>> toRelease;
    synchronized (registrations) {
      if (closed) {
        return;
      }
      closed = true;
      toRelease = new ArrayList<>(registrations);
      registrations.clear();
    }
    entries.clear();
    List<Throwable> failures = new ArrayList<>();
    for (int i = toRelease.size() - 1; i >= 0; i--) {
      Registration<?> registration = toRelease.get(i);
      try {
        registration.release();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Cleanup of " + registration.key + " failed", e);
        failures.add(e);
      }
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Exited scope " + scope + ", ran " + toRelease.size() + " cleanup(s)");
    }
    if (!failures.isEmpty()) {
      throw new CleanupException(scope, failures);
    }
  }

  @SuppressWarnings("unchecked") // entries only maps Key<T> to futures of T
  @Nullable
  private <T> ListenableFuture<T> lookup(Key<T> key) {
    return (ListenableFuture<T>) entries.get(key);
  }

  private <T> void construct(
      Key<T> key,
      SettableFuture<T> pending,
      Callable<? extends T> constructor,
      @Nullable Cleanup<? super T> cleanup) {
    T value;
    try {
      value = checkNotNull(constructor.call(), "%s was constructed as null", key);
    } catch (Throwable t) {
      entries.remove(key, pending);
      pending.setException(t);
      return;
    }

    Registration<T> registration =
        cleanup == null ? null : new Registration<T>(key, value, cleanup);
    boolean open;
    if (registration != null) {
      open = register(registration);
    } else {
      open = !isClosed();
    }
    if (!open) {
      // The scope exited while the value was being constructed; it is released, never handed out.
      entries.remove(key, pending);
      if (registration != null) {
        releaseLate(registration);
      }
      pending.setException(
          new IllegalStateException(
              "Scope " + scope + " exited while " + key + " was being constructed"));
      return;
    }
    pending.set(value);
  }

  /** Adds {@code registration} unless this cache is closed. */
  private boolean register(Registration<?> registration) {
    synchronized (registrations) {
      if (closed) {
        return false;
      }
      registrations.addLast(registration);
      return true;
    }
  }

  private void releaseLate(Registration<?> registration) {
    try {
      registration.release();
    } catch (Exception e) {
      logger.log(
          Level.SEVERE,
          registration.key + " completed after scope " + scope + " exited; its cleanup failed",
          e);
    }
  }

  private void checkOpen() {
    if (isClosed()) {
      throw new IllegalStateException("Scope " + scope + " has exited");
    }
  }

  @Override
  public String toString() {
    return "ScopeCache{" + scope + ", " + entries.size() + " entries}";
  }

  private static final class Registration<T> {
    final Key<T> key;
    final T value;
    final Cleanup<? super T> cleanup;

    Registration(Key<T> key, T value, Cleanup<? super T> cleanup) {
      this.key = key;
      this.value = value;
      this.cleanup = cleanup;
    }

    void release() throws Exception {
      cleanup.release(value);
    }
  }
}
