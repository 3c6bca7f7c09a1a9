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


package needle.testing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;
import needle.Arguments;
import needle.Dependant;
import needle.Factory;
import needle.Key;

/**
 * Builds string-valued dependants for tests. A node's value is its name followed by the values of
 * its arguments, so {@code A} depending on {@code B} and {@code C} produces {@code "A(B, C)"}; an
 * absent optional argument prints as {@code -}. Every factory call is counted.
 *
 * <p>{@link #chain} builds long integer-valued chains for exercising deep graphs.
 */
public final class Nodes {
  private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

  public static Key<String> key(String name) {
    return Key.get(String.class, name);
  }

  /** Returns a builder for {@code name} in {@code scope} with a counting factory. */
  public Dependant.Builder<String> node(String name, String scope) {
    return Dependant.builder(key(name)).scope(scope).factory(factory(name));
  }

  public Factory<String> factory(final String name) {
    return arguments -> {
      calls(name).incrementAndGet();
      return format(name, arguments);
    };
  }

  /** How many times the factory of {@code name} has run. */
  public int callCount(String name) {
    return calls(name).get();
  }

  private AtomicInteger calls(String name) {
    AtomicInteger count = calls.get(name);
    if (count == null) {
      calls.putIfAbsent(name, new AtomicInteger());
      count = calls.get(name);
    }
    return count;
  }

  public static Key<Integer> link(int index) {
    return Key.get(Integer.class, "n" + index);
  }

  /**
   * Returns the last of {@code length} integer dependants in scope {@code app}. Link {@code i}
   * depends on link {@code i - 1} and produces its value plus one, so the last link produces
   * {@code length - 1}. If {@code closingKey} is given, link 0 depends on it.
   */
  public static Dependant<Integer> chain(int length, @Nullable Key<?> closingKey) {
    Factory<Integer> factory =
        arguments -> arguments.size() == 0 ? 0 : arguments.<Integer>get(0) + 1;
    Dependant.Builder<Integer> first = Dependant.builder(link(0)).scope("app").factory(factory);
    if (closingKey != null) {
      first.dependsOn(closingKey);
    }
    Dependant<Integer> previous = first.build();
    for (int i = 1; i < length; i++) {
      previous =
          Dependant.builder(link(i)).scope("app").factory(factory).dependsOn(previous).build();
    }
    return previous;
  }

  public static String format(String name, Arguments arguments) {
    if (arguments.size() == 0) {
      return name;
    }
    List<String> values = new ArrayList<>();
    for (int i = 0; i < arguments.size(); i++) {
      Object value = arguments.get(i);
      values.add(value == null ? "-" : value.toString());
    }
    return name + "(" + String.join(", ", values) + ")";
  }
}
