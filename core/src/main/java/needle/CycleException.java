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
import java.util.List;

/**
 * Thrown when the dependency graph contains a cycle. {@link #cycle()} lists the keys in the order
 * they depend on each other, ending with the key that closes the cycle: {@code A -> B -> A} is
 * reported as {@code [A, B, A]}.
 */
public final class CycleException extends ResolutionException {
  private final ImmutableList<Key<?>> cycle;

  public CycleException(List<? extends Key<?>> cycle) {
    super(message(cycle));
    this.cycle = ImmutableList.copyOf(cycle);
  }

  public ImmutableList<Key<?>> cycle() {
    return cycle;
  }

  private static String message(List<? extends Key<?>> cycle) {
    StringBuilder message = new StringBuilder("Dependency cycle:");
    for (int i = 0; i < cycle.size(); i++) {
      int position = i == cycle.size() - 1 ? 0 : i;
      message.append("\n    ").append(position).append(". ").append(cycle.get(i));
    }
    return message.toString();
  }
}
