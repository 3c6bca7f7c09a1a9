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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Thrown when one or more cleanups failed while a scope exited. Every cleanup still ran. The first
 * failure is the {@linkplain #getCause cause}, later ones are suppressed, and {@link #failures()}
 * lists them all.
 */
public final class CleanupException extends ResolutionException {
  private final ImmutableList<Throwable> failures;

  public CleanupException(String scope, List<? extends Throwable> failures) {
    super(message(scope, failures), failures.isEmpty() ? null : failures.get(0));
    checkArgument(!failures.isEmpty(), "no failures");
    this.failures = ImmutableList.copyOf(failures);
    for (Throwable failure : this.failures.subList(1, this.failures.size())) {
      addSuppressed(failure);
    }
  }

  /** The failures in the order the cleanups ran. */
  public ImmutableList<Throwable> failures() {
    return failures;
  }

  private static String message(String scope, List<? extends Throwable> failures) {
    StringBuilder message =
        new StringBuilder()
            .append(failures.size())
            .append(" cleanup(s) failed while exiting scope ")
            .append(scope)
            .append(':');
    for (Throwable failure : failures) {
      message.append("\n  ").append(failure);
    }
    return message.toString();
  }
}
