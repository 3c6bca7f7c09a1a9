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
 * Produces the value of a {@link Dependant} from the already resolved values of its parameters.
 *
 * <p>A factory is invoked at most once per construction: for a {@linkplain Dependant#isShared()
 * shared} dependant that is at most once per scope instance, for an unshared one once per
 * execution that needs it. Implementations may be invoked concurrently for different keys.
 */
public interface Factory<T> {
  /**
   * Returns a new, non-null value. Any exception thrown here is reported to the caller of the
   * execution as a {@link ConstructionException} naming the dependant's key.
   */
  T create(Arguments arguments) throws Exception;
}
