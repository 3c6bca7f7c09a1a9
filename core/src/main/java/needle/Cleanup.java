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
 * Releases a value when the scope that owns it exits. Cleanups run in reverse construction order
 * and each one runs exactly once.
 */
public interface Cleanup<T> {
  void release(T value) throws Exception;
}
