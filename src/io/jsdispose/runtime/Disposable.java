/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.jsdispose.runtime;

/**
 * A resource that releases itself synchronously when the scope that declared it with {@code using}
 * is exited.
 */
@FunctionalInterface
public interface Disposable {

  /** Releases the resource. Any throwable is recorded by the unwind and never masks a primary. */
  void dispose() throws Exception;
}
