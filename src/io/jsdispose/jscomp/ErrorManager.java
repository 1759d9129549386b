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

package io.jsdispose.jscomp;

import com.google.common.collect.ImmutableList;

/** Collects the diagnostics of a compilation and reports them when it ends. */
public interface ErrorManager {

  /** Records {@code error} at {@code level}, which is ERROR or WARNING. */
  void report(CheckLevel level, JSError error);

  /** Writes out everything recorded so far. */
  void generateReport();

  ImmutableList<JSError> getErrors();

  ImmutableList<JSError> getWarnings();

  default int getErrorCount() {
    return getErrors().size();
  }

  default int getWarningCount() {
    return getWarnings().size();
  }

  /** Whether the compilation must stop before printing output. */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
