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

import java.util.logging.Level;

/** How a diagnostic is reported: as an error, as a warning, or not at all. */
public enum CheckLevel {
  ERROR(Level.SEVERE),
  WARNING(Level.WARNING),
  OFF(Level.OFF);

  private final Level logLevel;

  CheckLevel(Level logLevel) {
    this.logLevel = logLevel;
  }

  boolean isOn() {
    return this != OFF;
  }

  /** The level of the log record a diagnostic at this level is written as. */
  Level toLogLevel() {
    return logLevel;
  }
}
