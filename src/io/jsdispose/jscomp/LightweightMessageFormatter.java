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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Formats a diagnostic on a single line without a source excerpt:
 *
 * <pre>
 * input.js:12:4: ERROR - [JSC_AWAIT_USING_OUTSIDE_ASYNC] 'await using' is only allowed ...
 * </pre>
 */
public final class LightweightMessageFormatter implements MessageFormatter {
  private final boolean includeLocation;

  public LightweightMessageFormatter() {
    this(true);
  }

  private LightweightMessageFormatter(boolean includeLocation) {
    this.includeLocation = includeLocation;
  }

  /** Omits the {@code file:line:column:} prefix. */
  public static LightweightMessageFormatter withoutLocation() {
    return new LightweightMessageFormatter(false);
  }

  @Override
  public String format(CheckLevel level, JSError error) {
    checkArgument(level.isOn(), "Nothing to format at %s", level);
    StringBuilder sb = new StringBuilder();
    String sourceName = error.getSourceName();
    if (includeLocation && sourceName != null) {
      sb.append(sourceName);
      if (error.getLineno() > 0) {
        sb.append(':').append(error.getLineno());
        if (error.getCharno() >= 0) {
          sb.append(':').append(error.getCharno());
        }
      }
      sb.append(": ");
    }
    return sb.append(level)
        .append(" - [")
        .append(error.getType().key())
        .append("] ")
        .append(error.getDescription())
        .toString();
  }
}
