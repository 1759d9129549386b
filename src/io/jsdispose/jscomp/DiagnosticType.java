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

import java.text.MessageFormat;

/**
 * A kind of diagnostic the passes can report.
 *
 * @param key stable identifier, e.g. {@code JSC_AWAIT_USING_OUTSIDE_ASYNC}
 * @param level the level it is reported at unless configured otherwise
 * @param messageFormat a {@link MessageFormat} pattern for the description
 */
public record DiagnosticType(String key, CheckLevel level, String messageFormat) {

  public DiagnosticType {
    checkArgument(!key.isEmpty(), "empty diagnostic key");
  }

  public static DiagnosticType error(String key, String messageFormat) {
    return new DiagnosticType(key, CheckLevel.ERROR, messageFormat);
  }

  public static DiagnosticType warning(String key, String messageFormat) {
    return new DiagnosticType(key, CheckLevel.WARNING, messageFormat);
  }

  String format(String... arguments) {
    return MessageFormat.format(messageFormat, (Object[]) arguments);
  }

  @Override
  public String toString() {
    return key;
  }
}
