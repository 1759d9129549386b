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

import static java.util.Objects.requireNonNull;

import io.jsdispose.rhino.Node;
import org.jspecify.annotations.Nullable;

/** Compile error description. */
public record JSError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    @Nullable Node node,
    CheckLevel defaultLevel) {

  public JSError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  public static JSError make(DiagnosticType type, String... arguments) {
    return new JSError(type, type.format(arguments), null, -1, -1, null, type.level());
  }

  public static JSError make(Node n, DiagnosticType type, String... arguments) {
    return new JSError(
        type,
        type.format(arguments),
        n.getSourceFileName(),
        n.getLineno(),
        n.getCharno(),
        n,
        type.level());
  }

  public DiagnosticType getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }

  public @Nullable String getSourceName() {
    return sourceName;
  }

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  @Override
  public String toString() {
    return type.key()
        + ". "
        + description
        + " at "
        + (sourceName != null ? sourceName : "(unknown source)")
        + " line "
        + (lineno != -1 ? String.valueOf(lineno) : "(unknown line)")
        + " : "
        + (charno != -1 ? String.valueOf(charno) : "(unknown column)");
  }
}
