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

/**
 * Accumulates output text token by token. In compact mode only the whitespace needed to keep
 * adjacent tokens apart is written and a statement's semicolon is held back until something
 * follows it; in pretty mode every statement gets its own line.
 */
final class SourceWriter {
  private static final String INDENT = "  ";

  private final boolean pretty;
  private final StringBuilder out = new StringBuilder(1024);
  private int depth;
  private boolean lineStart = true;
  private boolean semicolonPending;

  SourceWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /** Keywords, identifiers and literals. */
  void word(String text) {
    emit(text);
  }

  /** Brackets, dots, colons and the like; never padded. */
  void punct(String text) {
    emit(text);
  }

  /** A binary operator or arrow, padded with spaces in pretty mode. */
  void binary(String op) {
    if (pretty) {
      space();
      emit(op);
      space();
    } else {
      emit(op);
    }
  }

  void comma() {
    emit(",");
    if (pretty) {
      space();
    }
  }

  /** A space that only pretty output needs. */
  void space() {
    if (pretty && !lineStart && last() != ' ') {
      out.append(' ');
    }
  }

  void endStatement() {
    if (pretty) {
      emit(";");
      newline();
    } else {
      flush();
      semicolonPending = true;
    }
  }

  /** An empty statement, which needs its semicolon even at the end of a block. */
  void emptyStatement() {
    emit(";");
    if (pretty) {
      newline();
    }
  }

  void newline() {
    if (pretty && !lineStart) {
      out.append('\n');
      lineStart = true;
    }
  }

  void openBlock() {
    space();
    emit("{");
    depth++;
    newline();
  }

  /** Closes a block; {@code endLine} is false where the statement continues after the brace. */
  void closeBlock(boolean endLine) {
    semicolonPending = false;
    depth--;
    newline();
    emit("}");
    if (endLine) {
      newline();
    }
  }

  void indent() {
    depth++;
    newline();
  }

  void outdent() {
    depth--;
    newline();
  }

  String finish() {
    return out.toString();
  }

  private void flush() {
    if (semicolonPending) {
      semicolonPending = false;
      out.append(';');
    }
  }

  private void emit(String text) {
    if (text.isEmpty()) {
      return;
    }
    flush();
    if (lineStart) {
      lineStart = false;
      for (int i = 0; i < depth; i++) {
        out.append(INDENT);
      }
    } else if (needsSeparator(last(), text.charAt(0))) {
      out.append(' ');
    }
    out.append(text);
  }

  private char last() {
    return out.length() == 0 ? '\n' : out.charAt(out.length() - 1);
  }

  /** Whether two adjacent characters would otherwise merge into one token. */
  private static boolean needsSeparator(char previous, char next) {
    if (isWordChar(previous) && (isWordChar(next) || next == '\\')) {
      return true;
    }
    // "a - -b", "a + +b" and "a-- > b" must not collapse into "--", "++" or "-->".
    return ((next == '+' || next == '-') && previous == next) || (previous == '-' && next == '>');
  }

  private static boolean isWordChar(char c) {
    return c == '_' || c == '$' || Character.isLetterOrDigit(c);
  }
}
