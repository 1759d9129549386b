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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.jsdispose.rhino.Node;

/** Prints a tree as compact or pretty-printed source text. */
public final class CodePrinter {

  private CodePrinter() {}

  /** Configures and runs one print. */
  public static final class Builder {
    private final Node root;
    private boolean prettyPrint;

    public Builder(Node root) {
      this.root = checkNotNull(root);
    }

    @CanIgnoreReturnValue
    public Builder setCompilerOptions(CompilerOptions options) {
      this.prettyPrint = options.isPrettyPrint();
      return this;
    }

    /** One statement per line with two-space indentation, instead of minimal whitespace. */
    @CanIgnoreReturnValue
    public Builder setPrettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    public String build() {
      SourceWriter writer = new SourceWriter(prettyPrint);
      new CodeGenerator(writer).print(root);
      return writer.finish();
    }
  }
}
