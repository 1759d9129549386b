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

import io.jsdispose.rhino.Node;

/**
 * An abstract compiler, to help remove the circular dependency of passes on JSCompiler.
 *
 * <p>This is an abstract class, so that we can make the methods package-private.
 */
public abstract class AbstractCompiler {

  /** Returns the options this compiler was created with. */
  public abstract CompilerOptions getOptions();

  /** Report an error or warning. */
  public abstract void report(JSError error);

  /** Gets the error manager. */
  public abstract ErrorManager getErrorManager();

  /** Supplies the ids used to build unique temporary names. */
  public abstract UniqueIdSupplier getUniqueIdSupplier();

  /**
   * Passes that make modifications in a scope that is not the current one should call this
   * method. The enclosing function, or the script when there is none, is recorded as changed.
   */
  public abstract void reportChangeToEnclosingScope(Node n);

  /** Generates JavaScript source for the given tree. */
  public abstract String toSource(Node n);

  /** Throws an internal error, wrapping the cause with the message. */
  abstract void throwInternalError(String message, Throwable cause);
}
