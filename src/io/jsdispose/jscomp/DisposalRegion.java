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

import io.jsdispose.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * Describes one protected region created for a scope with resource-scoped declarations: the names
 * of its temporaries and whether its unwind is awaited. Attached to the TRY node of the region so
 * that later lowering can recognize the region and its unwind.
 */
final class DisposalRegion {
  private static final String PREFIX = "$jscomp$using$";

  private final String id;
  private final boolean async;

  private DisposalRegion(String id, boolean async) {
    this.id = id;
    this.async = async;
  }

  static DisposalRegion create(String id, boolean async) {
    return new DisposalRegion(id, async);
  }

  /** Returns the region attached to {@code n}, or null if {@code n} is not a region's TRY. */
  static @Nullable DisposalRegion fromNode(Node n) {
    return n.isTry() ? (DisposalRegion) n.getDisposalRegion() : null;
  }

  void attachTo(Node tryNode) {
    checkArgument(tryNode.isTry(), tryNode);
    tryNode.setDisposalRegion(this);
  }

  boolean isAsync() {
    return async;
  }

  /** The ordered list of registered resources. */
  String getStackName() {
    return PREFIX + "stack$" + id;
  }

  /** The error thrown by the guarded body, if any. */
  String getErrorName() {
    return PREFIX + "error$" + id;
  }

  String getHasErrorName() {
    return PREFIX + "hasError$" + id;
  }

  String getCaughtName() {
    return PREFIX + "caught$" + id;
  }

  /** The step-wise unwind cursor of a lowered asynchronous region. */
  String getUnwindName() {
    return PREFIX + "unwind$" + id;
  }

  /** Holds the value of a module's {@code export default} expression. */
  String getDefaultExportName() {
    return PREFIX + "default$" + id;
  }

  @Override
  public String toString() {
    return "DisposalRegion{" + id + (async ? ", async}" : "}");
  }
}
