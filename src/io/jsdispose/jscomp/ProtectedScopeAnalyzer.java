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

import com.google.common.collect.ImmutableList;
import io.jsdispose.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * Classifies the lexical scopes that can host resource-scoped declarations and decides which of
 * them must be rewritten into a protected region.
 *
 * <p>Every scope is analyzed on its own: a {@code using} in a nested block does not make the
 * enclosing scope protected.
 */
final class ProtectedScopeAnalyzer {

  /** The kind of lexical scope rooted at a node. */
  enum ScopeKind {
    SCRIPT,
    MODULE_BODY,
    NAMESPACE_BODY,
    FUNCTION_BODY,
    LOOP_BODY,
    SWITCH_CASE,
    BRANCH,
    TRY_BODY,
    CATCH_BODY,
    FINALLY_BODY,
    LABELED_BODY,
    STATIC_BLOCK,
    BLOCK
  }

  /** How a function suspends, which decides how a protected region inside it is lowered. */
  enum FunctionKind {
    NORMAL,
    GENERATOR,
    ASYNC,
    ASYNC_GENERATOR;

    boolean isSuspendable() {
      return this != NORMAL;
    }
  }

  private ProtectedScopeAnalyzer() {}

  /** Returns the kind of scope rooted at {@code n}, or null if {@code n} does not root one. */
  static @Nullable ScopeKind classify(Node n) {
    switch (n.getToken()) {
      case SCRIPT:
        return NodeUtil.isModuleScript(n) ? null : ScopeKind.SCRIPT;
      case MODULE_BODY:
        return ScopeKind.MODULE_BODY;
      case NAMESPACE_ELEMENTS:
        return ScopeKind.NAMESPACE_BODY;
      case BLOCK:
        return classifyBlock(n);
      default:
        return null;
    }
  }

  private static @Nullable ScopeKind classifyBlock(Node block) {
    Node parent = block.getParent();
    if (parent == null) {
      return ScopeKind.BLOCK;
    }
    switch (parent.getToken()) {
      case FUNCTION:
        return ScopeKind.FUNCTION_BODY;
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case FOR_AWAIT_OF:
      case WHILE:
      case DO:
        return NodeUtil.getLoopCodeBlock(parent) == block ? ScopeKind.LOOP_BODY : null;
      case CASE:
      case DEFAULT_CASE:
        return ScopeKind.SWITCH_CASE;
      case IF:
        return ScopeKind.BRANCH;
      case TRY:
        if (block == parent.getFirstChild()) {
          return ScopeKind.TRY_BODY;
        }
        // The second child only holds the CATCH node.
        return block == parent.getSecondChild() ? null : ScopeKind.FINALLY_BODY;
      case CATCH:
        return ScopeKind.CATCH_BODY;
      case LABEL:
        return ScopeKind.LABELED_BODY;
      case CLASS_MEMBERS:
        return ScopeKind.STATIC_BLOCK;
      default:
        return ScopeKind.BLOCK;
    }
  }

  /** Whether {@code root} directly holds at least one resource-scoped declaration. */
  static boolean needsWrapping(Node root) {
    return !getUsingDeclarations(root).isEmpty();
  }

  /** Whether {@code root} directly holds an {@code await using} declaration. */
  static boolean isAsync(Node root) {
    for (Node decl : getUsingDeclarations(root)) {
      if (decl.isAwaitUsing()) {
        return true;
      }
    }
    return false;
  }

  /** The resource-scoped declarations that are direct statements of {@code root}. */
  static ImmutableList<Node> getUsingDeclarations(Node root) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node c = root.getFirstChild(); c != null; c = c.getNext()) {
      if (c.isUsingDeclaration()) {
        result.add(c);
      }
    }
    return result.build();
  }

  static FunctionKind getFunctionKind(Node fn) {
    checkArgument(fn.isFunction(), fn);
    if (fn.isAsyncGeneratorFunction()) {
      return FunctionKind.ASYNC_GENERATOR;
    } else if (fn.isGeneratorFunction()) {
      return FunctionKind.GENERATOR;
    } else if (fn.isAsyncFunction()) {
      return FunctionKind.ASYNC;
    }
    return FunctionKind.NORMAL;
  }
}
