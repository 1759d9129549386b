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

import io.jsdispose.rhino.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes in the parse tree, and facilitates the
 * transformations on the parse tree.
 */
public class NodeTraversal {
  private final AbstractCompiler compiler;
  private final Callback callback;

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** Contains the enclosing SCRIPT node if there is one, otherwise null. */
  /** Stack of enclosing FUNCTION nodes, innermost first. */
  private final Deque<Node> functions = new ArrayDeque<>();

  /** The current source file name */
  private @Nullable String sourceName;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns false, the node will not be visited by {@link #visit(NodeTraversal,
     * Node, Node)} and its children will neither be visited by {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} nor {@link #visit(NodeTraversal, Node, Node)}.
     *
     * <p>Siblings are always visited left-to-right.
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children).
     *
     * <p>Implementations can have side-effects (e.g. modify the parse tree). Removing the current
     * node is legal, but removing or reordering nodes above the current node may cause nodes to be
     * visited twice or not at all.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal nodeTraversal, Node n, Node parent) {
      return true;
    }
  }

  private NodeTraversal(AbstractCompiler compiler, Callback callback) {
    this.compiler = checkNotNull(compiler);
    this.callback = checkNotNull(callback);
  }

  /** Traverses a parse tree recursively. */
  public static void traverse(AbstractCompiler compiler, Node root, Callback cb) {
    new NodeTraversal(compiler, cb).traverse(root);
  }

  private void traverse(Node root) {
    try {
      sourceName = root.getSourceFileName();
      currentNode = root;
      // null parent ensures that the callbacks will traverse root
      traverseBranch(root, null);
    } catch (Error | RuntimeException unexpectedException) {
      throwUnexpectedException(unexpectedException);
    }
  }

  private void throwUnexpectedException(Throwable unexpectedException) {
    // If there's an unexpected exception, try to get the
    // line number of the code that caused it.
    String message = unexpectedException.getMessage();
    if (currentNode != null) {
      message =
          unexpectedException.getMessage()
              + "\n"
              + formatNodeContext("Node", currentNode)
              + formatNodeContext("Parent", currentNode.getParent());
    }
    compiler.throwInternalError(message, unexpectedException);
  }

  private String formatNodeContext(String label, @Nullable Node n) {
    if (n == null) {
      return "  " + label + ": NULL";
    }
    return "  " + label + "(" + n + "): " + formatNodePosition(n);
  }

  private String formatNodePosition(Node n) {
    String name = n.getSourceFileName() != null ? n.getSourceFileName() : sourceName;
    return (name == null ? "[source unknown]" : name)
        + ":"
        + n.getLineno()
        + ":"
        + n.getCharno()
        + "\n";
  }

  /** Traverses a branch. */
  private void traverseBranch(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    String previousSourceName = sourceName;
    if (n.isScript()) {
      if (n.getSourceFileName() != null) {
        sourceName = n.getSourceFileName();
      }
    }
    boolean isFunction = n.isFunction();
    if (isFunction) {
      functions.push(n);
    }

    for (Node child = n.getFirstChild(); child != null; ) {
      // child could be replaced, in which case our child node
      // would no longer point to the true next
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }

    if (isFunction) {
      functions.pop();
    }
    sourceName = previousSourceName;

    currentNode = n;
    callback.visit(this, n, parent);
  }

  /** Gets the current input source name, or the empty string when it is unknown. */
  public String getSourceName() {
    return sourceName == null ? "" : sourceName;
  }

  /** Returns the innermost FUNCTION being traversed, or null at script or module level. */
  public @Nullable Node getEnclosingFunction() {
    return functions.peek();
  }

  /** Reports a diagnostic (error or warning) */
  public void report(Node n, DiagnosticType diagnosticType, String... arguments) {
    // Synthetic nodes carry no file name; attribute them to the file being traversed.
    String name = n.getSourceFileName() != null ? n.getSourceFileName() : sourceName;
    compiler.report(
        new JSError(
            diagnosticType,
            diagnosticType.format(arguments),
            name,
            n.getLineno(),
            n.getCharno(),
            n,
            diagnosticType.level()));
  }
}
