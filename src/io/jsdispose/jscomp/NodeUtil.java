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
import io.jsdispose.rhino.Token;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /**
   * The comma operator has the lowest precedence, 0, followed by the assignment operators ({@code
   * =}, {@code +=}, etc.) which have precedence of 1, and so on.
   *
   * <p>See
   * https://developer.mozilla.org/en-US/docs/Web/JavaScript/Reference/Operators/Operator_Precedence
   */
  public static int precedence(Token type) {
    switch (type) {
      case COMMA:
        return 0;
      case ASSIGN:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
        return 1;
      case YIELD:
        return 2;
      case HOOK:
        return 3; // ?: operator
      case OR:
        return 4;
      case AND:
        return 5;
      case COALESCE:
        return 6;
      case BITOR:
        return 7;
      case BITXOR:
        return 8;
      case BITAND:
        return 9;
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return 10;
      case LT:
      case GT:
      case LE:
      case GE:
      case INSTANCEOF:
      case IN:
        return 11;
      case SUB:
      case ADD:
        return 13;
      case MUL:
      case MOD:
      case DIV:
        return 14;

      case AWAIT:
      case NEW:
      case TYPEOF:
      case VOID:
      case NOT:
      case NEG:
        return 16; // Unary operators

      case INC:
      case DEC:
        return 17; // Update operators

      case CALL:
      case GETELEM:
      case GETPROP:
        // Data values
      case ARRAYLIT:
      case EMPTY:
      case FALSE:
      case FUNCTION:
      case CLASS:
      case NAME:
      case NULL:
      case NUMBER:
      case OBJECTLIT:
      case STRINGLIT:
      case SUPER:
      case THIS:
      case TRUE:
        return 18;

      default:
        throw new IllegalStateException("Unknown precedence for " + type);
    }
  }

  /** @return Whether the node is a loop structure. */
  public static boolean isLoopStructure(Node n) {
    switch (n.getToken()) {
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case FOR_AWAIT_OF:
      case DO:
      case WHILE:
        return true;
      default:
        return false;
    }
  }

  /** @return The body of a loop structure. */
  public static Node getLoopCodeBlock(Node n) {
    switch (n.getToken()) {
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case FOR_AWAIT_OF:
      case WHILE:
        return n.getLastChild();
      case DO:
        return n.getFirstChild();
      default:
        throw new IllegalStateException("Not a loop: " + n);
    }
  }

  /** Returns true if the node is a class static initialization block. */
  public static boolean isClassStaticBlock(Node n) {
    return n.isBlock() && n.getParent() != null && n.getParent().isClassMembers();
  }

  /** Returns true if this node may hold statements as its children. */
  public static boolean isStatementParent(Node parent) {
    switch (parent.getToken()) {
      case SCRIPT:
      case MODULE_BODY:
      case NAMESPACE_ELEMENTS:
      case BLOCK:
        return true;
      default:
        return false;
    }
  }

  /** Returns the function body (a BLOCK, or an expression for arrow functions). */
  public static Node getFunctionBody(Node fn) {
    checkArgument(fn.isFunction(), fn);
    return fn.getLastChild();
  }

  /** Whether the script is an ES module, that is it holds a MODULE_BODY. */
  public static boolean isModuleScript(Node script) {
    checkArgument(script.isScript(), script);
    return script.hasChildren() && script.getFirstChild().isModuleBody();
  }

  /**
   * Returns true if the subtree contains a node of the given token, not descending into nested
   * functions (but descending into the given node itself even if it is a function).
   */
  public static boolean containsTokenOutsideFunctions(Node n, Token token) {
    if (n.getToken() == token) {
      return true;
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (!c.isFunction() && containsTokenOutsideFunctions(c, token)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true if the subtree references {@code arguments} in a way that binds to the given
   * function, that is outside nested non-arrow functions.
   */
  public static boolean referencesArguments(Node n) {
    if (n.isName() && n.getString().equals("arguments")) {
      return true;
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (c.isFunction() && !c.isArrowFunction()) {
        continue;
      }
      if (referencesArguments(c)) {
        return true;
      }
    }
    return false;
  }
}
