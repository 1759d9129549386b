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

package io.jsdispose.rhino;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Ascii;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node of the syntax tree. Every node has a {@link Token}, an ordered list of children, an
 * optional leaf value (a string for names, properties and labels, a number for numeric literals)
 * and a set of boolean flags.
 *
 * <p>Siblings are doubly linked; the parent keeps both ends of its child list.
 */
public class Node {

  /** Boolean annotations of a node. */
  private enum Flag {
    POSTFIX,
    STATIC_MEMBER,
    GENERATOR,
    ARROW,
    ASYNC,
    YIELD_ALL,
    EXPORT_DEFAULT,
    EXPORT_ALL_FROM,
    // Bookkeeping of the state machine lowering; never part of the program's meaning.
    SUSPENSION_MARKER,
    FRAME_SAFE;

    boolean affectsEquivalence() {
      return this != SUSPENSION_MARKER && this != FRAME_SAFE;
    }
  }

  private Token token;
  private @Nullable Node parent;
  private @Nullable Node firstChild;
  private @Nullable Node lastChild;
  private @Nullable Node previous;
  private @Nullable Node next;

  private @Nullable String string;
  private double number;
  private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
  private @Nullable Object disposalRegion;

  private @Nullable String sourceFileName;
  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newNumber(double number) {
    Node n = new Node(Token.NUMBER);
    n.number = number;
    return n;
  }

  public static Node newString(String str) {
    return newString(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final void setToken(Token token) {
    this.token = checkNotNull(token);
  }

  // Tree structure

  public final @Nullable Node getParent() {
    return parent;
  }

  public final @Nullable Node getFirstChild() {
    return firstChild;
  }

  public final @Nullable Node getSecondChild() {
    return firstChild == null ? null : firstChild.next;
  }

  public final @Nullable Node getLastChild() {
    return lastChild;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return previous;
  }

  public final boolean hasChildren() {
    return firstChild != null;
  }

  public final boolean hasOneChild() {
    return firstChild != null && firstChild == lastChild;
  }

  public final int getChildCount() {
    int count = 0;
    for (Node c = firstChild; c != null; c = c.next) {
      count++;
    }
    return count;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "Expected exactly one child: %s", this);
    return firstChild;
  }

  /** Returns the child at {@code index}, walking the list from the front. */
  public final Node getChildAtIndex(int index) {
    Node c = firstChild;
    for (int i = 0; i < index; i++) {
      c = checkNotNull(c, "No child at %s in %s", index, this).next;
    }
    return checkNotNull(c, "No child at %s in %s", index, this);
  }

  public final void addChildToFront(Node child) {
    checkDetachedChild(child);
    child.parent = this;
    child.next = firstChild;
    if (firstChild == null) {
      lastChild = child;
    } else {
      firstChild.previous = child;
    }
    firstChild = child;
  }

  public final void addChildToBack(Node child) {
    checkDetachedChild(child);
    child.parent = this;
    child.previous = lastChild;
    if (lastChild == null) {
      firstChild = child;
    } else {
      lastChild.next = child;
    }
    lastChild = child;
  }

  private void checkDetachedChild(Node child) {
    checkArgument(
        child.parent == null && child.previous == null && child.next == null,
        "Node %s already belongs to %s; cannot add it to %s",
        child,
        child.parent,
        this);
  }

  /** Puts {@code replacement}, which must be detached, where this node is. */
  public final void replaceWith(Node replacement) {
    checkState(parent != null, "Node has no parent: %s", this);
    checkState(
        replacement.parent == null && replacement.previous == null && replacement.next == null,
        "Replacement is still attached: %s",
        replacement);
    replacement.srcrefIfMissing(this);

    Node owner = parent;
    replacement.parent = owner;
    replacement.previous = previous;
    replacement.next = next;
    if (previous == null) {
      owner.firstChild = replacement;
    } else {
      previous.next = replacement;
    }
    if (next == null) {
      owner.lastChild = replacement;
    } else {
      next.previous = replacement;
    }
    parent = null;
    previous = null;
    next = null;
  }

  /** Unlinks this node from its parent; the subtree stays intact. */
  @CanIgnoreReturnValue
  public final Node detach() {
    checkState(parent != null, "Node has no parent: %s", this);
    if (previous == null) {
      parent.firstChild = next;
    } else {
      previous.next = next;
    }
    if (next == null) {
      parent.lastChild = previous;
    } else {
      next.previous = previous;
    }
    parent = null;
    previous = null;
    next = null;
    return this;
  }

  @CanIgnoreReturnValue
  public final @Nullable Node removeFirstChild() {
    return firstChild == null ? null : firstChild.detach();
  }

  /** The children in order. Detaching the child last returned does not disturb the iteration. */
  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node cursor = firstChild;

          @Override
          public boolean hasNext() {
            return cursor != null;
          }

          @Override
          public Node next() {
            if (cursor == null) {
              throw new NoSuchElementException();
            }
            Node result = cursor;
            cursor = cursor.next;
            return result;
          }
        };
  }

  // Leaf values

  public final String getString() {
    if (string == null) {
      throw new UnsupportedOperationException(token + " does not hold a string");
    }
    return string;
  }

  public final double getDouble() {
    checkState(token == Token.NUMBER, "%s does not hold a number", token);
    return number;
  }

  public final void setDouble(double value) {
    checkState(token == Token.NUMBER, "%s does not hold a number", token);
    this.number = value;
  }

  // Source positions

  public final @Nullable String getSourceFileName() {
    return sourceFileName;
  }

  @CanIgnoreReturnValue
  public final Node setSourceFileName(@Nullable String name) {
    this.sourceFileName = name;
    return this;
  }

  /** Sets the 1-based line and 0-based column; negative values mean unknown. */
  public final void setLinenoCharno(int lineno, int charno) {
    boolean known = lineno >= 0 && charno >= 0;
    this.lineno = known ? lineno : -1;
    this.charno = known ? charno : -1;
  }

  public final int getLineno() {
    return lineno;
  }

  public final int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public final Node srcref(Node other) {
    sourceFileName = other.sourceFileName;
    lineno = other.lineno;
    charno = other.charno;
    return this;
  }

  @CanIgnoreReturnValue
  public final Node srcrefTree(Node other) {
    srcref(other);
    for (Node c = firstChild; c != null; c = c.next) {
      c.srcrefTree(other);
    }
    return this;
  }

  /** Copies the position of {@code other} unless this node already has a source file. */
  @CanIgnoreReturnValue
  public final Node srcrefIfMissing(Node other) {
    return sourceFileName == null ? srcref(other) : this;
  }

  @CanIgnoreReturnValue
  public final Node srcrefTreeIfMissing(Node other) {
    srcrefIfMissing(other);
    for (Node c = firstChild; c != null; c = c.next) {
      c.srcrefTreeIfMissing(other);
    }
    return this;
  }

  // Copies and comparison

  /** A detached copy of this node without its children. */
  @CheckReturnValue
  public final Node cloneNode() {
    Node copy = new Node(token);
    copy.string = string;
    copy.number = number;
    copy.flags.addAll(flags);
    copy.disposalRegion = disposalRegion;
    copy.srcref(this);
    return copy;
  }

  @CheckReturnValue
  public final Node cloneTree() {
    Node copy = cloneNode();
    for (Node c = firstChild; c != null; c = c.next) {
      copy.addChildToBack(c.cloneTree());
    }
    return copy;
  }

  public final boolean isEquivalentTo(Node other) {
    return isEquivalentTo(other, true);
  }

  /**
   * Compares token, leaf value and the flags that change the meaning of the program. Source
   * positions and the bookkeeping flags of the lowering are ignored.
   *
   * @param recurse whether to compare the children too; otherwise only their number is compared
   */
  public final boolean isEquivalentTo(Node other, boolean recurse) {
    if (token != other.token
        || !Objects.equals(string, other.string)
        || (token == Token.NUMBER && number != other.number)
        || getChildCount() != other.getChildCount()) {
      return false;
    }
    for (Flag flag : Sets.symmetricDifference(flags, other.flags)) {
      if (flag.affectsEquivalence()) {
        return false;
      }
    }
    if (!recurse) {
      return true;
    }
    for (Node a = firstChild, b = other.firstChild; a != null; a = a.next, b = b.next) {
      if (!a.isEquivalentTo(b, true)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder().append(token);
    if (string != null) {
      sb.append(' ').append(string);
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    for (Flag flag : flags) {
      sb.append(" [").append(Ascii.toLowerCase(flag.name())).append(']');
    }
    return sb.toString();
  }

  /** One node per line, children indented below their parent. */
  @CheckReturnValue
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb, 0);
    return sb.toString();
  }

  private void appendTree(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append("  ");
    }
    sb.append(this).append('\n');
    for (Node c = firstChild; c != null; c = c.next) {
      c.appendTree(sb, depth + 1);
    }
  }

  // Flags

  private void setFlag(Flag flag, boolean value) {
    if (value) {
      flags.add(flag);
    } else {
      flags.remove(flag);
    }
  }

  /** On class member definitions and static blocks. */
  public final boolean isStaticMember() {
    return flags.contains(Flag.STATIC_MEMBER);
  }

  public final void setStaticMember(boolean value) {
    setFlag(Flag.STATIC_MEMBER, value);
  }

  public final boolean isGeneratorFunction() {
    return isFunction() && flags.contains(Flag.GENERATOR);
  }

  public final void setIsGeneratorFunction(boolean value) {
    checkState(isFunction(), this);
    setFlag(Flag.GENERATOR, value);
  }

  public final boolean isArrowFunction() {
    return isFunction() && flags.contains(Flag.ARROW);
  }

  public final void setIsArrowFunction(boolean value) {
    checkState(isFunction(), this);
    setFlag(Flag.ARROW, value);
  }

  public final boolean isAsyncFunction() {
    return isFunction() && flags.contains(Flag.ASYNC);
  }

  public final void setIsAsyncFunction(boolean value) {
    checkState(isFunction(), this);
    setFlag(Flag.ASYNC, value);
  }

  public final boolean isAsyncGeneratorFunction() {
    return isAsyncFunction() && isGeneratorFunction();
  }

  /** {@code yield*} rather than {@code yield}. */
  public final boolean isYieldAll() {
    return flags.contains(Flag.YIELD_ALL);
  }

  public final void setYieldAll(boolean value) {
    checkState(isYield(), this);
    setFlag(Flag.YIELD_ALL, value);
  }

  public final boolean isExportDefault() {
    return flags.contains(Flag.EXPORT_DEFAULT);
  }

  public final void setIsExportDefault(boolean value) {
    checkState(isExport(), this);
    setFlag(Flag.EXPORT_DEFAULT, value);
  }

  /** {@code export * from 'm'}. */
  public final boolean isExportAllFrom() {
    return flags.contains(Flag.EXPORT_ALL_FROM);
  }

  public final void setIsExportAllFrom(boolean value) {
    checkState(isExport(), this);
    setFlag(Flag.EXPORT_ALL_FROM, value);
  }

  /** {@code x++} rather than {@code ++x}. */
  public final boolean isPostfix() {
    return flags.contains(Flag.POSTFIX);
  }

  public final void setIsPostfix(boolean value) {
    checkState(token == Token.INC || token == Token.DEC, this);
    setFlag(Flag.POSTFIX, value);
  }

  /** Set on yields, awaits and every statement or expression that contains one. */
  public final boolean isSuspensionMarker() {
    return flags.contains(Flag.SUSPENSION_MARKER);
  }

  public final void setSuspensionMarker(boolean value) {
    setFlag(Flag.SUSPENSION_MARKER, value);
  }

  /** Generated by the lowering; copied into the state machine without further rewriting. */
  public final boolean isFrameSafe() {
    return flags.contains(Flag.FRAME_SAFE);
  }

  public final void setFrameSafe(boolean value) {
    setFlag(Flag.FRAME_SAFE, value);
  }

  /** The description of the guarded region implemented by this TRY node. */
  public final @Nullable Object getDisposalRegion() {
    return disposalRegion;
  }

  public final void setDisposalRegion(@Nullable Object region) {
    checkState(region == null || isTry(), this);
    this.disposalRegion = region;
  }

  // Token tests

  public final boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public final boolean isAwait() {
    return token == Token.AWAIT;
  }

  public final boolean isAwaitUsing() {
    return token == Token.AWAIT_USING;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isBreak() {
    return token == Token.BREAK;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isCatch() {
    return token == Token.CATCH;
  }

  public final boolean isClass() {
    return token == Token.CLASS;
  }

  public final boolean isClassMembers() {
    return token == Token.CLASS_MEMBERS;
  }

  public final boolean isConst() {
    return token == Token.CONST;
  }

  public final boolean isContinue() {
    return token == Token.CONTINUE;
  }

  public final boolean isDefaultCase() {
    return token == Token.DEFAULT_CASE;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isExport() {
    return token == Token.EXPORT;
  }

  public final boolean isExportSpecs() {
    return token == Token.EXPORT_SPECS;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  /** A three-clause {@code for} loop. */
  public final boolean isVanillaFor() {
    return token == Token.FOR;
  }

  public final boolean isForIn() {
    return token == Token.FOR_IN;
  }

  public final boolean isForOf() {
    return token == Token.FOR_OF;
  }

  public final boolean isForAwaitOf() {
    return token == Token.FOR_AWAIT_OF;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isImport() {
    return token == Token.IMPORT;
  }

  public final boolean isLabel() {
    return token == Token.LABEL;
  }

  public final boolean isLabelName() {
    return token == Token.LABEL_NAME;
  }

  public final boolean isLet() {
    return token == Token.LET;
  }

  public final boolean isModuleBody() {
    return token == Token.MODULE_BODY;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isRoot() {
    return token == Token.ROOT;
  }

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isStringLit() {
    return token == Token.STRINGLIT;
  }

  public final boolean isSuper() {
    return token == Token.SUPER;
  }

  public final boolean isSwitch() {
    return token == Token.SWITCH;
  }

  public final boolean isThrow() {
    return token == Token.THROW;
  }

  public final boolean isTry() {
    return token == Token.TRY;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isYield() {
    return token == Token.YIELD;
  }

  public final boolean isNameDeclaration() {
    return token.isNameDeclaration();
  }

  public final boolean isUsingDeclaration() {
    return token.isUsingDeclaration();
  }
}
