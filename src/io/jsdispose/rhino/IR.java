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

import com.google.common.collect.Sets;
import java.util.Arrays;
import java.util.Set;

/**
 * Factories for the statements and expressions the rewriting passes synthesize. Each factory
 * checks that its operands have a plausible shape; it cannot tell every detached expression from
 * a statement, so the checks are approximate.
 */
public final class IR {

  /** Tokens that start a statement. FUNCTION, CLASS and EMPTY appear in both positions. */
  private static final Set<Token> STATEMENTS =
      Sets.immutableEnumSet(
          Token.BLOCK,
          Token.BREAK,
          Token.CLASS,
          Token.CONST,
          Token.CONTINUE,
          Token.DEBUGGER,
          Token.DO,
          Token.EMPTY,
          Token.EXPORT,
          Token.EXPR_RESULT,
          Token.FOR,
          Token.FOR_AWAIT_OF,
          Token.FOR_IN,
          Token.FOR_OF,
          Token.FUNCTION,
          Token.IF,
          Token.IMPORT,
          Token.LABEL,
          Token.LET,
          Token.RETURN,
          Token.SWITCH,
          Token.THROW,
          Token.TRY,
          Token.USING,
          Token.AWAIT_USING,
          Token.VAR,
          Token.WHILE);

  /** Tokens that are expressions; pattern and template forms are never synthesized. */
  private static final Set<Token> EXPRESSIONS =
      Sets.immutableEnumSet(
          Arrays.asList(
              Token.ADD, Token.AND, Token.ARRAYLIT, Token.ASSIGN, Token.ASSIGN_ADD,
              Token.ASSIGN_SUB, Token.AWAIT, Token.BITAND, Token.BITOR, Token.BITXOR, Token.CALL,
              Token.CLASS, Token.COALESCE, Token.COMMA, Token.DEC, Token.DIV, Token.EQ,
              Token.FALSE, Token.FUNCTION, Token.GE, Token.GETELEM, Token.GETPROP, Token.GT,
              Token.HOOK, Token.IN, Token.INC, Token.INSTANCEOF, Token.LE, Token.LT, Token.MOD,
              Token.MUL, Token.NAME, Token.NE, Token.NEG, Token.NEW, Token.NOT, Token.NULL,
              Token.NUMBER, Token.OBJECTLIT, Token.OR, Token.SHEQ, Token.SHNE, Token.STRINGLIT,
              Token.SUB, Token.SUPER, Token.THIS, Token.TRUE, Token.TYPEOF, Token.VOID,
              Token.YIELD));

  private IR() {}

  public static boolean mayBeStatement(Node n) {
    return STATEMENTS.contains(n.getToken());
  }

  static boolean mayBeExpression(Node n) {
    return EXPRESSIONS.contains(n.getToken());
  }

  private static Node expression(Node n) {
    checkArgument(mayBeExpression(n), "Not an expression: %s", n);
    return n;
  }

  private static Node statement(Node n) {
    checkArgument(mayBeStatement(n), "Not a statement: %s", n);
    return n;
  }

  private static Node withChildren(Node parent, Iterable<Node> children) {
    for (Node child : children) {
      parent.addChildToBack(child);
    }
    return parent;
  }

  // Structure

  public static Node root(Node... scripts) {
    for (Node script : scripts) {
      checkArgument(script.isScript() || script.isRoot(), script);
    }
    return withChildren(new Node(Token.ROOT), Arrays.asList(scripts));
  }

  public static Node block(Node... stmts) {
    return block(Arrays.asList(stmts));
  }

  public static Node block(Iterable<Node> stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      block.addChildToBack(statement(stmt));
    }
    return block;
  }

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node function(Node name, Node params, Node body) {
    checkArgument(name.isName() && params.isParamList() && body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node paramList(Node... names) {
    for (Node name : names) {
      checkArgument(name.isName(), name);
    }
    return withChildren(new Node(Token.PARAM_LIST), Arrays.asList(names));
  }

  public static Node export(Node declaration) {
    return new Node(Token.EXPORT, declaration);
  }

  public static Node exportSpecs(Node... specs) {
    for (Node spec : specs) {
      checkArgument(spec.getToken() == Token.EXPORT_SPEC, spec);
    }
    return withChildren(new Node(Token.EXPORT_SPECS), Arrays.asList(specs));
  }

  /** {@code local as exported}. */
  public static Node exportSpec(Node local, Node exported) {
    checkArgument(local.isName() && exported.isName());
    return new Node(Token.EXPORT_SPEC, local, exported);
  }

  // Declarations

  public static Node var(Node name, Node value) {
    return declaration(Token.VAR, name, value);
  }

  public static Node let(Node name) {
    checkArgument(name.isName() && !name.hasChildren(), name);
    return new Node(Token.LET, name);
  }

  public static Node let(Node name, Node value) {
    return declaration(Token.LET, name, value);
  }

  public static Node constNode(Node name, Node value) {
    return declaration(Token.CONST, name, value);
  }

  private static Node declaration(Token kind, Node name, Node value) {
    checkArgument(name.isName() && !name.hasChildren(), name);
    name.addChildToBack(expression(value));
    return new Node(kind, name);
  }

  // Statements

  public static Node exprResult(Node expr) {
    return new Node(Token.EXPR_RESULT, expression(expr));
  }

  public static Node returnNode(Node expr) {
    return new Node(Token.RETURN, expression(expr));
  }

  public static Node throwNode(Node expr) {
    return new Node(Token.THROW, expression(expr));
  }

  public static Node ifNode(Node cond, Node then) {
    checkArgument(then.isBlock(), then);
    return new Node(Token.IF, expression(cond), then);
  }

  /** A switch without cases; the caller appends them. */
  public static Node switchNode(Node discriminant) {
    return new Node(Token.SWITCH, expression(discriminant));
  }

  /** A case clause; {@code body} holds its statements. */
  public static Node caseNode(Node expr, Node body) {
    checkArgument(body.isBlock(), body);
    return new Node(Token.CASE, expression(expr), body);
  }

  public static Node tryCatchFinally(Node tryBody, Node catchNode, Node finallyBody) {
    checkArgument(tryBody.isBlock() && catchNode.isCatch() && finallyBody.isBlock());
    Node handlers = new Node(Token.BLOCK, catchNode).srcrefIfMissing(catchNode);
    return new Node(Token.TRY, tryBody, handlers, finallyBody);
  }

  /** {@code binding} is EMPTY for {@code catch {}}. */
  public static Node catchNode(Node binding, Node body) {
    checkArgument((binding.isName() || binding.isEmpty()) && body.isBlock());
    return new Node(Token.CATCH, binding, body);
  }

  // Expressions

  public static Node name(String name) {
    checkArgument(name.indexOf('.') == -1, "Use qname for the dotted name %s", name);
    return Node.newString(Token.NAME, name);
  }

  /** A dotted name such as {@code $jscomp.using} as a chain of GETPROPs. */
  public static Node qname(String dottedName) {
    String[] parts = dottedName.split("\\.", -1);
    Node result = name(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      result = property(result, parts[i]);
    }
    return result;
  }

  public static Node getprop(Node target, String prop, String... moreProps) {
    Node result = property(expression(target), prop);
    for (String next : moreProps) {
      result = property(result, next);
    }
    return result;
  }

  private static Node property(Node target, String prop) {
    Node getprop = Node.newString(Token.GETPROP, prop);
    getprop.addChildToBack(target);
    return getprop;
  }

  public static Node call(Node callee, Node... args) {
    Node call = new Node(Token.CALL, callee);
    for (Node arg : args) {
      call.addChildToBack(expression(arg));
    }
    return call;
  }

  public static Node newNode(Node constructor, Node... args) {
    Node newNode = new Node(Token.NEW, constructor);
    for (Node arg : args) {
      newNode.addChildToBack(expression(arg));
    }
    return newNode;
  }

  public static Node await(Node expr) {
    return new Node(Token.AWAIT, expression(expr));
  }

  public static Node assign(Node target, Node value) {
    checkArgument(target.isName() || target.isGetProp() || target.isGetElem(), target);
    return new Node(Token.ASSIGN, target, expression(value));
  }

  public static Node comma(Node left, Node right) {
    return new Node(Token.COMMA, expression(left), expression(right));
  }

  public static Node not(Node operand) {
    return new Node(Token.NOT, expression(operand));
  }

  /** {@code void 0}. */
  public static Node undefined() {
    return new Node(Token.VOID, number(0));
  }

  /** An array literal; EMPTY children are holes. */
  public static Node arraylit(Node... elements) {
    Node array = new Node(Token.ARRAYLIT);
    for (Node element : elements) {
      array.addChildToBack(element.isEmpty() ? element : expression(element));
    }
    return array;
  }

  public static Node number(double value) {
    return Node.newNumber(value);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }
}
