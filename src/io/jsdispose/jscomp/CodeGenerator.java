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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import io.jsdispose.rhino.Node;
import io.jsdispose.rhino.Token;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Turns a tree back into source text. Statements and expressions are printed by separate methods;
 * expressions get parentheses wherever their precedence is lower than the position requires.
 * Control-flow bodies are always printed with braces.
 */
final class CodeGenerator {

  private static final ImmutableMap<Token, String> BINARY_OPERATORS =
      ImmutableMap.<Token, String>builder()
          .put(Token.ASSIGN, "=")
          .put(Token.ASSIGN_ADD, "+=")
          .put(Token.ASSIGN_SUB, "-=")
          .put(Token.OR, "||")
          .put(Token.AND, "&&")
          .put(Token.COALESCE, "??")
          .put(Token.BITOR, "|")
          .put(Token.BITXOR, "^")
          .put(Token.BITAND, "&")
          .put(Token.EQ, "==")
          .put(Token.NE, "!=")
          .put(Token.SHEQ, "===")
          .put(Token.SHNE, "!==")
          .put(Token.LT, "<")
          .put(Token.GT, ">")
          .put(Token.LE, "<=")
          .put(Token.GE, ">=")
          .put(Token.IN, "in")
          .put(Token.INSTANCEOF, "instanceof")
          .put(Token.ADD, "+")
          .put(Token.SUB, "-")
          .put(Token.MUL, "*")
          .put(Token.DIV, "/")
          .put(Token.MOD, "%")
          .buildOrThrow();

  private static final ImmutableMap<Token, String> DECLARATION_KEYWORDS =
      ImmutableMap.of(
          Token.VAR, "var",
          Token.LET, "let",
          Token.CONST, "const",
          Token.USING, "using",
          Token.AWAIT_USING, "await using");

  /** Operators that cannot be mixed without parentheses. */
  private static final Set<Token> SHORT_CIRCUIT = Sets.immutableEnumSet(Token.OR, Token.AND);

  private static final int MEMBER = NodeUtil.precedence(Token.GETPROP);
  private static final int ASSIGNMENT = NodeUtil.precedence(Token.ASSIGN);

  private static final CharMatcher IDENTIFIER_PART =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_$"));

  private final SourceWriter out;

  CodeGenerator(SourceWriter out) {
    this.out = out;
  }

  /** Prints a ROOT, SCRIPT or MODULE_BODY, or any single statement. */
  void print(Node n) {
    if (n.isRoot() || n.isScript() || n.isModuleBody()) {
      for (Node c : n.children()) {
        print(c);
      }
    } else {
      statement(n);
    }
  }

  // Statements

  private void statement(Node n) {
    Token token = n.getToken();
    switch (token) {
      case BLOCK:
        if (NodeUtil.isClassStaticBlock(n)) {
          out.word("static");
        }
        block(n, true);
        return;
      case EMPTY:
        out.emptyStatement();
        return;
      case EXPR_RESULT:
        Node expr = n.getOnlyChild();
        if (startsLikeDeclaration(expr)) {
          parenthesized(expr);
        } else {
          expression(expr, 0);
        }
        out.endStatement();
        return;
      case VAR:
      case LET:
      case CONST:
      case USING:
      case AWAIT_USING:
        declaration(n, false);
        out.endStatement();
        return;
      case FUNCTION:
        function(n);
        out.newline();
        return;
      case CLASS:
        classNode(n);
        out.newline();
        return;
      case RETURN:
      case THROW:
        out.word(token == Token.RETURN ? "return" : "throw");
        if (n.hasChildren()) {
          out.space();
          expression(n.getFirstChild(), 0);
        }
        out.endStatement();
        return;
      case BREAK:
      case CONTINUE:
        out.word(token == Token.BREAK ? "break" : "continue");
        if (n.hasChildren()) {
          out.word(n.getFirstChild().getString());
        }
        out.endStatement();
        return;
      case DEBUGGER:
        out.word("debugger");
        out.endStatement();
        return;
      case IF:
        ifStatement(n);
        return;
      case FOR:
        forStatement(n);
        return;
      case FOR_IN:
      case FOR_OF:
      case FOR_AWAIT_OF:
        forEachStatement(n);
        return;
      case WHILE:
        keywordAndCondition("while", n.getFirstChild());
        body(n.getLastChild(), true);
        return;
      case DO:
        out.word("do");
        body(n.getFirstChild(), false);
        out.space();
        keywordAndCondition("while", n.getLastChild());
        out.endStatement();
        return;
      case SWITCH:
        switchStatement(n);
        return;
      case TRY:
        tryStatement(n);
        return;
      case LABEL:
        out.word(n.getFirstChild().getString());
        out.punct(":");
        out.space();
        statement(n.getLastChild());
        return;
      case IMPORT:
        importStatement(n);
        return;
      case EXPORT:
        exportStatement(n);
        return;
      case NAMESPACE:
        out.word("namespace");
        out.word(n.getFirstChild().getString());
        statements(n.getLastChild(), true);
        return;
      default:
        throw new IllegalStateException("Not a statement: " + n.toStringTree());
    }
  }

  /** A braced block; {@code endLine} is false where a keyword continues the statement. */
  private void block(Node block, boolean endLine) {
    checkState(block.isBlock(), block);
    statements(block, endLine);
  }

  private void statements(Node container, boolean endLine) {
    out.openBlock();
    for (Node c : container.children()) {
      statement(c);
    }
    out.closeBlock(endLine);
  }

  private void body(Node n, boolean endLine) {
    if (n.isBlock()) {
      block(n, endLine);
    } else {
      out.space();
      statement(n);
    }
  }

  private void keywordAndCondition(String keyword, Node condition) {
    out.word(keyword);
    out.space();
    out.punct("(");
    expression(condition, 0);
    out.punct(")");
  }

  private void declaration(Node n, boolean forInit) {
    out.word(DECLARATION_KEYWORDS.get(n.getToken()));
    for (Node name : n.children()) {
      if (name != n.getFirstChild()) {
        out.comma();
      }
      out.word(name.getString());
      if (name.hasChildren()) {
        out.binary("=");
        Node value = name.getFirstChild();
        if (forInit && NodeUtil.containsTokenOutsideFunctions(value, Token.IN)) {
          parenthesized(value);
        } else {
          expression(value, ASSIGNMENT);
        }
      }
    }
  }

  private void ifStatement(Node n) {
    keywordAndCondition("if", n.getFirstChild());
    Node elseBranch = n.getSecondChild().getNext();
    body(n.getSecondChild(), elseBranch == null);
    if (elseBranch != null) {
      out.space();
      out.word("else");
      body(elseBranch, true);
    }
  }

  private void forStatement(Node n) {
    Node init = n.getFirstChild();
    Node condition = init.getNext();
    Node update = condition.getNext();
    out.word("for");
    out.space();
    out.punct("(");
    if (init.isNameDeclaration()) {
      declaration(init, true);
    } else if (!init.isEmpty()) {
      if (NodeUtil.containsTokenOutsideFunctions(init, Token.IN)) {
        parenthesized(init);
      } else {
        expression(init, 0);
      }
    }
    out.punct(";");
    if (!condition.isEmpty()) {
      out.space();
      expression(condition, 0);
    }
    out.punct(";");
    if (!update.isEmpty()) {
      out.space();
      expression(update, 0);
    }
    out.punct(")");
    body(n.getLastChild(), true);
  }

  private void forEachStatement(Node n) {
    Node target = n.getFirstChild();
    out.word("for");
    if (n.isForAwaitOf()) {
      out.word("await");
    }
    out.space();
    out.punct("(");
    if (target.isNameDeclaration()) {
      declaration(target, false);
    } else {
      expression(target, MEMBER);
    }
    out.word(n.isForIn() ? "in" : "of");
    out.space();
    expression(target.getNext(), ASSIGNMENT);
    out.punct(")");
    body(n.getLastChild(), true);
  }

  private void switchStatement(Node n) {
    keywordAndCondition("switch", n.getFirstChild());
    out.openBlock();
    for (Node clause = n.getSecondChild(); clause != null; clause = clause.getNext()) {
      if (clause.isDefaultCase()) {
        out.word("default");
      } else {
        out.word("case");
        expression(clause.getFirstChild(), 0);
      }
      out.punct(":");
      out.indent();
      for (Node stmt : clause.getLastChild().children()) {
        statement(stmt);
      }
      out.outdent();
    }
    out.closeBlock(true);
  }

  private void tryStatement(Node n) {
    Node handlers = n.getSecondChild();
    Node finallyBlock = handlers.getNext();
    out.word("try");
    block(n.getFirstChild(), false);
    if (handlers.hasChildren()) {
      Node catchNode = handlers.getOnlyChild();
      out.space();
      out.word("catch");
      Node binding = catchNode.getFirstChild();
      if (!binding.isEmpty()) {
        out.space();
        out.punct("(");
        out.word(binding.getString());
        out.punct(")");
      }
      block(catchNode.getLastChild(), finallyBlock == null);
    }
    if (finallyBlock != null) {
      out.space();
      out.word("finally");
      block(finallyBlock, true);
    }
  }

  private void importStatement(Node n) {
    Node defaultName = n.getFirstChild();
    Node bindings = n.getSecondChild();
    out.word("import");
    if (!defaultName.isEmpty()) {
      out.word(defaultName.getString());
      if (!bindings.isEmpty()) {
        out.comma();
      }
    }
    if (bindings.getToken() == Token.IMPORT_STAR) {
      out.binary("*");
      out.word("as");
      out.word(bindings.getString());
    } else if (!bindings.isEmpty()) {
      specifiers(bindings);
    }
    if (!defaultName.isEmpty() || !bindings.isEmpty()) {
      out.word("from");
    }
    out.space();
    stringLiteral(n.getLastChild().getString());
    out.endStatement();
  }

  private void exportStatement(Node n) {
    Node first = n.getFirstChild();
    out.word("export");
    if (n.isExportAllFrom()) {
      out.binary("*");
      out.word("from");
      out.space();
      stringLiteral(n.getLastChild().getString());
      out.endStatement();
    } else if (first.isExportSpecs()) {
      out.space();
      specifiers(first);
      if (first.getNext() != null) {
        out.word("from");
        out.space();
        stringLiteral(first.getNext().getString());
      }
      out.endStatement();
    } else if (n.isExportDefault() && !first.isFunction() && !first.isClass()) {
      out.word("default");
      out.space();
      if (startsLikeDeclaration(first)) {
        parenthesized(first);
      } else {
        expression(first, ASSIGNMENT);
      }
      out.endStatement();
    } else {
      if (n.isExportDefault()) {
        out.word("default");
      }
      statement(first);
    }
  }

  /** {@code {a, b as c}} */
  private void specifiers(Node specs) {
    out.punct("{");
    for (Node spec : specs.children()) {
      if (spec != specs.getFirstChild()) {
        out.comma();
      }
      String local = spec.getFirstChild().getString();
      String exported = spec.getLastChild().getString();
      out.word(local);
      if (!local.equals(exported)) {
        out.word("as");
        out.word(exported);
      }
    }
    out.punct("}");
  }

  // Functions and classes

  private void function(Node fn) {
    Node name = fn.getFirstChild();
    if (fn.isArrowFunction()) {
      arrowFunction(fn);
      return;
    }
    if (fn.isAsyncFunction()) {
      out.word("async");
    }
    out.word("function");
    if (fn.isGeneratorFunction()) {
      out.punct("*");
    }
    out.word(name.getString());
    parameters(name.getNext());
    block(fn.getLastChild(), false);
  }

  private void arrowFunction(Node fn) {
    if (fn.isAsyncFunction()) {
      out.word("async");
    }
    parameters(fn.getSecondChild());
    out.binary("=>");
    Node body = fn.getLastChild();
    if (body.isBlock()) {
      block(body, false);
    } else if (leftmost(body).getToken() == Token.OBJECTLIT) {
      parenthesized(body);
    } else {
      expression(body, ASSIGNMENT);
    }
  }

  private void parameters(Node params) {
    out.punct("(");
    for (Node param : params.children()) {
      if (param != params.getFirstChild()) {
        out.comma();
      }
      out.word(param.getString());
    }
    out.punct(")");
  }

  private void classNode(Node n) {
    Node name = n.getFirstChild();
    Node superClass = name.getNext();
    out.word("class");
    if (!name.isEmpty()) {
      out.word(name.getString());
    }
    if (!superClass.isEmpty()) {
      out.word("extends");
      expression(superClass, MEMBER);
    }
    out.openBlock();
    for (Node member : n.getLastChild().children()) {
      if (member.isBlock()) {
        out.word("static");
        block(member, true);
      } else {
        classMember(member);
      }
    }
    out.closeBlock(false);
  }

  private void classMember(Node member) {
    Node fn = member.getOnlyChild();
    if (member.isStaticMember()) {
      out.word("static");
    }
    if (fn.isAsyncFunction()) {
      out.word("async");
    }
    if (fn.isGeneratorFunction()) {
      out.punct("*");
    }
    if (member.getToken() == Token.GETTER_DEF) {
      out.word("get");
    } else if (member.getToken() == Token.SETTER_DEF) {
      out.word("set");
    }
    propertyName(member.getString());
    parameters(fn.getSecondChild());
    block(fn.getLastChild(), true);
  }

  // Expressions

  private void parenthesized(Node n) {
    out.punct("(");
    expression(n, 0);
    out.punct(")");
  }

  /** Prints {@code n}, in parentheses if it binds more loosely than {@code minPrecedence}. */
  private void expression(Node n, int minPrecedence) {
    if (precedence(n) < minPrecedence) {
      parenthesized(n);
      return;
    }
    Token token = n.getToken();
    String operator = BINARY_OPERATORS.get(token);
    if (operator != null) {
      binaryExpression(n, operator);
      return;
    }
    switch (token) {
      case NAME:
        out.word(n.getString());
        break;
      case NUMBER:
        number(n.getDouble());
        break;
      case STRINGLIT:
        stringLiteral(n.getString());
        break;
      case THIS:
      case SUPER:
      case NULL:
      case TRUE:
      case FALSE:
        out.word(Ascii.toLowerCase(token.name()));
        break;
      case COMMA:
        expression(n.getFirstChild(), 0);
        out.comma();
        expression(n.getLastChild(), ASSIGNMENT);
        break;
      case HOOK:
        expression(n.getFirstChild(), precedence(n) + 1);
        out.binary("?");
        expression(n.getSecondChild(), ASSIGNMENT);
        out.binary(":");
        expression(n.getLastChild(), ASSIGNMENT);
        break;
      case NOT:
        out.punct("!");
        expression(n.getFirstChild(), precedence(n));
        break;
      case NEG:
        out.punct("-");
        expression(n.getFirstChild(), precedence(n));
        break;
      case TYPEOF:
      case VOID:
      case AWAIT:
        out.word(Ascii.toLowerCase(token.name()));
        out.space();
        expression(n.getFirstChild(), precedence(n));
        break;
      case INC:
      case DEC:
        String update = token == Token.INC ? "++" : "--";
        if (n.isPostfix()) {
          expression(n.getFirstChild(), precedence(n));
          out.punct(update);
        } else {
          out.punct(update);
          expression(n.getFirstChild(), precedence(n));
        }
        break;
      case YIELD:
        out.word("yield");
        if (n.isYieldAll()) {
          out.punct("*");
        }
        if (n.hasChildren()) {
          out.space();
          expression(n.getFirstChild(), ASSIGNMENT);
        }
        break;
      case GETPROP:
        Node target = n.getFirstChild();
        if (target.isNumber()) {
          parenthesized(target);
        } else {
          expression(target, MEMBER);
        }
        out.punct(".");
        out.word(n.getString());
        break;
      case GETELEM:
        expression(n.getFirstChild(), MEMBER);
        out.punct("[");
        expression(n.getLastChild(), 0);
        out.punct("]");
        break;
      case CALL:
        expression(n.getFirstChild(), MEMBER);
        arguments(n.getSecondChild());
        break;
      case NEW:
        out.word("new");
        Node constructor = n.getFirstChild();
        // Without parentheses a call inside the constructor expression would take the arguments.
        if (NodeUtil.containsTokenOutsideFunctions(constructor, Token.CALL)) {
          parenthesized(constructor);
        } else {
          expression(constructor, MEMBER);
        }
        arguments(constructor.getNext());
        break;
      case ARRAYLIT:
        arrayLiteral(n);
        break;
      case OBJECTLIT:
        objectLiteral(n);
        break;
      case FUNCTION:
        function(n);
        break;
      case CLASS:
        classNode(n);
        break;
      default:
        throw new IllegalStateException("Not an expression: " + n.toStringTree());
    }
  }

  private void binaryExpression(Node n, String operator) {
    int p = precedence(n);
    boolean rightAssociative = p == ASSIGNMENT;
    binaryOperand(n, n.getFirstChild(), rightAssociative ? p + 1 : p);
    out.binary(operator);
    binaryOperand(n, n.getLastChild(), rightAssociative ? p : p + 1);
  }

  private void binaryOperand(Node parent, Node operand, int minPrecedence) {
    Token outer = parent.getToken();
    Token inner = operand.getToken();
    boolean mixesCoalesce =
        (outer == Token.COALESCE && SHORT_CIRCUIT.contains(inner))
            || (inner == Token.COALESCE && SHORT_CIRCUIT.contains(outer));
    if (mixesCoalesce) {
      parenthesized(operand);
    } else {
      expression(operand, minPrecedence);
    }
  }

  private void arguments(@Nullable Node first) {
    out.punct("(");
    for (Node arg = first; arg != null; arg = arg.getNext()) {
      if (arg != first) {
        out.comma();
      }
      expression(arg, ASSIGNMENT);
    }
    out.punct(")");
  }

  /** EMPTY elements are holes; a trailing hole needs its own comma. */
  private void arrayLiteral(Node n) {
    out.punct("[");
    for (Node element : n.children()) {
      if (element != n.getFirstChild()) {
        out.comma();
      }
      if (!element.isEmpty()) {
        expression(element, ASSIGNMENT);
      }
    }
    if (n.hasChildren() && n.getLastChild().isEmpty()) {
      out.comma();
    }
    out.punct("]");
  }

  private void objectLiteral(Node n) {
    out.punct("{");
    for (Node property : n.children()) {
      if (property != n.getFirstChild()) {
        out.comma();
      }
      if (property.getToken() == Token.COMPUTED_PROP) {
        out.punct("[");
        expression(property.getFirstChild(), ASSIGNMENT);
        out.punct("]");
      } else {
        propertyName(property.getString());
      }
      out.punct(":");
      out.space();
      expression(property.getLastChild(), ASSIGNMENT);
    }
    out.punct("}");
  }

  private void propertyName(String name) {
    if (isIdentifier(name)) {
      out.word(name);
    } else {
      stringLiteral(name);
    }
  }

  private void number(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e21) {
      out.word(value == 0 && 1 / value < 0 ? "-0" : Long.toString((long) value));
    } else {
      out.word(Double.toString(value));
    }
  }

  private void stringLiteral(String value) {
    out.word(quote(value));
  }

  /** A double-quoted literal; characters outside printable ASCII use escapes. */
  static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
    for (char c : value.toCharArray()) {
      switch (c) {
        case '"':
        case '\\':
          sb.append('\\').append(c);
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c >= ' ' && c <= '~') {
            sb.append(c);
          } else {
            sb.append(String.format("\\u%04x", (int) c));
          }
      }
    }
    return sb.append('"').toString();
  }

  private static boolean isIdentifier(String name) {
    return !name.isEmpty()
        && !CharMatcher.inRange('0', '9').matches(name.charAt(0))
        && IDENTIFIER_PART.matchesAllOf(name);
  }

  private static int precedence(Node n) {
    return n.isArrowFunction() ? ASSIGNMENT : NodeUtil.precedence(n.getToken());
  }

  /** The node whose text starts the printed form of {@code expr}. */
  private static Node leftmost(Node expr) {
    Node n = expr;
    while (true) {
      Token token = n.getToken();
      boolean postfix = (token == Token.INC || token == Token.DEC) && n.isPostfix();
      if (BINARY_OPERATORS.containsKey(token)
          || postfix
          || token == Token.COMMA
          || token == Token.HOOK
          || token == Token.CALL
          || token == Token.GETPROP
          || token == Token.GETELEM) {
        n = n.getFirstChild();
      } else {
        return n;
      }
    }
  }

  /** Whether a statement starting with {@code expr} would parse as a declaration or block. */
  private static boolean startsLikeDeclaration(Node expr) {
    Node first = leftmost(expr);
    return first.isClass()
        || first.getToken() == Token.OBJECTLIT
        || (first.isFunction() && !first.isArrowFunction());
  }
}
