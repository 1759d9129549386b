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
import static com.google.common.base.Preconditions.checkState;

import io.jsdispose.jscomp.CompilerOptions.LanguageMode;
import io.jsdispose.jscomp.ProtectedScopeAnalyzer.FunctionKind;
import io.jsdispose.rhino.IR;
import io.jsdispose.rhino.Node;
import io.jsdispose.rhino.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Lowers generators, async functions and async generators that host a guarded region into state
 * machines, for output languages that cannot express the function natively.
 *
 * <p>The body of the function is split into numbered steps of a program that the runtime drives
 * through {@code $jscomp.generator}. Every step ends by returning an instruction:
 *
 * <ul>
 *   <li>{@code [2, v]} return {@code v};
 *   <li>{@code [3, label]} continue at step {@code label};
 *   <li>{@code [4, v]} suspend on {@code v} (a yield or an await), resuming at the next step;
 *   <li>{@code [5, v]} delegate to the iterable {@code v}, resuming at the next step;
 *   <li>{@code [7]} leave a finally block.
 * </ul>
 *
 * <p>{@code try} statements become entries of the exception table {@code state.trys}. Variables
 * that must survive a suspension are hoisted into the enclosing function, so the disposal stack
 * and the pending error of a guarded region keep their values while the frame is suspended.
 */
final class SuspendableFrameAdapter {

  static final DiagnosticType CANNOT_LOWER_SUSPENSION =
      DiagnosticType.error(
          "JSC_CANNOT_LOWER_SUSPENSION",
          "Cannot lower this {0} function for the output language: {1}.");

  private static final String STATE = "$jscomp$generator$state";
  private static final String ARGUMENTS = "$jscomp$generator$arguments";

  private static final int RETURN = 2;
  private static final int JUMP = 3;
  private static final int SUSPEND = 4;
  private static final int DELEGATE = 5;
  private static final int END_FINALLY = 7;

  private final AbstractCompiler compiler;
  private final String helperNamespace;
  private final LanguageMode languageOut;

  SuspendableFrameAdapter(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.helperNamespace = compiler.getOptions().getRuntimeHelperNamespace();
    this.languageOut = compiler.getOptions().getLanguageOut();
  }

  /** Whether the output language lacks native support for the flavor of {@code fn}. */
  boolean needsLowering(Node fn) {
    checkArgument(fn.isFunction(), fn);
    switch (ProtectedScopeAnalyzer.getFunctionKind(fn)) {
      case GENERATOR:
        return !languageOut.supportsGenerators();
      case ASYNC:
        return !languageOut.supportsAsyncFunctions();
      case ASYNC_GENERATOR:
        return !languageOut.supportsAsyncGenerators();
      default:
        return false;
    }
  }

  /**
   * Replaces the body of {@code fn} by a state machine. Reports {@link #CANNOT_LOWER_SUSPENSION}
   * and leaves the function unchanged if a suspension point sits where no step boundary can be
   * placed.
   */
  void lower(NodeTraversal t, Node fn) {
    checkState(needsLowering(fn), fn);
    FunctionKind kind = ProtectedScopeAnalyzer.getFunctionKind(fn);
    Node body = NodeUtil.getFunctionBody(fn);
    NodeTraversal.traverse(compiler, body, new SuspensionMarker());

    String reason = findUnsupportedShape(fn, body);
    if (reason != null) {
      clearMarkers(body);
      t.report(fn, CANNOT_LOWER_SUSPENSION, describe(kind), reason);
      return;
    }
    new SingleFunctionTranspiler(fn, kind).transpile();
  }

  private static String describe(FunctionKind kind) {
    switch (kind) {
      case GENERATOR:
        return "generator";
      case ASYNC:
        return "async";
      case ASYNC_GENERATOR:
        return "async generator";
      default:
        throw new IllegalStateException("Not a suspendable function: " + kind);
    }
  }

  private static @Nullable String findUnsupportedShape(Node fn, Node body) {
    if (referencesSuper(body)) {
      return "reference to 'super'";
    }
    if (fn.isArrowFunction() && NodeUtil.referencesArguments(body)) {
      return "reference to 'arguments' in an arrow function";
    }
    for (Node stmt = body.getFirstChild(); stmt != null; stmt = stmt.getNext()) {
      String reason = findUnsupportedStatement(stmt);
      if (reason == null) {
        reason = findCapturedLoopBinding(stmt, null);
      }
      if (reason != null) {
        return reason;
      }
    }
    return null;
  }

  /**
   * Finds a block-scoped binding of a lowered loop that a nested function captures. The lowering
   * turns such a binding into a single frame variable, so closures created in different
   * iterations would observe the same value.
   *
   * @param loop the innermost lowered loop enclosing {@code n}, or null
   */
  private static @Nullable String findCapturedLoopBinding(Node n, @Nullable Node loop) {
    if (!n.isSuspensionMarker()) {
      return null;
    }
    switch (n.getToken()) {
      case BLOCK:
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          String reason = loop == null ? null : findCapturedDeclaration(c, loop);
          if (reason == null) {
            reason = findCapturedLoopBinding(c, loop);
          }
          if (reason != null) {
            return reason;
          }
        }
        return null;
      case LABEL:
        return findCapturedLoopBinding(n.getLastChild(), loop);
      case IF:
        {
          String reason = findCapturedLoopBinding(n.getSecondChild(), loop);
          return reason != null || n.getChildCount() == 2
              ? reason
              : findCapturedLoopBinding(n.getLastChild(), loop);
        }
      case WHILE:
        return findCapturedLoopBinding(n.getLastChild(), n);
      case DO:
        return findCapturedLoopBinding(n.getFirstChild(), n);
      case FOR:
        {
          String reason = findCapturedDeclaration(n.getFirstChild(), n);
          return reason != null ? reason : findCapturedLoopBinding(n.getLastChild(), n);
        }
      case TRY:
        {
          String reason = findCapturedLoopBinding(n.getFirstChild(), loop);
          Node catchBlock = n.getSecondChild();
          if (reason == null && catchBlock.hasChildren()) {
            Node catchNode = catchBlock.getFirstChild();
            Node param = catchNode.getFirstChild();
            if (loop != null && param.isName() && isCapturedIn(param.getString(), catchNode)) {
              reason = capturedReason(param.getString());
            }
            if (reason == null) {
              reason = findCapturedLoopBinding(catchNode.getLastChild(), loop);
            }
          }
          if (reason == null && n.getChildCount() == 3) {
            reason = findCapturedLoopBinding(n.getLastChild(), loop);
          }
          return reason;
        }
      default:
        return null;
    }
  }

  private static @Nullable String findCapturedDeclaration(Node stmt, Node loop) {
    if (stmt.isLet() || stmt.isConst()) {
      for (Node name = stmt.getFirstChild(); name != null; name = name.getNext()) {
        if (isCapturedIn(name.getString(), loop)) {
          return capturedReason(name.getString());
        }
      }
    } else if (stmt.isClass() && isCapturedIn(stmt.getFirstChild().getString(), loop)) {
      return capturedReason(stmt.getFirstChild().getString());
    }
    return null;
  }

  private static String capturedReason(String name) {
    return "loop binding '" + name + "' captured by a nested function";
  }

  /** Whether a function nested in {@code root} refers to {@code name}. */
  private static boolean isCapturedIn(String name, Node root) {
    for (Node c = root.getFirstChild(); c != null; c = c.getNext()) {
      if (c.isFunction() ? referencesName(c, name) : isCapturedIn(name, c)) {
        return true;
      }
    }
    return false;
  }

  private static boolean referencesName(Node n, String name) {
    if (n.isName() && n.getString().equals(name)) {
      return true;
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (referencesName(c, name)) {
        return true;
      }
    }
    return false;
  }

  private static @Nullable String findUnsupportedStatement(Node n) {
    if (!n.isSuspensionMarker()) {
      return null;
    }
    switch (n.getToken()) {
      case BLOCK:
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          String reason = findUnsupportedStatement(c);
          if (reason != null) {
            return reason;
          }
        }
        return null;
      case LABEL:
        return findUnsupportedStatement(n.getLastChild());
      case EXPR_RESULT:
        return isLowerableExpression(n.getFirstChild()) ? null : "suspension inside an expression";
      case VAR:
      case LET:
      case CONST:
        for (Node name = n.getFirstChild(); name != null; name = name.getNext()) {
          Node value = name.getFirstChild();
          if (value != null && value.isSuspensionMarker() && !isSuspension(value)) {
            return "suspension inside an expression";
          }
        }
        return null;
      case RETURN:
      case THROW:
        return isSuspension(n.getFirstChild()) ? null : "suspension inside an expression";
      case IF:
        if (n.getFirstChild().isSuspensionMarker()) {
          return "suspension in a condition";
        }
        return firstUnsupported(n.getSecondChild(), n.getChildAtIndex(n.getChildCount() - 1));
      case WHILE:
        return n.getFirstChild().isSuspensionMarker()
            ? "suspension in a loop head"
            : findUnsupportedStatement(n.getLastChild());
      case DO:
        return n.getLastChild().isSuspensionMarker()
            ? "suspension in a loop head"
            : findUnsupportedStatement(n.getFirstChild());
      case FOR:
        for (Node c = n.getFirstChild(); c != n.getLastChild(); c = c.getNext()) {
          if (c.isSuspensionMarker()) {
            return "suspension in a loop head";
          }
        }
        return findUnsupportedStatement(n.getLastChild());
      case TRY:
        {
          Node catchBlock = n.getSecondChild();
          String reason = findUnsupportedStatement(n.getFirstChild());
          if (reason == null && catchBlock.hasChildren()) {
            reason = findUnsupportedStatement(catchBlock.getFirstChild().getLastChild());
          }
          if (reason == null && n.getChildCount() == 3) {
            reason = findUnsupportedStatement(n.getLastChild());
          }
          return reason;
        }
      case SWITCH:
        return "suspension in a switch statement";
      case FOR_IN:
      case FOR_OF:
        return "suspension in a for-in or for-of loop";
      case FOR_AWAIT_OF:
        return "for-await loop";
      default:
        return "suspension inside an expression";
    }
  }

  private static @Nullable String firstUnsupported(Node thenBlock, Node elseBlock) {
    String reason = findUnsupportedStatement(thenBlock);
    return reason != null || elseBlock == thenBlock ? reason : findUnsupportedStatement(elseBlock);
  }

  /** A yield or await whose operand contains no further suspension. */
  private static boolean isSuspension(@Nullable Node n) {
    if (n == null || !(n.isYield() || n.isAwait())) {
      return false;
    }
    return !n.hasChildren() || !n.getFirstChild().isSuspensionMarker();
  }

  private static boolean isLowerableExpression(Node n) {
    return isSuspension(n)
        || (n.isAssign() && n.getFirstChild().isName() && isSuspension(n.getLastChild()));
  }

  private static boolean referencesSuper(Node n) {
    if (n.isSuper()) {
      return true;
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (c.isFunction() && !c.isArrowFunction()) {
        continue;
      }
      if (referencesSuper(c)) {
        return true;
      }
    }
    return false;
  }

  private static void clearMarkers(Node n) {
    n.setSuspensionMarker(false);
    n.setFrameSafe(false);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      clearMarkers(c);
    }
  }

  private static boolean isDirective(Node stmt) {
    return stmt.isExprResult() && stmt.getFirstChild().isStringLit();
  }

  /** Lowers a single function. */
  private final class SingleFunctionTranspiler {
    final Node function;
    final FunctionKind kind;

    /** Names of the variables whose values live across steps. */
    final Set<String> frameFields = new LinkedHashSet<>();

    /** Function declarations moved out of the program. */
    final List<Node> hoistedFunctions = new ArrayList<>();

    final TranspilationContext context = new TranspilationContext();

    SingleFunctionTranspiler(Node function, FunctionKind kind) {
      this.function = function;
      this.kind = kind;
    }

    void transpile() {
      Node originalBody = NodeUtil.getFunctionBody(function);
      Node newBody = IR.block().srcref(originalBody);
      while (originalBody.hasChildren() && isDirective(originalBody.getFirstChild())) {
        newBody.addChildToBack(originalBody.removeFirstChild());
      }

      boolean aliasArguments = NodeUtil.referencesArguments(originalBody);
      if (aliasArguments) {
        replaceArguments(originalBody);
      }

      while (originalBody.hasChildren()) {
        transpileStatement(originalBody.removeFirstChild(), null, null);
      }
      context.checkStateIsEmpty();

      for (Node hoisted : hoistedFunctions) {
        newBody.addChildToBack(hoisted);
      }
      if (!frameFields.isEmpty()) {
        Node var = new Node(Token.VAR);
        for (String name : frameFields) {
          var.addChildToBack(IR.name(name));
        }
        newBody.addChildToBack(var.srcrefTree(originalBody));
      }
      if (aliasArguments) {
        newBody.addChildToBack(
            IR.var(IR.name(ARGUMENTS), IR.name("arguments")).srcrefTree(originalBody));
      }

      Node program =
          IR.function(
              IR.name(""), IR.paramList(IR.name(STATE)), IR.block(context.buildSwitch()));
      Node machine = IR.call(qname("generator"), IR.thisNode(), program);
      if (kind == FunctionKind.ASYNC) {
        machine = IR.call(qname("asyncExecutePromiseGenerator"), machine);
      } else if (kind == FunctionKind.ASYNC_GENERATOR) {
        machine = IR.newNode(qname("AsyncGeneratorWrapper"), machine);
      }
      newBody.addChildToBack(IR.returnNode(machine).srcrefTreeIfMissing(originalBody));

      originalBody.replaceWith(newBody);
      clearMarkers(newBody);
      function.setIsGeneratorFunction(false);
      function.setIsAsyncFunction(false);
      compiler.reportChangeToEnclosingScope(newBody);
    }

    private Node qname(String helper) {
      return IR.qname(helperNamespace + "." + helper);
    }

    private void replaceArguments(Node n) {
      for (Node c = n.getFirstChild(); c != null; ) {
        Node next = c.getNext();
        if (c.isName() && c.getString().equals("arguments")) {
          c.replaceWith(IR.name(ARGUMENTS).srcref(c));
        } else if (!c.isFunction() || c.isArrowFunction()) {
          replaceArguments(c);
        }
        c = next;
      }
    }

    /** Converts a statement of the lowered function into steps of the program. */
    void transpileStatement(
        Node n,
        TranspilationContext.@Nullable Case breakCase,
        TranspilationContext.@Nullable Case continueCase) {
      if (!n.isSuspensionMarker()) {
        transpileUnmarkedNode(n);
        return;
      }
      switch (n.getToken()) {
        case LABEL:
          transpileLabel(n);
          break;
        case BLOCK:
          while (n.hasChildren()) {
            transpileStatement(n.removeFirstChild(), null, null);
          }
          break;
        case EXPR_RESULT:
          transpileExpressionResult(n);
          break;
        case VAR:
        case LET:
        case CONST:
          transpileDeclaration(n);
          break;
        case RETURN:
          writeSuspension(n.removeFirstChild());
          context.writeGeneratedNode(
              IR.returnNode(createInstruction(RETURN, resumeValue(n))).srcref(n));
          break;
        case THROW:
          writeSuspension(n.removeFirstChild());
          context.writeGeneratedNode(IR.throwNode(resumeValue(n)).srcref(n));
          break;
        case IF:
          transpileIf(n, breakCase);
          break;
        case WHILE:
          transpileWhile(n, breakCase, continueCase);
          break;
        case DO:
          transpileDo(n, breakCase, continueCase);
          break;
        case FOR:
          transpileFor(n, breakCase, continueCase);
          break;
        case TRY:
          transpileTry(n, breakCase);
          break;
        default:
          throw new IllegalStateException("Unsupported suspension: " + n.getToken());
      }
    }

    /** Copies a statement without suspension points into the current step. */
    void transpileUnmarkedNode(Node n) {
      if (n.isFunction()) {
        hoistedFunctions.add(n);
      } else if (n.isClass()) {
        String name = n.getFirstChild().getString();
        frameFields.add(name);
        context.writeGeneratedNode(
            IR.exprResult(IR.assign(IR.name(name).srcref(n), n)).srcrefIfMissing(n));
      } else if (n.isNameDeclaration()) {
        transpileDeclaration(n);
      } else if (n.isBlock() && hasLexicalDeclaration(n)) {
        context.transpileUnmarkedBlock(n);
        context.writeGeneratedNode(n);
      } else {
        Node block = n.isBlock() ? n : IR.block(n).srcref(n);
        context.transpileUnmarkedBlock(block);
        while (block.hasChildren()) {
          context.writeGeneratedNode(block.removeFirstChild());
        }
      }
    }

    private boolean hasLexicalDeclaration(Node block) {
      for (Node c = block.getFirstChild(); c != null; c = c.getNext()) {
        if (c.isLet() || c.isConst() || c.isClass() || c.isFunction()) {
          return true;
        }
      }
      return false;
    }

    void transpileLabel(Node n) {
      List<Node> labelNames = new ArrayList<>();
      while (n.isLabel()) {
        labelNames.add(n.removeFirstChild());
        n = n.removeFirstChild();
      }
      TranspilationContext.Case breakCase = context.createCase();
      TranspilationContext.Case continueCase =
          NodeUtil.isLoopStructure(n) ? context.createCase() : null;
      context.pushLabels(labelNames, breakCase, continueCase);
      transpileStatement(n, breakCase, continueCase);
      context.popLabels(labelNames);
      if (breakCase != context.currentCase) {
        context.switchCaseTo(breakCase);
      }
    }

    /** {@code yield e}, {@code await e} or {@code x = await e}. */
    void transpileExpressionResult(Node n) {
      Node expr = n.removeFirstChild();
      if (expr.isAssign()) {
        Node target = expr.removeFirstChild();
        writeSuspension(expr.removeFirstChild());
        context.writeGeneratedNode(
            IR.exprResult(IR.assign(target, resumeValue(n)).srcref(expr)).srcref(n));
      } else {
        writeSuspension(expr);
        context.writeGeneratedNode(IR.exprResult(resumeValue(n)).srcref(n));
      }
    }

    /**
     * Moves the names of a declaration into the frame and assigns their initial values.
     *
     * <pre>
     * let a = 1, b = await f(), c;
     * </pre>
     *
     * becomes the frame fields {@code a, b, c} and
     *
     * <pre>
     * a = 1;
     * return [4, f()];
     * case 1:
     * b = state.sent();
     * c = void 0;
     * </pre>
     */
    void transpileDeclaration(Node declaration) {
      for (Node name : declaration.children()) {
        frameFields.add(name.getString());
        Node value = name.removeFirstChild();
        if (value == null) {
          if (declaration.isVar()) {
            continue;
          }
          // A lexical declaration inside a loop must not see the previous iteration's value.
          value = IR.undefined().srcrefTree(name);
        } else if (isSuspension(value)) {
          writeSuspension(value);
          value = resumeValue(name);
        }
        context.writeGeneratedNode(
            IR.exprResult(IR.assign(IR.name(name.getString()).srcref(name), value).srcref(name))
                .srcref(declaration));
      }
    }

    void transpileIf(Node n, TranspilationContext.@Nullable Case breakCase) {
      Node condition = n.removeFirstChild();
      Node thenBlock = n.removeFirstChild();
      Node elseBlock = n.removeFirstChild();

      TranspilationContext.Case endCase = context.maybeCreateCase(breakCase);
      TranspilationContext.Case elseCase = elseBlock == null ? endCase : context.createCase();

      context.writeGeneratedNode(
          IR.ifNode(
                  IR.not(condition).srcref(condition),
                  IR.block(context.createJumpToNode(elseCase, n)).srcref(n))
              .srcref(n));
      transpileStatement(thenBlock, null, null);
      if (elseBlock != null) {
        context.writeJumpTo(endCase, n);
        context.switchCaseTo(elseCase);
        transpileStatement(elseBlock, null, null);
      }
      context.switchCaseTo(endCase);
    }

    void transpileWhile(
        Node n,
        TranspilationContext.@Nullable Case breakCase,
        TranspilationContext.@Nullable Case continueCase) {
      TranspilationContext.Case startCase = context.maybeCreateCase(continueCase);
      startCase.markUsed(); // the end of the loop jumps back to its start
      TranspilationContext.Case endCase = context.maybeCreateCase(breakCase);

      context.switchCaseTo(startCase);
      Node condition = n.removeFirstChild();
      Node body = n.removeFirstChild();
      context.writeGeneratedNode(
          IR.ifNode(
                  IR.not(condition).srcref(condition),
                  IR.block(context.createJumpToNode(endCase, n)).srcref(n))
              .srcref(n));

      context.pushBreakContinueContext(endCase, startCase);
      transpileStatement(body, null, null);
      context.popBreakContinueContext();
      context.writeJumpTo(startCase, n);

      context.switchCaseTo(endCase);
    }

    void transpileDo(
        Node n,
        TranspilationContext.@Nullable Case breakCase,
        TranspilationContext.@Nullable Case continueCase) {
      TranspilationContext.Case startCase = context.createCase();
      startCase.markUsed(); // the condition jumps back to the start
      breakCase = context.maybeCreateCase(breakCase);
      continueCase = context.maybeCreateCase(continueCase);

      context.switchCaseTo(startCase);
      Node body = n.removeFirstChild();
      context.pushBreakContinueContext(breakCase, continueCase);
      transpileStatement(body, null, null);
      context.popBreakContinueContext();

      context.switchCaseTo(continueCase);
      Node condition = n.removeFirstChild();
      context.writeGeneratedNode(
          IR.ifNode(condition, IR.block(context.createJumpToNode(startCase, n)).srcref(n))
              .srcref(n));
      context.switchCaseTo(breakCase);
    }

    void transpileFor(
        Node n,
        TranspilationContext.@Nullable Case breakCase,
        TranspilationContext.@Nullable Case continueCase) {
      Node init = n.removeFirstChild();
      Node condition = n.removeFirstChild();
      Node increment = n.removeFirstChild();
      Node body = n.removeFirstChild();

      if (init.isNameDeclaration()) {
        transpileDeclaration(init);
      } else if (!init.isEmpty()) {
        transpileUnmarkedNode(IR.exprResult(init).srcref(init));
      }

      TranspilationContext.Case startCase = context.createCase();
      startCase.markUsed(); // the increment jumps back to the start
      TranspilationContext.Case incrementCase = context.maybeCreateCase(continueCase);
      TranspilationContext.Case endCase = context.maybeCreateCase(breakCase);

      context.switchCaseTo(startCase);
      if (!condition.isEmpty()) {
        context.writeGeneratedNode(
            IR.ifNode(
                    IR.not(condition).srcref(condition),
                    IR.block(context.createJumpToNode(endCase, n)).srcref(n))
                .srcref(n));
      }

      context.pushBreakContinueContext(endCase, incrementCase);
      transpileStatement(body, null, null);
      context.popBreakContinueContext();

      context.switchCaseTo(incrementCase);
      if (!increment.isEmpty()) {
        transpileUnmarkedNode(IR.exprResult(increment).srcref(increment));
      }
      context.writeJumpTo(startCase, n);

      context.switchCaseTo(endCase);
    }

    /**
     * Lowers a {@code try} statement to an exception table entry {@code [start, catch, finally,
     * end]} followed by the steps of its blocks, in that order.
     */
    void transpileTry(Node n, TranspilationContext.@Nullable Case breakCase) {
      DisposalRegion region = DisposalRegion.fromNode(n);
      Node tryBlock = n.removeFirstChild();
      Node catchBlock = n.removeFirstChild();
      Node finallyBlock = n.removeFirstChild();

      TranspilationContext.Case startCase = context.createCase();
      startCase.markUsed(); // referenced by its own exception table entry
      TranspilationContext.Case catchCase =
          catchBlock.hasChildren() ? context.createCase() : null;
      TranspilationContext.Case finallyCase = finallyBlock == null ? null : context.createCase();
      TranspilationContext.Case endCase = context.maybeCreateCase(breakCase);

      context.switchCaseTo(startCase);
      context.writeGeneratedNode(
          IR.exprResult(
                  IR.call(
                      IR.getprop(IR.name(STATE), "trys", "push"),
                      IR.arraylit(
                          startCase.getNumber(n),
                          catchCase == null ? IR.empty() : catchCase.getNumber(n),
                          finallyCase == null ? IR.empty() : finallyCase.getNumber(n),
                          endCase.getNumber(n))))
              .srcrefTree(n));
      transpileStatement(tryBlock, null, null);
      context.maybeWriteJumpTo(endCase, n);

      if (catchCase != null) {
        context.switchCaseTo(catchCase);
        Node catchNode = catchBlock.getFirstChild();
        checkState(catchNode.isCatch(), catchNode);
        Node exceptionName = catchNode.removeFirstChild();
        Node catchBody = catchNode.removeFirstChild();
        if (exceptionName.isName()) {
          frameFields.add(exceptionName.getString());
          context.writeGeneratedNode(
              IR.exprResult(IR.assign(exceptionName, resumeValue(catchNode)).srcref(catchNode))
                  .srcref(catchNode));
        } else {
          context.writeGeneratedNode(IR.exprResult(resumeValue(catchNode)).srcref(catchNode));
        }
        transpileStatement(catchBody, null, null);
        context.maybeWriteJumpTo(endCase, n);
      }

      if (finallyCase != null) {
        context.switchCaseTo(finallyCase);
        if (region != null && region.isAsync()) {
          transpileAsyncUnwind(region, finallyBlock);
        } else {
          transpileStatement(finallyBlock, null, null);
        }
        context.writeGeneratedNode(
            IR.returnNode(createInstruction(END_FINALLY, null)).srcref(finallyBlock));
      }

      context.switchCaseTo(endCase);
    }

    /**
     * Disposes the resources of an asynchronous region one at a time, suspending on each
     * completion before the next disposal starts.
     *
     * <pre>
     * unwind = $jscomp.asyncUnwind(stack, hasError, error);
     * case loop:
     * if (!unwind.hasNext()) { return [3, done]; }
     * return [4, unwind.disposeNext()];
     * case next:
     * state.sent();
     * return [3, loop];
     * case done:
     * unwind.complete();
     * </pre>
     */
    void transpileAsyncUnwind(DisposalRegion region, Node finallyBlock) {
      String unwind = region.getUnwindName();
      frameFields.add(unwind);
      context.writeGeneratedNode(
          IR.exprResult(
                  IR.assign(
                      IR.name(unwind),
                      IR.call(
                          qname("asyncUnwind"),
                          IR.name(region.getStackName()),
                          IR.name(region.getHasErrorName()),
                          IR.name(region.getErrorName()))))
              .srcrefTree(finallyBlock));

      TranspilationContext.Case loopCase = context.createCase();
      loopCase.markUsed(); // every disposal jumps back to the loop
      TranspilationContext.Case doneCase = context.createCase();
      context.switchCaseTo(loopCase);
      context.writeGeneratedNode(
          IR.ifNode(
                  IR.not(IR.call(IR.getprop(IR.name(unwind), "hasNext"))),
                  IR.block(context.createJumpToNode(doneCase, finallyBlock)))
              .srcrefTreeIfMissing(finallyBlock));
      writeSuspension(
          IR.await(IR.call(IR.getprop(IR.name(unwind), "disposeNext")))
              .srcrefTree(finallyBlock));
      context.writeGeneratedNode(IR.exprResult(resumeValue(finallyBlock)).srcref(finallyBlock));
      context.writeJumpTo(loopCase, finallyBlock);

      context.switchCaseTo(doneCase);
      context.writeGeneratedNode(
          IR.exprResult(IR.call(IR.getprop(IR.name(unwind), "complete")))
              .srcrefTree(finallyBlock));
    }

    /** Ends the current step on a suspension and starts the step that resumes after it. */
    void writeSuspension(Node suspension) {
      checkState(suspension.isYield() || suspension.isAwait(), suspension);
      Node operand =
          suspension.hasChildren()
              ? suspension.removeFirstChild()
              : IR.undefined().srcrefTree(suspension);
      int instruction = SUSPEND;
      if (kind == FunctionKind.ASYNC_GENERATOR) {
        String action =
            suspension.isAwait()
                ? "AWAIT_VALUE"
                : suspension.isYieldAll() ? "YIELD_STAR" : "YIELD_VALUE";
        operand =
            IR.newNode(
                    qname("AsyncGeneratorWrapper$ActionRecord"),
                    qname("AsyncGeneratorWrapper$ActionEnum." + action),
                    operand)
                .srcrefTreeIfMissing(suspension);
      } else if (suspension.isYieldAll()) {
        instruction = DELEGATE;
      }
      context.writeGeneratedNode(
          IR.returnNode(createInstruction(instruction, operand)).srcref(suspension));

      TranspilationContext.Case resumeCase = context.createCase();
      resumeCase.markUsed(); // the runtime resumes at the step following the suspension
      context.switchCaseTo(resumeCase);
    }

    /** {@code state.sent()}: the value the frame was resumed with, or the error thrown into it. */
    Node resumeValue(Node sourceNode) {
      return IR.call(IR.getprop(IR.name(STATE), "sent")).srcrefTree(sourceNode);
    }

    Node createInstruction(int instruction, @Nullable Node operand) {
      Node array = IR.arraylit(IR.number(instruction));
      if (operand != null) {
        array.addChildToBack(operand);
      }
      return array;
    }

    /** The steps of the program being built, and the jump targets of the enclosing statements. */
    private final class TranspilationContext {

      /** Steps in program order; the runtime relies on this order for the exception table. */
      private final List<Case> cases = new ArrayList<>();

      private Case currentCase;

      private final HashMap<String, LabelCases> namedLabels = new HashMap<>();
      private final ArrayDeque<Case> breakCases = new ArrayDeque<>();
      private final ArrayDeque<Case> continueCases = new ArrayDeque<>();

      TranspilationContext() {
        currentCase = new Case();
        currentCase.markUsed();
        cases.add(currentCase);
      }

      void checkStateIsEmpty() {
        checkState(namedLabels.isEmpty());
        checkState(breakCases.isEmpty());
        checkState(continueCases.isEmpty());
      }

      /** Rewrites the returns, jumps and variables of original code that has no suspension. */
      void transpileUnmarkedBlock(Node block) {
        if (block.hasChildren()) {
          NodeTraversal.traverse(compiler, block, new UnmarkedNodeTranspiler());
        }
      }

      void writeGeneratedNode(Node n) {
        currentCase.addNode(n);
      }

      Case createCase() {
        return new Case();
      }

      Case maybeCreateCase(@Nullable Case other) {
        return other != null ? other : createCase();
      }

      /** {@code return [3, label];} */
      Node createJumpToNode(Case section, Node sourceNode) {
        return IR.returnNode(createInstruction(JUMP, section.getNumber(sourceNode)))
            .srcrefTree(sourceNode);
      }

      void writeJumpTo(Case section, Node sourceNode) {
        writeGeneratedNode(createJumpToNode(section, sourceNode));
      }

      /** Like {@link #writeJumpTo}, but writes nothing after a return or throw. */
      void maybeWriteJumpTo(Case section, Node sourceNode) {
        if (!endsWithTransfer(currentCase.caseBlock)) {
          writeJumpTo(section, sourceNode);
        }
      }

      /** Converts a {@code break} or {@code continue} that leaves the copied code into a jump. */
      void replaceBreakContinueWithJump(Node sourceNode, Case section) {
        Node jump = createJumpToNode(section, sourceNode);
        jump.setFrameSafe(true);
        sourceNode.replaceWith(jump);
      }

      /** Starts writing into {@code caseSection}, which follows the current step. */
      void switchCaseTo(Case caseSection) {
        if (caseSection.referenceCount == 0) {
          // Nothing jumps here: keep writing into the current step.
          checkState(!caseSection.caseBlock.hasChildren());
          caseSection.merged = true;
          return;
        }
        checkState(!cases.contains(caseSection), "Step written twice");
        cases.add(caseSection);
        currentCase = caseSection;
      }

      /**
       * Numbers the steps in program order and assembles {@code switch (state.label)}. A step that
       * can be entered by falling through from the previous one first records its own number, so
       * that the runtime resumes and dispatches exceptions relative to the right step.
       */
      Node buildSwitch() {
        for (int i = 0; i < cases.size(); i++) {
          cases.get(i).assignNumber(i);
        }
        Node switchNode = IR.switchNode(IR.getprop(IR.name(STATE), "label"));
        Case previous = null;
        for (Case c : cases) {
          if (previous != null && !endsWithTransfer(previous.caseBlock)) {
            c.caseBlock.addChildToFront(
                IR.exprResult(
                    IR.assign(IR.getprop(IR.name(STATE), "label"), IR.number(c.number))));
          }
          switchNode.addChildToBack(IR.caseNode(IR.number(c.number), c.caseBlock));
          previous = c;
        }
        if (!endsWithTransfer(previous.caseBlock)) {
          previous.caseBlock.addChildToBack(IR.returnNode(createInstruction(RETURN, null)));
        }
        return switchNode;
      }

      private boolean endsWithTransfer(Node caseBlock) {
        Node last = caseBlock.getLastChild();
        return last != null && (last.isReturn() || last.isThrow());
      }

      void pushLabels(List<Node> labelNames, Case breakCase, @Nullable Case continueCase) {
        for (Node labelName : labelNames) {
          checkState(labelName.isLabelName());
          namedLabels.put(labelName.getString(), new LabelCases(breakCase, continueCase));
        }
      }

      void popLabels(List<Node> labelNames) {
        for (Node labelName : labelNames) {
          namedLabels.remove(labelName.getString());
        }
      }

      void pushBreakContinueContext(Case breakCase, Case continueCase) {
        breakCases.push(breakCase);
        continueCases.push(continueCase);
      }

      void popBreakContinueContext() {
        breakCases.pop();
        continueCases.pop();
      }

      /** A step of the program. */
      private final class Case {
        final Node caseBlock = IR.block();

        /** Number nodes that refer to this step; filled in once steps are numbered. */
        private final List<Node> references = new ArrayList<>();

        int referenceCount;
        boolean merged;
        int number = -1;

        Node getNumber(Node sourceNode) {
          checkState(!merged, "Reference to a step that was merged into its predecessor");
          markUsed();
          Node number = IR.number(-1).srcref(sourceNode);
          references.add(number);
          return number;
        }

        void markUsed() {
          ++referenceCount;
        }

        void addNode(Node n) {
          checkState(IR.mayBeStatement(n), n);
          caseBlock.addChildToBack(n);
        }

        void assignNumber(int number) {
          this.number = number;
          for (Node reference : references) {
            reference.setDouble(number);
          }
        }
      }

      /** Jump targets of a labeled statement. */
      private final class LabelCases {
        final Case breakCase;
        final @Nullable Case continueCase;

        LabelCases(Case breakCase, @Nullable Case continueCase) {
          this.breakCase = breakCase;
          this.continueCase = continueCase;
        }
      }

      /**
       * Adjusts suspension-free code to run inside the program: moves {@code var} declarations into
       * the frame and turns {@code return} statements and jumps out of the copied code into
       * instructions.
       */
      private final class UnmarkedNodeTranspiler implements NodeTraversal.Callback {

        // Enclosing statements, inside the copied code, that a bare break could address.
        int breakSuppressors;
        int continueSuppressors;

        @Override
        public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
          if (n.isFrameSafe()) {
            return false;
          }
          checkState(!n.isSuspensionMarker(), n);

          if (NodeUtil.isLoopStructure(n)) {
            ++continueSuppressors;
            ++breakSuppressors;
          } else if (n.isSwitch()) {
            ++breakSuppressors;
          }

          if (n.isBreak() || n.isContinue()) {
            if (n.hasChildren()) {
              visitNamedBreakContinue(n);
            } else {
              visitBreakContinue(n);
            }
            return false;
          }
          return !n.isFunction() && !n.isClass();
        }

        @Override
        public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
          if (NodeUtil.isLoopStructure(n)) {
            --continueSuppressors;
            --breakSuppressors;
          } else if (n.isSwitch()) {
            --breakSuppressors;
          } else if (n.isReturn()) {
            visitReturn(n);
          } else if (n.isVar()) {
            visitVar(n, parent);
          }
        }

        /** {@code return v} to {@code return [2, v]}. */
        void visitReturn(Node n) {
          Node value = n.removeFirstChild();
          n.addChildToFront(createInstruction(RETURN, value).srcref(n));
        }

        void visitNamedBreakContinue(Node n) {
          LabelCases cases = namedLabels.get(n.getFirstChild().getString());
          if (cases != null) {
            replaceBreakContinueWithJump(n, n.isBreak() ? cases.breakCase : cases.continueCase);
          }
        }

        void visitBreakContinue(Node n) {
          if (n.isBreak() && breakSuppressors == 0) {
            replaceBreakContinueWithJump(n, breakCases.getFirst());
          } else if (n.isContinue() && continueSuppressors == 0) {
            replaceBreakContinueWithJump(n, continueCases.getFirst());
          }
        }

        /**
         * Moves the names of a {@code var} into the frame.
         *
         * <pre>
         * var a = "test", b = i + 5;
         * </pre>
         *
         * becomes
         *
         * <pre>
         * a = "test", b = i + 5;
         * </pre>
         */
        void visitVar(Node var, Node parent) {
          if ((parent.isForIn() || parent.isForOf() || parent.isForAwaitOf())
              && parent.getFirstChild() == var) {
            Node name = var.getOnlyChild();
            frameFields.add(name.getString());
            var.replaceWith(IR.name(name.getString()).srcref(name));
            return;
          }
          Node assignments = null;
          for (Node name : var.children()) {
            frameFields.add(name.getString());
            Node value = name.removeFirstChild();
            if (value != null) {
              Node assign = IR.assign(IR.name(name.getString()).srcref(name), value).srcref(name);
              assignments =
                  assignments == null ? assign : IR.comma(assignments, assign).srcref(name);
            }
          }
          if (parent.isVanillaFor() && parent.getFirstChild() == var) {
            var.replaceWith(assignments == null ? IR.empty().srcref(var) : assignments);
          } else if (assignments != null) {
            var.replaceWith(IR.exprResult(assignments).srcref(var));
          } else if (NodeUtil.isStatementParent(parent)) {
            var.detach();
          } else {
            var.replaceWith(IR.empty().srcref(var));
          }
        }
      }
    }
  }

  /** Marks yields and awaits and every node that contains one, up to the function body. */
  private static final class SuspensionMarker implements NodeTraversal.Callback {

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return !n.isFunction();
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.isYield() || n.isAwait() || n.isForAwaitOf()) {
        n.setSuspensionMarker(true);
      }
      // The traversal starts at the function body, so the marking stops there.
      if (parent != null && n.isSuspensionMarker()) {
        parent.setSuspensionMarker(true);
      }
    }
  }
}
