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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import io.jsdispose.jscomp.ProtectedScopeAnalyzer.ScopeKind;
import io.jsdispose.rhino.IR;
import io.jsdispose.rhino.Node;
import io.jsdispose.rhino.Token;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites {@code using} and {@code await using} declarations into a guarded region that releases
 * the declared resources in reverse order on every exit from their scope.
 *
 * <pre>
 *   { using x = open(); use(x); }
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   {
 *     const $jscomp$using$stack$0 = [];
 *     let $jscomp$using$error$0;
 *     let $jscomp$using$hasError$0 = false;
 *     try {
 *       const x = $jscomp.using($jscomp$using$stack$0, open());
 *       use(x);
 *     } catch ($jscomp$using$caught$0) {
 *       $jscomp$using$error$0 = $jscomp$using$caught$0;
 *       $jscomp$using$hasError$0 = true;
 *     } finally {
 *       $jscomp.dispose($jscomp$using$stack$0, $jscomp$using$hasError$0, $jscomp$using$error$0);
 *     }
 *   }
 * </pre>
 *
 * <p>Generators and async functions that host such a region are handed to the {@link
 * SuspendableFrameAdapter} when the output language cannot express them natively.
 */
public final class RewriteUsingDeclarations implements CompilerPass, NodeTraversal.Callback {
  private static final Logger logger = Logger.getLogger(RewriteUsingDeclarations.class.getName());

  static final DiagnosticType USING_AT_SCRIPT_TOP_LEVEL =
      DiagnosticType.error(
          "JSC_USING_AT_SCRIPT_TOP_LEVEL",
          "''{0}'' declarations are not allowed at the top level of a script.");

  static final DiagnosticType AWAIT_USING_OUTSIDE_ASYNC =
      DiagnosticType.error(
          "JSC_AWAIT_USING_OUTSIDE_ASYNC",
          "''await using'' is only allowed in async functions and at the top level of modules.");

  static final DiagnosticType TOP_LEVEL_AWAIT_USING_NOT_SUPPORTED =
      DiagnosticType.error(
          "JSC_TOP_LEVEL_AWAIT_USING_NOT_SUPPORTED",
          "Top-level ''await using'' requires an output language of ECMASCRIPT_2022 or higher,"
              + " found {0}.");

  static final DiagnosticType USING_IN_FOR_IN =
      DiagnosticType.error(
          "JSC_USING_IN_FOR_IN",
          "''{0}'' declarations are not allowed in the head of a for-in loop.");

  private static final String VALUE_PREFIX = "$jscomp$using$value$";

  private final AbstractCompiler compiler;
  private final String helperNamespace;
  private final boolean blockScopedOutput;
  private final SuspendableFrameAdapter frameAdapter;

  /** Suspendable functions that host at least one rewritten region. */
  private final Set<Node> regionHosts = new LinkedHashSet<>();

  private int rewrittenScopes = 0;

  public RewriteUsingDeclarations(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.helperNamespace = compiler.getOptions().getRuntimeHelperNamespace();
    this.blockScopedOutput = compiler.getOptions().getLanguageOut().supportsBlockScoping();
    this.frameAdapter = new SuspendableFrameAdapter(compiler);
  }

  @Override
  public void process(@Nullable Node externs, Node root) {
    rewrittenScopes = 0;
    NodeTraversal.traverse(compiler, root, new LoopHeadNormalizer());
    NodeTraversal.traverse(compiler, root, this);
    logger.fine("Rewrote " + rewrittenScopes + " scopes with resource-scoped declarations");
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isFunction()) {
      if (regionHosts.remove(n) && frameAdapter.needsLowering(n)) {
        frameAdapter.lower(t, n);
      }
      return;
    }
    ScopeKind kind = ProtectedScopeAnalyzer.classify(n);
    if (kind == null || !ProtectedScopeAnalyzer.needsWrapping(n)) {
      return;
    }
    if (!checkDeclarationPlacement(t, n, kind)) {
      // Leave the scope untouched; the reported errors halt the compilation.
      return;
    }
    rewriteScope(t, n, kind);
  }

  /** Reports misplaced declarations of {@code scope} and returns whether all are well placed. */
  private boolean checkDeclarationPlacement(NodeTraversal t, Node scope, ScopeKind kind) {
    boolean valid = true;
    for (Node decl : ProtectedScopeAnalyzer.getUsingDeclarations(scope)) {
      if (kind == ScopeKind.SCRIPT) {
        t.report(decl, USING_AT_SCRIPT_TOP_LEVEL, keyword(decl));
        valid = false;
        continue;
      }
      if (!decl.isAwaitUsing()) {
        continue;
      }
      switch (getAwaitContext(scope)) {
        case ASYNC_FUNCTION:
          break;
        case MODULE:
          {
            CompilerOptions.LanguageMode languageOut = compiler.getOptions().getLanguageOut();
            if (!languageOut.supportsTopLevelAwait()) {
              t.report(decl, TOP_LEVEL_AWAIT_USING_NOT_SUPPORTED, languageOut.toString());
              valid = false;
            }
            break;
          }
        case NONE:
          t.report(decl, AWAIT_USING_OUTSIDE_ASYNC);
          valid = false;
          break;
      }
    }
    return valid;
  }

  private enum AwaitContext {
    ASYNC_FUNCTION,
    MODULE,
    NONE
  }

  private static AwaitContext getAwaitContext(Node scope) {
    for (Node n = scope; n != null; n = n.getParent()) {
      if (n.isFunction()) {
        return n.isAsyncFunction() ? AwaitContext.ASYNC_FUNCTION : AwaitContext.NONE;
      } else if (NodeUtil.isClassStaticBlock(n)) {
        return AwaitContext.NONE;
      } else if (n.isModuleBody()) {
        return AwaitContext.MODULE;
      }
    }
    return AwaitContext.NONE;
  }

  private static String keyword(Node decl) {
    return decl.isAwaitUsing() ? "await using" : "using";
  }

  private void rewriteScope(NodeTraversal t, Node scope, ScopeKind kind) {
    Node srcref = ProtectedScopeAnalyzer.getUsingDeclarations(scope).get(0);
    DisposalRegion region =
        DisposalRegion.create(
            compiler.getUniqueIdSupplier().getUniqueId(t.getSourceName()),
            ProtectedScopeAnalyzer.isAsync(scope));

    ScopeParts parts =
        kind == ScopeKind.MODULE_BODY || kind == ScopeKind.NAMESPACE_BODY
            ? splitModuleLikeBody(scope, region, kind == ScopeKind.NAMESPACE_BODY)
            : splitBody(scope, kind, region);

    Node tryNode = createGuardedRegion(region, parts.guarded).srcrefTreeIfMissing(srcref);
    List<Node> replacement = new ArrayList<>(parts.beforeRegion);
    for (Node temp : createTemporaries(region)) {
      replacement.add(temp.srcrefTreeIfMissing(srcref));
    }
    replacement.add(tryNode);

    if (kind == ScopeKind.SWITCH_CASE) {
      // Keeps the temporaries local to the case.
      scope.addChildToBack(IR.block(replacement).srcref(srcref));
    } else {
      for (Node n : replacement) {
        scope.addChildToBack(n);
      }
    }
    for (Node n : parts.afterRegion) {
      scope.addChildToBack(n);
    }

    Node enclosingFunction = t.getEnclosingFunction();
    if (enclosingFunction != null
        && ProtectedScopeAnalyzer.getFunctionKind(enclosingFunction).isSuspendable()) {
      regionHosts.add(enclosingFunction);
    }
    rewrittenScopes++;
    compiler.reportChangeToEnclosingScope(tryNode);
  }

  /** The statements of a scope, sorted by where they go relative to the guarded region. */
  private static final class ScopeParts {
    final List<Node> beforeRegion = new ArrayList<>();
    final List<Node> guarded = new ArrayList<>();
    final List<Node> afterRegion = new ArrayList<>();
  }

  /** Guards every statement except the directive prologue of a function body. */
  private ScopeParts splitBody(Node scope, ScopeKind kind, DisposalRegion region) {
    ScopeParts parts = new ScopeParts();
    boolean inPrologue = kind == ScopeKind.FUNCTION_BODY;
    for (Node stmt : detachStatements(scope)) {
      if (inPrologue && isDirective(stmt)) {
        parts.beforeRegion.add(stmt);
        continue;
      }
      inPrologue = false;
      if (stmt.isUsingDeclaration()) {
        substituteUsingDeclaration(stmt, region);
      }
      parts.guarded.add(stmt);
    }
    return parts;
  }

  /**
   * Splits a module or namespace body. Bindings of the guarded statements stay visible to the whole
   * body: they are declared before the region and assigned inside it. Imports and function
   * declarations move before the region and export lists after it.
   */
  private ScopeParts splitModuleLikeBody(Node scope, DisposalRegion region, boolean namespace) {
    ScopeParts parts = new ScopeParts();
    Set<String> hoistedNames = new LinkedHashSet<>();
    Set<String> exportedNames = new LinkedHashSet<>();
    List<Node> hoistedFunctions = new ArrayList<>();
    List<Node> exportLists = new ArrayList<>();

    for (Node stmt : detachStatements(scope)) {
      switch (stmt.getToken()) {
        case IMPORT:
          parts.beforeRegion.add(stmt);
          break;
        case FUNCTION:
          hoistedFunctions.add(stmt);
          break;
        case EXPORT:
          splitExport(
              stmt,
              region,
              hoistedNames,
              exportedNames,
              hoistedFunctions,
              exportLists,
              parts.guarded);
          break;
        case CLASS:
          hoistClass(stmt, stmt.getFirstChild().getString(), hoistedNames, parts.guarded);
          break;
        case VAR:
        case LET:
        case CONST:
        case USING:
        case AWAIT_USING:
          hoistDeclaration(stmt, region, hoistedNames, parts.guarded);
          break;
        default:
          parts.guarded.add(stmt);
          break;
      }
    }

    Token hoistedType = blockScopedOutput ? Token.LET : Token.VAR;
    Node declaration = new Node(hoistedType);
    Node exportDeclaration = new Node(hoistedType);
    for (String name : hoistedNames) {
      if (namespace && exportedNames.contains(name)) {
        exportDeclaration.addChildToBack(IR.name(name));
      } else {
        declaration.addChildToBack(IR.name(name));
      }
    }
    if (declaration.hasChildren()) {
      parts.beforeRegion.add(declaration.srcrefTree(scope));
    }
    if (exportDeclaration.hasChildren()) {
      parts.beforeRegion.add(IR.export(exportDeclaration).srcrefTree(scope));
    }
    parts.beforeRegion.addAll(hoistedFunctions);

    if (!namespace && !exportedNames.isEmpty()) {
      Node specs = new Node(Token.EXPORT_SPECS);
      for (String name : exportedNames) {
        specs.addChildToBack(IR.exportSpec(IR.name(name), IR.name(name)));
      }
      parts.afterRegion.add(IR.export(specs).srcrefTree(scope));
    }
    parts.afterRegion.addAll(exportLists);
    return parts;
  }

  private void splitExport(
      Node export,
      DisposalRegion region,
      Set<String> hoistedNames,
      Set<String> exportedNames,
      List<Node> hoistedFunctions,
      List<Node> exportLists,
      List<Node> guarded) {
    Node declaration = export.getFirstChild();
    if (export.isExportAllFrom() || declaration.isExportSpecs()) {
      exportLists.add(export);
    } else if (declaration.isFunction()) {
      hoistedFunctions.add(export);
    } else if (export.isExportDefault()) {
      String name =
          declaration.isClass() && !declaration.getFirstChild().isEmpty()
              ? declaration.getFirstChild().getString()
              : region.getDefaultExportName();
      hoistedNames.add(name);
      guarded.add(
          IR.exprResult(IR.assign(IR.name(name), declaration.detach())).srcrefTree(export));
      exportLists.add(
          IR.export(IR.exportSpecs(IR.exportSpec(IR.name(name), IR.name("default"))))
              .srcrefTree(export));
    } else if (declaration.isClass()) {
      String name = declaration.getFirstChild().getString();
      hoistClass(declaration.detach(), name, hoistedNames, guarded);
      exportedNames.add(name);
    } else {
      checkState(declaration.isNameDeclaration(), declaration);
      for (Node name : declaration.children()) {
        exportedNames.add(name.getString());
      }
      hoistDeclaration(declaration.detach(), region, hoistedNames, guarded);
    }
  }

  private static void hoistClass(
      Node classNode, String name, Set<String> hoistedNames, List<Node> guarded) {
    hoistedNames.add(name);
    Node assign = IR.assign(IR.name(name), classNode);
    guarded.add(IR.exprResult(assign).srcrefTreeIfMissing(classNode));
  }

  /** Replaces a declaration by assignments of its initializers to the hoisted names. */
  private void hoistDeclaration(
      Node declaration, DisposalRegion region, Set<String> hoistedNames, List<Node> guarded) {
    for (Node name : declaration.children()) {
      hoistedNames.add(name.getString());
      Node value = name.removeFirstChild();
      if (value == null) {
        continue;
      }
      if (declaration.isUsingDeclaration()) {
        value = createRegistration(region, declaration.isAwaitUsing(), value);
      }
      guarded.add(
          IR.exprResult(IR.assign(IR.name(name.getString()), value)).srcrefTreeIfMissing(name));
    }
  }

  private static ImmutableList<Node> detachStatements(Node scope) {
    ImmutableList.Builder<Node> statements = ImmutableList.builder();
    while (scope.hasChildren()) {
      statements.add(scope.removeFirstChild());
    }
    return statements.build();
  }

  private static boolean isDirective(Node stmt) {
    return stmt.isExprResult() && stmt.getFirstChild().isStringLit();
  }

  /** {@code using x = e} to {@code const x = $jscomp.using(stack, e)}. */
  private void substituteUsingDeclaration(Node decl, DisposalRegion region) {
    boolean isAwait = decl.isAwaitUsing();
    for (Node name : decl.children()) {
      Node value = checkNotNull(name.removeFirstChild(), "Missing initializer: %s", name);
      name.addChildToBack(createRegistration(region, isAwait, value));
    }
    decl.setToken(blockScopedOutput ? Token.CONST : Token.VAR);
  }

  private Node createRegistration(DisposalRegion region, boolean isAwait, Node value) {
    Node helper = IR.qname(helperNamespace + (isAwait ? ".usingAsync" : ".using"));
    return IR.call(helper, IR.name(region.getStackName()), value).srcrefTreeIfMissing(value);
  }

  private ImmutableList<Node> createTemporaries(DisposalRegion region) {
    if (blockScopedOutput) {
      return ImmutableList.of(
          IR.constNode(IR.name(region.getStackName()), IR.arraylit()),
          IR.let(IR.name(region.getErrorName())),
          IR.let(IR.name(region.getHasErrorName()), IR.falseNode()));
    }
    // A var without initializer would keep the value of the previous loop iteration.
    return ImmutableList.of(
        IR.var(IR.name(region.getStackName()), IR.arraylit()),
        IR.var(IR.name(region.getErrorName()), IR.undefined()),
        IR.var(IR.name(region.getHasErrorName()), IR.falseNode()));
  }

  private Node createGuardedRegion(DisposalRegion region, List<Node> guarded) {
    Node catchBody =
        IR.block(
            IR.exprResult(
                IR.assign(IR.name(region.getErrorName()), IR.name(region.getCaughtName()))),
            IR.exprResult(IR.assign(IR.name(region.getHasErrorName()), IR.trueNode())));
    Node tryNode =
        IR.tryCatchFinally(
            IR.block(guarded),
            IR.catchNode(IR.name(region.getCaughtName()), catchBody),
            IR.block(IR.exprResult(createUnwind(region))));
    region.attachTo(tryNode);
    return tryNode;
  }

  /** {@code $jscomp.dispose(...)} or {@code await $jscomp.disposeAsync(...)}. */
  private Node createUnwind(DisposalRegion region) {
    Node call =
        IR.call(
            IR.qname(helperNamespace + (region.isAsync() ? ".disposeAsync" : ".dispose")),
            IR.name(region.getStackName()),
            IR.name(region.getHasErrorName()),
            IR.name(region.getErrorName()));
    return region.isAsync() ? IR.await(call) : call;
  }

  /**
   * Moves resource-scoped declarations out of loop heads so that every declaration is a statement
   * of the scope it belongs to.
   *
   * <pre>
   *   for (using x of xs) body
   *   =&gt; for (const $jscomp$using$value$0 of xs) { using x = $jscomp$using$value$0; body }
   *
   *   for (using x = e; c; u) body
   *   =&gt; { using x = e; for (; c; u) body }
   * </pre>
   */
  private final class LoopHeadNormalizer extends NodeTraversal.AbstractPostOrderCallback {
    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      switch (n.getToken()) {
        case FOR_OF:
        case FOR_AWAIT_OF:
          if (n.getFirstChild().isUsingDeclaration()) {
            moveIterationBinding(t, n);
          }
          break;
        case FOR_IN:
          if (n.getFirstChild().isUsingDeclaration()) {
            t.report(n.getFirstChild(), USING_IN_FOR_IN, keyword(n.getFirstChild()));
          }
          break;
        case FOR:
          if (n.getFirstChild().isUsingDeclaration()) {
            moveInitializer(n);
          }
          break;
        default:
          break;
      }
    }

    private void moveIterationBinding(NodeTraversal t, Node loop) {
      Node decl = loop.getFirstChild();
      checkState(decl.hasOneChild(), "Expected a single binding: %s", decl);
      String valueName =
          VALUE_PREFIX + compiler.getUniqueIdSupplier().getUniqueId(t.getSourceName());
      Node binding = decl.getFirstChild();
      checkState(!binding.hasChildren(), "Unexpected initializer: %s", binding);
      binding.addChildToBack(IR.name(valueName).srcref(binding));

      Token valueType = blockScopedOutput ? Token.CONST : Token.VAR;
      decl.replaceWith(new Node(valueType, IR.name(valueName)).srcrefTree(decl));
      loop.getLastChild().addChildToFront(decl);
      compiler.reportChangeToEnclosingScope(loop);
    }

    private void moveInitializer(Node loop) {
      Node insertionPoint = loop;
      while (insertionPoint.getParent().isLabel()) {
        insertionPoint = insertionPoint.getParent();
      }
      Node decl = loop.getFirstChild();
      decl.replaceWith(IR.empty().srcref(decl));
      Node block = IR.block().srcref(insertionPoint);
      insertionPoint.replaceWith(block);
      block.addChildToBack(decl);
      block.addChildToBack(insertionPoint);
      compiler.reportChangeToEnclosingScope(block);
    }
  }
}
