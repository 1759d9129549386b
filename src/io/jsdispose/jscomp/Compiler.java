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

import com.google.common.collect.ImmutableSet;
import io.jsdispose.rhino.Node;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Compiler (and the other classes in this package) does the following:
 *
 * <ul>
 *   <li>runs the configured passes over an already parsed tree
 *   <li>collects diagnostics through an {@link ErrorManager}
 *   <li>generates JavaScript source for the resulting tree
 * </ul>
 */
public class Compiler extends AbstractCompiler {

  /**
   * Logger for the whole io.jsdispose.jscomp domain - setting configuration for this logger
   * affects all loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("io.jsdispose.jscomp");

  private final CompilerOptions options;

  private ErrorManager errorManager;

  private final UniqueIdSupplier uniqueIdSupplier = new UniqueIdSupplier();

  private final Set<Node> changedScopeRoots = new LinkedHashSet<>();

  /** Creates a Compiler that reports errors and warnings to its logger. */
  public Compiler(CompilerOptions options) {
    this(options, new LoggingErrorManager(new LightweightMessageFormatter(), logger));
  }

  /** Creates a Compiler that uses a custom error manager. */
  public Compiler(CompilerOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  @Override
  public CompilerOptions getOptions() {
    return options;
  }

  @Override
  public ErrorManager getErrorManager() {
    return errorManager;
  }

  public void setErrorManager(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager);
  }

  @Override
  public UniqueIdSupplier getUniqueIdSupplier() {
    return uniqueIdSupplier;
  }

  @Override
  public void report(JSError error) {
    CheckLevel level = error.defaultLevel();
    if (level.isOn()) {
      errorManager.report(level, error);
    }
  }

  @Override
  void throwInternalError(String message, Throwable cause) {
    throw new RuntimeException(
        "INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n" + message, cause);
  }

  /** Gets the number of errors. */
  public int getErrorCount() {
    return errorManager.getErrorCount();
  }

  /** Gets the number of warnings. */
  public int getWarningCount() {
    return errorManager.getWarningCount();
  }

  @Override
  public void reportChangeToEnclosingScope(Node n) {
    Node scopeRoot = n;
    while (scopeRoot.getParent() != null && !scopeRoot.isFunction() && !scopeRoot.isScript()) {
      scopeRoot = scopeRoot.getParent();
    }
    changedScopeRoots.add(scopeRoot);
  }

  /** Returns the scope roots changed since the last call to {@link #resetChangeTracking()}. */
  public ImmutableSet<Node> getChangedScopeRoots() {
    return ImmutableSet.copyOf(changedScopeRoots);
  }

  public void resetChangeTracking() {
    changedScopeRoots.clear();
  }

  /** The passes run by {@link #compile}, in order, keyed by name. */
  Map<String, CompilerPass> getTranspilationPasses() {
    Map<String, CompilerPass> passes = new LinkedHashMap<>();
    if (!options.getLanguageOut().supportsUsingDeclarations()) {
      passes.put("rewriteUsingDeclarations", new RewriteUsingDeclarations(this));
    }
    return passes;
  }

  /**
   * Runs the transpilation passes over {@code root}, a SCRIPT or a ROOT holding scripts.
   *
   * @return the diagnostics reported while compiling
   */
  public Result compile(Node root) {
    return compile(null, root);
  }

  public Result compile(@Nullable Node externs, Node root) {
    checkState(root.isScript() || root.isRoot(), "Expected SCRIPT or ROOT, found %s", root);
    resetChangeTracking();
    for (Map.Entry<String, CompilerPass> entry : getTranspilationPasses().entrySet()) {
      if (errorManager.hasHaltingErrors()) {
        logger.fine("Skipping pass " + entry.getKey() + " after errors");
        break;
      }
      logger.fine("Running pass " + entry.getKey());
      entry.getValue().process(externs, root);
      if (options.shouldPrintSourceAfterEachPass()) {
        logger.fine("// " + entry.getKey() + " yields:\n" + toSource(root));
      }
    }
    errorManager.generateReport();
    return getResult();
  }

  /** Returns the result of the compilation so far. */
  public Result getResult() {
    return new Result(
        errorManager.getErrors(),
        errorManager.getWarnings(),
        changedScopeRoots.size());
  }

  @Override
  public String toSource(Node n) {
    return new CodePrinter.Builder(n).setCompilerOptions(options).build();
  }
}
