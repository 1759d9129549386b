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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.base.Joiner;
import com.google.errorprone.annotations.ForOverride;
import com.google.errorprone.annotations.OverridingMethodsMustInvokeSuper;
import io.jsdispose.jscomp.CompilerOptions.LanguageMode;
import io.jsdispose.rhino.IR;
import io.jsdispose.rhino.Node;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.junit.Before;

/**
 * Base class for testing JS compiler passes that change the node tree of a compiled JS input.
 *
 * <p>Inputs and expected outputs are compared as node trees rather than as strings, so expected
 * code does not have to match the printed spacing.
 */
public abstract class CompilerTestCase {
  private static final Joiner LINE_JOINER = Joiner.on('\n');

  /** The file name given to every test input. */
  protected static final String FILENAME = "testcode";

  private LanguageMode languageOut;

  private @Nullable Compiler lastCompiler;

  /** Gets the compiler pass instance to use for a test. */
  @ForOverride
  protected abstract CompilerPass getProcessor(Compiler compiler);

  /**
   * Gets the number of times the pass should be run. Running it twice checks that the pass leaves
   * its own output alone.
   */
  @ForOverride
  protected int getNumRepetitions() {
    return 2;
  }

  @ForOverride
  protected CompilerOptions getOptions() {
    CompilerOptions options = new CompilerOptions();
    options.setLanguageOut(languageOut);
    options.setPrettyPrint(true);
    return options;
  }

  @Before
  @OverridingMethodsMustInvokeSuper
  public void setUp() throws Exception {
    languageOut = LanguageMode.ECMASCRIPT_2015;
    lastCompiler = null;
  }

  protected final void setLanguageOut(LanguageMode languageOut) {
    this.languageOut = languageOut;
  }

  protected final Compiler getLastCompiler() {
    if (lastCompiler == null) {
      throw new IllegalStateException("No test has run yet");
    }
    return lastCompiler;
  }

  /** Joins lines of source into one program text. */
  protected static String lines(String... lines) {
    return LINE_JOINER.join(lines);
  }

  /** Asserts that the pass turns {@code js} into {@code expected} without reporting anything. */
  protected final void test(String js, String expected) {
    Node script = compile(js, getNumRepetitions());
    assertNoDiagnostics();
    Node expectedScript = SourceParser.parse(FILENAME, expected);
    if (!expectedScript.isEquivalentTo(script)) {
      String expectedSource = toSource(expectedScript);
      String actualSource = toSource(script);
      assertWithMessage(
              "Unexpected output.\nExpected tree:\n%s\nResult tree:\n%s",
              expectedScript.toStringTree(),
              script.toStringTree())
          .that(actualSource)
          .isEqualTo(expectedSource);
      throw new AssertionError(
          "Trees differ although they print the same:\n"
              + expectedScript.toStringTree()
              + "\nvs\n"
              + script.toStringTree());
    }
  }

  /** Asserts that the pass leaves {@code js} unchanged. */
  protected final void testSame(String js) {
    test(js, js);
  }

  /** Asserts that the pass reports exactly one error of the given type. */
  protected final void testError(String js, DiagnosticType type) {
    testError(js, type, null);
  }

  /** Asserts that the pass reports exactly one error of the given type and description. */
  protected final void testError(String js, DiagnosticType type, @Nullable String description) {
    compile(js, 1);
    Result result = getLastCompiler().getResult();
    assertWithMessage("Expected one error, found " + result.errors)
        .that(result.errors)
        .hasSize(1);
    JSError error = result.errors.get(0);
    assertThat(error.getType()).isEqualTo(type);
    if (description != null) {
      assertThat(error.getDescription()).isEqualTo(description);
    }
    assertThat(result.success).isFalse();
  }

  /** Asserts that the pass reports no errors or warnings on {@code js}. */
  protected final void testNoWarning(String js) {
    compile(js, 1);
    assertNoDiagnostics();
  }

  /** Compiles {@code js} and returns the resulting script. */
  protected final Node compile(String js, int repetitions) {
    Compiler compiler = new Compiler(getOptions(), collectingErrorManager());
    lastCompiler = compiler;
    Node script = SourceParser.parse(FILENAME, js);
    Node root = IR.root(script);
    CompilerPass pass = getProcessor(compiler);
    for (int i = 0; i < repetitions; i++) {
      pass.process(null, root);
      if (compiler.getErrorCount() > 0) {
        break;
      }
    }
    return root.getFirstChild();
  }

  private void assertNoDiagnostics() {
    Result result = getLastCompiler().getResult();
    assertWithMessage("Unexpected errors").that(result.errors).isEmpty();
    assertWithMessage("Unexpected warnings").that(result.warnings).isEmpty();
  }

  protected final String toSource(Node n) {
    return new CodePrinter.Builder(n).setPrettyPrint(true).build();
  }

  /** Keeps the diagnostics for inspection without printing them. */
  static ErrorManager collectingErrorManager() {
    Logger silent = Logger.getAnonymousLogger();
    silent.setUseParentHandlers(false);
    return new LoggingErrorManager(new LightweightMessageFormatter(), silent);
  }
}
