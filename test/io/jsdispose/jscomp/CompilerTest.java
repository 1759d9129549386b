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
import static org.junit.Assert.assertThrows;

import io.jsdispose.jscomp.CompilerOptions.LanguageMode;
import io.jsdispose.rhino.IR;
import io.jsdispose.rhino.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest {

  @Test
  public void testNextOutputKeepsUsingDeclarations() {
    Compiler compiler = newCompiler(LanguageMode.ECMASCRIPT_NEXT);
    assertThat(compiler.getTranspilationPasses()).isEmpty();

    Node script = parse("{ using r = open(); }");
    Node expected = script.cloneTree();
    Result result = compiler.compile(IR.root(script));

    assertThat(result.success).isTrue();
    assertThat(result.changedScopeCount).isEqualTo(0);
    assertThat(script.isEquivalentTo(expected)).isTrue();
  }

  @Test
  public void testLowersUsingDeclarations() {
    Compiler compiler = newCompiler(LanguageMode.ECMASCRIPT_2021);
    assertThat(compiler.getTranspilationPasses()).containsKey("rewriteUsingDeclarations");

    Node script = parse("function f() { using r = open(); use(r); }");
    Result result = compiler.compile(IR.root(script));

    assertThat(result.success).isTrue();
    assertThat(result.errors).isEmpty();
    assertThat(result.changedScopeCount).isEqualTo(1);
    String source = compiler.toSource(script);
    assertThat(source).contains("$jscomp.using($jscomp$using$stack$0");
    assertThat(source).contains("$jscomp.dispose(");
    assertThat(source).doesNotContain("using r");
  }

  @Test
  public void testErrorsAreReported() {
    Compiler compiler = newCompiler(LanguageMode.ECMASCRIPT_2021);
    Result result = compiler.compile(IR.root(parse("using r = open();")));

    assertThat(result.success).isFalse();
    assertThat(result.errors).hasSize(1);
    assertThat(result.errors.get(0).getType())
        .isEqualTo(RewriteUsingDeclarations.USING_AT_SCRIPT_TOP_LEVEL);
    assertThat(compiler.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testCompileRequiresScriptOrRoot() {
    Compiler compiler = newCompiler(LanguageMode.ECMASCRIPT_2021);
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> compiler.compile(IR.block()));
    assertThat(e).hasMessageThat().contains("Expected SCRIPT or ROOT");
  }

  private static Compiler newCompiler(LanguageMode languageOut) {
    CompilerOptions options = new CompilerOptions();
    options.setLanguageOut(languageOut);
    options.setPrettyPrint(false);
    return new Compiler(options, CompilerTestCase.collectingErrorManager());
  }

  private static Node parse(String source) {
    return SourceParser.parse("testcode", source);
  }
}
