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
import io.jsdispose.rhino.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static final String PROGRAM =
      Joiner.on('\n')
          .join(
              "import {open} from './files.js';",
              "export class Reader extends Base {",
              "  constructor(path) { super(path); this.path = path; }",
              "  get name() { return this.path; }",
              "  static { Reader.count = 0; }",
              "  async *lines() {",
              "    await using f = await open(this.path);",
              "    for await (const line of f) { yield line; }",
              "  }",
              "}",
              "export function count(xs) {",
              "  using a = open(xs[0]), b = open(xs[1]);",
              "  let n = 0;",
              "  outer: for (let i = 0; i < xs.length; i++) {",
              "    switch (typeof xs[i]) {",
              "      case 'string': n += 1; break;",
              "      default: if (!xs[i]) { continue outer; } else { n = n * 2 - 1; }",
              "    }",
              "  }",
              "  try { return n > 0 ? n : -n; } catch (e) { throw e; } finally { a.close(); }",
              "}",
              "const f = async (x) => await x;",
              "export {f as run};");

  @Test
  public void testCompactDeclarations() {
    assertCompact("var x = 1; var y = 2;", "var x=1;var y=2");
  }

  @Test
  public void testCompactUsingDeclarations() {
    assertCompact("using x = open();", "using x=open()");
    assertCompact("await using x = open();", "await using x=open()");
  }

  @Test
  public void testCompactTry() {
    assertCompact(
        "try { a(); } catch (e) { b(); } finally { c(); }", "try{a()}catch(e){b()}finally{c()}");
  }

  @Test
  public void testCompactSwitch() {
    assertCompact(
        "switch (k) { case 1: a(); break; default: b(); }",
        "switch(k){case 1:a();break;default:b()}");
  }

  @Test
  public void testCompactParenthesizesWhereNeeded() {
    assertCompact("(function() {})();", "(function(){}())");
    assertCompact("new (f())();", "new(f())()");
    assertCompact("x = () => ({a: 1});", "x=()=>({a:1})");
    assertCompact("(a ?? b) || c;", "(a??b)||c");
    assertCompact("(a, b) + c;", "(a,b)+c");
    assertCompact("a - -b;", "a- -b");
  }

  @Test
  public void testCompactKeepsInOutOfForInit() {
    assertCompact("for (var i = (a in b); i;) {}", "for(var i=(a in b);i;){}");
  }

  @Test
  public void testCompactArrayHoles() {
    assertCompact("x = [, 1, ,];", "x=[,1,,]");
  }

  @Test
  public void testPrettyPrintElseAndCatchStayOnTheClosingBraceLine() {
    assertPretty("if (a) { b(); } else { c(); }", "if (a) {\n  b();\n} else {\n  c();\n}\n");
    assertPretty(
        "try { a(); } catch (e) { b(); } finally { c(); }",
        "try {\n  a();\n} catch (e) {\n  b();\n} finally {\n  c();\n}\n");
  }

  @Test
  public void testPrettyPrintSwitchIndentsCaseBodies() {
    assertPretty(
        "switch (k) { case 1: a(); break; default: b(); }",
        "switch (k) {\n  case 1:\n    a();\n    break;\n  default:\n    b();\n}\n");
  }

  @Test
  public void testQuoteEscapes() {
    assertThat(CodeGenerator.quote("a\"b\\c\n\u00e9")).isEqualTo("\"a\\\"b\\\\c\\n\\u00e9\"");
  }

  @Test
  public void testPrettyPrintRoundTrip() {
    assertRoundTrip(true);
  }

  @Test
  public void testCompactRoundTrip() {
    assertRoundTrip(false);
  }

  @Test
  public void testPrettyPrintIndentsBlocks() {
    Node root = SourceParser.parse("in.js", "if (a) { b(); }");
    String printed = new CodePrinter.Builder(root).setPrettyPrint(true).build();
    assertThat(printed).contains("\n  b();\n");
  }

  private static void assertCompact(String source, String expected) {
    Node root = SourceParser.parse("in.js", source);
    assertThat(new CodePrinter.Builder(root).setPrettyPrint(false).build()).isEqualTo(expected);
  }

  private static void assertPretty(String source, String expected) {
    Node root = SourceParser.parse("in.js", source);
    assertThat(new CodePrinter.Builder(root).setPrettyPrint(true).build()).isEqualTo(expected);
  }

  private static void assertRoundTrip(boolean prettyPrint) {
    Node original = SourceParser.parse("in.js", PROGRAM);
    String printed = new CodePrinter.Builder(original).setPrettyPrint(prettyPrint).build();
    Node reparsed = SourceParser.parse("out.js", printed);
    assertWithMessage(printed).that(reparsed.isEquivalentTo(original)).isTrue();
  }
}
