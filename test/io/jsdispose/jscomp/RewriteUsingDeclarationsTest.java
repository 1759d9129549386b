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

import io.jsdispose.jscomp.CompilerOptions.LanguageMode;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link RewriteUsingDeclarations}. */
@RunWith(JUnit4.class)
public final class RewriteUsingDeclarationsTest extends CompilerTestCase {

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    // Async functions are native from here on, so only the rewrite itself is under test.
    setLanguageOut(LanguageMode.ECMASCRIPT_2021);
  }

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteUsingDeclarations(compiler);
  }

  /** The temporaries of region {@code id} followed by its guarded region around {@code body}. */
  private static String region(int id, String... body) {
    return guardedRegion(id, "$jscomp.dispose", body);
  }

  private static String asyncRegion(int id, String... body) {
    return guardedRegion(id, "await $jscomp.disposeAsync", body);
  }

  private static String guardedRegion(int id, String unwind, String... body) {
    return lines(
        "const $jscomp$using$stack$" + id + " = [];",
        "let $jscomp$using$error$" + id + ";",
        "let $jscomp$using$hasError$" + id + " = false;",
        "try {",
        lines(body),
        "} catch ($jscomp$using$caught$" + id + ") {",
        "  $jscomp$using$error$" + id + " = $jscomp$using$caught$" + id + ";",
        "  $jscomp$using$hasError$" + id + " = true;",
        "} finally {",
        "  " + unwind + "(",
        "      $jscomp$using$stack$" + id + ",",
        "      $jscomp$using$hasError$" + id + ",",
        "      $jscomp$using$error$" + id + ");",
        "}");
  }

  @Test
  public void testBlock() {
    test(
        lines(
            "function f() {", //
            "  {",
            "    using x = open();",
            "    use(x);",
            "  }",
            "}"),
        lines(
            "function f() {",
            "  {",
            region(0, "const x = $jscomp.using($jscomp$using$stack$0, open());", "use(x);"),
            "  }",
            "}"));
  }

  @Test
  public void testFunctionBodyKeepsDirectivePrologue() {
    test(
        lines(
            "function f() {", //
            "  'use strict';",
            "  using x = open();",
            "  return x.value;",
            "}"),
        lines(
            "function f() {",
            "  'use strict';",
            region(0, "const x = $jscomp.using($jscomp$using$stack$0, open());", "return x.value;"),
            "}"));
  }

  @Test
  public void testDeclarationsAreRegisteredInOrder() {
    test(
        lines(
            "function f() {", //
            "  using a = open('a'), b = open('b');",
            "  log();",
            "  using c = open('c');",
            "}"),
        lines(
            "function f() {",
            region(
                0,
                "const a = $jscomp.using($jscomp$using$stack$0, open('a')),",
                "    b = $jscomp.using($jscomp$using$stack$0, open('b'));",
                "log();",
                "const c = $jscomp.using($jscomp$using$stack$0, open('c'));"),
            "}"));
  }

  @Test
  public void testStatementsBeforeTheFirstDeclarationAreGuarded() {
    test(
        lines(
            "function f() {", //
            "  prepare();",
            "  using x = open();",
            "}"),
        lines(
            "function f() {",
            region(0, "prepare();", "const x = $jscomp.using($jscomp$using$stack$0, open());"),
            "}"));
  }

  @Test
  public void testNestedScopesAreRewrittenIndependently() {
    test(
        lines(
            "function f() {",
            "  using outer = open('outer');",
            "  {",
            "    using inner = open('inner');",
            "  }",
            "}"),
        lines(
            "function f() {",
            region(
                1,
                "const outer = $jscomp.using($jscomp$using$stack$1, open('outer'));",
                "{",
                region(0, "const inner = $jscomp.using($jscomp$using$stack$0, open('inner'));"),
                "}"),
            "}"));
  }

  @Test
  public void testScopesWithoutDeclarationsAreUntouched() {
    testSame(
        lines(
            "function f() {", //
            "  const x = open();",
            "  { let y = x; }",
            "  try { use(x); } finally { x.close(); }",
            "}"));
  }

  @Test
  public void testAwaitUsingInAsyncFunction() {
    test(
        lines(
            "async function f() {", //
            "  await using x = open();",
            "  await x.ready();",
            "}"),
        lines(
            "async function f() {",
            asyncRegion(
                0,
                "const x = $jscomp.usingAsync($jscomp$using$stack$0, open());",
                "await x.ready();"),
            "}"));
  }

  @Test
  public void testMixedDeclarationsShareOneAsyncRegion() {
    test(
        lines(
            "async function f() {", //
            "  using a = open('a');",
            "  await using b = open('b');",
            "}"),
        lines(
            "async function f() {",
            asyncRegion(
                0,
                "const a = $jscomp.using($jscomp$using$stack$0, open('a'));",
                "const b = $jscomp.usingAsync($jscomp$using$stack$0, open('b'));"),
            "}"));
  }

  @Test
  public void testSyncUsingInAsyncFunctionKeepsSyncUnwind() {
    test(
        lines(
            "async function f() {", //
            "  using a = open('a');",
            "  await a.ready();",
            "}"),
        lines(
            "async function f() {",
            region(
                0,
                "const a = $jscomp.using($jscomp$using$stack$0, open('a'));",
                "await a.ready();"),
            "}"));
  }

  @Test
  public void testArrowFunction() {
    test(
        "const f = () => { using x = open(); return x.id; };",
        lines(
            "const f = () => {",
            region(0, "const x = $jscomp.using($jscomp$using$stack$0, open());", "return x.id;"),
            "};"));
  }

  @Test
  public void testClassMembers() {
    test(
        lines(
            "class C {",
            "  constructor() { using x = open(); this.id = x.id; }",
            "  get value() { using x = open(); return x.value; }",
            "  static {",
            "    using x = open();",
            "    C.ready = x.ready;",
            "  }",
            "}"),
        lines(
            "class C {",
            "  constructor() {",
            region(0, "const x = $jscomp.using($jscomp$using$stack$0, open());", "this.id = x.id;"),
            "  }",
            "  get value() {",
            region(1, "const x = $jscomp.using($jscomp$using$stack$1, open());", "return x.value;"),
            "  }",
            "  static {",
            region(2, "const x = $jscomp.using($jscomp$using$stack$2, open());", "C.ready = x.ready;"),
            "  }",
            "}"));
  }

  @Test
  public void testGeneratorIsLeftNativeWhenSupported() {
    test(
        lines(
            "function* g() {", //
            "  using x = open();",
            "  yield x;",
            "}"),
        lines(
            "function* g() {",
            region(0, "const x = $jscomp.using($jscomp$using$stack$0, open());", "yield x;"),
            "}"));
  }

  @Test
  public void testControlFlowBranches() {
    test(
        lines(
            "function f(c) {",
            "  if (c) {",
            "    using x = open();",
            "  } else {",
            "    using y = open();",
            "  }",
            "}"),
        lines(
            "function f(c) {",
            "  if (c) {",
            region(0, "const x = $jscomp.using($jscomp$using$stack$0, open());"),
            "  } else {",
            region(1, "const y = $jscomp.using($jscomp$using$stack$1, open());"),
            "  }",
            "}"));
  }

  @Test
  public void testTryCatchAndFinallyBodies() {
    test(
        lines(
            "function f() {",
            "  try {",
            "    using a = open('a');",
            "  } catch (e) {",
            "    using b = open('b');",
            "  } finally {",
            "    using c = open('c');",
            "  }",
            "}"),
        lines(
            "function f() {",
            "  try {",
            region(0, "const a = $jscomp.using($jscomp$using$stack$0, open('a'));"),
            "  } catch (e) {",
            region(1, "const b = $jscomp.using($jscomp$using$stack$1, open('b'));"),
            "  } finally {",
            region(2, "const c = $jscomp.using($jscomp$using$stack$2, open('c'));"),
            "  }",
            "}"));
  }

  @Test
  public void testLabeledBlockKeepsBreakInsideRegion() {
    test(
        lines(
            "function f() {",
            "  outer: {",
            "    using x = open();",
            "    if (x.done) break outer;",
            "    use(x);",
            "  }",
            "}"),
        lines(
            "function f() {",
            "  outer: {",
            region(
                0,
                "const x = $jscomp.using($jscomp$using$stack$0, open());",
                "if (x.done) { break outer; }",
                "use(x);"),
            "  }",
            "}"));
  }

  @Test
  public void testSwitchCaseKeepsTemporariesInANestedBlock() {
    test(
        lines(
            "function f(k) {",
            "  switch (k) {",
            "    case 1:",
            "      using x = open();",
            "      use(x);",
            "      break;",
            "    default:",
            "      other();",
            "  }",
            "}"),
        lines(
            "function f(k) {",
            "  switch (k) {",
            "    case 1: {",
            region(0, "const x = $jscomp.using($jscomp$using$stack$0, open());", "use(x);", "break;"),
            "    }",
            "    default:",
            "      other();",
            "  }",
            "}"));
  }

  @Test
  public void testLoopBodyGetsARegionPerIteration() {
    test(
        lines(
            "function f(names) {",
            "  for (let i = 0; i < names.length; i++) {",
            "    using x = open(names[i]);",
            "    if (x.skip) continue;",
            "    use(x);",
            "  }",
            "}"),
        lines(
            "function f(names) {",
            "  for (let i = 0; i < names.length; i++) {",
            region(
                0,
                "const x = $jscomp.using($jscomp$using$stack$0, open(names[i]));",
                "if (x.skip) { continue; }",
                "use(x);"),
            "  }",
            "}"));
  }

  @Test
  public void testForOfHeadBindsEachValue() {
    test(
        lines(
            "function f(xs) {", //
            "  for (using x of xs) {",
            "    use(x);",
            "  }",
            "}"),
        lines(
            "function f(xs) {",
            "  for (const $jscomp$using$value$0 of xs) {",
            region(
                1,
                "const x = $jscomp.using($jscomp$using$stack$1, $jscomp$using$value$0);",
                "use(x);"),
            "  }",
            "}"));
  }

  @Test
  public void testForAwaitOfHead() {
    test(
        lines(
            "async function f(xs) {", //
            "  for await (await using x of xs) {",
            "    use(x);",
            "  }",
            "}"),
        lines(
            "async function f(xs) {",
            "  for await (const $jscomp$using$value$0 of xs) {",
            asyncRegion(
                1,
                "const x = $jscomp.usingAsync($jscomp$using$stack$1, $jscomp$using$value$0);",
                "use(x);"),
            "  }",
            "}"));
  }

  @Test
  public void testForHeadMovesIntoEnclosingBlock() {
    test(
        lines(
            "function f() {",
            "  loop: for (using x = open(); x.more(); ) step(x);",
            "}"),
        lines(
            "function f() {",
            "  {",
            region(
                0,
                "const x = $jscomp.using($jscomp$using$stack$0, open());",
                "loop: for (; x.more(); ) { step(x); }"),
            "  }",
            "}"));
  }

  @Test
  public void testUsingInForInHeadIsAnError() {
    testError(
        "function f(o) { for (using x in o) {} }",
        RewriteUsingDeclarations.USING_IN_FOR_IN,
        "'using' declarations are not allowed in the head of a for-in loop.");
  }

  @Test
  public void testUsingAtScriptTopLevelIsAnError() {
    testError(
        "using x = open();",
        RewriteUsingDeclarations.USING_AT_SCRIPT_TOP_LEVEL,
        "'using' declarations are not allowed at the top level of a script.");
  }

  @Test
  public void testAwaitUsingOutsideAsyncFunctionIsAnError() {
    testError(
        "function f() { await using x = open(); }",
        RewriteUsingDeclarations.AWAIT_USING_OUTSIDE_ASYNC);
  }

  @Test
  public void testAwaitUsingInStaticBlockIsAnError() {
    testError(
        "async function f() { class C { static { await using x = open(); } } }",
        RewriteUsingDeclarations.AWAIT_USING_OUTSIDE_ASYNC);
  }

  @Test
  public void testErrorLeavesScopeUntouched() {
    testError(
        "function f() { await using x = open(); }",
        RewriteUsingDeclarations.AWAIT_USING_OUTSIDE_ASYNC);
    assertThat(getLastCompiler().getChangedScopeRoots()).isEmpty();
  }

  @Test
  public void testModuleBody() {
    test(
        lines(
            "import {open} from './resources';",
            "using r = open();",
            "export const value = r.read();",
            "export function helper() { return value; }",
            "export default r.name;"),
        lines(
            "import {open} from './resources';",
            "let r, value, $jscomp$using$default$0;",
            "export function helper() { return value; }",
            region(
                0,
                "r = $jscomp.using($jscomp$using$stack$0, open());",
                "value = r.read();",
                "$jscomp$using$default$0 = r.name;"),
            "export {value};",
            "export {$jscomp$using$default$0 as default};"));
  }

  @Test
  public void testModuleBodyClassesAndExportLists() {
    test(
        lines(
            "using r = open();",
            "class Local {}",
            "export class Pool {}",
            "export {Local as Other};",
            "export * from './more';"),
        lines(
            "let r, Local, Pool;",
            region(
                0,
                "r = $jscomp.using($jscomp$using$stack$0, open());",
                "Local = class Local {};",
                "Pool = class Pool {};"),
            "export {Pool};",
            "export {Local as Other};",
            "export * from './more';"));
  }

  @Test
  public void testTopLevelAwaitUsingInModule() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2022);
    test(
        lines(
            "await using r = open();", //
            "export const id = r.id;"),
        lines(
            "let r, id;",
            asyncRegion(
                0,
                "r = $jscomp.usingAsync($jscomp$using$stack$0, open());",
                "id = r.id;"),
            "export {id};"));
  }

  @Test
  public void testTopLevelAwaitUsingNeedsTopLevelAwait() {
    testError(
        lines(
            "await using r = open();", //
            "export const id = r.id;"),
        RewriteUsingDeclarations.TOP_LEVEL_AWAIT_USING_NOT_SUPPORTED,
        "Top-level 'await using' requires an output language of ECMASCRIPT_2022 or higher,"
            + " found ECMASCRIPT_2021.");
  }

  @Test
  public void testNamespaceBody() {
    test(
        lines(
            "namespace ns {", //
            "  using r = open();",
            "  export const id = r.id;",
            "}"),
        lines(
            "namespace ns {",
            "  let r;",
            "  export let id;",
            region(0, "r = $jscomp.using($jscomp$using$stack$0, open());", "id = r.id;"),
            "}"));
  }

  @Test
  public void testEs5OutputUsesVar() {
    setLanguageOut(LanguageMode.ECMASCRIPT5);
    test(
        lines(
            "function f() {", //
            "  using x = open();",
            "  use(x);",
            "}"),
        lines(
            "function f() {",
            "  var $jscomp$using$stack$0 = [];",
            "  var $jscomp$using$error$0 = void 0;",
            "  var $jscomp$using$hasError$0 = false;",
            "  try {",
            "    var x = $jscomp.using($jscomp$using$stack$0, open());",
            "    use(x);",
            "  } catch ($jscomp$using$caught$0) {",
            "    $jscomp$using$error$0 = $jscomp$using$caught$0;",
            "    $jscomp$using$hasError$0 = true;",
            "  } finally {",
            "    $jscomp.dispose(",
            "        $jscomp$using$stack$0, $jscomp$using$hasError$0, $jscomp$using$error$0);",
            "  }",
            "}"));
  }

  @Test
  public void testRecordsChangedScopes() {
    test(
        lines(
            "function f() { using x = open(); }", //
            "function g() { return 1; }"),
        lines(
            "function f() {",
            region(0, "const x = $jscomp.using($jscomp$using$stack$0, open());"),
            "}",
            "function g() { return 1; }"));
    assertThat(getLastCompiler().getChangedScopeRoots()).hasSize(1);
  }
}
