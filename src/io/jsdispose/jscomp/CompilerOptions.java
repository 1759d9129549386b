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

import com.google.common.base.Ascii;
import org.jspecify.annotations.Nullable;

/** Compiler options */
public class CompilerOptions {

  /** The output language. Resource-scoped declarations are lowered for every mode but NEXT. */
  private LanguageMode languageOut = LanguageMode.STABLE_OUT;

  /** Output code in a human readable form. */
  private boolean prettyPrint = true;

  /** Log the source after each pass at FINE level. */
  private boolean printSourceAfterEachPass = false;

  /** Namespace of the runtime helpers the rewritten code calls into. */
  private String runtimeHelperNamespace = "$jscomp";

  public CompilerOptions() {}

  public LanguageMode getLanguageOut() {
    return languageOut;
  }

  public void setLanguageOut(LanguageMode languageOut) {
    this.languageOut = languageOut;
  }

  public boolean isPrettyPrint() {
    return prettyPrint;
  }

  public void setPrettyPrint(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  public boolean shouldPrintSourceAfterEachPass() {
    return printSourceAfterEachPass;
  }

  public void setPrintSourceAfterEachPass(boolean printSource) {
    this.printSourceAfterEachPass = printSource;
  }

  public String getRuntimeHelperNamespace() {
    return runtimeHelperNamespace;
  }

  public void setRuntimeHelperNamespace(String namespace) {
    this.runtimeHelperNamespace = namespace;
  }

  /** When to do the extra sanity checks */
  public enum LanguageMode {
    /** Traditional JavaScript */
    ECMASCRIPT5,

    /** ECMAScript standard approved in 2015. Adds block scoping and generators. */
    ECMASCRIPT_2015,

    /** ECMAScript standard approved in 2016. */
    ECMASCRIPT_2016,

    /** ECMAScript standard approved in 2017. Adds async/await and other syntax */
    ECMASCRIPT_2017,

    /** ECMAScript standard approved in 2018. Adds async generators and for-await-of. */
    ECMASCRIPT_2018,

    /** ECMAScript standard approved in 2019. Adds catch blocks with no error binding. */
    ECMASCRIPT_2019,

    /** ECMAScript standard approved in 2020. */
    ECMASCRIPT_2020,

    /** ECMAScript standard approved in 2021. */
    ECMASCRIPT_2021,

    /** ECMAScript standard approved in 2022. Adds top-level await in modules. */
    ECMASCRIPT_2022,

    /** ECMAScript features from the upcoming standard, including resource-scoped declarations. */
    ECMASCRIPT_NEXT;

    /** The default output language level. */
    public static final LanguageMode STABLE_OUT = ECMASCRIPT5;

    public static @Nullable LanguageMode fromString(@Nullable String value) {
      if (value == null) {
        return null;
      }
      // Trim spaces, disregard case, and allow abbreviation of ECMASCRIPT for convenience.
      String canonicalizedName = Ascii.toUpperCase(value.trim()).replaceFirst("^ES", "ECMASCRIPT");

      if (canonicalizedName.equals("ECMASCRIPT6")) {
        return ECMASCRIPT_2015;
      }

      try {
        return LanguageMode.valueOf(canonicalizedName);
      } catch (IllegalArgumentException e) {
        return null; // unknown name.
      }
    }

    private boolean atLeast(LanguageMode other) {
      return compareTo(other) >= 0;
    }

    public boolean supportsBlockScoping() {
      return atLeast(ECMASCRIPT_2015);
    }

    public boolean supportsGenerators() {
      return atLeast(ECMASCRIPT_2015);
    }

    public boolean supportsAsyncFunctions() {
      return atLeast(ECMASCRIPT_2017);
    }

    public boolean supportsAsyncGenerators() {
      return atLeast(ECMASCRIPT_2018);
    }

    public boolean supportsOptionalCatchBinding() {
      return atLeast(ECMASCRIPT_2019);
    }

    public boolean supportsTopLevelAwait() {
      return atLeast(ECMASCRIPT_2022);
    }

    public boolean supportsUsingDeclarations() {
      return this == ECMASCRIPT_NEXT;
    }
  }
}
