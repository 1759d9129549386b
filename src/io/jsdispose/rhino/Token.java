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

/** The node types of the intermediate representation. */
public enum Token {
  RETURN,
  BITOR,
  BITXOR,
  BITAND,
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  NOT,
  NEG,
  NEW,
  TYPEOF,
  VOID,
  GETPROP,
  GETELEM,
  CALL,
  NAME,
  NUMBER,
  STRINGLIT,
  NULL,
  THIS,
  FALSE,
  TRUE,
  SHEQ,
  SHNE,
  INSTANCEOF,
  IN,
  THROW,
  ARRAYLIT,
  OBJECTLIT,
  TRY,
  COMMA,
  ASSIGN,
  ASSIGN_ADD,
  ASSIGN_SUB,
  HOOK,
  OR,
  AND,
  COALESCE,
  INC,
  DEC,
  FUNCTION,
  IF,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  WHILE,
  DO,
  FOR,
  FOR_IN,
  FOR_OF,
  FOR_AWAIT_OF,
  BREAK,
  CONTINUE,
  VAR,
  LET,
  CONST,
  // Resource-scoped declarations: `using x = e` and `await using x = e`.
  USING,
  AWAIT_USING,
  EXPR_RESULT,
  SCRIPT,
  MODULE_BODY,
  ROOT,
  BLOCK,
  LABEL,
  LABEL_NAME,
  CATCH,
  EMPTY,
  DEBUGGER,
  STRING_KEY,
  COMPUTED_PROP,
  PARAM_LIST,
  YIELD,
  AWAIT,
  SUPER,
  CLASS,
  CLASS_MEMBERS,
  MEMBER_FUNCTION_DEF,
  GETTER_DEF,
  SETTER_DEF,
  IMPORT,
  IMPORT_SPECS,
  IMPORT_SPEC,
  IMPORT_STAR,
  EXPORT,
  EXPORT_SPECS,
  EXPORT_SPEC,
  NAMESPACE,
  NAMESPACE_ELEMENTS;

  /** Returns true if the token is one of the name declaration tokens. */
  public boolean isNameDeclaration() {
    switch (this) {
      case VAR:
      case LET:
      case CONST:
      case USING:
      case AWAIT_USING:
        return true;
      default:
        return false;
    }
  }

  /** Returns true if the token is a resource-scoped declaration. */
  public boolean isUsingDeclaration() {
    return this == USING || this == AWAIT_USING;
  }
}
