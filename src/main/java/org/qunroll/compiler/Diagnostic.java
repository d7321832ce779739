/*
 * Copyright 2025 The Qunroll Authors
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

package org.qunroll.compiler;

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;
import org.qunroll.ast.AstPrinter;
import org.qunroll.ast.Expr;
import org.qunroll.ast.SourcePosition;
import org.qunroll.ast.Statement;

/**
 * A problem found while loading or unrolling a program. Every Diagnostic carries the position of
 * the construct that caused it and (usually) a one-line rendering of that construct.
 */
public record Diagnostic(
    Diagnostic.Kind kind, String message, SourcePosition position, @Nullable String snippet) {

  public enum Kind {
    SWITCH_TARGET_TYPE,
    CASE_LABEL_TYPE,
    NOT_CONSTANT,
    DUPLICATE_CASE,
    EMPTY_SWITCH,
    UNSUPPORTED_STATEMENT,
    REDECLARATION,
    UNDECLARED_IDENTIFIER,
    IMMUTABLE_ASSIGNMENT,
    TYPE_MISMATCH,
    ARGUMENT_MISMATCH,
    INDEX_OUT_OF_RANGE,
    INLINE_DEPTH,
    SYNTAX
  }

  /** Returns a Diagnostic located at the given expression. */
  @FormatMethod
  static Diagnostic at(Kind kind, Expr expr, String fmt, Object... fmtArgs) {
    return new Diagnostic(kind, String.format(fmt, fmtArgs), expr.pos(), AstPrinter.print(expr));
  }

  /** Returns a Diagnostic located at the given statement. */
  @FormatMethod
  static Diagnostic at(Kind kind, Statement statement, String fmt, Object... fmtArgs) {
    return new Diagnostic(
        kind, String.format(fmt, fmtArgs), statement.pos(), AstPrinter.snippet(statement));
  }

  /** Returns a Diagnostic with no rendered snippet. */
  @FormatMethod
  static Diagnostic at(Kind kind, SourcePosition position, String fmt, Object... fmtArgs) {
    return new Diagnostic(kind, String.format(fmt, fmtArgs), position, null);
  }
}
