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
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.qunroll.ast.SourcePosition;
import org.qunroll.compiler.QasmParser.ParenExpressionContext;

/**
 * A base class for the visitors that build the AST from an ANTLR parse tree.
 *
 * <ul>
 *   <li>It disables the default "do nothing" behavior for node types that haven't been overridden.
 *       Visiting a node that doesn't have an explicit visit* method will throw an AssertionError.
 *   <li>It provides error() methods that report a SYNTAX diagnostic located at the node currently
 *       being visited.
 * </ul>
 */
class VisitorBase<T> extends QasmBaseVisitor<T> {
  final DiagnosticsReporter reporter;

  /** The node currently being visited. */
  private ParseTree currentNode;

  VisitorBase(DiagnosticsReporter reporter) {
    this.reporter = reporter;
  }

  @Override
  protected final T defaultResult() {
    // Only reached from a visitXXX() method we failed to override.
    throw new AssertionError();
  }

  /**
   * Visits {@code tree}, binding {@link #currentNode} for the duration of the call.
   *
   * <p>Assumes that if the visit throws, this Visitor will not be used again (no attempt is made to
   * restore the correct currentNode state).
   */
  @Override
  public final T visit(ParseTree tree) {
    ParseTree prevNode = currentNode;
    currentNode = tree;
    T result = super.visit(tree);
    currentNode = prevNode;
    return result;
  }

  @Override
  public final T visitParenExpression(ParenExpressionContext ctx) {
    // Parentheses don't change the interpretation of the parenthesized expression.
    return visit(ctx.expression());
  }

  /** Returns the position of the first token of the given node. */
  static SourcePosition position(ParserRuleContext ctx) {
    return Compiler.position(ctx.start);
  }

  /** Returns the first token of the current node. */
  Token currentToken() {
    return ((ParserRuleContext) currentNode).start;
  }

  /** Returns a {@link ValidationError} pointing at the current node. */
  @FormatMethod
  ValidationError error(String fmt, Object... fmtArgs) {
    return reporter.report(
        Diagnostic.at(Diagnostic.Kind.SYNTAX, Compiler.position(currentToken()), fmt, fmtArgs));
  }
}
