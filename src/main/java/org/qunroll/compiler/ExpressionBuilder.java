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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.qunroll.ast.Expr;
import org.qunroll.compiler.QasmParser.BinaryExpressionContext;
import org.qunroll.compiler.QasmParser.BoolLiteralContext;
import org.qunroll.compiler.QasmParser.CallExpressionContext;
import org.qunroll.compiler.QasmParser.ExpressionListContext;
import org.qunroll.compiler.QasmParser.FloatLiteralContext;
import org.qunroll.compiler.QasmParser.IdExpressionContext;
import org.qunroll.compiler.QasmParser.IndexContext;
import org.qunroll.compiler.QasmParser.IndexExpressionContext;
import org.qunroll.compiler.QasmParser.IndexedIdContext;
import org.qunroll.compiler.QasmParser.IntLiteralContext;
import org.qunroll.compiler.QasmParser.UnaryExpressionContext;

/** A visitor that converts expression parse trees to {@link Expr}s. */
class ExpressionBuilder extends VisitorBase<Expr> {

  ExpressionBuilder(DiagnosticsReporter reporter) {
    super(reporter);
  }

  /** Returns the expressions of an optional expression list. */
  ImmutableList<Expr> list(@Nullable ExpressionListContext ctx) {
    if (ctx == null) {
      return ImmutableList.of();
    }
    return ctx.expression().stream().map(this::visit).collect(ImmutableList.toImmutableList());
  }

  /**
   * Converts {@code id[i][j, k]} to an Index whose base is the Index {@code id[i]}, matching what
   * {@link #visitIndexExpression} builds for the same text.
   */
  Expr indexedId(IndexedIdContext ctx) {
    Expr result = new Expr.Identifier(ctx.ID().getText(), position(ctx));
    for (IndexContext index : ctx.index()) {
      result = new Expr.Index(result, list(index.expressionList()), position(ctx));
    }
    return result;
  }

  @Override
  public Expr visitIntLiteral(IntLiteralContext ctx) {
    String text = ctx.INT_LITERAL().getText().replace("_", "");
    try {
      long value =
          (text.startsWith("0x") || text.startsWith("0X"))
              ? Long.parseLong(text.substring(2), 16)
              : Long.parseLong(text);
      return new Expr.IntLiteral(value, position(ctx));
    } catch (NumberFormatException e) {
      throw error("Integer literal %s is out of range", ctx.getText());
    }
  }

  @Override
  public Expr visitFloatLiteral(FloatLiteralContext ctx) {
    String text = ctx.FLOAT_LITERAL().getText().replace("_", "");
    return new Expr.FloatLiteral(Double.parseDouble(text), text, position(ctx));
  }

  @Override
  public Expr visitBoolLiteral(BoolLiteralContext ctx) {
    return new Expr.BoolLiteral(ctx.TRUE() != null, position(ctx));
  }

  @Override
  public Expr visitIdExpression(IdExpressionContext ctx) {
    return new Expr.Identifier(ctx.ID().getText(), position(ctx));
  }

  @Override
  public Expr visitCallExpression(CallExpressionContext ctx) {
    return new Expr.Call(ctx.ID().getText(), list(ctx.expressionList()), position(ctx));
  }

  @Override
  public Expr visitIndexExpression(IndexExpressionContext ctx) {
    Expr base = visit(ctx.expression());
    if (base instanceof Expr.Identifier || base instanceof Expr.Index) {
      return new Expr.Index(base, list(ctx.index().expressionList()), position(ctx));
    }
    throw error("Cannot index %s", ctx.expression().getText());
  }

  @Override
  public Expr visitUnaryExpression(UnaryExpressionContext ctx) {
    return new Expr.Unary(
        Expr.UnaryOp.fromSymbol(ctx.op.getText()), visit(ctx.expression()), position(ctx));
  }

  @Override
  public Expr visitBinaryExpression(BinaryExpressionContext ctx) {
    return new Expr.Binary(
        Expr.BinaryOp.fromSymbol(ctx.op.getText()),
        visit(ctx.expression(0)),
        visit(ctx.expression(1)),
        position(ctx));
  }
}
