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

package org.qunroll.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/**
 * An immutable expression tree. Every node records the position of its first token.
 *
 * <p>Expressions are shared by reference between the loaded program, the validation passes, and
 * the unrolled output; nothing ever mutates them.
 */
public sealed interface Expr
    permits Expr.IntLiteral,
        Expr.FloatLiteral,
        Expr.BoolLiteral,
        Expr.Identifier,
        Expr.Index,
        Expr.Unary,
        Expr.Binary,
        Expr.Call,
        Expr.Measure {

  SourcePosition pos();

  record IntLiteral(long value, SourcePosition pos) implements Expr {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /** {@code text} is the literal as written, so that diagnostics quote it exactly. */
  record FloatLiteral(double value, String text, SourcePosition pos) implements Expr {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record BoolLiteral(boolean value, SourcePosition pos) implements Expr {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record Identifier(String name, SourcePosition pos) implements Expr {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /**
   * {@code a[0][1]} is an Index whose base is the Index {@code a[0]}; {@code a[0, 1]} is a single
   * Index with two indices.
   */
  record Index(Expr base, ImmutableList<Expr> indices, SourcePosition pos) implements Expr {
    /** Returns the identifier at the root of a chain of Index nodes, if there is one. */
    public Identifier rootIdentifier() {
      Expr e = this;
      while (e instanceof Index index) {
        e = index.base;
      }
      if (!(e instanceof Identifier id)) {
        throw new IllegalStateException("Index base is not an identifier: " + e);
      }
      return id;
    }

    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record Unary(UnaryOp op, Expr operand, SourcePosition pos) implements Expr {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record Binary(BinaryOp op, Expr left, Expr right, SourcePosition pos) implements Expr {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record Call(String name, ImmutableList<Expr> args, SourcePosition pos) implements Expr {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /** Only appears as the value of a declaration or assignment. */
  record Measure(Expr operand, SourcePosition pos) implements Expr {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  enum UnaryOp {
    NEGATE("-"),
    NOT("!"),
    BIT_NOT("~");

    public final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public static UnaryOp fromSymbol(String symbol) {
      return Arrays.stream(values())
          .filter(op -> op.symbol.equals(symbol))
          .findFirst()
          .orElseThrow(() -> new IllegalArgumentException("Unknown unary operator " + symbol));
    }
  }

  /** The result category of a binary operator, used by the type checker. */
  enum OpKind {
    ARITHMETIC,
    BITWISE,
    COMPARISON,
    LOGICAL
  }

  enum BinaryOp {
    POWER("**", 12, OpKind.ARITHMETIC),
    TIMES("*", 11, OpKind.ARITHMETIC),
    DIVIDE("/", 11, OpKind.ARITHMETIC),
    MODULO("%", 11, OpKind.ARITHMETIC),
    PLUS("+", 10, OpKind.ARITHMETIC),
    MINUS("-", 10, OpKind.ARITHMETIC),
    SHIFT_LEFT("<<", 9, OpKind.BITWISE),
    SHIFT_RIGHT(">>", 9, OpKind.BITWISE),
    LESS("<", 8, OpKind.COMPARISON),
    LESS_EQUAL("<=", 8, OpKind.COMPARISON),
    GREATER(">", 8, OpKind.COMPARISON),
    GREATER_EQUAL(">=", 8, OpKind.COMPARISON),
    EQUAL("==", 7, OpKind.COMPARISON),
    NOT_EQUAL("!=", 7, OpKind.COMPARISON),
    BIT_AND("&", 6, OpKind.BITWISE),
    BIT_XOR("^", 5, OpKind.BITWISE),
    BIT_OR("|", 4, OpKind.BITWISE),
    AND("&&", 3, OpKind.LOGICAL),
    OR("||", 2, OpKind.LOGICAL);

    public final String symbol;

    /** Higher binds tighter. */
    public final int precedence;

    public final OpKind kind;

    BinaryOp(String symbol, int precedence, OpKind kind) {
      this.symbol = symbol;
      this.precedence = precedence;
      this.kind = kind;
    }

    public static BinaryOp fromSymbol(String symbol) {
      return Arrays.stream(values())
          .filter(op -> op.symbol.equals(symbol))
          .findFirst()
          .orElseThrow(() -> new IllegalArgumentException("Unknown binary operator " + symbol));
    }
  }
}
