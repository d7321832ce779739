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

import com.google.common.math.LongMath;
import org.qunroll.ast.Expr;
import org.qunroll.ast.Expr.Binary;
import org.qunroll.ast.Expr.BinaryOp;
import org.qunroll.ast.Expr.Unary;
import org.qunroll.compiler.Diagnostic.Kind;

/**
 * Evaluates expressions at compile time.
 *
 * <p>Identifiers are read from the ScopeStack when the expression is evaluated, so a fold always
 * sees the current value of a variable rather than a snapshot. Evaluation has no side effects and
 * may be repeated.
 */
final class ConstantFolder {

  /** Which identifiers may contribute to a folded value. */
  enum Mode {
    /** Only symbols declared {@code const}; used for case labels, sizes and const initializers. */
    CONSTANTS_ONLY("Expected variable %s to be constant in given expression"),
    /** Any symbol whose current value is known; used for switch targets and value tracking. */
    KNOWN_VALUES("Value of variable %s is not known at compile time");

    /** The NOT_CONSTANT message for an identifier that can't be used in this mode. */
    final String notConstantMessage;

    Mode(String notConstantMessage) {
      this.notConstantMessage = notConstantMessage;
    }
  }

  private final ScopeStack scopes;

  ConstantFolder(ScopeStack scopes) {
    this.scopes = scopes;
  }

  /**
   * Returns the value of the expression. Fails with NOT_CONSTANT if it depends on something that
   * is not known (naming the first such identifier), with UNDECLARED_IDENTIFIER if it refers to an
   * undeclared name, or with TYPE_MISMATCH if an operator is applied to values it does not accept.
   */
  Outcome<Value> evaluate(Expr expr, Mode mode) {
    if (expr instanceof Expr.IntLiteral literal) {
      return Outcome.of(Value.of(literal.value()));
    } else if (expr instanceof Expr.FloatLiteral literal) {
      return Outcome.of(Value.of(literal.value()));
    } else if (expr instanceof Expr.BoolLiteral literal) {
      return Outcome.of(Value.of(literal.value()));
    } else if (expr instanceof Expr.Identifier id) {
      return evaluateIdentifier(id, mode);
    } else if (expr instanceof Expr.Index index) {
      // Array and register elements are never tracked, but an undeclared base is still reported
      // as such.
      Expr.Identifier root = index.rootIdentifier();
      Outcome<Symbol> symbol = scopes.lookup(root);
      if (symbol.failed()) {
        return symbol.propagate();
      }
      return Outcome.failure(
          Diagnostic.at(Kind.NOT_CONSTANT, expr, mode.notConstantMessage, root.name()));
    } else if (expr instanceof Unary unary) {
      Outcome<Value> operand = evaluate(unary.operand(), mode);
      return operand.failed() ? operand : applyUnary(unary, operand.value());
    } else if (expr instanceof Binary binary) {
      Outcome<Value> left = evaluate(binary.left(), mode);
      if (left.failed()) {
        return left;
      }
      Outcome<Value> right = evaluate(binary.right(), mode);
      return right.failed() ? right : applyBinary(binary, left.value(), right.value());
    } else {
      // Calls and measurements
      return Outcome.failure(
          Diagnostic.at(
              Kind.NOT_CONSTANT, expr, "Expression %s is not a compile-time constant", expr));
    }
  }

  /**
   * Evaluates an expression that must produce an integer. Fails with TYPE_MISMATCH if the value
   * is a float or bool.
   */
  Outcome<Long> foldInt(Expr expr, Mode mode) {
    Outcome<Value> value = evaluate(expr, mode);
    if (value.failed()) {
      return value.propagate();
    } else if (!value.value().isInt()) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.TYPE_MISMATCH,
              expr,
              "Expected an int value but %s is %s",
              expr,
              value.value().kind.name().toLowerCase()));
    }
    return Outcome.of(value.value().asLong());
  }

  private Outcome<Value> evaluateIdentifier(Expr.Identifier id, Mode mode) {
    Outcome<Symbol> found = scopes.lookup(id);
    if (found.failed()) {
      return found.propagate();
    }
    Symbol symbol = found.value();
    Value value = symbol.value();
    if (value == null || (mode == Mode.CONSTANTS_ONLY && !symbol.isConst())) {
      return Outcome.failure(
          Diagnostic.at(Kind.NOT_CONSTANT, id, mode.notConstantMessage, id.name()));
    }
    return Outcome.of(value);
  }

  private static Outcome<Value> applyUnary(Unary unary, Value operand) {
    switch (unary.op()) {
      case NEGATE:
        if (operand.kind == Value.Kind.INT) {
          if (operand.asLong() == Long.MIN_VALUE) {
            return overflow(unary);
          }
          return Outcome.of(Value.of(-operand.asLong()));
        } else if (operand.kind == Value.Kind.FLOAT) {
          return Outcome.of(Value.of(-operand.asDouble()));
        }
        break;
      case NOT:
        if (operand.kind == Value.Kind.BOOL) {
          return Outcome.of(Value.of(!operand.asBoolean()));
        }
        break;
      case BIT_NOT:
        if (operand.kind == Value.Kind.INT) {
          return Outcome.of(Value.of(~operand.asLong()));
        }
        break;
    }
    return Outcome.failure(
        Diagnostic.at(
            Kind.TYPE_MISMATCH,
            unary,
            "Invalid operand type %s for operator %s",
            operand.kind.name().toLowerCase(),
            unary.op().symbol));
  }

  private static Outcome<Value> applyBinary(Binary binary, Value left, Value right) {
    BinaryOp op = binary.op();
    boolean bothInt = left.isInt() && right.isInt();
    boolean bothBool = left.kind == Value.Kind.BOOL && right.kind == Value.Kind.BOOL;
    boolean bothNumeric = left.kind != Value.Kind.BOOL && right.kind != Value.Kind.BOOL;
    switch (op.kind) {
      case LOGICAL:
        if (bothBool) {
          boolean result =
              (op == BinaryOp.AND)
                  ? left.asBoolean() && right.asBoolean()
                  : left.asBoolean() || right.asBoolean();
          return Outcome.of(Value.of(result));
        }
        break;
      case COMPARISON:
        if (bothBool && (op == BinaryOp.EQUAL || op == BinaryOp.NOT_EQUAL)) {
          boolean same = left.asBoolean() == right.asBoolean();
          return Outcome.of(Value.of(same == (op == BinaryOp.EQUAL)));
        } else if (bothNumeric) {
          int cmp =
              bothInt
                  ? Long.compare(left.asLong(), right.asLong())
                  : Double.compare(left.asDouble(), right.asDouble());
          return Outcome.of(Value.of(compare(op, cmp)));
        }
        break;
      case BITWISE:
        if (bothInt) {
          return bitwise(binary, left.asLong(), right.asLong());
        }
        break;
      case ARITHMETIC:
        if (bothNumeric) {
          return arithmetic(binary, left, right, bothInt);
        }
        break;
    }
    return Outcome.failure(
        Diagnostic.at(
            Kind.TYPE_MISMATCH,
            binary,
            "Invalid operand types %s and %s for operator %s",
            left.kind.name().toLowerCase(),
            right.kind.name().toLowerCase(),
            op.symbol));
  }

  private static boolean compare(BinaryOp op, int cmp) {
    switch (op) {
      case LESS:
        return cmp < 0;
      case LESS_EQUAL:
        return cmp <= 0;
      case GREATER:
        return cmp > 0;
      case GREATER_EQUAL:
        return cmp >= 0;
      case EQUAL:
        return cmp == 0;
      case NOT_EQUAL:
        return cmp != 0;
      default:
        throw new AssertionError(op);
    }
  }

  /** Shift counts must lie in 0..63, and a left shift must not lose any bits. */
  private static Outcome<Value> bitwise(Binary binary, long x, long y) {
    BinaryOp op = binary.op();
    switch (op) {
      case SHIFT_LEFT:
      case SHIFT_RIGHT:
        if (y < 0 || y >= Long.SIZE) {
          return Outcome.failure(
              Diagnostic.at(
                  Kind.NOT_CONSTANT, binary, "Shift count %s out of range in %s", y, binary));
        } else if (op == BinaryOp.SHIFT_RIGHT) {
          return Outcome.of(Value.of(x >> y));
        } else if (((x << y) >> y) != x) {
          return overflow(binary);
        }
        return Outcome.of(Value.of(x << y));
      case BIT_AND:
        return Outcome.of(Value.of(x & y));
      case BIT_XOR:
        return Outcome.of(Value.of(x ^ y));
      case BIT_OR:
        return Outcome.of(Value.of(x | y));
      default:
        throw new AssertionError(op);
    }
  }

  /** Integer results that don't fit in 64 bits are never folded. */
  private static Outcome<Value> overflow(Expr expr) {
    return Outcome.failure(Diagnostic.at(Kind.NOT_CONSTANT, expr, "Integer overflow in %s", expr));
  }

  /**
   * Integer arithmetic truncates toward zero; a float operand makes the result a float. Negative
   * exponents and division by zero are not folded.
   */
  private static Outcome<Value> arithmetic(
      Binary binary, Value left, Value right, boolean bothInt) {
    BinaryOp op = binary.op();
    if ((op == BinaryOp.DIVIDE || op == BinaryOp.MODULO) && right.asDouble() == 0) {
      return Outcome.failure(
          Diagnostic.at(Kind.NOT_CONSTANT, binary, "Division by zero in %s", binary));
    }
    if (bothInt) {
      if (op == BinaryOp.POWER && right.asLong() < 0) {
        return Outcome.failure(
            Diagnostic.at(Kind.NOT_CONSTANT, binary, "Negative exponent in %s", binary));
      }
      try {
        return Outcome.of(Value.of(integerArithmetic(binary, left.asLong(), right.asLong())));
      } catch (ArithmeticException e) {
        return overflow(binary);
      }
    }
    double x = left.asDouble();
    double y = right.asDouble();
    switch (op) {
      case PLUS:
        return Outcome.of(Value.of(x + y));
      case MINUS:
        return Outcome.of(Value.of(x - y));
      case TIMES:
        return Outcome.of(Value.of(x * y));
      case DIVIDE:
        return Outcome.of(Value.of(x / y));
      case MODULO:
        return Outcome.of(Value.of(x % y));
      case POWER:
        return Outcome.of(Value.of(Math.pow(x, y)));
      default:
        throw new AssertionError(op);
    }
  }

  /** Throws ArithmeticException if the result doesn't fit in a long. */
  private static long integerArithmetic(Binary binary, long x, long y) {
    switch (binary.op()) {
      case PLUS:
        return LongMath.checkedAdd(x, y);
      case MINUS:
        return LongMath.checkedSubtract(x, y);
      case TIMES:
        return LongMath.checkedMultiply(x, y);
      case DIVIDE:
        if (x == Long.MIN_VALUE && y == -1) {
          throw new ArithmeticException("overflow");
        }
        return x / y;
      case MODULO:
        return x % y;
      case POWER:
        return LongMath.checkedPow(x, (int) Math.min(y, Integer.MAX_VALUE));
      default:
        throw new AssertionError(binary.op());
    }
  }
}
