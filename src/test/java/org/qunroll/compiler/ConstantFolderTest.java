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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.qunroll.ast.Expr;
import org.qunroll.ast.Expr.BinaryOp;
import org.qunroll.ast.Expr.UnaryOp;
import org.qunroll.ast.SourcePosition;
import org.qunroll.compiler.ConstantFolder.Mode;
import org.qunroll.compiler.Diagnostic.Kind;

@RunWith(JUnitParamsRunner.class)
public class ConstantFolderTest {

  private static final SourcePosition POS = SourcePosition.UNKNOWN;

  private ScopeStack scopes;
  private ConstantFolder folder;

  @Before
  public void setUp() {
    scopes = new ScopeStack();
    folder = new ConstantFolder(scopes);
    scopes.declare(Symbol.constant("k", SymbolType.INT, POS, Value.of(3L)));
    scopes.declare(Symbol.variable("v", SymbolType.INT, POS, Value.of(4L)));
    scopes.declare(Symbol.variable("u", SymbolType.INT, POS, null));
  }

  private static Expr lit(long value) {
    return new Expr.IntLiteral(value, POS);
  }

  private static Expr lit(double value) {
    return new Expr.FloatLiteral(value, Double.toString(value), POS);
  }

  private static Expr id(String name) {
    return new Expr.Identifier(name, POS);
  }

  private static Expr binary(BinaryOp op, Expr left, Expr right) {
    return new Expr.Binary(op, left, right, POS);
  }

  private static Object[] intCases() {
    return new Object[] {
      new Object[] {binary(BinaryOp.DIVIDE, lit(7), lit(2)), 3L},
      new Object[] {binary(BinaryOp.DIVIDE, lit(-7), lit(2)), -3L},
      new Object[] {binary(BinaryOp.MODULO, lit(-7), lit(2)), -1L},
      new Object[] {binary(BinaryOp.POWER, lit(2), lit(10)), 1024L},
      new Object[] {binary(BinaryOp.SHIFT_LEFT, lit(1), lit(3)), 8L},
      new Object[] {binary(BinaryOp.BIT_XOR, lit(6), lit(3)), 5L},
      new Object[] {new Expr.Unary(UnaryOp.BIT_NOT, lit(0), POS), -1L},
      new Object[] {new Expr.Unary(UnaryOp.NEGATE, id("k"), POS), -3L},
      new Object[] {binary(BinaryOp.MINUS, id("k"), lit(1)), 2L},
    };
  }

  @Test
  @Parameters(method = "intCases")
  public void foldsIntegers(Expr expr, long expected) {
    Outcome<Long> result = folder.foldInt(expr, Mode.CONSTANTS_ONLY);
    assertThat(result.value()).isEqualTo(expected);
  }

  @Test
  public void floatArithmetic() {
    Outcome<Value> result =
        folder.evaluate(binary(BinaryOp.PLUS, lit(1.5), lit(1)), Mode.CONSTANTS_ONLY);
    assertThat(result.value()).isEqualTo(Value.of(2.5));
  }

  @Test
  public void builtinConstants() {
    assertThat(folder.evaluate(id("pi"), Mode.CONSTANTS_ONLY).value())
        .isEqualTo(Value.of(Math.PI));
    assertThat(folder.evaluate(id("tau"), Mode.CONSTANTS_ONLY).value())
        .isEqualTo(Value.of(2 * Math.PI));
  }

  @Test
  public void comparisonsAndLogic() {
    Expr less = binary(BinaryOp.LESS, lit(3), lit(4));
    Expr both = binary(BinaryOp.AND, less, new Expr.BoolLiteral(false, POS));
    assertThat(folder.evaluate(less, Mode.CONSTANTS_ONLY).value()).isEqualTo(Value.of(true));
    assertThat(folder.evaluate(both, Mode.CONSTANTS_ONLY).value()).isEqualTo(Value.of(false));
  }

  @Test
  public void variablesNeedKnownValuesMode() {
    Outcome<Value> constantsOnly = folder.evaluate(id("v"), Mode.CONSTANTS_ONLY);
    assertThat(constantsOnly.failedWith(Kind.NOT_CONSTANT)).isTrue();
    assertThat(constantsOnly.diagnostic().message())
        .isEqualTo("Expected variable v to be constant in given expression");
    assertThat(folder.evaluate(id("v"), Mode.KNOWN_VALUES).value()).isEqualTo(Value.of(4L));
  }

  @Test
  public void unknownValue() {
    Outcome<Value> result =
        folder.evaluate(binary(BinaryOp.PLUS, lit(1), id("u")), Mode.KNOWN_VALUES);
    assertThat(result.failedWith(Kind.NOT_CONSTANT)).isTrue();
    assertThat(result.diagnostic().message())
        .isEqualTo("Value of variable u is not known at compile time");
  }

  @Test
  public void undeclared() {
    Outcome<Value> result = folder.evaluate(id("nope"), Mode.KNOWN_VALUES);
    assertThat(result.failedWith(Kind.UNDECLARED_IDENTIFIER)).isTrue();
  }

  @Test
  public void divisionByZeroIsNotConstant() {
    Outcome<Value> result =
        folder.evaluate(binary(BinaryOp.MODULO, lit(1), lit(0)), Mode.CONSTANTS_ONLY);
    assertThat(result.failedWith(Kind.NOT_CONSTANT)).isTrue();
    assertThat(result.diagnostic().message()).isEqualTo("Division by zero in 1 % 0");
  }

  @Test
  public void negativeExponentIsNotConstant() {
    Outcome<Value> result =
        folder.evaluate(binary(BinaryOp.POWER, lit(2), lit(-1)), Mode.CONSTANTS_ONLY);
    assertThat(result.failedWith(Kind.NOT_CONSTANT)).isTrue();
  }

  private static Object[] overflowCases() {
    return new Object[] {
      new Object[] {
        binary(BinaryOp.PLUS, lit(Long.MAX_VALUE), lit(2)),
        "Integer overflow in 9223372036854775807 + 2"
      },
      new Object[] {
        binary(BinaryOp.TIMES, lit(Long.MAX_VALUE), lit(2)),
        "Integer overflow in 9223372036854775807 * 2"
      },
      new Object[] {binary(BinaryOp.POWER, lit(2), lit(63)), "Integer overflow in 2 ** 63"},
      new Object[] {
        binary(BinaryOp.SHIFT_LEFT, lit(Long.MAX_VALUE), lit(1)),
        "Integer overflow in 9223372036854775807 << 1"
      },
      new Object[] {
        binary(BinaryOp.SHIFT_LEFT, lit(1), lit(64)), "Shift count 64 out of range in 1 << 64"
      },
      new Object[] {
        binary(BinaryOp.SHIFT_RIGHT, lit(1), lit(-1)), "Shift count -1 out of range in 1 >> -1"
      },
    };
  }

  @Test
  @Parameters(method = "overflowCases")
  public void integerOverflowIsNotConstant(Expr expr, String message) {
    Outcome<Value> result = folder.evaluate(expr, Mode.CONSTANTS_ONLY);
    assertThat(result.failedWith(Kind.NOT_CONSTANT)).isTrue();
    assertThat(result.diagnostic().message()).isEqualTo(message);
  }

  @Test
  public void largestValuesStillFold() {
    Expr power = binary(BinaryOp.POWER, lit(2), lit(62));
    Expr sum = binary(BinaryOp.PLUS, lit(Long.MAX_VALUE - 2), lit(2));
    assertThat(folder.foldInt(power, Mode.CONSTANTS_ONLY).value()).isEqualTo(1L << 62);
    assertThat(folder.foldInt(sum, Mode.CONSTANTS_ONLY).value()).isEqualTo(Long.MAX_VALUE);
  }

  @Test
  public void foldIntRejectsFloats() {
    Outcome<Long> result = folder.foldInt(lit(4.5), Mode.CONSTANTS_ONLY);
    assertThat(result.failedWith(Kind.TYPE_MISMATCH)).isTrue();
  }

  @Test
  public void operatorTypeMismatch() {
    Outcome<Value> result =
        folder.evaluate(
            binary(BinaryOp.BIT_AND, lit(1), new Expr.BoolLiteral(true, POS)), Mode.KNOWN_VALUES);
    assertThat(result.failedWith(Kind.TYPE_MISMATCH)).isTrue();
    assertThat(result.diagnostic().message())
        .isEqualTo("Invalid operand types int and bool for operator &");
  }

  @Test
  public void callsAreNeverConstant() {
    Expr call = new Expr.Call("sin", ImmutableList.of(lit(0)), POS);
    assertThat(folder.evaluate(call, Mode.KNOWN_VALUES).failedWith(Kind.NOT_CONSTANT)).isTrue();
  }
}
