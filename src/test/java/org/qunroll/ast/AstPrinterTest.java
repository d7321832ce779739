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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.qunroll.ast.Expr.BinaryOp;
import org.qunroll.compiler.Compiler;

@RunWith(TestParameterInjector.class)
public class AstPrinterTest {

  private static final SourcePosition POS = SourcePosition.UNKNOWN;

  private static Expr id(String name) {
    return new Expr.Identifier(name, POS);
  }

  private static Expr binary(BinaryOp op, Expr left, Expr right) {
    return new Expr.Binary(op, left, right, POS);
  }

  @Test
  public void parenthesizesLowerPrecedenceOperands() {
    Expr sum = binary(BinaryOp.PLUS, id("a"), id("b"));
    assertThat(AstPrinter.print(binary(BinaryOp.TIMES, sum, id("c")))).isEqualTo("(a + b) * c");
    assertThat(AstPrinter.print(binary(BinaryOp.PLUS, id("c"), sum))).isEqualTo("c + (a + b)");
    assertThat(AstPrinter.print(binary(BinaryOp.PLUS, sum, id("c")))).isEqualTo("a + b + c");
  }

  @Test
  public void powerIsRightAssociative() {
    Expr inner = binary(BinaryOp.POWER, id("b"), id("c"));
    assertThat(AstPrinter.print(binary(BinaryOp.POWER, id("a"), inner))).isEqualTo("a ** b ** c");
    assertThat(AstPrinter.print(binary(BinaryOp.POWER, inner, id("a"))))
        .isEqualTo("(b ** c) ** a");
  }

  @Test
  public void unaryAroundBinary() {
    Expr difference = binary(BinaryOp.MINUS, id("x"), id("y"));
    Expr negated = new Expr.Unary(Expr.UnaryOp.NEGATE, difference, POS);
    assertThat(AstPrinter.print(negated)).isEqualTo("-(x - y)");
  }

  @Test
  public void indexAndCall() {
    Expr index = new Expr.Index(id("q"), ImmutableList.of(new Expr.IntLiteral(1, POS)), POS);
    Expr call = new Expr.Call("sin", ImmutableList.of(id("t")), POS);
    assertThat(AstPrinter.print(index)).isEqualTo("q[1]");
    assertThat(AstPrinter.print(call)).isEqualTo("sin(t)");
  }

  /** Statements that print back exactly as written. */
  enum RoundTrip {
    CONST_DECLARATION("const int[32] n = 2 * 3;"),
    REGISTER("qubit[4] q;"),
    ARRAY("array[int[32], 3, 2] arr;"),
    COMPOUND_ASSIGNMENT("x += 1;"),
    NESTED_INDEX("x = arr[0][1];"),
    MEASURE_ASSIGNMENT("c[0] = measure q[0];"),
    MEASURE_ARROW("measure q -> c;"),
    GATE_CALL("rx(pi / 2) q[0], q[1];"),
    BARRIER("barrier q;"),
    RESET("reset q;"),
    CALL("f(1, q);");

    final String source;

    RoundTrip(String source) {
      this.source = source;
    }
  }

  @Test
  public void printsStatementAsWritten(@TestParameter RoundTrip statement) {
    Statement parsed = Compiler.load(statement.source).statements().get(0);
    assertThat(AstPrinter.print(parsed)).isEqualTo(statement.source);
  }

  @Test
  public void switchSnippetAndFullForm() {
    String source =
        String.join(
            "\n",
            "switch (i + 1) {",
            "  case 1, 2 {",
            "    x q;",
            "  }",
            "  default {",
            "    y q;",
            "  }",
            "}");
    Statement parsed = Compiler.load(source).statements().get(0);
    assertThat(AstPrinter.snippet(parsed)).isEqualTo("switch (i + 1) {...}");
    assertThat(AstPrinter.print(parsed)).isEqualTo(source);
    Statement.Switch switchStmt = (Statement.Switch) parsed;
    assertThat(switchStmt.cases().get(0).toString()).isEqualTo("case 1, 2 {...}");
  }

  @Test
  public void subroutineDefinition() {
    String source = String.join("\n", "def f(int n, qubit a) {", "  x a;", "}");
    Statement parsed = Compiler.load(source).statements().get(0);
    assertThat(AstPrinter.snippet(parsed)).isEqualTo("def f(int n, qubit a) {...}");
    assertThat(AstPrinter.print(parsed)).isEqualTo(source);
  }
}
