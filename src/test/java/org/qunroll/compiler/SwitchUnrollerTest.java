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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qunroll.ast.AstPrinter;
import org.qunroll.ast.Statement;

@RunWith(JUnit4.class)
public class SwitchUnrollerTest {

  private static final String PROGRAM =
      String.join(
          "\n",
          "OPENQASM 3.0;",
          "include \"stdgates.inc\";",
          "qubit[2] q;",
          "bit[2] c;",
          "def flip(int n, qubit a) {",
          "  switch (n) {",
          "    case 0 {",
          "      x a;",
          "    }",
          "    default {",
          "      y a;",
          "    }",
          "  }",
          "}",
          "int i = 1;",
          "switch (i) {",
          "  case 1 {",
          "    flip(i - 1, q[1]);",
          "  }",
          "}",
          "c = measure q;");

  @Test
  public void flatProgramHasNoSwitchesOrCalls() {
    FlatProgram result = Compiler.load(PROGRAM).unroll();
    assertThat(result.version()).isEqualTo("3.0");
    assertThat(result.numQubits()).isEqualTo(2);
    assertThat(result.numClbits()).isEqualTo(2);
    for (Statement statement : result.unrolledAst()) {
      assertThat(statement).isNotInstanceOf(Statement.Switch.class);
      assertThat(statement).isNotInstanceOf(Statement.SubroutineCall.class);
      assertThat(statement).isNotInstanceOf(Statement.SubroutineDefinition.class);
    }
    assertThat(result.toString())
        .isEqualTo(
            String.join(
                "\n",
                "OPENQASM 3.0;",
                "include \"stdgates.inc\";",
                "qubit[2] q;",
                "bit[2] c;",
                "int i = 1;",
                "x q[1];",
                "c = measure q;",
                ""));
  }

  @Test
  public void unrollIsRepeatable() {
    Program program = Compiler.load(PROGRAM);
    ImmutableList<Statement> first = program.unroll().unrolledAst();
    ImmutableList<Statement> second = program.unroll().unrolledAst();
    assertThat(second).isEqualTo(first);
  }

  @Test
  public void validateAcceptsValidProgram() {
    Compiler.load(PROGRAM).validate();
  }

  @Test
  public void unselectedBodiesAreNotChecked() {
    // Only the selected clause's statements are examined.
    Program program =
        Compiler.load(
            String.join(
                "\n",
                "qubit q;",
                "int i = 2;",
                "switch (i) {",
                "  case 1 {",
                "    def f() {",
                "    }",
                "    y undeclared;",
                "  }",
                "  case 2 {",
                "    x q;",
                "  }",
                "}"));
    assertThat(program.unroll().unrolledAst()).hasSize(3);
  }

  @Test
  public void emptyResultWhenNothingMatches() {
    FlatProgram result =
        Compiler.load(
                String.join(
                    "\n", "int i = 3;", "switch (i) {", "  case 1 {", "    int j = 1;", "  }", "}"))
            .unroll();
    assertThat(statementsOf(result)).isEqualTo("int i = 3;");
  }

  @Test
  public void inlineDepthIsConfigurable() {
    Program program =
        Compiler.load(
            String.join(
                "\n",
                "qubit q;",
                "def a(qubit x) {",
                "  h x;",
                "}",
                "def b(qubit x) {",
                "  a(x);",
                "}",
                "b(q);"));
    assertThat(program.unroll(UnrollOptions.DEFAULT.withMaxInlineDepth(2)).unrolledAst())
        .hasSize(2);
    ValidationError e =
        assertThrows(
            ValidationError.class,
            () -> program.unroll(UnrollOptions.DEFAULT.withMaxInlineDepth(1)));
    assertThat(e.kind).isEqualTo(Diagnostic.Kind.INLINE_DEPTH);
    assertThat(e.msg).isEqualTo("Call to a exceeds the maximum inlining depth of 1");
  }

  @Test
  public void optionsFromSystemProperties() {
    String saved = System.getProperty("maxInlineDepth");
    try {
      System.setProperty("maxInlineDepth", " 7 ");
      assertThat(UnrollOptions.fromSystemProperties().maxInlineDepth).isEqualTo(7);
      System.clearProperty("maxInlineDepth");
      assertThat(UnrollOptions.fromSystemProperties()).isSameInstanceAs(UnrollOptions.DEFAULT);
    } finally {
      if (saved != null) {
        System.setProperty("maxInlineDepth", saved);
      }
    }
  }

  /** Renders just the statements, without the header line. */
  private static String statementsOf(FlatProgram program) {
    return AstPrinter.print(program.unrolledAst()).trim();
  }
}
