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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qunroll.ast.BaseType;
import org.qunroll.ast.Expr;
import org.qunroll.ast.SourcePosition;
import org.qunroll.ast.Statement;
import org.qunroll.compiler.Diagnostic.Kind;

@RunWith(JUnit4.class)
public class ScopeStackTest {

  private static final SourcePosition POS = SourcePosition.UNKNOWN;
  private static final Statement SITE = new Statement.Reset(new Expr.Identifier("q", POS), POS);

  private final ScopeStack scopes = new ScopeStack();

  private static Expr.Identifier id(String name) {
    return new Expr.Identifier(name, POS);
  }

  @Test
  public void builtinsAreGlobalConstants() {
    Symbol pi = scopes.find("pi");
    assertThat(pi.isConst()).isTrue();
    assertThat(pi.value()).isEqualTo(Value.of(Math.PI));
    assertThat(scopes.find("euler").value()).isEqualTo(Value.of(Math.E));
    assertThat(scopes.atGlobalScope()).isTrue();
  }

  @Test
  public void innerScopeShadowsAndPops() {
    scopes.declare(Symbol.variable("x", SymbolType.INT, POS, Value.of(1L)));
    scopes.push();
    assertThat(scopes.atGlobalScope()).isFalse();
    assertThat(scopes.find("x").value()).isEqualTo(Value.of(1L));
    scopes.declare(Symbol.variable("x", SymbolType.FLOAT, POS, Value.of(2.0)));
    assertThat(scopes.find("x").type).isEqualTo(SymbolType.FLOAT);
    scopes.pop();
    assertThat(scopes.find("x").type).isEqualTo(SymbolType.INT);
    assertThat(scopes.depth()).isEqualTo(1);
  }

  @Test
  public void globalScopeCannotBePopped() {
    assertThrows(IllegalStateException.class, scopes::pop);
  }

  @Test
  public void redeclarationInSameScope() {
    scopes.declare(Symbol.variable("a", SymbolType.INT, POS, null));
    Outcome<Symbol> again = scopes.declare(Symbol.variable("a", SymbolType.FLOAT, POS, null), SITE);
    assertThat(again.failedWith(Kind.REDECLARATION)).isTrue();
    assertThat(again.diagnostic().message()).isEqualTo("Re-declaration of variable a");
  }

  @Test
  public void functionScopeSeesOnlyConstantsAndQubits() {
    scopes.declare(Symbol.variable("g", SymbolType.INT, POS, Value.of(1L)));
    scopes.declare(Symbol.constant("N", SymbolType.INT, POS, Value.of(2L)));
    scopes.declare(Symbol.variable("q", SymbolType.register(BaseType.QUBIT, 2), POS, null));
    scopes.push();
    scopes.declare(Symbol.variable("local", SymbolType.INT, POS, Value.of(3L)));
    scopes.pushFunction();
    assertThat(scopes.find("g")).isNull();
    assertThat(scopes.find("local")).isNull();
    assertThat(scopes.find("N")).isNotNull();
    assertThat(scopes.find("q")).isNotNull();
    assertThat(scopes.lookup(id("g")).failedWith(Kind.UNDECLARED_IDENTIFIER)).isTrue();
    scopes.pop();
    assertThat(scopes.find("local")).isNotNull();
  }

  @Test
  public void assignmentUpdatesDeclaringScope() {
    scopes.declare(Symbol.variable("x", SymbolType.INT, POS, Value.of(1L)));
    scopes.push();
    scopes.assign(id("x"), Value.of(5L), SITE);
    scopes.pop();
    assertThat(scopes.find("x").value()).isEqualTo(Value.of(5L));
  }

  @Test
  public void assignmentConvertsToVariableType() {
    scopes.declare(Symbol.variable("i", SymbolType.INT, POS, null));
    scopes.declare(Symbol.variable("b", SymbolType.BOOL, POS, null));
    scopes.assign(id("i"), Value.of(2.7), SITE);
    scopes.assign(id("b"), Value.of(3L), SITE);
    assertThat(scopes.find("i").value()).isEqualTo(Value.of(2L));
    assertThat(scopes.find("b").value()).isEqualTo(Value.of(true));
  }

  @Test
  public void assignmentToRegisterForgetsValue() {
    scopes.declare(Symbol.variable("c", SymbolType.register(BaseType.BIT, 2), POS, null));
    Outcome<Symbol> result = scopes.assign(id("c"), Value.of(1L), SITE);
    assertThat(result.failed()).isFalse();
    assertThat(scopes.find("c").value()).isNull();
  }

  @Test
  public void uintRejectsNegativeValues() {
    scopes.declare(Symbol.variable("n", SymbolType.scalar(BaseType.UINT), POS, Value.of(1L)));
    Outcome<Symbol> result = scopes.assign(id("n"), Value.of(-2L), SITE);
    assertThat(result.failedWith(Kind.TYPE_MISMATCH)).isTrue();
    assertThat(result.diagnostic().message())
        .isEqualTo("Cannot store negative value -2 in n of type uint");
    assertThat(scopes.find("n").value()).isEqualTo(Value.of(1L));
  }

  @Test
  public void constantsAreImmutable() {
    scopes.declare(Symbol.constant("k", SymbolType.INT, POS, Value.of(1L)));
    Outcome<Symbol> result = scopes.assign(id("k"), Value.of(2L), SITE);
    assertThat(result.failedWith(Kind.IMMUTABLE_ASSIGNMENT)).isTrue();
    assertThat(result.diagnostic().message()).isEqualTo("Cannot update constant variable k");
    assertThat(scopes.find("k").value()).isEqualTo(Value.of(1L));
  }

  @Test
  public void qubitsCannotBeAssigned() {
    scopes.declare(Symbol.variable("q", SymbolType.scalar(BaseType.QUBIT), POS, null));
    Outcome<Symbol> result = scopes.assign(id("q"), Value.of(1L), SITE);
    assertThat(result.failedWith(Kind.TYPE_MISMATCH)).isTrue();
  }
}
