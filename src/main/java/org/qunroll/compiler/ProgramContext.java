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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.qunroll.ast.Statement;
import org.qunroll.ast.Statement.GateDefinition;
import org.qunroll.ast.Statement.SubroutineDefinition;
import org.qunroll.compiler.Diagnostic.Kind;

/**
 * The program-wide definitions that every check may consult: the subroutines and gates defined
 * at the top level of the program, and every name the top level declares. A ProgramContext is
 * built once, before unrolling starts, and is read-only afterwards; it is passed explicitly to the
 * components that need it.
 */
final class ProgramContext {

  /** Functions that may appear in expressions without being defined; all return float. */
  static final ImmutableSet<String> BUILTIN_FUNCTIONS =
      ImmutableSet.of("sin", "cos", "tan", "arcsin", "arccos", "arctan", "exp", "log", "sqrt");

  private final ImmutableMap<String, SubroutineDefinition> subroutines;

  /** The names of the gates defined by the program. */
  private final ImmutableSet<String> gates;

  /** Names declared by top-level statements, including definitions. */
  private final ImmutableSet<String> topLevelNames;

  private ProgramContext(
      ImmutableMap<String, SubroutineDefinition> subroutines,
      ImmutableSet<String> gates,
      ImmutableSet<String> topLevelNames) {
    this.subroutines = subroutines;
    this.gates = gates;
    this.topLevelNames = topLevelNames;
  }

  /**
   * Collects the top-level definitions of a program. Fails with REDECLARATION if two definitions
   * share a name.
   */
  static Outcome<ProgramContext> collect(List<Statement> statements) {
    Map<String, SubroutineDefinition> subroutines = new LinkedHashMap<>();
    Set<String> gates = new LinkedHashSet<>();
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (Statement statement : statements) {
      String name;
      if (statement instanceof SubroutineDefinition def) {
        name = def.name();
      } else if (statement instanceof GateDefinition gate) {
        name = gate.name();
      } else {
        if (statement instanceof Statement.Declaration decl) {
          names.add(decl.name());
        } else if (statement instanceof Statement.ArrayDeclaration decl) {
          names.add(decl.name());
        }
        continue;
      }
      if (subroutines.containsKey(name) || gates.contains(name)) {
        return Outcome.failure(
            Diagnostic.at(Kind.REDECLARATION, statement, "Re-declaration of %s", name));
      }
      names.add(name);
      if (statement instanceof SubroutineDefinition def) {
        subroutines.put(name, def);
      } else {
        gates.add(name);
      }
    }
    return Outcome.of(
        new ProgramContext(
            ImmutableMap.copyOf(subroutines), ImmutableSet.copyOf(gates), names.build()));
  }

  @Nullable SubroutineDefinition subroutine(String name) {
    return subroutines.get(name);
  }

  boolean isGate(String name) {
    return gates.contains(name);
  }

  /** True if a statement at the top level of the program declares or defines this name. */
  boolean isTopLevelName(String name) {
    return topLevelNames.contains(name);
  }
}
