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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.qunroll.ast.BaseType;
import org.qunroll.ast.Expr;
import org.qunroll.ast.SourcePosition;
import org.qunroll.ast.Statement;
import org.qunroll.compiler.Diagnostic.Kind;

/**
 * The scopes of one unrolling pass, held in an arena indexed by position. Each {@link Scope} links
 * to its parent by index, so a child scope can be pushed and popped without copying anything and
 * lookups simply follow the parent links.
 *
 * <p>Assignments always update the Symbol in whichever scope declared it, so a case body that
 * assigns to an outer variable leaves the new value visible after the switch has been unrolled.
 *
 * <p>A ScopeStack belongs to a single pass and is not thread-safe.
 */
final class ScopeStack {

  /** Constants that are visible in every program. */
  static final ImmutableMap<String, Double> BUILTIN_CONSTANTS =
      ImmutableMap.of("pi", Math.PI, "tau", 2 * Math.PI, "euler", Math.E);

  private final List<Scope> scopes = new ArrayList<>();

  /** The index of the innermost scope; always {@code scopes.size() - 1}. */
  private int current;

  ScopeStack() {
    scopes.add(new Scope(Scope.Kind.GLOBAL, -1));
    current = 0;
    Scope global = scopes.get(0);
    BUILTIN_CONSTANTS.forEach(
        (name, v) ->
            global.add(
                Symbol.constant(
                    name, SymbolType.FLOAT, SourcePosition.UNKNOWN, Value.of((double) v))));
  }

  /** Enters a nested block (e.g. the body of the selected case). */
  void push() {
    scopes.add(new Scope(Scope.Kind.BLOCK, current));
    current = scopes.size() - 1;
  }

  /** Enters the body of an inlined subroutine, whose only visible ancestor is the global scope. */
  void pushFunction() {
    scopes.add(new Scope(Scope.Kind.FUNCTION, 0));
    current = scopes.size() - 1;
  }

  /** Leaves the innermost scope, discarding its symbols. The global scope cannot be popped. */
  void pop() {
    Preconditions.checkState(current > 0, "Cannot pop the global scope");
    scopes.remove(current);
    current--;
  }

  /** The number of scopes currently pushed, including the global scope. */
  int depth() {
    return scopes.size();
  }

  /** True if the innermost scope is the global scope. */
  boolean atGlobalScope() {
    return current == 0;
  }

  /**
   * Adds a symbol to the innermost scope. Fails with REDECLARATION if that scope already has a
   * symbol with the same name; shadowing a name from an enclosing scope is allowed.
   */
  Outcome<Symbol> declare(Symbol symbol, Statement site) {
    if (!scopes.get(current).add(symbol)) {
      return Outcome.failure(
          Diagnostic.at(Kind.REDECLARATION, site, "Re-declaration of variable %s", symbol.name));
    }
    return Outcome.of(symbol);
  }

  /** Like {@link #declare(Symbol, Statement)}, for symbols that have no declaring statement. */
  Outcome<Symbol> declare(Symbol symbol) {
    if (!scopes.get(current).add(symbol)) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.REDECLARATION, symbol.declaredAt, "Re-declaration of variable %s", symbol.name));
    }
    return Outcome.of(symbol);
  }

  /**
   * Returns the innermost visible symbol with the given name, or null. Inside a subroutine body
   * only constants and qubits from the global scope are visible.
   */
  @Nullable Symbol find(String name) {
    boolean crossedFunction = false;
    for (int i = current; i >= 0; ) {
      Scope scope = scopes.get(i);
      Symbol symbol = scope.get(name);
      if (symbol != null
          && (!crossedFunction || symbol.isConst() || symbol.type.base() == BaseType.QUBIT)) {
        return symbol;
      }
      if (scope.kind == Scope.Kind.FUNCTION) {
        crossedFunction = true;
      }
      i = scope.parent;
    }
    return null;
  }

  /** Like {@link #find}, but fails with UNDECLARED_IDENTIFIER if there is no such symbol. */
  Outcome<Symbol> lookup(Expr.Identifier id) {
    Symbol symbol = find(id.name());
    if (symbol == null) {
      return Outcome.failure(
          Diagnostic.at(Kind.UNDECLARED_IDENTIFIER, id, "Undefined identifier %s", id.name()));
    }
    return Outcome.of(symbol);
  }

  /**
   * Sets the current value of the named variable (null if it is not known at compile time). The
   * value is converted to the variable's type. Fails if the name is undeclared, or refers to a
   * constant or a subroutine parameter.
   */
  Outcome<Symbol> assign(Expr.Identifier id, @Nullable Value value, Statement site) {
    Outcome<Symbol> found = lookup(id);
    if (found.failed()) {
      return found;
    }
    Symbol symbol = found.value();
    if (symbol.isReadOnly()) {
      String what = symbol.isConst() ? "constant variable" : "subroutine parameter";
      return Outcome.failure(
          Diagnostic.at(
              Kind.IMMUTABLE_ASSIGNMENT, site, "Cannot update %s %s", what, symbol.name));
    } else if (symbol.type.base() == BaseType.QUBIT) {
      return Outcome.failure(
          Diagnostic.at(Kind.TYPE_MISMATCH, site, "Cannot assign to qubit %s", symbol.name));
    }
    if (!symbol.type.isScalar()) {
      value = null;
    } else if (value != null) {
      if (!value.fitsIn(symbol.type.base())) {
        return Outcome.failure(
            Diagnostic.at(
                Kind.TYPE_MISMATCH,
                site,
                "Cannot store negative value %s in %s of type %s",
                value,
                symbol.name,
                symbol.type));
      }
      value = value.castTo(symbol.type.base());
    }
    symbol.setValue(value);
    return found;
  }

  @Override
  public String toString() {
    return scopes.toString();
  }
}
