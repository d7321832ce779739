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

import org.jspecify.annotations.Nullable;
import org.qunroll.ast.Expr;
import org.qunroll.ast.SourcePosition;

/**
 * A declared name. Symbols are created by declarations (and by binding subroutine parameters) and
 * live until the Scope that owns them is popped.
 */
final class Symbol {

  enum Kind {
    /** A mutable variable or register. */
    VARIABLE,
    /** Declared {@code const}; always has a value. */
    CONSTANT,
    /** A subroutine parameter; read-only, and references to it are replaced by its binding. */
    PARAMETER
  }

  final String name;
  final SymbolType type;
  final Kind kind;
  final SourcePosition declaredAt;

  /**
   * The expression that replaces references to a PARAMETER in an inlined subroutine body; null
   * for other kinds.
   */
  final @Nullable Expr binding;

  /** The current value, if known at compile time. Always null for qubits, registers and arrays. */
  private @Nullable Value value;

  Symbol(
      String name,
      SymbolType type,
      Kind kind,
      SourcePosition declaredAt,
      @Nullable Value value,
      @Nullable Expr binding) {
    this.name = name;
    this.type = type;
    this.kind = kind;
    this.declaredAt = declaredAt;
    this.value = value;
    this.binding = binding;
  }

  static Symbol variable(String name, SymbolType type, SourcePosition pos, @Nullable Value value) {
    return new Symbol(name, type, Kind.VARIABLE, pos, value, null);
  }

  static Symbol constant(String name, SymbolType type, SourcePosition pos, Value value) {
    return new Symbol(name, type, Kind.CONSTANT, pos, value, null);
  }

  boolean isConst() {
    return kind == Kind.CONSTANT;
  }

  /** True if assignments to this symbol are forbidden. */
  boolean isReadOnly() {
    return kind != Kind.VARIABLE;
  }

  @Nullable Value value() {
    return value;
  }

  /** Should only be called by {@link ScopeStack#assign}. */
  void setValue(@Nullable Value value) {
    assert !isReadOnly();
    this.value = value;
  }

  @Override
  public String toString() {
    String prefix = isConst() ? "const " : "";
    return prefix + type + " " + name + (value == null ? "" : " = " + value);
  }
}
