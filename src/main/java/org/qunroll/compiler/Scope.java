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

import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One lexical region's declarations. Scopes live in a {@link ScopeStack} and refer to their parent
 * by its index in the stack rather than by reference; a scope never owns its parent.
 */
final class Scope {

  enum Kind {
    /** The program's top level; always at index 0. */
    GLOBAL,
    /** A case body (or any other nested block); sees everything its parent sees. */
    BLOCK,
    /**
     * The body of an inlined subroutine. Its parent is always the global scope, and across this
     * boundary only constants and qubits are visible.
     */
    FUNCTION
  }

  final Kind kind;

  /** The index of the enclosing scope in the ScopeStack, or -1 for the global scope. */
  final int parent;

  /** Maps each name declared in this scope to its Symbol, in declaration order. */
  private final Map<String, Symbol> symbols = new LinkedHashMap<>();

  Scope(Kind kind, int parent) {
    this.kind = kind;
    this.parent = parent;
  }

  /** Returns the symbol declared with this name in this scope (ignoring any parent), or null. */
  @Nullable Symbol get(String name) {
    return symbols.get(name);
  }

  /** Adds a symbol; returns false (and leaves the scope unchanged) if the name is already used. */
  boolean add(Symbol symbol) {
    return symbols.putIfAbsent(symbol.name, symbol) == null;
  }

  @Override
  public String toString() {
    return kind + symbols.values().toString();
  }
}
