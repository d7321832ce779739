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

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import org.qunroll.ast.BaseType;

/**
 * The resolved type of a symbol or expression: an element type plus a (possibly empty) shape.
 *
 * <p>Registers ({@code qubit[2]}, {@code bit[3]}) and arrays ({@code array[int, 3, 2]}) both have
 * a non-empty shape; {@code isArray} distinguishes them, and only affects how the type is printed.
 */
record SymbolType(BaseType base, ImmutableList<Integer> shape, boolean isArray) {

  static final SymbolType INT = scalar(BaseType.INT);
  static final SymbolType FLOAT = scalar(BaseType.FLOAT);
  static final SymbolType BOOL = scalar(BaseType.BOOL);

  static SymbolType scalar(BaseType base) {
    return new SymbolType(base, ImmutableList.of(), false);
  }

  static SymbolType register(BaseType base, int size) {
    return new SymbolType(base, ImmutableList.of(size), false);
  }

  static SymbolType array(BaseType base, ImmutableList<Integer> shape) {
    return new SymbolType(base, shape, true);
  }

  boolean isScalar() {
    return shape.isEmpty();
  }

  /** True for scalar {@code int} and {@code uint}, the only types allowed in switch targets. */
  boolean isIntegralScalar() {
    return isScalar() && base.isIntegral();
  }

  /** Returns the type that results from applying {@code count} indices to a value of this type. */
  SymbolType indexed(int count) {
    ImmutableList<Integer> remaining = shape.subList(count, shape.size());
    return new SymbolType(base, remaining, isArray && !remaining.isEmpty());
  }

  /** The number of elements in a register, or 1 for a scalar. */
  int size() {
    return shape.stream().reduce(1, (x, y) -> x * y);
  }

  @Override
  public String toString() {
    if (shape.isEmpty()) {
      return base.keyword;
    } else if (isArray) {
      return String.format(
          "array[%s, %s]",
          base.keyword, shape.stream().map(String::valueOf).collect(Collectors.joining(", ")));
    } else {
      return base.keyword + "[" + shape.get(0) + "]";
    }
  }
}
