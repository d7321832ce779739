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

import org.jspecify.annotations.Nullable;

/**
 * A type as written in the source, e.g. {@code int[32]} or {@code qubit[2]}.
 *
 * <p>For {@code qubit} and {@code bit} the designator is the register size; for the other scalar
 * types it is a bit width, which the unroller ignores.
 */
public record TypeSpec(BaseType base, @Nullable Expr designator) {

  /** True if this spec declares a register (a {@code qubit} or {@code bit} with a designator). */
  public boolean isRegister() {
    return designator != null && (base == BaseType.QUBIT || base == BaseType.BIT);
  }

  @Override
  public String toString() {
    return designator == null ? base.keyword : base.keyword + "[" + designator + "]";
  }
}
