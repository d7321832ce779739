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

/** The element types a declaration may name. */
public enum BaseType {
  INT("int"),
  UINT("uint"),
  FLOAT("float"),
  BOOL("bool"),
  BIT("bit"),
  QUBIT("qubit");

  public final String keyword;

  BaseType(String keyword) {
    this.keyword = keyword;
  }

  /** True for the types that may be used as a switch target or case label. */
  public boolean isIntegral() {
    return this == INT || this == UINT;
  }

  /** True for every type except {@link #QUBIT}. */
  public boolean isClassical() {
    return this != QUBIT;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
