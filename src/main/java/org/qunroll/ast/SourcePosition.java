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

/**
 * The location of the first token of a syntactic construct. Lines are numbered from 1, columns
 * from 0 (the ANTLR convention).
 */
public record SourcePosition(int line, int column) {

  /** Used for nodes synthesized during unrolling that have no better location. */
  public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
