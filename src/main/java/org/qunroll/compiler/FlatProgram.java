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
import org.jspecify.annotations.Nullable;
import org.qunroll.ast.AstPrinter;
import org.qunroll.ast.Statement;

/**
 * The result of unrolling a program: a branch-free statement sequence with no switches and no
 * subroutine calls or definitions, plus the number of qubits and classical bits it declares.
 */
public final class FlatProgram {
  private final @Nullable String version;
  private final int numQubits;
  private final int numClbits;
  private final ImmutableList<Statement> unrolledAst;

  FlatProgram(
      @Nullable String version,
      int numQubits,
      int numClbits,
      ImmutableList<Statement> unrolledAst) {
    this.version = version;
    this.numQubits = numQubits;
    this.numClbits = numClbits;
    this.unrolledAst = unrolledAst;
  }

  /** The version from the program's {@code OPENQASM} header, or null if it had none. */
  public @Nullable String version() {
    return version;
  }

  public int numQubits() {
    return numQubits;
  }

  public int numClbits() {
    return numClbits;
  }

  public ImmutableList<Statement> unrolledAst() {
    return unrolledAst;
  }

  /** Renders the program as OpenQASM source. */
  @Override
  public String toString() {
    String header = (version == null) ? "" : "OPENQASM " + version + ";\n";
    return header + AstPrinter.print(unrolledAst);
  }
}
