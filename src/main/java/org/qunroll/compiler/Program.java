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
 * A loaded OpenQASM program. Programs are immutable; {@link #validate} and {@link #unroll} may be
 * called any number of times and each call starts from a fresh symbol table.
 */
public final class Program {
  private final String sourceName;
  private final @Nullable String version;
  private final ImmutableList<Statement> statements;
  private final DiagnosticsReporter reporter;

  Program(
      String sourceName,
      @Nullable String version,
      ImmutableList<Statement> statements,
      DiagnosticsReporter reporter) {
    this.sourceName = sourceName;
    this.version = version;
    this.statements = statements;
    this.reporter = reporter;
  }

  public String sourceName() {
    return sourceName;
  }

  public @Nullable String version() {
    return version;
  }

  public ImmutableList<Statement> statements() {
    return statements;
  }

  /**
   * Checks every switch (and every subroutine call) that the program would execute, throwing a
   * ValidationError for the first problem found. Nothing is returned on success.
   */
  public void validate() {
    validate(UnrollOptions.DEFAULT);
  }

  public void validate(UnrollOptions options) {
    unroll(options);
  }

  /**
   * Validates the program and returns its flattened equivalent: each switch is replaced by the
   * statements of its selected clause, and each subroutine call by the subroutine's body.
   *
   * @throws ValidationError describing the first problem found
   */
  public FlatProgram unroll() {
    return unroll(UnrollOptions.DEFAULT);
  }

  public FlatProgram unroll(UnrollOptions options) {
    ProgramContext context = reporter.check(ProgramContext.collect(statements));
    return reporter.check(new SwitchUnroller(context, options).unrollProgram(version, statements));
  }

  @Override
  public String toString() {
    return AstPrinter.print(statements);
  }
}
