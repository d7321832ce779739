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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.qunroll.ast.Expr.BinaryOp;

/**
 * The statements of a loaded program. Like {@link Expr}, statements are immutable; the unroller
 * produces a new statement list rather than editing the one it was given.
 */
public sealed interface Statement
    permits Statement.Include,
        Statement.Declaration,
        Statement.ArrayDeclaration,
        Statement.Assignment,
        Statement.MeasureArrow,
        Statement.GateCall,
        Statement.Reset,
        Statement.Barrier,
        Statement.GateDefinition,
        Statement.SubroutineDefinition,
        Statement.Return,
        Statement.SubroutineCall,
        Statement.Switch {

  SourcePosition pos();

  record Include(String path, SourcePosition pos) implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /**
   * Declares a qubit, a bit register, or a classical scalar. {@code init} is null if there is no
   * initializer, and may be an {@link Expr.Measure}.
   */
  record Declaration(
      TypeSpec type, String name, @Nullable Expr init, boolean isConst, SourcePosition pos)
      implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record ArrayDeclaration(
      TypeSpec elementType, ImmutableList<Expr> dimensions, String name, SourcePosition pos)
      implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /**
   * {@code target op= value}, or a plain assignment if {@code op} is null. {@code target} is an
   * {@link Expr.Identifier} or {@link Expr.Index}.
   */
  record Assignment(Expr target, @Nullable BinaryOp op, Expr value, SourcePosition pos)
      implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /** The old-style {@code measure q -> c;}. */
  record MeasureArrow(Expr qubit, Expr target, SourcePosition pos) implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record GateCall(
      String name, ImmutableList<Expr> params, ImmutableList<Expr> operands, SourcePosition pos)
      implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record Reset(Expr operand, SourcePosition pos) implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record Barrier(ImmutableList<Expr> operands, SourcePosition pos) implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record GateDefinition(
      String name,
      ImmutableList<String> params,
      ImmutableList<String> qubits,
      ImmutableList<Statement> body,
      SourcePosition pos)
      implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record SubroutineDefinition(
      String name,
      ImmutableList<Parameter> params,
      @Nullable TypeSpec returnType,
      ImmutableList<Statement> body,
      SourcePosition pos)
      implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /** A subroutine parameter; {@code type.base()} is {@link BaseType#QUBIT} for qubit arguments. */
  record Parameter(TypeSpec type, String name, SourcePosition pos) {
    @Override
    public String toString() {
      return type + " " + name;
    }
  }

  record Return(@Nullable Expr value, SourcePosition pos) implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  record SubroutineCall(String name, ImmutableList<Expr> args, SourcePosition pos)
      implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /**
   * A switch statement. The default clause (if any) is kept separately from {@code cases} and has
   * no labels.
   */
  record Switch(
      Expr target,
      ImmutableList<CaseClause> cases,
      @Nullable CaseClause defaultCase,
      SourcePosition pos)
      implements Statement {
    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /** One or more labels sharing a body; the default clause has an empty label list. */
  record CaseClause(ImmutableList<Expr> labels, ImmutableList<Statement> body, SourcePosition pos) {
    public boolean isDefault() {
      return labels.isEmpty();
    }

    @Override
    public String toString() {
      return AstPrinter.snippet(this);
    }
  }
}
