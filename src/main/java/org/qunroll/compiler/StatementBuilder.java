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
import java.util.List;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jspecify.annotations.Nullable;
import org.qunroll.ast.BaseType;
import org.qunroll.ast.Expr;
import org.qunroll.ast.Statement;
import org.qunroll.ast.TypeSpec;
import org.qunroll.compiler.QasmParser.ArrayDeclarationContext;
import org.qunroll.compiler.QasmParser.AssignmentStatementContext;
import org.qunroll.compiler.QasmParser.BarrierStatementContext;
import org.qunroll.compiler.QasmParser.BlockContext;
import org.qunroll.compiler.QasmParser.CallStatementContext;
import org.qunroll.compiler.QasmParser.CaseClauseContext;
import org.qunroll.compiler.QasmParser.ClassicalDeclarationContext;
import org.qunroll.compiler.QasmParser.ClassicalParameterContext;
import org.qunroll.compiler.QasmParser.ConstDeclarationContext;
import org.qunroll.compiler.QasmParser.CregDeclarationContext;
import org.qunroll.compiler.QasmParser.DeclarationValueContext;
import org.qunroll.compiler.QasmParser.DefaultClauseContext;
import org.qunroll.compiler.QasmParser.DesignatorContext;
import org.qunroll.compiler.QasmParser.ExpressionContext;
import org.qunroll.compiler.QasmParser.ExpressionValueContext;
import org.qunroll.compiler.QasmParser.GateCallStatementContext;
import org.qunroll.compiler.QasmParser.GateDefinitionContext;
import org.qunroll.compiler.QasmParser.IdListContext;
import org.qunroll.compiler.QasmParser.IncludeStatementContext;
import org.qunroll.compiler.QasmParser.IndexedIdContext;
import org.qunroll.compiler.QasmParser.MeasureArrowStatementContext;
import org.qunroll.compiler.QasmParser.MeasureAssignmentContext;
import org.qunroll.compiler.QasmParser.MeasureValueContext;
import org.qunroll.compiler.QasmParser.ParameterContext;
import org.qunroll.compiler.QasmParser.QregDeclarationContext;
import org.qunroll.compiler.QasmParser.QubitDeclarationContext;
import org.qunroll.compiler.QasmParser.QubitParameterContext;
import org.qunroll.compiler.QasmParser.ResetStatementContext;
import org.qunroll.compiler.QasmParser.ReturnStatementContext;
import org.qunroll.compiler.QasmParser.ScalarTypeContext;
import org.qunroll.compiler.QasmParser.StatementContext;
import org.qunroll.compiler.QasmParser.SubroutineDefinitionContext;
import org.qunroll.compiler.QasmParser.SwitchCaseContext;
import org.qunroll.compiler.QasmParser.SwitchStatementContext;
import org.qunroll.compiler.QasmParser.UnitContext;

/** A visitor that converts statement parse trees to {@link Statement}s. */
class StatementBuilder extends VisitorBase<Statement> {
  private final ExpressionBuilder expressions;

  StatementBuilder(DiagnosticsReporter reporter) {
    super(reporter);
    this.expressions = new ExpressionBuilder(reporter);
  }

  /** Converts a parsed program. */
  Program build(UnitContext unit) {
    String version = (unit.header() == null) ? null : unit.header().version.getText();
    return new Program(reporter.sourceName(), version, statements(unit.statement()), reporter);
  }

  ImmutableList<Statement> statements(List<StatementContext> statements) {
    return statements.stream().map(this::visit).collect(ImmutableList.toImmutableList());
  }

  private ImmutableList<Statement> block(BlockContext ctx) {
    return statements(ctx.statement());
  }

  private Expr expression(ExpressionContext ctx) {
    return expressions.visit(ctx);
  }

  private @Nullable Expr designator(@Nullable DesignatorContext ctx) {
    return (ctx == null) ? null : expression(ctx.expression());
  }

  private TypeSpec scalarType(ScalarTypeContext ctx) {
    BaseType base;
    if (ctx.INT() != null) {
      base = BaseType.INT;
    } else if (ctx.UINT() != null) {
      base = BaseType.UINT;
    } else if (ctx.FLOAT() != null) {
      base = BaseType.FLOAT;
    } else if (ctx.BOOL() != null) {
      base = BaseType.BOOL;
    } else {
      base = BaseType.BIT;
    }
    return new TypeSpec(base, designator(ctx.designator()));
  }

  private static ImmutableList<String> names(@Nullable IdListContext ctx) {
    if (ctx == null) {
      return ImmutableList.of();
    }
    return ctx.ID().stream().map(TerminalNode::getText).collect(ImmutableList.toImmutableList());
  }

  private ImmutableList<Expr> operands(List<IndexedIdContext> ids) {
    return ids.stream().map(expressions::indexedId).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Statement visitIncludeStatement(IncludeStatementContext ctx) {
    String quoted = ctx.STRING().getText();
    return new Statement.Include(quoted.substring(1, quoted.length() - 1), position(ctx));
  }

  @Override
  public Statement visitQubitDeclaration(QubitDeclarationContext ctx) {
    return new Statement.Declaration(
        new TypeSpec(BaseType.QUBIT, designator(ctx.designator())),
        ctx.ID().getText(),
        null,
        false,
        position(ctx));
  }

  @Override
  public Statement visitQregDeclaration(QregDeclarationContext ctx) {
    // qreg q[2] is an older spelling of qubit[2] q
    return new Statement.Declaration(
        new TypeSpec(BaseType.QUBIT, designator(ctx.designator())),
        ctx.ID().getText(),
        null,
        false,
        position(ctx));
  }

  @Override
  public Statement visitCregDeclaration(CregDeclarationContext ctx) {
    return new Statement.Declaration(
        new TypeSpec(BaseType.BIT, designator(ctx.designator())),
        ctx.ID().getText(),
        null,
        false,
        position(ctx));
  }

  @Override
  public Statement visitConstDeclaration(ConstDeclarationContext ctx) {
    return new Statement.Declaration(
        scalarType(ctx.scalarType()),
        ctx.ID().getText(),
        expression(ctx.expression()),
        true,
        position(ctx));
  }

  @Override
  public Statement visitClassicalDeclaration(ClassicalDeclarationContext ctx) {
    DeclarationValueContext value = ctx.declarationValue();
    Expr init;
    if (value == null) {
      init = null;
    } else if (value instanceof ExpressionValueContext expressionValue) {
      init = expression(expressionValue.expression());
    } else {
      init =
          new Expr.Measure(
              expressions.indexedId(((MeasureValueContext) value).indexedId()), position(value));
    }
    return new Statement.Declaration(
        scalarType(ctx.scalarType()), ctx.ID().getText(), init, false, position(ctx));
  }

  @Override
  public Statement visitArrayDeclaration(ArrayDeclarationContext ctx) {
    ImmutableList<Expr> dims =
        ctx.expression().stream().map(this::expression).collect(ImmutableList.toImmutableList());
    return new Statement.ArrayDeclaration(
        scalarType(ctx.scalarType()), dims, ctx.ID().getText(), position(ctx));
  }

  @Override
  public Statement visitMeasureAssignment(MeasureAssignmentContext ctx) {
    IndexedIdContext qubit = ctx.indexedId(1);
    return new Statement.Assignment(
        expressions.indexedId(ctx.indexedId(0)),
        null,
        new Expr.Measure(expressions.indexedId(qubit), position(qubit)),
        position(ctx));
  }

  @Override
  public Statement visitAssignmentStatement(AssignmentStatementContext ctx) {
    String op = ctx.assignOp().getText();
    // "+=" becomes PLUS, etc.
    Expr.BinaryOp binaryOp =
        op.equals("=") ? null : Expr.BinaryOp.fromSymbol(op.substring(0, op.length() - 1));
    return new Statement.Assignment(
        expressions.indexedId(ctx.indexedId()),
        binaryOp,
        expression(ctx.expression()),
        position(ctx));
  }

  @Override
  public Statement visitMeasureArrowStatement(MeasureArrowStatementContext ctx) {
    return new Statement.MeasureArrow(
        expressions.indexedId(ctx.indexedId(0)),
        expressions.indexedId(ctx.indexedId(1)),
        position(ctx));
  }

  @Override
  public Statement visitResetStatement(ResetStatementContext ctx) {
    return new Statement.Reset(expressions.indexedId(ctx.indexedId()), position(ctx));
  }

  @Override
  public Statement visitBarrierStatement(BarrierStatementContext ctx) {
    return new Statement.Barrier(operands(ctx.indexedId()), position(ctx));
  }

  @Override
  public Statement visitGateCallStatement(GateCallStatementContext ctx) {
    return new Statement.GateCall(
        ctx.ID().getText(),
        expressions.list(ctx.expressionList()),
        operands(ctx.indexedId()),
        position(ctx));
  }

  @Override
  public Statement visitCallStatement(CallStatementContext ctx) {
    return new Statement.SubroutineCall(
        ctx.ID().getText(), expressions.list(ctx.expressionList()), position(ctx));
  }

  @Override
  public Statement visitGateDefinition(GateDefinitionContext ctx) {
    return new Statement.GateDefinition(
        ctx.ID().getText(),
        names(ctx.params),
        names(ctx.qubits),
        block(ctx.block()),
        position(ctx));
  }

  @Override
  public Statement visitSubroutineDefinition(SubroutineDefinitionContext ctx) {
    ImmutableList.Builder<Statement.Parameter> params = ImmutableList.builder();
    for (ParameterContext param : ctx.parameter()) {
      if (param instanceof QubitParameterContext qubit) {
        params.add(
            new Statement.Parameter(
                new TypeSpec(BaseType.QUBIT, designator(qubit.designator())),
                qubit.ID().getText(),
                position(qubit)));
      } else {
        ClassicalParameterContext classical = (ClassicalParameterContext) param;
        params.add(
            new Statement.Parameter(
                scalarType(classical.scalarType()),
                classical.ID().getText(),
                position(classical)));
      }
    }
    TypeSpec returnType = (ctx.scalarType() == null) ? null : scalarType(ctx.scalarType());
    return new Statement.SubroutineDefinition(
        ctx.ID().getText(), params.build(), returnType, block(ctx.block()), position(ctx));
  }

  @Override
  public Statement visitReturnStatement(ReturnStatementContext ctx) {
    Expr value = (ctx.expression() == null) ? null : expression(ctx.expression());
    return new Statement.Return(value, position(ctx));
  }

  @Override
  public Statement visitSwitchStatement(SwitchStatementContext ctx) {
    ImmutableList.Builder<Statement.CaseClause> cases = ImmutableList.builder();
    Statement.CaseClause defaultCase = null;
    for (SwitchCaseContext switchCase : ctx.switchCase()) {
      if (switchCase instanceof CaseClauseContext clause) {
        cases.add(
            new Statement.CaseClause(
                expressions.list(clause.expressionList()),
                block(clause.block()),
                position(clause)));
      } else if (defaultCase != null) {
        throw reporter.report(
            Diagnostic.at(
                Diagnostic.Kind.SYNTAX,
                position(switchCase),
                "Multiple default cases in switch statement"));
      } else {
        BlockContext body = ((DefaultClauseContext) switchCase).block();
        defaultCase =
            new Statement.CaseClause(ImmutableList.of(), block(body), position(switchCase));
      }
    }
    return new Statement.Switch(
        expression(ctx.expression()), cases.build(), defaultCase, position(ctx));
  }
}
