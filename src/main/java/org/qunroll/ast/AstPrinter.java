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

import java.util.List;
import java.util.stream.Collectors;
import org.qunroll.ast.Expr.Binary;
import org.qunroll.ast.Statement.CaseClause;

/**
 * Renders program trees back to OpenQASM source.
 *
 * <p>{@link #print(Statement)} renders a statement in full, with nested bodies on separate
 * indented lines. {@link #snippet(Statement)} renders it on a single line with any body elided as
 * <code>{...}</code>; diagnostics use snippets.
 */
public final class AstPrinter {

  private static final String INDENT = "  ";

  // Static methods only
  private AstPrinter() {}

  public static String print(Expr expr) {
    if (expr instanceof Expr.IntLiteral literal) {
      return Long.toString(literal.value());
    } else if (expr instanceof Expr.FloatLiteral literal) {
      return literal.text();
    } else if (expr instanceof Expr.BoolLiteral literal) {
      return Boolean.toString(literal.value());
    } else if (expr instanceof Expr.Identifier id) {
      return id.name();
    } else if (expr instanceof Expr.Index index) {
      return print(index.base()) + "[" + join(index.indices()) + "]";
    } else if (expr instanceof Expr.Unary unary) {
      String operand = print(unary.operand());
      boolean parens = unary.operand() instanceof Binary;
      return unary.op().symbol + (parens ? "(" + operand + ")" : operand);
    } else if (expr instanceof Binary binary) {
      int precedence = binary.op().precedence;
      // ** is right-associative; everything else is left-associative.
      boolean rightAssoc = binary.op() == Expr.BinaryOp.POWER;
      return operand(binary.left(), rightAssoc ? precedence + 1 : precedence)
          + " "
          + binary.op().symbol
          + " "
          + operand(binary.right(), rightAssoc ? precedence : precedence + 1);
    } else if (expr instanceof Expr.Call call) {
      return call.name() + "(" + join(call.args()) + ")";
    } else {
      return "measure " + print(((Expr.Measure) expr).operand());
    }
  }

  /** Prints an operand of a binary operator, parenthesized if it binds less tightly than needed. */
  private static String operand(Expr expr, int minPrecedence) {
    String result = print(expr);
    if (expr instanceof Binary binary && binary.op().precedence < minPrecedence) {
      return "(" + result + ")";
    }
    return result;
  }

  /** Renders the statement in full; statements with bodies span multiple lines. */
  public static String print(Statement statement) {
    StringBuilder sb = new StringBuilder();
    print(statement, "", sb);
    return sb.toString();
  }

  /** Renders a list of statements, one per line. */
  public static String print(List<Statement> statements) {
    StringBuilder sb = new StringBuilder();
    for (Statement statement : statements) {
      print(statement, "", sb);
      sb.append('\n');
    }
    return sb.toString();
  }

  /** Renders the statement on one line, with bodies elided. */
  public static String snippet(Statement statement) {
    String head = head(statement);
    return hasBody(statement) ? head + " {...}" : head;
  }

  public static String snippet(CaseClause clause) {
    return caseHead(clause) + " {...}";
  }

  private static boolean hasBody(Statement statement) {
    return statement instanceof Statement.GateDefinition
        || statement instanceof Statement.SubroutineDefinition
        || statement instanceof Statement.Switch;
  }

  private static void print(Statement statement, String indent, StringBuilder sb) {
    sb.append(indent).append(head(statement));
    if (statement instanceof Statement.GateDefinition gate) {
      printBody(gate.body(), indent, sb);
    } else if (statement instanceof Statement.SubroutineDefinition def) {
      printBody(def.body(), indent, sb);
    } else if (statement instanceof Statement.Switch switchStmt) {
      sb.append(" {\n");
      String inner = indent + INDENT;
      for (CaseClause clause : switchStmt.cases()) {
        sb.append(inner).append(caseHead(clause));
        printBody(clause.body(), inner, sb);
        sb.append('\n');
      }
      if (switchStmt.defaultCase() != null) {
        sb.append(inner).append("default");
        printBody(switchStmt.defaultCase().body(), inner, sb);
        sb.append('\n');
      }
      sb.append(indent).append('}');
    }
  }

  private static void printBody(List<Statement> body, String indent, StringBuilder sb) {
    sb.append(" {\n");
    for (Statement s : body) {
      print(s, indent + INDENT, sb);
      sb.append('\n');
    }
    sb.append(indent).append('}');
  }

  private static String caseHead(CaseClause clause) {
    return clause.isDefault() ? "default" : "case " + join(clause.labels());
  }

  /** Everything but the body (for statements that have one). */
  private static String head(Statement statement) {
    if (statement instanceof Statement.Include include) {
      return "include \"" + include.path() + "\";";
    } else if (statement instanceof Statement.Declaration decl) {
      String init = (decl.init() == null) ? "" : " = " + print(decl.init());
      return (decl.isConst() ? "const " : "") + decl.type() + " " + decl.name() + init + ";";
    } else if (statement instanceof Statement.ArrayDeclaration decl) {
      return String.format(
          "array[%s, %s] %s;", decl.elementType(), join(decl.dimensions()), decl.name());
    } else if (statement instanceof Statement.Assignment assign) {
      String op = (assign.op() == null) ? "=" : assign.op().symbol + "=";
      return print(assign.target()) + " " + op + " " + print(assign.value()) + ";";
    } else if (statement instanceof Statement.MeasureArrow measure) {
      return "measure " + print(measure.qubit()) + " -> " + print(measure.target()) + ";";
    } else if (statement instanceof Statement.GateCall call) {
      String params = call.params().isEmpty() ? "" : "(" + join(call.params()) + ")";
      return call.name() + params + " " + join(call.operands()) + ";";
    } else if (statement instanceof Statement.Reset reset) {
      return "reset " + print(reset.operand()) + ";";
    } else if (statement instanceof Statement.Barrier barrier) {
      return barrier.operands().isEmpty()
          ? "barrier;"
          : "barrier " + join(barrier.operands()) + ";";
    } else if (statement instanceof Statement.GateDefinition gate) {
      String params = gate.params().isEmpty() ? "" : "(" + String.join(", ", gate.params()) + ")";
      return "gate " + gate.name() + params + " " + String.join(", ", gate.qubits());
    } else if (statement instanceof Statement.SubroutineDefinition def) {
      String params =
          def.params().stream()
              .map(Statement.Parameter::toString)
              .collect(Collectors.joining(", "));
      String returns = (def.returnType() == null) ? "" : " -> " + def.returnType();
      return "def " + def.name() + "(" + params + ")" + returns;
    } else if (statement instanceof Statement.Return ret) {
      Expr value = ret.value();
      return value == null ? "return;" : "return " + print(value) + ";";
    } else if (statement instanceof Statement.SubroutineCall call) {
      return call.name() + "(" + join(call.args()) + ");";
    } else {
      return "switch (" + print(((Statement.Switch) statement).target()) + ")";
    }
  }

  private static String join(List<Expr> exprs) {
    return exprs.stream().map(AstPrinter::print).collect(Collectors.joining(", "));
  }
}
