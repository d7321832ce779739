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

import org.qunroll.ast.BaseType;
import org.qunroll.ast.Expr;
import org.qunroll.ast.Expr.Binary;
import org.qunroll.ast.Expr.OpKind;
import org.qunroll.ast.Expr.Unary;
import org.qunroll.ast.Expr.UnaryOp;
import org.qunroll.ast.Statement;
import org.qunroll.ast.Statement.SubroutineDefinition;
import org.qunroll.compiler.Diagnostic.Kind;

/**
 * Computes the static types of expressions and enforces the int-only rule for switch targets and
 * case labels.
 *
 * <p>Types are always checked before anything is folded, so a label such as {@code 4.3} is
 * reported as having the wrong type rather than as a value that doesn't match.
 */
final class TypeChecker {
  private final ScopeStack scopes;
  private final ConstantFolder folder;
  private final ProgramContext context;

  TypeChecker(ScopeStack scopes, ConstantFolder folder, ProgramContext context) {
    this.scopes = scopes;
    this.folder = folder;
    this.context = context;
  }

  /**
   * Returns the static type of an expression. Index expressions are checked against the shape of
   * the indexed symbol; any index whose value is known is also checked against the bounds.
   */
  Outcome<SymbolType> typeOf(Expr expr) {
    if (expr instanceof Expr.IntLiteral) {
      return Outcome.of(SymbolType.INT);
    } else if (expr instanceof Expr.FloatLiteral) {
      return Outcome.of(SymbolType.FLOAT);
    } else if (expr instanceof Expr.BoolLiteral) {
      return Outcome.of(SymbolType.BOOL);
    } else if (expr instanceof Expr.Identifier id) {
      return scopes.lookup(id).map(symbol -> symbol.type);
    } else if (expr instanceof Expr.Index index) {
      return typeOfIndex(index);
    } else if (expr instanceof Unary unary) {
      Outcome<SymbolType> operand = classicalScalar(unary.operand(), unary.op().symbol);
      if (operand.failed() || unary.op() != UnaryOp.NOT) {
        return operand;
      }
      return Outcome.of(SymbolType.BOOL);
    } else if (expr instanceof Binary binary) {
      return typeOfBinary(binary);
    } else if (expr instanceof Expr.Call call) {
      return typeOfCall(call);
    } else {
      Expr operand = ((Expr.Measure) expr).operand();
      Outcome<SymbolType> qubits = typeOf(operand);
      if (qubits.failed()) {
        return qubits;
      } else if (qubits.value().base() != BaseType.QUBIT) {
        return Outcome.failure(
            Diagnostic.at(
                Kind.TYPE_MISMATCH,
                operand,
                "Cannot measure %s of type %s",
                operand,
                qubits.value()));
      }
      SymbolType type = qubits.value();
      return Outcome.of(
          type.isScalar()
              ? SymbolType.scalar(BaseType.BIT)
              : SymbolType.register(BaseType.BIT, type.size()));
    }
  }

  /** Fails with SWITCH_TARGET_TYPE unless the switch target is a scalar int or uint. */
  Outcome<Void> checkSwitchTarget(Statement.Switch node) {
    Outcome<SymbolType> type = typeOf(node.target());
    if (type.failed()) {
      return type.propagate();
    } else if (type.value().isIntegralScalar()) {
      return Outcome.ok();
    }
    Expr culprit = culprit(node.target());
    String name = variableName(culprit);
    return Outcome.failure(
        Diagnostic.at(Kind.SWITCH_TARGET_TYPE, node, "Switch target %s must be of type int", name));
  }

  /**
   * Fails with CASE_LABEL_TYPE unless the label is a scalar int or uint, reporting the innermost
   * sub-expression responsible.
   */
  Outcome<Void> checkCaseLabel(Expr label) {
    Outcome<SymbolType> type = typeOf(label);
    if (type.failed()) {
      return type.propagate();
    } else if (type.value().isIntegralScalar()) {
      return Outcome.ok();
    }
    Expr culprit = culprit(label);
    SymbolType culpritType = typeOf(culprit).value();
    Diagnostic diagnostic;
    if (culprit instanceof Expr.Identifier || culprit instanceof Expr.Index) {
      String name = variableName(culprit);
      diagnostic =
          Diagnostic.at(
              Kind.CASE_LABEL_TYPE,
              culprit,
              "Invalid type %s of variable '%s' for required type int",
              culpritType,
              name);
    } else {
      diagnostic =
          Diagnostic.at(
              Kind.CASE_LABEL_TYPE,
              culprit,
              "Invalid value %s with type %s for required type int",
              culprit,
              culpritType);
    }
    return Outcome.failure(diagnostic);
  }

  /** The variable an identifier or index refers to; otherwise the printed expression. */
  private static String variableName(Expr expr) {
    if (expr instanceof Expr.Identifier id) {
      return id.name();
    } else if (expr instanceof Expr.Index index) {
      return index.rootIdentifier().name();
    }
    return expr.toString();
  }

  /**
   * Given an expression whose type is not a scalar int, returns the sub-expression that makes it
   * so: the first non-int operand of an arithmetic or bitwise operator, or the expression itself.
   */
  private Expr culprit(Expr expr) {
    if (expr instanceof Binary binary) {
      if (binary.op().kind == OpKind.ARITHMETIC || binary.op().kind == OpKind.BITWISE) {
        if (!isIntegral(binary.left())) {
          return culprit(binary.left());
        } else if (!isIntegral(binary.right())) {
          return culprit(binary.right());
        }
      }
    } else if (expr instanceof Unary unary && unary.op() != UnaryOp.NOT) {
      return culprit(unary.operand());
    }
    return expr;
  }

  private boolean isIntegral(Expr expr) {
    Outcome<SymbolType> type = typeOf(expr);
    return !type.failed() && type.value().isIntegralScalar();
  }

  /** Returns the type of an operand that must be a classical scalar. */
  private Outcome<SymbolType> classicalScalar(Expr operand, String opSymbol) {
    Outcome<SymbolType> type = typeOf(operand);
    if (type.failed()) {
      return type;
    } else if (!type.value().isScalar() || !type.value().base().isClassical()) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.TYPE_MISMATCH,
              operand,
              "Invalid operand %s of type %s for operator %s",
              operand,
              type.value(),
              opSymbol));
    }
    return type;
  }

  private Outcome<SymbolType> typeOfBinary(Binary binary) {
    Outcome<SymbolType> left = classicalScalar(binary.left(), binary.op().symbol);
    if (left.failed()) {
      return left;
    }
    Outcome<SymbolType> right = classicalScalar(binary.right(), binary.op().symbol);
    if (right.failed()) {
      return right;
    }
    if (binary.op().kind == OpKind.COMPARISON || binary.op().kind == OpKind.LOGICAL) {
      return Outcome.of(SymbolType.BOOL);
    }
    BaseType l = left.value().base();
    BaseType r = right.value().base();
    if (l == BaseType.FLOAT || r == BaseType.FLOAT) {
      return Outcome.of(SymbolType.FLOAT);
    } else if (l.isIntegral() && r.isIntegral()) {
      return Outcome.of(SymbolType.INT);
    }
    // A bool or bit operand; report the first one.
    return Outcome.of(SymbolType.scalar(l.isIntegral() ? r : l));
  }

  private Outcome<SymbolType> typeOfIndex(Expr.Index index) {
    Outcome<SymbolType> base = typeOf(index.base());
    if (base.failed()) {
      return base;
    }
    SymbolType type = base.value();
    Expr.Identifier root = index.rootIdentifier();
    String name = root.name();
    int count = index.indices().size();
    // For a[i][j] the indices of the outer Index start at the second dimension of a.
    int firstDimension = scopes.find(root.name()).type.shape().size() - type.shape().size();
    if (type.isScalar()) {
      return Outcome.failure(
          Diagnostic.at(Kind.TYPE_MISMATCH, index, "Cannot index %s of type %s", name, type));
    } else if (count > type.shape().size()) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.TYPE_MISMATCH, index, "Too many indices for %s of type %s", name, type));
    }
    for (int i = 0; i < count; i++) {
      Expr indexExpr = index.indices().get(i);
      Outcome<SymbolType> indexType = typeOf(indexExpr);
      if (indexType.failed()) {
        return indexType;
      } else if (!indexType.value().isIntegralScalar()) {
        return Outcome.failure(
            Diagnostic.at(
                Kind.TYPE_MISMATCH,
                indexExpr,
                "Index %s must be of type int, not %s",
                indexExpr,
                indexType.value()));
      }
      Outcome<Long> value = folder.foldInt(indexExpr, ConstantFolder.Mode.KNOWN_VALUES);
      if (!value.failed()) {
        long v = value.value();
        int size = type.shape().get(i);
        // Negative indices count back from the end.
        if (v >= size || v < -size) {
          return Outcome.failure(
              Diagnostic.at(
                  Kind.INDEX_OUT_OF_RANGE,
                  indexExpr,
                  "Index %s out of range for dimension %s of %s (size %s)",
                  v,
                  firstDimension + i,
                  name,
                  size));
        }
      }
    }
    return Outcome.of(type.indexed(count));
  }

  private Outcome<SymbolType> typeOfCall(Expr.Call call) {
    if (ProgramContext.BUILTIN_FUNCTIONS.contains(call.name())) {
      return Outcome.of(SymbolType.FLOAT);
    }
    SubroutineDefinition def = context.subroutine(call.name());
    if (def == null) {
      return Outcome.failure(
          Diagnostic.at(Kind.UNDECLARED_IDENTIFIER, call, "Undefined subroutine %s", call.name()));
    } else if (def.returnType() == null) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.TYPE_MISMATCH, call, "Subroutine %s does not return a value", call.name()));
    }
    return Outcome.of(SymbolType.scalar(def.returnType().base()));
  }
}
