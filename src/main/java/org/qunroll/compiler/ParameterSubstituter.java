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
import org.qunroll.ast.Expr;
import org.qunroll.ast.Statement;
import org.qunroll.ast.TypeSpec;

/**
 * Replaces references to bound symbols with their bindings, so that statements copied out of an
 * inlined body or a case body only refer to names that exist in the flat program. Subroutine
 * parameters are bound to their arguments; locals that were renamed on declaration are bound to
 * an identifier carrying the new name.
 *
 * <p>Where no symbol in scope has a binding every method returns its argument. Unchanged subtrees
 * are returned as-is rather than copied.
 */
final class ParameterSubstituter {
  private final ScopeStack scopes;

  ParameterSubstituter(ScopeStack scopes) {
    this.scopes = scopes;
  }

  Expr rewrite(Expr expr) {
    if (expr instanceof Expr.Identifier id) {
      Symbol symbol = scopes.find(id.name());
      return (symbol == null || symbol.binding == null) ? expr : symbol.binding;
    } else if (expr instanceof Expr.Index index) {
      Expr base = rewrite(index.base());
      ImmutableList<Expr> indices = rewriteAll(index.indices());
      if (base == index.base() && indices == index.indices()) {
        return expr;
      }
      return new Expr.Index(base, indices, index.pos());
    } else if (expr instanceof Expr.Unary unary) {
      Expr operand = rewrite(unary.operand());
      return (operand == unary.operand()) ? expr : new Expr.Unary(unary.op(), operand, unary.pos());
    } else if (expr instanceof Expr.Binary binary) {
      Expr left = rewrite(binary.left());
      Expr right = rewrite(binary.right());
      if (left == binary.left() && right == binary.right()) {
        return expr;
      }
      return new Expr.Binary(binary.op(), left, right, binary.pos());
    } else if (expr instanceof Expr.Call call) {
      ImmutableList<Expr> args = rewriteAll(call.args());
      return (args == call.args()) ? expr : new Expr.Call(call.name(), args, call.pos());
    } else if (expr instanceof Expr.Measure measure) {
      Expr operand = rewrite(measure.operand());
      return (operand == measure.operand()) ? expr : new Expr.Measure(operand, measure.pos());
    }
    // Literals
    return expr;
  }

  /** Returns {@code exprs} itself if none of its elements change. */
  ImmutableList<Expr> rewriteAll(ImmutableList<Expr> exprs) {
    ImmutableList.Builder<Expr> builder = null;
    for (int i = 0; i < exprs.size(); i++) {
      Expr expr = exprs.get(i);
      Expr rewritten = rewrite(expr);
      if (builder == null && rewritten != expr) {
        builder = ImmutableList.builder();
        builder.addAll(exprs.subList(0, i));
      }
      if (builder != null) {
        builder.add(rewritten);
      }
    }
    return (builder == null) ? exprs : builder.build();
  }

  /**
   * Rewrites the expressions of a statement that is about to be emitted. Definitions, includes and
   * switches are returned unchanged; the unroller never emits the latter two from an inlined body.
   * A declaration keeps its own name; the unroller renames it separately if needed.
   */
  Statement rewrite(Statement statement) {
    if (statement instanceof Statement.Declaration decl) {
      TypeSpec type = rewrite(decl.type());
      Expr init = rewriteNullable(decl.init());
      if (type == decl.type() && init == decl.init()) {
        return statement;
      }
      return new Statement.Declaration(type, decl.name(), init, decl.isConst(), decl.pos());
    } else if (statement instanceof Statement.ArrayDeclaration decl) {
      TypeSpec type = rewrite(decl.elementType());
      ImmutableList<Expr> dims = rewriteAll(decl.dimensions());
      if (type == decl.elementType() && dims == decl.dimensions()) {
        return statement;
      }
      return new Statement.ArrayDeclaration(type, dims, decl.name(), decl.pos());
    } else if (statement instanceof Statement.Assignment assign) {
      Expr target = rewrite(assign.target());
      Expr value = rewrite(assign.value());
      if (target == assign.target() && value == assign.value()) {
        return statement;
      }
      return new Statement.Assignment(target, assign.op(), value, assign.pos());
    } else if (statement instanceof Statement.MeasureArrow measure) {
      Expr qubit = rewrite(measure.qubit());
      Expr target = rewrite(measure.target());
      if (qubit == measure.qubit() && target == measure.target()) {
        return statement;
      }
      return new Statement.MeasureArrow(qubit, target, measure.pos());
    } else if (statement instanceof Statement.GateCall call) {
      ImmutableList<Expr> params = rewriteAll(call.params());
      ImmutableList<Expr> operands = rewriteAll(call.operands());
      if (params == call.params() && operands == call.operands()) {
        return statement;
      }
      return new Statement.GateCall(call.name(), params, operands, call.pos());
    } else if (statement instanceof Statement.Reset reset) {
      Expr operand = rewrite(reset.operand());
      return (operand == reset.operand()) ? statement : new Statement.Reset(operand, reset.pos());
    } else if (statement instanceof Statement.Barrier barrier) {
      ImmutableList<Expr> operands = rewriteAll(barrier.operands());
      return (operands == barrier.operands())
          ? statement
          : new Statement.Barrier(operands, barrier.pos());
    }
    return statement;
  }

  private @Nullable Expr rewriteNullable(@Nullable Expr expr) {
    return (expr == null) ? null : rewrite(expr);
  }

  private TypeSpec rewrite(TypeSpec type) {
    Expr designator = type.designator();
    if (designator == null) {
      return type;
    }
    Expr rewritten = rewrite(designator);
    return (rewritten == designator) ? type : new TypeSpec(type.base(), rewritten);
  }
}
