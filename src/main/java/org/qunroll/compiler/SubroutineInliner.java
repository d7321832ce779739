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
import java.util.ArrayList;
import java.util.List;
import org.qunroll.ast.BaseType;
import org.qunroll.ast.Expr;
import org.qunroll.ast.Statement;
import org.qunroll.ast.Statement.Parameter;
import org.qunroll.ast.Statement.SubroutineDefinition;
import org.qunroll.ast.TypeSpec;
import org.qunroll.compiler.ConstantFolder.Mode;
import org.qunroll.compiler.Diagnostic.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a subroutine call statement with the subroutine's body.
 *
 * <p>Each parameter is declared in a fresh function scope, bound either to a literal (when the
 * argument's value is known) or to the argument expression itself; the unroller substitutes those
 * bindings into the statements it emits. Any switches in the body are unrolled with the parameter
 * values in effect, and nested calls are inlined in turn.
 */
final class SubroutineInliner {
  private static final Logger LOGGER = LoggerFactory.getLogger(SubroutineInliner.class);

  private final SwitchUnroller unroller;
  private final ScopeStack scopes;
  private final ConstantFolder folder;
  private final TypeChecker typeChecker;
  private final StatementGatekeeper gatekeeper;
  private final ProgramContext context;
  private final int maxDepth;

  /** The number of calls currently being inlined. */
  private int depth;

  SubroutineInliner(
      SwitchUnroller unroller,
      ScopeStack scopes,
      ConstantFolder folder,
      TypeChecker typeChecker,
      StatementGatekeeper gatekeeper,
      ProgramContext context,
      int maxDepth) {
    this.unroller = unroller;
    this.scopes = scopes;
    this.folder = folder;
    this.typeChecker = typeChecker;
    this.gatekeeper = gatekeeper;
    this.context = context;
    this.maxDepth = maxDepth;
  }

  /** True while the body of a subroutine is being processed. */
  boolean inSubroutine() {
    return depth > 0;
  }

  Outcome<Void> inline(Statement.SubroutineCall call, ImmutableList.Builder<Statement> out) {
    SubroutineDefinition def = context.subroutine(call.name());
    if (def == null) {
      if (context.isGate(call.name())) {
        return Outcome.failure(
            Diagnostic.at(
                Kind.ARGUMENT_MISMATCH, call, "Gate %s must be applied to qubits", call.name()));
      }
      return Outcome.failure(
          Diagnostic.at(Kind.UNDECLARED_IDENTIFIER, call, "Undefined subroutine %s", call.name()));
    } else if (call.args().size() != def.params().size()) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.ARGUMENT_MISMATCH,
              call,
              "Subroutine %s expects %s arguments but got %s",
              call.name(),
              def.params().size(),
              call.args().size()));
    } else if (depth >= maxDepth) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.INLINE_DEPTH,
              call,
              "Call to %s exceeds the maximum inlining depth of %s",
              call.name(),
              maxDepth));
    }
    // Arguments are evaluated in the caller's scope.
    List<Symbol> params = new ArrayList<>();
    for (int i = 0; i < def.params().size(); i++) {
      Outcome<Symbol> param = bind(def.params().get(i), call.args().get(i));
      if (param.failed()) {
        return param.propagate();
      }
      params.add(param.value());
    }
    Outcome<Void> bodyOk =
        gatekeeper.check(def.body(), StatementGatekeeper.Context.SUBROUTINE_BODY);
    if (bodyOk.failed()) {
      return bodyOk;
    }
    LOGGER.debug("inlining {} at {} (depth {})", def.name(), call.pos(), depth + 1);
    scopes.pushFunction();
    depth++;
    Outcome<Void> result = declareAll(params);
    if (!result.failed()) {
      result = unroller.unrollStatements(def.body(), out);
    }
    unroller.endInlinedBody();
    depth--;
    scopes.pop();
    return result;
  }

  private Outcome<Void> declareAll(List<Symbol> params) {
    for (Symbol param : params) {
      Outcome<Symbol> declared = scopes.declare(param);
      if (declared.failed()) {
        return declared.propagate();
      }
    }
    return Outcome.ok();
  }

  /** Creates the symbol for one parameter, checking that the argument's type is compatible. */
  private Outcome<Symbol> bind(Parameter param, Expr arg) {
    Outcome<SymbolType> argType = typeChecker.typeOf(arg);
    if (argType.failed()) {
      return argType.propagate();
    }
    Outcome<SymbolType> paramType = parameterType(param.type());
    if (paramType.failed()) {
      return paramType.propagate();
    }
    SymbolType expected = paramType.value();
    SymbolType actual = argType.value();
    boolean compatible =
        (expected.base() == BaseType.QUBIT || !expected.isScalar())
            ? expected.equals(actual)
            : actual.isScalar() && actual.base().isClassical();
    if (!compatible) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.ARGUMENT_MISMATCH,
              arg,
              "Argument %s of type %s does not match parameter %s of type %s",
              arg,
              actual,
              param.name(),
              expected));
    }
    Value value = null;
    Expr binding = unroller.substitute(arg);
    if (expected.isScalar() && expected.base() != BaseType.QUBIT) {
      Outcome<Value> folded = folder.evaluate(arg, Mode.KNOWN_VALUES);
      if (!folded.failed()) {
        if (!folded.value().fitsIn(expected.base())) {
          return Outcome.failure(
              Diagnostic.at(
                  Kind.ARGUMENT_MISMATCH,
                  arg,
                  "Cannot store negative value %s in %s of type %s",
                  folded.value(),
                  param.name(),
                  expected));
        }
        value = folded.value().castTo(expected.base());
        binding = value.toLiteral(arg.pos());
      } else if (!folded.failedWith(Kind.NOT_CONSTANT)) {
        return folded.propagate();
      }
    }
    return Outcome.of(
        new Symbol(param.name(), expected, Symbol.Kind.PARAMETER, param.pos(), value, binding));
  }

  private Outcome<SymbolType> parameterType(TypeSpec spec) {
    if (!spec.isRegister()) {
      return Outcome.of(SymbolType.scalar(spec.base()));
    }
    Outcome<Long> size = folder.foldInt(spec.designator(), Mode.CONSTANTS_ONLY);
    if (size.failed()) {
      return size.propagate();
    } else if (size.value() <= 0 || size.value() > Integer.MAX_VALUE) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.TYPE_MISMATCH,
              spec.designator(),
              "Invalid size %s for parameter of type %s",
              size.value(),
              spec));
    }
    return Outcome.of(SymbolType.register(spec.base(), size.value().intValue()));
  }
}
