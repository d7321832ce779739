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
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.qunroll.ast.BaseType;
import org.qunroll.ast.Expr;
import org.qunroll.ast.Statement;
import org.qunroll.ast.Statement.CaseClause;
import org.qunroll.ast.TypeSpec;
import org.qunroll.compiler.ConstantFolder.Mode;
import org.qunroll.compiler.Diagnostic.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a program's statements in order, tracking declarations and known values, and emits the
 * equivalent branch-free statement list.
 *
 * <p>Each switch is replaced by the body of the clause its target selects (or by nothing if no
 * clause matches and there is no default); each subroutine call is replaced by the subroutine's
 * body. A SwitchUnroller is used for a single program; its symbol table is discarded when it is.
 *
 * <p>Case bodies and inlined bodies lose their scopes when flattened, so a local whose name is
 * already used in the flat program is emitted under a fresh name ({@code k_1}, {@code k_2}, ...)
 * and references to it are rewritten to match.
 */
final class SwitchUnroller {
  private static final Logger LOGGER = LoggerFactory.getLogger(SwitchUnroller.class);

  private final ScopeStack scopes = new ScopeStack();
  private final ConstantFolder folder = new ConstantFolder(scopes);
  private final ParameterSubstituter substituter = new ParameterSubstituter(scopes);
  private final StatementGatekeeper gatekeeper = new StatementGatekeeper();
  private final TypeChecker typeChecker;
  private final CaseSetValidator caseSetValidator;
  private final SubroutineInliner inliner;
  private final ProgramContext context;

  /** Every name declared by a statement emitted so far. */
  private final Set<String> emittedNames = new HashSet<>();

  /** True after a {@code return} until the enclosing inlined call completes. */
  private boolean returned;

  private int numQubits;
  private int numClbits;

  SwitchUnroller(ProgramContext context, UnrollOptions options) {
    this.context = context;
    this.typeChecker = new TypeChecker(scopes, folder, context);
    this.caseSetValidator = new CaseSetValidator(typeChecker, folder);
    this.inliner =
        new SubroutineInliner(
            this, scopes, folder, typeChecker, gatekeeper, context, options.maxInlineDepth);
  }

  /** Unrolls a complete program. */
  Outcome<FlatProgram> unrollProgram(@Nullable String version, List<Statement> statements) {
    ImmutableList.Builder<Statement> out = ImmutableList.builder();
    Outcome<Void> result = unrollStatements(statements, out);
    if (result.failed()) {
      return result.propagate();
    }
    return Outcome.of(new FlatProgram(version, numQubits, numClbits, out.build()));
  }

  /**
   * Processes each statement in turn, appending its replacement to {@code out}. Stops early after
   * a {@code return} in an inlined body.
   */
  Outcome<Void> unrollStatements(List<Statement> statements, ImmutableList.Builder<Statement> out) {
    for (Statement statement : statements) {
      if (returned) {
        break;
      }
      Outcome<Void> result = unrollStatement(statement, out);
      if (result.failed()) {
        return result;
      }
    }
    return Outcome.ok();
  }

  /** Called by the inliner when an inlined body has been completely processed. */
  void endInlinedBody() {
    returned = false;
  }

  /** Exposed for the inliner, which binds qubit parameters to rewritten call arguments. */
  Expr substitute(Expr expr) {
    return substituter.rewrite(expr);
  }

  private Outcome<Void> unrollStatement(Statement statement, ImmutableList.Builder<Statement> out) {
    if (statement instanceof Statement.Switch node) {
      return unrollSwitch(node, out);
    } else if (statement instanceof Statement.SubroutineCall call) {
      return inliner.inline(call, out);
    } else if (statement instanceof Statement.SubroutineDefinition) {
      // Every call has been inlined, so definitions have no place in the output.
      return Outcome.ok();
    } else if (statement instanceof Statement.Declaration decl) {
      return declare(decl, out);
    } else if (statement instanceof Statement.ArrayDeclaration decl) {
      return declareArray(decl, out);
    } else if (statement instanceof Statement.Assignment assign) {
      return assign(assign, out);
    } else if (statement instanceof Statement.MeasureArrow measure) {
      return measure(measure, out);
    } else if (statement instanceof Statement.Return ret) {
      if (!inliner.inSubroutine()) {
        return Outcome.failure(
            Diagnostic.at(
                Kind.UNSUPPORTED_STATEMENT,
                statement,
                "Unsupported statement 'return' outside of a subroutine"));
      }
      Expr value = ret.value();
      if (value != null) {
        Outcome<SymbolType> type = typeChecker.typeOf(value);
        if (type.failed()) {
          return type.propagate();
        }
      }
      returned = true;
      return Outcome.ok();
    }
    // Includes, gate definitions and quantum operations pass through.
    if (statement instanceof Statement.GateDefinition gate) {
      emittedNames.add(gate.name());
    }
    out.add(substituter.rewrite(statement));
    return Outcome.ok();
  }

  /**
   * Replaces a switch with the body of the clause selected by its target.
   *
   * <p>The target's type is checked first, then every label (so a bad label in a clause that
   * would not have been selected is still reported), and only then is the target's value needed.
   */
  Outcome<Void> unrollSwitch(Statement.Switch node, ImmutableList.Builder<Statement> out) {
    Outcome<Void> targetOk = typeChecker.checkSwitchTarget(node);
    if (targetOk.failed()) {
      return targetOk;
    }
    Outcome<ImmutableList<ImmutableSet<Long>>> labels = caseSetValidator.validate(node);
    if (labels.failed()) {
      return labels.propagate();
    }
    Outcome<Long> target = folder.foldInt(node.target(), Mode.KNOWN_VALUES);
    if (target.failed()) {
      return target.propagate();
    }
    long value = target.value();
    CaseClause selected = node.defaultCase();
    for (int i = 0; i < node.cases().size(); i++) {
      if (labels.value().get(i).contains(value)) {
        selected = node.cases().get(i);
        break;
      }
    }
    if (selected == null) {
      LOGGER.debug("switch at {}: no clause matches {}", node.pos(), value);
      return Outcome.ok();
    }
    LOGGER.debug("switch at {}: {} selects {}", node.pos(), value, selected);
    Outcome<Void> bodyOk = gatekeeper.check(selected.body(), StatementGatekeeper.Context.CASE_BODY);
    if (bodyOk.failed()) {
      return bodyOk;
    }
    scopes.push();
    Outcome<Void> result = unrollStatements(selected.body(), out);
    scopes.pop();
    return result;
  }

  private Outcome<Void> declare(Statement.Declaration decl, ImmutableList.Builder<Statement> out) {
    // Rewrite before declaring, since the new name may shadow a parameter.
    Statement.Declaration emitted = (Statement.Declaration) substituter.rewrite(decl);
    TypeSpec spec = decl.type();
    BaseType base = spec.base();
    Expr init = decl.init();
    SymbolType type;
    Value value = null;
    if (base == BaseType.QUBIT || spec.isRegister()) {
      if (spec.isRegister()) {
        Outcome<Integer> size = registerSize(spec.designator(), decl.name());
        if (size.failed()) {
          return size.propagate();
        }
        type = SymbolType.register(base, size.value());
      } else {
        type = SymbolType.scalar(base);
      }
      if (init != null) {
        Outcome<Void> initOk = checkInitializer(decl, type);
        if (initOk.failed()) {
          return initOk;
        }
      }
    } else {
      type = SymbolType.scalar(base);
      if (init != null) {
        Outcome<Void> initOk = checkInitializer(decl, type);
        if (initOk.failed()) {
          return initOk;
        }
        Outcome<Value> folded =
            folder.evaluate(init, decl.isConst() ? Mode.CONSTANTS_ONLY : Mode.KNOWN_VALUES);
        if (!folded.failed()) {
          if (!folded.value().fitsIn(base)) {
            return Outcome.failure(
                Diagnostic.at(
                    Kind.TYPE_MISMATCH,
                    init,
                    "Cannot store negative value %s in %s of type %s",
                    folded.value(),
                    decl.name(),
                    type));
          }
          value = folded.value().castTo(base);
        } else if (decl.isConst() || !isUnknownValue(folded)) {
          return folded.propagate();
        }
      }
    }
    String name = emittedName(decl.name());
    Symbol symbol =
        new Symbol(
            decl.name(),
            type,
            decl.isConst() && value != null ? Symbol.Kind.CONSTANT : Symbol.Kind.VARIABLE,
            decl.pos(),
            value,
            renaming(decl.name(), name, decl));
    Outcome<Symbol> declared = scopes.declare(symbol, decl);
    if (declared.failed()) {
      return declared.propagate();
    }
    if (base == BaseType.QUBIT) {
      numQubits += type.size();
    } else if (base == BaseType.BIT) {
      numClbits += type.size();
    }
    if (!name.equals(decl.name())) {
      emitted =
          new Statement.Declaration(
              emitted.type(), name, emitted.init(), emitted.isConst(), emitted.pos());
    }
    out.add(emitted);
    return Outcome.ok();
  }

  /** Checks that an initializer can be stored in a variable of the given type. */
  private Outcome<Void> checkInitializer(Statement.Declaration decl, SymbolType type) {
    Expr init = decl.init();
    Outcome<SymbolType> initType = typeChecker.typeOf(init);
    if (initType.failed()) {
      return initType.propagate();
    }
    SymbolType actual = initType.value();
    boolean ok;
    if (type.base() == BaseType.QUBIT) {
      ok = false;
    } else if (init instanceof Expr.Measure) {
      ok = type.base() == BaseType.BIT && type.shape().equals(actual.shape());
    } else {
      ok = type.isScalar() && actual.isScalar() && actual.base().isClassical();
    }
    if (!ok) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.TYPE_MISMATCH,
              init,
              "Cannot initialize %s of type %s with %s of type %s",
              decl.name(),
              type,
              init,
              actual));
    }
    return Outcome.ok();
  }

  private Outcome<Void> declareArray(
      Statement.ArrayDeclaration decl, ImmutableList.Builder<Statement> out) {
    Statement.ArrayDeclaration emitted = (Statement.ArrayDeclaration) substituter.rewrite(decl);
    ImmutableList.Builder<Integer> shape = ImmutableList.builder();
    for (Expr dim : decl.dimensions()) {
      Outcome<Integer> size = registerSize(dim, decl.name());
      if (size.failed()) {
        return size.propagate();
      }
      shape.add(size.value());
    }
    SymbolType type = SymbolType.array(decl.elementType().base(), shape.build());
    String name = emittedName(decl.name());
    Symbol symbol =
        new Symbol(
            decl.name(),
            type,
            Symbol.Kind.VARIABLE,
            decl.pos(),
            null,
            renaming(decl.name(), name, decl));
    Outcome<Symbol> declared = scopes.declare(symbol, decl);
    if (declared.failed()) {
      return declared.propagate();
    }
    if (!name.equals(decl.name())) {
      emitted =
          new Statement.ArrayDeclaration(
              emitted.elementType(), emitted.dimensions(), name, emitted.pos());
    }
    out.add(emitted);
    return Outcome.ok();
  }

  /**
   * Returns the name under which a declaration is emitted, and reserves it. Top-level names are
   * kept. A local keeps its name unless that name is already declared by an emitted statement, is
   * declared at the top level of the program, or is a builtin constant; it then gets the first
   * free name of the form {@code name_N}.
   */
  private String emittedName(String name) {
    String result = name;
    if (!scopes.atGlobalScope()) {
      for (int i = 1; isTaken(result); i++) {
        result = name + "_" + i;
      }
    }
    emittedNames.add(result);
    return result;
  }

  private boolean isTaken(String name) {
    return emittedNames.contains(name)
        || context.isTopLevelName(name)
        || ScopeStack.BUILTIN_CONSTANTS.containsKey(name);
  }

  /** The binding that redirects references to a renamed local, or null if it kept its name. */
  private static @Nullable Expr renaming(String original, String emitted, Statement site) {
    return original.equals(emitted) ? null : new Expr.Identifier(emitted, site.pos());
  }

  /** Folds a register size or array dimension, which must be a positive constant int. */
  private Outcome<Integer> registerSize(Expr size, String name) {
    Outcome<Long> folded = folder.foldInt(size, Mode.CONSTANTS_ONLY);
    if (folded.failed()) {
      return folded.propagate();
    } else if (folded.value() <= 0 || folded.value() > Integer.MAX_VALUE) {
      return Outcome.failure(
          Diagnostic.at(Kind.TYPE_MISMATCH, size, "Invalid size %s for %s", folded.value(), name));
    }
    return Outcome.of(folded.value().intValue());
  }

  private Outcome<Void> assign(Statement.Assignment assign, ImmutableList.Builder<Statement> out) {
    Statement emitted = substituter.rewrite(assign);
    Expr target = assign.target();
    Outcome<SymbolType> targetType = typeChecker.typeOf(target);
    if (targetType.failed()) {
      return targetType.propagate();
    }
    Outcome<SymbolType> valueType = typeChecker.typeOf(assign.value());
    if (valueType.failed()) {
      return valueType.propagate();
    } else if (!(assign.value() instanceof Expr.Measure)
        && !valueType.value().equals(targetType.value())
        && !(valueType.value().isScalar() && valueType.value().base().isClassical())) {
      return Outcome.failure(
          Diagnostic.at(
              Kind.TYPE_MISMATCH,
              assign.value(),
              "Cannot assign %s of type %s to %s",
              assign.value(),
              valueType.value(),
              target));
    }
    Value value = null;
    if (target instanceof Expr.Identifier && !(assign.value() instanceof Expr.Measure)) {
      // A compound assignment folds as the corresponding binary expression.
      Expr effective =
          (assign.op() == null)
              ? assign.value()
              : new Expr.Binary(assign.op(), target, assign.value(), assign.pos());
      Outcome<Value> folded = folder.evaluate(effective, Mode.KNOWN_VALUES);
      if (!folded.failed()) {
        value = folded.value();
      } else if (!isUnknownValue(folded)) {
        return folded.propagate();
      }
    }
    Outcome<Symbol> assigned = scopes.assign(rootIdentifier(target), value, assign);
    if (assigned.failed()) {
      return assigned.propagate();
    }
    out.add(emitted);
    return Outcome.ok();
  }

  private Outcome<Void> measure(
      Statement.MeasureArrow measure, ImmutableList.Builder<Statement> out) {
    Statement emitted = substituter.rewrite(measure);
    Expr qubit = measure.qubit();
    Outcome<SymbolType> measured = typeChecker.typeOf(new Expr.Measure(qubit, qubit.pos()));
    if (measured.failed()) {
      return measured.propagate();
    }
    Outcome<SymbolType> targetType = typeChecker.typeOf(measure.target());
    if (targetType.failed()) {
      return targetType.propagate();
    }
    Outcome<Symbol> assigned = scopes.assign(rootIdentifier(measure.target()), null, measure);
    if (assigned.failed()) {
      return assigned.propagate();
    }
    out.add(emitted);
    return Outcome.ok();
  }

  /**
   * True if a failed evaluation only means that the value can't be determined at compile time,
   * which is fine for a variable.
   */
  private static boolean isUnknownValue(Outcome<?> outcome) {
    return outcome.failedWith(Kind.NOT_CONSTANT) || outcome.failedWith(Kind.TYPE_MISMATCH);
  }

  private static Expr.Identifier rootIdentifier(Expr target) {
    return (target instanceof Expr.Index index) ? index.rootIdentifier() : (Expr.Identifier) target;
  }
}
