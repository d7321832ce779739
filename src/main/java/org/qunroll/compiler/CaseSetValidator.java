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
import java.util.Set;
import org.qunroll.ast.Expr;
import org.qunroll.ast.Statement;
import org.qunroll.ast.Statement.CaseClause;
import org.qunroll.compiler.Diagnostic.Kind;

/**
 * Checks the case labels of a switch and folds them to integers.
 *
 * <p>Labels are processed clause by clause and, within a clause, left to right; each label is
 * type-checked, then folded, then compared against every value seen so far. The first problem
 * found is the one reported.
 */
final class CaseSetValidator {
  private final TypeChecker typeChecker;
  private final ConstantFolder folder;

  CaseSetValidator(TypeChecker typeChecker, ConstantFolder folder) {
    this.typeChecker = typeChecker;
    this.folder = folder;
  }

  /**
   * Returns the folded label values of each non-default clause, in clause order. Fails with
   * CASE_LABEL_TYPE, NOT_CONSTANT or DUPLICATE_CASE for a bad label, and with EMPTY_SWITCH if
   * there are no non-default clauses.
   */
  Outcome<ImmutableList<ImmutableSet<Long>>> validate(Statement.Switch node) {
    Set<Long> seen = new HashSet<>();
    ImmutableList.Builder<ImmutableSet<Long>> result = ImmutableList.builder();
    for (CaseClause clause : node.cases()) {
      ImmutableSet.Builder<Long> values = ImmutableSet.builder();
      for (Expr label : clause.labels()) {
        Outcome<Void> typeOk = typeChecker.checkCaseLabel(label);
        if (typeOk.failed()) {
          return typeOk.propagate();
        }
        Outcome<Long> value = folder.foldInt(label, ConstantFolder.Mode.CONSTANTS_ONLY);
        if (value.failed()) {
          return value.propagate();
        } else if (!seen.add(value.value())) {
          // Located at the switch itself, so the message says which value repeated.
          return Outcome.failure(
              Diagnostic.at(
                  Kind.DUPLICATE_CASE,
                  node,
                  "Duplicate case value %s in switch statement",
                  value.value()));
        }
        values.add(value.value());
      }
      result.add(values.build());
    }
    if (node.cases().isEmpty()) {
      return Outcome.failure(
          Diagnostic.at(Kind.EMPTY_SWITCH, node, "Switch statement must have at least one case"));
    }
    return Outcome.of(result.build());
  }
}
