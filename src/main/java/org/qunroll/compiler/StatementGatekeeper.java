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

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.qunroll.ast.Statement;
import org.qunroll.compiler.Diagnostic.Kind;

/**
 * Rejects statements that may only appear at the top level of a program. Subroutine definitions,
 * gate definitions and array declarations must be visible to the whole program, so they can't be
 * conditionally selected along with a case body (or materialized by inlining a subroutine).
 *
 * <p>Only the given statements are examined; nested switches and calls are checked when they are
 * themselves unrolled.
 */
final class StatementGatekeeper {

  /** Describes the kind of body being checked, for error messages. */
  enum Context {
    CASE_BODY("switch case"),
    SUBROUTINE_BODY("subroutine body");

    final String description;

    Context(String description) {
      this.description = description;
    }
  }

  Outcome<Void> check(List<Statement> body, Context context) {
    for (Statement statement : body) {
      String keyword = forbiddenKeyword(statement);
      if (keyword != null) {
        return Outcome.failure(
            Diagnostic.at(
                Kind.UNSUPPORTED_STATEMENT,
                statement,
                "Unsupported statement '%s' in %s",
                keyword,
                context.description));
      }
    }
    return Outcome.ok();
  }

  /** Returns the keyword of a statement that can't appear in a nested body, or null. */
  private static @Nullable String forbiddenKeyword(Statement statement) {
    if (statement instanceof Statement.SubroutineDefinition) {
      return "def";
    } else if (statement instanceof Statement.GateDefinition) {
      return "gate";
    } else if (statement instanceof Statement.ArrayDeclaration) {
      return "array";
    }
    return null;
  }
}
